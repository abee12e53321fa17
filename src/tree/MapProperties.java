package tree;

import java.util.Map;

import com.google.common.collect.ImmutableSortedMap;

/**
 * Key/value properties compared by content, e.g. the attributes of an element.
 */
public final class MapProperties implements NodeProperties {

	private final ImmutableSortedMap<String, String> entries;

	private MapProperties(Map<String, String> entries) {
		this.entries = ImmutableSortedMap.copyOf(entries);
	}

	public static MapProperties of(Map<String, String> entries) {
		return new MapProperties(entries);
	}

	public static MapProperties of(String key, String value) {
		return new MapProperties(ImmutableSortedMap.of(key, value));
	}

	public String get(String key) {
		return entries.get(key);
	}

	public Map<String, String> asMap() {
		return entries;
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public boolean sameAs(NodeProperties other) {
		if(other instanceof MapProperties)
			return entries.equals(((MapProperties)other).entries);
		//An empty map carries as much as no properties at all.
		return other == NoProperties.INSTANCE && entries.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof MapProperties && entries.equals(((MapProperties)obj).entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
