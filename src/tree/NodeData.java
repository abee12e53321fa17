package tree;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The content of a single node: its kind, label, optional leaf value and properties.
 * Only nodes of the same kind are ever matched with each other.
 */
public final class NodeData {

	private final String kind;
	private final String label;
	private final String value;
	private final NodeProperties properties;

	public NodeData(String kind, String label, String value, NodeProperties properties) {
		this.kind = checkNotNull(kind, "kind");
		this.label = checkNotNull(label, "label");
		this.value = value;
		this.properties = properties == null ? NoProperties.INSTANCE : properties;
	}

	/**
	 * A node without value or properties, labeled with its kind.
	 */
	public static NodeData of(String kind) {
		return new NodeData(kind, kind, null, null);
	}

	public static NodeData of(String kind, String label) {
		return new NodeData(kind, label, null, null);
	}

	public static NodeData leaf(String kind, String value) {
		return new NodeData(kind, kind, value, null);
	}

	public static NodeData leaf(String kind, String label, String value) {
		return new NodeData(kind, label, value, null);
	}

	public NodeData withProperties(NodeProperties properties) {
		return new NodeData(kind, label, value, properties);
	}

	public String getKind() {
		return kind;
	}

	public String getLabel() {
		return label;
	}

	public String getValue() {
		return value;
	}

	public boolean hasValue() {
		return value != null;
	}

	public NodeProperties getProperties() {
		return properties;
	}

	/**
	 * @return true if kind, label, value and properties are all equal.
	 */
	public boolean sameAs(NodeData other) {
		return kind.equals(other.kind)
				&& label.equals(other.label)
				&& Objects.equal(value, other.value)
				&& properties.sameAs(other.properties);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.omitNullValues()
				.add("kind", kind)
				.add("label", label.equals(kind) ? null : label)
				.add("value", value)
				.add("properties", properties == NoProperties.INSTANCE ? null : properties)
				.toString();
	}
}
