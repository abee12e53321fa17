package tree;

/**
 * Payload of nodes which carry no properties.
 */
public enum NoProperties implements NodeProperties {
	INSTANCE;

	@Override
	public boolean sameAs(NodeProperties other) {
		return other == INSTANCE
				|| other instanceof MapProperties && ((MapProperties)other).isEmpty();
	}

	@Override
	public String toString() {
		return "{}";
	}
}
