package tree;

/**
 * Payload attached to a node which is not part of the tree structure itself,
 * e.g. the attributes of a markup element or the operator of an expression.
 * <p>
 * The engine only ever asks whether two payloads are equal. Anything thrown
 * by an implementation is passed on to the caller unchanged.
 */
public interface NodeProperties {

	boolean sameAs(NodeProperties other);

}
