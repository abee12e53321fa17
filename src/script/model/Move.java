package script.model;

import tree.NodeData;

/**
 * Move a node, with its subtree, under <code>location</code> at <code>position</code>.
 * The position is the child index once the node has been detached.
 */
public class Move extends EditOp {

	private final int dstNode;

	public Move(int node, int dstNode, NodeData data, int location, int position) {
		super(node, data, location, position);
		this.dstNode = dstNode;
	}

	public int getDstNode() {
		return dstNode;
	}

	@Override
	public String getType(){
		return "move";
	}

	@Override
	public Move duplicate() {
		return new Move(node, dstNode, data, location, position);
	}

	@Override
	public String toString(){
		return getType() + "\t" + describe(data, node) + " to "
				+ describeLocation(location) + EditOp.SYM_DELIM + position;
	}
}
