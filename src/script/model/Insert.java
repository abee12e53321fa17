package script.model;

import static com.google.common.base.Preconditions.checkNotNull;

import tree.NodeData;

/**
 * Insert a new leaf carrying the data of destination node <code>dstNode</code>.
 */
public class Insert extends EditOp {

	private final int dstNode;

	public Insert(int node, int dstNode, NodeData data, int location, int position) {
		super(node, checkNotNull(data), location, position);
		this.dstNode = dstNode;
	}

	public int getDstNode() {
		return dstNode;
	}

	@Override
	public String getType(){
		return "insert";
	}

	@Override
	public Insert duplicate() {
		return new Insert(node, dstNode, data, location, position);
	}
}
