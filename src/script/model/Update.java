package script.model;

import static com.google.common.base.Preconditions.checkNotNull;

import tree.NodeData;
import tree.TreeNode;

public class Update extends EditOp {

	private final int dstNode;
	private final NodeData oldData;

	public Update(int node, int dstNode, NodeData oldData, NodeData newData) {
		super(node, checkNotNull(newData), TreeNode.NO_NODE, -1);
		this.dstNode = dstNode;
		this.oldData = oldData;
	}

	public int getDstNode() {
		return dstNode;
	}

	public NodeData getOldData() {
		return oldData;
	}

	public NodeData getNewData() {
		return data;
	}

	@Override
	public String getType(){
		return "update";
	}

	@Override
	public Update duplicate() {
		return new Update(node, dstNode, oldData, data);
	}

	@Override
	public String toString(){
		return getType() + "\t" + describe(oldData, node) + " to "
				+ describe(data, dstNode);
	}
}
