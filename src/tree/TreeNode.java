package tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node stored in the arena of a {@link Tree}. Parent and children are kept as
 * ids into the same arena.
 */
public class TreeNode {
	public static final int NO_NODE = -1;

	private final int id;
	private final NodeData data;
	private final int parent;
	private final List<Integer> children;

	//Metrics, filled in by Tree.
	long hash;
	int height;
	int descendants;
	int preOrder;

	TreeNode(int id, NodeData data, int parent){
		this.id = id;
		this.data = data;
		this.parent = parent;
		this.children = new ArrayList<Integer>();
	}

	void addChild(int child){
		children.add(child);
	}

	public int getId() {
		return id;
	}

	public NodeData getData() {
		return data;
	}

	public String getKind() {
		return data.getKind();
	}

	public String getLabel() {
		return data.getLabel();
	}

	public String getValue() {
		return data.getValue();
	}

	public int getParent() {
		return parent;
	}

	public boolean isRoot() {
		return parent == NO_NODE;
	}

	public boolean isLeaf(){
		return children.isEmpty();
	}

	public List<Integer> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public int getChildCount() {
		return children.size();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(data.getLabel());
		if(data.hasValue())
			sb.append("=").append(data.getValue());
		sb.append("#").append(id);
		return sb.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if(obj instanceof TreeNode){
			TreeNode other = (TreeNode)obj;
			return this.id == other.id && this.data == other.data;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return id;
	}
}
