package script.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import tree.NodeData;
import tree.TreeNode;

/**
 * An edit operation on the working copy of a source tree.
 * <p>
 * <code>node</code> is the working-copy id of the target: a source tree id for an
 * existing node, a fresh id for an inserted one. <code>location</code> and
 * <code>position</code> are the parent and child index the op refers to at the
 * moment it is applied. Ops implied by this one can be nested as children.
 */
public abstract class EditOp {

	public static final String SYM_DELIM = ",";

	protected final int node;
	protected final NodeData data;
	protected final int location;
	protected final int position;
	protected final List<EditOp> children;
	protected int size;

	protected EditOp(int node, NodeData data, int location, int position){
		this.node = node;
		this.data = data;
		this.location = location;
		this.position = position;
		this.children = new ArrayList<>();
		this.size = 0;
	}

	public abstract String getType();

	/**
	 * @return a copy of this op without nested ops.
	 */
	public abstract EditOp duplicate();

	public int getNode() {
		return this.node;
	}

	/**
	 * @return the node data the op is about. For an insert or an update this is the new data.
	 */
	public NodeData getData() {
		return this.data;
	}

	public int getLocation() {
		return this.location;
	}

	public int getPosition() {
		return this.position;
	}

	/**
	 * @return the number of ops in this op's subtree, itself included.
	 */
	public int size(){
		if(size == 0){
			size++;
			for(EditOp child : children){
				size += child.size();
			}
		}
		return size;
	}

	public void addEditOp(EditOp op){
		children.add(op);
		size = 0;
	}

	public List<EditOp> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public List<EditOp> getSubtreeEdit(){
		List<EditOp> editOps = new ArrayList<>();
		editOps.add(this);
		for(EditOp child : children){
			editOps.addAll(child.getSubtreeEdit());
		}
		return editOps;
	}

	protected static String describe(NodeData data, int id){
		StringBuilder sb = new StringBuilder();
		if(data != null){
			sb.append(data.getLabel());
			if(data.hasValue())
				sb.append("=").append(data.getValue());
		}
		sb.append("#").append(id);
		return sb.toString();
	}

	protected static String describeLocation(int location){
		return location == TreeNode.NO_NODE ? "-" : "#" + location;
	}

	@Override
	public String toString(){
		return getType() + "\t" + describe(data, node) + EditOp.SYM_DELIM
				+ describeLocation(location) + EditOp.SYM_DELIM + position;
	}

	public String toOpString() {
		return toOpString("");
	}

	public String toOpString(String indent){
		StringBuilder sb = new StringBuilder();
		sb.append(indent + toString());
		indent += "\t";
		for(EditOp child : children){
			sb.append("\n");
			sb.append(child.toOpString(indent));
		}
		return sb.toString();
	}
}
