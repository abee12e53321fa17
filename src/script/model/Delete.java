package script.model;

import tree.NodeData;

/**
 * Delete a node. Its former parent and child index are recorded for display.
 */
public class Delete extends EditOp {

	public Delete(int node, NodeData data, int location, int position){
		super(node, data, location, position);
	}

	@Override
	public String getType(){
		return "delete";
	}

	@Override
	public Delete duplicate() {
		return new Delete(node, data, location, position);
	}
}
