package script;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import script.model.Delete;
import script.model.EditOp;
import script.model.EditScript;
import script.model.Insert;
import script.model.Move;
import script.model.Update;
import tree.Tree;

/**
 * Replays an edit script on a copy of a tree.
 */
public class ScriptApplier {

	/**
	 * @param src the tree the script was generated from. It is not modified.
	 * @param script a raw or simplified edit script.
	 * @return the tree obtained by applying every op of <code>script</code> to a copy of <code>src</code>.
	 * @throws IllegalArgumentException if an op refers to a node or position that does not exist.
	 * @throws IllegalStateException if a deleted node is not where the delete recorded it.
	 */
	public static Tree apply(Tree src, EditScript script){
		checkNotNull(src, "src");
		checkNotNull(script, "script");
		WorkingTree work = new WorkingTree(src);
		for(EditOp op : script){
			apply(work, op);
		}
		Tree result = work.toTree();
		result.setName(src.getName());
		return result;
	}

	private static void apply(WorkingTree work, EditOp op) {
		if(op instanceof Insert){
			work.insert(op.getNode(), op.getData(), op.getLocation(), op.getPosition());
			//Nested inserts build the subtree below the new node.
			for(EditOp child : op.getChildren()){
				apply(work, child);
			}
		}else if(op instanceof Delete){
			int node = op.getNode();
			checkState(work.getParent(node) == op.getLocation() && work.indexInParent(node) == op.getPosition(),
					"node %s is not at %s,%s", node, op.getLocation(), op.getPosition());
			work.delete(node);
		}else if(op instanceof Move){
			work.detach(op.getNode());
			work.attach(op.getNode(), op.getLocation(), op.getPosition());
		}else if(op instanceof Update){
			work.update(op.getNode(), op.getData());
		}else{
			throw new IllegalArgumentException("Unknown edit operation: " + op.getType());
		}
	}
}
