package script;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

import match.Matching;
import script.model.Delete;
import script.model.EditOp;
import script.model.EditScript;
import script.model.Insert;
import script.model.Move;
import tree.Tree;
import tree.TreeNode;

/**
 * Removes edit operations implied by an operation on an ancestor.
 * <p>
 * A removed op is not lost: it is nested under the op that implies it, so
 * {@link EditOp#getSubtreeEdit()} still lists every change.
 */
public class ScriptSimplifier {

	private static final Logger logger = LoggerFactory.getLogger(ScriptSimplifier.class);

	/**
	 * Simplify <code>script</code>, an edit script from <code>src</code> to <code>dst</code>.
	 * <ul>
	 * <li>A delete whose node's parent is deleted too is nested under the parent's delete.</li>
	 * <li>An insert whose destination parent roots a subtree without any matched node
	 * is nested under the parent's insert.</li>
	 * <li>A move under a moved ancestor is nested under that ancestor's move if the node
	 * keeps its parent and its order among the matched siblings.</li>
	 * </ul>
	 * The kept ops are in their original order. The given script is not modified.
	 *
	 * @return a new script, never longer than <code>script</code>.
	 */
	public static EditScript simplify(EditScript script, Tree src, Tree dst, Matching matching){
		checkNotNull(script, "script");
		checkNotNull(src, "src");
		checkNotNull(dst, "dst");
		checkNotNull(matching, "matching");

		List<EditOp> editOps = script.getAllEditOps();
		Map<Integer, Delete> deletes = new HashMap<>();
		Map<Integer, Insert> inserts = new HashMap<>();
		Map<Integer, Move> moves = new HashMap<>();
		Map<EditOp, EditOp> copies = Maps.newIdentityHashMap();
		for(EditOp op : editOps){
			if(op instanceof Delete) {
				deletes.put(op.getNode(), (Delete)op);
			} else if(op instanceof Insert) {
				inserts.put(((Insert)op).getDstNode(), (Insert)op);
			} else if(op instanceof Move) {
				moves.put(op.getNode(), (Move)op);
			}
			copies.put(op, op.duplicate());
		}
		boolean[] fullyInserted = computeFullyInserted(dst, matching);

		List<EditOp> kept = new ArrayList<>();
		for(EditOp op : editOps){
			EditOp owner = null;
			if(op instanceof Delete) {
				owner = findDeleteOwner(op.getNode(), src, deletes);
			} else if(op instanceof Insert) {
				owner = findInsertOwner(((Insert)op).getDstNode(), dst, inserts, fullyInserted);
			} else if(op instanceof Move) {
				owner = findMoveOwner((Move)op, src, dst, matching, moves);
			}
			if(owner != null){
				copies.get(owner).addEditOp(copies.get(op));
			}else{
				kept.add(copies.get(op));
			}
		}
		logger.debug("Simplified {} edit operations to {}", editOps.size(), kept.size());
		return new EditScript(kept);
	}

	private static EditOp findDeleteOwner(int node, Tree src, Map<Integer, Delete> deletes) {
		if(node >= src.getSize())
			return null;
		int parent = src.getParent(node);
		return parent == TreeNode.NO_NODE ? null : deletes.get(parent);
	}

	private static EditOp findInsertOwner(int dstNode, Tree dst, Map<Integer, Insert> inserts,
			boolean[] fullyInserted) {
		int parent = dst.getParent(dstNode);
		if(parent == TreeNode.NO_NODE || !fullyInserted[parent])
			return null;
		return inserts.get(parent);
	}

	/**
	 * Only scripts that did not come from {@link ScriptGenerator} can hold such a move.
	 */
	private static EditOp findMoveOwner(Move move, Tree src, Tree dst, Matching matching,
			Map<Integer, Move> moves) {
		int node = move.getNode();
		if(node >= src.getSize() || !matching.hasDst(node))
			return null;
		Move owner = null;
		for(int p = src.getParent(node); p != TreeNode.NO_NODE && owner == null; p = src.getParent(p)){
			owner = moves.get(p);
		}
		if(owner == null)
			return null;
		int parent = src.getParent(node);
		int dstParent = dst.getParent(matching.getDst(node));
		if(matching.getDst(parent) != dstParent || dstParent == TreeNode.NO_NODE)
			return null;
		return keepsSiblingOrder(node, parent, dstParent, src, dst, matching) ? owner : null;
	}

	/**
	 * @return true if the matched siblings before and after <code>node</code> are the
	 * same, in the same order, on both sides.
	 */
	private static boolean keepsSiblingOrder(int node, int parent, int dstParent, Tree src, Tree dst,
			Matching matching) {
		List<Integer> srcSiblings = new ArrayList<>();
		int srcIndex = -1;
		for(int sibling : src.getChildren(parent)){
			if(sibling == node){
				srcIndex = srcSiblings.size();
			}else if(matching.hasDst(sibling) && dst.getParent(matching.getDst(sibling)) == dstParent){
				srcSiblings.add(matching.getDst(sibling));
			}
		}
		List<Integer> dstSiblings = new ArrayList<>();
		int dstIndex = -1;
		int partner = matching.getDst(node);
		for(int sibling : dst.getChildren(dstParent)){
			if(sibling == partner){
				dstIndex = dstSiblings.size();
			}else if(matching.hasSrc(sibling) && src.getParent(matching.getSrc(sibling)) == parent){
				dstSiblings.add(sibling);
			}
		}
		return srcIndex == dstIndex && srcSiblings.equals(dstSiblings);
	}

	/**
	 * @return for every destination node, whether it and all its descendants are unmatched.
	 */
	private static boolean[] computeFullyInserted(Tree dst, Matching matching) {
		boolean[] fullyInserted = new boolean[dst.getSize()];
		for(int id : dst.postOrder()){
			boolean inserted = !matching.hasSrc(id);
			for(int child : dst.getChildren(id)){
				inserted = inserted && fullyInserted[child];
			}
			fullyInserted[id] = inserted;
		}
		return fullyInserted;
	}
}
