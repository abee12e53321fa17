package script;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import match.Matching;
import script.model.Delete;
import script.model.EditOp;
import script.model.EditScript;
import script.model.Insert;
import script.model.Move;
import script.model.Update;
import tree.NodeData;
import tree.Tree;
import tree.TreeNode;

/**
 * Generates the edit script that turns a source tree into a destination tree,
 * following Chawathe et al.'s algorithm for ordered trees.
 * <p>
 * All ops are decided on a {@link WorkingTree} copy of the source tree, so the
 * positions they carry are valid when the ops are applied one after the other.
 */
public class ScriptGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ScriptGenerator.class);

	private final Tree dst;
	private final WorkingTree work;
	private final int[] dstToWork;
	private final int[] workToDst;
	private final boolean[] workInOrder;
	private final boolean[] dstInOrder;
	private final List<EditOp> editOps;

	private ScriptGenerator(Tree src, Tree dst, Matching matching){
		this.dst = dst;
		this.work = new WorkingTree(src);
		this.dstToWork = new int[dst.getSize()];
		//Inserted nodes get ids after the source ids, one per destination node at most.
		this.workToDst = new int[src.getSize() + dst.getSize()];
		Arrays.fill(dstToWork, TreeNode.NO_NODE);
		Arrays.fill(workToDst, TreeNode.NO_NODE);
		for(Matching.Pair pair : matching.getPairs()){
			dstToWork[pair.getDst()] = pair.getSrc();
			workToDst[pair.getSrc()] = pair.getDst();
		}
		this.workInOrder = new boolean[workToDst.length];
		this.dstInOrder = new boolean[dst.getSize()];
		this.editOps = new ArrayList<EditOp>();
	}

	/**
	 * Generate the edit script transforming <code>src</code> into <code>dst</code>.
	 *
	 * @param src the source tree. It is not modified.
	 * @param dst the destination tree.
	 * @param matching a matching between the two trees in which the roots are matched to each other.
	 * @return inserts, moves and updates in breadth-first order of <code>dst</code>, followed
	 * by the deletes in postorder.
	 */
	public static EditScript generateScript(Tree src, Tree dst, Matching matching){
		checkNotNull(src, "src");
		checkNotNull(dst, "dst");
		checkNotNull(matching, "matching");
		checkArgument(matching.getSrcSize() == src.getSize() && matching.getDstSize() == dst.getSize(),
				"matching does not belong to these trees");
		checkArgument(matching.contains(Tree.ROOT, Tree.ROOT), "the roots must be matched to each other");
		ScriptGenerator generator = new ScriptGenerator(src, dst, matching);
		generator.generateInsertMoveUpdate();
		generator.generateDelete();
		logger.debug("Generated {} edit operations", generator.editOps.size());
		return new EditScript(generator.editOps);
	}

	private void generateInsertMoveUpdate(){
		for(int x : dst.bfs()){
			int w;
			boolean inserted = false;
			if(dst.isRoot(x)){
				w = Tree.ROOT;
			}else{
				int z = dstToWork[dst.getParent(x)];
				w = dstToWork[x];
				if(w == TreeNode.NO_NODE){
					int k = findPos(x);
					w = work.insert(dst.getData(x), z, k);
					link(w, x);
					addEditOp(new Insert(w, x, dst.getData(x), z, k));
					workInOrder[w] = true;
					dstInOrder[x] = true;
					inserted = true;
				}else if(work.getParent(w) != z){
					work.detach(w);
					int k = findPos(x);
					work.attach(w, z, k);
					addEditOp(new Move(w, x, work.getData(w), z, k));
					workInOrder[w] = true;
					dstInOrder[x] = true;
				}
			}
			if(!inserted){
				NodeData data = work.getData(w);
				if(!data.sameAs(dst.getData(x))){
					addEditOp(new Update(w, x, data, dst.getData(x)));
					work.update(w, dst.getData(x));
				}
			}
			alignChildren(w, x);
		}
	}

	private void generateDelete(){
		for(int n : work.postOrder()){
			if(workToDst[n] == TreeNode.NO_NODE){
				addEditOp(new Delete(n, work.getData(n), work.getParent(n), work.indexInParent(n)));
				work.delete(n);
			}
		}
	}

	private void addEditOp(EditOp op){
		logger.debug("{}", op);
		editOps.add(op);
	}

	private void link(int w, int x){
		workToDst[w] = x;
		dstToWork[x] = w;
	}

	/**
	 * Move the children of <code>w</code> whose order differs from the order of their
	 * partners under <code>x</code>. Only children outside a longest common subsequence move.
	 */
	private void alignChildren(int w, int x){
		for(int c : work.getChildren(w)){
			workInOrder[c] = false;
		}
		for(int c : dst.getChildren(x)){
			dstInOrder[c] = false;
		}

		List<Integer> s1 = new ArrayList<Integer>();
		for(int c : work.getChildren(w)){
			int partner = workToDst[c];
			if(partner != TreeNode.NO_NODE && dst.getParent(partner) == x)
				s1.add(c);
		}
		List<Integer> s2 = new ArrayList<Integer>();
		for(int c : dst.getChildren(x)){
			int partner = dstToWork[c];
			if(partner != TreeNode.NO_NODE && work.getParent(partner) == w)
				s2.add(c);
		}

		for(int a : findLCSNodes(s1, s2)){
			workInOrder[a] = true;
			dstInOrder[workToDst[a]] = true;
		}

		for(int b : s2){
			int a = dstToWork[b];
			if(!workInOrder[a]){
				work.detach(a);
				int k = findPos(b);
				work.attach(a, w, k);
				addEditOp(new Move(a, b, work.getData(a), w, k));
				workInOrder[a] = true;
				dstInOrder[b] = true;
			}
		}
	}

	/**
	 * @return the nodes of <code>oldNodes</code> in a longest common subsequence of
	 * <code>oldNodes</code> and <code>newNodes</code>, where a node equals its partner.
	 */
	private List<Integer> findLCSNodes(List<Integer> oldNodes, List<Integer> newNodes) {
		List<Integer> lcsNodes = new ArrayList<>();
		int m = oldNodes.size();
		int n = newNodes.size();
		if(m == 0 || n == 0){
			return lcsNodes;
		}
		int[][] len = new int[m+1][n+1];
		for(int i=m-1; i>=0; i--) {
			for(int j=n-1; j>=0; j--) {
				if(workToDst[oldNodes.get(i)] == newNodes.get(j)){
					len[i][j] = len[i+1][j+1] + 1;
				}else{
					len[i][j] = Math.max(len[i+1][j], len[i][j+1]);
				}
			}
		}
		int i = 0, j = 0;
		while(i<m && j<n) {
			int oldNode = oldNodes.get(i);
			if(workToDst[oldNode] == newNodes.get(j)) {
				lcsNodes.add(oldNode);
				i++;
				j++;
			}else if(len[i+1][j] >= len[i][j+1]){
				i++;
			}else{
				j++;
			}
		}
		return lcsNodes;
	}

	/**
	 * @return the child index in the working copy for the partner of destination node
	 * <code>x</code>: right after the partner of its rightmost in-order left sibling,
	 * or 0 if there is none.
	 */
	private int findPos(int x){
		List<Integer> siblings = dst.getChildren(dst.getParent(x));
		int v = TreeNode.NO_NODE;
		for(int i=siblings.indexOf(x)-1; i>=0; i--){
			if(dstInOrder[siblings.get(i)]){
				v = siblings.get(i);
				break;
			}
		}
		if(v == TreeNode.NO_NODE)
			return 0;
		return work.indexInParent(dstToWork[v]) + 1;
	}
}
