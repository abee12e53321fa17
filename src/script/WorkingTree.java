package script;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import tree.NodeData;
import tree.Tree;
import tree.TreeNode;

/**
 * A mutable copy of a tree that edit operations are applied to.
 * <p>
 * Existing nodes keep the ids of the tree it was copied from. Inserted nodes get the
 * id the caller chooses, which must not be in use.
 */
public class WorkingTree {

	private final List<Node> nodes;
	private int nextId;

	public WorkingTree(Tree tree){
		nodes = new ArrayList<Node>(tree.getSize());
		for(int id=0; id<tree.getSize(); id++){
			nodes.add(new Node(tree.getData(id), tree.getParent(id)));
		}
		for(int id=0; id<tree.getSize(); id++){
			nodes.get(id).children.addAll(tree.getChildren(id));
		}
		nextId = tree.getSize();
	}

	/**
	 * @return the smallest id never used in this tree.
	 */
	public int nextId(){
		return nextId;
	}

	public boolean contains(int id){
		return id >= 0 && id < nodes.size() && nodes.get(id) != null;
	}

	private Node node(int id){
		checkArgument(contains(id), "unknown node %s", id);
		return nodes.get(id);
	}

	public NodeData getData(int id){
		return node(id).data;
	}

	public int getParent(int id){
		return node(id).parent;
	}

	public List<Integer> getChildren(int id){
		return Collections.unmodifiableList(node(id).children);
	}

	public int indexInParent(int id){
		int parent = node(id).parent;
		return parent == TreeNode.NO_NODE ? -1 : node(parent).children.indexOf(id);
	}

	/**
	 * Insert a new leaf <code>id</code> under <code>parent</code> at <code>position</code>.
	 */
	public void insert(int id, NodeData data, int parent, int position){
		checkArgument(id >= 0 && !contains(id), "node %s already exists", id);
		checkNotNull(data);
		Node p = node(parent);
		checkPositionIndex(position, p.children.size());
		while(nodes.size() <= id){
			nodes.add(null);
		}
		nodes.set(id, new Node(data, parent));
		p.children.add(position, id);
		nextId = Math.max(nextId, id + 1);
	}

	/**
	 * Insert a new leaf under <code>parent</code> using the next free id.
	 *
	 * @return the id of the new node.
	 */
	public int insert(NodeData data, int parent, int position){
		int id = nextId;
		insert(id, data, parent, position);
		return id;
	}

	public void update(int id, NodeData data){
		node(id).data = checkNotNull(data);
	}

	/**
	 * Remove <code>id</code> from its parent's children. The subtree stays intact.
	 */
	public void detach(int id){
		Node n = node(id);
		checkState(n.parent != TreeNode.NO_NODE, "node %s is not attached", id);
		node(n.parent).children.remove(Integer.valueOf(id));
		n.parent = TreeNode.NO_NODE;
	}

	public void attach(int id, int parent, int position){
		Node n = node(id);
		checkState(n.parent == TreeNode.NO_NODE, "node %s is already attached", id);
		checkArgument(id != Tree.ROOT && !isInSubtree(parent, id), "cannot attach %s below itself", id);
		Node p = node(parent);
		checkPositionIndex(position, p.children.size());
		p.children.add(position, id);
		n.parent = parent;
	}

	/**
	 * Remove <code>id</code> together with its whole subtree.
	 */
	public void delete(int id){
		checkArgument(id != Tree.ROOT, "the root cannot be deleted");
		if(node(id).parent != TreeNode.NO_NODE)
			detach(id);
		Deque<Integer> stack = new ArrayDeque<Integer>();
		stack.push(id);
		while(!stack.isEmpty()){
			int current = stack.pop();
			for(int child : nodes.get(current).children){
				stack.push(child);
			}
			nodes.set(current, null);
		}
	}

	private boolean isInSubtree(int node, int root){
		for(int n = node; n != TreeNode.NO_NODE; n = nodes.get(n).parent){
			if(n == root)
				return true;
		}
		return false;
	}

	/**
	 * @return the nodes reachable from the root, children before their parent.
	 */
	public List<Integer> postOrder(){
		List<Integer> visitedNodes = new ArrayList<Integer>();
		Deque<Integer> stack = new ArrayDeque<Integer>();
		Deque<Integer> output = new ArrayDeque<Integer>();
		stack.push(Tree.ROOT);
		while(!stack.isEmpty()){
			int id = stack.pop();
			output.push(id);
			for(int child : nodes.get(id).children){
				stack.push(child);
			}
		}
		while(!output.isEmpty()){
			visitedNodes.add(output.pop());
		}
		return visitedNodes;
	}

	/**
	 * @return a new tree with the current content. Ids are renumbered in preorder.
	 */
	public Tree toTree(){
		Tree tree = new Tree(node(Tree.ROOT).data);
		copyChildren(Tree.ROOT, tree, Tree.ROOT);
		return tree;
	}

	private void copyChildren(int id, Tree tree, int treeId){
		for(int child : nodes.get(id).children){
			int newId = tree.addChild(treeId, nodes.get(child).data);
			copyChildren(child, tree, newId);
		}
	}

	private static class Node {
		private NodeData data;
		private int parent;
		private final List<Integer> children;

		Node(NodeData data, int parent){
			this.data = data;
			this.parent = parent;
			this.children = new ArrayList<Integer>();
		}
	}
}
