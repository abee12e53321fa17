package tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * An ordered labeled tree. Nodes live in an arena and are addressed by their id,
 * which is the index of the node in the arena. The root always has id 0.
 * <p>
 * Hash, height, descendant count and preorder index of every node are computed
 * bottom-up the first time one of them is needed and cached until the tree grows.
 */
public class Tree {
	public static final int ROOT = 0;
	private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

	private String name;
	private final List<TreeNode> nodes;
	private List<Integer> preOrder;
	private boolean metricsComputed;

	public Tree(NodeData root){
		this("", root);
	}

	public Tree(String name, NodeData root){
		this.name = name;
		this.nodes = new ArrayList<TreeNode>();
		this.nodes.add(new TreeNode(ROOT, checkNotNull(root), TreeNode.NO_NODE));
		this.metricsComputed = false;
	}

	/**
	 * Append a new last child to <code>parent</code>.
	 *
	 * @return the id of the new node.
	 */
	public int addChild(int parent, NodeData data){
		checkArgument(parent >= 0 && parent < nodes.size(), "unknown parent %s", parent);
		TreeNode node = new TreeNode(nodes.size(), checkNotNull(data), parent);
		nodes.add(node);
		nodes.get(parent).addChild(node.getId());
		metricsComputed = false;
		return node.getId();
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public int getSize() {
		return nodes.size();
	}

	public TreeNode getRoot() {
		return nodes.get(ROOT);
	}

	public TreeNode getNode(int id){
		checkArgument(id >= 0 && id < nodes.size(), "unknown node %s", id);
		return nodes.get(id);
	}

	public NodeData getData(int id){
		return getNode(id).getData();
	}

	public String getKind(int id){
		return getNode(id).getKind();
	}

	public int getParent(int id){
		return getNode(id).getParent();
	}

	public List<Integer> getChildren(int id){
		return getNode(id).getChildren();
	}

	public boolean isLeaf(int id){
		return getNode(id).isLeaf();
	}

	public boolean isRoot(int id){
		return id == ROOT;
	}

	public int indexInParent(int id){
		int parent = getParent(id);
		if(parent == TreeNode.NO_NODE)
			return -1;
		return nodes.get(parent).getChildren().indexOf(id);
	}

	public long getHash(int id){
		computeMetrics();
		return getNode(id).hash;
	}

	public int getHeight(int id){
		computeMetrics();
		return getNode(id).height;
	}

	/**
	 * @return the number of nodes below <code>id</code>, not counting the node itself.
	 */
	public int getDescendantCount(int id){
		computeMetrics();
		return getNode(id).descendants;
	}

	public int getPreOrderIndex(int id){
		computeMetrics();
		return getNode(id).preOrder;
	}

	/**
	 * @return all nodes below <code>id</code> in preorder, without the node itself.
	 */
	public List<Integer> getDescendants(int id){
		computeMetrics();
		TreeNode node = getNode(id);
		return preOrder.subList(node.preOrder + 1, node.preOrder + 1 + node.descendants);
	}

	/**
	 * @return true if <code>node</code> lies strictly below <code>ancestor</code>.
	 */
	public boolean isDescendant(int ancestor, int node){
		computeMetrics();
		TreeNode a = getNode(ancestor);
		int index = getNode(node).preOrder;
		return index > a.preOrder && index <= a.preOrder + a.descendants;
	}

	public List<Integer> dfs(){
		computeMetrics();
		return preOrder;
	}

	public List<Integer> postOrder(){
		List<Integer> visitedNodes = new ArrayList<Integer>(nodes.size());
		Deque<Integer> stack = new ArrayDeque<Integer>();
		Deque<Integer> output = new ArrayDeque<Integer>();
		stack.push(ROOT);
		while(!stack.isEmpty()){
			int id = stack.pop();
			output.push(id);
			for(int child : nodes.get(id).getChildren()){
				stack.push(child);
			}
		}
		while(!output.isEmpty()){
			visitedNodes.add(output.pop());
		}
		return visitedNodes;
	}

	public List<Integer> bfs(){
		List<Integer> visitedNodes = new ArrayList<Integer>(nodes.size());
		visitedNodes.add(ROOT);
		for(int i=0; i<visitedNodes.size(); i++){
			visitedNodes.addAll(nodes.get(visitedNodes.get(i)).getChildren());
		}
		return visitedNodes;
	}

	private void computeMetrics(){
		if(metricsComputed)
			return;
		computePreOrder();
		for(int id : postOrder()){
			TreeNode node = nodes.get(id);
			computeHash(node);
			int height = 0;
			int descendants = 0;
			for(int child : node.getChildren()){
				TreeNode c = nodes.get(child);
				height = Math.max(height, c.height + 1);
				descendants += c.descendants + 1;
			}
			node.height = height;
			node.descendants = descendants;
		}
		metricsComputed = true;
	}

	private void computePreOrder(){
		List<Integer> order = new ArrayList<Integer>(nodes.size());
		Deque<Integer> stack = new ArrayDeque<Integer>();
		stack.push(ROOT);
		while(!stack.isEmpty()){
			int id = stack.pop();
			TreeNode node = nodes.get(id);
			node.preOrder = order.size();
			order.add(id);
			List<Integer> children = node.getChildren();
			for(int i=children.size()-1; i>=0; i--){
				stack.push(children.get(i));
			}
		}
		preOrder = Collections.unmodifiableList(order);
	}

	/**
	 * Children must be hashed before their parent.
	 */
	private void computeHash(TreeNode node){
		NodeData data = node.getData();
		Hasher hasher = HASH_FUNCTION.newHasher();
		putString(hasher, data.getKind());
		putString(hasher, data.getLabel());
		if(node.isLeaf() && data.hasValue()){
			hasher.putBoolean(true);
			putString(hasher, data.getValue());
		}else{
			hasher.putBoolean(false);
		}
		hasher.putInt(node.getChildCount());
		for(int child : node.getChildren()){
			hasher.putLong(nodes.get(child).hash);
		}
		node.hash = hasher.hash().asLong();
	}

	private static void putString(Hasher hasher, String s){
		hasher.putInt(s.length());
		hasher.putString(s, StandardCharsets.UTF_8);
	}

	/**
	 * @return true if both trees have the same shape and every pair of corresponding
	 * nodes has the same kind, label, value and properties.
	 */
	public boolean isIsomorphicTo(Tree other){
		return isIsomorphic(ROOT, other, ROOT);
	}

	private boolean isIsomorphic(int id, Tree other, int otherId){
		TreeNode node = getNode(id);
		TreeNode otherNode = other.getNode(otherId);
		if(!node.getData().sameAs(otherNode.getData())
				|| node.getChildCount() != otherNode.getChildCount())
			return false;
		for(int i=0; i<node.getChildCount(); i++){
			if(!isIsomorphic(node.getChildren().get(i), other, otherNode.getChildren().get(i)))
				return false;
		}
		return true;
	}

	public String toTreeString(){
		return toTreeString(ROOT, "");
	}

	public String toTreeString(int id, String indent) {
		checkArgument(indent != null);
		StringBuilder sb = new StringBuilder();
		sb.append(indent + getNode(id).toString());
		indent += "  ";
		for(int child : getChildren(id)){
			sb.append("\n");
			sb.append(toTreeString(child, indent));
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return (name == null || name.isEmpty() ? "tree" : name) + "[" + nodes.size() + " nodes]";
	}
}
