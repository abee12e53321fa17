package match;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import tree.TreeNode;

/**
 * A partial bijection between the node ids of a source tree and a destination tree.
 * <p>
 * No source id is matched twice and no destination id is matched twice. Pairs are only
 * added by the matchers of this package; callers get a read-only view.
 */
public class Matching {

	private final int[] srcToDst;
	private final int[] dstToSrc;
	private final List<Pair> pairs;

	public Matching(int srcSize, int dstSize){
		checkArgument(srcSize >= 0 && dstSize >= 0);
		srcToDst = new int[srcSize];
		dstToSrc = new int[dstSize];
		Arrays.fill(srcToDst, TreeNode.NO_NODE);
		Arrays.fill(dstToSrc, TreeNode.NO_NODE);
		pairs = new ArrayList<Pair>();
	}

	void add(int src, int dst){
		checkArgument(src >= 0 && src < srcToDst.length, "unknown source node %s", src);
		checkArgument(dst >= 0 && dst < dstToSrc.length, "unknown destination node %s", dst);
		checkState(srcToDst[src] == TreeNode.NO_NODE, "source node %s is already matched to %s", src, srcToDst[src]);
		checkState(dstToSrc[dst] == TreeNode.NO_NODE, "destination node %s is already matched to %s", dst, dstToSrc[dst]);
		srcToDst[src] = dst;
		dstToSrc[dst] = src;
		pairs.add(new Pair(src, dst));
	}

	/**
	 * @return the partner of source node <code>src</code>, or {@link TreeNode#NO_NODE}.
	 */
	public int getDst(int src){
		return src >= 0 && src < srcToDst.length ? srcToDst[src] : TreeNode.NO_NODE;
	}

	/**
	 * @return the partner of destination node <code>dst</code>, or {@link TreeNode#NO_NODE}.
	 */
	public int getSrc(int dst){
		return dst >= 0 && dst < dstToSrc.length ? dstToSrc[dst] : TreeNode.NO_NODE;
	}

	/**
	 * @return true if source node <code>src</code> has a partner.
	 */
	public boolean hasDst(int src){
		return getDst(src) != TreeNode.NO_NODE;
	}

	/**
	 * @return true if destination node <code>dst</code> has a partner.
	 */
	public boolean hasSrc(int dst){
		return getSrc(dst) != TreeNode.NO_NODE;
	}

	public boolean contains(int src, int dst){
		return hasDst(src) && srcToDst[src] == dst;
	}

	/**
	 * @return all pairs in the order they were matched.
	 */
	public List<Pair> getPairs() {
		return Collections.unmodifiableList(pairs);
	}

	public int size(){
		return pairs.size();
	}

	public int getSrcSize() {
		return srcToDst.length;
	}

	public int getDstSize() {
		return dstToSrc.length;
	}

	/**
	 * @return true if every node of both trees has a partner.
	 */
	public boolean isTotal(){
		return pairs.size() == srcToDst.length && pairs.size() == dstToSrc.length;
	}

	@Override
	public String toString() {
		return pairs.toString();
	}

	public static final class Pair {
		private final int src;
		private final int dst;

		public Pair(int src, int dst){
			this.src = src;
			this.dst = dst;
		}

		public int getSrc() {
			return src;
		}

		public int getDst() {
			return dst;
		}

		@Override
		public boolean equals(Object obj) {
			if(obj instanceof Pair){
				Pair other = (Pair)obj;
				return src == other.src && dst == other.dst;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return 31 * src + dst;
		}

		@Override
		public String toString() {
			return src + "->" + dst;
		}
	}
}
