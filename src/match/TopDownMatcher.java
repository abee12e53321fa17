package match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import tree.Tree;

/**
 * Matches identical subtrees of two trees using their structural hashes.
 */
public class TopDownMatcher {

	private static final Logger logger = LoggerFactory.getLogger(TopDownMatcher.class);

	/**
	 * Match every pair of hash-identical subtrees whose height is at least
	 * <code>config.getMinHeight()</code>, tallest first.
	 * <p>
	 * Nodes within a bucket are paired in preorder. Once a pair is matched,
	 * all their descendants are matched pairwise.
	 *
	 * @param src the source tree.
	 * @param dst the destination tree.
	 * @param matching the matching to extend.
	 * @param config thresholds.
	 */
	public static void match(final Tree src, final Tree dst, Matching matching, MatchingConfig config) {
		final ListMultimap<Long, Integer> srcIndex = index(src, config.getMinHeight());
		ListMultimap<Long, Integer> dstIndex = index(dst, config.getMinHeight());

		List<Long> hashes = new ArrayList<Long>();
		for(Long hash : srcIndex.keySet()){
			if(dstIndex.containsKey(hash))
				hashes.add(hash);
		}
		//Tallest subtrees first, then by the preorder index of the first source node.
		Collections.sort(hashes, new Comparator<Long>() {
			@Override
			public int compare(Long h1, Long h2) {
				int n1 = srcIndex.get(h1).get(0);
				int n2 = srcIndex.get(h2).get(0);
				int result = Integer.compare(src.getHeight(n2), src.getHeight(n1));
				return result != 0 ? result : Integer.compare(src.getPreOrderIndex(n1), src.getPreOrderIndex(n2));
			}
		});

		int matched = 0;
		for(Long hash : hashes){
			List<Integer> dstNodes = dstIndex.get(hash);
			for(int x : srcIndex.get(hash)){
				if(matching.hasDst(x))
					continue;
				for(int y : dstNodes){
					if(!matching.hasSrc(y) && isIdentical(src, x, dst, y)){
						matched += matchSubtrees(src, x, dst, y, matching);
						break;
					}
				}
			}
		}
		logger.debug("{} hash buckets shared, {} pairs matched top-down", hashes.size(), matched);
	}

	/**
	 * @return nodes with height at least <code>minHeight</code> bucketed by hash, in preorder.
	 */
	private static ListMultimap<Long, Integer> index(Tree tree, int minHeight) {
		ListMultimap<Long, Integer> index = MultimapBuilder.hashKeys().arrayListValues().build();
		for(int id : tree.dfs()){
			if(tree.getHeight(id) >= minHeight)
				index.put(tree.getHash(id), id);
		}
		return index;
	}

	/**
	 * Roots only match roots.
	 */
	static boolean isIdentical(Tree src, int x, Tree dst, int y) {
		return src.getHash(x) == dst.getHash(y)
				&& src.getKind(x).equals(dst.getKind(y))
				&& src.getDescendantCount(x) == dst.getDescendantCount(y)
				&& src.isRoot(x) == dst.isRoot(y);
	}

	/**
	 * Match <code>x</code> with <code>y</code> and their descendants pairwise.
	 *
	 * @return the number of new pairs.
	 */
	static int matchSubtrees(Tree src, int x, Tree dst, int y, Matching matching) {
		int matched = 1;
		matching.add(x, y);
		List<Integer> xChildren = src.getChildren(x);
		List<Integer> yChildren = dst.getChildren(y);
		for(int i=0; i<xChildren.size() && i<yChildren.size(); i++){
			int xChild = xChildren.get(i);
			int yChild = yChildren.get(i);
			if(!matching.hasDst(xChild) && !matching.hasSrc(yChild)){
				matched += matchSubtrees(src, xChild, dst, yChild, matching);
			}
		}
		return matched;
	}
}
