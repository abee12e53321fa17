package match;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multiset;
import com.google.common.collect.MultimapBuilder;

import match.Candidates.Candidate;
import tree.Tree;
import tree.TreeNode;

/**
 * Matches the nodes left over by the top-down phase using the similarity of their
 * already matched descendants.
 */
public class BottomUpMatcher {

	private static final Logger logger = LoggerFactory.getLogger(BottomUpMatcher.class);

	/**
	 * Visit source nodes in postorder and match them with destination nodes.
	 * <ul>
	 * <li>The source root is matched with the destination root.</li>
	 * <li>An unmatched leaf is matched with the first unmatched destination leaf
	 * with the same kind and hash.</li>
	 * <li>An unmatched container with matched descendants is matched with the
	 * unmatched destination container of the same kind with the highest dice,
	 * if it reaches <code>config.getMinDice()</code>.</li>
	 * </ul>
	 * Every container pair made here, the root pair included, is followed by
	 * {@link #lastChanceMatch} on their children.
	 */
	public static void match(Tree src, Tree dst, Matching matching, MatchingConfig config) {
		ListMultimap<Long, Integer> dstLeaves = MultimapBuilder.hashKeys().arrayListValues().build();
		ListMultimap<String, Integer> dstContainers = MultimapBuilder.hashKeys().arrayListValues().build();
		for(int id : dst.dfs()){
			if(dst.isRoot(id))
				continue;
			if(dst.isLeaf(id))
				dstLeaves.put(dst.getHash(id), id);
			else
				dstContainers.put(dst.getKind(id), id);
		}

		int leafMatches = 0;
		int containerMatches = 0;
		for(int x : src.postOrder()){
			if(src.isRoot(x)){
				if(!matching.hasDst(x))
					matching.add(x, Tree.ROOT);
				lastChanceMatch(src, x, dst, Tree.ROOT, matching, config);
			}else if(matching.hasDst(x)){
				continue;
			}else if(src.isLeaf(x)){
				for(int y : dstLeaves.get(src.getHash(x))){
					if(!matching.hasSrc(y) && src.getKind(x).equals(dst.getKind(y))){
						matching.add(x, y);
						leafMatches++;
						break;
					}
				}
			}else{
				int y = findBestContainer(src, x, dst, dstContainers.get(src.getKind(x)), matching, config);
				if(y != TreeNode.NO_NODE){
					matching.add(x, y);
					containerMatches++;
					lastChanceMatch(src, x, dst, y, matching, config);
				}
			}
		}
		logger.debug("Bottom-up matched {} leaves and {} containers", leafMatches, containerMatches);
	}

	private static int findBestContainer(Tree src, int x, Tree dst, List<Integer> candidates,
			Matching matching, MatchingConfig config) {
		//Count, for every destination node, the matched descendants of x whose partner lies below it.
		Multiset<Integer> common = HashMultiset.create();
		for(int d : src.getDescendants(x)){
			int partner = matching.getDst(d);
			if(partner == TreeNode.NO_NODE)
				continue;
			for(int p = dst.getParent(partner); p != TreeNode.NO_NODE; p = dst.getParent(p)){
				common.add(p);
			}
		}
		if(common.isEmpty())
			return TreeNode.NO_NODE;

		Candidates best = new Candidates();
		int xDescendants = src.getDescendantCount(x);
		for(int y : candidates){
			if(matching.hasSrc(y))
				continue;
			double similarity = dice(common.count(y), xDescendants, dst.getDescendantCount(y));
			if(similarity >= config.getMinDice())
				best.addCandidate(y, dst.getPreOrderIndex(y), similarity);
		}
		Candidate c = best.peek();
		return c == null ? TreeNode.NO_NODE : c.getNode();
	}

	/**
	 * Recover matches among the direct children of the pair (x, y).
	 * <p>
	 * Hash-identical children of the same kind are matched first, together with their
	 * subtrees. Then every child of x that is still unmatched takes the unmatched child
	 * of y with the same kind and leafness that scores the highest dice, if it reaches
	 * <code>config.getMinDice()</code>. Two leaves always score 1.0.
	 */
	static void lastChanceMatch(Tree src, int x, Tree dst, int y, Matching matching, MatchingConfig config) {
		List<Integer> xChildren = src.getChildren(x);
		List<Integer> yChildren = dst.getChildren(y);
		for(int xChild : xChildren){
			if(matching.hasDst(xChild))
				continue;
			for(int yChild : yChildren){
				if(!matching.hasSrc(yChild) && TopDownMatcher.isIdentical(src, xChild, dst, yChild)){
					TopDownMatcher.matchSubtrees(src, xChild, dst, yChild, matching);
					break;
				}
			}
		}

		for(int xChild : xChildren){
			if(matching.hasDst(xChild))
				continue;
			Candidates candidates = new Candidates();
			for(int yChild : yChildren){
				if(matching.hasSrc(yChild)
						|| !src.getKind(xChild).equals(dst.getKind(yChild))
						|| src.isLeaf(xChild) != dst.isLeaf(yChild))
					continue;
				double similarity = src.isLeaf(xChild) ? 1.0d : dice(src, xChild, dst, yChild, matching);
				if(similarity >= config.getMinDice())
					candidates.addCandidate(yChild, dst.getPreOrderIndex(yChild), similarity);
			}
			Candidate c = candidates.peek();
			if(c != null)
				matching.add(xChild, c.getNode());
		}
	}

	/**
	 * @return the dice coefficient of the matched descendants of <code>x</code> and <code>y</code>.
	 */
	public static double dice(Tree src, int x, Tree dst, int y, Matching matching) {
		int common = 0;
		for(int d : src.getDescendants(x)){
			int partner = matching.getDst(d);
			if(partner != TreeNode.NO_NODE && dst.isDescendant(y, partner))
				common++;
		}
		return dice(common, src.getDescendantCount(x), dst.getDescendantCount(y));
	}

	static double dice(int common, int xDescendants, int yDescendants) {
		if(xDescendants + yDescendants == 0)
			return 1.0d;
		return 2.0d * common / (xDescendants + yDescendants);
	}
}
