package match;

import static com.google.common.base.Preconditions.checkNotNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tree.Tree;

public class Matcher {

	private static final Logger logger = LoggerFactory.getLogger(Matcher.class);

	/**
	 * Match nodes between two trees: identical subtrees first, then the rest by
	 * the similarity of their matched descendants.
	 *
	 * @param src a tree before a change.
	 * @param dst a tree after a change.
	 * @param config matching thresholds.
	 * @return the matching, with the two roots matched to each other.
	 */
	public static Matching computeMatching(Tree src, Tree dst, MatchingConfig config) {
		checkNotNull(src, "src");
		checkNotNull(dst, "dst");
		checkNotNull(config, "config");
		Matching matching = new Matching(src.getSize(), dst.getSize());
		TopDownMatcher.match(src, dst, matching, config);
		int topDown = matching.size();
		logger.debug("Top-down phase: {} pairs", topDown);
		BottomUpMatcher.match(src, dst, matching, config);
		logger.debug("Bottom-up phase: {} pairs, {} of {}/{} nodes matched", matching.size() - topDown,
				matching.size(), src.getSize(), dst.getSize());
		return matching;
	}
}
