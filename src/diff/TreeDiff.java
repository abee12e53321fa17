package diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import match.Matcher;
import match.Matching;
import match.MatchingConfig;
import script.ScriptGenerator;
import script.ScriptSimplifier;
import script.model.EditScript;
import tree.Tree;

/**
 * Entry points for differencing two ordered labeled trees.
 */
public class TreeDiff {

	private static final Logger logger = LoggerFactory.getLogger(TreeDiff.class);

	public static Matching computeMatching(Tree before, Tree after, MatchingConfig config) {
		return Matcher.computeMatching(before, after, config);
	}

	public static EditScript generateEditScript(Tree before, Tree after, Matching matching) {
		return ScriptGenerator.generateScript(before, after, matching);
	}

	/**
	 * @return the simplified edit script transforming <code>before</code> into <code>after</code>.
	 */
	public static EditScript diff(Tree before, Tree after, MatchingConfig config) {
		return diffWithMatching(before, after, config).getEditScript();
	}

	/**
	 * Match, generate and simplify.
	 *
	 * @param before a tree before a change.
	 * @param after a tree after a change.
	 * @param config matching thresholds.
	 * @return the simplified script together with the raw script and the matching.
	 */
	public static DiffResult diffWithMatching(Tree before, Tree after, MatchingConfig config) {
		Matching matching = computeMatching(before, after, config);
		EditScript raw = generateEditScript(before, after, matching);
		EditScript simplified = ScriptSimplifier.simplify(raw, before, after, matching);
		DiffResult result = new DiffResult(simplified, raw, matching);
		logger.debug("Diff of {} and {}: {}", before, after, result);
		return result;
	}
}
