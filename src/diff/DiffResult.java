package diff;

import com.google.common.base.MoreObjects;

import match.Matching;
import script.model.EditScript;

/**
 * The outcome of a diff: the simplified script, the script it was simplified from
 * and the matching both were generated with.
 */
public final class DiffResult {

	private final EditScript editScript;
	private final EditScript rawEditScript;
	private final Matching matching;

	public DiffResult(EditScript editScript, EditScript rawEditScript, Matching matching) {
		this.editScript = editScript;
		this.rawEditScript = rawEditScript;
		this.matching = matching;
	}

	public EditScript getEditScript() {
		return editScript;
	}

	public EditScript getRawEditScript() {
		return rawEditScript;
	}

	public Matching getMatching() {
		return matching;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("ops", editScript.size())
				.add("rawOps", rawEditScript.size())
				.add("matched", matching.size())
				.toString();
	}
}
