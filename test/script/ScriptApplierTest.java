package script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tree.Trees.build;
import static tree.Trees.leaf;
import static tree.Trees.node;

import java.util.List;

import org.junit.jupiter.api.Test;

import match.Matcher;
import match.MatcherFixtures;
import match.Matching;
import match.MatchingConfig;
import script.model.Delete;
import script.model.EditScript;
import script.model.Insert;
import script.model.Update;
import tree.NodeData;
import tree.Tree;

public class ScriptApplierTest {

	private static void assertTransforms(Tree src, Tree dst){
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		EditScript raw = ScriptGenerator.generateScript(src, dst, matching);
		EditScript simplified = ScriptSimplifier.simplify(raw, src, dst, matching);
		assertTrue(dst.isIsomorphicTo(ScriptApplier.apply(src, raw)), raw.toString());
		assertTrue(dst.isIsomorphicTo(ScriptApplier.apply(src, simplified)), simplified.toString());
	}

	@Test
	public void testEmptyScript() {
		Tree src = MatcherFixtures.before();
		Tree result = ScriptApplier.apply(src, EditScript.empty());
		assertNotSame(src, result);
		assertTrue(src.isIsomorphicTo(result));
	}

	@Test
	public void testHandWrittenScript() {
		Tree src = build(node("Doc", leaf("Text", "a"), node("Box", leaf("Text", "b"))));
		Insert insert = new Insert(4, 1, NodeData.of("Para"), 0, 0);
		insert.addEditOp(new Insert(5, 2, NodeData.leaf("Text", "c"), 4, 0));
		EditScript script = new EditScript(List.of(
				insert,
				new Update(1, 3, src.getData(1), NodeData.leaf("Text", "A")),
				new Delete(2, src.getData(2), 0, 2)));
		Tree expected = build(node("Doc", node("Para", leaf("Text", "c")), leaf("Text", "A")));
		assertTrue(expected.isIsomorphicTo(ScriptApplier.apply(src, script)));
		assertEquals(4, src.getSize());
	}

	@Test
	public void testInvalidOp() {
		Tree src = build(node("Doc", leaf("Text", "a")));
		EditScript script = new EditScript(List.of(new Delete(7, NodeData.of("X"), 0, 0)));
		assertThrows(IllegalArgumentException.class, () -> ScriptApplier.apply(src, script));
	}

	@Test
	public void testDeleteAtWrongPosition() {
		Tree src = build(node("Doc", leaf("Text", "a"), leaf("Text", "b")));
		EditScript wrongIndex = new EditScript(List.of(new Delete(2, src.getData(2), 0, 0)));
		assertThrows(IllegalStateException.class, () -> ScriptApplier.apply(src, wrongIndex));
		EditScript wrongParent = new EditScript(List.of(new Delete(2, src.getData(2), 1, 1)));
		assertThrows(IllegalStateException.class, () -> ScriptApplier.apply(src, wrongParent));
		EditScript right = new EditScript(List.of(new Delete(2, src.getData(2), 0, 1)));
		assertTrue(build(node("Doc", leaf("Text", "a"))).isIsomorphicTo(ScriptApplier.apply(src, right)));
	}

	@Test
	public void testMovedList() {
		assertTransforms(MatcherFixtures.before(), MatcherFixtures.after());
		assertTransforms(MatcherFixtures.after(), MatcherFixtures.before());
	}

	@Test
	public void testWrappedAndUnwrappedSubtree() {
		Tree src = build(node("Doc",
				node("Sec", leaf("Title", "t"),
						node("List", node("Item", leaf("Text", "a")), node("Item", leaf("Text", "b"))))));
		Tree dst = build(node("Doc",
				node("Sec", leaf("Title", "t")),
				node("Box", node("List", node("Item", leaf("Text", "a")), node("Item", leaf("Text", "b"))))));
		assertTransforms(src, dst);
		assertTransforms(dst, src);
	}

	@Test
	public void testReversedChildren() {
		Tree src = build(node("Doc", leaf("T", "1"), leaf("T", "2"), leaf("T", "3"), leaf("T", "4"), leaf("T", "5")));
		Tree dst = build(node("Doc", leaf("T", "5"), leaf("T", "4"), leaf("T", "3"), leaf("T", "2"), leaf("T", "1")));
		assertTransforms(src, dst);
	}

	@Test
	public void testRootOnlyTrees() {
		assertTransforms(build(node("A")), build(node("B")));
		assertTransforms(build(node("A")), build(node("A", leaf("T", "x"), node("P", leaf("T", "y")))));
		assertTransforms(build(node("A", leaf("T", "x"), node("P", leaf("T", "y")))), build(node("A")));
	}
}
