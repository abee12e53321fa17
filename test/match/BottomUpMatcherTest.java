package match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tree.Trees.build;
import static tree.Trees.leaf;
import static tree.Trees.node;

import org.junit.jupiter.api.Test;

import tree.Tree;

public class BottomUpMatcherTest {

	@Test
	public void testContainersFollowTheirDescendants() {
		Tree src = MatcherFixtures.before();
		Tree dst = MatcherFixtures.after();
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertTrue(matching.isTotal());
		assertTrue(matching.contains(0, 0));
		assertTrue(matching.contains(1, 1));
		assertTrue(matching.contains(12, 7));
		assertTrue(matching.contains(2, 2));
		assertTrue(matching.contains(13, 8));
		assertTrue(matching.contains(14, 9));
		assertTrue(matching.contains(7, 13));
	}

	@Test
	public void testDice() {
		Tree src = MatcherFixtures.before();
		Tree dst = MatcherFixtures.after();
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertEquals(10.0d / 15.0d, BottomUpMatcher.dice(src, 1, dst, 1, matching), 1e-9);
		assertEquals(0.5d, BottomUpMatcher.dice(src, 1, dst, 7, matching), 1e-9);
		assertEquals(1.0d, BottomUpMatcher.dice(src, 2, dst, 2, matching), 1e-9);
		assertEquals(0.0d, BottomUpMatcher.dice(src, 3, dst, 9, matching), 1e-9);
	}

	@Test
	public void testMinDice() {
		Tree src = MatcherFixtures.before();
		Tree dst = MatcherFixtures.after();
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults().withMinDice(0.9d));
		assertFalse(matching.hasDst(1));
		assertFalse(matching.hasDst(12));
		assertTrue(matching.contains(0, 0));
		assertTrue(matching.contains(3, 3));
		assertTrue(matching.contains(7, 13));
	}

	@Test
	public void testLeavesMatchedByHashInOrder() {
		Tree src = build(node("Doc", leaf("Text", "a"), leaf("Text", "a"), leaf("Text", "b")));
		Tree dst = build(node("Doc", leaf("Text", "a"), leaf("Text", "a"), leaf("Text", "b"), leaf("Text", "c")));
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertEquals(4, matching.size());
		assertTrue(matching.contains(1, 1));
		assertTrue(matching.contains(2, 2));
		assertTrue(matching.contains(3, 3));
		assertFalse(matching.hasSrc(4));
	}

	@Test
	public void testKindIsAStrictFilter() {
		Tree src = build(node("Doc", node("P", leaf("Text", "a"), leaf("Text", "b"))));
		Tree dst = build(node("Doc", node("Q", leaf("Text", "a"), leaf("Text", "b"))));
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertFalse(matching.hasDst(1));
		assertTrue(matching.contains(2, 2));
		assertTrue(matching.contains(3, 3));
	}

	@Test
	public void testRootsAlwaysMatch() {
		Tree src = build(node("Old", leaf("Text", "a")));
		Tree dst = build(node("New", leaf("Name", "b")));
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertEquals(1, matching.size());
		assertTrue(matching.contains(0, 0));
	}

	@Test
	public void testLastChanceRecoversChangedLeaf() {
		Tree src = build(node("Doc", node("Para", leaf("Text", "hello"), leaf("Text", "foo"), leaf("Text", "bar"))));
		Tree dst = build(node("Doc", node("Para", leaf("Text", "world"), leaf("Text", "foo"), leaf("Text", "bar"))));
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertTrue(matching.isTotal());
		assertTrue(matching.contains(1, 1));
		assertTrue(matching.contains(2, 2));
	}

	@Test
	public void testMovedLowSubtreeAndChangedLeaf() {
		//The paragraph is too low for the top-down phase.
		Tree src = build(node("Doc",
				node("Sec", leaf("Title", "t"), leaf("Text", "x"), leaf("Text", "y")),
				node("Para", leaf("Text", "p"))));
		Tree dst = build(node("Doc",
				node("Para", leaf("Text", "p")),
				node("Sec", leaf("Title", "t"), leaf("Text", "x"), leaf("Text", "z"))));
		Matching matching = Matcher.computeMatching(src, dst, MatchingConfig.defaults());
		assertTrue(matching.contains(1, 3));
		assertTrue(matching.contains(5, 1));
		assertTrue(matching.contains(6, 2));
		assertTrue(matching.contains(4, 6));
	}

	@Test
	public void testLastChanceMatchesIdenticalChildren() {
		Tree src = build(node("Doc", node("Para", leaf("Text", "p")), node("Para", leaf("Text", "q"))));
		Tree dst = build(node("Doc", node("Para", leaf("Text", "q")), node("Para", leaf("Text", "p"))));
		Matching matching = new Matching(src.getSize(), dst.getSize());
		matching.add(0, 0);
		BottomUpMatcher.lastChanceMatch(src, 0, dst, 0, matching, MatchingConfig.defaults());
		assertEquals(5, matching.size());
		assertTrue(matching.contains(1, 3));
		assertTrue(matching.contains(2, 4));
		assertTrue(matching.contains(3, 1));
		assertTrue(matching.contains(4, 2));
	}
}
