package match;

import static tree.Trees.build;
import static tree.Trees.leaf;
import static tree.Trees.node;

import tree.Tree;
import tree.Trees.Shape;

/**
 * A document whose list moves from the first section to the end of the second one.
 */
public final class MatcherFixtures {

	private MatcherFixtures(){
	}

	/**
	 * Doc0(Sec1(Title2, Para3(Text4), Para5(Text6), List7(Item8(Text9), Item10(Text11))),
	 * Sec12(Title13, Para14(Text15), Para16(Text17)))
	 */
	public static Tree before(){
		return build(node("Doc",
				node("Sec", leaf("Title", "one"),
						node("Para", leaf("Text", "p1")),
						node("Para", leaf("Text", "p2")),
						list()),
				node("Sec", leaf("Title", "two"),
						node("Para", leaf("Text", "q1")),
						node("Para", leaf("Text", "q2")))));
	}

	/**
	 * Doc0(Sec1(Title2, Para3(Text4), Para5(Text6)),
	 * Sec7(Title8, Para9(Text10), Para11(Text12), List13(Item14(Text15), Item16(Text17))))
	 */
	public static Tree after(){
		return build(node("Doc",
				node("Sec", leaf("Title", "one"),
						node("Para", leaf("Text", "p1")),
						node("Para", leaf("Text", "p2"))),
				node("Sec", leaf("Title", "two"),
						node("Para", leaf("Text", "q1")),
						node("Para", leaf("Text", "q2")),
						list())));
	}

	private static Shape list(){
		return node("List",
				node("Item", leaf("Text", "a")),
				node("Item", leaf("Text", "b")));
	}
}
