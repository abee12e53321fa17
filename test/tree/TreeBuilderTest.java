package tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class TreeBuilderTest {

	private static final String SOURCE = "class A { void m() { x = 1; } }";

	@Test
	public void testBuildTreeFromSource() {
		Tree tree = TreeBuilder.buildTreeFromSource(SOURCE);
		assertEquals("CompilationUnit", tree.getKind(Tree.ROOT));
		int type = Trees.find(tree, "TypeDeclaration", null);
		int name = Trees.find(tree, "SimpleName", "A");
		assertEquals(type, tree.getParent(name));
		assertTrue(tree.isLeaf(name));
		int literal = Trees.find(tree, "NumberLiteral", "1");
		assertTrue(literal > 0);
		assertEquals("void", tree.getData(Trees.find(tree, "PrimitiveType", null)).getValue());
	}

	@Test
	public void testExpressionStatementsAreLeftOut() {
		Tree tree = TreeBuilder.buildTreeFromSource(SOURCE);
		assertEquals(-1, Trees.find(tree, "ExpressionStatement", null));
		int assignment = Trees.find(tree, "Assignment", null);
		assertEquals("Block", tree.getKind(tree.getParent(assignment)));
	}

	@Test
	public void testOperatorIsAProperty() {
		Tree tree = TreeBuilder.buildTreeFromSource("class A { int m(int a) { return a + 1; } }");
		NodeData infix = tree.getData(Trees.find(tree, "InfixExpression", null));
		assertEquals("InfixExpression", infix.getLabel());
		assertTrue(infix.getProperties() instanceof MapProperties);
		assertEquals("+", ((MapProperties)infix.getProperties()).get(JavaCodeVisitor.OPERATOR));
	}

	@Test
	public void testStatementsAreNestedUnderSwitchCases() {
		Tree tree = TreeBuilder.buildTreeFromSource(
				"class A { void m(int x) { switch (x) { case 1: a(); break; case 2: b(); } c(); } }");
		int switchStatement = Trees.find(tree, "SwitchStatement", null);
		List<String> kinds = new ArrayList<String>();
		for(int child : tree.getChildren(switchStatement)){
			kinds.add(tree.getKind(child));
		}
		assertEquals(List.of("SimpleName", "SwitchCase", "SwitchCase"), kinds);

		int firstCase = tree.getChildren(switchStatement).get(1);
		List<String> caseKinds = new ArrayList<String>();
		for(int child : tree.getChildren(firstCase)){
			caseKinds.add(tree.getKind(child));
		}
		assertEquals(List.of("NumberLiteral", "MethodInvocation", "BreakStatement"), caseKinds);

		//The statement after the switch is back in the method body.
		int block = tree.getParent(switchStatement);
		assertEquals("Block", tree.getKind(block));
		assertEquals(2, tree.getChildren(block).size());
		assertEquals("MethodInvocation", tree.getKind(tree.getChildren(block).get(1)));
	}

	@Test
	public void testFullAst() {
		JavaCodeVisitor visitor = new JavaCodeVisitor(true);
		TreeBuilder.getCompilationUnit(SOURCE).accept(visitor);
		Tree tree = visitor.getTree();
		int statement = Trees.find(tree, "ExpressionStatement", null);
		assertTrue(statement > 0);
		assertEquals("Assignment", tree.getKind(tree.getChildren(statement).get(0)));
	}

	@Test
	public void testBuildTreeFromFile() throws IOException, URISyntaxException {
		File f = new File(getClass().getResource("/java/Before.java").toURI());
		Tree tree = TreeBuilder.buildTreeFromFile(f);
		assertEquals("Before.java", tree.getName());
		assertTrue(Trees.find(tree, "MethodDeclaration", null) > 0);
	}
}
