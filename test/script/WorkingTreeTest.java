package script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tree.Trees.build;
import static tree.Trees.leaf;
import static tree.Trees.node;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import tree.NodeData;
import tree.Tree;
import tree.TreeNode;

public class WorkingTreeTest {

	/**
	 * R0(A1(x2, y3), B4(z5))
	 */
	private static Tree sample(){
		return build(node("R",
				node("A", leaf("L", "x"), leaf("L", "y")),
				node("B", leaf("L", "z"))));
	}

	@Test
	public void testCopy() {
		WorkingTree work = new WorkingTree(sample());
		assertEquals(6, work.nextId());
		assertEquals(Arrays.asList(1, 4), work.getChildren(0));
		assertEquals(1, work.getParent(3));
		assertEquals(1, work.indexInParent(3));
		assertTrue(work.toTree().isIsomorphicTo(sample()));
	}

	@Test
	public void testInsertDetachAttach() {
		WorkingTree work = new WorkingTree(sample());
		int id = work.insert(NodeData.leaf("L", "w"), 4, 0);
		assertEquals(6, id);
		assertEquals(7, work.nextId());
		assertEquals(Arrays.asList(6, 5), work.getChildren(4));

		work.detach(1);
		assertEquals(TreeNode.NO_NODE, work.getParent(1));
		assertEquals(Arrays.asList(4), work.getChildren(0));
		work.attach(1, 4, 2);
		assertEquals(Arrays.asList(6, 5, 1), work.getChildren(4));
		assertEquals(Arrays.asList(2, 3), work.getChildren(1));

		Tree expected = build(node("R",
				node("B", leaf("L", "w"), leaf("L", "z"),
						node("A", leaf("L", "x"), leaf("L", "y")))));
		assertTrue(work.toTree().isIsomorphicTo(expected));
	}

	@Test
	public void testInsertWithGivenId() {
		WorkingTree work = new WorkingTree(sample());
		work.insert(10, NodeData.leaf("L", "w"), 0, 2);
		assertTrue(work.contains(10));
		assertFalse(work.contains(8));
		assertEquals(11, work.nextId());
		assertThrows(IllegalArgumentException.class, () -> work.insert(10, NodeData.of("X"), 0, 0));
		assertThrows(IllegalArgumentException.class, () -> work.insert(2, NodeData.of("X"), 0, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> work.insert(NodeData.of("X"), 0, 9));
	}

	@Test
	public void testDeleteSubtree() {
		WorkingTree work = new WorkingTree(sample());
		work.delete(1);
		assertFalse(work.contains(1));
		assertFalse(work.contains(2));
		assertFalse(work.contains(3));
		assertEquals(Arrays.asList(4), work.getChildren(0));
		assertEquals(Arrays.asList(5, 4, 0), work.postOrder());
		assertThrows(IllegalArgumentException.class, () -> work.delete(Tree.ROOT));
		assertThrows(IllegalArgumentException.class, () -> work.getData(2));
	}

	@Test
	public void testUpdate() {
		WorkingTree work = new WorkingTree(sample());
		work.update(5, NodeData.leaf("L", "Z"));
		assertEquals("Z", work.getData(5).getValue());
	}

	@Test
	public void testCannotAttachBelowItself() {
		WorkingTree work = new WorkingTree(sample());
		work.detach(1);
		assertThrows(IllegalArgumentException.class, () -> work.attach(1, 2, 0));
		assertThrows(IllegalStateException.class, () -> work.detach(1));
		assertThrows(IllegalStateException.class, () -> work.attach(4, 0, 0));
	}
}
