package org.javai.mathast.ast;

import java.util.function.Consumer;

/**
 * Utility class for walking {@link MathNode} trees.
 */
public final class MathNodeWalker {

	private MathNodeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits {@code node} and then its children, left to right.
	 *
	 * @param node the root node to start traversal from
	 * @param action the action applied to each node
	 */
	public static void walkPreOrder(MathNode node, Consumer<MathNode> action) {
		if (node == null) {
			return;
		}
		action.accept(node);
		for (MathNode child : node.children()) {
			walkPreOrder(child, action);
		}
	}

	/**
	 * Visits the children of {@code node}, left to right, and then the node itself.
	 *
	 * @param node the root node to start traversal from
	 * @param action the action applied to each node
	 */
	public static void walkPostOrder(MathNode node, Consumer<MathNode> action) {
		if (node == null) {
			return;
		}
		for (MathNode child : node.children()) {
			walkPostOrder(child, action);
		}
		action.accept(node);
	}

	/**
	 * Number of nodes in the tree rooted at {@code node}.
	 */
	public static int count(MathNode node) {
		int[] count = {0};
		walkPreOrder(node, n -> count[0]++);
		return count[0];
	}

	/**
	 * Number of leaves (literals and variables) in the tree rooted at {@code node}.
	 */
	public static int countLeaves(MathNode node) {
		int[] count = {0};
		walkPreOrder(node, n -> {
			if (n.isLeaf()) {
				count[0]++;
			}
		});
		return count[0];
	}
}
