package org.javai.mathast.ast;

import java.util.List;

/**
 * A node in the syntax tree produced by the parser.
 * <p>
 * A node is either a leaf ({@link LiteralNode}, {@link VariableNode}) or an
 * {@link OperatorNode} owning its children. Trees are built bottom-up from
 * already completed nodes, so there is no sharing and no cycles.
 */
public sealed interface MathNode permits LiteralNode, VariableNode, OperatorNode {

	NodeType type();

	/**
	 * Source offsets covered by this node, operator symbol and operands included.
	 */
	Span span();

	/**
	 * Child nodes in source order; empty for leaves.
	 */
	List<MathNode> children();

	/**
	 * Accepts a visitor and dispatches to the method for this node's kind.
	 *
	 * @param <R> the return type of the visitor
	 * @param visitor the visitor to accept
	 * @return the result of the visitor operation
	 */
	<R> R accept(MathNodeVisitor<R> visitor);

	default boolean isLeaf() {
		return children().isEmpty();
	}
}
