package org.javai.mathast.ast;

/**
 * Visitor interface for traversing {@link MathNode} trees.
 * <p>
 * Used for rendering, analysis and transformation of parsed expressions.
 *
 * @param <R> the return type of the visitor operations
 */
public interface MathNodeVisitor<R> {

	R visitLiteral(LiteralNode node);

	R visitVariable(VariableNode node);

	R visitUnary(UnaryOperatorNode node);

	R visitBinary(BinaryOperatorNode node);

	R visitFunction(FunctionOperatorNode node);
}
