package org.javai.mathast.operator;

/**
 * Visitor over the three operator kinds.
 *
 * @param <R> the return type of the visitor operations
 */
public interface OperatorVisitor<R> {

	R visitUnary(UnaryOperator operator);

	R visitBinary(BinaryOperator operator);

	R visitFunction(FunctionOperator operator);
}
