package org.javai.mathast.ast;

import org.javai.mathast.operator.Operator;

/**
 * A node produced by reducing an operator with its operands.
 */
public sealed interface OperatorNode extends MathNode
		permits UnaryOperatorNode, BinaryOperatorNode, FunctionOperatorNode {

	Operator operator();

	/**
	 * Display name of the operator, e.g. {@code "Sum"}.
	 */
	default String name() {
		return operator().name();
	}
}
