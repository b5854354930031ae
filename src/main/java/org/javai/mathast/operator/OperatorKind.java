package org.javai.mathast.operator;

/**
 * The kind of an operator: unary prefix, binary infix, or function call.
 */
public enum OperatorKind {
	unary,
	binary,
	function
}
