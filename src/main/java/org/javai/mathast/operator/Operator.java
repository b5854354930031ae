package org.javai.mathast.operator;

/**
 * An operator the parser can recognize in the source text.
 * <p>
 * Each operator has a display name (e.g. {@code "Sum"}) and the exact symbol
 * matched against the input (e.g. {@code "+"}). Symbols are compared as plain
 * string prefixes; no normalization or pattern syntax applies.
 */
public sealed interface Operator permits UnaryOperator, BinaryOperator, FunctionOperator {

	/**
	 * Display name carried into the syntax tree.
	 */
	String name();

	/**
	 * Symbol matched against the source text.
	 */
	String symbol();

	/**
	 * Number of operands this operator consumes when reduced.
	 */
	int arity();

	OperatorKind kind();

	<R> R accept(OperatorVisitor<R> visitor);

	static void requireText(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Operator " + field + " must not be blank");
		}
	}
}
