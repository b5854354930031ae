package org.javai.mathast.ast;

/**
 * Discriminant of a {@link MathNode}, with the label used when a tree is serialized.
 */
public enum NodeType {
	LITERAL("Literal"),
	VARIABLE("Variable"),
	UNARY_OPERATOR("UnaryOperator"),
	BINARY_OPERATOR("BinaryOperator"),
	FUNCTION_OPERATOR("FunctionOperator");

	private final String label;

	NodeType(String label) {
		this.label = label;
	}

	public String label() {
		return label;
	}
}
