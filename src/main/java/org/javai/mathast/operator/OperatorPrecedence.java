package org.javai.mathast.operator;

/**
 * Binding strength of a binary operator, weakest first.
 */
public enum OperatorPrecedence {
	LOW(1),
	NORMAL(2),
	MEDIUM(3),
	HIGH(4);

	private final int value;

	OperatorPrecedence(int value) {
		this.value = value;
	}

	/**
	 * Numeric rank used when comparing two operators competing for an operand.
	 */
	public int value() {
		return value;
	}
}
