package org.javai.mathast;

import org.javai.mathast.operator.Operator;

/**
 * Thrown when an operator is given a number of operands different from its arity.
 */
public class IncorrectArityException extends MathParseException {

	private final Operator operator;
	private final int actual;

	public IncorrectArityException(Operator operator, int actual) {
		super("Operator '" + operator.name() + "' expects " + operator.arity()
				+ " operand(s) but got " + actual);
		this.operator = operator;
		this.actual = actual;
	}

	public Operator operator() {
		return operator;
	}

	public int expected() {
		return operator.arity();
	}

	public int actual() {
		return actual;
	}
}
