package org.javai.mathast;

/**
 * Thrown when the input is not a well-formed expression.
 */
public class MathSyntaxException extends MathParseException {

	public MathSyntaxException() {
		super("Math syntax error");
	}

	public MathSyntaxException(String message) {
		super(message);
	}
}
