package org.javai.mathast;

/**
 * Thrown when a letter in the input is not one of the configured variables.
 */
public class UnknownVariableException extends MathSyntaxException {

	private final String variable;

	public UnknownVariableException(String variable, int position) {
		super("Unknown variable '" + variable + "' at position " + position);
		this.variable = variable;
	}

	public String variable() {
		return variable;
	}
}
