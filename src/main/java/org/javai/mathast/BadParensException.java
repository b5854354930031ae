package org.javai.mathast;

/**
 * Thrown for unbalanced parentheses, a stray comma, or a function symbol not
 * followed by an opening parenthesis.
 */
public class BadParensException extends MathSyntaxException {

	public BadParensException(String message) {
		super(message);
	}
}
