package org.javai.mathast;

/**
 * Base exception for failures while turning text into a syntax tree.
 */
public class MathParseException extends RuntimeException {

	public MathParseException(String message) {
		super(message);
	}

	public MathParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
