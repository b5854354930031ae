package org.javai.mathast;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options controlling how a {@link MathParser} reads expressions.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ParserConfig config = ParserConfig.defaults();
 *
 * // Only x and y are variables, and a + b + c groups to the right
 * ParserConfig config = ParserConfig.builder()
 *         .validVariables(List.of("x", "y"))
 *         .leftAssociative(false)
 *         .build();
 * }</pre>
 *
 * @param implicitMultiply whether adjacent operands such as {@code 3x} are multiplied
 * @param leftAssociative whether operators of equal precedence group to the left
 * @param validVariables the single-letter variable names allowed, or {@code null} for any letter
 */
public record ParserConfig(
		boolean implicitMultiply,
		boolean leftAssociative,
		Set<String> validVariables
) {

	public static final boolean DEFAULT_IMPLICIT_MULTIPLY = true;
	public static final boolean DEFAULT_LEFT_ASSOCIATIVE = true;

	public ParserConfig {
		if (validVariables != null) {
			for (String variable : validVariables) {
				if (variable == null || variable.length() != 1
						|| !ClaimTokenScanner.isAsciiLetter(variable.charAt(0))) {
					throw new IllegalArgumentException(
							"Valid variables must be single ASCII letters, got: '" + variable + "'");
				}
			}
			validVariables = Set.copyOf(validVariables);
		}
	}

	/**
	 * Creates a configuration with default values: implicit multiplication on,
	 * left associative, any letter accepted as a variable.
	 *
	 * @return default configuration
	 */
	public static ParserConfig defaults() {
		return new ParserConfig(DEFAULT_IMPLICIT_MULTIPLY, DEFAULT_LEFT_ASSOCIATIVE, null);
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean restrictsVariables() {
		return validVariables != null;
	}

	public boolean isVariableAllowed(char variable) {
		return validVariables == null || validVariables.contains(String.valueOf(variable));
	}

	/**
	 * Builder for {@link ParserConfig}.
	 */
	public static class Builder {
		private boolean implicitMultiply = DEFAULT_IMPLICIT_MULTIPLY;
		private boolean leftAssociative = DEFAULT_LEFT_ASSOCIATIVE;
		private Set<String> validVariables;

		private Builder() {}

		public Builder implicitMultiply(boolean implicitMultiply) {
			this.implicitMultiply = implicitMultiply;
			return this;
		}

		public Builder leftAssociative(boolean leftAssociative) {
			this.leftAssociative = leftAssociative;
			return this;
		}

		/**
		 * Restricts variables to the given names. Passing {@code null} lifts the restriction.
		 *
		 * @param validVariables single-letter names
		 * @return this builder
		 */
		public Builder validVariables(Collection<String> validVariables) {
			this.validVariables = validVariables != null ? new LinkedHashSet<>(validVariables) : null;
			return this;
		}

		public ParserConfig build() {
			return new ParserConfig(implicitMultiply, leftAssociative, validVariables);
		}
	}
}
