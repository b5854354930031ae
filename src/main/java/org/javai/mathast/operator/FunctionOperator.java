package org.javai.mathast.operator;

/**
 * A named function whose arguments follow in parentheses, separated by commas.
 * <p>
 * Functions carry no precedence: a call is always reduced as soon as its
 * closing parenthesis is read.
 *
 * @param name the display name
 * @param symbol the symbol matched in the source text, immediately followed by {@code (}
 * @param arity the exact number of arguments the function takes
 */
public record FunctionOperator(String name, String symbol, int arity) implements Operator {

	public FunctionOperator {
		Operator.requireText(name, "name");
		Operator.requireText(symbol, "symbol");
		if (arity < 1) {
			throw new IllegalArgumentException("Function arity must be positive, got " + arity);
		}
	}

	@Override
	public OperatorKind kind() {
		return OperatorKind.function;
	}

	@Override
	public <R> R accept(OperatorVisitor<R> visitor) {
		return visitor.visitFunction(this);
	}
}
