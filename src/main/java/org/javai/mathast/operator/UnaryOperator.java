package org.javai.mathast.operator;

/**
 * A prefix operator taking exactly one operand, e.g. negation.
 *
 * @param name the display name
 * @param symbol the symbol matched in the source text
 */
public record UnaryOperator(String name, String symbol) implements Operator {

	public UnaryOperator {
		Operator.requireText(name, "name");
		Operator.requireText(symbol, "symbol");
	}

	@Override
	public int arity() {
		return 1;
	}

	@Override
	public OperatorKind kind() {
		return OperatorKind.unary;
	}

	@Override
	public <R> R accept(OperatorVisitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
