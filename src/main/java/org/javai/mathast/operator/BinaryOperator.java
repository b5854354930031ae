package org.javai.mathast.operator;

import java.util.Objects;

/**
 * An infix operator taking a left and a right operand.
 *
 * @param name the display name
 * @param symbol the symbol matched in the source text
 * @param precedence how tightly the operator binds relative to other binary operators
 */
public record BinaryOperator(String name, String symbol, OperatorPrecedence precedence) implements Operator {

	public BinaryOperator {
		Operator.requireText(name, "name");
		Operator.requireText(symbol, "symbol");
		Objects.requireNonNull(precedence, "precedence must not be null");
	}

	@Override
	public int arity() {
		return 2;
	}

	@Override
	public OperatorKind kind() {
		return OperatorKind.binary;
	}

	@Override
	public <R> R accept(OperatorVisitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
