package org.javai.mathast.ast;

import java.util.List;
import java.util.Objects;
import org.javai.mathast.operator.BinaryOperator;

/**
 * A binary operator applied to a left and a right operand.
 */
public record BinaryOperatorNode(BinaryOperator operator, MathNode left, MathNode right, Span span)
		implements OperatorNode {

	public BinaryOperatorNode {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(right, "right must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}

	@Override
	public NodeType type() {
		return NodeType.BINARY_OPERATOR;
	}

	@Override
	public List<MathNode> children() {
		return List.of(left, right);
	}

	@Override
	public <R> R accept(MathNodeVisitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
