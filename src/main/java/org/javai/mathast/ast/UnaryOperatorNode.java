package org.javai.mathast.ast;

import java.util.List;
import java.util.Objects;
import org.javai.mathast.operator.UnaryOperator;

/**
 * A unary operator applied to one operand.
 */
public record UnaryOperatorNode(UnaryOperator operator, MathNode operand, Span span) implements OperatorNode {

	public UnaryOperatorNode {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(operand, "operand must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}

	@Override
	public NodeType type() {
		return NodeType.UNARY_OPERATOR;
	}

	@Override
	public List<MathNode> children() {
		return List.of(operand);
	}

	@Override
	public <R> R accept(MathNodeVisitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
