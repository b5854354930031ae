package org.javai.mathast.ast;

import java.util.List;
import java.util.Objects;
import org.javai.mathast.IncorrectArityException;
import org.javai.mathast.operator.FunctionOperator;

/**
 * A function call with its arguments in source order.
 */
public record FunctionOperatorNode(FunctionOperator operator, List<MathNode> arguments, Span span)
		implements OperatorNode {

	public FunctionOperatorNode {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(span, "span must not be null");
		arguments = List.copyOf(arguments);
		if (arguments.size() != operator.arity()) {
			throw new IncorrectArityException(operator, arguments.size());
		}
	}

	@Override
	public NodeType type() {
		return NodeType.FUNCTION_OPERATOR;
	}

	@Override
	public List<MathNode> children() {
		return arguments;
	}

	@Override
	public <R> R accept(MathNodeVisitor<R> visitor) {
		return visitor.visitFunction(this);
	}
}
