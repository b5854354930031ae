package org.javai.mathast.ast;

import java.util.List;
import java.util.Objects;
import org.javai.mathast.IncorrectArityException;
import org.javai.mathast.operator.BinaryOperator;
import org.javai.mathast.operator.FunctionOperator;
import org.javai.mathast.operator.Operator;
import org.javai.mathast.operator.OperatorVisitor;
import org.javai.mathast.operator.UnaryOperator;

/**
 * Factory methods building nodes from already reduced children.
 * <p>
 * Operator nodes are checked against the operator's arity before they are
 * built; a mismatch throws {@link IncorrectArityException} rather than
 * dropping or padding children.
 */
public final class MathNodes {

	private MathNodes() {
	}

	public static LiteralNode literal(double value, Span span) {
		return new LiteralNode(value, span);
	}

	public static VariableNode variable(String name, Span span) {
		return new VariableNode(name, span);
	}

	/**
	 * Builds the node for {@code operator} applied to {@code children}.
	 *
	 * @param operator the operator being reduced
	 * @param children the operands, leftmost first
	 * @param span the source offsets covered by the operator and its operands
	 * @return the operator node
	 * @throws IncorrectArityException if the number of children differs from the operator's arity
	 */
	public static OperatorNode operator(Operator operator, List<MathNode> children, Span span) {
		Objects.requireNonNull(operator, "operator must not be null");
		Objects.requireNonNull(children, "children must not be null");
		if (children.size() != operator.arity()) {
			throw new IncorrectArityException(operator, children.size());
		}
		return operator.accept(new OperatorVisitor<OperatorNode>() {
			@Override
			public OperatorNode visitUnary(UnaryOperator unary) {
				return new UnaryOperatorNode(unary, children.get(0), span);
			}

			@Override
			public OperatorNode visitBinary(BinaryOperator binary) {
				return new BinaryOperatorNode(binary, children.get(0), children.get(1), span);
			}

			@Override
			public OperatorNode visitFunction(FunctionOperator function) {
				return new FunctionOperatorNode(function, children, span);
			}
		});
	}
}
