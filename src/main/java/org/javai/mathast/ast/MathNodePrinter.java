package org.javai.mathast.ast;

import java.util.stream.Collectors;

/**
 * Renders a tree back to a fully parenthesized infix expression.
 * <p>
 * Every binary and unary application gets its own parentheses, so the grouping
 * the parser chose is visible: {@code 1 + 2 * 3} prints as {@code (1 + (2 * 3))}.
 * Implicit products print with their {@code *} symbol.
 */
public class MathNodePrinter implements MathNodeVisitor<String> {

	private static final MathNodePrinter INSTANCE = new MathNodePrinter();

	/**
	 * Static convenience method to print a node.
	 */
	public static String print(MathNode node) {
		return node.accept(INSTANCE);
	}

	@Override
	public String visitLiteral(LiteralNode node) {
		double value = node.value();
		if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}

	@Override
	public String visitVariable(VariableNode node) {
		return node.name();
	}

	@Override
	public String visitUnary(UnaryOperatorNode node) {
		return "(" + node.operator().symbol() + node.operand().accept(this) + ")";
	}

	@Override
	public String visitBinary(BinaryOperatorNode node) {
		return "(" + node.left().accept(this) + " " + node.operator().symbol() + " "
				+ node.right().accept(this) + ")";
	}

	@Override
	public String visitFunction(FunctionOperatorNode node) {
		return node.operator().symbol() + node.arguments().stream()
				.map(argument -> argument.accept(this))
				.collect(Collectors.joining(", ", "(", ")"));
	}
}
