package org.javai.mathast.operator;

import java.util.List;

/**
 * The built-in operator table every parser starts from.
 * <p>
 * {@link #UNARY_MINUS} is not part of {@link #ALL}: the parser
 * decides between negation and subtraction from context and only tries it
 * after the ordinary unary operators.
 */
public final class CoreOperators {

	public static final BinaryOperator DIFFERENCE = new BinaryOperator("Difference", "-", OperatorPrecedence.NORMAL);
	public static final BinaryOperator EXPONENT = new BinaryOperator("Exponent", "^", OperatorPrecedence.HIGH);
	public static final BinaryOperator PRODUCT = new BinaryOperator("Product", "*", OperatorPrecedence.MEDIUM);
	public static final BinaryOperator QUOTIENT = new BinaryOperator("Quotient", "/", OperatorPrecedence.MEDIUM);
	public static final BinaryOperator SUM = new BinaryOperator("Sum", "+", OperatorPrecedence.NORMAL);

	/**
	 * Written {@code cos}. The symbol {@code cosin} is not recognized; since {@code cos}
	 * is a prefix of it, {@code cosin(0)} fails with a missing {@code (} after {@code cos}.
	 */
	public static final FunctionOperator COSINE = new FunctionOperator("Cosine", "cos", 1);
	public static final FunctionOperator LOG10 = new FunctionOperator("Log10", "log", 1);
	public static final FunctionOperator POWER = new FunctionOperator("Power", "pow", 2);
	public static final FunctionOperator SINE = new FunctionOperator("Sine", "sin", 1);
	public static final FunctionOperator TANGENT = new FunctionOperator("Tangent", "tan", 1);

	public static final UnaryOperator UNARY_MINUS = new UnaryOperator("Minus", "-");

	/**
	 * Catalogue order; within a kind this is the order symbols are tried in.
	 */
	public static final List<Operator> ALL = List.of(
			COSINE,
			DIFFERENCE,
			EXPONENT,
			LOG10,
			POWER,
			PRODUCT,
			QUOTIENT,
			SINE,
			SUM,
			TANGENT
	);

	private CoreOperators() {
	}
}
