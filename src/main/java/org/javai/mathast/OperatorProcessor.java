package org.javai.mathast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.mathast.ast.MathNode;
import org.javai.mathast.ast.MathNodes;
import org.javai.mathast.ast.Span;
import org.javai.mathast.operator.BinaryOperator;
import org.javai.mathast.operator.CoreOperators;
import org.javai.mathast.operator.FunctionOperator;
import org.javai.mathast.operator.Operator;
import org.javai.mathast.operator.OperatorVisitor;
import org.javai.mathast.operator.UnaryOperator;

/**
 * Operator-precedence stack machine turning a left-to-right token stream into a tree.
 * <p>
 * The parser hands over one token per pass. Completed subtrees live on the node
 * stack; operators still waiting for operands, and the markers opening
 * parenthesized groups and function calls, live on the operator stack.
 * <p>
 * The kind of token added on the previous pass decides two things: whether a
 * {@code -} is negation or subtraction, and whether two adjacent operands are
 * joined by an implicit product.
 * <p>
 * One instance handles one expression; it cannot be reused after {@link #done()}.
 */
final class OperatorProcessor {

	private static final Set<TokenKind> IMPLICIT_MULTIPLY_LEFT =
			EnumSet.of(TokenKind.CLOSE_PARENS, TokenKind.VARIABLE, TokenKind.LITERAL);

	private static final Set<TokenKind> IMPLICIT_MULTIPLY_RIGHT = EnumSet.of(
			TokenKind.OPEN_PARENS,
			TokenKind.UNARY_OPERATOR,
			TokenKind.FUNCTION_OPERATOR,
			TokenKind.LITERAL,
			TokenKind.VARIABLE);

	private final ParserConfig config;
	private final Deque<MathNode> nodes = new ArrayDeque<>();
	private final Deque<StackEntry> operators = new ArrayDeque<>();

	private TokenKind kindAddedCurrentPass;
	private TokenKind kindAddedLastPass;
	private boolean done;

	OperatorProcessor(ParserConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	/**
	 * Called by the parser before it hands over the next token.
	 */
	void startPass() {
		if (done) {
			throw new IllegalStateException("Cannot add tokens after the expression is complete");
		}
		kindAddedLastPass = kindAddedCurrentPass;
		kindAddedCurrentPass = null;
	}

	/**
	 * Reduces everything left on the operator stack and returns the single root.
	 *
	 * @throws BadParensException if a parenthesis or function call was never closed
	 * @throws MathSyntaxException if the tokens do not form exactly one expression
	 */
	MathNode done() {
		if (done) {
			throw new IllegalStateException("Expression is already complete");
		}
		done = true;

		StackEntry marker = innermostMarker();
		if (marker instanceof StackEntry.OpenParens open) {
			throw new BadParensException(
					"Unmatched '(' at position " + open.span().start() + ": reached end of input");
		} else if (marker instanceof StackEntry.FunctionCall call) {
			throw new BadParensException("Unclosed call to function '" + call.operator().name()
					+ "' at position " + call.span().start() + ": reached end of input");
		}

		while (!operators.isEmpty()) {
			reduce((StackEntry.Pending) operators.pop());
		}

		if (nodes.size() != 1) {
			throw new MathSyntaxException("Invalid equation");
		}
		return nodes.pop();
	}

	/**
	 * Whether a {@code -} read on the current pass negates rather than subtracts.
	 * Only a literal or a closing parenthesis on the previous pass makes it a subtraction.
	 */
	boolean shouldProcessMinusAsUnary() {
		return kindAddedLastPass != TokenKind.LITERAL && kindAddedLastPass != TokenKind.CLOSE_PARENS;
	}

	void addLiteral(double value, Span span) {
		kindAddedCurrentPass = TokenKind.LITERAL;
		maybeImplicitMultiply(span);
		nodes.push(MathNodes.literal(value, span));
	}

	void addVariable(String name, Span span) {
		kindAddedCurrentPass = TokenKind.VARIABLE;
		maybeImplicitMultiply(span);
		nodes.push(MathNodes.variable(name, span));
	}

	/**
	 * Adds an operator. For a function, {@code span} covers the symbol and its
	 * opening parenthesis, which the parser consumes together.
	 */
	void addOperator(Operator operator, Span span) {
		operator.accept(new OperatorVisitor<Void>() {
			@Override
			public Void visitUnary(UnaryOperator unary) {
				addUnaryOperator(unary, span);
				return null;
			}

			@Override
			public Void visitBinary(BinaryOperator binary) {
				addBinaryOperator(binary, span, false);
				return null;
			}

			@Override
			public Void visitFunction(FunctionOperator function) {
				addFunctionOperator(function, span);
				return null;
			}
		});
	}

	void addOpenParens(Span span) {
		kindAddedCurrentPass = TokenKind.OPEN_PARENS;
		maybeImplicitMultiply(span);
		operators.push(new StackEntry.OpenParens(span, nodes.size()));
	}

	/**
	 * Ends the innermost group ({@code )}) or the current function argument ({@code ,}).
	 * The group is matched first; everything pending since it opened is then
	 * reduced unconditionally.
	 */
	void addCloseSymbol(CloseSymbol symbol, Span span) {
		kindAddedCurrentPass = symbol.kind();
		maybeImplicitMultiply(span);

		StackEntry marker = innermostMarker();
		if (symbol == CloseSymbol.COMMA && !(marker instanceof StackEntry.FunctionCall)) {
			throw new BadParensException("Unexpected ',' at position " + span.start()
					+ ": argument separators are only allowed in a function call");
		}
		if (marker == null) {
			throw new BadParensException("Unexpected ')' at position " + span.start()
					+ ": no matching opening parenthesis");
		}

		while (operators.peek() instanceof StackEntry.Pending pending) {
			operators.pop();
			reduce(pending);
		}

		if (marker instanceof StackEntry.FunctionCall call) {
			closeFunctionOperand(call, symbol, span);
		} else if (marker instanceof StackEntry.OpenParens open) {
			operators.pop();
			if (nodes.size() - open.nodeDepth() != 1) {
				throw new MathSyntaxException("Empty or incomplete expression in parentheses opened at position "
						+ open.span().start());
			}
		}
	}

	private void addUnaryOperator(UnaryOperator operator, Span span) {
		kindAddedCurrentPass = TokenKind.UNARY_OPERATOR;
		maybeImplicitMultiply(span);
		operators.push(new StackEntry.Pending(operator, span));
	}

	/**
	 * Adds a binary operator after reducing every pending operator that binds at
	 * least as tightly (strictly more tightly when right associative). A silent
	 * add does not record the pass as a binary operator; implicit products use it
	 * so the token being processed keeps its own kind.
	 */
	private void addBinaryOperator(BinaryOperator operator, Span span, boolean silent) {
		if (!silent) {
			kindAddedCurrentPass = TokenKind.BINARY_OPERATOR;
		}

		while (operators.peek() instanceof StackEntry.Pending pending && reducesBefore(pending.operator(), operator)) {
			operators.pop();
			reduce(pending);
		}

		operators.push(new StackEntry.Pending(operator, span));
	}

	private void addFunctionOperator(FunctionOperator operator, Span span) {
		kindAddedCurrentPass = TokenKind.FUNCTION_OPERATOR;
		maybeImplicitMultiply(span);
		operators.push(new StackEntry.FunctionCall(operator, span, nodes.size(), operator.arity()));
	}

	private void closeFunctionOperand(StackEntry.FunctionCall call, CloseSymbol symbol, Span span) {
		FunctionOperator function = call.operator();
		int operandsInCall = nodes.size() - call.nodeDepth();

		if (operandsInCall == call.completedOperands()) {
			throw new MathSyntaxException("Missing argument for function '" + function.name()
					+ "' at position " + span.start());
		}
		if (operandsInCall != call.completedOperands() + 1) {
			throw new MathSyntaxException("Expected ',' or ')' between arguments of function '"
					+ function.name() + "' before position " + span.start());
		}

		if (symbol == CloseSymbol.COMMA) {
			if (call.remainingOperands() <= 1) {
				throw new IncorrectArityException(function, function.arity() + 1);
			}
			operators.pop();
			operators.push(call.withOperandCompleted());
			return;
		}

		if (call.remainingOperands() != 1) {
			throw new IncorrectArityException(function, call.completedOperands() + 1);
		}
		operators.pop();
		List<MathNode> arguments = popNodes(function.arity());
		nodes.push(MathNodes.operator(function, arguments, new Span(call.span().start(), span.end())));
	}

	private boolean reducesBefore(Operator pending, BinaryOperator incoming) {
		int pendingPower = bindingPower(pending);
		int incomingPower = incoming.precedence().value();
		return config.leftAssociative() ? pendingPower >= incomingPower : pendingPower > incomingPower;
	}

	/**
	 * Unary operators bind tighter than any binary operator.
	 */
	private static int bindingPower(Operator operator) {
		return operator.accept(new OperatorVisitor<Integer>() {
			@Override
			public Integer visitUnary(UnaryOperator unary) {
				return Integer.MAX_VALUE;
			}

			@Override
			public Integer visitBinary(BinaryOperator binary) {
				return binary.precedence().value();
			}

			@Override
			public Integer visitFunction(FunctionOperator function) {
				throw new IllegalStateException(
						"Function '" + function.name() + "' is reduced at its closing parenthesis, never by precedence");
			}
		});
	}

	private void maybeImplicitMultiply(Span current) {
		if (config.implicitMultiply()
				&& IMPLICIT_MULTIPLY_LEFT.contains(kindAddedLastPass)
				&& IMPLICIT_MULTIPLY_RIGHT.contains(kindAddedCurrentPass)) {
			addBinaryOperator(CoreOperators.PRODUCT, Span.at(current.start()), true);
		}
	}

	private void reduce(StackEntry.Pending pending) {
		Operator operator = pending.operator();
		int available = nodes.size() - groupDepth();
		if (available < operator.arity()) {
			throw new MathSyntaxException("Missing operand for operator '" + operator.name()
					+ "' at position " + pending.span().start());
		}

		List<MathNode> children = popNodes(operator.arity());
		Span span = pending.span();
		for (MathNode child : children) {
			span = span.union(child.span());
		}
		nodes.push(MathNodes.operator(operator, children, span));
	}

	/**
	 * Node stack size when the innermost open group started, or zero at top level.
	 */
	private int groupDepth() {
		StackEntry marker = innermostMarker();
		if (marker instanceof StackEntry.OpenParens open) {
			return open.nodeDepth();
		}
		if (marker instanceof StackEntry.FunctionCall call) {
			return call.nodeDepth();
		}
		return 0;
	}

	/**
	 * The open parenthesis or function call nearest the top of the operator stack, or {@code null}.
	 */
	private StackEntry innermostMarker() {
		for (StackEntry entry : operators) {
			if (!(entry instanceof StackEntry.Pending)) {
				return entry;
			}
		}
		return null;
	}

	/**
	 * Pops {@code count} nodes, returning them leftmost first.
	 */
	private List<MathNode> popNodes(int count) {
		MathNode[] popped = new MathNode[count];
		for (int i = count - 1; i >= 0; i--) {
			popped[i] = nodes.pop();
		}
		return List.of(popped);
	}
}
