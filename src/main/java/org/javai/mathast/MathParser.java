package org.javai.mathast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.mathast.ast.MathNode;
import org.javai.mathast.ast.MathNodeWalker;
import org.javai.mathast.ast.Span;
import org.javai.mathast.operator.CoreOperators;
import org.javai.mathast.operator.FunctionOperator;
import org.javai.mathast.operator.Operator;
import org.javai.mathast.operator.OperatorCatalog;
import org.javai.mathast.operator.OperatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses math expressions into {@link MathNode} trees.
 * <p>
 * The parser walks the text with a cursor, skipping whitespace. At each
 * position it tries, in this order: a literal, {@code (}, {@code )} or
 * {@code ,}, the registered unary operators, the built-in unary minus (only
 * where a minus cannot be a subtraction), the binary operators, the function
 * operators, and finally a single-letter variable. The first claim wins and is
 * handed to an {@link OperatorProcessor}, which resolves precedence.
 *
 * <pre>
 * MathNode tree = MathParser.parseWithDefaults("3x^2 + sin(y)");
 *
 * MathParser parser = new MathParser(ParserConfig.builder().validVariables(List.of("x")).build());
 * parser.addOperator(new UnaryOperator("Factorial", "!"));
 * MathNode other = parser.parse("!(x + 1)");
 * </pre>
 * <p>
 * A parser may be reused for any number of expressions. It is not safe to
 * call {@link #addOperator(Operator)} while another thread is parsing.
 */
public class MathParser {

	private static final Logger logger = LoggerFactory.getLogger(MathParser.class);

	private final ParserConfig config;
	private final OperatorRegistry registry;

	/**
	 * Creates a parser with default options and the built-in operators.
	 */
	public MathParser() {
		this(ParserConfig.defaults());
	}

	public MathParser(ParserConfig config) {
		this(config, OperatorCatalog.defaults());
	}

	/**
	 * Creates a parser whose operators are seeded from {@code catalog} instead of the built-in table.
	 *
	 * @param config the parser options
	 * @param catalog the operators available before any {@link #addOperator(Operator)} call
	 */
	public MathParser(ParserConfig config, OperatorCatalog catalog) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.registry = new OperatorRegistry(catalog);
	}

	/**
	 * Creates a parser from a loaded definition.
	 */
	public static MathParser fromDefinition(ParserDefinition definition) {
		Objects.requireNonNull(definition, "definition must not be null");
		return new MathParser(definition.config(), definition.catalog());
	}

	/**
	 * Parses {@code text} with a parser using default options.
	 */
	public static MathNode parseWithDefaults(String text) {
		return new MathParser().parse(text);
	}

	/**
	 * Registers an additional operator. Within its kind it is tried after every
	 * operator already known to this parser.
	 */
	public void addOperator(Operator operator) {
		registry.register(operator);
	}

	public ParserConfig config() {
		return config;
	}

	public OperatorRegistry registry() {
		return registry;
	}

	/**
	 * Parses a single expression.
	 *
	 * @param text the expression
	 * @return the root of the syntax tree
	 * @throws MathParseException if the text is not a valid expression
	 */
	public MathNode parse(String text) {
		Objects.requireNonNull(text, "text must not be null");
		logger.debug("Parsing expression '{}'", text);

		OperatorProcessor processor = new OperatorProcessor(config);
		int cursor = 0;
		while (cursor < text.length()) {
			Optional<ClaimToken> whitespace = ClaimTokenScanner.whitespace(text, cursor);
			if (whitespace.isPresent()) {
				cursor = whitespace.get().end();
				continue;
			}
			processor.startPass();
			cursor = processToken(processor, text, cursor);
		}

		MathNode root = processor.done();
		if (logger.isDebugEnabled()) {
			logger.debug("Parsed '{}' into {} node(s)", text, MathNodeWalker.count(root));
		}
		return root;
	}

	/**
	 * Claims the token at {@code cursor}, feeds it to the processor and returns the new cursor.
	 */
	private int processToken(OperatorProcessor processor, String text, int cursor) {
		Optional<ClaimToken> literal = ClaimTokenScanner.literal(text, cursor);
		if (literal.isPresent()) {
			ClaimToken token = literal.get();
			double value = Double.parseDouble(token.text(text));
			if (Double.isInfinite(value)) {
				throw new MathSyntaxException("Literal '" + token.text(text) + "' at position " + cursor
						+ " is too large to represent");
			}
			processor.addLiteral(value, token.toSpan());
			return token.end();
		}

		char c = text.charAt(cursor);
		if (c == '(') {
			processor.addOpenParens(new Span(cursor, cursor + 1));
			return cursor + 1;
		}

		CloseSymbol closeSymbol = CloseSymbol.of(c);
		if (closeSymbol != null) {
			processor.addCloseSymbol(closeSymbol, new Span(cursor, cursor + 1));
			return cursor + 1;
		}

		Optional<ClaimToken> unary = claimOperator(processor, registry.unaryOperators(), text, cursor);
		if (unary.isPresent()) {
			return unary.get().end();
		}

		if (processor.shouldProcessMinusAsUnary()) {
			Optional<ClaimToken> minus = ClaimTokenScanner.operator(CoreOperators.UNARY_MINUS, text, cursor);
			if (minus.isPresent()) {
				processor.addOperator(CoreOperators.UNARY_MINUS, minus.get().toSpan());
				return minus.get().end();
			}
		}

		Optional<ClaimToken> binary = claimOperator(processor, registry.binaryOperators(), text, cursor);
		if (binary.isPresent()) {
			return binary.get().end();
		}

		for (FunctionOperator function : registry.functionOperators()) {
			Optional<ClaimToken> claim = ClaimTokenScanner.operator(function, text, cursor);
			if (claim.isPresent()) {
				int end = claim.get().end();
				if (end >= text.length() || text.charAt(end) != '(') {
					throw new BadParensException("Expected '(' after function '" + function.name()
							+ "' at position " + end);
				}
				// The opening parenthesis belongs to the call.
				processor.addOperator(function, new Span(cursor, end + 1));
				return end + 1;
			}
		}

		Optional<ClaimToken> variable = ClaimTokenScanner.variable(config, text, cursor);
		if (variable.isPresent()) {
			ClaimToken token = variable.get();
			processor.addVariable(token.text(text), token.toSpan());
			return token.end();
		}

		if (ClaimTokenScanner.isAsciiLetter(c) && config.restrictsVariables()) {
			throw new UnknownVariableException(String.valueOf(c), cursor);
		}
		throw new MathSyntaxException("Unexpected token '" + c + "' at position " + cursor);
	}

	/**
	 * Feeds the first operator of {@code candidates} whose symbol starts at the cursor.
	 */
	private static Optional<ClaimToken> claimOperator(OperatorProcessor processor,
			List<? extends Operator> candidates, String text, int cursor) {
		for (Operator operator : candidates) {
			Optional<ClaimToken> claim = ClaimTokenScanner.operator(operator, text, cursor);
			if (claim.isPresent()) {
				processor.addOperator(operator, claim.get().toSpan());
				return claim;
			}
		}
		return Optional.empty();
	}
}
