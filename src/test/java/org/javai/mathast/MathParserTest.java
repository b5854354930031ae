package org.javai.mathast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.mathast.ast.BinaryOperatorNode;
import org.javai.mathast.ast.FunctionOperatorNode;
import org.javai.mathast.ast.LiteralNode;
import org.javai.mathast.ast.MathNode;
import org.javai.mathast.ast.MathNodePrinter;
import org.javai.mathast.ast.MathNodeWalker;
import org.javai.mathast.ast.Span;
import org.javai.mathast.ast.UnaryOperatorNode;
import org.javai.mathast.ast.VariableNode;
import org.javai.mathast.operator.BinaryOperator;
import org.javai.mathast.operator.CoreOperators;
import org.javai.mathast.operator.FunctionOperator;
import org.javai.mathast.operator.OperatorCatalog;
import org.javai.mathast.operator.OperatorPrecedence;
import org.javai.mathast.operator.UnaryOperator;
import org.javai.mathast.testsupport.LogCapture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MathParser Tests")
class MathParserTest {

	private static final UnaryOperator BLAH = new UnaryOperator("Blah", "$");

	private static String shape(String text) {
		return MathNodePrinter.print(MathParser.parseWithDefaults(text));
	}

	private static String shape(MathParser parser, String text) {
		return MathNodePrinter.print(parser.parse(text));
	}

	private static MathParser parserWithBlah() {
		MathParser parser = new MathParser();
		parser.addOperator(BLAH);
		return parser;
	}

	@Nested
	@DisplayName("Literals and variables")
	class Leaves {

		@Test
		void parsesNumberLiterals() {
			assertThat(MathParser.parseWithDefaults("2")).isEqualTo(new LiteralNode(2, new Span(0, 1)));
			assertThat(MathParser.parseWithDefaults("1.12")).isEqualTo(new LiteralNode(1.12, new Span(0, 4)));
			assertThat(MathParser.parseWithDefaults(".12")).isEqualTo(new LiteralNode(0.12, new Span(0, 3)));
		}

		@Test
		void parsesExponentSuffix() {
			MathNode node = MathParser.parseWithDefaults("6.02e23");

			assertThat(node).isInstanceOf(LiteralNode.class);
			assertThat(((LiteralNode) node).value()).isEqualTo(6.02e23);
		}

		@Test
		void parsesVariable() {
			assertThat(MathParser.parseWithDefaults("x")).isEqualTo(new VariableNode("x", new Span(0, 1)));
			assertThat(shape("1 + x")).isEqualTo("(1 + x)");
		}

		@Test
		void ignoresSurroundingWhitespace() {
			assertThat(MathParser.parseWithDefaults("  12\t")).isEqualTo(new LiteralNode(12, new Span(2, 4)));
		}
	}

	@Nested
	@DisplayName("Binary operators and precedence")
	class Precedence {

		@ParameterizedTest
		@CsvSource(delimiter = '|', value = {
				"2 + 3      | (2 + 3)",
				"2 - 3      | (2 - 3)",
				"2 * 3.1    | (2 * 3.1)",
				".12 / .48  | (0.12 / 0.48)",
				"1.1 ^ 3    | (1.1 ^ 3)"
		})
		void parsesCoreBinaryOperators(String text, String expected) {
			assertThat(shape(text)).isEqualTo(expected);
		}

		@Test
		void usesOperatorDisplayNames() {
			BinaryOperatorNode node = (BinaryOperatorNode) MathParser.parseWithDefaults("2 - 3");

			assertThat(node.name()).isEqualTo("Difference");
			assertThat(node.operator()).isEqualTo(CoreOperators.DIFFERENCE);
			assertThat(node.left()).isEqualTo(new LiteralNode(2, new Span(0, 1)));
			assertThat(node.right()).isEqualTo(new LiteralNode(3, new Span(4, 5)));
		}

		@Test
		void givesMultiplicationHigherPrecedenceThanAddition() {
			assertThat(shape("1 + 2 * 3")).isEqualTo("(1 + (2 * 3))");
			assertThat(shape("1 * 2 + 3")).isEqualTo("((1 * 2) + 3)");
		}

		@Test
		void givesExponentHigherPrecedenceThanMultiplication() {
			assertThat(shape("1 + 2 ^ 3")).isEqualTo("(1 + (2 ^ 3))");
			assertThat(shape("1 ^ 2 + 3")).isEqualTo("((1 ^ 2) + 3)");
			assertThat(shape("2 * 3 ^ 4")).isEqualTo("(2 * (3 ^ 4))");
		}

		@Test
		void parenthesesOverridePrecedence() {
			assertThat(shape("(1 + 2) * 3")).isEqualTo("((1 + 2) * 3)");
			assertThat(shape("(1)")).isEqualTo("1");
			assertThat(shape("((1))")).isEqualTo("1");
		}
	}

	@Nested
	@DisplayName("Associativity")
	class Associativity {

		@Test
		void groupsLeftByDefault() {
			assertThat(shape("1 + 2 + 3")).isEqualTo("((1 + 2) + 3)");
			assertThat(shape("8 / 4 / 2")).isEqualTo("((8 / 4) / 2)");
		}

		@Test
		void groupsRightWhenConfigured() {
			MathParser parser = new MathParser(ParserConfig.builder().leftAssociative(false).build());

			assertThat(shape(parser, "1 + 2 + 3")).isEqualTo("(1 + (2 + 3))");
			assertThat(shape(parser, "2 ^ 3 ^ 2")).isEqualTo("(2 ^ (3 ^ 2))");
		}

		@Test
		void rightAssociativityStillRespectsPrecedence() {
			MathParser parser = new MathParser(ParserConfig.builder().leftAssociative(false).build());

			assertThat(shape(parser, "1 * 2 + 3")).isEqualTo("((1 * 2) + 3)");
		}
	}

	@Nested
	@DisplayName("Implicit multiplication")
	class ImplicitMultiply {

		@Test
		void worksBetweenVariableAndLiteral() {
			assertThat(shape("3x")).isEqualTo("(3 * x)");
			assertThat(shape("x3")).isEqualTo("(x * 3)");
		}

		@Test
		void worksBetweenVariables() {
			assertThat(shape("xy")).isEqualTo("(x * y)");
		}

		@Test
		void worksBetweenComplexOperations() {
			assertThat(shape("x^2y^2")).isEqualTo("((x ^ 2) * (y ^ 2))");
		}

		@Test
		void worksWithParentheses() {
			assertThat(shape("(1)(2)")).isEqualTo("(1 * 2)");
			assertThat(shape("1(2)")).isEqualTo("(1 * 2)");
			assertThat(shape("(1)2")).isEqualTo("(1 * 2)");
		}

		@Test
		void worksWithFunctionOperators() {
			assertThat(shape("xsin(y)")).isEqualTo("(x * sin(y))");
		}

		@Test
		void usesTheProductOperator() {
			BinaryOperatorNode node = (BinaryOperatorNode) MathParser.parseWithDefaults("3x");

			assertThat(node.operator()).isEqualTo(CoreOperators.PRODUCT);
			assertThat(node.span()).isEqualTo(new Span(0, 2));
		}

		@Test
		void canBeDisabled() {
			MathParser parser = new MathParser(ParserConfig.builder().implicitMultiply(false).build());

			assertThatThrownBy(() -> parser.parse("xy")).isInstanceOf(MathSyntaxException.class);
			assertThatThrownBy(() -> parser.parse("3x")).isInstanceOf(MathSyntaxException.class);
			assertThat(shape(parser, "3 * x")).isEqualTo("(3 * x)");
		}
	}

	@Nested
	@DisplayName("Unary minus")
	class UnaryMinus {

		@Test
		void parsesLeadingMinusAsNegation() {
			UnaryOperatorNode node = (UnaryOperatorNode) MathParser.parseWithDefaults("-3");

			assertThat(node.operator()).isEqualTo(CoreOperators.UNARY_MINUS);
			assertThat(node.name()).isEqualTo("Minus");
			assertThat(node.operand()).isEqualTo(new LiteralNode(3, new Span(1, 2)));
		}

		@Test
		void parsesNegationWithParentheses() {
			assertThat(shape("(-3)")).isEqualTo("(-3)");
			assertThat(shape("-(4)")).isEqualTo("(-4)");
		}

		@Test
		void parsesNegationAfterBinaryOperator() {
			assertThat(shape("4 - -3")).isEqualTo("(4 - (-3))");
			assertThat(shape("2 ^ -3")).isEqualTo("(2 ^ (-3))");
		}

		@Test
		void parsesConsecutiveNegations() {
			assertThat(shape("--12")).isEqualTo("(-(-12))");
		}

		@Test
		void parsesNegationOfFunctionCall() {
			assertThat(shape("-sin(3.14)")).isEqualTo("(-sin(3.14))");
		}

		@Test
		void negationBindsTighterThanBinaryOperators() {
			assertThat(shape("-2 + 3")).isEqualTo("((-2) + 3)");
		}

		@Test
		void minusAfterLiteralOrClosingParenthesisSubtracts() {
			assertThat(shape("(1) - 2")).isEqualTo("(1 - 2)");
			assertThat(shape("1 - 2")).isEqualTo("(1 - 2)");
		}

		@Test
		void minusAfterVariableIsNegationJoinedByImplicitProduct() {
			assertThat(shape("x - 3")).isEqualTo("(x * (-3))");
		}

		@Test
		void registeringTheBuiltInMinusLeavesSubtractionIntact() {
			MathParser parser = new MathParser();
			parser.addOperator(CoreOperators.UNARY_MINUS);

			assertThat(shape(parser, "2 - 3")).isEqualTo("(2 - 3)");
		}
	}

	@Nested
	@DisplayName("Function operators")
	class Functions {

		@ParameterizedTest
		@CsvSource(delimiter = '|', value = {
				"log(1)     | log(1)      | Log10",
				"sin(0)     | sin(0)      | Sine",
				"cos(0)     | cos(0)      | Cosine",
				"tan(1)     | tan(1)      | Tangent",
				"pow(1, 2)  | pow(1, 2)   | Power"
		})
		void parsesCoreFunctions(String text, String expected, String name) {
			FunctionOperatorNode node = (FunctionOperatorNode) MathParser.parseWithDefaults(text);

			assertThat(MathNodePrinter.print(node)).isEqualTo(expected);
			assertThat(node.name()).isEqualTo(name);
		}

		@Test
		void reducesExpressionsInsideArguments() {
			assertThat(shape("pow(1 + 2, 3 * 4)")).isEqualTo("pow((1 + 2), (3 * 4))");
			assertThat(shape("sin((x))")).isEqualTo("sin(x)");
		}

		@Test
		void supportsNestedCalls() {
			assertThat(shape("pow(sin(x), 2)")).isEqualTo("pow(sin(x), 2)");
			assertThat(shape("pow(2, pow(3, 4))")).isEqualTo("pow(2, pow(3, 4))");
		}

		@Test
		void spansTheSymbolThroughTheClosingParenthesis() {
			assertThat(MathParser.parseWithDefaults("sin(x)").span()).isEqualTo(new Span(0, 6));
			assertThat(MathParser.parseWithDefaults("1 + pow(2, 3)").children().get(1).span())
					.isEqualTo(new Span(4, 13));
		}

		@ParameterizedTest
		@ValueSource(strings = {"sin 1", "sinx", "log", "3 + tan"})
		void requiresOpeningParenthesis(String text) {
			assertThatThrownBy(() -> MathParser.parseWithDefaults(text))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Expected '('");
		}

		@Test
		void doesNotRecognizeLongCosineSpelling() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("cosin(0)"))
					.isInstanceOf(BadParensException.class)
					.hasMessage("Expected '(' after function 'Cosine' at position 3");
		}

		@Test
		void rejectsTooManyArguments() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("sin(1, 2)"))
					.isInstanceOf(IncorrectArityException.class)
					.hasMessageContaining("Sine");
		}

		@Test
		void rejectsTooFewArguments() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("pow(1)"))
					.isInstanceOf(IncorrectArityException.class)
					.satisfies(e -> {
						IncorrectArityException arity = (IncorrectArityException) e;
						assertThat(arity.expected()).isEqualTo(2);
						assertThat(arity.actual()).isEqualTo(1);
					});
		}

		@ParameterizedTest
		@ValueSource(strings = {"sin()", "pow(1,)", "pow(,1)"})
		void rejectsEmptyArguments(String text) {
			assertThatThrownBy(() -> MathParser.parseWithDefaults(text))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessageContaining("Missing argument");
		}
	}

	@Nested
	@DisplayName("Variable whitelist")
	class ValidVariables {

		private final MathParser parser = new MathParser(
				ParserConfig.builder().validVariables(List.of("x", "y")).build());

		@Test
		void acceptsListedVariables() {
			assertThat(shape(parser, "tan(x + y)")).isEqualTo("tan((x + y))");
		}

		@Test
		void rejectsOtherVariables() {
			assertThatThrownBy(() -> parser.parse("tan(x + z)"))
					.isInstanceOf(UnknownVariableException.class)
					.isInstanceOf(MathSyntaxException.class)
					.hasMessageContaining("'z' at position 8");
		}

		@Test
		void functionSymbolsAreNotVariables() {
			assertThat(shape(parser, "sin(x)")).isEqualTo("sin(x)");
		}
	}

	@Nested
	@DisplayName("Custom operators")
	class CustomOperators {

		@Test
		void registersCustomOperatorsWithTheParser() {
			MathParser parser = parserWithBlah();

			assertThat(parser.registry().unaryOperators()).containsExactly(BLAH);
			assertThat(new MathParser().registry().unaryOperators()).isEmpty();
		}

		@Test
		void supportsCustomUnaryOperators() {
			UnaryOperatorNode node = (UnaryOperatorNode) parserWithBlah().parse("$1");

			assertThat(node.operator()).isEqualTo(BLAH);
			assertThat(node.operand()).isEqualTo(new LiteralNode(1, new Span(1, 2)));
		}

		@Test
		void parsesCustomUnaryWithParentheses() {
			MathParser parser = parserWithBlah();

			assertThat(shape(parser, "$(1)")).isEqualTo("($1)");
			assertThat(shape(parser, "($1)")).isEqualTo("($1)");
		}

		@Test
		void customUnaryBindsTighterThanBinaryOperators() {
			MathParser parser = parserWithBlah();

			assertThat(shape(parser, "$1 + 2")).isEqualTo("(($1) + 2)");
			assertThat(shape(parser, "1 + $2")).isEqualTo("(1 + ($2))");
			assertThat(shape(parser, "$1 + 2 * 3")).isEqualTo("(($1) + (2 * 3))");
		}

		@Test
		void parsesComplicatedExpressionsNestedInsideCustomUnary() {
			assertThat(shape(parserWithBlah(), "$(1 + 2sin(x))")).isEqualTo("($(1 + (2 * sin(x))))");
		}

		@Test
		void customUnaryTakesPartInImplicitMultiplication() {
			assertThat(shape(parserWithBlah(), "2$1")).isEqualTo("(2 * ($1))");
		}

		@Test
		void supportsCustomBinaryOperators() {
			MathParser parser = new MathParser();
			parser.addOperator(new BinaryOperator("Modulo", "%", OperatorPrecedence.MEDIUM));

			assertThat(shape(parser, "7 % 3 + 1")).isEqualTo("((7 % 3) + 1)");
		}

		@Test
		void supportsCustomFunctions() {
			MathParser parser = new MathParser();
			parser.addOperator(new FunctionOperator("Maximum", "max", 3));

			assertThat(shape(parser, "max(1, x, 2y)")).isEqualTo("max(1, x, (2 * y))");
		}

		@Test
		void firstRegisteredSymbolWins() {
			BinaryOperator power = new BinaryOperator("Power", "**", OperatorPrecedence.HIGH);

			MathParser late = new MathParser();
			late.addOperator(power);
			assertThatThrownBy(() -> late.parse("2 ** 3")).isInstanceOf(MathSyntaxException.class);

			MathParser early = new MathParser(ParserConfig.defaults(),
					OperatorCatalog.empty().with(List.of(power)).with(CoreOperators.ALL));
			assertThat(shape(early, "2 ** 3 * 4")).isEqualTo("((2 ** 3) * 4)");
		}

		@Test
		void registrationDoesNotLeakBetweenParsers() {
			parserWithBlah();

			assertThatThrownBy(() -> MathParser.parseWithDefaults("$1"))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessageContaining("Unexpected token '$' at position 0");
		}
	}

	@Nested
	@DisplayName("Malformed input")
	class Errors {

		@Test
		void rejectsBinaryOperatorWithMissingOperand() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("1 *"))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessageContaining("Missing operand for operator 'Product'");
		}

		@ParameterizedTest
		@ValueSource(strings = {"", "   "})
		void rejectsEmptyInput(String text) {
			assertThatThrownBy(() -> MathParser.parseWithDefaults(text))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessage("Invalid equation");
		}

		@Test
		void rejectsUnknownCharacters() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("1 # 2"))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessage("Unexpected token '#' at position 2");
		}

		@Test
		void rejectsUnclosedParenthesis() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("(1 + 2"))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Unmatched '(' at position 0");
		}

		@Test
		void reportsUnclosedParenthesisBeforeMissingOperand() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("(1 +"))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Unmatched '(' at position 0");
		}

		@Test
		void reportsUnopenedParenthesisBeforeMissingOperand() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("1 + )"))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Unexpected ')' at position 4");
		}

		@Test
		void rejectsLiteralOutOfRange() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("2 * 1e400"))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessage("Literal '1e400' at position 4 is too large to represent");
		}

		@Test
		void rejectsUnclosedFunctionCall() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("sin(1"))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Unclosed call to function 'Sine'");
		}

		@Test
		void rejectsUnopenedParenthesis() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("1 + 2)"))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Unexpected ')' at position 5");
		}

		@ParameterizedTest
		@ValueSource(strings = {"(1, 2)", "1, 2"})
		void rejectsCommaOutsideFunctionCall(String text) {
			assertThatThrownBy(() -> MathParser.parseWithDefaults(text))
					.isInstanceOf(BadParensException.class)
					.hasMessageContaining("Unexpected ','");
		}

		@Test
		void rejectsEmptyParentheses() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("()"))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessageContaining("Empty or incomplete expression");
		}

		@Test
		void operatorsCannotReachOutsideTheirGroup() {
			assertThatThrownBy(() -> MathParser.parseWithDefaults("2 * (+3)"))
					.isInstanceOf(MathSyntaxException.class)
					.hasMessageContaining("Missing operand for operator 'Sum'");
		}

		@Test
		void rejectsNullText() {
			assertThatThrownBy(() -> new MathParser().parse(null))
					.isInstanceOf(NullPointerException.class);
		}
	}

	@Nested
	@DisplayName("Tree properties")
	class TreeProperties {

		@ParameterizedTest
		@CsvSource(delimiter = '|', value = {
				"1 + 2 * 3          | 2",
				"x^2y^2             | 3",
				"-sin(3.14)         | 2",
				"pow(1 + 2, 3)      | 2",
				"(1)(2)(3)          | 2",
				"--12               | 2"
		})
		void operatorNodeCountMatchesApplications(String text, int applications) {
			MathNode root = MathParser.parseWithDefaults(text);

			assertThat(MathNodeWalker.count(root) - MathNodeWalker.countLeaves(root)).isEqualTo(applications);
		}

		@Test
		void childSpansLieWithinParentSpan() {
			MathNode root = MathParser.parseWithDefaults("3x^2 + pow(y, 2) - -4");

			MathNodeWalker.walkPreOrder(root, node -> {
				for (MathNode child : node.children()) {
					assertThat(child.span().start()).isGreaterThanOrEqualTo(node.span().start());
					assertThat(child.span().end()).isLessThanOrEqualTo(node.span().end());
				}
			});
			assertThat(root.span()).isEqualTo(new Span(0, 21));
		}

		@Test
		void logsParseAtDebug() {
			try (LogCapture capture = LogCapture.of(MathParser.class, Level.DEBUG)) {
				MathParser.parseWithDefaults("1 + 2");

				assertThat(capture.messages()).containsExactly(
						"Parsing expression '1 + 2'",
						"Parsed '1 + 2' into 3 node(s)");
			}
		}

		@Test
		void parserCanBeReused() {
			MathParser parser = new MathParser();

			assertThatThrownBy(() -> parser.parse("1 +")).isInstanceOf(MathSyntaxException.class);
			assertThat(shape(parser, "1 + 2")).isEqualTo("(1 + 2)");
			assertThat(shape(parser, "3")).isEqualTo("3");
		}
	}
}
