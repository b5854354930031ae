package org.javai.mathast;

/**
 * What a single pass of the parser fed into the {@link OperatorProcessor}.
 */
enum TokenKind {
	LITERAL,
	VARIABLE,
	UNARY_OPERATOR,
	BINARY_OPERATOR,
	FUNCTION_OPERATOR,
	OPEN_PARENS,
	CLOSE_PARENS,
	COMMA
}
