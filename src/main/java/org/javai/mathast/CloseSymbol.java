package org.javai.mathast;

/**
 * Symbols that end an expression group: a closing parenthesis or an argument separator.
 */
enum CloseSymbol {
	CLOSE_PARENS(')', TokenKind.CLOSE_PARENS),
	COMMA(',', TokenKind.COMMA);

	private final char symbol;
	private final TokenKind kind;

	CloseSymbol(char symbol, TokenKind kind) {
		this.symbol = symbol;
		this.kind = kind;
	}

	char symbol() {
		return symbol;
	}

	TokenKind kind() {
		return kind;
	}

	/**
	 * The close symbol written as {@code c}, or {@code null} if there is none.
	 */
	static CloseSymbol of(char c) {
		for (CloseSymbol closeSymbol : values()) {
			if (closeSymbol.symbol() == c) {
				return closeSymbol;
			}
		}
		return null;
	}
}
