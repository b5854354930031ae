package org.javai.mathast;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.mathast.operator.Operator;

/**
 * Stateless recognizers for the units of an expression.
 * <p>
 * Each method looks at the source text from {@code cursor} onwards and
 * returns the span it would claim, or empty if nothing it recognizes starts
 * there. None of them ever claims a zero-length span.
 */
public final class ClaimTokenScanner {

	/**
	 * Optional integer part, optional fraction, at least one digit, optional signed exponent.
	 */
	private static final Pattern LITERAL = Pattern.compile("[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?");

	private ClaimTokenScanner() {
	}

	/**
	 * Claims a decimal literal such as {@code 2}, {@code 1.12}, {@code .5} or {@code 6.02e23}.
	 * A leading sign is never part of the literal.
	 */
	public static Optional<ClaimToken> literal(String text, int cursor) {
		if (cursor >= text.length()) {
			return Optional.empty();
		}
		Matcher matcher = LITERAL.matcher(text).region(cursor, text.length());
		if (!matcher.lookingAt()) {
			return Optional.empty();
		}
		return Optional.of(new ClaimToken(cursor, matcher.end()));
	}

	/**
	 * Claims a single ASCII letter as a variable. When a whitelist is configured
	 * a letter outside it is not claimed, so the caller reports it instead of
	 * accepting it.
	 */
	public static Optional<ClaimToken> variable(ParserConfig config, String text, int cursor) {
		if (cursor >= text.length()) {
			return Optional.empty();
		}
		char c = text.charAt(cursor);
		if (!isAsciiLetter(c) || !config.isVariableAllowed(c)) {
			return Optional.empty();
		}
		return Optional.of(new ClaimToken(cursor, cursor + 1));
	}

	/**
	 * Claims the operator's symbol if the text at the cursor starts with it exactly.
	 */
	public static Optional<ClaimToken> operator(Operator operator, String text, int cursor) {
		String symbol = operator.symbol();
		if (!text.startsWith(symbol, cursor)) {
			return Optional.empty();
		}
		return Optional.of(new ClaimToken(cursor, cursor + symbol.length()));
	}

	/**
	 * Claims a run of one or more whitespace characters.
	 */
	public static Optional<ClaimToken> whitespace(String text, int cursor) {
		int end = cursor;
		while (end < text.length() && Character.isWhitespace(text.charAt(end))) {
			end++;
		}
		return end > cursor ? Optional.of(new ClaimToken(cursor, end)) : Optional.empty();
	}

	static boolean isAsciiLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}
}
