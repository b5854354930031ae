package org.javai.mathast;

import org.javai.mathast.ast.Span;

/**
 * A span of the source text a scanner has recognized at the cursor.
 *
 * @param start offset of the first claimed character
 * @param end offset one past the last claimed character
 */
public record ClaimToken(int start, int end) {

	public ClaimToken {
		if (start < 0 || end <= start) {
			throw new IllegalArgumentException("A claim token must cover at least one character");
		}
	}

	public String text(String source) {
		return source.substring(start, end);
	}

	public Span toSpan() {
		return new Span(start, end);
	}
}
