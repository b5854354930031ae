package org.javai.mathast.ast;

/**
 * Half-open range of source offsets {@code [start, end)} covered by a node.
 *
 * @param start offset of the first character
 * @param end offset one past the last character
 */
public record Span(int start, int end) {

	public Span {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
		}
	}

	/**
	 * A zero-width span at the given offset.
	 */
	public static Span at(int offset) {
		return new Span(offset, offset);
	}

	/**
	 * Smallest span covering both this one and {@code other}.
	 */
	public Span union(Span other) {
		return new Span(Math.min(start, other.start), Math.max(end, other.end));
	}
}
