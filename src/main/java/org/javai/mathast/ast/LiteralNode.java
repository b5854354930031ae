package org.javai.mathast.ast;

import java.util.List;
import java.util.Objects;

/**
 * A decimal number literal.
 *
 * @param value the parsed value
 * @param span the source offsets of the literal
 */
public record LiteralNode(double value, Span span) implements MathNode {

	public LiteralNode {
		Objects.requireNonNull(span, "span must not be null");
	}

	@Override
	public NodeType type() {
		return NodeType.LITERAL;
	}

	@Override
	public List<MathNode> children() {
		return List.of();
	}

	@Override
	public <R> R accept(MathNodeVisitor<R> visitor) {
		return visitor.visitLiteral(this);
	}
}
