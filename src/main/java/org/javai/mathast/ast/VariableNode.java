package org.javai.mathast.ast;

import java.util.List;
import java.util.Objects;

/**
 * A single-letter variable.
 *
 * @param name the variable name
 * @param span the source offsets of the variable
 */
public record VariableNode(String name, Span span) implements MathNode {

	public VariableNode {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}

	@Override
	public NodeType type() {
		return NodeType.VARIABLE;
	}

	@Override
	public List<MathNode> children() {
		return List.of();
	}

	@Override
	public <R> R accept(MathNodeVisitor<R> visitor) {
		return visitor.visitVariable(this);
	}
}
