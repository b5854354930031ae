package org.javai.mathast.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, ordered table of operators used to seed a parser's registry.
 *
 * @param operators the operators in scan order
 */
public record OperatorCatalog(List<Operator> operators) {

	public OperatorCatalog {
		Objects.requireNonNull(operators, "operators must not be null");
		operators = List.copyOf(operators);
	}

	/**
	 * The built-in catalogue.
	 */
	public static OperatorCatalog defaults() {
		return new OperatorCatalog(CoreOperators.ALL);
	}

	public static OperatorCatalog empty() {
		return new OperatorCatalog(List.of());
	}

	/**
	 * Returns a new catalogue with the given operators appended after this one's.
	 */
	public OperatorCatalog with(List<? extends Operator> additional) {
		List<Operator> combined = new ArrayList<>(operators);
		combined.addAll(additional);
		return new OperatorCatalog(combined);
	}
}
