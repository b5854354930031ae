package org.javai.mathast.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-parser table of the operators the scanner may claim, split by kind.
 * <p>
 * Seeded from an {@link OperatorCatalog} and extended with {@link #register(Operator)}.
 * Registration does not check for duplicate symbols: within a kind the first
 * matching operator in registration order wins.
 * <p>
 * Not thread-safe. Registering while another thread parses with the owning
 * parser is the caller's problem.
 */
public final class OperatorRegistry {

	private static final Logger logger = LoggerFactory.getLogger(OperatorRegistry.class);

	private final List<UnaryOperator> unaryOperators = new ArrayList<>();
	private final List<BinaryOperator> binaryOperators = new ArrayList<>();
	private final List<FunctionOperator> functionOperators = new ArrayList<>();

	public OperatorRegistry(OperatorCatalog catalog) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		catalog.operators().forEach(this::register);
	}

	/**
	 * Adds an operator to the list for its kind, after any already registered.
	 */
	public void register(Operator operator) {
		Objects.requireNonNull(operator, "operator must not be null");
		if (CoreOperators.UNARY_MINUS.equals(operator)) {
			logger.debug("Ignoring registration of built-in unary minus; it is resolved from context");
			return;
		}
		operator.accept(new OperatorVisitor<Void>() {
			@Override
			public Void visitUnary(UnaryOperator unary) {
				unaryOperators.add(unary);
				return null;
			}

			@Override
			public Void visitBinary(BinaryOperator binary) {
				binaryOperators.add(binary);
				return null;
			}

			@Override
			public Void visitFunction(FunctionOperator function) {
				functionOperators.add(function);
				return null;
			}
		});
		logger.debug("Registered {} operator '{}' with symbol '{}'", operator.kind(), operator.name(), operator.symbol());
	}

	public List<UnaryOperator> unaryOperators() {
		return Collections.unmodifiableList(unaryOperators);
	}

	public List<BinaryOperator> binaryOperators() {
		return Collections.unmodifiableList(binaryOperators);
	}

	public List<FunctionOperator> functionOperators() {
		return Collections.unmodifiableList(functionOperators);
	}

	public int size() {
		return unaryOperators.size() + binaryOperators.size() + functionOperators.size();
	}
}
