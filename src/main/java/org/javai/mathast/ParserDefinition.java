package org.javai.mathast;

import java.util.Objects;
import org.javai.mathast.operator.OperatorCatalog;

/**
 * Everything needed to build a {@link MathParser}: its options and the operators it starts with.
 *
 * @param config the parser options
 * @param catalog the operators seeding the parser's registry
 */
public record ParserDefinition(ParserConfig config, OperatorCatalog catalog) {

	public ParserDefinition {
		Objects.requireNonNull(config, "config must not be null");
		Objects.requireNonNull(catalog, "catalog must not be null");
	}

	public static ParserDefinition defaults() {
		return new ParserDefinition(ParserConfig.defaults(), OperatorCatalog.defaults());
	}
}
