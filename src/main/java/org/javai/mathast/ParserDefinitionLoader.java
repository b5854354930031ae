package org.javai.mathast;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.javai.mathast.operator.BinaryOperator;
import org.javai.mathast.operator.FunctionOperator;
import org.javai.mathast.operator.Operator;
import org.javai.mathast.operator.OperatorCatalog;
import org.javai.mathast.operator.OperatorKind;
import org.javai.mathast.operator.OperatorPrecedence;
import org.javai.mathast.operator.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a {@link ParserDefinition} from YAML.
 *
 * <pre>
 * parser:
 *   implicit_multiply: true
 *   left_associative: true
 *   valid_variables: [x, y]
 * include_core_operators: true
 * operators:
 *   - kind: binary
 *     name: Modulo
 *     symbol: "%"
 *     precedence: medium
 *   - kind: function
 *     name: Maximum
 *     symbol: max
 *     arity: 2
 * </pre>
 *
 * Every section is optional. Declared operators come after the core operators
 * unless {@code include_core_operators} is false.
 */
public class ParserDefinitionLoader {

	private static final Logger logger = LoggerFactory.getLogger(ParserDefinitionLoader.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Load a definition from a file.
	 */
	public ParserDefinition load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader), path.toString());
		} catch (MathParseException e) {
			throw e;
		} catch (Exception e) {
			throw new MathParseException("Failed to load parser definition from path: " + path, e);
		}
	}

	/**
	 * Load a definition from an input stream.
	 */
	public ParserDefinition load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream), "input stream");
		} catch (MathParseException e) {
			throw e;
		} catch (Exception e) {
			throw new MathParseException("Failed to load parser definition from input stream", e);
		}
	}

	/**
	 * Load a definition from a reader.
	 */
	public ParserDefinition load(Reader reader) {
		try {
			return build(yaml.load(reader), "reader");
		} catch (MathParseException e) {
			throw e;
		} catch (Exception e) {
			throw new MathParseException("Failed to load parser definition from reader", e);
		}
	}

	/**
	 * Load a definition from YAML text.
	 */
	public ParserDefinition loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent), "string");
		} catch (MathParseException e) {
			throw e;
		} catch (Exception e) {
			throw new MathParseException("Failed to load parser definition from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private ParserDefinition build(Object document, String source) {
		if (document == null) {
			return ParserDefinition.defaults();
		}
		if (!(document instanceof Map)) {
			throw new MathParseException("Parser definition must be a YAML mapping");
		}
		Map<String, Object> data = (Map<String, Object>) document;

		ParserConfig config = buildConfig((Map<String, Object>) data.get("parser"));

		Object includeCore = data.get("include_core_operators");
		if (includeCore != null && !(includeCore instanceof Boolean)) {
			throw new MathParseException("'include_core_operators' must be a boolean");
		}
		OperatorCatalog catalog = includeCore == null || (Boolean) includeCore
				? OperatorCatalog.defaults()
				: OperatorCatalog.empty();

		List<Map<String, Object>> operatorsList = (List<Map<String, Object>>) data.get("operators");
		List<Operator> operators = new ArrayList<>();
		if (operatorsList != null) {
			for (int i = 0; i < operatorsList.size(); i++) {
				operators.add(buildOperator(operatorsList.get(i), i));
			}
		}

		logger.info("Loaded {} operator(s) from {}", operators.size(), source);
		return new ParserDefinition(config, catalog.with(operators));
	}

	@SuppressWarnings("unchecked")
	private ParserConfig buildConfig(Map<String, Object> parserMap) {
		if (parserMap == null) {
			return ParserConfig.defaults();
		}
		ParserConfig.Builder builder = ParserConfig.builder();

		Boolean implicitMultiply = (Boolean) parserMap.get("implicit_multiply");
		if (implicitMultiply != null) {
			builder.implicitMultiply(implicitMultiply);
		}

		Boolean leftAssociative = (Boolean) parserMap.get("left_associative");
		if (leftAssociative != null) {
			builder.leftAssociative(leftAssociative);
		}

		List<Object> validVariables = (List<Object>) parserMap.get("valid_variables");
		if (validVariables != null) {
			builder.validVariables(validVariables.stream()
					.map(String::valueOf)
					.collect(Collectors.toList()));
		}
		return builder.build();
	}

	private Operator buildOperator(Map<String, Object> operatorData, int index) {
		String kindStr = requireString(operatorData, "kind", index);
		OperatorKind kind;
		try {
			kind = OperatorKind.valueOf(kindStr);
		} catch (IllegalArgumentException e) {
			throw new MathParseException("Operator #" + index + " has unknown kind '" + kindStr
					+ "'; expected unary, binary or function", e);
		}

		String name = requireString(operatorData, "name", index);
		String symbol = requireString(operatorData, "symbol", index);

		return switch (kind) {
			case unary -> new UnaryOperator(name, symbol);
			case binary -> {
				Object precedenceObj = operatorData.get("precedence");
				OperatorPrecedence precedence = precedenceObj != null
						? OperatorPrecedence.valueOf(String.valueOf(precedenceObj).toUpperCase(Locale.ROOT))
						: OperatorPrecedence.NORMAL;
				yield new BinaryOperator(name, symbol, precedence);
			}
			case function -> {
				Object arityObj = operatorData.get("arity");
				if (!(arityObj instanceof Integer)) {
					throw new MathParseException("Function operator '" + name + "' requires an integer 'arity'");
				}
				yield new FunctionOperator(name, symbol, (Integer) arityObj);
			}
		};
	}

	private String requireString(Map<String, Object> data, String key, int index) {
		Object value = data.get(key);
		if (value == null) {
			throw new MathParseException("Operator #" + index + " is missing required '" + key + "'");
		}
		return value instanceof String ? (String) value : String.valueOf(value);
	}
}
