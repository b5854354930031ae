package org.javai.mathast.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import org.javai.mathast.MathParseException;
import org.javai.mathast.operator.Operator;

/**
 * Serializes syntax trees to JSON.
 * <p>
 * The shape is stable and shared by every caller that displays or stores trees:
 * <ul>
 *   <li>every node: {@code type} ({@code Literal}, {@code Variable}, {@code UnaryOperator},
 *   {@code BinaryOperator}, {@code FunctionOperator}) and {@code span} ({@code {start, end}})</li>
 *   <li>literals: {@code value}</li>
 *   <li>variables: {@code name}</li>
 *   <li>operator nodes: {@code name}, {@code symbol} and the ordered {@code children}</li>
 * </ul>
 *
 * <pre>{@code
 * MathNodeJsonWriter writer = new MathNodeJsonWriter();
 * String json = writer.toJsonString(MathParser.parseWithDefaults("2 + x"));
 * }</pre>
 */
public class MathNodeJsonWriter {

	private final ObjectMapper mapper;

	public MathNodeJsonWriter() {
		this(new ObjectMapper());
	}

	public MathNodeJsonWriter(ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	/**
	 * Converts a tree to a Jackson object node.
	 */
	public ObjectNode toJson(MathNode node) {
		Objects.requireNonNull(node, "node must not be null");
		return node.accept(new JsonBuilder());
	}

	public String toJsonString(MathNode node) {
		try {
			return mapper.writeValueAsString(toJson(node));
		} catch (JsonProcessingException e) {
			throw new MathParseException("Failed to serialize syntax tree", e);
		}
	}

	public String toPrettyJsonString(MathNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(node));
		} catch (JsonProcessingException e) {
			throw new MathParseException("Failed to serialize syntax tree", e);
		}
	}

	private final class JsonBuilder implements MathNodeVisitor<ObjectNode> {

		@Override
		public ObjectNode visitLiteral(LiteralNode node) {
			ObjectNode json = header(node);
			json.put("value", node.value());
			return withSpan(json, node);
		}

		@Override
		public ObjectNode visitVariable(VariableNode node) {
			ObjectNode json = header(node);
			json.put("name", node.name());
			return withSpan(json, node);
		}

		@Override
		public ObjectNode visitUnary(UnaryOperatorNode node) {
			return operatorNode(node, node.operator(), node.children());
		}

		@Override
		public ObjectNode visitBinary(BinaryOperatorNode node) {
			return operatorNode(node, node.operator(), node.children());
		}

		@Override
		public ObjectNode visitFunction(FunctionOperatorNode node) {
			return operatorNode(node, node.operator(), node.children());
		}

		private ObjectNode operatorNode(MathNode node, Operator operator, List<MathNode> children) {
			ObjectNode json = header(node);
			json.put("name", operator.name());
			json.put("symbol", operator.symbol());
			ArrayNode childArray = json.putArray("children");
			for (MathNode child : children) {
				childArray.add(child.accept(this));
			}
			return withSpan(json, node);
		}

		private ObjectNode header(MathNode node) {
			ObjectNode json = mapper.createObjectNode();
			json.put("type", node.type().label());
			return json;
		}

		private ObjectNode withSpan(ObjectNode json, MathNode node) {
			ObjectNode span = json.putObject("span");
			span.put("start", node.span().start());
			span.put("end", node.span().end());
			return json;
		}
	}
}
