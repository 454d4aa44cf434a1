package org.javai.formula.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link FormulaExecution} audit trails to and from JSON.
 * <p>
 * Variable and result values are written as JSON numbers, booleans or strings; numbers are
 * read back as {@link Double}, matching what the evaluator produces. Timestamps are ISO-8601.
 */
public final class FormulaExecutionJsonMapper {

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

	private FormulaExecutionJsonMapper() {
	}

	public static String toJson(FormulaExecution execution) {
		try {
			return MAPPER.writeValueAsString(toJsonNode(execution));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize execution " + execution.id(), e);
		}
	}

	public static String toPrettyJson(FormulaExecution execution) {
		try {
			return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode(execution));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize execution " + execution.id(), e);
		}
	}

	public static ObjectNode toJsonNode(FormulaExecution execution) {
		ObjectNode root = MAPPER.createObjectNode();
		root.put("id", execution.id());
		root.put("formulaSetId", execution.formulaSetId());
		root.put("status", execution.status().name());
		root.set("executedAt", MAPPER.valueToTree(execution.executedAt()));

		ObjectNode input = root.putObject("inputVariables");
		for (Map.Entry<String, Object> entry : execution.inputVariables().entrySet()) {
			input.set(entry.getKey(), MAPPER.valueToTree(entry.getValue()));
		}

		ArrayNode steps = root.putArray("steps");
		for (ExecutionStep step : execution.steps()) {
			ObjectNode node = steps.addObject();
			node.put("order", step.order());
			node.put("formulaId", step.formulaId());
			node.put("expression", step.expression());
			node.put("resultVariable", step.resultVariable());
			node.set("resultValue", MAPPER.valueToTree(step.resultValue()));
			node.set("executedAt", MAPPER.valueToTree(step.executedAt()));
		}

		ArrayNode skipped = root.putArray("skippedFormulaIds");
		execution.skippedFormulaIds().forEach(skipped::add);
		root.set("finalResult", MAPPER.valueToTree(execution.finalResult()));

		if (execution.failure() != null) {
			StepFailure failure = execution.failure();
			ObjectNode node = root.putObject("failure");
			node.put("stepIndex", failure.stepIndex());
			node.put("formulaId", failure.formulaId());
			node.put("errorCode", failure.errorCode());
			node.put("message", failure.message());
		}
		return root;
	}

	/**
	 * @throws IllegalArgumentException if the text is not a serialized execution
	 */
	public static FormulaExecution fromJson(String json) {
		JsonNode root;
		try {
			root = MAPPER.readTree(json);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Malformed execution JSON", e);
		}
		if (root == null || !root.isObject()) {
			throw new IllegalArgumentException("Execution JSON must be an object");
		}
		try {
			Map<String, Object> input = new LinkedHashMap<>();
			Iterator<Map.Entry<String, JsonNode>> fields = root.path("inputVariables").fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				input.put(field.getKey(), value(field.getValue()));
			}

			List<ExecutionStep> steps = new ArrayList<>();
			for (JsonNode node : root.path("steps")) {
				steps.add(new ExecutionStep(
						node.path("order").asInt(),
						text(node, "formulaId"),
						text(node, "expression"),
						text(node, "resultVariable"),
						value(node.get("resultValue")),
						instant(node, "executedAt")));
			}

			List<String> skipped = new ArrayList<>();
			for (JsonNode node : root.path("skippedFormulaIds")) {
				skipped.add(node.asText());
			}

			StepFailure failure = null;
			JsonNode failureNode = root.get("failure");
			if (failureNode != null && failureNode.isObject()) {
				failure = new StepFailure(failureNode.path("stepIndex").asInt(), text(failureNode, "formulaId"),
						text(failureNode, "errorCode"), text(failureNode, "message"));
			}

			return new FormulaExecution(
					text(root, "id"),
					text(root, "formulaSetId"),
					input,
					steps,
					skipped,
					value(root.get("finalResult")),
					ExecutionStatus.valueOf(text(root, "status")),
					failure,
					instant(root, "executedAt"));
		} catch (RuntimeException e) {
			throw new IllegalArgumentException("Invalid execution JSON: " + e.getMessage(), e);
		}
	}

	private static Object value(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return null;
		}
		if (node.isNumber()) {
			return node.asDouble();
		}
		if (node.isBoolean()) {
			return node.asBoolean();
		}
		return node.asText();
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

	private static Instant instant(JsonNode node, String field) {
		String value = text(node, field);
		return value != null ? Instant.parse(value) : null;
	}
}
