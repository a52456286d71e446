package org.cbombench;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-tolerant navigation over tool-produced JSON trees.
 *
 * <p>
 * Every accessor walks a path of field names and returns an empty result instead of
 * failing when a segment is missing, null or of the wrong type. Tool documents are
 * frequently incomplete, so callers decide what an absent value means.
 */
public class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	public Optional<String> getText(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (!target.isValueNode() || target.isNull()) {
			return Optional.empty();
		}
		String text = target.asText().trim();
		return text.isEmpty() ? Optional.empty() : Optional.of(text);
	}

	/**
	 * Read a non-negative integer that may be encoded as a JSON number or as a string
	 * such as {@code "2048"} or {@code "2048 bits"}.
	 */
	public Optional<Integer> getLenientInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isIntegralNumber() && target.canConvertToInt()) {
			int value = target.asInt();
			return value > 0 ? Optional.of(value) : Optional.empty();
		}
		if (target.isNumber()) {
			double value = target.asDouble();
			return value >= 1 && value == Math.rint(value) ? Optional.of((int) value) : Optional.empty();
		}
		if (target.isTextual()) {
			return parseLeadingInt(target.asText());
		}
		return Optional.empty();
	}

	/**
	 * Read a decimal value that may be encoded as a JSON number or a numeric string.
	 */
	public Optional<Double> getDouble(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isNumber()) {
			return Optional.of(target.asDouble());
		}
		if (target.isTextual()) {
			try {
				return Optional.of(Double.parseDouble(target.asText().trim()));
			}
			catch (NumberFormatException e) {
				logger.debug("Ignoring non-numeric value: {}", target.asText());
			}
		}
		return Optional.empty();
	}

	public List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);

		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}

		return List.of();
	}

	public Optional<JsonNode> getObject(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isObject() ? Optional.of(target) : Optional.empty();
	}

	private JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	private static Optional<Integer> parseLeadingInt(String text) {
		String trimmed = text.trim();
		int end = 0;
		while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
			end++;
		}
		if (end == 0 || end > 6) {
			return Optional.empty();
		}
		int value = Integer.parseInt(trimmed.substring(0, end));
		return value > 0 ? Optional.of(value) : Optional.empty();
	}

}
