package my.telemetryranker.app.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes area lists as a JSON array of strings and reads them back. Anything other than a
 * flat array of strings is rejected.
 */
public final class AreaListCodec {
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private AreaListCodec() {
	}

	public static String encode(List<String> areas) {
		try {
			return MAPPER.writeValueAsString(areas == null ? List.of() : areas);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Failed to encode area list", ex);
		}
	}

	public static List<String> decode(String raw) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}
		JsonNode node;
		try {
			node = MAPPER.readTree(raw);
		} catch (JsonProcessingException ex) {
			throw new IllegalArgumentException("Area list is not a JSON array: " + raw, ex);
		}
		if (node == null || !node.isArray()) {
			throw new IllegalArgumentException("Area list is not a JSON array: " + raw);
		}
		List<String> areas = new ArrayList<>(node.size());
		for (JsonNode element : node) {
			if (!element.isTextual()) {
				throw new IllegalArgumentException("Area list must contain only strings: " + raw);
			}
			areas.add(element.asText());
		}
		return List.copyOf(areas);
	}
}
