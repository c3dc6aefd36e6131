package my.telemetryranker.app.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Reads a standalone ranking profile (the same shape as the {@code app.ranking} block of
 * application.yml) from JSON or YAML.
 */
public class RankingProfileParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public RankingProfileParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
				.build();
	}

	public AppProperties.Ranking parse(String content) {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("Ranking profile is empty");
		}
		try {
			return jsonMapper.readValue(content, AppProperties.Ranking.class);
		} catch (Exception jsonEx) {
			try {
				return yamlMapper.readValue(content, AppProperties.Ranking.class);
			} catch (Exception yamlEx) {
				throw new IllegalArgumentException("Ranking profile is neither valid JSON nor YAML: " + yamlEx.getMessage(), yamlEx);
			}
		}
	}
}
