package my.telemetryranker.app.ranking;

import java.util.List;

/**
 * Raised before any scoring starts when the ranking configuration cannot be used.
 */
public class RankingConfigurationException extends RuntimeException {
	private final List<String> errors;

	public RankingConfigurationException(List<String> errors) {
		super("Invalid ranking configuration: " + String.join("; ", errors));
		this.errors = List.copyOf(errors);
	}

	public RankingConfigurationException(String error) {
		this(List.of(error));
	}

	public List<String> getErrors() {
		return errors;
	}
}
