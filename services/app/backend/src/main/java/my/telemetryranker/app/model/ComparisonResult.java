package my.telemetryranker.app.model;

import java.util.List;

/**
 * Distributional comparison of two rankings. Deltas are right minus left; statistics that
 * are undefined for an empty ranking are null.
 */
public record ComparisonResult(
		String leftLabel,
		String rightLabel,
		List<StatisticRow> statistics,
		List<CategoryRow> categories
) {
	public ComparisonResult {
		statistics = statistics == null ? List.of() : List.copyOf(statistics);
		categories = categories == null ? List.of() : List.copyOf(categories);
	}

	public StatisticRow statistic(String metric) {
		return statistics.stream()
				.filter(row -> row.metric().equals(metric))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown comparison metric: " + metric));
	}

	public CategoryRow category(String label) {
		return categories.stream()
				.filter(row -> row.category().equals(label))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown category: " + label));
	}

	public record StatisticRow(String metric, Double left, Double right, Double delta) {
	}

	public record CategoryRow(String category, int left, int right, int total) {
	}
}
