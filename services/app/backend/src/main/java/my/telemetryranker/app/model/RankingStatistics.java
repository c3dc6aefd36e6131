package my.telemetryranker.app.model;

import java.util.List;
import java.util.Map;

/**
 * Descriptive statistics of one ranking's final scores. Score statistics are null for an empty ranking.
 */
public record RankingStatistics(
		String label,
		int count,
		Double max,
		Double min,
		Double mean,
		Double std,
		Double median,
		Double q1,
		Double q3,
		Double iqr,
		Map<Integer, Double> percentiles,
		List<CategoryShare> categoryDistribution,
		List<RankingEntry> top,
		List<RankingEntry> bottom
) {
	public record CategoryShare(String category, int count, double percentage) {
	}
}
