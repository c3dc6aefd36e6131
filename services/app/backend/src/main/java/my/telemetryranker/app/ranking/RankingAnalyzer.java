package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.RankingEntry;
import my.telemetryranker.app.model.RankingStatistics;
import my.telemetryranker.app.model.RankingStatistics.CategoryShare;
import my.telemetryranker.app.util.Statistics;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive statistics of a single ranking: spread, quartiles, percentiles and category shares.
 */
public class RankingAnalyzer {
	private static final List<Integer> PERCENTILES = List.of(10, 25, 50, 75, 90, 95, 99);

	private final List<String> categories;

	public RankingAnalyzer(List<String> categories) {
		this.categories = categories == null ? List.of() : List.copyOf(categories);
	}

	public RankingStatistics analyze(String label, List<RankingEntry> entries, int topN) {
		List<RankingEntry> ordered = new ArrayList<>();
		if (entries != null) {
			entries.stream().filter(Objects::nonNull).forEach(ordered::add);
		}
		ordered.sort(Comparator.comparingInt(RankingEntry::position));
		int limit = Math.max(0, topN);
		List<RankingEntry> top = List.copyOf(ordered.subList(0, Math.min(limit, ordered.size())));
		List<RankingEntry> bottom = List.copyOf(ordered.subList(Math.max(0, ordered.size() - limit), ordered.size()));
		List<CategoryShare> distribution = distribution(ordered);

		if (ordered.isEmpty()) {
			return new RankingStatistics(label, 0, null, null, null, null, null, null, null, null,
					Map.of(), distribution, top, bottom);
		}
		DescriptiveStatistics scores = Statistics.describe(
				ordered.stream().mapToDouble(RankingEntry::finalScore).toArray());
		double q1 = Statistics.quantile(scores, 0.25);
		double q3 = Statistics.quantile(scores, 0.75);
		Map<Integer, Double> percentiles = new LinkedHashMap<>();
		for (int percentile : PERCENTILES) {
			percentiles.put(percentile, Statistics.quantile(scores, percentile / 100.0));
		}
		return new RankingStatistics(
				label,
				(int) scores.getN(),
				scores.getMax(),
				scores.getMin(),
				scores.getMean(),
				scores.getStandardDeviation(),
				Statistics.quantile(scores, 0.5),
				q1,
				q3,
				q3 - q1,
				Collections.unmodifiableMap(percentiles),
				distribution,
				top,
				bottom
		);
	}

	private List<CategoryShare> distribution(List<RankingEntry> entries) {
		List<CategoryShare> shares = new ArrayList<>();
		for (String category : categories) {
			int count = (int) entries.stream().filter(entry -> category.equals(entry.category())).count();
			double percentage = entries.isEmpty() ? 0.0 : 100.0 * count / entries.size();
			shares.add(new CategoryShare(category, count, percentage));
		}
		return List.copyOf(shares);
	}
}
