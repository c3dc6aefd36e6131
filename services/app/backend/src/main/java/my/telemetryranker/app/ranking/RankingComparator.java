package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.ComparisonResult;
import my.telemetryranker.app.model.ComparisonResult.CategoryRow;
import my.telemetryranker.app.model.ComparisonResult.StatisticRow;
import my.telemetryranker.app.model.RankingEntry;
import my.telemetryranker.app.util.Statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Compares the score distributions of two rankings. The rankings usually cover different
 * entity populations, so entities are never matched across them.
 */
public class RankingComparator {
	public static final String COUNT = "count";
	public static final String MAX = "max";
	public static final String MIN = "min";
	public static final String MEAN = "mean";
	public static final String STD = "std";

	private final List<String> categories;

	public RankingComparator(List<String> categories) {
		this.categories = categories == null ? List.of() : List.copyOf(categories);
	}

	public ComparisonResult compare(String leftLabel, List<RankingEntry> left, String rightLabel, List<RankingEntry> right) {
		List<RankingEntry> safeLeft = left == null ? List.of() : left;
		List<RankingEntry> safeRight = right == null ? List.of() : right;
		double[] leftScores = scores(safeLeft);
		double[] rightScores = scores(safeRight);

		List<StatisticRow> statistics = new ArrayList<>();
		statistics.add(row(COUNT, (double) leftScores.length, (double) rightScores.length));
		statistics.add(row(MAX, leftScores, rightScores, Statistics::max));
		statistics.add(row(MIN, leftScores, rightScores, Statistics::min));
		statistics.add(row(MEAN, leftScores, rightScores, Statistics::mean));
		statistics.add(row(STD, leftScores, rightScores, Statistics::sampleStd));

		List<CategoryRow> categoryRows = new ArrayList<>();
		for (String category : categories) {
			int leftCount = countCategory(safeLeft, category);
			int rightCount = countCategory(safeRight, category);
			categoryRows.add(new CategoryRow(category, leftCount, rightCount, leftCount + rightCount));
		}
		return new ComparisonResult(leftLabel, rightLabel, statistics, categoryRows);
	}

	private StatisticRow row(String metric, double[] left, double[] right, Function<double[], Double> statistic) {
		Double leftValue = left.length == 0 ? null : statistic.apply(left);
		Double rightValue = right.length == 0 ? null : statistic.apply(right);
		return row(metric, leftValue, rightValue);
	}

	private StatisticRow row(String metric, Double left, Double right) {
		Double delta = left == null || right == null ? null : right - left;
		return new StatisticRow(metric, left, right, delta);
	}

	private int countCategory(List<RankingEntry> entries, String category) {
		int count = 0;
		for (RankingEntry entry : entries) {
			if (entry != null && Objects.equals(entry.category(), category)) {
				count += 1;
			}
		}
		return count;
	}

	private double[] scores(List<RankingEntry> entries) {
		return entries.stream()
				.filter(Objects::nonNull)
				.mapToDouble(RankingEntry::finalScore)
				.toArray();
	}
}
