package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.AreaScore;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.SubMetricValue;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Combines normalized sub-metric scores into area scores and area scores into a final score.
 * Both steps renormalize the weights over the inputs that are actually present, so a missing
 * measurement never counts as a poor one.
 */
public class CompositeScorer {
	private final DomainProfile profile;

	public CompositeScorer(DomainProfile profile) {
		this.profile = profile;
	}

	public OptionalDouble areaScore(Map<MetricKind, SubMetricValue> subMetrics) {
		if (subMetrics == null || subMetrics.isEmpty()) {
			return OptionalDouble.empty();
		}
		double weighted = 0.0;
		double totalWeight = 0.0;
		for (MetricKind kind : MetricKind.values()) {
			SubMetricValue value = subMetrics.get(kind);
			if (value == null) {
				continue;
			}
			double weight = profile.subMetricWeight(kind);
			weighted += value.normalizedScore() * weight;
			totalWeight += weight;
		}
		if (totalWeight <= 0.0) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(weighted / totalWeight);
	}

	/**
	 * Weighted mean of the area scores; areas with zero weight do not contribute.
	 */
	public OptionalDouble finalScore(List<AreaScore> areaScores) {
		if (areaScores == null || areaScores.isEmpty()) {
			return OptionalDouble.empty();
		}
		double weighted = 0.0;
		double totalWeight = 0.0;
		for (AreaScore areaScore : areaScores) {
			if (areaScore.weight() <= 0.0) {
				continue;
			}
			weighted += areaScore.score() * areaScore.weight();
			totalWeight += areaScore.weight();
		}
		if (totalWeight <= 0.0) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(clamp(weighted / totalWeight));
	}

	private double clamp(double score) {
		return Math.max(0.0, Math.min(100.0, score));
	}
}
