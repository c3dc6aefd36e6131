package my.telemetryranker.app.model;

import java.time.LocalDateTime;
import java.util.List;

public record RankingResult(
		MetricDomain domain,
		LocalDateTime runTimestamp,
		int windowSize,
		int recordCount,
		List<CompositeScore> composites,
		List<SubMetricValue> subMetrics,
		List<RunCondition> conditions
) {
	public RankingResult {
		composites = composites == null ? List.of() : List.copyOf(composites);
		subMetrics = subMetrics == null ? List.of() : List.copyOf(subMetrics);
		conditions = conditions == null ? List.of() : List.copyOf(conditions);
	}

	public static RankingResult empty(MetricDomain domain, LocalDateTime runTimestamp, int windowSize) {
		return new RankingResult(domain, runTimestamp, windowSize, 0, List.of(), List.of(), List.of());
	}

	public int rankedCount() {
		return composites.size();
	}

	public List<RankingEntry> entries() {
		return composites.stream().map(CompositeScore::toEntry).toList();
	}
}
