package my.telemetryranker.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record UnifiedScore(
		int position,
		String entityId,
		double unifiedScore,
		String category,
		Map<MetricDomain, Double> domainScores
) {
	public UnifiedScore {
		Map<MetricDomain, Double> ordered = new EnumMap<>(MetricDomain.class);
		if (domainScores != null) {
			ordered.putAll(domainScores);
		}
		domainScores = Collections.unmodifiableMap(ordered);
	}
}
