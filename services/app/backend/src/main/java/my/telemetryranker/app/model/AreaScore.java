package my.telemetryranker.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record AreaScore(
		String areaId,
		double score,
		double weight,
		Map<MetricKind, SubMetricValue> subMetrics
) {
	public AreaScore {
		Map<MetricKind, SubMetricValue> ordered = new EnumMap<>(MetricKind.class);
		if (subMetrics != null) {
			ordered.putAll(subMetrics);
		}
		subMetrics = Collections.unmodifiableMap(ordered);
	}
}
