package my.telemetryranker.app.model;

import java.util.List;

/**
 * One sub-metric of one (entity, area) window, normalized against its (area, kind) population.
 *
 * @param rawValue        unscaled statistic
 * @param scaledValue     rawValue times the kind's presentation scale
 * @param normalizedScore direction-adjusted population percentile, higher is more favorable
 * @param position        dense rank inside the (area, kind) population
 * @param windowValues    window values, most recent first
 */
public record SubMetricValue(
		String entityId,
		String areaId,
		MetricKind kind,
		double rawValue,
		double scaledValue,
		double normalizedScore,
		int position,
		List<Double> windowValues
) {
	public SubMetricValue {
		windowValues = windowValues == null ? List.of() : List.copyOf(windowValues);
	}
}
