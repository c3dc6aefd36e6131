package my.telemetryranker.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-domain scoring setup: area polarities and weights, sub-metric weights and the valid value range.
 * A null defaultPolarity means every area must be registered explicitly.
 */
public record DomainProfile(
		MetricDomain domain,
		Polarity defaultPolarity,
		Map<String, AreaProfile> areas,
		Map<MetricKind, Double> subMetricWeights,
		Double minValue,
		Double maxValue,
		int minimumRecords
) {
	private static final double DEFAULT_AREA_WEIGHT = 1.0;

	public DomainProfile {
		areas = areas == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(areas));
		Map<MetricKind, Double> weights = new EnumMap<>(MetricKind.class);
		if (subMetricWeights != null) {
			weights.putAll(subMetricWeights);
		}
		subMetricWeights = Collections.unmodifiableMap(weights);
	}

	public double areaWeight(String areaId) {
		AreaProfile area = areas.get(areaId);
		return area == null ? DEFAULT_AREA_WEIGHT : area.weight();
	}

	public String describe(String areaId) {
		AreaProfile area = areas.get(areaId);
		if (area == null || area.description() == null || area.description().isBlank()) {
			return areaId;
		}
		return area.description();
	}

	public double subMetricWeight(MetricKind kind) {
		return subMetricWeights.getOrDefault(kind, 0.0);
	}

	public boolean accepts(double value) {
		if (!Double.isFinite(value)) {
			return false;
		}
		if (minValue != null && value < minValue) {
			return false;
		}
		return maxValue == null || value <= maxValue;
	}
}
