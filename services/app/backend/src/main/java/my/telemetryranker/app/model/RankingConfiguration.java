package my.telemetryranker.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration handed to the ranking engine on every invocation.
 */
public record RankingConfiguration(
		int windowSize,
		double instabilityScale,
		double rateOfChangeScale,
		List<CategoryBand> categories,
		Map<MetricDomain, DomainProfile> domains,
		Map<MetricDomain, Double> unifiedDomainWeights
) {
	public RankingConfiguration {
		categories = categories == null ? List.of() : List.copyOf(categories);
		Map<MetricDomain, DomainProfile> orderedDomains = new EnumMap<>(MetricDomain.class);
		if (domains != null) {
			orderedDomains.putAll(domains);
		}
		domains = Collections.unmodifiableMap(orderedDomains);
		Map<MetricDomain, Double> orderedWeights = new EnumMap<>(MetricDomain.class);
		if (unifiedDomainWeights != null) {
			orderedWeights.putAll(unifiedDomainWeights);
		}
		unifiedDomainWeights = Collections.unmodifiableMap(orderedWeights);
	}

	public DomainProfile profile(MetricDomain domain) {
		DomainProfile profile = domains.get(domain);
		if (profile == null) {
			throw new IllegalArgumentException("No profile configured for domain " + domain);
		}
		return profile;
	}

	public double scale(MetricKind kind) {
		return switch (kind) {
			case FILL -> 1.0;
			case INSTABILITY -> instabilityScale;
			case RATE_OF_CHANGE -> rateOfChangeScale;
		};
	}

	public List<String> categoryLabels() {
		return categories.stream().map(CategoryBand::label).toList();
	}
}
