package my.telemetryranker.app.support;

import my.telemetryranker.app.model.AreaProfile;
import my.telemetryranker.app.model.CategoryBand;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.Polarity;
import my.telemetryranker.app.model.RankingConfiguration;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RankingTestData {
	public static final LocalDate DAY_ONE = LocalDate.of(2024, 1, 1);
	public static final LocalDateTime RUN_TIMESTAMP = LocalDateTime.of(2024, 1, 31, 12, 0, 0);

	public static final List<CategoryBand> BANDS = List.of(
			new CategoryBand("Excelente", 90.0),
			new CategoryBand("Muy Bueno", 75.0),
			new CategoryBand("Bueno", 60.0),
			new CategoryBand("Regular", 40.0),
			new CategoryBand("Necesita Mejora", 0.0)
	);

	private RankingTestData() {
	}

	public static MetricRecord record(String entityId, String areaId, int dayOffset, double value) {
		return new MetricRecord(entityId, areaId, DAY_ONE.plusDays(dayOffset), value);
	}

	/**
	 * One record per day starting at {@link #DAY_ONE}.
	 */
	public static List<MetricRecord> series(String entityId, String areaId, double... values) {
		List<MetricRecord> records = new ArrayList<>();
		for (int i = 0; i < values.length; i++) {
			records.add(record(entityId, areaId, i, values[i]));
		}
		return records;
	}

	public static Map<MetricKind, Double> equalWeights() {
		Map<MetricKind, Double> weights = new EnumMap<>(MetricKind.class);
		for (MetricKind kind : MetricKind.values()) {
			weights.put(kind, 1.0);
		}
		return weights;
	}

	public static Map<MetricKind, Double> weights(double fill, double instability, double rateOfChange) {
		Map<MetricKind, Double> weights = new EnumMap<>(MetricKind.class);
		weights.put(MetricKind.FILL, fill);
		weights.put(MetricKind.INSTABILITY, instability);
		weights.put(MetricKind.RATE_OF_CHANGE, rateOfChange);
		return weights;
	}

	public static AreaProfile area(String areaId, Polarity polarity, double weight) {
		return new AreaProfile(areaId, polarity, weight, null);
	}

	public static DomainProfile profile(MetricDomain domain, Polarity defaultPolarity, AreaProfile... areas) {
		Map<String, AreaProfile> byId = new LinkedHashMap<>();
		for (AreaProfile area : areas) {
			byId.put(area.areaId(), area);
		}
		return new DomainProfile(domain, defaultPolarity, byId, equalWeights(), null, null, 1);
	}

	public static RankingConfiguration configuration(DomainProfile... profiles) {
		return configuration(7, profiles);
	}

	public static RankingConfiguration configuration(int windowSize, DomainProfile... profiles) {
		Map<MetricDomain, DomainProfile> domains = new EnumMap<>(MetricDomain.class);
		for (MetricDomain domain : MetricDomain.values()) {
			domains.put(domain, profile(domain, Polarity.LOWER_BETTER));
		}
		for (DomainProfile profile : profiles) {
			domains.put(profile.domain(), profile);
		}
		return new RankingConfiguration(windowSize, 1000.0, 10000.0, BANDS, domains, Map.of());
	}
}
