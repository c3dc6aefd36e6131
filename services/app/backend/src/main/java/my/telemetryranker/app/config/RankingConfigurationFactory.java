package my.telemetryranker.app.config;

import my.telemetryranker.app.model.AreaProfile;
import my.telemetryranker.app.model.CategoryBand;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.RankingConfiguration;
import my.telemetryranker.app.ranking.RankingConfigurationValidator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable {@link RankingConfiguration} from bound or parsed properties, filling
 * defaults and rejecting anything the validator flags.
 */
public class RankingConfigurationFactory {
	static final int DEFAULT_WINDOW_SIZE = 7;
	static final double DEFAULT_INSTABILITY_SCALE = 1000.0;
	static final double DEFAULT_RATE_OF_CHANGE_SCALE = 10000.0;
	static final double DEFAULT_AREA_WEIGHT = 1.0;
	static final int DEFAULT_MINIMUM_RECORDS = 1;
	static final List<CategoryBand> DEFAULT_CATEGORIES = List.of(
			new CategoryBand("Excelente", 90.0),
			new CategoryBand("Muy Bueno", 75.0),
			new CategoryBand("Bueno", 60.0),
			new CategoryBand("Regular", 40.0),
			new CategoryBand("Necesita Mejora", 0.0)
	);

	private final RankingConfigurationValidator validator = new RankingConfigurationValidator();

	public RankingConfiguration create(AppProperties.Ranking ranking) {
		RankingConfiguration configuration = ranking == null ? defaults() : build(ranking);
		validator.check(configuration);
		return configuration;
	}

	private RankingConfiguration defaults() {
		return new RankingConfiguration(DEFAULT_WINDOW_SIZE, DEFAULT_INSTABILITY_SCALE, DEFAULT_RATE_OF_CHANGE_SCALE,
				DEFAULT_CATEGORIES, emptyProfiles(), Map.of());
	}

	private RankingConfiguration build(AppProperties.Ranking ranking) {
		Map<MetricDomain, DomainProfile> profiles = emptyProfiles();
		if (ranking.domains() != null) {
			for (Map.Entry<MetricDomain, AppProperties.Domain> entry : ranking.domains().entrySet()) {
				if (entry.getKey() != null) {
					profiles.put(entry.getKey(), buildProfile(entry.getKey(), entry.getValue()));
				}
			}
		}
		Map<MetricDomain, Double> unifiedWeights = new EnumMap<>(MetricDomain.class);
		if (ranking.unified() != null && ranking.unified().domainWeights() != null) {
			unifiedWeights.putAll(ranking.unified().domainWeights());
		}
		return new RankingConfiguration(
				ranking.windowSize() == null ? DEFAULT_WINDOW_SIZE : ranking.windowSize(),
				ranking.instabilityScale() == null ? DEFAULT_INSTABILITY_SCALE : ranking.instabilityScale(),
				ranking.rateOfChangeScale() == null ? DEFAULT_RATE_OF_CHANGE_SCALE : ranking.rateOfChangeScale(),
				buildCategories(ranking.categories()),
				profiles,
				unifiedWeights
		);
	}

	private List<CategoryBand> buildCategories(List<AppProperties.Category> categories) {
		if (categories == null || categories.isEmpty()) {
			return DEFAULT_CATEGORIES;
		}
		List<CategoryBand> bands = new ArrayList<>();
		for (AppProperties.Category category : categories) {
			if (category == null) {
				continue;
			}
			double minScore = category.minScore() == null ? Double.NaN : category.minScore();
			bands.add(new CategoryBand(category.label(), minScore));
		}
		return bands;
	}

	private DomainProfile buildProfile(MetricDomain domain, AppProperties.Domain properties) {
		if (properties == null) {
			return emptyProfile(domain);
		}
		Map<String, AreaProfile> areas = new LinkedHashMap<>();
		if (properties.areas() != null) {
			for (Map.Entry<String, AppProperties.Area> entry : properties.areas().entrySet()) {
				AppProperties.Area area = entry.getValue();
				String areaId = entry.getKey().trim();
				areas.put(areaId, new AreaProfile(
						areaId,
						area == null ? null : area.polarity(),
						area == null || area.weight() == null ? DEFAULT_AREA_WEIGHT : area.weight(),
						area == null ? null : area.description()
				));
			}
		}
		return new DomainProfile(
				domain,
				properties.defaultPolarity(),
				areas,
				subMetricWeights(properties.subMetricWeights()),
				properties.minValue(),
				properties.maxValue(),
				properties.minimumRecords() == null ? DEFAULT_MINIMUM_RECORDS : properties.minimumRecords()
		);
	}

	private Map<MetricKind, Double> subMetricWeights(AppProperties.SubMetricWeights weights) {
		Map<MetricKind, Double> result = new EnumMap<>(MetricKind.class);
		if (weights == null) {
			for (MetricKind kind : MetricKind.values()) {
				result.put(kind, 1.0 / MetricKind.values().length);
			}
			return result;
		}
		result.put(MetricKind.FILL, orZero(weights.fill()));
		result.put(MetricKind.INSTABILITY, orZero(weights.instability()));
		result.put(MetricKind.RATE_OF_CHANGE, orZero(weights.rateOfChange()));
		return result;
	}

	private Map<MetricDomain, DomainProfile> emptyProfiles() {
		Map<MetricDomain, DomainProfile> profiles = new EnumMap<>(MetricDomain.class);
		for (MetricDomain domain : MetricDomain.values()) {
			profiles.put(domain, emptyProfile(domain));
		}
		return profiles;
	}

	private DomainProfile emptyProfile(MetricDomain domain) {
		return new DomainProfile(domain, null, Map.of(), subMetricWeights(null), null, null, DEFAULT_MINIMUM_RECORDS);
	}

	private double orZero(Double value) {
		return value == null ? 0.0 : value;
	}
}
