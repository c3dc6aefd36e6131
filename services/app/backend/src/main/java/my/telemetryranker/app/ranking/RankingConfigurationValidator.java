package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.AreaProfile;
import my.telemetryranker.app.model.CategoryBand;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.RankingConfiguration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RankingConfigurationValidator {

	public List<String> validate(RankingConfiguration configuration) {
		List<String> errors = new ArrayList<>();
		if (configuration == null) {
			errors.add("Ranking configuration is empty");
			return errors;
		}
		if (configuration.windowSize() < 1) {
			errors.add("window_size must be at least 1");
		}
		if (!positive(configuration.instabilityScale())) {
			errors.add("instability_scale must be a positive number");
		}
		if (!positive(configuration.rateOfChangeScale())) {
			errors.add("rate_of_change_scale must be a positive number");
		}
		validateCategories(configuration.categories(), errors);
		for (Map.Entry<MetricDomain, DomainProfile> entry : configuration.domains().entrySet()) {
			validateDomain(entry.getKey(), entry.getValue(), errors);
		}
		validateUnifiedWeights(configuration.unifiedDomainWeights(), errors);
		return errors;
	}

	public void check(RankingConfiguration configuration) {
		List<String> errors = validate(configuration);
		if (!errors.isEmpty()) {
			throw new RankingConfigurationException(errors);
		}
	}

	private void validateCategories(List<CategoryBand> categories, List<String> errors) {
		if (categories == null || categories.isEmpty()) {
			errors.add("categories must not be empty");
			return;
		}
		Set<String> labels = new HashSet<>();
		Set<Double> floors = new HashSet<>();
		for (CategoryBand band : categories) {
			if (band.label() == null || band.label().isBlank()) {
				errors.add("categories.label is required");
			} else if (!labels.add(band.label())) {
				errors.add("categories.label '" + band.label() + "' is duplicated");
			}
			if (!Double.isFinite(band.minScore()) || band.minScore() < 0.0 || band.minScore() > 100.0) {
				errors.add("categories.min_score for '" + band.label() + "' must be between 0 and 100");
			} else if (!floors.add(band.minScore())) {
				errors.add("categories.min_score " + band.minScore() + " is used by more than one band");
			}
		}
		double lowest = categories.stream()
				.map(CategoryBand::minScore)
				.min(Comparator.naturalOrder())
				.orElse(0.0);
		if (lowest != 0.0) {
			errors.add("the lowest category band must start at 0 so every score is categorized");
		}
	}

	private void validateDomain(MetricDomain domain, DomainProfile profile, List<String> errors) {
		String prefix = "domains." + domain;
		if (profile == null) {
			errors.add(prefix + " must not be empty");
			return;
		}
		double subMetricTotal = 0.0;
		for (MetricKind kind : MetricKind.values()) {
			double weight = profile.subMetricWeight(kind);
			if (!Double.isFinite(weight) || weight < 0.0) {
				errors.add(prefix + ".sub_metric_weights." + kind.code() + " must not be negative");
			} else {
				subMetricTotal += weight;
			}
		}
		if (subMetricTotal <= 0.0) {
			errors.add(prefix + ".sub_metric_weights must sum to a positive total");
		}
		double areaTotal = 0.0;
		for (AreaProfile area : profile.areas().values()) {
			if (area.polarity() == null && profile.defaultPolarity() == null) {
				errors.add(prefix + ".areas." + area.areaId() + ".polarity is required");
			}
			if (!Double.isFinite(area.weight()) || area.weight() < 0.0) {
				errors.add(prefix + ".areas." + area.areaId() + ".weight must not be negative");
			} else {
				areaTotal += area.weight();
			}
		}
		if (!profile.areas().isEmpty() && profile.defaultPolarity() == null && areaTotal <= 0.0) {
			errors.add(prefix + ".areas weights must sum to a positive total");
		}
		if (profile.minValue() != null && profile.maxValue() != null && profile.minValue() > profile.maxValue()) {
			errors.add(prefix + ".min_value must not exceed max_value");
		}
		if (profile.minimumRecords() < 1) {
			errors.add(prefix + ".minimum_records must be at least 1");
		}
	}

	private void validateUnifiedWeights(Map<MetricDomain, Double> weights, List<String> errors) {
		if (weights.isEmpty()) {
			return;
		}
		double total = 0.0;
		for (Map.Entry<MetricDomain, Double> entry : weights.entrySet()) {
			Double weight = entry.getValue();
			if (weight == null || !Double.isFinite(weight) || weight < 0.0) {
				errors.add("unified.domain_weights." + entry.getKey() + " must not be negative");
			} else {
				total += weight;
			}
		}
		if (total <= 0.0) {
			errors.add("unified.domain_weights must sum to a positive total");
		}
	}

	private boolean positive(double value) {
		return Double.isFinite(value) && value > 0.0;
	}
}
