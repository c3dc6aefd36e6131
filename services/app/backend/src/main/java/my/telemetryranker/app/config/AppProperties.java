package my.telemetryranker.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.Polarity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Ranking ranking,
		Batch batch
) {
	public record Ranking(
			Integer windowSize,
			Double instabilityScale,
			Double rateOfChangeScale,
			List<@Valid Category> categories,
			Map<MetricDomain, Domain> domains,
			Unified unified
	) {
	}

	public record Category(
			@NotBlank String label,
			Double minScore
	) {
	}

	public record Domain(
			Polarity defaultPolarity,
			Map<String, Area> areas,
			SubMetricWeights subMetricWeights,
			Double minValue,
			Double maxValue,
			Integer minimumRecords
	) {
	}

	public record Area(
			Polarity polarity,
			Double weight,
			String description
	) {
	}

	public record SubMetricWeights(
			Double fill,
			Double instability,
			Double rateOfChange
	) {
	}

	public record Unified(
			Map<MetricDomain, Double> domainWeights
	) {
	}

	public record Batch(
			boolean enabled,
			String cpInput,
			String hddInput,
			String outputDir,
			String profile
	) {
	}
}
