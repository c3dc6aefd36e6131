package my.telemetryranker.app.dto;

import java.util.List;
import java.util.Map;

public record RankingConfigurationDto(int windowSize,
									  double instabilityScale,
									  double rateOfChangeScale,
									  List<CategoryDto> categories,
									  Map<String, DomainDto> domains,
									  Map<String, Double> unifiedDomainWeights) {
	public record CategoryDto(String label, double minScore) {
	}

	public record DomainDto(String defaultPolarity,
							List<AreaDto> areas,
							Map<String, Double> subMetricWeights,
							Double minValue,
							Double maxValue,
							int minimumRecords) {
	}

	public record AreaDto(String areaId, String polarity, double weight, String description) {
	}
}
