package my.telemetryranker.app.api;

import my.telemetryranker.app.dto.AreaScoreDto;
import my.telemetryranker.app.dto.ComparisonResponseDto;
import my.telemetryranker.app.dto.CompositeScoreDto;
import my.telemetryranker.app.dto.MetricRecordDto;
import my.telemetryranker.app.dto.RankingConfigurationDto;
import my.telemetryranker.app.dto.RankingEntryDto;
import my.telemetryranker.app.dto.RankingResponseDto;
import my.telemetryranker.app.dto.RankingSetDto;
import my.telemetryranker.app.dto.RankingStatisticsDto;
import my.telemetryranker.app.dto.RunConditionDto;
import my.telemetryranker.app.dto.SubMetricRowDto;
import my.telemetryranker.app.dto.UnifiedScoreDto;
import my.telemetryranker.app.model.AreaProfile;
import my.telemetryranker.app.model.ComparisonResult;
import my.telemetryranker.app.model.CompositeScore;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.RankingConfiguration;
import my.telemetryranker.app.model.RankingEntry;
import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.model.RankingStatistics;
import my.telemetryranker.app.model.RunCondition;
import my.telemetryranker.app.model.SubMetricValue;
import my.telemetryranker.app.model.UnifiedScore;
import my.telemetryranker.app.report.RankingCsvWriter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class RankingDtoMapper {
	private RankingDtoMapper() {
	}

	static List<MetricRecord> toRecords(List<MetricRecordDto> records) {
		if (records == null) {
			return List.of();
		}
		return records.stream()
				.map(dto -> new MetricRecord(dto.entityId(), dto.areaId(), dto.date(), dto.rawValue()))
				.toList();
	}

	static List<RankingEntry> toEntries(RankingSetDto set) {
		return set.entries().stream()
				.map(dto -> new RankingEntry(dto.position(), dto.entityId(), dto.finalScore(), dto.category()))
				.toList();
	}

	static RankingResponseDto toResponse(RankingResult result, int skippedRows) {
		return new RankingResponseDto(
				result.domain().name(),
				RankingCsvWriter.formatTimestamp(result.runTimestamp()),
				result.windowSize(),
				result.recordCount(),
				result.rankedCount(),
				skippedRows,
				result.composites().stream().map(RankingDtoMapper::toComposite).toList(),
				result.subMetrics().stream().map(RankingDtoMapper::toSubMetric).toList(),
				result.conditions().stream().map(RankingDtoMapper::toCondition).toList()
		);
	}

	static ComparisonResponseDto toComparison(ComparisonResult comparison) {
		return new ComparisonResponseDto(
				comparison.leftLabel(),
				comparison.rightLabel(),
				comparison.statistics().stream()
						.map(row -> new ComparisonResponseDto.StatisticRowDto(row.metric(), row.left(), row.right(), row.delta()))
						.toList(),
				comparison.categories().stream()
						.map(row -> new ComparisonResponseDto.CategoryRowDto(row.category(), row.left(), row.right(), row.total()))
						.toList()
		);
	}

	static UnifiedScoreDto toUnified(UnifiedScore score) {
		Map<String, Double> domainScores = new LinkedHashMap<>();
		score.domainScores().forEach((domain, value) -> domainScores.put(domain.name(), value));
		return new UnifiedScoreDto(score.position(), score.entityId(), score.unifiedScore(), score.category(), domainScores);
	}

	static RankingStatisticsDto toStatistics(RankingStatistics statistics) {
		Map<String, Double> percentiles = new LinkedHashMap<>();
		statistics.percentiles().forEach((percentile, value) -> percentiles.put("p" + percentile, value));
		return new RankingStatisticsDto(
				statistics.label(),
				statistics.count(),
				statistics.max(),
				statistics.min(),
				statistics.mean(),
				statistics.std(),
				statistics.median(),
				statistics.q1(),
				statistics.q3(),
				statistics.iqr(),
				percentiles,
				statistics.categoryDistribution().stream()
						.map(share -> new RankingStatisticsDto.CategoryShareDto(share.category(), share.count(), share.percentage()))
						.toList(),
				statistics.top().stream().map(RankingDtoMapper::toEntry).toList(),
				statistics.bottom().stream().map(RankingDtoMapper::toEntry).toList()
		);
	}

	static RankingConfigurationDto toConfiguration(RankingConfiguration configuration) {
		Map<String, RankingConfigurationDto.DomainDto> domains = new LinkedHashMap<>();
		for (Map.Entry<MetricDomain, DomainProfile> entry : configuration.domains().entrySet()) {
			DomainProfile profile = entry.getValue();
			Map<String, Double> weights = new LinkedHashMap<>();
			for (MetricKind kind : MetricKind.values()) {
				weights.put(kind.code(), profile.subMetricWeight(kind));
			}
			List<RankingConfigurationDto.AreaDto> areas = profile.areas().values().stream()
					.map(RankingDtoMapper::toArea)
					.toList();
			domains.put(entry.getKey().name(), new RankingConfigurationDto.DomainDto(
					profile.defaultPolarity() == null ? null : profile.defaultPolarity().name(),
					areas,
					weights,
					profile.minValue(),
					profile.maxValue(),
					profile.minimumRecords()
			));
		}
		Map<String, Double> unifiedWeights = new LinkedHashMap<>();
		configuration.unifiedDomainWeights().forEach((domain, weight) -> unifiedWeights.put(domain.name(), weight));
		return new RankingConfigurationDto(
				configuration.windowSize(),
				configuration.instabilityScale(),
				configuration.rateOfChangeScale(),
				configuration.categories().stream()
						.map(band -> new RankingConfigurationDto.CategoryDto(band.label(), band.minScore()))
						.toList(),
				domains,
				unifiedWeights
		);
	}

	private static RankingConfigurationDto.AreaDto toArea(AreaProfile area) {
		return new RankingConfigurationDto.AreaDto(
				area.areaId(),
				area.polarity() == null ? null : area.polarity().name(),
				area.weight(),
				area.description()
		);
	}

	private static RankingEntryDto toEntry(RankingEntry entry) {
		return new RankingEntryDto(entry.position(), entry.entityId(), entry.finalScore(), entry.category());
	}

	private static CompositeScoreDto toComposite(CompositeScore composite) {
		return new CompositeScoreDto(
				composite.position(),
				composite.entityId(),
				composite.finalScore(),
				composite.category(),
				composite.contributingAreas(),
				composite.areaScores().stream()
						.map(area -> new AreaScoreDto(area.areaId(), area.score(), area.weight()))
						.toList(),
				composite.explanation(),
				composite.recommendation()
		);
	}

	private static SubMetricRowDto toSubMetric(SubMetricValue value) {
		return new SubMetricRowDto(
				value.areaId(),
				value.entityId(),
				value.kind().code(),
				value.position(),
				value.scaledValue(),
				value.rawValue(),
				value.normalizedScore(),
				value.windowValues()
		);
	}

	private static RunConditionDto toCondition(RunCondition condition) {
		return new RunConditionDto(
				condition.code(),
				condition.areaId(),
				condition.entityId(),
				condition.kind() == null ? null : condition.kind().code(),
				condition.message()
		);
	}
}
