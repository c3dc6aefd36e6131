package my.telemetryranker.app.dto;

import java.util.List;
import java.util.Map;

public record RankingStatisticsDto(String label,
								   int count,
								   Double max,
								   Double min,
								   Double mean,
								   Double std,
								   Double median,
								   Double q1,
								   Double q3,
								   Double iqr,
								   Map<String, Double> percentiles,
								   List<CategoryShareDto> categoryDistribution,
								   List<RankingEntryDto> top,
								   List<RankingEntryDto> bottom) {
	public record CategoryShareDto(String category, int count, double percentage) {
	}
}
