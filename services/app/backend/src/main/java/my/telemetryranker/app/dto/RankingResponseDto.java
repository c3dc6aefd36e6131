package my.telemetryranker.app.dto;

import java.util.List;

public record RankingResponseDto(String domain,
								 String runTimestamp,
								 int windowSize,
								 int recordCount,
								 int rankedCount,
								 int skippedRows,
								 List<CompositeScoreDto> ranking,
								 List<SubMetricRowDto> subMetrics,
								 List<RunConditionDto> conditions) {
}
