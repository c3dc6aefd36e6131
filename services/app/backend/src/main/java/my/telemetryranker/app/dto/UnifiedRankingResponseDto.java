package my.telemetryranker.app.dto;

import java.util.List;

public record UnifiedRankingResponseDto(String runTimestamp,
										List<UnifiedScoreDto> ranking,
										List<RankingResponseDto> domains) {
}
