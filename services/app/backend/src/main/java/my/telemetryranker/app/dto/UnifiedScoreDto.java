package my.telemetryranker.app.dto;

import java.util.Map;

public record UnifiedScoreDto(int position,
							  String entityId,
							  double unifiedScore,
							  String category,
							  Map<String, Double> domainScores) {
}
