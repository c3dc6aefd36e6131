package my.telemetryranker.app.dto;

import java.util.List;

public record CompositeScoreDto(int position,
								String entityId,
								double finalScore,
								String category,
								List<String> contributingAreas,
								List<AreaScoreDto> areaScores,
								String explanation,
								String recommendation) {
}
