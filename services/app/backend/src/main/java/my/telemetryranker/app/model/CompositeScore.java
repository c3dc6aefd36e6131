package my.telemetryranker.app.model;

import java.util.List;

public record CompositeScore(
		int position,
		String entityId,
		double finalScore,
		String category,
		List<String> contributingAreas,
		List<AreaScore> areaScores,
		String explanation,
		String recommendation
) {
	public CompositeScore {
		contributingAreas = contributingAreas == null ? List.of() : List.copyOf(contributingAreas);
		areaScores = areaScores == null ? List.of() : List.copyOf(areaScores);
	}

	public RankingEntry toEntry() {
		return new RankingEntry(position, entityId, finalScore, category);
	}
}
