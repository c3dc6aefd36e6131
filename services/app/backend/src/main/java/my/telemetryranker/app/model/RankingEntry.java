package my.telemetryranker.app.model;

public record RankingEntry(
		int position,
		String entityId,
		double finalScore,
		String category
) {
}
