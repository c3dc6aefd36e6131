package my.telemetryranker.app.service;

import my.telemetryranker.app.model.RankingResult;

public record CsvRankingOutcome(RankingResult result, int skippedRows) {
}
