package my.telemetryranker.app.service;

import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.model.UnifiedScore;

import java.util.List;

public record UnifiedRanking(List<RankingResult> domainResults, List<UnifiedScore> ranking) {
	public UnifiedRanking {
		domainResults = domainResults == null ? List.of() : List.copyOf(domainResults);
		ranking = ranking == null ? List.of() : List.copyOf(ranking);
	}
}
