package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.CompositeScore;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.RankingConfiguration;
import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.model.UnifiedScore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges per-domain final scores of the same entity into one cross-domain score. Domain weights
 * are renormalized over the domains an entity actually appears in.
 */
public class UnifiedRanker {
	private final RankingConfiguration configuration;
	private final RankAssigner rankAssigner = new RankAssigner();

	public UnifiedRanker(RankingConfiguration configuration) {
		this.configuration = configuration;
	}

	public List<UnifiedScore> unify(List<RankingResult> results) {
		Map<String, Map<MetricDomain, Double>> scoresByEntity = new TreeMap<>();
		if (results != null) {
			for (RankingResult result : results) {
				for (CompositeScore composite : result.composites()) {
					scoresByEntity.computeIfAbsent(composite.entityId(), key -> new EnumMap<>(MetricDomain.class))
							.put(result.domain(), composite.finalScore());
				}
			}
		}
		List<Pending> pending = new ArrayList<>();
		for (Map.Entry<String, Map<MetricDomain, Double>> entry : scoresByEntity.entrySet()) {
			double weighted = 0.0;
			double totalWeight = 0.0;
			for (Map.Entry<MetricDomain, Double> domainScore : entry.getValue().entrySet()) {
				double weight = domainWeight(domainScore.getKey());
				weighted += domainScore.getValue() * weight;
				totalWeight += weight;
			}
			if (totalWeight > 0.0) {
				pending.add(new Pending(entry.getKey(), weighted / totalWeight, entry.getValue()));
			}
		}
		Categorizer categorizer = new Categorizer(configuration.categories());
		List<UnifiedScore> unified = new ArrayList<>();
		for (RankAssigner.Ranked<Pending> ranked : rankAssigner.assign(pending, Pending::score, Pending::entityId)) {
			Pending item = ranked.item();
			unified.add(new UnifiedScore(ranked.position(), item.entityId(), item.score(),
					categorizer.categorize(item.score()), item.domainScores()));
		}
		return List.copyOf(unified);
	}

	private double domainWeight(MetricDomain domain) {
		if (configuration.unifiedDomainWeights().isEmpty()) {
			return 1.0;
		}
		return configuration.unifiedDomainWeights().getOrDefault(domain, 0.0);
	}

	private record Pending(String entityId, double score, Map<MetricDomain, Double> domainScores) {
	}
}
