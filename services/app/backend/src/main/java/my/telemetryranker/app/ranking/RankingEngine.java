package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.AreaScore;
import my.telemetryranker.app.model.CompositeScore;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.Polarity;
import my.telemetryranker.app.model.RankingConfiguration;
import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.model.RunCondition;
import my.telemetryranker.app.model.SeriesKey;
import my.telemetryranker.app.model.SubMetricValue;
import my.telemetryranker.app.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Ranks the entities of one metric domain from raw daily records.
 * <p>
 * Stateless: the configuration and the run timestamp are passed on every call, so identical
 * inputs always produce identical results.
 */
@Service
public class RankingEngine {
	private static final Logger logger = LoggerFactory.getLogger(RankingEngine.class);

	private final RankingConfigurationValidator validator = new RankingConfigurationValidator();
	private final SubMetricCalculator calculator = new SubMetricCalculator();
	private final PercentileNormalizer normalizer = new PercentileNormalizer();
	private final RankAssigner rankAssigner = new RankAssigner();

	public RankingResult rank(MetricDomain domain,
							  Collection<MetricRecord> records,
							  RankingConfiguration configuration,
							  LocalDateTime runTimestamp) {
		Objects.requireNonNull(domain, "domain");
		Objects.requireNonNull(runTimestamp, "runTimestamp");
		validator.check(configuration);
		DomainProfile profile = configuration.profile(domain);
		if (records == null || records.isEmpty()) {
			logger.info("No {} records supplied; returning an empty ranking", domain);
			return RankingResult.empty(domain, runTimestamp, configuration.windowSize());
		}

		DirectionRegistry directions = new DirectionRegistry(configuration);
		Set<String> areas = records.stream()
				.filter(Objects::nonNull)
				.map(MetricRecord::areaId)
				.collect(Collectors.toSet());
		directions.requireRegistered(domain, areas);

		logger.info("Ranking {} from {} records across {} areas", domain, records.size(), areas.size());
		WindowExtractor.Extraction extraction = new WindowExtractor(configuration.windowSize()).extract(profile, records);
		List<RunCondition> conditions = new ArrayList<>(extraction.conditions());

		Map<String, List<Window>> windowsByArea = new TreeMap<>();
		for (Window window : extraction.windows().values()) {
			windowsByArea.computeIfAbsent(window.areaId(), key -> new ArrayList<>()).add(window);
		}

		Map<String, Map<String, Map<MetricKind, SubMetricValue>>> byEntity = new TreeMap<>();
		List<SubMetricValue> subMetricRows = new ArrayList<>();
		for (Map.Entry<String, List<Window>> areaEntry : windowsByArea.entrySet()) {
			String areaId = areaEntry.getKey();
			Polarity polarity = directions.direction(domain, areaId);
			Map<String, Window> windowsByEntity = new TreeMap<>();
			Map<String, Map<MetricKind, Double>> rawByEntity = new TreeMap<>();
			for (Window window : areaEntry.getValue()) {
				windowsByEntity.put(window.entityId(), window);
				rawByEntity.put(window.entityId(), calculator.compute(window));
			}
			for (MetricKind kind : MetricKind.values()) {
				List<SubMetricValue> slice = normalizeSlice(areaId, kind, polarity, configuration.scale(kind),
						windowsByEntity, rawByEntity);
				if (slice.isEmpty()) {
					logger.info("No eligible {} entities for {} in area {}", domain, kind.code(), areaId);
					conditions.add(new RunCondition(RunCondition.EMPTY_SLICE, areaId, null, kind,
							"No eligible entities for " + kind.code()));
					continue;
				}
				subMetricRows.addAll(slice);
				for (SubMetricValue value : slice) {
					byEntity.computeIfAbsent(value.entityId(), key -> new TreeMap<>())
							.computeIfAbsent(areaId, key -> new EnumMap<>(MetricKind.class))
							.put(kind, value);
				}
			}
		}

		CompositeScorer scorer = new CompositeScorer(profile);
		List<Candidate> candidates = new ArrayList<>();
		for (Map.Entry<String, Map<String, Map<MetricKind, SubMetricValue>>> entityEntry : byEntity.entrySet()) {
			String entityId = entityEntry.getKey();
			List<AreaScore> areaScores = new ArrayList<>();
			for (Map.Entry<String, Map<MetricKind, SubMetricValue>> areaEntry : entityEntry.getValue().entrySet()) {
				OptionalDouble areaScore = scorer.areaScore(areaEntry.getValue());
				if (areaScore.isPresent()) {
					areaScores.add(new AreaScore(areaEntry.getKey(), areaScore.getAsDouble(),
							profile.areaWeight(areaEntry.getKey()), areaEntry.getValue()));
				}
			}
			OptionalDouble finalScore = scorer.finalScore(areaScores);
			if (finalScore.isEmpty()) {
				logger.warn("Excluding {} entity {}: no contributing area", domain, entityId);
				conditions.add(new RunCondition(RunCondition.ENTITY_EXCLUDED, null, entityId, null,
						"No area with a positive weight and a valid sub-metric"));
				continue;
			}
			List<AreaScore> contributing = areaScores.stream().filter(score -> score.weight() > 0.0).toList();
			candidates.add(new Candidate(entityId, finalScore.getAsDouble(), contributing));
		}

		Categorizer categorizer = new Categorizer(configuration.categories());
		ExplanationBuilder explanations = new ExplanationBuilder(profile);
		List<CompositeScore> composites = new ArrayList<>();
		for (RankAssigner.Ranked<Candidate> ranked : rankAssigner.assign(candidates, Candidate::finalScore, Candidate::entityId)) {
			Candidate candidate = ranked.item();
			ExplanationBuilder.Explanation explanation = explanations.explain(candidate.areaScores());
			composites.add(new CompositeScore(
					ranked.position(),
					candidate.entityId(),
					candidate.finalScore(),
					categorizer.categorize(candidate.finalScore()),
					candidate.areaScores().stream().map(AreaScore::areaId).toList(),
					candidate.areaScores(),
					explanation.text(),
					explanation.recommendation()
			));
		}
		logger.info("Ranked {} {} entities ({} sub-metric rows, {} conditions)",
				composites.size(), domain, subMetricRows.size(), conditions.size());
		return new RankingResult(domain, runTimestamp, configuration.windowSize(), records.size(),
				composites, subMetricRows, conditions);
	}

	private List<SubMetricValue> normalizeSlice(String areaId,
												MetricKind kind,
												Polarity polarity,
												double scale,
												Map<String, Window> windowsByEntity,
												Map<String, Map<MetricKind, Double>> rawByEntity) {
		Map<String, Double> scaled = new LinkedHashMap<>();
		for (Map.Entry<String, Map<MetricKind, Double>> entry : rawByEntity.entrySet()) {
			Double raw = entry.getValue().get(kind);
			if (raw != null) {
				scaled.put(entry.getKey(), raw * scale);
			}
		}
		if (scaled.isEmpty()) {
			return List.of();
		}
		Map<String, Double> scores = normalizer.normalize(scaled, polarity);
		List<SubMetricValue> slice = new ArrayList<>(scaled.size());
		for (RankAssigner.Ranked<String> ranked : rankAssigner.assign(scaled.keySet(), scores::get, entityId -> entityId)) {
			String entityId = ranked.item();
			slice.add(new SubMetricValue(
					entityId,
					areaId,
					kind,
					rawByEntity.get(entityId).get(kind),
					scaled.get(entityId),
					scores.get(entityId),
					ranked.position(),
					windowsByEntity.get(entityId).valuesMostRecentFirst()
			));
		}
		return slice;
	}

	private record Candidate(String entityId, double finalScore, List<AreaScore> areaScores) {
	}
}
