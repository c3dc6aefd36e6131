package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.Polarity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw values into direction-adjusted percentiles within one (area, kind) population.
 * <p>
 * A value scores {@code 100 * (N - 1 - b) / (N - 1)} where b counts the population members strictly
 * more favorable than it. Tied values share the higher score, so the most favorable value always
 * scores 100 and a population of identical values scores 100 throughout. A population of one scores 100.
 */
public class PercentileNormalizer {
	private static final double MAX_SCORE = 100.0;

	public Map<String, Double> normalize(Map<String, Double> valuesByEntity, Polarity polarity) {
		if (valuesByEntity == null || valuesByEntity.isEmpty()) {
			return Map.of();
		}
		double[] population = valuesByEntity.values().stream().mapToDouble(Double::doubleValue).toArray();
		Map<String, Double> scores = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : valuesByEntity.entrySet()) {
			scores.put(entry.getKey(), score(entry.getValue(), population, polarity));
		}
		return Collections.unmodifiableMap(scores);
	}

	public double score(double value, double[] population, Polarity polarity) {
		if (population == null || population.length == 0) {
			throw new IllegalArgumentException("population must not be empty");
		}
		if (population.length == 1) {
			return MAX_SCORE;
		}
		int moreFavorable = 0;
		for (double other : population) {
			boolean better = polarity == Polarity.LOWER_BETTER ? other < value : other > value;
			if (better) {
				moreFavorable += 1;
			}
		}
		int rest = population.length - 1;
		return MAX_SCORE * Math.max(0, rest - moreFavorable) / rest;
	}
}
