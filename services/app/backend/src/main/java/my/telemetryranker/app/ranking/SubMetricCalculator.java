package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.Window;
import my.telemetryranker.app.util.Statistics;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Computes the unscaled fill, instability and rate-of-change statistics of one window.
 * Scaling for presentation is applied by the caller.
 */
public class SubMetricCalculator {

	public Map<MetricKind, Double> compute(Window window) {
		Map<MetricKind, Double> values = new EnumMap<>(MetricKind.class);
		values.put(MetricKind.FILL, fill(window));
		values.put(MetricKind.INSTABILITY, instability(window));
		rateOfChange(window).ifPresent(value -> values.put(MetricKind.RATE_OF_CHANGE, value));
		return Collections.unmodifiableMap(values);
	}

	public double fill(Window window) {
		return Statistics.mean(window.values());
	}

	/**
	 * Sample standard deviation of the window values; 0 for a single sample.
	 */
	public double instability(Window window) {
		return Statistics.sampleStd(window.values());
	}

	/**
	 * Sample standard deviation of the consecutive-day differences. Empty when the window has
	 * no two records on consecutive days.
	 */
	public OptionalDouble rateOfChange(Window window) {
		double[] differences = consecutiveDifferences(window);
		if (differences.length == 0) {
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(Statistics.sampleStd(differences));
	}

	static double[] consecutiveDifferences(Window window) {
		List<MetricRecord> records = window.records();
		List<Double> differences = new ArrayList<>();
		for (int i = 1; i < records.size(); i++) {
			MetricRecord previous = records.get(i - 1);
			MetricRecord current = records.get(i);
			if (ChronoUnit.DAYS.between(previous.date(), current.date()) != 1) {
				continue;
			}
			differences.add(current.rawValue() - previous.rawValue());
		}
		return differences.stream().mapToDouble(Double::doubleValue).toArray();
	}
}
