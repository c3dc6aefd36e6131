package my.telemetryranker.app.util;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Descriptive statistics backed by commons-math3. Standard deviations use the divisor n - 1
 * (a single value yields 0) and quantiles interpolate linearly between closest ranks.
 */
public final class Statistics {
	private Statistics() {
	}

	public static DescriptiveStatistics describe(double[] values) {
		if (values == null || values.length == 0) {
			throw new IllegalArgumentException("values must not be empty");
		}
		DescriptiveStatistics statistics = new DescriptiveStatistics(values);
		statistics.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
		return statistics;
	}

	public static double mean(double[] values) {
		return describe(values).getMean();
	}

	public static double sampleStd(double[] values) {
		return describe(values).getStandardDeviation();
	}

	public static double max(double[] values) {
		return describe(values).getMax();
	}

	public static double min(double[] values) {
		return describe(values).getMin();
	}

	public static double quantile(double[] values, double q) {
		return quantile(describe(values), q);
	}

	/**
	 * Quantile for q in [0, 1].
	 */
	public static double quantile(DescriptiveStatistics statistics, double q) {
		if (q < 0.0 || q > 1.0) {
			throw new IllegalArgumentException("quantile must be between 0 and 1: " + q);
		}
		if (q == 0.0) {
			return statistics.getMin();
		}
		return statistics.getPercentile(q * 100.0);
	}
}
