package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.SeriesKey;
import my.telemetryranker.app.model.Window;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static my.telemetryranker.app.support.RankingTestData.record;
import static my.telemetryranker.app.support.RankingTestData.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SubMetricCalculatorTest {
	private final SubMetricCalculator calculator = new SubMetricCalculator();

	@Test
	void computesAllThreeStatistics() {
		Map<MetricKind, Double> values = calculator.compute(window(series("A", "C:", 2, 4, 4, 4, 5, 5, 7, 9)));

		assertThat(values.get(MetricKind.FILL)).isCloseTo(5.0, within(1e-9));
		assertThat(values.get(MetricKind.INSTABILITY)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-9));
		// differences 2, 0, 0, 1, 0, 2, 2
		assertThat(values.get(MetricKind.RATE_OF_CHANGE)).isCloseTo(1.0, within(1e-9));
	}

	@Test
	void deviationDependsOnWindowLength() {
		// same squared deviations, sample divisors 1 and 3
		double shortWindow = calculator.instability(window(series("A", "C:", 10, 20)));
		double longWindow = calculator.instability(window(series("A", "C:", 15, 15, 10, 20)));

		assertThat(shortWindow).isCloseTo(Math.sqrt(50.0), within(1e-9));
		assertThat(longWindow).isCloseTo(Math.sqrt(50.0 / 3.0), within(1e-9));
		assertThat(longWindow).isLessThan(shortWindow);
	}

	@Test
	void singleSampleHasZeroInstabilityAndNoRateOfChange() {
		Map<MetricKind, Double> values = calculator.compute(window(List.of(record("A", "C:", 0, 12.5))));

		assertThat(values).containsEntry(MetricKind.FILL, 12.5).containsEntry(MetricKind.INSTABILITY, 0.0);
		assertThat(values).doesNotContainKey(MetricKind.RATE_OF_CHANGE);
	}

	@Test
	void rateOfChangeOnlyUsesConsecutiveDays() {
		Window gapped = window(List.of(
				record("A", "C:", 0, 10),
				record("A", "C:", 2, 50),
				record("A", "C:", 3, 60)
		));

		assertThat(SubMetricCalculator.consecutiveDifferences(gapped)).containsExactly(10.0);
		assertThat(calculator.rateOfChange(gapped)).hasValue(0.0);
	}

	@Test
	void rateOfChangeIsEmptyWithoutConsecutiveDays() {
		Window gapped = window(List.of(record("A", "C:", 0, 10), record("A", "C:", 5, 20)));

		assertThat(calculator.rateOfChange(gapped)).isEmpty();
		assertThat(calculator.compute(gapped)).containsOnlyKeys(MetricKind.FILL, MetricKind.INSTABILITY);
	}

	private Window window(List<MetricRecord> records) {
		return new Window(new SeriesKey("A", "C:"), records);
	}
}
