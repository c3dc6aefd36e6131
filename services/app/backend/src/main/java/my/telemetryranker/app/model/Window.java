package my.telemetryranker.app.model;

import java.util.List;

/**
 * Most recent records of one (entity, area) series, ascending by date. Never empty.
 */
public record Window(SeriesKey key, List<MetricRecord> records) {
	public Window {
		if (records == null || records.isEmpty()) {
			throw new IllegalArgumentException("Window for " + key + " must not be empty");
		}
		records = List.copyOf(records);
	}

	public String entityId() {
		return key.entityId();
	}

	public String areaId() {
		return key.areaId();
	}

	public int size() {
		return records.size();
	}

	public double[] values() {
		double[] values = new double[records.size()];
		for (int i = 0; i < records.size(); i++) {
			values[i] = records.get(i).rawValue();
		}
		return values;
	}

	/**
	 * Window values with the most recent first, the order used by exported ranking rows.
	 */
	public List<Double> valuesMostRecentFirst() {
		double[] values = values();
		Double[] reversed = new Double[values.length];
		for (int i = 0; i < values.length; i++) {
			reversed[i] = values[values.length - 1 - i];
		}
		return List.of(reversed);
	}
}
