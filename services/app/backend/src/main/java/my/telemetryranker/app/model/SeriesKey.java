package my.telemetryranker.app.model;

import java.util.Comparator;

/**
 * Identifies one (entity, area) time series.
 */
public record SeriesKey(String entityId, String areaId) implements Comparable<SeriesKey> {
	private static final Comparator<SeriesKey> ORDER = Comparator.comparing(SeriesKey::areaId)
			.thenComparing(SeriesKey::entityId);

	@Override
	public int compareTo(SeriesKey other) {
		return ORDER.compare(this, other);
	}
}
