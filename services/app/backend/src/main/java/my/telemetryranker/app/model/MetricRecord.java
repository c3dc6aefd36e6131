package my.telemetryranker.app.model;

import java.time.LocalDate;

public record MetricRecord(
		String entityId,
		String areaId,
		LocalDate date,
		double rawValue
) {
	public MetricRecord {
		if (entityId == null || entityId.isBlank()) {
			throw new IllegalArgumentException("entityId is required");
		}
		if (areaId == null || areaId.isBlank()) {
			throw new IllegalArgumentException("areaId is required for entity " + entityId);
		}
		if (date == null) {
			throw new IllegalArgumentException("date is required for entity " + entityId + " in area " + areaId);
		}
		entityId = entityId.trim();
		areaId = areaId.trim();
	}

	public SeriesKey seriesKey() {
		return new SeriesKey(entityId, areaId);
	}
}
