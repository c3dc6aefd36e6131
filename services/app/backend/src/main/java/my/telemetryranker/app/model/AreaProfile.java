package my.telemetryranker.app.model;

public record AreaProfile(
		String areaId,
		Polarity polarity,
		double weight,
		String description
) {
}
