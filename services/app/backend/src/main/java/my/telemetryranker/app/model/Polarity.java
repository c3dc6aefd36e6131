package my.telemetryranker.app.model;

public enum Polarity {
	LOWER_BETTER,
	HIGHER_BETTER
}
