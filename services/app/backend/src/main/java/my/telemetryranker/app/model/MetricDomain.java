package my.telemetryranker.app.model;

import java.util.Locale;

public enum MetricDomain {
	CP,
	HDD;

	public static MetricDomain parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("domain is required");
		}
		try {
			return MetricDomain.valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unknown domain: " + value, ex);
		}
	}
}
