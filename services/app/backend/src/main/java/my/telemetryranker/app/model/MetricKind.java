package my.telemetryranker.app.model;

/**
 * The three statistics computed over every (entity, area) window.
 * The code is the column value used in exported tables.
 */
public enum MetricKind {
	FILL("llenado"),
	INSTABILITY("inestabilidad"),
	RATE_OF_CHANGE("tasa_cambio");

	private final String code;

	MetricKind(String code) {
		this.code = code;
	}

	public String code() {
		return code;
	}
}
