package my.telemetryranker.app.model;

/**
 * A non-fatal condition observed during a run, such as an empty slice or an excluded entity.
 * Fields that do not apply are null.
 */
public record RunCondition(
		String code,
		String areaId,
		String entityId,
		MetricKind kind,
		String message
) {
	public static final String EMPTY_SLICE = "EMPTY_SLICE";
	public static final String ENTITY_EXCLUDED = "ENTITY_EXCLUDED";
	public static final String DUPLICATE_RECORD = "DUPLICATE_RECORD";
	public static final String OUT_OF_RANGE = "OUT_OF_RANGE";
	public static final String INSUFFICIENT_RECORDS = "INSUFFICIENT_RECORDS";
}
