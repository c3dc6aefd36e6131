package my.telemetryranker.app.dto;

public record RunConditionDto(String code,
							  String areaId,
							  String entityId,
							  String metricKind,
							  String message) {
}
