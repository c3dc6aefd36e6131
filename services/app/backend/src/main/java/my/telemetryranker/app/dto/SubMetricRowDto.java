package my.telemetryranker.app.dto;

import java.util.List;

public record SubMetricRowDto(String areaId,
							  String entityId,
							  String metricKind,
							  int position,
							  double metricValue,
							  double rawMetricValue,
							  double normalizedScore,
							  List<Double> windowValues) {
}
