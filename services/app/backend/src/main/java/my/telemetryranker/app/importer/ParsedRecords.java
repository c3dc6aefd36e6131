package my.telemetryranker.app.importer;

import my.telemetryranker.app.model.MetricRecord;

import java.util.List;

public record ParsedRecords(List<MetricRecord> records, int skippedRows) {
	public ParsedRecords {
		records = records == null ? List.of() : List.copyOf(records);
	}
}
