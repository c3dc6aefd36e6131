package my.telemetryranker.app.importer;

public interface MetricRecordParser {
	ParsedRecords parse(byte[] payload, String filename);
}
