package my.telemetryranker.app.importer;

import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads daily telemetry records from CSV. Both the English column names and the Spanish ones
 * used by the monitoring exports are accepted.
 */
public class MetricCsvParser implements MetricRecordParser {
	private static final Logger logger = LoggerFactory.getLogger(MetricCsvParser.class);

	private static final List<String> ENTITY_COLUMNS = List.of("entity_id", "equipo");
	private static final List<String> AREA_COLUMNS = List.of("area_id", "unit_id", "area", "unidad");
	private static final List<String> DATE_COLUMNS = List.of("date", "fecha");
	private static final List<String> VALUE_COLUMNS = List.of("raw_value", "value", "valor", "uso");

	@Override
	public ParsedRecords parse(byte[] payload, String filename) {
		if (payload == null || payload.length == 0) {
			throw new IllegalArgumentException("CSV file is empty");
		}
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(content);
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(delimiter)
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.build();

		List<MetricRecord> records = new ArrayList<>();
		int skipped = 0;
		try (CSVParser parser = CSVParser.parse(new StringReader(content), format)) {
			Columns columns = resolveColumns(parser.getHeaderMap(), filename);
			for (CSVRecord row : parser) {
				if (row.size() <= columns.lastIndex()) {
					skipped++;
					logger.debug("Skipping row {} of {}: {} columns", row.getRecordNumber(), filename, row.size());
					continue;
				}
				try {
					records.add(new MetricRecord(
							row.get(columns.entity()),
							row.get(columns.area()),
							CsvParsing.parseDate(row.get(columns.date())),
							CsvParsing.parseDecimal(row.get(columns.value()))
					));
				} catch (IllegalArgumentException ex) {
					skipped++;
					logger.debug("Skipping row {} of {}: {}", row.getRecordNumber(), filename, ex.getMessage());
				}
			}
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read metric CSV: " + ex.getMessage(), ex);
		}
		if (skipped > 0) {
			logger.warn("Skipped {} unparseable rows in {}", skipped, filename);
		}
		logger.info("Parsed {} records from {}", records.size(), filename);
		return new ParsedRecords(records, skipped);
	}

	private Columns resolveColumns(Map<String, Integer> headerMap, String filename) {
		if (headerMap == null || headerMap.isEmpty()) {
			throw new IllegalArgumentException("CSV " + filename + " has no header row");
		}
		List<String> missing = new ArrayList<>();
		Integer entity = find(headerMap, ENTITY_COLUMNS, missing);
		Integer area = find(headerMap, AREA_COLUMNS, missing);
		Integer date = find(headerMap, DATE_COLUMNS, missing);
		Integer value = find(headerMap, VALUE_COLUMNS, missing);
		if (!missing.isEmpty()) {
			throw new IllegalArgumentException("CSV " + filename + " is missing columns: " + String.join(", ", missing));
		}
		return new Columns(entity, area, date, value);
	}

	private Integer find(Map<String, Integer> headerMap, List<String> aliases, List<String> missing) {
		for (Map.Entry<String, Integer> entry : headerMap.entrySet()) {
			if (aliases.contains(CsvParsing.normalizeHeader(entry.getKey()))) {
				return entry.getValue();
			}
		}
		missing.add(aliases.get(0));
		return null;
	}

	private record Columns(int entity, int area, int date, int value) {
		int lastIndex() {
			return Math.max(Math.max(entity, area), Math.max(date, value));
		}
	}
}
