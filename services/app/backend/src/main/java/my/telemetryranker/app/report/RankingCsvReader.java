package my.telemetryranker.app.report;

import my.telemetryranker.app.model.CompositeScore;
import my.telemetryranker.app.util.AreaListCodec;
import my.telemetryranker.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads a composite table written by {@link RankingCsvWriter} back into composite scores
 * (without per-area detail), typically to compare two exported rankings.
 */
public class RankingCsvReader {

	public List<CompositeScore> readComposites(String content) {
		if (content == null || content.isBlank()) {
			return List.of();
		}
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.build();
		List<CompositeScore> composites = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(new StringReader(CsvParsing.stripBom(content)), format)) {
			for (String column : List.of("position", "entity_id", "final_score", "category")) {
				if (!parser.getHeaderMap().containsKey(column)) {
					throw new IllegalArgumentException("Composite table is missing column " + column);
				}
			}
			for (CSVRecord row : parser) {
				composites.add(new CompositeScore(
						parseInt(row.get("position"), row.getRecordNumber()),
						row.get("entity_id"),
						CsvParsing.parseDecimal(row.get("final_score")),
						row.get("category"),
						row.isMapped("contributing_areas") ? AreaListCodec.decode(row.get("contributing_areas")) : List.of(),
						List.of(),
						row.isMapped("explanation") ? row.get("explanation") : null,
						row.isMapped("recommendation") ? row.get("recommendation") : null
				));
			}
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read composite table: " + ex.getMessage(), ex);
		}
		composites.sort(Comparator.comparingInt(CompositeScore::position));
		return List.copyOf(composites);
	}

	private int parseInt(String raw, long recordNumber) {
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("Invalid position '" + raw + "' in row " + recordNumber, ex);
		}
	}
}
