package my.telemetryranker.app.report;

import my.telemetryranker.app.model.ComparisonResult;
import my.telemetryranker.app.model.CompositeScore;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.model.SubMetricValue;
import my.telemetryranker.app.model.UnifiedScore;
import my.telemetryranker.app.util.AreaListCodec;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Renders ranking tables as comma separated text with a header row. Window values are written
 * most recent first, padded with empty cells up to the configured window size.
 */
public class RankingCsvWriter {
	public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	static final List<String> COMPOSITE_HEADER = List.of("position", "entity_id", "final_score", "category",
			"explanation", "recommendation", "contributing_areas", "run_timestamp");

	public String writeSubMetrics(RankingResult result) {
		List<String> header = new ArrayList<>(List.of("area_id", "entity_id", "metric_kind", "position",
				"metric_value", "raw_metric_value", "normalized_score"));
		for (int i = 1; i <= result.windowSize(); i++) {
			header.add("value_" + i);
		}
		header.add("run_timestamp");
		String timestamp = formatTimestamp(result.runTimestamp());
		return print(header, printer -> {
			for (SubMetricValue value : result.subMetrics()) {
				List<Object> row = new ArrayList<>();
				row.add(value.areaId());
				row.add(value.entityId());
				row.add(value.kind().code());
				row.add(value.position());
				row.add(value.scaledValue());
				row.add(value.rawValue());
				row.add(value.normalizedScore());
				for (int i = 0; i < result.windowSize(); i++) {
					row.add(i < value.windowValues().size() ? value.windowValues().get(i) : "");
				}
				row.add(timestamp);
				printer.printRecord(row);
			}
		});
	}

	public String writeComposites(RankingResult result) {
		String timestamp = formatTimestamp(result.runTimestamp());
		return print(COMPOSITE_HEADER, printer -> {
			for (CompositeScore composite : result.composites()) {
				printer.printRecord(
						composite.position(),
						composite.entityId(),
						composite.finalScore(),
						composite.category(),
						composite.explanation(),
						composite.recommendation(),
						AreaListCodec.encode(composite.contributingAreas()),
						timestamp
				);
			}
		});
	}

	public String writeComparisonStatistics(ComparisonResult comparison) {
		List<String> header = List.of("metric", comparison.leftLabel(), comparison.rightLabel(), "delta");
		return print(header, printer -> {
			for (ComparisonResult.StatisticRow row : comparison.statistics()) {
				printer.printRecord(row.metric(), blankIfNull(row.left()), blankIfNull(row.right()), blankIfNull(row.delta()));
			}
		});
	}

	public String writeComparisonCategories(ComparisonResult comparison) {
		List<String> header = List.of("category", comparison.leftLabel(), comparison.rightLabel(), "total");
		return print(header, printer -> {
			for (ComparisonResult.CategoryRow row : comparison.categories()) {
				printer.printRecord(row.category(), row.left(), row.right(), row.total());
			}
		});
	}

	public String writeUnified(List<UnifiedScore> unified) {
		List<String> header = new ArrayList<>(List.of("position", "entity_id", "unified_score", "category"));
		for (MetricDomain domain : MetricDomain.values()) {
			header.add(domain.name().toLowerCase(Locale.ROOT) + "_score");
		}
		return print(header, printer -> {
			for (UnifiedScore score : unified) {
				List<Object> row = new ArrayList<>(Arrays.asList(score.position(), score.entityId(), score.unifiedScore(), score.category()));
				for (MetricDomain domain : MetricDomain.values()) {
					row.add(blankIfNull(score.domainScores().get(domain)));
				}
				printer.printRecord(row);
			}
		});
	}

	public static String formatTimestamp(LocalDateTime timestamp) {
		return timestamp == null ? "" : TIMESTAMP_FORMAT.format(timestamp);
	}

	private Object blankIfNull(Double value) {
		return value == null ? "" : value;
	}

	private String print(List<String> header, RowWriter rows) {
		StringWriter out = new StringWriter();
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(header.toArray(String[]::new))
				.setRecordSeparator('\n')
				.build();
		try (CSVPrinter printer = new CSVPrinter(out, format)) {
			rows.write(printer);
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to render CSV table", ex);
		}
		return out.toString();
	}

	@FunctionalInterface
	private interface RowWriter {
		void write(CSVPrinter printer) throws IOException;
	}
}
