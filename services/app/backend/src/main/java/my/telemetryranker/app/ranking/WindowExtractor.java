package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.RunCondition;
import my.telemetryranker.app.model.SeriesKey;
import my.telemetryranker.app.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cuts each (entity, area) series down to its most recent daily records. Missing days are not
 * interpolated.
 */
public class WindowExtractor {
	private static final Logger logger = LoggerFactory.getLogger(WindowExtractor.class);

	private final int windowSize;

	public WindowExtractor(int windowSize) {
		if (windowSize < 1) {
			throw new IllegalArgumentException("windowSize must be at least 1");
		}
		this.windowSize = windowSize;
	}

	public Extraction extract(DomainProfile profile, Collection<MetricRecord> records) {
		if (records == null || records.isEmpty()) {
			return new Extraction(Map.of(), List.of());
		}
		List<RunCondition> conditions = new ArrayList<>();
		Map<SeriesKey, Map<LocalDate, MetricRecord>> series = new TreeMap<>();
		int outOfRange = 0;
		for (MetricRecord record : records) {
			if (record == null) {
				continue;
			}
			if (!profile.accepts(record.rawValue())) {
				outOfRange += 1;
				logger.debug("Dropping {} value {} for {} in area {} on {}: outside valid range",
						profile.domain(), record.rawValue(), record.entityId(), record.areaId(), record.date());
				continue;
			}
			Map<LocalDate, MetricRecord> byDate = series.computeIfAbsent(record.seriesKey(), key -> new TreeMap<>());
			MetricRecord existing = byDate.putIfAbsent(record.date(), record);
			if (existing != null) {
				logger.warn("Duplicate {} record for {} in area {} on {}; keeping the first value",
						profile.domain(), record.entityId(), record.areaId(), record.date());
				conditions.add(new RunCondition(RunCondition.DUPLICATE_RECORD, record.areaId(), record.entityId(), null,
						"Duplicate record on " + record.date() + " ignored"));
			}
		}
		if (outOfRange > 0) {
			logger.warn("Dropped {} {} records outside the valid range [{}, {}]",
					outOfRange, profile.domain(), profile.minValue(), profile.maxValue());
			conditions.add(new RunCondition(RunCondition.OUT_OF_RANGE, null, null, null,
					outOfRange + " records outside the valid range were dropped"));
		}

		Map<SeriesKey, Window> windows = new TreeMap<>();
		int minimumRecords = Math.max(1, profile.minimumRecords());
		for (Map.Entry<SeriesKey, Map<LocalDate, MetricRecord>> entry : series.entrySet()) {
			List<MetricRecord> ordered = new ArrayList<>(entry.getValue().values());
			ordered.sort(Comparator.comparing(MetricRecord::date));
			List<MetricRecord> recent = ordered.subList(Math.max(0, ordered.size() - windowSize), ordered.size());
			if (recent.size() < minimumRecords) {
				SeriesKey key = entry.getKey();
				logger.info("Skipping {} series {} / {}: {} records, {} required",
						profile.domain(), key.entityId(), key.areaId(), recent.size(), minimumRecords);
				conditions.add(new RunCondition(RunCondition.INSUFFICIENT_RECORDS, key.areaId(), key.entityId(), null,
						recent.size() + " records in window, " + minimumRecords + " required"));
				continue;
			}
			windows.put(entry.getKey(), new Window(entry.getKey(), recent));
		}
		return new Extraction(Collections.unmodifiableMap(windows), List.copyOf(conditions));
	}

	/**
	 * Windows keyed and ordered by (area, entity).
	 */
	public record Extraction(Map<SeriesKey, Window> windows, List<RunCondition> conditions) {
	}
}
