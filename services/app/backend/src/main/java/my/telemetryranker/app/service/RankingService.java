package my.telemetryranker.app.service;

import my.telemetryranker.app.config.RankingConfigurationFactory;
import my.telemetryranker.app.config.RankingProfileParser;
import my.telemetryranker.app.importer.MetricCsvParser;
import my.telemetryranker.app.importer.MetricRecordParser;
import my.telemetryranker.app.importer.ParsedRecords;
import my.telemetryranker.app.model.ComparisonResult;
import my.telemetryranker.app.model.CompositeScore;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.RankingConfiguration;
import my.telemetryranker.app.model.RankingEntry;
import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.model.RankingStatistics;
import my.telemetryranker.app.model.UnifiedScore;
import my.telemetryranker.app.ranking.RankingAnalyzer;
import my.telemetryranker.app.ranking.RankingComparator;
import my.telemetryranker.app.ranking.RankingEngine;
import my.telemetryranker.app.ranking.UnifiedRanker;
import my.telemetryranker.app.report.RankingCsvReader;
import my.telemetryranker.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class RankingService {
	private static final Logger logger = LoggerFactory.getLogger(RankingService.class);
	private static final int DEFAULT_TOP_N = 10;

	private final RankingEngine rankingEngine;
	private final RankingConfiguration configuration;
	private final Clock clock;
	private final MetricRecordParser recordParser = new MetricCsvParser();
	private final RankingProfileParser profileParser = new RankingProfileParser();
	private final RankingCsvReader tableReader = new RankingCsvReader();

	public RankingService(RankingEngine rankingEngine, RankingConfiguration configuration, Clock clock) {
		this.rankingEngine = rankingEngine;
		this.configuration = configuration;
		this.clock = clock;
	}

	public RankingConfiguration configuration() {
		return configuration;
	}

	public RankingConfiguration loadProfile(String content) {
		return new RankingConfigurationFactory().create(profileParser.parse(content));
	}

	public RankingResult rank(MetricDomain domain, Collection<MetricRecord> records) {
		return rank(domain, records, configuration, now());
	}

	public RankingResult rank(MetricDomain domain,
							  Collection<MetricRecord> records,
							  RankingConfiguration rankingConfiguration,
							  LocalDateTime runTimestamp) {
		return rankingEngine.rank(domain, records, rankingConfiguration, runTimestamp);
	}

	public ParsedRecords parseCsv(byte[] payload, String filename) {
		return recordParser.parse(payload, filename);
	}

	public CsvRankingOutcome rankCsv(MetricDomain domain, byte[] payload, String filename) {
		ParsedRecords parsed = parseCsv(payload, filename);
		if (parsed.skippedRows() > 0) {
			logger.warn("{} rows of {} could not be parsed and were skipped", parsed.skippedRows(), filename);
		}
		return new CsvRankingOutcome(rank(domain, parsed.records()), parsed.skippedRows());
	}

	public UnifiedRanking unify(Map<MetricDomain, ? extends Collection<MetricRecord>> recordsByDomain) {
		return unify(recordsByDomain, configuration, now());
	}

	public UnifiedRanking unify(Map<MetricDomain, ? extends Collection<MetricRecord>> recordsByDomain,
								RankingConfiguration rankingConfiguration,
								LocalDateTime runTimestamp) {
		Map<MetricDomain, Collection<MetricRecord>> ordered = new EnumMap<>(MetricDomain.class);
		if (recordsByDomain != null) {
			ordered.putAll(recordsByDomain);
		}
		List<RankingResult> results = new ArrayList<>();
		for (Map.Entry<MetricDomain, Collection<MetricRecord>> entry : ordered.entrySet()) {
			results.add(rankingEngine.rank(entry.getKey(), entry.getValue(), rankingConfiguration, runTimestamp));
		}
		List<UnifiedScore> unified = new UnifiedRanker(rankingConfiguration).unify(results);
		logger.info("Built unified ranking of {} entities from {} domains", unified.size(), results.size());
		return new UnifiedRanking(results, unified);
	}

	public ComparisonResult compare(String leftLabel, List<RankingEntry> left, String rightLabel, List<RankingEntry> right) {
		return compare(configuration, leftLabel, left, rightLabel, right);
	}

	/**
	 * Counts categories against the bands of the given configuration, which must be the one
	 * both rankings were produced with.
	 */
	public ComparisonResult compare(RankingConfiguration rankingConfiguration,
									String leftLabel,
									List<RankingEntry> left,
									String rightLabel,
									List<RankingEntry> right) {
		return new RankingComparator(rankingConfiguration.categoryLabels()).compare(leftLabel, left, rightLabel, right);
	}

	public ComparisonResult compareExports(String leftLabel, byte[] leftTable, String rightLabel, byte[] rightTable) {
		List<RankingEntry> left = readEntries(leftLabel, leftTable);
		List<RankingEntry> right = readEntries(rightLabel, rightTable);
		return compare(leftLabel, left, rightLabel, right);
	}

	public RankingStatistics analyze(String label, List<RankingEntry> entries, Integer topN) {
		int limit = topN == null ? DEFAULT_TOP_N : topN;
		if (limit < 0) {
			throw new IllegalArgumentException("topN must not be negative");
		}
		return new RankingAnalyzer(configuration.categoryLabels()).analyze(label, entries, limit);
	}

	private List<RankingEntry> readEntries(String label, byte[] table) {
		if (table == null) {
			throw new IllegalArgumentException("Composite table for " + label + " is missing");
		}
		return tableReader.readComposites(CsvParsing.decodeUtf8(table)).stream()
				.map(CompositeScore::toEntry)
				.toList();
	}

	private LocalDateTime now() {
		return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
	}
}
