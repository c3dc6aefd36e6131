package my.telemetryranker.app.config;

import my.telemetryranker.app.importer.ParsedRecords;
import my.telemetryranker.app.model.ComparisonResult;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricRecord;
import my.telemetryranker.app.model.RankingConfiguration;
import my.telemetryranker.app.model.RankingResult;
import my.telemetryranker.app.report.RankingCsvWriter;
import my.telemetryranker.app.service.RankingService;
import my.telemetryranker.app.service.UnifiedRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline run: ranks the configured CP and HDD exports and writes every table into the output directory.
 */
@Component
@ConditionalOnProperty(prefix = "app.batch", name = "enabled", havingValue = "true")
public class RankingBatchRunner implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(RankingBatchRunner.class);

	private final RankingService rankingService;
	private final AppProperties properties;
	private final Clock clock;
	private final RankingCsvWriter writer = new RankingCsvWriter();

	public RankingBatchRunner(RankingService rankingService, AppProperties properties, Clock clock) {
		this.rankingService = rankingService;
		this.properties = properties;
		this.clock = clock;
	}

	@Override
	public void run(ApplicationArguments args) throws IOException {
		AppProperties.Batch batch = properties.batch();
		if (batch == null || batch.outputDir() == null || batch.outputDir().isBlank()) {
			throw new IllegalStateException("app.batch.output-dir is required when the batch run is enabled");
		}
		RankingConfiguration configuration = resolveConfiguration(batch);
		LocalDateTime runTimestamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
		Path outputDir = Path.of(batch.outputDir());
		Files.createDirectories(outputDir);

		Map<MetricDomain, List<MetricRecord>> records = new EnumMap<>(MetricDomain.class);
		readInput(MetricDomain.CP, batch.cpInput(), records);
		readInput(MetricDomain.HDD, batch.hddInput(), records);
		if (records.isEmpty()) {
			logger.warn("Batch run enabled but no input file configured (app.batch.cp-input / app.batch.hdd-input)");
			return;
		}

		UnifiedRanking unified = rankingService.unify(records, configuration, runTimestamp);
		for (RankingResult result : unified.domainResults()) {
			String prefix = result.domain().name().toLowerCase(Locale.ROOT);
			write(outputDir.resolve(prefix + "_sub_metrics.csv"), writer.writeSubMetrics(result));
			write(outputDir.resolve(prefix + "_ranking.csv"), writer.writeComposites(result));
			logger.info("{} ranking: {} entities ranked, {} conditions", result.domain(), result.rankedCount(),
					result.conditions().size());
		}
		write(outputDir.resolve("unified_ranking.csv"), writer.writeUnified(unified.ranking()));

		if (unified.domainResults().size() == 2) {
			RankingResult left = unified.domainResults().get(0);
			RankingResult right = unified.domainResults().get(1);
			ComparisonResult comparison = rankingService.compare(configuration,
					left.domain().name(), left.entries(), right.domain().name(), right.entries());
			write(outputDir.resolve("comparison_statistics.csv"), writer.writeComparisonStatistics(comparison));
			write(outputDir.resolve("comparison_categories.csv"), writer.writeComparisonCategories(comparison));
		}
		logger.info("Batch run finished; tables written to {}", outputDir.toAbsolutePath());
	}

	private RankingConfiguration resolveConfiguration(AppProperties.Batch batch) throws IOException {
		if (batch.profile() == null || batch.profile().isBlank()) {
			return rankingService.configuration();
		}
		Path profile = Path.of(batch.profile());
		logger.info("Using ranking profile {}", profile.toAbsolutePath());
		return rankingService.loadProfile(Files.readString(profile, StandardCharsets.UTF_8));
	}

	private void readInput(MetricDomain domain, String location, Map<MetricDomain, List<MetricRecord>> records) throws IOException {
		if (location == null || location.isBlank()) {
			return;
		}
		Path path = Path.of(location);
		ParsedRecords parsed = rankingService.parseCsv(Files.readAllBytes(path), path.getFileName().toString());
		logger.info("Read {} {} records from {} ({} rows skipped)", parsed.records().size(), domain, path,
				parsed.skippedRows());
		records.put(domain, parsed.records());
	}

	private void write(Path target, String content) {
		try {
			Files.writeString(target, content, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to write " + target, ex);
		}
	}
}
