package my.telemetryranker.app.config;

import my.telemetryranker.app.ranking.RankingEngine;
import my.telemetryranker.app.service.RankingService;
import my.telemetryranker.app.support.RankingTestData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingBatchRunnerTest {
	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T08:00:00Z"), ZoneOffset.UTC);

	@TempDir
	Path workDir;

	private final RankingService rankingService =
			new RankingService(new RankingEngine(), RankingTestData.configuration(), CLOCK);

	@Test
	void writesEveryTableForBothDomains() throws IOException {
		Path cp = copyFixture("cp_sample.csv");
		Path hdd = copyFixture("hdd_sample.csv");
		Path out = workDir.resolve("out");

		runner(new AppProperties.Batch(true, cp.toString(), hdd.toString(), out.toString(), null)).run(arguments());

		assertThat(out.resolve("cp_sub_metrics.csv")).exists();
		assertThat(out.resolve("cp_ranking.csv")).exists();
		assertThat(out.resolve("hdd_sub_metrics.csv")).exists();
		assertThat(out.resolve("hdd_ranking.csv")).exists();
		assertThat(out.resolve("comparison_statistics.csv")).exists();
		assertThat(out.resolve("comparison_categories.csv")).exists();

		List<String> unified = Files.readAllLines(out.resolve("unified_ranking.csv"), StandardCharsets.UTF_8);
		assertThat(unified.get(0)).isEqualTo("position,entity_id,unified_score,category,cp_score,hdd_score");
		assertThat(unified).hasSize(5);

		List<String> cpRanking = Files.readAllLines(out.resolve("cp_ranking.csv"), StandardCharsets.UTF_8);
		assertThat(cpRanking).hasSize(4);
		assertThat(cpRanking.get(1)).endsWith("2024-02-01 08:00:00");
	}

	@Test
	void skipsComparisonWithSingleDomain() throws IOException {
		Path hdd = copyFixture("hdd_sample.csv");
		Path out = workDir.resolve("hdd-only");

		runner(new AppProperties.Batch(true, null, hdd.toString(), out.toString(), null)).run(arguments());

		assertThat(out.resolve("hdd_ranking.csv")).exists();
		assertThat(out.resolve("unified_ranking.csv")).exists();
		assertThat(out.resolve("cp_ranking.csv")).doesNotExist();
		assertThat(out.resolve("comparison_statistics.csv")).doesNotExist();
	}

	@Test
	void appliesProfileFile() throws IOException {
		Path cp = copyFixture("cp_sample.csv");
		Path hdd = copyFixture("hdd_sample.csv");
		Path profile = copyFixture("ranking_profile.yml");
		Path out = workDir.resolve("profiled");

		runner(new AppProperties.Batch(true, cp.toString(), hdd.toString(), out.toString(), profile.toString())).run(arguments());

		List<String> subMetrics = Files.readAllLines(out.resolve("cp_sub_metrics.csv"), StandardCharsets.UTF_8);
		assertThat(subMetrics.get(0)).contains("value_5").doesNotContain("value_6");

		int ranked = Files.readAllLines(out.resolve("cp_ranking.csv"), StandardCharsets.UTF_8).size() - 1
				+ Files.readAllLines(out.resolve("hdd_ranking.csv"), StandardCharsets.UTF_8).size() - 1;
		List<String> categories = Files.readAllLines(out.resolve("comparison_categories.csv"), StandardCharsets.UTF_8);
		assertThat(categories.get(0)).isEqualTo("category,CP,HDD,total");
		assertThat(categories.subList(1, categories.size()))
				.extracting(line -> line.split(",")[0])
				.containsExactly("Alto", "Bajo");
		int matrixTotal = categories.subList(1, categories.size()).stream()
				.mapToInt(line -> Integer.parseInt(line.split(",")[3]))
				.sum();
		assertThat(matrixTotal).isEqualTo(ranked).isEqualTo(6);

		List<String> unified = Files.readAllLines(out.resolve("unified_ranking.csv"), StandardCharsets.UTF_8);
		assertThat(unified.subList(1, unified.size()))
				.extracting(line -> line.split(",")[3])
				.allMatch(category -> category.equals("Alto") || category.equals("Bajo"));
	}

	@Test
	void comparisonMatrixCoversEveryRankedEntity() throws IOException {
		Path cp = copyFixture("cp_sample.csv");
		Path hdd = copyFixture("hdd_sample.csv");
		Path out = workDir.resolve("defaults");

		runner(new AppProperties.Batch(true, cp.toString(), hdd.toString(), out.toString(), null)).run(arguments());

		List<String> categories = Files.readAllLines(out.resolve("comparison_categories.csv"), StandardCharsets.UTF_8);
		int matrixTotal = categories.subList(1, categories.size()).stream()
				.mapToInt(line -> Integer.parseInt(line.split(",")[3]))
				.sum();
		assertThat(matrixTotal).isEqualTo(6);
	}

	@Test
	void requiresOutputDirectory() {
		RankingBatchRunner runner = runner(new AppProperties.Batch(true, "cp.csv", null, " ", null));

		assertThatThrownBy(() -> runner.run(arguments()))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("output-dir");
	}

	@Test
	void doesNothingWithoutInputs() throws IOException {
		Path out = workDir.resolve("empty");

		runner(new AppProperties.Batch(true, "", null, out.toString(), null)).run(arguments());

		assertThat(out).isEmptyDirectory();
	}

	private RankingBatchRunner runner(AppProperties.Batch batch) {
		return new RankingBatchRunner(rankingService, new AppProperties(null, batch), CLOCK);
	}

	private static DefaultApplicationArguments arguments() {
		return new DefaultApplicationArguments();
	}

	private Path copyFixture(String name) throws IOException {
		Path target = workDir.resolve(name);
		try (InputStream input = Objects.requireNonNull(getClass().getResourceAsStream("/fixtures/" + name))) {
			Files.copy(input, target);
		}
		return target;
	}
}
