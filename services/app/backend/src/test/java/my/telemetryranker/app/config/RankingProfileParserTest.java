package my.telemetryranker.app.config;

import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.Polarity;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingProfileParserTest {
	private final RankingProfileParser parser = new RankingProfileParser();

	@Test
	void parsesYamlProfile() throws IOException {
		AppProperties.Ranking ranking = parser.parse(fixture("/fixtures/ranking_profile.yml"));

		assertThat(ranking.windowSize()).isEqualTo(5);
		assertThat(ranking.categories()).extracting(AppProperties.Category::label).containsExactly("Alto", "Bajo");
		assertThat(ranking.unified().domainWeights()).containsEntry(MetricDomain.HDD, 3.0);
		AppProperties.Domain cp = ranking.domains().get(MetricDomain.CP);
		assertThat(cp.areas().get("CPLOAD").polarity()).isEqualTo(Polarity.LOWER_BETTER);
		assertThat(cp.areas().get("CPLOAD").weight()).isEqualTo(2.0);
		assertThat(cp.subMetricWeights().rateOfChange()).isEqualTo(0.0);
		assertThat(ranking.domains().get(MetricDomain.HDD).maxValue()).isEqualTo(100.0);
	}

	@Test
	void parsesJsonProfile() {
		String json = """
				{"window-size": 3, "domains": {"HDD": {"default-polarity": "HIGHER_BETTER"}}, "unknown-key": true}
				""";

		AppProperties.Ranking ranking = parser.parse(json);

		assertThat(ranking.windowSize()).isEqualTo(3);
		assertThat(ranking.domains().get(MetricDomain.HDD).defaultPolarity()).isEqualTo(Polarity.HIGHER_BETTER);
	}

	@Test
	void rejectsUnreadableProfile() {
		assertThatThrownBy(() -> parser.parse("window-size: [unclosed")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> parser.parse(" ")).isInstanceOf(IllegalArgumentException.class);
	}

	static String fixture(String path) throws IOException {
		try (InputStream input = Objects.requireNonNull(RankingProfileParserTest.class.getResourceAsStream(path))) {
			return new String(input.readAllBytes(), StandardCharsets.UTF_8);
		}
	}
}
