package my.telemetryranker.app;

import my.telemetryranker.app.config.AppProperties;
import my.telemetryranker.app.config.RankingBatchRunner;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.MetricDomain;
import my.telemetryranker.app.model.MetricKind;
import my.telemetryranker.app.model.Polarity;
import my.telemetryranker.app.model.RankingConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class TelemetryRankerApplicationTests {

	@Autowired
	private ApplicationContext context;

	@Autowired
	private AppProperties properties;

	@Autowired
	private RankingConfiguration configuration;

	@Test
	void contextLoads() {
		assertThat(context.getBeansOfType(RankingBatchRunner.class)).isEmpty();
	}

	@Test
	void bindsShippedRankingDefaults() {
		assertThat(properties.ranking().domains().get(MetricDomain.CP).areas())
				.containsKeys("PP_NFD", "IOLOAD", "totmem", "CUMOVR", "OMOVRN", "TLCONS", "OMLDAV", "CPLOAD", "MAXMEM");

		assertThat(configuration.windowSize()).isEqualTo(7);
		assertThat(configuration.categoryLabels())
				.containsExactly("Excelente", "Muy Bueno", "Bueno", "Regular", "Necesita Mejora");
		assertThat(configuration.unifiedDomainWeights()).containsEntry(MetricDomain.CP, 0.45).containsEntry(MetricDomain.HDD, 0.55);

		DomainProfile cp = configuration.profile(MetricDomain.CP);
		assertThat(cp.defaultPolarity()).isNull();
		assertThat(cp.areas().get("totmem").polarity()).isEqualTo(Polarity.LOWER_BETTER);
		assertThat(cp.describe("PP_NFD")).isEqualTo("Archivos no encontrados");
		assertThat(cp.subMetricWeight(MetricKind.FILL)).isEqualTo(0.4);

		DomainProfile hdd = configuration.profile(MetricDomain.HDD);
		assertThat(hdd.defaultPolarity()).isEqualTo(Polarity.LOWER_BETTER);
		assertThat(hdd.subMetricWeight(MetricKind.RATE_OF_CHANGE)).isEqualTo(0.2);
		assertThat(hdd.maxValue()).isEqualTo(100.0);
	}
}
