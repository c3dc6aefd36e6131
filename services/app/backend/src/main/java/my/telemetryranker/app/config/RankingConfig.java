package my.telemetryranker.app.config;

import my.telemetryranker.app.model.RankingConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class RankingConfig {
	private static final Logger logger = LoggerFactory.getLogger(RankingConfig.class);

	@Bean
	public RankingConfiguration rankingConfiguration(AppProperties properties) {
		RankingConfiguration configuration = new RankingConfigurationFactory().create(properties.ranking());
		logger.info("Ranking configuration loaded (window={}, categories={}, domains={}).",
				configuration.windowSize(), configuration.categoryLabels(), configuration.domains().keySet());
		return configuration;
	}

	@Bean
	public Clock rankingClock() {
		return Clock.systemDefaultZone();
	}
}
