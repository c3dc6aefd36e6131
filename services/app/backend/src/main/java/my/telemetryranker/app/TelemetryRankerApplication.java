package my.telemetryranker.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TelemetryRankerApplication {
	public static void main(String[] args) {
		SpringApplication.run(TelemetryRankerApplication.class, args);
	}
}
