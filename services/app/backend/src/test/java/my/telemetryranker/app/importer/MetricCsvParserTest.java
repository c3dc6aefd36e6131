package my.telemetryranker.app.importer;

import my.telemetryranker.app.model.MetricRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricCsvParserTest {
	private final MetricCsvParser parser = new MetricCsvParser();

	@Test
	void parsesEnglishColumns() {
		String csv = "entity_id,area_id,date,raw_value\n"
				+ "PC01,CPLOAD,2024-01-01,12.5\n"
				+ "PC02,CPLOAD,2024-01-01 10:15:00,7\n";

		ParsedRecords parsed = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "cp.csv");

		assertThat(parsed.skippedRows()).isZero();
		assertThat(parsed.records()).containsExactly(
				new MetricRecord("PC01", "CPLOAD", LocalDate.of(2024, 1, 1), 12.5),
				new MetricRecord("PC02", "CPLOAD", LocalDate.of(2024, 1, 1), 7.0)
		);
	}

	@Test
	void parsesSpanishColumnsWithSemicolonsAndDecimalCommas() {
		String csv = "\uFEFFEquipo;Unidad;Fecha;Uso\n"
				+ "PC01;C:;2024-01-02;45,5\n";

		ParsedRecords parsed = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "hdd.csv");

		assertThat(parsed.records()).containsExactly(new MetricRecord("PC01", "C:", LocalDate.of(2024, 1, 2), 45.5));
	}

	@Test
	void skipsUnparseableRows() {
		String csv = "equipo,area,fecha,valor\n"
				+ "PC01,CPLOAD,2024-01-01,1\n"
				+ "PC02,CPLOAD,not-a-date,1\n"
				+ ",CPLOAD,2024-01-01,1\n"
				+ "PC03,CPLOAD,2024-01-01,\n";

		ParsedRecords parsed = parser.parse(csv.getBytes(StandardCharsets.UTF_8), "cp.csv");

		assertThat(parsed.records()).extracting(MetricRecord::entityId).containsExactly("PC01");
		assertThat(parsed.skippedRows()).isEqualTo(3);
	}

	@Test
	void rejectsMissingColumns() {
		String csv = "equipo,fecha,valor\nPC01,2024-01-01,1\n";

		assertThatThrownBy(() -> parser.parse(csv.getBytes(StandardCharsets.UTF_8), "cp.csv"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("area_id");
	}

	@Test
	void rejectsEmptyPayload() {
		assertThatThrownBy(() -> parser.parse(new byte[0], "empty.csv")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void parsesFixtureFile() throws IOException {
		byte[] payload;
		try (InputStream input = Objects.requireNonNull(getClass().getResourceAsStream("/fixtures/cp_sample.csv"))) {
			payload = input.readAllBytes();
		}

		ParsedRecords parsed = parser.parse(payload, "cp_sample.csv");

		assertThat(parsed.records()).hasSize(24);
		assertThat(parsed.skippedRows()).isZero();
		assertThat(parsed.records()).extracting(MetricRecord::areaId).containsOnly("CPLOAD", "IOLOAD");
	}
}
