package my.telemetryranker.app.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record MetricRecordDto(@NotBlank String entityId,
							  @NotBlank @JsonAlias("unitId") String areaId,
							  @NotNull LocalDate date,
							  @NotNull @JsonAlias("value") Double rawValue) {
}
