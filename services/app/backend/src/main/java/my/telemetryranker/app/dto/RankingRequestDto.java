package my.telemetryranker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RankingRequestDto(@NotNull List<@Valid @NotNull MetricRecordDto> records) {
}
