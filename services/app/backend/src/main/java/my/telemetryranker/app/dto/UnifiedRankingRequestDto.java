package my.telemetryranker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record UnifiedRankingRequestDto(List<@Valid @NotNull MetricRecordDto> cpRecords,
									   List<@Valid @NotNull MetricRecordDto> hddRecords) {
}
