package my.telemetryranker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record AnalyzeRequestDto(@Valid @NotNull RankingSetDto ranking,
								@Min(0) Integer topN) {
}
