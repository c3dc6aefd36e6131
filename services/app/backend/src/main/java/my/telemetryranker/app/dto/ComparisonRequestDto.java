package my.telemetryranker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ComparisonRequestDto(@Valid @NotNull RankingSetDto left,
								   @Valid @NotNull RankingSetDto right) {
}
