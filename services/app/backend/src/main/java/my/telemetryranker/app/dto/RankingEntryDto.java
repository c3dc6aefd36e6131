package my.telemetryranker.app.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RankingEntryDto(@Min(1) int position,
							  @NotBlank String entityId,
							  @NotNull Double finalScore,
							  String category) {
}
