package my.telemetryranker.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RankingSetDto(@NotBlank String label,
							@NotNull List<@Valid @NotNull RankingEntryDto> entries) {
}
