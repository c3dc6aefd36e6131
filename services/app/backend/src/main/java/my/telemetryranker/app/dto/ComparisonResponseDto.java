package my.telemetryranker.app.dto;

import java.util.List;

public record ComparisonResponseDto(String leftLabel,
									String rightLabel,
									List<StatisticRowDto> statistics,
									List<CategoryRowDto> categories) {
	public record StatisticRowDto(String metric, Double left, Double right, Double delta) {
	}

	public record CategoryRowDto(String category, int left, int right, int total) {
	}
}
