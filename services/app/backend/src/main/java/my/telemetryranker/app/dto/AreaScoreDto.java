package my.telemetryranker.app.dto;

public record AreaScoreDto(String areaId, double score, double weight) {
}
