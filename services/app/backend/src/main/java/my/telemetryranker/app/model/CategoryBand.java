package my.telemetryranker.app.model;

/**
 * A quality tier; a score belongs to the first band, highest first, whose minScore it reaches.
 */
public record CategoryBand(String label, double minScore) {
}
