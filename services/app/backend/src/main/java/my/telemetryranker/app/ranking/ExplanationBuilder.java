package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.AreaScore;
import my.telemetryranker.app.model.DomainProfile;
import my.telemetryranker.app.model.SubMetricValue;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the per-area explanation text and the recommendation attached to a composite score.
 */
public class ExplanationBuilder {
	static final String LINE_SEPARATOR = " | ";
	static final String RECOMMENDATION_SEPARATOR = "; ";
	static final int MAX_LISTED_AREAS = 3;

	private final DomainProfile profile;

	public ExplanationBuilder(DomainProfile profile) {
		this.profile = profile;
	}

	public Explanation explain(List<AreaScore> areaScores) {
		List<String> lines = new ArrayList<>();
		Set<String> criticalAreas = new LinkedHashSet<>();
		Set<String> regularAreas = new LinkedHashSet<>();
		for (AreaScore areaScore : areaScores) {
			String description = profile.describe(areaScore.areaId());
			for (SubMetricValue value : areaScore.subMetrics().values()) {
				Tier tier = Tier.of(value.normalizedScore());
				lines.add(line(areaScore.areaId(), description, value, tier));
				if (tier == Tier.CRITICAL) {
					criticalAreas.add(description);
				} else if (tier == Tier.REGULAR) {
					regularAreas.add(description);
				}
			}
		}
		regularAreas.removeAll(criticalAreas);
		return new Explanation(String.join(LINE_SEPARATOR, lines), recommend(criticalAreas, regularAreas));
	}

	private String line(String areaId, String description, SubMetricValue value, Tier tier) {
		String score = format(value.normalizedScore());
		return switch (value.kind()) {
			case FILL -> String.format(Locale.ROOT, "%s %s (%spts): nivel promedio de %s en %s",
					description, tier.label, score, format(value.rawValue()), areaId);
			case INSTABILITY -> String.format(Locale.ROOT, "Estabilidad en %s %s (%spts): variabilidad de %s en %s",
					description, tier.label, score, format(value.scaledValue()), areaId);
			case RATE_OF_CHANGE -> String.format(Locale.ROOT, "Cambios en %s %s (%spts): variabilidad diaria de %s en %s",
					description, tier.label, score, format(value.scaledValue()), areaId);
		};
	}

	private String recommend(Set<String> criticalAreas, Set<String> regularAreas) {
		List<String> recommendations = new ArrayList<>();
		if (!criticalAreas.isEmpty()) {
			recommendations.add(criticalAreas.size() == 1
					? "Intervención inmediata requerida en " + criticalAreas.iterator().next()
					: "Intervención inmediata requerida en múltiples áreas: " + listed(criticalAreas));
		}
		if (!regularAreas.isEmpty()) {
			recommendations.add(regularAreas.size() == 1
					? "Optimizar rendimiento en " + regularAreas.iterator().next()
					: "Optimizar rendimiento en múltiples áreas: " + listed(regularAreas));
		}
		if (criticalAreas.isEmpty() && regularAreas.isEmpty()) {
			recommendations.add("Mantener estándares actuales de rendimiento");
		} else if (criticalAreas.size() > MAX_LISTED_AREAS) {
			recommendations.add("Revisión completa del equipo requerida");
		}
		return String.join(RECOMMENDATION_SEPARATOR, recommendations);
	}

	private String listed(Set<String> areas) {
		return String.join(", ", areas.stream().limit(MAX_LISTED_AREAS).toList());
	}

	private static String format(double value) {
		return String.format(Locale.ROOT, "%.1f", value);
	}

	enum Tier {
		EXCELLENT("Excelente", 80.0),
		GOOD("Buena", 60.0),
		REGULAR("Regular", 40.0),
		CRITICAL("Crítica", Double.NEGATIVE_INFINITY);

		private final String label;
		private final double floor;

		Tier(String label, double floor) {
			this.label = label;
			this.floor = floor;
		}

		static Tier of(double score) {
			for (Tier tier : values()) {
				if (score >= tier.floor) {
					return tier;
				}
			}
			return CRITICAL;
		}
	}

	public record Explanation(String text, String recommendation) {
	}
}
