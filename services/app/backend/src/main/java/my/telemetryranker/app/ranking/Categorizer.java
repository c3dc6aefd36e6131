package my.telemetryranker.app.ranking;

import my.telemetryranker.app.model.CategoryBand;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class Categorizer {
	private final List<CategoryBand> bands;

	public Categorizer(List<CategoryBand> bands) {
		if (bands == null || bands.isEmpty()) {
			throw new RankingConfigurationException("At least one category band is required");
		}
		List<CategoryBand> ordered = new ArrayList<>(bands);
		ordered.sort(Comparator.comparingDouble(CategoryBand::minScore).reversed());
		this.bands = List.copyOf(ordered);
	}

	public String categorize(double score) {
		for (CategoryBand band : bands) {
			if (score >= band.minScore()) {
				return band.label();
			}
		}
		return bands.get(bands.size() - 1).label();
	}

	/**
	 * Category vocabulary, best band first.
	 */
	public List<String> labels() {
		return bands.stream().map(CategoryBand::label).toList();
	}
}
