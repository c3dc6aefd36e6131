package my.telemetryranker.app.ranking;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Orders items by score descending, then by id ascending, and numbers them 1..N.
 */
public class RankAssigner {

	public <T> List<Ranked<T>> assign(Collection<T> items, ToDoubleFunction<T> score, Function<T, String> id) {
		if (items == null || items.isEmpty()) {
			return List.of();
		}
		Comparator<T> order = Comparator.<T>comparingDouble(score).reversed()
				.thenComparing(id);
		List<T> sorted = new ArrayList<>(items);
		sorted.sort(order);
		List<Ranked<T>> ranked = new ArrayList<>(sorted.size());
		for (int i = 0; i < sorted.size(); i++) {
			ranked.add(new Ranked<>(i + 1, sorted.get(i)));
		}
		return List.copyOf(ranked);
	}

	public record Ranked<T>(int position, T item) {
	}
}
