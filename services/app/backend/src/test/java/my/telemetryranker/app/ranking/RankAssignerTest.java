package my.telemetryranker.app.ranking;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RankAssignerTest {
	private final RankAssigner assigner = new RankAssigner();

	@Test
	void ordersByScoreThenIdWithoutSharedPositions() {
		Map<String, Double> scores = Map.of("b", 50.0, "a", 50.0, "c", 90.0, "d", 10.0);

		List<RankAssigner.Ranked<String>> ranked = assigner.assign(scores.keySet(), scores::get, id -> id);

		assertThat(ranked).extracting(RankAssigner.Ranked::item).containsExactly("c", "a", "b", "d");
		assertThat(ranked).extracting(RankAssigner.Ranked::position).containsExactly(1, 2, 3, 4);
	}

	@Test
	void emptyInputGivesEmptyRanking() {
		assertThat(assigner.assign(List.<String>of(), id -> 0.0, id -> id)).isEmpty();
	}
}
