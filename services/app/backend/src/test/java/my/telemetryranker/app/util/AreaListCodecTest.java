package my.telemetryranker.app.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AreaListCodecTest {
	@Test
	void encodesAsJsonArray() {
		assertThat(AreaListCodec.encode(List.of("CPLOAD", "C:\\data"))).isEqualTo("[\"CPLOAD\",\"C:\\\\data\"]");
		assertThat(AreaListCodec.encode(null)).isEqualTo("[]");
	}

	@Test
	void decodesFlatStringArrays() {
		assertThat(AreaListCodec.decode("[\"CPLOAD\", \"IOLOAD\"]")).containsExactly("CPLOAD", "IOLOAD");
		assertThat(AreaListCodec.decode("")).isEmpty();
	}

	@Test
	void rejectsAnythingElse() {
		assertThatThrownBy(() -> AreaListCodec.decode("['CPLOAD']")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> AreaListCodec.decode("{\"a\": 1}")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> AreaListCodec.decode("[\"CPLOAD\", 3]")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> AreaListCodec.decode("[[\"CPLOAD\"]]")).isInstanceOf(IllegalArgumentException.class);
	}
}
