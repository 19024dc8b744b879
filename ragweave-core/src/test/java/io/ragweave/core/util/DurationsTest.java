package io.ragweave.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Durations")
class DurationsTest {

    @Test
    @DisplayName("parses ISO-8601 and millisecond forms")
    void shouldParseBothForms() {
        assertThat(Durations.parse("PT2S")).isEqualTo(Duration.ofSeconds(2));
        assertThat(Durations.parse(" 1500 ")).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("rejects garbage and negative durations")
    void shouldRejectInvalid() {
        assertThatThrownBy(() -> Durations.parse("2 seconds")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Durations.parse("PT-1S")).isInstanceOf(IllegalArgumentException.class);
    }
}
