package io.ragweave.core.execution.runner;

import static org.assertj.core.api.Assertions.assertThat;

import io.ragweave.core.workflow.RetryPolicy;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("BackoffStrategy")
class BackoffStrategyTest {

    private static final RetryPolicy POLICY =
            RetryPolicy.of(10, Duration.ofMillis(100), Duration.ofMillis(1000));

    @ParameterizedTest(name = "attempt {0} -> ceiling {1}ms")
    @CsvSource({"1, 100", "2, 200", "3, 400", "4, 800", "5, 1000", "9, 1000"})
    @DisplayName("ceiling doubles per attempt up to the cap")
    void shouldDoubleCeilingUpToCap(int failedAttempt, long expectedMillis) {
        assertThat(BackoffStrategy.ceiling(POLICY, failedAttempt))
                .isEqualTo(Duration.ofMillis(expectedMillis));
    }

    @Test
    @DisplayName("ceiling does not overflow for large attempt numbers")
    void shouldNotOverflow() {
        assertThat(BackoffStrategy.ceiling(POLICY, 200)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("delay is drawn within [0, ceiling]")
    void shouldDrawDelayWithinCeiling() {
        var strategy = new BackoffStrategy(new Random(42));

        for (int attempt = 1; attempt <= 6; attempt++) {
            Duration ceiling = BackoffStrategy.ceiling(POLICY, attempt);
            for (int i = 0; i < 50; i++) {
                Duration delay = strategy.delay(POLICY, attempt);
                assertThat(delay).isBetween(Duration.ZERO, ceiling);
            }
        }
    }

    @Test
    @DisplayName("zero base yields zero delay")
    void shouldReturnZeroForZeroBase() {
        var strategy = new BackoffStrategy(new Random(1));

        assertThat(strategy.delay(RetryPolicy.noRetry(), 1)).isEqualTo(Duration.ZERO);
    }
}
