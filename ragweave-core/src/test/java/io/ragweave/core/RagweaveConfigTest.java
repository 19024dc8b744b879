package io.ragweave.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.workflow.RetryPolicy;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RagweaveConfig")
class RagweaveConfigTest {

    @Test
    @DisplayName("defaults are usable without any settings")
    void shouldProvideDefaults() {
        RagweaveConfig config = RagweaveConfig.defaults();

        assertThat(config.getMaxConcurrentNodes()).isEqualTo(4);
        assertThat(config.getDefaultNodeTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getDefaultRetryPolicy()).isEqualTo(RetryPolicy.DEFAULT);
        assertThat(config.getDefaultCacheTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.getContextTokenBudget()).isEqualTo(2000);
        assertThat(config.getRetrievalTopK()).isEqualTo(5);
        assertThat(config.getRunTimeout()).isEmpty();
    }

    @Nested
    @DisplayName("fromProperties")
    class FromProperties {

        @Test
        @DisplayName("reads every key, accepting ISO-8601 and millisecond durations")
        void shouldReadAllKeys() {
            RagweaveConfig config =
                    RagweaveConfig.fromProperties(
                            Map.of(
                                    RagweaveConfig.MAX_CONCURRENT_NODES, "8",
                                    RagweaveConfig.NODE_TIMEOUT, "PT2S",
                                    RagweaveConfig.NODE_MAX_ATTEMPTS, "5",
                                    RagweaveConfig.NODE_BACKOFF_BASE, "100",
                                    RagweaveConfig.NODE_BACKOFF_CAP, "PT1S",
                                    RagweaveConfig.CACHE_TTL, "60000",
                                    RagweaveConfig.CONTEXT_TOKEN_BUDGET, "512",
                                    RagweaveConfig.MIN_SIMILARITY, "0.25",
                                    RagweaveConfig.TOP_K, "12",
                                    RagweaveConfig.RUN_TIMEOUT, "PT1M"));

            assertThat(config.getMaxConcurrentNodes()).isEqualTo(8);
            assertThat(config.getDefaultNodeTimeout()).isEqualTo(Duration.ofSeconds(2));
            assertThat(config.getDefaultRetryPolicy())
                    .isEqualTo(RetryPolicy.of(5, Duration.ofMillis(100), Duration.ofSeconds(1)));
            assertThat(config.getDefaultCacheTtl()).isEqualTo(Duration.ofMinutes(1));
            assertThat(config.getContextTokenBudget()).isEqualTo(512);
            assertThat(config.getMinSimilarity()).isEqualTo(0.25);
            assertThat(config.getRetrievalTopK()).isEqualTo(12);
            assertThat(config.getRunTimeout()).contains(Duration.ofMinutes(1));
        }

        @Test
        @DisplayName("rejects unparseable values naming the key")
        void shouldRejectInvalidValue() {
            assertThatThrownBy(
                            () -> RagweaveConfig.fromProperties(
                                    Map.of(RagweaveConfig.NODE_TIMEOUT, "soon")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(RagweaveConfig.NODE_TIMEOUT);
        }

        @Test
        @DisplayName("rejects a backoff cap below the base")
        void shouldRejectInconsistentBackoff() {
            assertThatThrownBy(
                            () -> RagweaveConfig.fromProperties(
                                    Map.of(
                                            RagweaveConfig.NODE_BACKOFF_BASE, "PT2S",
                                            RagweaveConfig.NODE_BACKOFF_CAP, "PT1S")))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("toBuilder copies every setting")
    void shouldCopyThroughToBuilder() {
        RagweaveConfig original =
                RagweaveConfig.builder().maxConcurrentNodes(2).runTimeout(Duration.ofSeconds(9)).build();

        RagweaveConfig copy = original.toBuilder().contextTokenBudget(10).build();

        assertThat(copy.getMaxConcurrentNodes()).isEqualTo(2);
        assertThat(copy.getRunTimeout()).contains(Duration.ofSeconds(9));
        assertThat(copy.getContextTokenBudget()).isEqualTo(10);
    }

    @Test
    @DisplayName("rejects a non-positive concurrency limit")
    void shouldRejectZeroConcurrency() {
        assertThatThrownBy(() -> RagweaveConfig.builder().maxConcurrentNodes(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
