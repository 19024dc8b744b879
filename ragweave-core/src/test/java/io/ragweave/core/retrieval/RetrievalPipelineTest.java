package io.ragweave.core.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import io.ragweave.core.adapter.VectorMatch;
import io.ragweave.core.adapter.VectorStoreAdapter;
import io.ragweave.core.adapter.memory.InMemoryCacheAdapter;
import io.ragweave.core.adapter.memory.InMemoryVectorStore;
import io.ragweave.core.adapter.stub.StubLlmAdapter;
import io.ragweave.core.cache.CacheLayer;
import io.ragweave.core.exception.AdapterException;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.token.WhitespaceTokenEstimator;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("RetrievalPipeline")
@ExtendWith(MockitoExtension.class)
class RetrievalPipelineTest {

    @Mock private VectorStoreAdapter vectorStore;

    private StubLlmAdapter llm;
    private CacheLayer cache;
    private RetrievalPipeline pipeline;

    @BeforeEach
    void setUp() {
        llm = new StubLlmAdapter();
        cache = new CacheLayer(new InMemoryCacheAdapter(), Duration.ofMinutes(5));
        pipeline = new RetrievalPipeline(llm, vectorStore, cache, null, WhitespaceTokenEstimator.INSTANCE);
    }

    private static VectorMatch match(String id, double score, String documentId, int start, int end, String text) {
        return new VectorMatch(
                id,
                score,
                Map.of(
                        VectorMatch.DOCUMENT_ID, documentId,
                        VectorMatch.START_OFFSET, start,
                        VectorMatch.END_OFFSET, end,
                        VectorMatch.TEXT, text));
    }

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        @DisplayName("filters, dedupes, orders best first and stops at the first chunk over budget")
        void shouldSelectStrictPrefixWithinBudget() {
            // Given
            when(vectorStore.query(any(float[].class), eq(10)))
                    .thenReturn(
                            List.of(
                                    match("m1", 0.9, "doc1", 0, 10, "alpha beta"),
                                    match("m2", 0.7, "doc2", 0, 20, "gamma delta epsilon"),
                                    match("m3", 0.5, "doc1", 0, 10, "alpha beta"),
                                    match("m4", 0.7, "doc0", 5, 9, "x y"),
                                    match("m5", 0.6, "doc3", 0, 1, "z"),
                                    match("m6", 0.1, "doc4", 0, 3, "noise")));

            // When
            RetrievalResult result =
                    pipeline.retrieve("what is alpha", 10, new RetrievalOptions(0.2, 6));

            // Then
            assertThat(result.chunks())
                    .extracting(c -> c.identity().toString())
                    .containsExactly("doc1:0-10", "doc0:5-9");
            assertThat(result.chunks().get(0).score()).isEqualTo(0.9);
            assertThat(result.totalTokens()).isEqualTo(4);
        }

        @Test
        @DisplayName("returns an empty result when nothing clears the similarity floor")
        void shouldReturnEmptyBelowFloor() {
            when(vectorStore.query(any(float[].class), eq(3)))
                    .thenReturn(List.of(match("m1", 0.3, "doc1", 0, 4, "text")));

            RetrievalResult result = pipeline.retrieve("q", 3, new RetrievalOptions(0.5, 100));

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.totalTokens()).isZero();
        }

        @Test
        @DisplayName("accepts offsets encoded as strings")
        void shouldAcceptStringOffsets() {
            var stringOffsets =
                    new VectorMatch(
                            "m1",
                            0.8,
                            Map.of(
                                    VectorMatch.DOCUMENT_ID, "doc",
                                    VectorMatch.START_OFFSET, "3",
                                    VectorMatch.END_OFFSET, "7",
                                    VectorMatch.TEXT, "four"));
            when(vectorStore.query(any(float[].class), eq(1))).thenReturn(List.of(stringOffsets));

            RetrievalResult result = pipeline.retrieve("q", 1, new RetrievalOptions(0.0, 10));

            assertThat(result.chunks().get(0).identity()).isEqualTo(new ChunkId("doc", 3, 7));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("malformed match metadata is an adapter error")
        void shouldRejectMalformedMetadata() {
            when(vectorStore.query(any(float[].class), eq(2)))
                    .thenReturn(List.of(new VectorMatch("bad", 0.9, Map.of(VectorMatch.TEXT, "orphan"))));

            assertThatThrownBy(() -> pipeline.retrieve("q", 2, new RetrievalOptions(0.0, 10)))
                    .isInstanceOf(AdapterException.class)
                    .hasMessageContaining("'bad'");
        }

        @Test
        @DisplayName("blank queries and non-positive k are rejected")
        void shouldValidateArguments() {
            assertThatThrownBy(() -> pipeline.retrieve("   ", 2, new RetrievalOptions(0.0, 10)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> pipeline.retrieve("q", 0, new RetrievalOptions(0.0, 10)))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("query embedding")
    class QueryEmbedding {

        @Test
        @DisplayName("embeds equivalent queries once through the cache")
        void shouldCacheQueryEmbedding() {
            when(vectorStore.query(any(float[].class), eq(5))).thenReturn(List.of());

            pipeline.retrieve("What is RAG?", 5, new RetrievalOptions(0.0, 10));
            pipeline.retrieve("  What   is RAG? ", 5, new RetrievalOptions(0.0, 10));

            assertThat(llm.getEmbedCalls()).isEqualTo(1);
            assertThat(cache.stats().hits()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("lexical reranking promotes chunks covering the query terms")
    void shouldRerankByLexicalOverlap() {
        // Given
        var store = new InMemoryVectorStore();
        var texts =
                List.of(
                        "solar panels convert sunlight into electricity",
                        "wind turbines convert wind into electricity",
                        "panels of judges score competitions");
        for (int i = 0; i < texts.size(); i++) {
            store.upsert(
                    "c" + i,
                    llm.embed(texts.get(i)),
                    Map.of(
                            VectorMatch.DOCUMENT_ID, "doc" + i,
                            VectorMatch.START_OFFSET, 0,
                            VectorMatch.END_OFFSET, texts.get(i).length(),
                            VectorMatch.TEXT, texts.get(i)));
        }
        var reranking =
                new RetrievalPipeline(
                        llm, store, cache, new LexicalOverlapReranker(), WhitespaceTokenEstimator.INSTANCE);

        // When
        RetrievalResult result =
                reranking.retrieve("solar panels electricity", 3, new RetrievalOptions(0.0, 1000));

        // Then
        assertThat(result.chunks()).isNotEmpty();
        assertThat(result.chunks().get(0).documentId()).isEqualTo("doc0");
        for (int i = 1; i < result.size(); i++) {
            assertThat(result.chunks().get(i).score())
                    .isLessThanOrEqualTo(result.chunks().get(i - 1).score());
        }
    }
}
