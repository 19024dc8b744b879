package io.ragweave.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ragweave.core.exception.CycleDetectedException;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.workflow.Node;
import io.ragweave.core.workflow.RetryPolicy;
import io.ragweave.core.workflow.StepKind;
import io.ragweave.core.workflow.WorkflowGraph;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowDefinitionSerializer")
class WorkflowDefinitionSerializerTest {

    private static final String RAG_DEFINITION =
            """
            {
              "id": "rag",
              "nodes": [
                {"id": "retrieve", "step_kind": "RETRIEVE", "config": {"top_k": 4}},
                {"id": "prompt", "step_kind": "assemble_prompt", "depends_on": ["retrieve"],
                 "config": {"template": "qa"}},
                {"id": "answer", "step_kind": "GENERATE", "depends_on": ["prompt"],
                 "retry_policy": {"max_attempts": 5, "backoff_base": 100, "backoff_cap": "PT2S"},
                 "timeout": "PT30S", "config": {"temperature": 0.2, "stop": ["###"]}}
              ]
            }
            """;

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("reads nodes, dependencies, retry policy, timeout and config")
        void shouldParseDefinition() {
            // When
            WorkflowGraph graph = WorkflowDefinitionSerializer.fromJson(RAG_DEFINITION);

            // Then
            assertThat(graph.getId()).isEqualTo("rag");
            assertThat(graph.topologicalOrder()).containsExactly("retrieve", "prompt", "answer");
            assertThat(graph.getNode("prompt").getStepKind()).isEqualTo(StepKind.ASSEMBLE_PROMPT);
            assertThat(graph.getNode("retrieve").getConfig()).containsEntry("top_k", 4);

            Node answer = graph.getNode("answer");
            assertThat(answer.getDependsOn()).containsExactly("prompt");
            assertThat(answer.getRetryPolicy())
                    .isEqualTo(RetryPolicy.of(5, Duration.ofMillis(100), Duration.ofSeconds(2)));
            assertThat(answer.getTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(answer.getConfig())
                    .containsEntry("temperature", 0.2)
                    .containsEntry("stop", List.of("###"));
        }

        @Test
        @DisplayName("reads optional dependencies and custom handlers")
        void shouldParseOptionalDependenciesAndHandlers() {
            // Given
            String json =
                    """
                    {"id": "fanout", "nodes": [
                      {"id": "a", "step_kind": "CUSTOM", "handler": "load"},
                      {"id": "b", "step_kind": "CUSTOM", "handler": "enrich", "depends_on": ["a"],
                       "optional": true},
                      {"id": "c", "step_kind": "CUSTOM", "handler": "merge", "depends_on": ["a", "b"],
                       "optional_depends_on": ["b"]}
                    ]}
                    """;

            // When
            WorkflowGraph graph = WorkflowDefinitionSerializer.fromJson(json);

            // Then
            assertThat(graph.getNode("b").isOptional()).isTrue();
            assertThat(graph.getNode("c").getOptionalDependencies()).containsExactly("b");
            assertThat(graph.getNode("c").getHandler()).isEqualTo("merge");
        }

        @Test
        @DisplayName("reads from a stream")
        void shouldReadFromStream() throws Exception {
            WorkflowGraph graph =
                    WorkflowDefinitionSerializer.read(
                            new ByteArrayInputStream(RAG_DEFINITION.getBytes(StandardCharsets.UTF_8)));

            assertThat(graph.size()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("surfaces cycles with their path")
        void shouldRejectCycle() {
            String json =
                    """
                    {"id": "loop", "nodes": [
                      {"id": "root", "step_kind": "RETRIEVE"},
                      {"id": "a", "step_kind": "GENERATE", "depends_on": ["root", "b"]},
                      {"id": "b", "step_kind": "GENERATE", "depends_on": ["a"]}
                    ]}
                    """;

            assertThatThrownBy(() -> WorkflowDefinitionSerializer.fromJson(json))
                    .isInstanceOf(CycleDetectedException.class);
        }

        @Test
        @DisplayName("rejects a dangling dependency")
        void shouldRejectDanglingDependency() {
            String json =
                    """
                    {"id": "broken", "nodes": [
                      {"id": "a", "step_kind": "GENERATE", "depends_on": ["ghost"]}
                    ]}
                    """;

            assertThatThrownBy(() -> WorkflowDefinitionSerializer.fromJson(json))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("rejects an unknown step kind")
        void shouldRejectUnknownStepKind() {
            String json = "{\"id\": \"w\", \"nodes\": [{\"id\": \"a\", \"step_kind\": \"SUMMON\"}]}";

            assertThatThrownBy(() -> WorkflowDefinitionSerializer.fromJson(json))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("SUMMON");
        }

        @Test
        @DisplayName("rejects an invalid duration")
        void shouldRejectInvalidDuration() {
            String json =
                    "{\"id\": \"w\", \"nodes\": [{\"id\": \"a\", \"step_kind\": \"GENERATE\","
                            + " \"timeout\": \"soon\"}]}";

            assertThatThrownBy(() -> WorkflowDefinitionSerializer.fromJson(json))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("timeout");
        }

        @Test
        @DisplayName("rejects a definition without nodes")
        void shouldRejectMissingNodes() {
            assertThatThrownBy(() -> WorkflowDefinitionSerializer.fromJson("{\"id\": \"w\"}"))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("nodes");
        }

        @Test
        @DisplayName("rejects malformed JSON")
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> WorkflowDefinitionSerializer.fromJson("{\"id\": "))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("writes a definition that parses back to the same graph")
    void shouldWriteReadableDefinition() {
        // Given
        WorkflowGraph original =
                WorkflowGraph.builder()
                        .id("written")
                        .allowMultipleRoots(true)
                        .node(Node.builder().id("a").stepKind(StepKind.RETRIEVE).build())
                        .node(
                                Node.builder()
                                        .id("b")
                                        .stepKind(StepKind.CUSTOM)
                                        .handler("score")
                                        .config(Map.of("threshold", 0.5))
                                        .build())
                        .node(
                                Node.builder()
                                        .id("c")
                                        .stepKind(StepKind.GENERATE)
                                        .dependsOn("a", "b")
                                        .optionalDependencies("b")
                                        .retryPolicy(RetryPolicy.noRetry())
                                        .timeout(Duration.ofSeconds(3))
                                        .build())
                        .build();

        // When
        String json = WorkflowDefinitionSerializer.toJson(original);
        WorkflowGraph restored = WorkflowDefinitionSerializer.fromJson(json);

        // Then
        assertThat(json).contains("\"step_kind\" : \"CUSTOM\"").contains("\"timeout\" : \"PT3S\"");
        assertThat(restored.isAllowMultipleRoots()).isTrue();
        assertThat(restored.getNodeIds()).containsExactly("a", "b", "c");
        Node c = restored.getNode("c");
        assertThat(c.getOptionalDependencies()).containsExactly("b");
        assertThat(c.getRetryPolicy()).isEqualTo(RetryPolicy.noRetry());
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(restored.getNode("b").getConfig()).containsEntry("threshold", 0.5);
    }
}
