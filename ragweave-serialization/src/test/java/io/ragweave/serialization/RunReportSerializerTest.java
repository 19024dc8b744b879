package io.ragweave.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.ragweave.core.RagweaveEnvironment;
import io.ragweave.core.RagweaveFactory;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.adapter.stub.StubLlmAdapter;
import io.ragweave.core.exception.AdapterException;
import io.ragweave.core.exception.ErrorKind;
import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import io.ragweave.core.execution.result.RunStatus;
import io.ragweave.core.retrieval.Chunk;
import io.ragweave.core.retrieval.RetrievalResult;
import io.ragweave.core.workflow.WorkflowGraph;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RunReportSerializer")
class RunReportSerializerTest {

    @Test
    @DisplayName("renders status, outputs and failures with snake_case keys")
    void shouldRenderReport() {
        // Given
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("retrieve", new RetrievalResult(List.of(Chunk.of("doc1", 0, 5, "alpha", 0.9)), 1));
        outputs.put("answer", new LlmResponse("42", 3, 1, Duration.ofMillis(5), "stub:model"));
        outputs.put("label", "done");
        RunResult result =
                new RunResult(
                        "run-7",
                        "rag",
                        RunStatus.PARTIAL,
                        outputs,
                        List.of(
                                new NodeFailure("c", ErrorKind.ADAPTER, "invalid api key", 1),
                                NodeFailure.skipped("d", ErrorKind.DEPENDENCY_FAILED, "Dependency 'c' did not succeed")),
                        Map.of(),
                        Duration.ofMillis(420));

        // When
        JsonNode report = RunReportSerializer.toTree(result);

        // Then
        assertThat(report.get("run_id").asText()).isEqualTo("run-7");
        assertThat(report.get("workflow_id").asText()).isEqualTo("rag");
        assertThat(report.get("status").asText()).isEqualTo("PARTIAL");
        assertThat(report.get("elapsed").asText()).isEqualTo("PT0.42S");

        JsonNode answer = report.get("outputs").get("answer");
        assertThat(answer.get("text").asText()).isEqualTo("42");
        assertThat(answer.get("prompt_tokens").asInt()).isEqualTo(3);
        assertThat(answer.get("latency").asText()).isEqualTo("PT0.005S");
        assertThat(report.get("outputs").get("retrieve").get("chunks").get(0).get("document_id").asText())
                .isEqualTo("doc1");
        assertThat(report.get("outputs").get("label").asText()).isEqualTo("done");

        JsonNode failures = report.get("failures");
        assertThat(failures).hasSize(2);
        assertThat(failures.get(0).get("node_id").asText()).isEqualTo("c");
        assertThat(failures.get(0).get("error_kind").asText()).isEqualTo("ADAPTER");
        assertThat(failures.get(0).get("message").asText()).isEqualTo("invalid api key");
        assertThat(failures.get(1).get("error_kind").asText()).isEqualTo("DEPENDENCY_FAILED");
        assertThat(failures.get(1).get("attempts").asInt()).isZero();
    }

    @Test
    @DisplayName("reports a run of a parsed definition")
    void shouldReportRunOfParsedDefinition() {
        // Given
        WorkflowGraph graph =
                WorkflowDefinitionSerializer.fromJson(
                        """
                        {"id": "pipeline", "nodes": [
                          {"id": "load", "step_kind": "CUSTOM", "handler": "load"},
                          {"id": "enrich", "step_kind": "CUSTOM", "handler": "fail",
                           "depends_on": ["load"], "retry_policy": {"max_attempts": 1}},
                          {"id": "publish", "step_kind": "CUSTOM", "handler": "load",
                           "depends_on": ["enrich"]}
                        ]}
                        """);

        String json;
        try (RagweaveEnvironment environment =
                RagweaveFactory.builder()
                        .stubMode(false)
                        .llmAdapter(new StubLlmAdapter())
                        .customHandler("load", ctx -> "loaded")
                        .customHandler(
                                "fail",
                                ctx -> {
                                    throw new AdapterException(
                                            "crm", AdapterException.Reason.UNAUTHORIZED, "token expired");
                                })
                        .build()) {

            // When
            json = RunReportSerializer.toJson(environment.run(graph, Map.of()));
        }

        // Then
        assertThat(json)
                .contains("\"status\" : \"PARTIAL\"")
                .contains("\"load\" : \"loaded\"")
                .contains("\"node_id\" : \"enrich\"")
                .contains("\"error_kind\" : \"ADAPTER\"")
                .contains("\"node_id\" : \"publish\"")
                .contains("\"error_kind\" : \"DEPENDENCY_FAILED\"");
    }
}
