package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.ragweave.core.exception.RagweaveException;
import io.ragweave.core.exception.ValidationException;
import io.ragweave.core.workflow.WorkflowGraph;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Utility class for reading and writing workflow definitions as JSON.
///
/// ### Usage
/// {@snippet :
/// WorkflowGraph graph = WorkflowDefinitionSerializer.fromJson("""
///     {"id": "rag", "nodes": [
///       {"id": "retrieve", "step_kind": "RETRIEVE"},
///       {"id": "prompt", "step_kind": "ASSEMBLE_PROMPT", "depends_on": ["retrieve"],
///        "config": {"template": "qa"}},
///       {"id": "answer", "step_kind": "GENERATE", "depends_on": ["prompt"], "timeout": "PT30S"}
///     ]}
///     """);
/// String json = WorkflowDefinitionSerializer.toJson(graph);
/// }
///
/// Every definition is validated by the graph builder, so a successfully
/// parsed graph is acyclic and has no dangling dependencies.
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see RagweaveJacksonModule for the registered type handlers
public final class WorkflowDefinitionSerializer {

    private WorkflowDefinitionSerializer() {}

    /// Serializes a workflow graph to pretty-printed JSON.
    ///
    /// @param graph the graph to serialize, not null
    /// @return JSON definition, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowGraph graph) {
        try {
            return createMapper().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Parses and validates a workflow definition.
    ///
    /// @param json JSON definition, not null
    /// @return validated graph, never null
    /// @throws ValidationException if the JSON is malformed or the graph is invalid
    /// @throws io.ragweave.core.exception.CycleDetectedException if the graph has a cycle
    public static WorkflowGraph fromJson(String json) {
        try {
            return createMapper().readValue(json, WorkflowGraph.class);
        } catch (JsonProcessingException e) {
            throw translate(e);
        }
    }

    /// Parses and validates a workflow definition from a stream.
    ///
    /// @param in stream positioned at the definition, not null; not closed
    /// @return validated graph, never null
    /// @throws ValidationException if the JSON is malformed or the graph is invalid
    /// @throws IOException if reading the stream fails
    public static WorkflowGraph read(InputStream in) throws IOException {
        try {
            return createMapper().readValue(in, WorkflowGraph.class);
        } catch (JsonProcessingException e) {
            throw translate(e);
        }
    }

    /// Parses and validates a workflow definition file.
    ///
    /// @param path definition file, not null
    /// @return validated graph, never null
    /// @throws IOException if the file cannot be read
    public static WorkflowGraph read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /// Creates an ObjectMapper configured for workflow definitions.
    ///
    /// Registers:
    /// - `RagweaveJacksonModule` for graph, node and run result types
    /// - `JavaTimeModule` for `Duration` fields of step outputs
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Durations written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new RagweaveJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Surfaces engine validation errors raised while building the graph, and
    /// wraps JSON structure errors.
    static RagweaveException translate(JsonProcessingException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof RagweaveException ragweaveException) {
                return ragweaveException;
            }
        }
        return new ValidationException("Invalid workflow definition: " + e.getOriginalMessage(), e);
    }
}
