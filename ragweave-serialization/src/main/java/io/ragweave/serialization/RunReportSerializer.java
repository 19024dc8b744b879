package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.ragweave.core.execution.result.RunResult;

/// Renders run results as JSON reports.
///
/// Report keys are snake_case, including the properties of step outputs
/// written as nested objects (`prompt_tokens`, `document_id`, ...).
///
/// @see RunResultSerializer for the report layout
public final class RunReportSerializer {

    private RunReportSerializer() {}

    /// Renders a pretty-printed report.
    ///
    /// @param result run result, not null
    /// @return JSON report, never null
    /// @throws IllegalArgumentException if an output cannot be serialized
    public static String toJson(RunResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize run report: " + e.getMessage(), e);
        }
    }

    /// Renders a report as a JSON tree.
    ///
    /// @param result run result, not null
    /// @return report tree, never null
    public static JsonNode toTree(RunResult result) {
        return createMapper().valueToTree(result);
    }

    /// Creates the report mapper: the definition mapper with snake_case
    /// property naming and empty beans allowed.
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return WorkflowDefinitionSerializer.createMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }
}
