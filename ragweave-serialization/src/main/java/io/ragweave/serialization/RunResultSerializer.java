package io.ragweave.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.ragweave.core.execution.result.NodeFailure;
import io.ragweave.core.execution.result.RunResult;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a `RunResult` as a run report.
///
/// ```
/// {
///   "run_id": "...", "workflow_id": "...", "status": "PARTIAL", "elapsed": "PT0.42S",
///   "outputs": { "<node id>": <output> },
///   "failures": [ { "node_id": "...", "error_kind": "...", "message": "...", "attempts": 2 } ]
/// }
/// ```
///
/// Outputs are written with the mapper's default serializers, so records
/// such as `LlmResponse` and `RetrievalResult` appear as nested objects.
///
/// @implNote Package-private. Registered by {@link RagweaveJacksonModule}.
class RunResultSerializer extends StdSerializer<RunResult> {

    @Serial private static final long serialVersionUID = 6312045783204437519L;

    RunResultSerializer() {
        super(RunResult.class);
    }

    @Override
    public void serialize(RunResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField(DefinitionFields.RUN_ID, result.runId());
        gen.writeStringField(DefinitionFields.WORKFLOW_ID, result.workflowId());
        gen.writeStringField(DefinitionFields.STATUS, result.status().name());
        gen.writeStringField(DefinitionFields.ELAPSED, result.elapsed().toString());

        gen.writeObjectFieldStart(DefinitionFields.OUTPUTS);
        for (Map.Entry<String, Object> output : result.outputs().entrySet()) {
            provider.defaultSerializeField(output.getKey(), output.getValue(), gen);
        }
        gen.writeEndObject();

        gen.writeArrayFieldStart(DefinitionFields.FAILURES);
        for (NodeFailure failure : result.failures()) {
            gen.writeStartObject();
            gen.writeStringField(DefinitionFields.NODE_ID, failure.nodeId());
            gen.writeStringField(DefinitionFields.ERROR_KIND, failure.kind().name());
            gen.writeStringField(DefinitionFields.MESSAGE, failure.message());
            gen.writeNumberField(DefinitionFields.ATTEMPTS, failure.attempts());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
