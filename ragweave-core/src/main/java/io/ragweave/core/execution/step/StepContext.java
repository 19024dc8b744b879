package io.ragweave.core.execution.step;

import io.ragweave.core.RagweaveConfig;
import io.ragweave.core.adapter.LlmResponse;
import io.ragweave.core.execution.CancellationSignal;
import io.ragweave.core.prompt.AssembledPrompt;
import io.ragweave.core.workflow.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Everything a {@link StepHandler} sees for one attempt of one node.
///
/// Upstream outputs contain only dependencies that succeeded. Dependencies
/// that failed or were skipped, and that the node tolerates, are listed in
/// {@link #unavailableDependencies()}.
///
/// @param runId run id, not null
/// @param node the node being executed, not null
/// @param initialInputs run inputs, never null
/// @param upstreamOutputs outputs of succeeded dependencies keyed by node id, never null
/// @param unavailableDependencies tolerated dependencies without output, never null
/// @param attempt 1-based attempt number
/// @param cancellation run cancellation signal, not null
/// @param config run configuration, not null
public record StepContext(
        String runId,
        Node node,
        Map<String, Object> initialInputs,
        Map<String, Object> upstreamOutputs,
        Set<String> unavailableDependencies,
        int attempt,
        CancellationSignal cancellation,
        RagweaveConfig config) {

    public StepContext {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        Objects.requireNonNull(config, "config must not be null");
        initialInputs = Collections.unmodifiableMap(new LinkedHashMap<>(initialInputs));
        upstreamOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(upstreamOutputs));
        unavailableDependencies =
                Collections.unmodifiableSet(new LinkedHashSet<>(unavailableDependencies));
    }

    /// Returns a copy of this context for another attempt.
    ///
    /// @param nextAttempt 1-based attempt number
    /// @return context for the attempt, never null
    public StepContext withAttempt(int nextAttempt) {
        return new StepContext(
                runId,
                node,
                initialInputs,
                upstreamOutputs,
                unavailableDependencies,
                nextAttempt,
                cancellation,
                config);
    }

    /// Returns a run input.
    ///
    /// @param name input name, not null
    /// @return the input, or empty if absent
    public Optional<Object> input(String name) {
        return Optional.ofNullable(initialInputs.get(name));
    }

    /// Returns a value of the node's config map.
    ///
    /// @param key config key, not null
    /// @return the value, or empty if absent
    public Optional<Object> nodeConfig(String key) {
        return Optional.ofNullable(node.getConfig().get(key));
    }

    /// Returns the upstream outputs of a given type, in dependency order.
    ///
    /// @param type output type to select, not null
    /// @return matching outputs, never null
    public <T> List<T> upstream(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Object output : upstreamOutputs.values()) {
            if (type.isInstance(output)) {
                matches.add(type.cast(output));
            }
        }
        return matches;
    }

    /// Returns template variables: run inputs plus the text of upstream outputs
    /// keyed by node id.
    ///
    /// Upstream outputs contribute when they are strings, numbers, booleans,
    /// {@link LlmResponse}s or {@link AssembledPrompt}s. An upstream output
    /// shadows an input of the same name.
    ///
    /// @return variable map, never null
    public Map<String, Object> textVariables() {
        Map<String, Object> variables = new LinkedHashMap<>(initialInputs);
        upstreamOutputs.forEach(
                (nodeId, output) -> {
                    String text = textOf(output);
                    if (text != null) {
                        variables.put(nodeId, text);
                    }
                });
        return variables;
    }

    /// Returns the text form of a step output.
    ///
    /// @param output step output, may be null
    /// @return text, or null if the output has no text form
    public static String textOf(Object output) {
        if (output instanceof String s) {
            return s;
        }
        if (output instanceof LlmResponse response) {
            return response.text();
        }
        if (output instanceof AssembledPrompt prompt) {
            return prompt.text();
        }
        if (output instanceof Number || output instanceof Boolean) {
            return output.toString();
        }
        return null;
    }
}
