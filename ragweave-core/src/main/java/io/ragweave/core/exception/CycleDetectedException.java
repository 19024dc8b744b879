package io.ragweave.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when the dependency structure of a workflow graph contains a cycle.
///
/// The offending path is reported in traversal order, with the first node
/// repeated at the end (e.g. `[a, b, c, a]`).
public class CycleDetectedException extends ValidationException {

    @Serial private static final long serialVersionUID = 7417268026913035254L;

    private final List<String> cycle;

    /// Creates the exception for the given cycle path.
    ///
    /// @param cycle node ids forming the cycle, first node repeated last, not null
    public CycleDetectedException(List<String> cycle) {
        super("Workflow graph contains a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /// Returns the node ids forming the cycle.
    ///
    /// @return unmodifiable cycle path, never null
    public List<String> getCycle() {
        return cycle;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CYCLE_DETECTED;
    }
}
