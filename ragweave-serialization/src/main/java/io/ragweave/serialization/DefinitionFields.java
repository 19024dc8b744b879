package io.ragweave.serialization;

/// JSON field names of the workflow definition and run report formats.
final class DefinitionFields {

    static final String ID = "id";
    static final String ALLOW_MULTIPLE_ROOTS = "allow_multiple_roots";
    static final String NODES = "nodes";

    static final String STEP_KIND = "step_kind";
    static final String DEPENDS_ON = "depends_on";
    static final String OPTIONAL_DEPENDS_ON = "optional_depends_on";
    static final String RETRY_POLICY = "retry_policy";
    static final String MAX_ATTEMPTS = "max_attempts";
    static final String BACKOFF_BASE = "backoff_base";
    static final String BACKOFF_CAP = "backoff_cap";
    static final String TIMEOUT = "timeout";
    static final String OPTIONAL = "optional";
    static final String HANDLER = "handler";
    static final String CONFIG = "config";

    static final String RUN_ID = "run_id";
    static final String WORKFLOW_ID = "workflow_id";
    static final String STATUS = "status";
    static final String ELAPSED = "elapsed";
    static final String OUTPUTS = "outputs";
    static final String FAILURES = "failures";
    static final String NODE_ID = "node_id";
    static final String ERROR_KIND = "error_kind";
    static final String MESSAGE = "message";
    static final String ATTEMPTS = "attempts";

    private DefinitionFields() {}
}
