package io.ragweave.core.adapter.stub;

import io.ragweave.core.adapter.LlmAdapter;
import io.ragweave.core.adapter.spi.LlmProvider;
import java.util.Map;
import java.util.logging.Logger;

/// LLM provider that returns {@link StubLlmAdapter} instances.
///
/// ### Enabling Stub Mode
/// A provider built with {@link #StubLlmProvider(boolean)} uses that setting
/// and ignores global state. The no-argument constructor, used by
/// `ServiceLoader`, checks in order:
/// - Credentials map: `credentials.put("RAGWEAVE_STUB_ENABLED", "true")`
/// - System property: `-Dragweave.stub.enabled=true`
/// - Environment variable: `RAGWEAVE_STUB_ENABLED=true`
///
/// ### Priority Behavior
/// - When enabled: priority 1000 (intercepts all models)
/// - When disabled: priority -1 (never selected)
///
/// @implNote Thread-safe. Immutable provider.
public class StubLlmProvider implements LlmProvider {

    private static final Logger logger = Logger.getLogger(StubLlmProvider.class.getName());

    static final String ENABLED_KEY = "RAGWEAVE_STUB_ENABLED";
    static final String ENABLED_PROPERTY = "ragweave.stub.enabled";

    private final Boolean enabledOverride;

    public StubLlmProvider() {
        this.enabledOverride = null;
    }

    /// Creates a provider with a fixed stub-mode setting.
    ///
    /// @param enabled whether stub mode is on for this provider
    public StubLlmProvider(boolean enabled) {
        this.enabledOverride = enabled;
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return isEnabledGlobally();
    }

    @Override
    public LlmAdapter createAdapter(String modelName, Map<String, String> credentials) {
        if (!isEnabled(credentials)) {
            throw new IllegalStateException("Stub provider called but stub mode is not enabled");
        }
        logger.info("[STUB] Creating stub LLM adapter for model: " + modelName);
        return new StubLlmAdapter(modelName, StubLlmAdapter.DEFAULT_DIMENSION);
    }

    /// Returns the provider priority.
    ///
    /// @return 1000 when enabled (highest priority), -1 when disabled
    @Override
    public int getPriority() {
        return isEnabledGlobally() ? 1000 : -1;
    }

    private boolean isEnabledGlobally() {
        if (enabledOverride != null) {
            return enabledOverride;
        }
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }

    /// Credentials map values take precedence over global settings.
    private boolean isEnabled(Map<String, String> credentials) {
        if (enabledOverride != null) {
            return enabledOverride;
        }
        if (credentials != null) {
            String credValue = credentials.get(ENABLED_KEY);
            if (credValue == null) {
                credValue = credentials.get(ENABLED_PROPERTY);
            }
            if ("true".equalsIgnoreCase(credValue)) {
                return true;
            }
            if ("false".equalsIgnoreCase(credValue)) {
                return false;
            }
        }
        return isEnabledGlobally();
    }
}
