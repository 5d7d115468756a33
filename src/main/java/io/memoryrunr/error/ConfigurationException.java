package io.memoryrunr.error;

import java.util.List;

/**
 * Invalid pipeline configuration. Raised while the configuration is bound, before any record is processed.
 */
public class ConfigurationException extends PipelineException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid pipeline configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
