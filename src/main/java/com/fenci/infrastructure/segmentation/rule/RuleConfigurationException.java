package com.fenci.infrastructure.segmentation.rule;

/**
 * Raised when the rule catalogue cannot be resolved, e.g. a dependency cycle.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }
}
