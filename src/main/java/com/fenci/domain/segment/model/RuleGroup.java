package com.fenci.domain.segment.model;

/**
 * Split rules always run before remove rules.
 */
public enum RuleGroup {
    SPLIT,
    REMOVE
}
