package com.fenci.domain.segment.model;

import java.util.Set;

/**
 * Static metadata of a rule.
 *
 * @param id            the rule identifier
 * @param group         split or remove
 * @param priority      total order within the group (ascending = earlier)
 * @param dependsOn     rules that are force-included when this rule is selected
 * @param conflictsWith rules dropped when selected together with this one
 * @param displayName   short human-readable name
 * @param description   what the rule does
 */
public record RuleDescriptor(
        RuleId id,
        RuleGroup group,
        int priority,
        Set<RuleId> dependsOn,
        Set<RuleId> conflictsWith,
        String displayName,
        String description
) {
    public RuleDescriptor {
        dependsOn = dependsOn == null ? Set.of() : Set.copyOf(dependsOn);
        conflictsWith = conflictsWith == null ? Set.of() : Set.copyOf(conflictsWith);
    }
}
