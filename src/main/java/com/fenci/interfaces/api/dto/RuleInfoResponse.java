package com.fenci.interfaces.api.dto;

import com.fenci.domain.segment.model.RuleDescriptor;
import com.fenci.domain.segment.model.RuleId;

import java.util.List;

public record RuleInfoResponse(
        String id,
        String group,
        int priority,
        List<String> dependsOn,
        List<String> conflictsWith,
        String displayName,
        String description
) {
    public static RuleInfoResponse from(RuleDescriptor descriptor) {
        return new RuleInfoResponse(
                descriptor.id().id(),
                descriptor.group().name().toLowerCase(),
                descriptor.priority(),
                descriptor.dependsOn().stream().map(RuleId::id).sorted().toList(),
                descriptor.conflictsWith().stream().map(RuleId::id).sorted().toList(),
                descriptor.displayName(),
                descriptor.description());
    }
}
