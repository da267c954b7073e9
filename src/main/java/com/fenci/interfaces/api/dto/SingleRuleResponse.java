package com.fenci.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SingleRuleResponse(List<String> tokens, boolean hasConflict, String conflictMessage) {}
