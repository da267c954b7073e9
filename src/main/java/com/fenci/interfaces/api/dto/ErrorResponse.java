package com.fenci.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
