package com.fenci.interfaces.api.dto;

import java.util.List;

public record SegmentResponse(String mode, List<String> tokens) {}
