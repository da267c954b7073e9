package com.fenci.application.segment;

import com.fenci.domain.segment.model.SegmentMode;

import java.util.List;

/**
 * @param mode   the mode actually used after resolving the requested identifier
 * @param tokens the token sequence
 */
public record SegmentResult(SegmentMode mode, List<String> tokens) {}
