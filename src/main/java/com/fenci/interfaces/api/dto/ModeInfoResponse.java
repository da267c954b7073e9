package com.fenci.interfaces.api.dto;

import com.fenci.domain.segment.model.SegmentMode;

import java.util.List;

public record ModeInfoResponse(String id, String displayName, String description, List<String> optionKeys) {

    public static ModeInfoResponse from(SegmentMode mode) {
        return new ModeInfoResponse(mode.id(), mode.displayName(), mode.description(), mode.optionKeys());
    }
}
