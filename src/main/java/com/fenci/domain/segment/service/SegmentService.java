package com.fenci.domain.segment.service;

import com.fenci.domain.segment.model.MultiRuleResult;
import com.fenci.domain.segment.model.RuleId;
import com.fenci.domain.segment.model.SegmentMode;
import com.fenci.domain.segment.model.SegmentOptions;

import java.util.List;
import java.util.Set;

/**
 * Single entry point of the segmentation engine.
 */
public interface SegmentService {

    /**
     * Segment the text with one of the top-level modes.
     * Blank input yields an empty list; this method never fails on input.
     */
    List<String> segment(String text, SegmentMode mode, SegmentOptions options);

    /**
     * Run the multi-rule composer and return the full result including applied rules and conflicts.
     */
    MultiRuleResult composeRules(String text, Set<RuleId> rules, SegmentOptions options);
}
