package com.fenci.domain.segment.repository;

import com.fenci.domain.segment.model.SegmentOptions;

/**
 * Read-only source of the stored segmentation defaults.
 */
public interface SettingsRepository {

    SegmentOptions loadDefaults();
}
