package com.fenci.domain.segment.model;

import java.util.List;

/**
 * @param kind   what was found
 * @param values matches in first-occurrence order, never empty
 */
public record TextFeature(FeatureKind kind, List<String> values) {

    public TextFeature {
        values = List.copyOf(values);
    }
}
