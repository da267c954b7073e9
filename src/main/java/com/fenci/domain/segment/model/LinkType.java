package com.fenci.domain.segment.model;

public enum LinkType {
    /** Full URL with an explicit scheme. */
    LITERAL,
    /** Bare domain completed with an inferred scheme. */
    SUSPECT
}
