package com.fenci.domain.segment.model;

public enum CodeDialect {
    BRACE_DELIMITED("cpp_brace"),
    INDENTATION_DELIMITED("python_indent"),
    LINE_BASED("line_based");

    private final String label;

    CodeDialect(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
