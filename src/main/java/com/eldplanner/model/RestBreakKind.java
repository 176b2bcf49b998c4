package com.eldplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RestBreakKind {
    SPLIT_SLEEPER_SEGMENT_1("split_sleeper_segment_1"),
    SPLIT_SLEEPER_SEGMENT_2("split_sleeper_segment_2"),
    FULL_RESTART("full_restart"),
    FULL_REST("full_rest");

    private final String code;

    RestBreakKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
