package com.negotiationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MoveAction {
    ACCEPT("accept"),
    REJECT("reject"),
    COUNTER("counter"),
    HOLD_FIRM("hold_firm"),
    MAKE_CONCESSION("make_concession"),
    REQUEST_RECIPROCITY("request_reciprocity");

    private final String tag;

    MoveAction(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
