package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** How state update, next-state logic and output logic are split across blocks. */
public enum BlockStyle {
    ONE_BLOCK("one-block"),
    TWO_BLOCK("two-block"),
    THREE_BLOCK("three-block");

    private final String code;

    BlockStyle(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
