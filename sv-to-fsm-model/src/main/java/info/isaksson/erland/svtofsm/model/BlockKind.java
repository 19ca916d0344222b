package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a procedural block is triggered. */
public enum BlockKind {
    /** {@code always_ff}. */
    CLOCKED("clocked"),
    /** {@code always_comb} and {@code always_latch}. */
    COMBINATIONAL("combinational"),
    /** Plain {@code always}. */
    LEGACY("legacy");

    private final String code;

    BlockKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
