package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Stable warning tags exposed to callers. */
public enum WarningKind {
    UNREACHABLE_STATE("unreachable_state"),
    TERMINAL_STATE("terminal_state"),
    MISSING_CASE("missing_case"),
    NO_RESET("no_reset"),
    IMPLICIT_DEFAULT("implicit_default");

    private final String code;

    WarningKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
