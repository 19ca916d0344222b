package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StateEncoding {
    BINARY("binary"),
    ONEHOT("onehot"),
    GRAY("gray"),
    UNKNOWN("unknown");

    private final String code;

    StateEncoding(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
