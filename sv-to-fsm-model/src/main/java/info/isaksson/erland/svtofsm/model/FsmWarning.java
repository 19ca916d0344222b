package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A structured validation finding attached to an FSM. */
@JsonPropertyOrder({"type", "message", "line", "states"})
public final class FsmWarning {
    public final WarningKind type;
    public final String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Integer line;

    /** Affected states, in state declaration order. */
    public final List<String> states;

    @JsonCreator
    public FsmWarning(
            @JsonProperty("type") WarningKind type,
            @JsonProperty("message") String message,
            @JsonProperty("line") Integer line,
            @JsonProperty("states") List<String> states
    ) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.line = line;
        this.states = states == null ? List.of() : List.copyOf(states);
    }

    public FsmWarning(WarningKind type, String message, List<String> states) {
        this(type, message, null, states);
    }

    @Override public String toString() {
        return type.code() + ": " + message;
    }
}
