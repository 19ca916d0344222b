package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A state of a recovered machine.
 *
 * <p>The reachability flags are annotations written by the validators; everything else is fixed
 * at assembly time.</p>
 */
@JsonPropertyOrder({"name", "encoding", "line", "outputs", "isUnreachable", "isTerminal"})
public final class FsmState {
    public final String name;

    /** Literal encoding as written in the source, e.g. {@code 2'b01}; null when implicit. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String encoding;

    public final int line;

    /** Moore outputs. */
    public final List<FsmOutput> outputs;

    public boolean isUnreachable;
    public boolean isTerminal;

    @JsonCreator
    public FsmState(
            @JsonProperty("name") String name,
            @JsonProperty("encoding") String encoding,
            @JsonProperty("line") int line,
            @JsonProperty("outputs") List<FsmOutput> outputs,
            @JsonProperty("isUnreachable") boolean isUnreachable,
            @JsonProperty("isTerminal") boolean isTerminal
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.encoding = encoding;
        this.line = line;
        this.outputs = outputs == null ? List.of() : List.copyOf(outputs);
        this.isUnreachable = isUnreachable;
        this.isTerminal = isTerminal;
    }

    public FsmState(String name, String encoding, int line, List<FsmOutput> outputs) {
        this(name, encoding, line, outputs, false, false);
    }

    @Override public String toString() {
        return name;
    }
}
