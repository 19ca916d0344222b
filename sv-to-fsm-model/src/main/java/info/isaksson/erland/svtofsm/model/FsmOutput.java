package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** An output assignment: a signal, the value expression it is assigned, and the source line. */
@JsonPropertyOrder({"signal", "value", "line"})
public final class FsmOutput {
    public final String signal;
    public final String value;
    public final int line;

    @JsonCreator
    public FsmOutput(
            @JsonProperty("signal") String signal,
            @JsonProperty("value") String value,
            @JsonProperty("line") int line
    ) {
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        this.value = value == null ? "" : value;
        this.line = line;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FsmOutput)) return false;
        FsmOutput that = (FsmOutput) o;
        return line == that.line && signal.equals(that.signal) && value.equals(that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(signal, value, line);
    }

    @Override public String toString() {
        return signal + "=" + value;
    }
}
