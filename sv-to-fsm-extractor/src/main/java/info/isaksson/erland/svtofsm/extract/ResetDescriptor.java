package info.isaksson.erland.svtofsm.extract;

import java.util.Objects;

/** Reset signal of a block and the level at which it is asserted. */
public final class ResetDescriptor {
    public final String signal;
    public final boolean activeLow;

    /** Found on an edge of the sensitivity list rather than in the leading condition. */
    public final boolean asynchronous;

    public ResetDescriptor(String signal, boolean activeLow, boolean asynchronous) {
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        this.activeLow = activeLow;
        this.asynchronous = asynchronous;
    }

    public String polarity() {
        return activeLow ? "active_low" : "active_high";
    }

    @Override public String toString() {
        return signal + " (" + polarity() + (asynchronous ? ", async" : "") + ")";
    }
}
