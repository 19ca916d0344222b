package info.isaksson.erland.svtofsm.extract;

import java.util.Objects;

/** One term of a sensitivity list: optional edge keyword plus the signal. */
public final class SensitivityEntry {
    /** {@code posedge}, {@code negedge}, {@code edge}, or null for a level term. */
    public final String edge;
    public final String signal;

    public SensitivityEntry(String edge, String signal) {
        this.edge = edge;
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
    }

    public boolean isEdge() {
        return edge != null;
    }

    @Override public String toString() {
        return edge == null ? signal : edge + " " + signal;
    }
}
