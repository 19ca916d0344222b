package info.isaksson.erland.svtofsm.extract;

import java.util.Objects;

/** A variable that may hold the current or next state. */
public final class StateRegister {
    public final String name;

    /** Enumeration type of the variable, or null when it was picked up by name only. */
    public final String typeName;

    public final boolean isNextState;
    public final int line;

    public StateRegister(String name, String typeName, boolean isNextState, int line) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.typeName = typeName;
        this.isNextState = isNextState;
        this.line = line;
    }

    @Override public String toString() {
        return name + (typeName == null ? "" : ":" + typeName) + (isNextState ? " (next)" : "");
    }
}
