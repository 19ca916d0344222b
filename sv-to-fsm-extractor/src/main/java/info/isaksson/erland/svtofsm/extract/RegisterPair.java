package info.isaksson.erland.svtofsm.extract;

import java.util.Objects;

/**
 * A current-state register with its next-state register. Without a next-state register the
 * current-state register is updated directly, one-block style.
 */
public final class RegisterPair {
    public final StateRegister state;
    public final StateRegister next;

    public RegisterPair(StateRegister state, StateRegister next) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.next = next;
    }

    public boolean hasNext() {
        return next != null;
    }

    /** Name of the next-state register, or null for a one-block machine. */
    public String nextVarName() {
        return next == null ? null : next.name;
    }

    @Override public String toString() {
        return next == null ? state.name : state.name + "/" + next.name;
    }
}
