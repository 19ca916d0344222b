package info.isaksson.erland.svtofsm.extract;

import java.util.List;

/** One label of a state case item with the statements it runs. A multi-label item yields one arm per label. */
public final class CaseArm {

    /** State label; null for the {@code default} item. */
    public final String label;

    public final int line;
    public final List<ArmStatement> body;

    public CaseArm(String label, int line, List<ArmStatement> body) {
        this.label = label;
        this.line = line;
        this.body = body == null ? List.of() : List.copyOf(body);
    }

    public boolean isDefault() {
        return label == null;
    }

    @Override public String toString() {
        return (label == null ? "default" : label) + "@" + line;
    }
}
