package info.isaksson.erland.svtofsm.extract;

import java.util.Objects;

/** One member of an enumeration: name, optional literal encoding and source line. */
public final class EnumMember {
    public final String name;

    /** Literal as written, e.g. {@code 2'b01}; null when the member has no explicit value. */
    public final String encoding;

    public final int line;

    public EnumMember(String name, String encoding, int line) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.encoding = encoding;
        this.line = line;
    }

    @Override public String toString() {
        return encoding == null ? name : name + " = " + encoding;
    }
}
