package info.isaksson.erland.svtofsm.extract;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An enumerated type found in a module: a {@code typedef enum} or an enum declared inline on a
 * variable. Inline enums are named after the first variable they declare.
 */
public final class EnumDefinition {
    public final String typeName;
    public final List<EnumMember> members;
    public final int line;
    public final boolean inline;

    /** The base type width depends on a parameter, e.g. {@code logic [W-1:0]}. */
    public final boolean parameterizedWidth;

    public EnumDefinition(String typeName, List<EnumMember> members, int line, boolean inline, boolean parameterizedWidth) {
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
        this.members = members == null ? List.of() : List.copyOf(members);
        this.line = line;
        this.inline = inline;
        this.parameterizedWidth = parameterizedWidth;
    }

    public List<String> memberNames() {
        return members.stream().map(m -> m.name).collect(Collectors.toList());
    }

    @Override public String toString() {
        return typeName + memberNames();
    }
}
