package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.BlockKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A classified {@code always} construct. */
public final class ProceduralBlock {
    public final BlockKind kind;
    public final String keyword;
    public final int line;
    public final List<SensitivityEntry> sensitivity;

    /** {@code @*} or {@code @(*)}. */
    public final boolean wildcard;

    /** Null when the block has no recognizable reset. */
    public final ResetDescriptor reset;

    /** Watched state variables this block assigns, in order of first assignment. */
    public final Set<String> assignedStateVars;

    public final SyntaxNode node;

    public ProceduralBlock(BlockKind kind, String keyword, int line, List<SensitivityEntry> sensitivity, boolean wildcard,
                           ResetDescriptor reset, Set<String> assignedStateVars, SyntaxNode node) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.keyword = keyword;
        this.line = line;
        this.sensitivity = sensitivity == null ? List.of() : List.copyOf(sensitivity);
        this.wildcard = wildcard;
        this.reset = reset;
        this.assignedStateVars = assignedStateVars == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(assignedStateVars));
        this.node = Objects.requireNonNull(node, "node must not be null");
    }

    public boolean hasEdge() {
        return sensitivity.stream().anyMatch(SensitivityEntry::isEdge);
    }

    /** {@code always_ff}, or a plain {@code always} triggered on an edge. */
    public boolean actsClocked() {
        return kind == BlockKind.CLOCKED || (kind == BlockKind.LEGACY && hasEdge());
    }

    /** {@code always_comb}/{@code always_latch}, or a plain {@code always} without edges. */
    public boolean actsCombinational() {
        return kind == BlockKind.COMBINATIONAL || (kind == BlockKind.LEGACY && !hasEdge());
    }

    public boolean assigns(String variable) {
        return variable != null && assignedStateVars.contains(variable);
    }

    @Override public String toString() {
        return keyword + "@" + line + sensitivity;
    }
}
