package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

/** A blocking or non-blocking assignment. */
public final class Assignment implements ArmStatement {

    /** Assigned variable; null for a concatenation target. */
    public final String target;

    /** Target as written, selects included. */
    public final String targetText;

    /** Right-hand side with whitespace collapsed. */
    public final String value;

    /** Right-hand side expression node; null when the assignment has none (e.g. after recovery). */
    public final SyntaxNode valueNode;

    public final boolean blocking;

    /** The target has a bit or part select, e.g. {@code state[IDLE]}. */
    public final boolean selected;

    private final int line;

    public Assignment(String target, String targetText, String value, SyntaxNode valueNode, boolean blocking,
                      boolean selected, int line) {
        this.target = target;
        this.targetText = targetText == null ? "" : targetText;
        this.value = value == null ? "" : value;
        this.valueNode = valueNode;
        this.blocking = blocking;
        this.selected = selected;
        this.line = line;
    }

    @Override
    public int line() {
        return line;
    }

    /** True for a whole-variable write of {@code variable}. */
    public boolean writes(String variable) {
        return !selected && target != null && target.equals(variable);
    }

    @Override public String toString() {
        return targetText + (blocking ? " = " : " <= ") + value;
    }
}
