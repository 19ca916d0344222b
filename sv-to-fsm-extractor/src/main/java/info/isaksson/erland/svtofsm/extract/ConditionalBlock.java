package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.List;
import java.util.Objects;

/**
 * An {@code if} inside a case arm. The else side is either absent, a plain body, or a nested
 * {@code else if} block; never both.
 *
 * <p>Case statements nested in an arm are read as chains of these, one block per item, with the
 * {@code default} item as the final else.</p>
 */
public final class ConditionalBlock implements ArmStatement {

    /** Condition with whitespace collapsed. */
    public final String condition;

    /** Expressions the condition reads from. */
    public final List<SyntaxNode> conditionNodes;

    public final List<ArmStatement> thenBody;

    /** Null when there is no plain else. */
    public final List<ArmStatement> elseBody;

    /** Null when there is no else-if. */
    public final ConditionalBlock elseIf;

    private final int line;

    public ConditionalBlock(String condition, List<SyntaxNode> conditionNodes, List<ArmStatement> thenBody,
                            List<ArmStatement> elseBody, ConditionalBlock elseIf, int line) {
        if (elseBody != null && elseIf != null) throw new IllegalArgumentException("else and else-if are exclusive");
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.conditionNodes = conditionNodes == null ? List.of() : List.copyOf(conditionNodes);
        this.thenBody = thenBody == null ? List.of() : List.copyOf(thenBody);
        this.elseBody = elseBody == null ? null : List.copyOf(elseBody);
        this.elseIf = elseIf;
        this.line = line;
    }

    @Override
    public int line() {
        return line;
    }

    public boolean hasElse() {
        return elseBody != null || elseIf != null;
    }

    /** The else side as a statement list: the else-if block alone, the else body, or empty. */
    public List<ArmStatement> elseStatements() {
        if (elseIf != null) return List.of(elseIf);
        return elseBody == null ? List.of() : elseBody;
    }

    @Override public String toString() {
        return "if (" + condition + ")";
    }
}
