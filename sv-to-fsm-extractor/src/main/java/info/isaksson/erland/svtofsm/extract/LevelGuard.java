package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A condition that tests a single signal for a level: {@code rst}, {@code !rst_n},
 * {@code ~rst_n}, {@code rst == 1'b1}, {@code rst_n == 1'b0}, {@code rst_n != 1'b1} and the
 * four-state {@code ===}/{@code !==} forms.
 */
final class LevelGuard {

    final String signal;

    /** The condition holds while the signal is low. */
    final boolean trueWhenLow;

    private LevelGuard(String signal, boolean trueWhenLow) {
        this.signal = signal;
        this.trueWhenLow = trueWhenLow;
    }

    static Optional<LevelGuard> of(SyntaxNode condition) {
        SyntaxNode e = SvNodes.unwrap(condition);
        if (e == null) return Optional.empty();

        if (e.is(NodeKind.REFERENCE)) {
            return named(SvNodes.referenceName(e), false);
        }
        if (e.is(NodeKind.UNARY_EXPRESSION)) {
            String op = SvNodes.operator(e);
            List<SyntaxNode> operands = SvNodes.operands(e);
            if ((op.equals("!") || op.equals("~")) && operands.size() == 1) {
                SyntaxNode inner = SvNodes.unwrap(operands.get(0));
                if (inner != null && inner.is(NodeKind.REFERENCE)) return named(SvNodes.referenceName(inner), true);
            }
            return Optional.empty();
        }
        if (e.is(NodeKind.BINARY_EXPRESSION)) {
            String op = SvNodes.operator(e);
            boolean equal = op.equals("==") || op.equals("===");
            boolean notEqual = op.equals("!=") || op.equals("!==");
            List<SyntaxNode> operands = SvNodes.operands(e);
            if ((!equal && !notEqual) || operands.size() != 2) return Optional.empty();

            SyntaxNode left = SvNodes.unwrap(operands.get(0));
            SyntaxNode right = SvNodes.unwrap(operands.get(1));
            SyntaxNode ref = left != null && left.is(NodeKind.REFERENCE) ? left : right;
            SyntaxNode lit = ref == left ? right : left;
            if (ref == null || lit == null || !ref.is(NodeKind.REFERENCE) || !lit.is(NodeKind.NUMBER)) {
                return Optional.empty();
            }
            OptionalLong value = EnumerationDetector.parseLiteral(lit.text());
            if (value.isEmpty() || value.getAsLong() > 1) return Optional.empty();
            boolean comparesToZero = value.getAsLong() == 0;
            return named(SvNodes.referenceName(ref), equal == comparesToZero);
        }
        return Optional.empty();
    }

    private static Optional<LevelGuard> named(String signal, boolean trueWhenLow) {
        if (signal == null) return Optional.empty();
        return Optional.of(new LevelGuard(signal, trueWhenLow));
    }
}
