package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.BlockKind;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds the guarded transition relation from the arms of a state case statement.
 *
 * <p>Within one statement list the last direct write of the driven variable wins; writes before
 * it are dead. Conditionals after it override it under their guard, so the direct transition
 * picks up the negated guard, or disappears when the conditional writes on every path.</p>
 */
public final class TransitionExtractor {

    /**
     * @param stateCase      arms of the case statement on the state register
     * @param drivenVar      variable the arms assign: the next-state register, or the state
     *                       register itself in one-block style
     * @param stateVar       current-state register; {@code drivenVar = stateVar} inside an arm is a hold
     * @param stateNames     all states, in declaration order
     * @param blockKind      kind of the block holding the case statement
     * @param defaultHold    a {@code next = state} default precedes the case statement; states
     *                       without explicit transitions then get an implicit self-loop
     */
    public Result extract(CaseArmReader.StateCase stateCase, String drivenVar, String stateVar,
                          List<String> stateNames, BlockKind blockKind, boolean defaultHold) {
        if (stateCase == null) throw new IllegalArgumentException("stateCase is null");
        if (drivenVar == null) throw new IllegalArgumentException("drivenVar is null");

        Walk walk = new Walk(drivenVar, stateVar, new LinkedHashSet<>(stateNames), blockKind);
        List<List<FsmTransition>> perArm = new ArrayList<>();
        Set<String> withExplicit = new HashSet<>();
        for (CaseArm arm : stateCase.arms) {
            if (arm.isDefault()) {
                perArm.add(List.of());
                continue;
            }
            List<FsmTransition> found = new ArrayList<>();
            walk.body(arm.body, Guard.TRUE, arm.label, found);
            if (!found.isEmpty()) withExplicit.add(arm.label);
            perArm.add(found);
        }

        List<FsmTransition> transitions = new ArrayList<>();
        Set<String> implicit = new HashSet<>();
        for (int i = 0; i < stateCase.arms.size(); i++) {
            CaseArm arm = stateCase.arms.get(i);
            transitions.addAll(perArm.get(i));
            if (defaultHold && !arm.isDefault() && !withExplicit.contains(arm.label) && implicit.add(arm.label)) {
                transitions.add(FsmTransition.implicitSelfLoop(arm.label, arm.line, blockKind));
            }
        }
        if (defaultHold) {
            for (String s : stateNames) {
                if (!withExplicit.contains(s) && implicit.add(s)) {
                    transitions.add(FsmTransition.implicitSelfLoop(s, stateCase.line(), blockKind));
                }
            }
        }
        return new Result(transitions, defaultHold, implicit.size(), walk.errors);
    }

    /** Transitions of one case statement. */
    public static final class Result {
        public final List<FsmTransition> transitions;
        public final boolean hasDefaultAssignment;
        public final int implicitSelfLoops;

        /** Next-state values that name no state. */
        public final List<String> errors;

        Result(List<FsmTransition> transitions, boolean hasDefaultAssignment, int implicitSelfLoops, List<String> errors) {
            this.transitions = List.copyOf(transitions);
            this.hasDefaultAssignment = hasDefaultAssignment;
            this.implicitSelfLoops = implicitSelfLoops;
            this.errors = List.copyOf(errors);
        }

        /** States with at least one explicit outgoing transition. */
        public Set<String> coveredStates() {
            Set<String> out = new LinkedHashSet<>();
            for (FsmTransition t : transitions) {
                if (!t.isImplicit) out.add(t.from);
            }
            return out;
        }
    }

    private static final class Walk {
        final String drivenVar;
        final String stateVar;
        final Set<String> states;
        final BlockKind blockKind;
        final List<String> errors = new ArrayList<>();

        Walk(String drivenVar, String stateVar, Set<String> states, BlockKind blockKind) {
            this.drivenVar = drivenVar;
            this.stateVar = stateVar;
            this.states = states;
            this.blockKind = blockKind;
        }

        void body(List<ArmStatement> body, Guard acc, String from, List<FsmTransition> out) {
            int lastDirect = -1;
            for (int i = 0; i < body.size(); i++) {
                if (body.get(i) instanceof Assignment && ((Assignment) body.get(i)).writes(drivenVar)) lastDirect = i;
            }

            if (lastDirect >= 0) {
                Guard g = acc;
                boolean overridden = false;
                for (int i = lastDirect + 1; i < body.size() && !overridden; i++) {
                    if (!(body.get(i) instanceof ConditionalBlock)) continue;
                    ConditionalBlock c = (ConditionalBlock) body.get(i);
                    boolean thenWrites = writesSomewhere(c.thenBody);
                    boolean elseWrites = writesSomewhere(c.elseStatements());
                    if (c.hasElse() && writesOnEveryPath(c.thenBody) && writesOnEveryPath(c.elseStatements())) {
                        overridden = true;
                    } else if (thenWrites && !elseWrites) {
                        g = g.andNot(c.condition);
                    } else if (elseWrites && !thenWrites) {
                        g = g.and(c.condition);
                    }
                }
                if (!overridden) {
                    Assignment direct = (Assignment) body.get(lastDirect);
                    value(direct.valueNode, direct.value, g, from, direct.line(), out);
                }
            }

            for (int i = lastDirect + 1; i < body.size(); i++) {
                if (body.get(i) instanceof ConditionalBlock) conditional((ConditionalBlock) body.get(i), acc, from, out);
            }
        }

        void conditional(ConditionalBlock c, Guard acc, String from, List<FsmTransition> out) {
            body(c.thenBody, acc.and(c.condition), from, out);
            if (c.elseIf != null) {
                conditional(c.elseIf, acc.andNot(c.condition), from, out);
            } else if (c.elseBody != null) {
                body(c.elseBody, acc.andNot(c.condition), from, out);
            }
        }

        /** A state name, a hold, or {@code c ? A : B} which splits into two guarded transitions. */
        void value(SyntaxNode node, String text, Guard g, String from, int line, List<FsmTransition> out) {
            SyntaxNode v = SvNodes.unwrap(node);
            if (v != null && v.is(NodeKind.CONDITIONAL_EXPRESSION)) {
                List<SyntaxNode> parts = SvNodes.operands(v);
                if (parts.size() == 3) {
                    String cond = SvNodes.normalize(parts.get(0).text());
                    value(parts.get(1), SvNodes.normalize(parts.get(1).text()), g.and(cond), from, line, out);
                    value(parts.get(2), SvNodes.normalize(parts.get(2).text()), g.andNot(cond), from, line, out);
                    return;
                }
            }

            String name = v == null ? null : SvNodes.referenceName(v);
            if (name != null && states.contains(name)) {
                out.add(FsmTransition.explicit(from, name, g.simplified(), g.raw(), line, blockKind));
            } else if (name == null || !name.equals(stateVar)) {
                errors.add("Line " + line + ": " + drivenVar + " is assigned '" + text
                        + "' in state " + from + ", which is not a known state");
            }
        }

        boolean writesSomewhere(List<ArmStatement> body) {
            for (ArmStatement s : body) {
                if (s instanceof Assignment && ((Assignment) s).writes(drivenVar)) return true;
                if (s instanceof ConditionalBlock) {
                    ConditionalBlock c = (ConditionalBlock) s;
                    if (writesSomewhere(c.thenBody) || writesSomewhere(c.elseStatements())) return true;
                }
            }
            return false;
        }

        boolean writesOnEveryPath(List<ArmStatement> body) {
            for (ArmStatement s : body) {
                if (s instanceof Assignment && ((Assignment) s).writes(drivenVar)) return true;
                if (s instanceof ConditionalBlock) {
                    ConditionalBlock c = (ConditionalBlock) s;
                    if (c.hasElse() && writesOnEveryPath(c.thenBody) && writesOnEveryPath(c.elseStatements())) return true;
                }
            }
            return false;
        }
    }
}
