package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.FsmOutput;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits the non-state assignments of case arms into Moore and Mealy outputs.
 *
 * <p>An assignment made directly in an arm is a Moore output of the arm's state. An assignment
 * in a branch that also moves to a known state is a Mealy output of that transition, keyed
 * {@code FROM->TO}. Identifiers read by branch conditions are the machine's inputs.</p>
 */
public final class OutputExtractor {

    public Result extract(List<CaseArm> arms, String stateVar, String drivenVar, Collection<String> stateNames) {
        if (arms == null) throw new IllegalArgumentException("arms is null");
        Set<String> registers = new HashSet<>();
        if (stateVar != null) registers.add(stateVar);
        if (drivenVar != null) registers.add(drivenVar);
        Set<String> states = stateNames == null ? Set.of() : new HashSet<>(stateNames);

        Result result = new Result();
        Scan scan = new Scan(registers, drivenVar, states, result);
        for (CaseArm arm : arms) {
            for (ArmStatement s : arm.body) {
                if (s instanceof Assignment) {
                    Assignment a = (Assignment) s;
                    if (scan.isRegister(a)) continue;
                    result.outputSignals.add(signalName(a));
                    if (!arm.isDefault()) {
                        result.moore.computeIfAbsent(arm.label, k -> new ArrayList<>()).add(toOutput(a));
                    }
                } else if (s instanceof ConditionalBlock) {
                    scan.conditional((ConditionalBlock) s, arm.label);
                }
            }
        }
        return result;
    }

    /** The same transitions with their Mealy outputs attached. */
    public static List<FsmTransition> attach(List<FsmTransition> transitions, Map<String, List<FsmOutput>> mealy) {
        List<FsmTransition> out = new ArrayList<>();
        for (FsmTransition t : transitions) {
            List<FsmOutput> outputs = mealy.get(t.edgeKey());
            out.add(outputs == null || outputs.isEmpty() ? t : t.withOutputs(outputs));
        }
        return out;
    }

    static FsmOutput toOutput(Assignment a) {
        return new FsmOutput(a.targetText, a.value, a.line());
    }

    static String signalName(Assignment a) {
        return a.target != null ? a.target : a.targetText;
    }

    /** Outputs of one or more case statements. */
    public static final class Result {
        /** State name to Moore outputs, in arm order. */
        public final Map<String, List<FsmOutput>> moore = new LinkedHashMap<>();

        /** {@code FROM->TO} to Mealy outputs. */
        public final Map<String, List<FsmOutput>> mealy = new LinkedHashMap<>();

        public final Set<String> inputSignals = new LinkedHashSet<>();
        public final Set<String> outputSignals = new LinkedHashSet<>();

        /** Adds the findings of another case statement, e.g. the output block of a three-block machine. */
        public void merge(Result other) {
            other.moore.forEach((k, v) -> moore.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            other.mealy.forEach((k, v) -> mealy.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
            inputSignals.addAll(other.inputSignals);
            outputSignals.addAll(other.outputSignals);
        }

        public List<FsmOutput> mooreOf(String state) {
            return moore.getOrDefault(state, List.of());
        }
    }

    private static final class Scan {
        final Set<String> registers;
        final String drivenVar;
        final Set<String> states;
        final Result result;

        Scan(Set<String> registers, String drivenVar, Set<String> states, Result result) {
            this.registers = registers;
            this.drivenVar = drivenVar;
            this.states = states;
            this.result = result;
        }

        boolean isRegister(Assignment a) {
            return a.target != null && registers.contains(a.target);
        }

        void conditional(ConditionalBlock c, String from) {
            for (SyntaxNode node : c.conditionNodes) {
                for (String name : SvNodes.referencedNames(node)) {
                    if (!registers.contains(name) && !states.contains(name)) result.inputSignals.add(name);
                }
            }
            branch(c.thenBody, from);
            if (c.elseIf != null) {
                conditional(c.elseIf, from);
            } else if (c.elseBody != null) {
                branch(c.elseBody, from);
            }
        }

        void branch(List<ArmStatement> body, String from) {
            String target = null;
            List<Assignment> outputs = new ArrayList<>();
            for (ArmStatement s : body) {
                if (s instanceof Assignment) {
                    Assignment a = (Assignment) s;
                    if (a.writes(drivenVar)) {
                        String name = SvNodes.valueName(a.valueNode);
                        target = name != null && states.contains(name) ? name : null;
                    } else if (!isRegister(a)) {
                        outputs.add(a);
                        result.outputSignals.add(signalName(a));
                    }
                } else if (s instanceof ConditionalBlock) {
                    conditional((ConditionalBlock) s, from);
                }
            }
            if (from != null && target != null && !outputs.isEmpty()) {
                List<FsmOutput> list = result.mealy.computeIfAbsent(from + "->" + target, k -> new ArrayList<>());
                for (Assignment a : outputs) {
                    FsmOutput o = toOutput(a);
                    if (!list.contains(o)) list.add(o);
                }
            }
        }
    }
}
