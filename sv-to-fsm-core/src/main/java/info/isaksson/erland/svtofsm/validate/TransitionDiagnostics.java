package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmTransition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Secondary, non-gating checks over the transition relation.
 *
 * <p>None of these change the FSM. The non-determinism check is advisory: it only notices several
 * guarded transitions from one state to different targets and makes no attempt to prove that the
 * guards overlap.</p>
 */
public final class TransitionDiagnostics {

    public static final class Coverage {
        public final List<String> coveredStates;
        public final List<String> uncoveredStates;

        /** Covered fraction of states, 0 for an FSM without states. */
        public final double ratio;

        Coverage(List<String> coveredStates, List<String> uncoveredStates, double ratio) {
            this.coveredStates = List.copyOf(coveredStates);
            this.uncoveredStates = List.copyOf(uncoveredStates);
            this.ratio = ratio;
        }
    }

    public static final class Duplicate {
        public final String from;
        public final String to;
        public final String condition;
        public final int count;

        Duplicate(String from, String to, String condition, int count) {
            this.from = from;
            this.to = to;
            this.condition = condition;
            this.count = count;
        }
    }

    public static final class NonDeterminism {
        public final String state;
        public final List<String> conditions;

        NonDeterminism(String state, List<String> conditions) {
            this.state = state;
            this.conditions = List.copyOf(conditions);
        }
    }

    private TransitionDiagnostics() {}

    /** States with at least one outgoing transition, implicit ones included. */
    public static Coverage coverage(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        Set<String> covered = new LinkedHashSet<>();
        for (FsmTransition t : fsm.transitions) {
            covered.add(t.from);
        }
        List<String> uncovered = new ArrayList<>();
        for (FsmState s : fsm.states) {
            if (!covered.contains(s.name)) uncovered.add(s.name);
        }
        double ratio = fsm.states.isEmpty() ? 0.0 : (double) covered.size() / fsm.states.size();
        return new Coverage(new ArrayList<>(covered), uncovered, ratio);
    }

    /** One message per endpoint that names no declared state. */
    public static List<String> unknownTargets(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        Set<String> names = new LinkedHashSet<>(fsm.stateNames());
        List<String> errors = new ArrayList<>();
        for (FsmTransition t : fsm.transitions) {
            if (!names.contains(t.to)) {
                errors.add("Transition from " + t.from + " targets unknown state '" + t.to + "' at line " + t.line);
            }
            if (!names.contains(t.from)) {
                errors.add("Transition from unknown state '" + t.from + "' at line " + t.line);
            }
        }
        return errors;
    }

    /** Transitions sharing source, target and guard, in order of first occurrence. */
    public static List<Duplicate> duplicates(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        Map<String, List<FsmTransition>> byKey = new LinkedHashMap<>();
        for (FsmTransition t : fsm.transitions) {
            String key = t.edgeKey() + ":" + (t.condition == null ? "" : t.condition);
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(t);
        }
        List<Duplicate> out = new ArrayList<>();
        for (List<FsmTransition> group : byKey.values()) {
            if (group.size() > 1) {
                FsmTransition first = group.get(0);
                out.add(new Duplicate(first.from, first.to, first.condition, group.size()));
            }
        }
        return out;
    }

    public static List<NonDeterminism> nonDeterminism(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        Map<String, List<FsmTransition>> bySource = new LinkedHashMap<>();
        for (FsmTransition t : fsm.transitions) {
            if (t.isDefault || !t.hasCondition()) continue;
            bySource.computeIfAbsent(t.from, k -> new ArrayList<>()).add(t);
        }
        List<NonDeterminism> out = new ArrayList<>();
        for (Map.Entry<String, List<FsmTransition>> e : bySource.entrySet()) {
            List<FsmTransition> guarded = e.getValue();
            long targets = guarded.stream().map(t -> t.to).distinct().count();
            if (guarded.size() > 1 && targets > 1) {
                out.add(new NonDeterminism(e.getKey(),
                        guarded.stream().map(t -> t.condition).collect(Collectors.toList())));
            }
        }
        return out;
    }
}
