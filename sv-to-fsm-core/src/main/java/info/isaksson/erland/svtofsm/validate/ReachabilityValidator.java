package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.extract.FsmHeuristics;
import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.model.FsmWarning;
import info.isaksson.erland.svtofsm.model.WarningKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags states without incoming or outgoing non-self-loop transitions.
 *
 * <p>The reset state is never unreachable. States named like an intended end point
 * ({@link FsmHeuristics#isIntentionalTerminalName(String)}) are marked terminal but left out of the
 * warning.</p>
 */
public final class ReachabilityValidator {

    private final FsmHeuristics heuristics;

    public ReachabilityValidator() {
        this(FsmHeuristics.defaults());
    }

    public ReachabilityValidator(FsmHeuristics heuristics) {
        if (heuristics == null) throw new IllegalArgumentException("heuristics is null");
        this.heuristics = heuristics;
    }

    /** Returns the warnings and sets {@link FsmState#isUnreachable} / {@link FsmState#isTerminal}. */
    public List<FsmWarning> validate(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");

        Set<String> hasIncoming = new HashSet<>();
        Set<String> hasOutgoing = new HashSet<>();
        for (FsmTransition t : fsm.transitions) {
            if (t.isSelfLoop) continue;
            hasIncoming.add(t.to);
            hasOutgoing.add(t.from);
        }

        List<String> unreachable = new ArrayList<>();
        List<String> terminal = new ArrayList<>();
        for (FsmState s : fsm.states) {
            if (!s.name.equals(fsm.resetState) && !hasIncoming.contains(s.name)) {
                unreachable.add(s.name);
                s.isUnreachable = true;
            }
            if (!hasOutgoing.contains(s.name)) {
                terminal.add(s.name);
                s.isTerminal = true;
            }
        }

        List<FsmWarning> warnings = new ArrayList<>();
        if (!unreachable.isEmpty()) {
            warnings.add(new FsmWarning(WarningKind.UNREACHABLE_STATE,
                    "State(s) " + String.join(", ", unreachable) + " have no incoming transitions", unreachable));
        }

        List<String> unintended = terminal.stream()
                .filter(n -> !heuristics.isIntentionalTerminalName(n))
                .collect(Collectors.toList());
        if (!unintended.isEmpty()) {
            warnings.add(new FsmWarning(WarningKind.TERMINAL_STATE,
                    "State(s) " + String.join(", ", unintended) + " have no outgoing transitions (may be intentional)",
                    unintended));
        }
        return warnings;
    }
}
