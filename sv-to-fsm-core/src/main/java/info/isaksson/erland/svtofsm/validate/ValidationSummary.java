package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Flat list of everything questionable about an FSM plus a few counts. */
public final class ValidationSummary {
    public final boolean isValid;
    public final List<String> issues;
    public final int stateCount;
    public final int transitionCount;
    public final boolean hasReset;
    public final double coverage;

    private ValidationSummary(List<String> issues, int stateCount, int transitionCount, boolean hasReset, double coverage) {
        this.issues = List.copyOf(issues);
        this.isValid = issues.isEmpty();
        this.stateCount = stateCount;
        this.transitionCount = transitionCount;
        this.hasReset = hasReset;
        this.coverage = coverage;
    }

    /** Summarizes an FSM that has already been through {@link FsmValidator}. */
    public static ValidationSummary of(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        List<String> issues = new ArrayList<>();

        if (fsm.resetState == null) {
            issues.add("No reset state detected");
        }

        TransitionDiagnostics.Coverage cov = TransitionDiagnostics.coverage(fsm);
        if (!cov.uncoveredStates.isEmpty()) {
            issues.add("Uncovered states: " + String.join(", ", cov.uncoveredStates));
        }

        issues.addAll(TransitionDiagnostics.unknownTargets(fsm));

        List<String> unreachable = fsm.states.stream()
                .filter(s -> s.isUnreachable)
                .map(s -> s.name)
                .collect(Collectors.toList());
        if (!unreachable.isEmpty()) {
            issues.add("Unreachable states: " + String.join(", ", unreachable));
        }

        for (FsmWarning w : fsm.warnings) {
            issues.add(w.message);
        }

        return new ValidationSummary(issues, fsm.states.size(), fsm.transitions.size(), fsm.resetState != null, cov.ratio);
    }

    @Override
    public String toString() {
        return "ValidationSummary{valid=" + isValid + ", issues=" + issues.size()
                + ", states=" + stateCount + ", transitions=" + transitionCount + "}";
    }
}
