package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.ConfidenceBreakdown;
import info.isaksson.erland.svtofsm.model.FsmTransition;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Weighted confidence of an extracted machine. Factors and weights come from
 * {@link FsmHeuristics}; the result is clamped to {@code [0,1]}.
 */
public final class ConfidenceScorer {

    private final FsmHeuristics heuristics;

    public ConfidenceScorer(FsmHeuristics heuristics) {
        if (heuristics == null) throw new IllegalArgumentException("heuristics is null");
        this.heuristics = heuristics;
    }

    /**
     * @param stateCount    number of states
     * @param transitions   all transitions, implicit ones included
     * @param resetKnown a reset state is known, whether found in code or defaulted
     * @param signalsFound  at least one input or output signal was found
     */
    public ConfidenceBreakdown breakdown(int stateCount, List<FsmTransition> transitions,
                                         boolean resetKnown, boolean signalsFound) {
        Set<String> sources = new HashSet<>();
        if (transitions != null) {
            for (FsmTransition t : transitions) sources.add(t.from);
        }
        double covered = stateCount == 0 ? 0.0 : (double) sources.size() / stateCount;
        return new ConfidenceBreakdown(
                1.0,
                Math.min(1.0, covered + heuristics.transitionCoverageBonus),
                resetKnown ? 1.0 : heuristics.resetFallbackScore,
                signalsFound ? heuristics.signalsFoundScore : heuristics.signalsMissingScore);
    }

    public double score(ConfidenceBreakdown b) {
        FsmHeuristics.Weights w = heuristics.weights;
        double s = b.stateDetection * w.stateDetection
                + b.transitionExtraction * w.transitionExtraction
                + b.resetDetection * w.resetDetection
                + b.outputExtraction * w.outputExtraction;
        if (Double.isNaN(s)) return 0.0;
        return Math.max(0.0, Math.min(1.0, s));
    }
}
