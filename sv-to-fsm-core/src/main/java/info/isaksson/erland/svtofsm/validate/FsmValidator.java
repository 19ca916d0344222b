package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.extract.FsmHeuristics;
import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmWarning;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Runs reachability and coverage validation over an assembled FSM and records the results on it.
 *
 * <p>Warnings are appended to {@link Fsm#warnings} (reachability first), transitions that name
 * unknown states are appended to {@link Fsm#errors}. The transition relation is left untouched.
 * Never throws for a non-null FSM.</p>
 */
public final class FsmValidator {
    private static final Logger logger = LogManager.getLogger(FsmValidator.class);

    private final ReachabilityValidator reachability;
    private final CoverageValidator coverage = new CoverageValidator();

    public FsmValidator() {
        this(FsmHeuristics.defaults());
    }

    public FsmValidator(FsmHeuristics heuristics) {
        this.reachability = new ReachabilityValidator(heuristics);
    }

    public void validate(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");

        List<FsmWarning> found = reachability.validate(fsm);
        found.addAll(coverage.validate(fsm));
        fsm.warnings.addAll(found);

        for (String err : TransitionDiagnostics.unknownTargets(fsm)) {
            if (!fsm.errors.contains(err)) fsm.errors.add(err);
        }

        for (TransitionDiagnostics.NonDeterminism nd : TransitionDiagnostics.nonDeterminism(fsm)) {
            logger.debug("FSM {}: state {} has guarded transitions to several targets: {}", fsm.name, nd.state, nd.conditions);
        }
        logger.debug("FSM {}: {} warning(s), {} error(s)", fsm.name, fsm.warnings.size(), fsm.errors.size());
    }
}
