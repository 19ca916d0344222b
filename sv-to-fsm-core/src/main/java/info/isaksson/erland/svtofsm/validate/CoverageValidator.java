package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.model.FsmWarning;
import info.isaksson.erland.svtofsm.model.WarningKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Case coverage checks: unhandled states, missing reset, synthesized self-loops. */
public final class CoverageValidator {

    public List<FsmWarning> validate(Fsm fsm) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        List<FsmWarning> warnings = new ArrayList<>();

        Set<String> handled = new HashSet<>();
        Set<String> implicit = new LinkedHashSet<>();
        for (FsmTransition t : fsm.transitions) {
            if (t.isImplicit) {
                if (t.isSelfLoop) implicit.add(t.from);
            } else {
                handled.add(t.from);
            }
        }

        List<String> missing = new ArrayList<>();
        for (FsmState s : fsm.states) {
            if (!handled.contains(s.name)) missing.add(s.name);
        }
        if (!missing.isEmpty()) {
            warnings.add(new FsmWarning(WarningKind.MISSING_CASE,
                    "State(s) " + String.join(", ", missing) + " not explicitly handled in case statement", missing));
        }

        if (fsm.resetState == null) {
            warnings.add(new FsmWarning(WarningKind.NO_RESET,
                    "No reset state detected. Diagram will not show initial state arrow.", List.of()));
        }

        if (!implicit.isEmpty()) {
            warnings.add(new FsmWarning(WarningKind.IMPLICIT_DEFAULT,
                    "Self-loops inferred from default assignment pattern", new ArrayList<>(implicit)));
        }
        return warnings;
    }
}
