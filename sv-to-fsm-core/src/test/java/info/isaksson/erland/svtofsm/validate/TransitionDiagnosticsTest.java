package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.model.Fsm;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.svtofsm.validate.Fsms.edge;
import static info.isaksson.erland.svtofsm.validate.Fsms.hold;
import static org.junit.jupiter.api.Assertions.*;

public class TransitionDiagnosticsTest {

    @Test
    void coverageCountsImplicitSources() {
        Fsm fsm = Fsms.of("A", List.of("A", "B", "C", "D"), edge("A", "B"), hold("B"));
        TransitionDiagnostics.Coverage c = TransitionDiagnostics.coverage(fsm);

        assertEquals(List.of("A", "B"), c.coveredStates);
        assertEquals(List.of("C", "D"), c.uncoveredStates);
        assertEquals(0.5, c.ratio, 1e-9);
        assertEquals(0.0, TransitionDiagnostics.coverage(Fsms.of(null, List.of())).ratio, 1e-9);
    }

    @Test
    void unknownEndpointsAreReported() {
        Fsm fsm = Fsms.of("A", List.of("A"), edge("A", "GHOST", "go", 12), edge("PHANTOM", "A", null, 14));
        assertEquals(List.of(
                "Transition from A targets unknown state 'GHOST' at line 12",
                "Transition from unknown state 'PHANTOM' at line 14"
        ), TransitionDiagnostics.unknownTargets(fsm));
    }

    @Test
    void duplicatesShareSourceTargetAndGuard() {
        Fsm fsm = Fsms.of("A", List.of("A", "B"),
                edge("A", "B", "go", 3), edge("A", "B", "go", 7), edge("A", "B", "stop", 9));
        List<TransitionDiagnostics.Duplicate> d = TransitionDiagnostics.duplicates(fsm);

        assertEquals(1, d.size());
        assertEquals("A", d.get(0).from);
        assertEquals("B", d.get(0).to);
        assertEquals("go", d.get(0).condition);
        assertEquals(2, d.get(0).count);
    }

    @Test
    void differentTargetsUnderGuardsAreAdvisory() {
        Fsm fsm = Fsms.of("A", List.of("A", "B", "C"),
                edge("A", "B", "x", 3), edge("A", "C", "y", 4), edge("B", "A", "p", 5), edge("B", "A", "q", 6), hold("C"));
        List<TransitionDiagnostics.NonDeterminism> nd = TransitionDiagnostics.nonDeterminism(fsm);

        assertEquals(1, nd.size());
        assertEquals("A", nd.get(0).state);
        assertEquals(List.of("x", "y"), nd.get(0).conditions);
    }
}
