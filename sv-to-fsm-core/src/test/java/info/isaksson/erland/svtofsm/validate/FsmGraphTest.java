package info.isaksson.erland.svtofsm.validate;

import info.isaksson.erland.svtofsm.model.Fsm;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static info.isaksson.erland.svtofsm.validate.Fsms.edge;
import static org.junit.jupiter.api.Assertions.*;

public class FsmGraphTest {

    @Test
    void reachableSetIsBreadthFirst() {
        Fsm fsm = Fsms.of("A", List.of("A", "B", "C", "D"), edge("A", "B"), edge("A", "C"), edge("C", "D"));
        assertEquals(List.of("A", "B", "C", "D"), List.copyOf(FsmGraph.reachableFrom(fsm, "A")));
        assertEquals(Set.of("C", "D"), FsmGraph.reachableFrom(fsm, "C"));
        assertTrue(FsmGraph.reachableFrom(fsm, null).isEmpty());
    }

    @Test
    void stronglyConnectedFromReset() {
        Fsm all = Fsms.of("A", List.of("A", "B"), edge("A", "B"), edge("B", "A"));
        Fsm partial = Fsms.of("A", List.of("A", "B", "X"), edge("A", "B"), edge("X", "A"));
        Fsm noReset = Fsms.of(null, List.of("A", "B"), edge("A", "B"), edge("B", "A"));

        assertTrue(FsmGraph.isStronglyConnected(all));
        assertFalse(FsmGraph.isStronglyConnected(partial));
        assertFalse(FsmGraph.isStronglyConnected(noReset));
    }

    @Test
    void cyclesAreClosedAndIgnoreSelfLoops() {
        Fsm fsm = Fsms.of("A", List.of("A", "B", "C"),
                edge("A", "B"), edge("B", "C"), edge("C", "A"), edge("B", "B"));
        assertEquals(List.of(List.of("A", "B", "C", "A")), FsmGraph.findCycles(fsm));
    }

    @Test
    void acyclicMachineHasNoCycles() {
        Fsm fsm = Fsms.of("A", List.of("A", "B", "C"), edge("A", "B"), edge("B", "C"));
        assertTrue(FsmGraph.findCycles(fsm).isEmpty());
    }
}
