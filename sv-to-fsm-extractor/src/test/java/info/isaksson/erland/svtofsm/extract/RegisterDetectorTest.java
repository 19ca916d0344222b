package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class RegisterDetectorTest {

    private final FsmHeuristics heuristics = FsmHeuristics.defaults();
    private final EnumerationDetector enums = new EnumerationDetector(heuristics);
    private final RegisterDetector detector = new RegisterDetector(heuristics);

    @Test
    void pairsTypedStateAndNextState() {
        SyntaxNode module = SvFixtures.module(SvFixtures.TWO_BLOCK);
        List<StateRegister> registers = detector.detect(module, enums.detect(module));

        assertEquals(List.of("state", "next_state"), names(registers));
        assertEquals("state_t", registers.get(0).typeName);
        assertFalse(registers.get(0).isNextState);
        assertTrue(registers.get(1).isNextState);

        List<RegisterPair> pairs = detector.pair(registers);
        assertEquals(1, pairs.size());
        assertEquals("state", pairs.get(0).state.name);
        assertEquals("next_state", pairs.get(0).nextVarName());
    }

    @Test
    void singleRegisterPairsWithNothing() {
        SyntaxNode module = SvFixtures.module(SvFixtures.ONE_BLOCK);
        List<RegisterPair> pairs = detector.pair(detector.detect(module, enums.detect(module)));

        assertEquals(1, pairs.size());
        assertFalse(pairs.get(0).hasNext());
        assertNull(pairs.get(0).nextVarName());
    }

    @Test
    void untypedRegistersAreFoundByName() {
        SyntaxNode module = SvFixtures.module(SvFixtures.INFERRED);
        List<StateRegister> registers = detector.detect(module, enums.detect(module));

        assertEquals(List.of("state", "next_state"), names(registers));
        assertNull(registers.get(0).typeName);
        assertEquals(1, detector.pair(registers).size());
    }

    @Test
    void pairsEachTypeSeparately() {
        SyntaxNode module = SvFixtures.module(SvFixtures.DUAL);
        List<EnumDefinition> defs = enums.detect(module);
        List<RegisterPair> pairs = detector.pair(detector.detect(module, defs));

        assertEquals(2, pairs.size());
        assertEquals("ctrl_state_next", RegisterDetector.pairFor(defs.get(0), pairs).orElseThrow().nextVarName());
        assertEquals("rx_state_next", RegisterDetector.pairFor(defs.get(1), pairs).orElseThrow().nextVarName());
    }

    @Test
    void namingConventionWinsOverDeclarationOrder() {
        List<StateRegister> registers = List.of(
                new StateRegister("rx_state", "t", false, 1),
                new StateRegister("tx_state", "t", false, 2),
                new StateRegister("tx_state_next", "t", true, 3),
                new StateRegister("rx_state_next", "t", true, 4));

        List<RegisterPair> pairs = detector.pair(registers);

        assertEquals(2, pairs.size());
        assertEquals("rx_state_next", pairs.get(0).nextVarName());
        assertEquals("tx_state_next", pairs.get(1).nextVarName());
    }

    @Test
    void excludedNamesAreSkipped() {
        SyntaxNode module = SvFixtures.module("""
                module m;
                    logic [3:0] state_counter;
                    logic [1:0] state;
                endmodule
                """);

        assertEquals(List.of("state"), names(detector.detect(module, List.of())));
    }

    private static List<String> names(List<StateRegister> registers) {
        return registers.stream().map(r -> r.name).collect(Collectors.toList());
    }
}
