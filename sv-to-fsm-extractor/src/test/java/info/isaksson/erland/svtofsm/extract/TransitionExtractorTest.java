package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.BlockKind;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TransitionExtractorTest {

    private static final List<String> STATES = List.of("IDLE", "RUN", "WAIT", "DONE");
    private static final String MEMBERS = "IDLE, RUN, WAIT, DONE";

    private final TransitionExtractor extractor = new TransitionExtractor();

    @Test
    void ifElseIfElseAccumulatesNegatedGuards() {
        TransitionExtractor.Result r = extract("""
                        next_state = state;
                        case (state)
                            IDLE: if (a) next_state = RUN;
                                  else if (b) next_state = WAIT;
                                  else next_state = DONE;
                            RUN: next_state = IDLE;
                            WAIT: next_state = IDLE;
                            DONE: next_state = IDLE;
                        endcase
                """);

        List<FsmTransition> fromIdle = from(r, "IDLE");
        assertEquals(3, fromIdle.size());
        assertEquals("RUN", fromIdle.get(0).to);
        assertEquals("a", fromIdle.get(0).condition);
        assertEquals("WAIT", fromIdle.get(1).to);
        assertEquals("!a && b", fromIdle.get(1).condition);
        assertEquals("!(a) && b", fromIdle.get(1).rawCondition);
        assertEquals("DONE", fromIdle.get(2).to);
        assertEquals("!a && !b", fromIdle.get(2).condition);
        assertTrue(r.errors.isEmpty());
    }

    @Test
    void nestedGuardKeepsDisjunctionGrouped() {
        TransitionExtractor.Result r = extract("""
                        next_state = state;
                        case (state)
                            IDLE: if (a || b) begin
                                      if (c) next_state = RUN;
                                  end
                            RUN: if (a || b) next_state = c ? DONE : WAIT;
                        endcase
                """);

        List<FsmTransition> fromIdle = from(r, "IDLE");
        assertEquals(1, fromIdle.size());
        assertEquals("(a || b) && c", fromIdle.get(0).condition);
        assertEquals("(a || b) && c", fromIdle.get(0).rawCondition);

        List<FsmTransition> fromRun = from(r, "RUN");
        assertEquals(List.of("DONE", "WAIT"), targets(fromRun));
        assertEquals("(a || b) && c", fromRun.get(0).condition);
        assertEquals("(a || b) && !c", fromRun.get(1).condition);
    }

    @Test
    void lastDirectWriteWinsAndYieldsToLaterConditional() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            RUN: begin
                                next_state = IDLE;
                                next_state = DONE;
                                if (c) next_state = WAIT;
                            end
                        endcase
                """);

        List<FsmTransition> fromRun = from(r, "RUN");
        assertEquals(2, fromRun.size());
        assertEquals("DONE", fromRun.get(0).to);
        assertEquals("!c", fromRun.get(0).condition);
        assertEquals("WAIT", fromRun.get(1).to);
        assertEquals("c", fromRun.get(1).condition);
    }

    @Test
    void directWriteOverriddenOnEveryPathIsDropped() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            RUN: begin
                                next_state = IDLE;
                                if (a) next_state = DONE;
                                else next_state = WAIT;
                            end
                        endcase
                """);

        assertEquals(List.of("DONE", "WAIT"), targets(from(r, "RUN")));
    }

    @Test
    void defaultHoldAddsOneImplicitSelfLoopPerUncoveredState() {
        TransitionExtractor.Result r = extract("""
                        next_state = state;
                        case (state)
                            IDLE: if (a) next_state = RUN;
                            RUN: next_state = IDLE;
                            DONE: begin end
                        endcase
                """);

        assertTrue(r.hasDefaultAssignment);
        assertEquals(2, r.implicitSelfLoops);
        assertEquals(Set.of("IDLE", "RUN"), r.coveredStates());

        List<FsmTransition> implicit = r.transitions.stream().filter(t -> t.isImplicit).collect(Collectors.toList());
        assertEquals(List.of("DONE", "WAIT"), implicit.stream().map(t -> t.from).collect(Collectors.toList()));
        for (FsmTransition t : implicit) {
            assertTrue(t.isSelfLoop);
            assertTrue(t.isDefault);
            assertEquals(t.from, t.to);
            assertNull(t.condition);
        }
        assertEquals(STATES.size() - r.coveredStates().size(), r.implicitSelfLoops);
    }

    @Test
    void withoutDefaultHoldNothingIsSynthesized() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            IDLE: if (a) next_state = RUN;
                        endcase
                """);

        assertFalse(r.hasDefaultAssignment);
        assertEquals(0, r.implicitSelfLoops);
        assertEquals(1, r.transitions.size());
    }

    @Test
    void ternaryValueSplitsIntoTwoTransitions() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            RUN: next_state = a ? DONE : RUN;
                        endcase
                """);

        List<FsmTransition> fromRun = from(r, "RUN");
        assertEquals(2, fromRun.size());
        assertEquals("DONE", fromRun.get(0).to);
        assertEquals("a", fromRun.get(0).condition);
        assertEquals("RUN", fromRun.get(1).to);
        assertEquals("!a", fromRun.get(1).condition);
        assertTrue(fromRun.get(1).isSelfLoop);
    }

    @Test
    void multiLabelArmAppliesToEachLabel() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            IDLE, WAIT: next_state = RUN;
                        endcase
                """);

        assertEquals(1, from(r, "IDLE").size());
        assertEquals(1, from(r, "WAIT").size());
        assertEquals("RUN", from(r, "WAIT").get(0).to);
    }

    @Test
    void nestedCaseReadsAsIfChain() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            RUN: case (c)
                                1'b1: next_state = DONE;
                                default: next_state = IDLE;
                            endcase
                        endcase
                """);

        List<FsmTransition> fromRun = from(r, "RUN");
        assertEquals(2, fromRun.size());
        assertEquals("c", fromRun.get(0).condition);
        assertEquals("IDLE", fromRun.get(1).to);
        assertEquals("!c", fromRun.get(1).condition);
    }

    @Test
    void unknownValueIsReportedAndHoldIsIgnored() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            IDLE: next_state = 2'b11;
                            RUN: next_state = state;
                        endcase
                """);

        assertTrue(r.transitions.isEmpty());
        assertEquals(1, r.errors.size());
        assertTrue(r.errors.get(0).contains("'2'b11'"), r.errors.get(0));
        assertTrue(r.errors.get(0).contains("not a known state"));
    }

    @Test
    void transitionsRecordSourceBlockAndLine() {
        TransitionExtractor.Result r = extract("""
                        case (state)
                            IDLE: next_state = RUN;
                        endcase
                """);

        FsmTransition t = r.transitions.get(0);
        assertEquals(BlockKind.COMBINATIONAL, t.sourceBlock);
        assertEquals(7, t.line);
        assertFalse(t.isSelfLoop);
        assertFalse(t.hasCondition());
    }

    private TransitionExtractor.Result extract(String body) {
        SyntaxNode module = SvFixtures.combModule(MEMBERS, body);
        SyntaxNode caseNode = CaseArmReader.findStateCase(module, Set.of("state", "next_state")).orElseThrow();
        CaseArmReader.StateCase stateCase = CaseArmReader.read(caseNode, STATES);
        boolean hold = CaseArmReader.hasDefaultAssignment(caseNode, "next_state", "state");
        return extractor.extract(stateCase, "next_state", "state", STATES, BlockKind.COMBINATIONAL, hold);
    }

    private static List<FsmTransition> from(TransitionExtractor.Result r, String state) {
        return r.transitions.stream().filter(t -> t.from.equals(state)).collect(Collectors.toList());
    }

    private static List<String> targets(List<FsmTransition> transitions) {
        return transitions.stream().map(t -> t.to).collect(Collectors.toList());
    }
}
