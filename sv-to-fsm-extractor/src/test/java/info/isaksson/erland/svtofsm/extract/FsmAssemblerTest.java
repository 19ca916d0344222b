package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.BlockKind;
import info.isaksson.erland.svtofsm.model.BlockStyle;
import info.isaksson.erland.svtofsm.model.ErrorCode;
import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmJson;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.model.ModuleAnalysis;
import info.isaksson.erland.svtofsm.model.StateEncoding;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class FsmAssemblerTest {

    private final FsmAssembler assembler = new FsmAssembler();

    @Test
    void twoBlockMachine() {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module(SvFixtures.TWO_BLOCK));

        assertEquals("two_block", analysis.moduleName);
        assertTrue(analysis.parseErrors.isEmpty(), () -> analysis.parseErrors.toString());
        assertEquals(1, analysis.fsms.size());

        Fsm fsm = analysis.fsms.get(0);
        assertEquals("state_t", fsm.name);
        assertEquals(List.of("IDLE", "RUN", "DONE"), fsm.stateNames());
        assertEquals(List.of("IDLE->RUN:start", "RUN->DONE:done", "DONE->IDLE:"), edges(fsm));
        assertEquals("IDLE", fsm.resetState);
        assertEquals("state", fsm.stateVarName);
        assertEquals("next_state", fsm.nextStateVarName);
        assertEquals(BlockStyle.TWO_BLOCK, fsm.blockStyle);
        assertEquals(StateEncoding.UNKNOWN, fsm.encoding);
        assertEquals(BlockKind.COMBINATIONAL, fsm.transitions.get(0).sourceBlock);
        assertEquals("busy", fsm.state("RUN").orElseThrow().outputs.get(0).signal);
        assertEquals(List.of("start", "done"), fsm.inputSignals);
        assertEquals(List.of("busy"), fsm.outputSignals);
        assertEquals(0.985, fsm.confidence, 1e-9);
        assertTrue(fsm.warnings.isEmpty());
        assertTrue(fsm.errors.isEmpty());
    }

    @Test
    void oneBlockLegacyMachineMatchesTwoBlockTransitions() {
        Fsm oneBlock = assembler.assemble(SvFixtures.module(SvFixtures.ONE_BLOCK)).fsms.get(0);
        Fsm twoBlock = assembler.assemble(SvFixtures.module(SvFixtures.TWO_BLOCK)).fsms.get(0);

        assertEquals(BlockStyle.ONE_BLOCK, oneBlock.blockStyle);
        assertNull(oneBlock.nextStateVarName);
        assertEquals("IDLE", oneBlock.resetState);
        assertEquals(BlockKind.LEGACY, oneBlock.transitions.get(0).sourceBlock);
        assertEquals(edges(twoBlock), edges(oneBlock));
    }

    @Test
    void independentMachinesInOneModule() {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module(SvFixtures.DUAL));

        assertEquals(2, analysis.fsms.size());
        Fsm ctrl = analysis.fsm("ctrl_state_t").orElseThrow();
        Fsm rx = analysis.fsm("rx_state_t").orElseThrow();
        assertEquals(List.of("IDLE", "BUSY"), ctrl.stateNames());
        assertEquals(List.of("RX_IDLE", "RX_DATA", "RX_STOP"), rx.stateNames());
        assertEquals("IDLE", ctrl.resetState);
        assertEquals("RX_IDLE", rx.resetState);

        Set<String> ctrlStates = new HashSet<>(ctrl.stateNames());
        for (FsmTransition t : rx.transitions) {
            assertFalse(ctrlStates.contains(t.from));
            assertFalse(ctrlStates.contains(t.to));
        }
        assertEquals(2, ctrl.transitions.size());
        assertEquals(3, rx.transitions.size());
    }

    @Test
    void infersStatesFromCaseLabelsWithoutEnumeration() {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module(SvFixtures.INFERRED));

        assertEquals(1, analysis.fsms.size());
        Fsm fsm = analysis.fsms.get(0);
        assertEquals("state", fsm.name);
        assertEquals(List.of("IDLE", "WORK", "DONE"), fsm.stateNames());
        assertEquals("2'b01", fsm.state("WORK").orElseThrow().encoding);
        assertEquals(StateEncoding.BINARY, fsm.encoding);
        assertEquals(0.5, fsm.confidence, 1e-9);
        assertEquals(0.5, fsm.confidenceBreakdown.transitionExtraction, 1e-9);
        assertEquals(0.5, fsm.confidenceBreakdown.stateDetection, 1e-9);
        assertEquals("IDLE", fsm.resetState);
        assertEquals(List.of("IDLE->WORK:go", "WORK->DONE:", "DONE->IDLE:"), edges(fsm));
    }

    @Test
    void resetInElseBranchFollowsPolarity() {
        Fsm fsm = only("""
                module m (input logic clk, input logic rst_n, input logic go);
                    typedef enum {S_INIT, S_IDLE, S_RUN} state_t;
                    state_t state, next_state;

                    always_ff @(posedge clk or negedge rst_n) begin
                        if (rst_n) state <= next_state;
                        else state <= S_IDLE;
                    end

                    always_comb begin
                        next_state = state;
                        case (state)
                            S_INIT: next_state = S_IDLE;
                            S_IDLE: if (go) next_state = S_RUN;
                            S_RUN: next_state = S_IDLE;
                        endcase
                    end
                endmodule
                """);

        assertEquals("S_IDLE", fsm.resetState);
        assertEquals(1.0, fsm.confidenceBreakdown.resetDetection, 1e-9);
    }

    @Test
    void missingResetFallsBackToFirstState() {
        Fsm fsm = only("""
                module m (input logic clk, input logic go);
                    typedef enum {IDLE, RUN} state_t;
                    state_t state, next_state;

                    always_ff @(posedge clk) state <= next_state;

                    always_comb begin
                        next_state = state;
                        case (state)
                            IDLE: if (go) next_state = RUN;
                            RUN: next_state = IDLE;
                        endcase
                    end
                endmodule
                """);

        assertEquals("IDLE", fsm.resetState);
        assertEquals(1.0, fsm.confidenceBreakdown.resetDetection, 1e-9);
    }

    @Test
    void inferredMachineWithoutResetHasNoResetState() {
        Fsm fsm = only("""
                module m (input wire clk, input wire go);
                    localparam IDLE = 2'b00, RUN = 2'b01;
                    reg [1:0] state, next_state;

                    always @(posedge clk) state <= next_state;

                    always @(*) begin
                        next_state = state;
                        case (state)
                            IDLE: if (go) next_state = RUN;
                            RUN: next_state = IDLE;
                        endcase
                    end
                endmodule
                """);

        assertEquals(List.of("IDLE", "RUN"), fsm.stateNames());
        assertNull(fsm.resetState);
        assertEquals("next_state", fsm.nextStateVarName);
    }

    @Test
    void separateOutputBlockContributesMooreOutputs() {
        Fsm fsm = only("""
                module m (input logic clk, input logic rst_n, input logic go, output logic busy);
                    typedef enum {IDLE, RUN} state_t;
                    state_t state, next_state;

                    always_ff @(posedge clk or negedge rst_n)
                        if (!rst_n) state <= IDLE;
                        else state <= next_state;

                    always_comb begin
                        next_state = state;
                        case (state)
                            IDLE: if (go) next_state = RUN;
                            RUN: next_state = IDLE;
                        endcase
                    end

                    always_comb begin
                        case (state)
                            RUN: busy = 1'b1;
                            default: busy = 1'b0;
                        endcase
                    end
                endmodule
                """);

        assertEquals(BlockStyle.THREE_BLOCK, fsm.blockStyle);
        assertEquals("busy", fsm.state("RUN").orElseThrow().outputs.get(0).signal);
        assertTrue(fsm.state("IDLE").orElseThrow().outputs.isEmpty());
        assertEquals(List.of("busy"), fsm.outputSignals);
    }

    @Test
    void wildcardLabelsAreReportedNotMerged() {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module("""
                module m (input logic clk, input logic go);
                    typedef enum logic [1:0] {IDLE = 2'b00, RUN = 2'b01, DONE = 2'b10} state_t;
                    state_t state, next_state;

                    always_ff @(posedge clk) state <= next_state;

                    always_comb begin
                        next_state = state;
                        casez (state)
                            IDLE: if (go) next_state = RUN;
                            RUN: next_state = DONE;
                            2'b1?: next_state = IDLE;
                        endcase
                    end
                endmodule
                """));

        assertEquals(1, analysis.parseErrors.size());
        assertEquals(ErrorCode.UNSUPPORTED_PATTERN, analysis.parseErrors.get(0).code);
        assertEquals(12, analysis.parseErrors.get(0).line);

        Fsm fsm = analysis.fsms.get(0);
        assertEquals(StateEncoding.BINARY, fsm.encoding);
        List<FsmTransition> fromDone = fsm.transitions.stream()
                .filter(t -> t.from.equals("DONE")).collect(Collectors.toList());
        assertEquals(1, fromDone.size());
        assertTrue(fromDone.get(0).isImplicit);
    }

    @Test
    void stateEnumWithoutCaseStatementIsDiagnosed() {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module("""
                module m (input logic clk);
                    typedef enum {IDLE, RUN} state_t;
                    state_t state, next_state;
                    always_ff @(posedge clk) state <= next_state;
                    always_comb next_state = state;
                endmodule
                """));

        assertTrue(analysis.fsms.isEmpty());
        assertEquals(1, analysis.parseErrors.size());
        assertEquals(ErrorCode.NO_TRANSITIONS, analysis.parseErrors.get(0).code);
        assertEquals(2, analysis.parseErrors.get(0).line);
    }

    @Test
    void unrelatedEnumerationIsIgnored() {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module("""
                module m (input logic clk);
                    typedef enum {RED, GREEN} color_t;
                    color_t color;
                endmodule
                """));

        assertTrue(analysis.fsms.isEmpty());
        assertTrue(analysis.parseErrors.isEmpty());
    }

    @Test
    void unknownNextStateValueIsKeptAsError() {
        Fsm fsm = assembler.assemble(SvFixtures.combModule("IDLE, RUN", """
                        case (state)
                            IDLE: next_state = RUN;
                            RUN: next_state = 2'b11;
                        endcase
                """)).fsms.get(0);

        assertEquals(1, fsm.transitions.size());
        assertEquals(1, fsm.errors.size());
        assertTrue(fsm.errors.get(0).startsWith("Line 8: next_state"), fsm.errors.get(0));
    }

    @Test
    void extractionIsDeterministic() {
        String first = FsmJson.toJson(assembler.assemble(SvFixtures.module(SvFixtures.DUAL)));
        String second = FsmJson.toJson(new FsmAssembler().assemble(SvFixtures.module(SvFixtures.DUAL)));

        assertEquals(first, second);
    }

    @Test
    void rejectsNonModuleNodes() {
        assertThrows(IllegalArgumentException.class, () -> assembler.assemble(null));
        assertThrows(IllegalArgumentException.class,
                () -> assembler.assemble(SvFixtures.module(SvFixtures.TWO_BLOCK).parent()));
    }

    private Fsm only(String source) {
        ModuleAnalysis analysis = assembler.assemble(SvFixtures.module(source));
        assertEquals(1, analysis.fsms.size(), () -> analysis.parseErrors.toString());
        return analysis.fsms.get(0);
    }

    private static List<String> edges(Fsm fsm) {
        return fsm.transitions.stream()
                .map(t -> t.from + "->" + t.to + ":" + (t.condition == null ? "" : t.condition))
                .collect(Collectors.toList());
    }
}
