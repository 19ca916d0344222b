package info.isaksson.erland.svtofsm.parser;

import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import info.isaksson.erland.svtofsm.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AntlrSourceParserTest {

    private static final String TWO_BLOCK = """
            `timescale 1ns/1ps
            module fsm_two_block (
                input  logic clk,
                input  logic rst_n,
                input  logic start,
                output logic busy
            );
                typedef enum logic [1:0] {IDLE = 2'b00, RUN = 2'b01, DONE = 2'b10} state_t;
                state_t state, next_state;

                // state register
                always_ff @(posedge clk or negedge rst_n) begin
                    if (!rst_n) state <= IDLE;
                    else        state <= next_state;
                end

                always_comb begin
                    next_state = state;
                    busy = 1'b0;
                    case (state)
                        IDLE: if (start) next_state = RUN;
                        RUN: begin
                            busy = 1'b1;
                            next_state = DONE;
                        end
                        default: next_state = IDLE;
                    endcase
                end
            endmodule
            """;

    private final AntlrSourceParser parser = new AntlrSourceParser();

    @Test
    void parsesTwoBlockModuleWithoutProblems() {
        SyntaxTree tree = parser.parse(TWO_BLOCK);

        assertFalse(tree.hasProblems(), () -> tree.problems.toString());
        List<SyntaxNode> modules = tree.modules();
        assertEquals(1, modules.size());
        SyntaxNode module = modules.get(0);
        assertEquals("fsm_two_block", module.child(NodeKind.NAME).orElseThrow().text());
        assertEquals(2, module.line());

        List<SyntaxNode> members = module.descendants(NodeKind.ENUM_MEMBER);
        assertEquals(List.of("IDLE = 2'b00", "RUN = 2'b01", "DONE = 2'b10"),
                members.stream().map(SyntaxNode::text).collect(Collectors.toList()));

        List<SyntaxNode> always = module.children(NodeKind.ALWAYS_CONSTRUCT);
        assertEquals(2, always.size());
        assertEquals("always_ff", always.get(0).child(NodeKind.ALWAYS_KEYWORD).orElseThrow().text());
        assertEquals(12, always.get(0).line());
    }

    @Test
    void ansiPortsBecomeDeclarations() {
        SyntaxNode module = parser.parse(TWO_BLOCK).modules().get(0);
        List<String> names = module.children(NodeKind.DATA_DECLARATION).stream()
                .flatMap(d -> d.descendants(NodeKind.VARIABLE_DECLARATOR).stream())
                .map(SyntaxNode::text)
                .collect(Collectors.toList());
        assertEquals(List.of("clk", "rst_n", "start", "busy", "state", "next_state"), names);
    }

    @Test
    void sensitivityListKeepsEdgesAndSignals() {
        SyntaxNode module = parser.parse(TWO_BLOCK).modules().get(0);
        SyntaxNode ff = module.children(NodeKind.ALWAYS_CONSTRUCT).get(0);
        List<SyntaxNode> terms = ff.child(NodeKind.EVENT_CONTROL).orElseThrow().children(NodeKind.EVENT_TERM);
        assertEquals(2, terms.size());
        assertEquals("negedge", terms.get(1).child(NodeKind.EDGE).orElseThrow().text());
        assertEquals("rst_n", terms.get(1).expressionChild().orElseThrow().text());
    }

    @Test
    void caseItemsKeepLabelsAndDefault() {
        SyntaxNode module = parser.parse(TWO_BLOCK).modules().get(0);
        SyntaxNode caseStmt = module.descendants(NodeKind.CASE_STATEMENT).get(0);

        assertEquals("state", caseStmt.child(NodeKind.CASE_SUBJECT).orElseThrow().text());
        List<SyntaxNode> items = caseStmt.children(NodeKind.CASE_ITEM);
        assertEquals(2, items.size());
        assertEquals("IDLE", items.get(0).child(NodeKind.CASE_LABEL).orElseThrow().text());
        assertTrue(caseStmt.child(NodeKind.DEFAULT_CASE_ITEM).isPresent());

        SyntaxNode ifStmt = items.get(0).child(NodeKind.IF_STATEMENT).orElseThrow();
        assertEquals("start", ifStmt.child(NodeKind.CONDITION).orElseThrow().text());
        assertTrue(ifStmt.child(NodeKind.THEN_BRANCH).isPresent());
        assertFalse(ifStmt.child(NodeKind.ELSE_BRANCH).isPresent());
    }

    @Test
    void expressionsCarryOperatorNodes() {
        SyntaxTree tree = parser.parse("""
                module m;
                  always @(*) begin
                    if (!rst_n && (mode == 2'b01)) y = a | ~b;
                  end
                endmodule
                """);
        assertFalse(tree.hasProblems(), () -> tree.problems.toString());

        SyntaxNode always = tree.modules().get(0).child(NodeKind.ALWAYS_CONSTRUCT).orElseThrow();
        assertTrue(always.child(NodeKind.EVENT_CONTROL).orElseThrow().child(NodeKind.EVENT_WILDCARD).isPresent());

        SyntaxNode cond = always.descendants(NodeKind.CONDITION).get(0).expressionChild().orElseThrow();
        assertEquals(NodeKind.BINARY_EXPRESSION, cond.kind());
        assertEquals("&&", cond.child(NodeKind.OPERATOR).orElseThrow().text());
        SyntaxNode lhs = cond.children().get(0);
        assertEquals(NodeKind.UNARY_EXPRESSION, lhs.kind());
        assertEquals("!", lhs.child(NodeKind.OPERATOR).orElseThrow().text());
        assertEquals(NodeKind.PAREN_EXPRESSION, cond.children().get(2).kind());
    }

    @Test
    void oneLineStatementsAndPackagesParse() {
        SyntaxTree tree = parser.parse("""
                package fsm_pkg;
                  typedef enum {A, B} ab_t;
                endpackage

                module top #(parameter int W = 4) (input clk);
                  import fsm_pkg::*;
                  localparam [1:0] S0 = 2'd0, S1 = 2'd1;
                  reg [1:0] cs, ns;
                  assign out = (cs == S1);
                  sub #(.W(W)) u_sub (.clk(clk), .q());
                  always @(posedge clk) cs <= ns;
                endmodule
                """);
        assertFalse(tree.hasProblems(), () -> tree.problems.toString());
        assertEquals(1, tree.root.children(NodeKind.PACKAGE).size());
        SyntaxNode top = tree.modules().get(0);
        assertEquals(1, top.children(NodeKind.PARAMETER_DECLARATION).size());
        assertEquals(2, top.descendants(NodeKind.PARAMETER_ASSIGNMENT).size());
        assertEquals(1, top.children(NodeKind.ALWAYS_CONSTRUCT).size());
    }

    @Test
    void syntaxErrorsAreCollectedNotThrown() {
        SyntaxTree tree = parser.parse("""
                module broken;
                  always_comb begin
                    if (a next = 1;
                  end
                endmodule
                """);
        assertTrue(tree.hasProblems());
        assertEquals(3, tree.problems.get(0).line);
    }

    @Test
    void nullSourceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(null));
    }
}
