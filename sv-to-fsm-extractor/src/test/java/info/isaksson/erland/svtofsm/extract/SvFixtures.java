package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.parser.AntlrSourceParser;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import info.isaksson.erland.svtofsm.syntax.SyntaxTree;

import static org.junit.jupiter.api.Assertions.assertFalse;

/** Shared SystemVerilog sources for the extraction tests. */
final class SvFixtures {

    static final String TWO_BLOCK = """
            module two_block (
                input  logic clk,
                input  logic rst_n,
                input  logic start,
                input  logic done,
                output logic busy
            );
                typedef enum logic [1:0] {IDLE, RUN, DONE} state_t;
                state_t state, next_state;

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
                            if (done) next_state = DONE;
                        end
                        DONE: next_state = IDLE;
                    endcase
                end
            endmodule
            """;

    static final String ONE_BLOCK = """
            module one_block (
                input logic clk,
                input logic reset,
                input logic start,
                input logic done
            );
                typedef enum {IDLE, RUN, DONE} state_t;
                state_t state;

                always @(posedge clk) begin
                    if (reset) state <= IDLE;
                    else begin
                        case (state)
                            IDLE: if (start) state <= RUN;
                            RUN:  if (done) state <= DONE;
                            DONE: state <= IDLE;
                        endcase
                    end
                end
            endmodule
            """;

    static final String DUAL = """
            module dual (
                input logic clk,
                input logic rst_n,
                input logic a,
                input logic b
            );
                typedef enum logic {IDLE, BUSY} ctrl_state_t;
                typedef enum logic [1:0] {RX_IDLE, RX_DATA, RX_STOP} rx_state_t;
                ctrl_state_t ctrl_state, ctrl_state_next;
                rx_state_t rx_state, rx_state_next;

                always_ff @(posedge clk or negedge rst_n) begin
                    if (!rst_n) begin
                        ctrl_state <= IDLE;
                        rx_state <= RX_IDLE;
                    end else begin
                        ctrl_state <= ctrl_state_next;
                        rx_state <= rx_state_next;
                    end
                end

                always_comb begin
                    ctrl_state_next = ctrl_state;
                    case (ctrl_state)
                        IDLE: if (a) ctrl_state_next = BUSY;
                        BUSY: ctrl_state_next = IDLE;
                    endcase
                end

                always_comb begin
                    rx_state_next = rx_state;
                    case (rx_state)
                        RX_IDLE: if (b) rx_state_next = RX_DATA;
                        RX_DATA: rx_state_next = RX_STOP;
                        RX_STOP: rx_state_next = RX_IDLE;
                    endcase
                end
            endmodule
            """;

    static final String INFERRED = """
            module legacy (
                input wire clk,
                input wire rst,
                input wire go
            );
                localparam IDLE = 2'b00, WORK = 2'b01, DONE = 2'b10;
                reg [1:0] state, next_state;

                always @(posedge clk) begin
                    if (rst) state <= IDLE;
                    else     state <= next_state;
                end

                always @(*) begin
                    next_state = state;
                    case (state)
                        IDLE: if (go) next_state = WORK;
                        WORK: next_state = DONE;
                        DONE: next_state = IDLE;
                    endcase
                end
            endmodule
            """;

    private static final AntlrSourceParser PARSER = new AntlrSourceParser();

    private SvFixtures() {}

    static SyntaxNode module(String source) {
        SyntaxTree tree = PARSER.parse(source);
        assertFalse(tree.hasProblems(), () -> tree.problems.toString());
        return tree.modules().get(0);
    }

    /** Wraps an {@code always_comb} body in a module with a typed {@code state}/{@code next_state} pair. */
    static SyntaxNode combModule(String enumMembers, String body) {
        return module("module m (input logic clk, input logic a, input logic b, input logic c);\n"
                + "    typedef enum {" + enumMembers + "} state_t;\n"
                + "    state_t state, next_state;\n"
                + "    always_ff @(posedge clk) state <= next_state;\n"
                + "    always_comb begin\n"
                + body
                + "    end\n"
                + "endmodule\n");
    }
}
