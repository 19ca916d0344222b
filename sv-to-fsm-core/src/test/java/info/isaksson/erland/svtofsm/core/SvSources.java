package info.isaksson.erland.svtofsm.core;

/** SystemVerilog inputs for the service tests. */
final class SvSources {

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

    /** States come from localparams; nothing resets the register. */
    static final String NO_RESET = """
            module free_running (
                input  wire clk,
                input  wire go
            );
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
            """;

    /** STUCK is entered from RUN and never left. */
    static final String ORPHAN_EXIT = """
            module orphan (
                input  logic clk,
                input  logic rst_n,
                input  logic a,
                input  logic b
            );
                typedef enum logic [1:0] {IDLE, RUN, STUCK} state_t;
                state_t state, next_state;

                always_ff @(posedge clk or negedge rst_n) begin
                    if (!rst_n) state <= IDLE;
                    else        state <= next_state;
                end

                always_comb begin
                    next_state = state;
                    case (state)
                        IDLE: if (a) next_state = RUN;
                        RUN: begin
                            if (b) next_state = STUCK;
                            else   next_state = IDLE;
                        end
                    endcase
                end
            endmodule
            """;

    /** LOST has an exit but nothing leads to it. */
    static final String ORPHAN_ENTRY = """
            module lost (
                input  logic clk,
                input  logic rst_n,
                input  logic a
            );
                typedef enum logic [1:0] {IDLE, RUN, LOST} state_t;
                state_t state, next_state;

                always_ff @(posedge clk or negedge rst_n) begin
                    if (!rst_n) state <= IDLE;
                    else        state <= next_state;
                end

                always_comb begin
                    next_state = state;
                    case (state)
                        IDLE: if (a) next_state = RUN;
                        RUN:  next_state = IDLE;
                        LOST: next_state = IDLE;
                    endcase
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

    static final String PLAIN = """
            module plain (
                input  logic clk,
                input  logic a,
                output logic y
            );
                always_ff @(posedge clk) y <= a;
            endmodule
            """;

    private SvSources() {}
}
