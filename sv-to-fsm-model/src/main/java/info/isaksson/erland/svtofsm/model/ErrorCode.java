package info.isaksson.erland.svtofsm.model;

/**
 * Extraction failure codes with their default message and remediation hint.
 *
 * <p>Recoverable codes are reported as diagnostics next to partial results; the others abort
 * the extraction of the module.</p>
 */
public enum ErrorCode {
    PARSE_ERROR("Parse error", null, false),
    NO_MODULE("No module declaration found in input",
            "Make sure your input contains a valid SystemVerilog module.", false),
    NO_FSM("No FSM detected in the module",
            "Could not find a typedef enum with state definitions or a case statement on a state variable.\n"
                    + "Supported patterns:\n"
                    + "  - typedef enum { STATE1, STATE2, ... } state_t;\n"
                    + "  - case (state) STATE1: ... STATE2: ... endcase", false),
    NO_STATES("No states found in the FSM",
            "Could not find any state definitions. Make sure you have:\n"
                    + "  - A typedef enum with state names, or\n"
                    + "  - Case labels that look like state names (e.g., IDLE, RUN, DONE)", false),
    NO_TRANSITIONS("No transitions found in the FSM",
            "Could not find any state transitions. Make sure you have:\n"
                    + "  - Assignments to next_state or state variable\n"
                    + "  - A case statement switching on the state variable", true),
    INVALID_INPUT("Invalid input", null, false),
    PARSER_INIT("Failed to initialize parser",
            "Make sure the ANTLR runtime on the classpath matches the version the parser was generated with.", false),
    UNSUPPORTED_PATTERN("Unsupported FSM pattern",
            "This tool supports common FSM patterns but not all.\n"
                    + "See documentation for supported patterns.", true);

    private final String description;
    private final String hint;
    private final boolean recoverable;

    ErrorCode(String description, String hint, boolean recoverable) {
        this.description = description;
        this.hint = hint;
        this.recoverable = recoverable;
    }

    public String getDescription() {
        return description;
    }

    /** Default remediation hint, or null. */
    public String getHint() {
        return hint;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    /** {@code "<description>: <detail>"}, or the bare description when there is no detail. */
    public String message(String detail) {
        if (detail == null || detail.isBlank()) return description;
        return description + ": " + detail;
    }
}
