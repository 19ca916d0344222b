package info.isaksson.erland.svtofsm.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FsmExtractionExceptionTest {

    @Test
    void messageCombinesDescriptionAndDetail() {
        FsmExtractionException e = new FsmExtractionException(ErrorCode.INVALID_INPUT, "source is empty", (Integer) null);
        assertEquals("Invalid input: source is empty", e.getMessage());
        assertEquals(ErrorCode.INVALID_INPUT, e.getCode());
        assertNull(e.getHint());
        assertFalse(e.isRecoverable());
    }

    @Test
    void formatIncludesLineAndHint() {
        FsmExtractionException e = new FsmExtractionException(ErrorCode.UNSUPPORTED_PATTERN, "casex label", 7);
        assertEquals("Unsupported FSM pattern: casex label (line 7)\n"
                + "  This tool supports common FSM patterns but not all.\n"
                + "See documentation for supported patterns.", e.format());
        assertTrue(e.isRecoverable());
    }

    @Test
    void bareCodeUsesDefaultMessage() {
        FsmExtractionException e = new FsmExtractionException(ErrorCode.NO_MODULE);
        assertEquals("No module declaration found in input", e.getMessage());
        assertEquals("No module declaration found in input\n  Make sure your input contains a valid SystemVerilog module.",
                e.format());
    }

    @Test
    void diagnosticRoundTripsThroughException() {
        FsmDiagnostic d = FsmDiagnostic.of(ErrorCode.NO_TRANSITIONS, null, 4);
        FsmExtractionException e = new FsmExtractionException(d);
        assertEquals(d, e.toDiagnostic());
        assertEquals(Integer.valueOf(4), e.getLine());
    }

    @Test
    void onlyTransitionAndPatternCodesAreRecoverable() {
        for (ErrorCode code : ErrorCode.values()) {
            boolean expected = code == ErrorCode.NO_TRANSITIONS || code == ErrorCode.UNSUPPORTED_PATTERN;
            assertEquals(expected, code.isRecoverable(), code.name());
        }
    }
}
