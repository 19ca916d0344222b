package info.isaksson.erland.svtofsm.model;

/**
 * Single checked exception for extraction failures; the {@link ErrorCode} tells them apart.
 */
public final class FsmExtractionException extends Exception {
    private static final long serialVersionUID = 1L;

    private final ErrorCode code;
    private final Integer line;
    private final String hint;

    public FsmExtractionException(ErrorCode code) {
        this(code, null, (Integer) null);
    }

    /** Message is the code's description plus {@code detail}; hint is the code's default. */
    public FsmExtractionException(ErrorCode code, String detail, Integer line) {
        super(code.message(detail));
        this.code = code;
        this.line = line;
        this.hint = code.getHint();
    }

    public FsmExtractionException(ErrorCode code, String detail, Throwable cause) {
        super(code.message(detail), cause);
        this.code = code;
        this.line = null;
        this.hint = code.getHint();
    }

    public FsmExtractionException(FsmDiagnostic diagnostic) {
        super(diagnostic.message);
        this.code = diagnostic.code;
        this.line = diagnostic.line;
        this.hint = diagnostic.hint;
    }

    public ErrorCode getCode() {
        return code;
    }

    /** 1-indexed source line, or null. */
    public Integer getLine() {
        return line;
    }

    public String getHint() {
        return hint;
    }

    public boolean isRecoverable() {
        return code.isRecoverable();
    }

    public FsmDiagnostic toDiagnostic() {
        return new FsmDiagnostic(code, getMessage(), line, hint);
    }

    /** Display form: {@code message (line N)} and the indented hint. */
    public String format() {
        return toDiagnostic().format();
    }
}
