package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A reported extraction problem: code, message, optional line and remediation hint. */
@JsonPropertyOrder({"code", "message", "line", "hint"})
public final class FsmDiagnostic {
    public final ErrorCode code;
    public final String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final Integer line;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String hint;

    @JsonCreator
    public FsmDiagnostic(
            @JsonProperty("code") ErrorCode code,
            @JsonProperty("message") String message,
            @JsonProperty("line") Integer line,
            @JsonProperty("hint") String hint
    ) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = message == null ? code.getDescription() : message;
        this.line = line;
        this.hint = hint;
    }

    /** Diagnostic with the code's default hint. */
    public static FsmDiagnostic of(ErrorCode code, String detail, Integer line) {
        return new FsmDiagnostic(code, code.message(detail), line, code.getHint());
    }

    /** {@code message (line N)} followed by the indented hint when present. */
    public String format() {
        StringBuilder sb = new StringBuilder(message);
        if (line != null && line > 0) sb.append(" (line ").append(line).append(')');
        if (hint != null && !hint.isEmpty()) sb.append("\n  ").append(hint);
        return sb.toString();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FsmDiagnostic)) return false;
        FsmDiagnostic that = (FsmDiagnostic) o;
        return code == that.code && message.equals(that.message)
                && Objects.equals(line, that.line) && Objects.equals(hint, that.hint);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, line, hint);
    }

    @Override public String toString() {
        return code + ": " + format();
    }
}
