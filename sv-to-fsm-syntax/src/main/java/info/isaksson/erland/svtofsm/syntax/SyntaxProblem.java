package info.isaksson.erland.svtofsm.syntax;

import java.util.Objects;

/** A syntax error reported by the parser. Parsing continues past it. */
public final class SyntaxProblem {
    public final int line;
    public final int column;
    public final String message;

    public SyntaxProblem(int line, int column, String message) {
        this.line = line;
        this.column = column;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return "line " + line + ":" + column + " " + message;
    }
}
