package info.isaksson.erland.svtofsm.parser;

import info.isaksson.erland.svtofsm.syntax.SyntaxProblem;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/** Collects lexer and parser errors instead of printing them. */
final class CollectingErrorListener extends BaseErrorListener {

    private final List<SyntaxProblem> problems = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        problems.add(new SyntaxProblem(line, charPositionInLine, msg));
    }

    List<SyntaxProblem> problems() {
        return List.copyOf(problems);
    }
}
