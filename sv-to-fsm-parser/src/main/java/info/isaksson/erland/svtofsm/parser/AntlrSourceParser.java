package info.isaksson.erland.svtofsm.parser;

import info.isaksson.erland.svtofsm.syntax.SourceParser;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import info.isaksson.erland.svtofsm.syntax.SyntaxTree;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link SourceParser} backed by the ANTLR-generated SystemVerilog subset parser.
 *
 * <p>Instances are stateless; each call builds its own lexer and parser.</p>
 */
public final class AntlrSourceParser implements SourceParser {

    private static final Logger logger = LogManager.getLogger(AntlrSourceParser.class);

    @Override
    public SyntaxTree parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");

        CharStream input = CharStreams.fromString(source);
        CollectingErrorListener errors = new CollectingErrorListener();

        SystemVerilogFsmLexer lexer = new SystemVerilogFsmLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        SystemVerilogFsmParser parser = new SystemVerilogFsmParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        SystemVerilogFsmParser.SourceTextContext ctx = parser.sourceText();
        SyntaxNode root = new SyntaxTreeBuilder(input).build(ctx);

        SyntaxTree tree = new SyntaxTree(root, errors.problems());
        if (tree.hasProblems()) {
            logger.debug("Parsed {} characters with {} syntax problem(s); first: {}",
                    source.length(), tree.problems.size(), tree.problems.get(0));
        } else {
            logger.debug("Parsed {} characters, {} module(s)", source.length(), tree.modules().size());
        }
        return tree;
    }
}
