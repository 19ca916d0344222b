package info.isaksson.erland.svtofsm.syntax;

/**
 * Turns source text into a {@link SyntaxTree}.
 *
 * <p>Implementations report syntax errors through {@link SyntaxTree#problems} and return whatever
 * tree could be recovered. They must be safe to call repeatedly from one thread.</p>
 */
public interface SourceParser {

    SyntaxTree parse(String source);
}
