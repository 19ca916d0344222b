package info.isaksson.erland.svtofsm.syntax;

import java.util.List;
import java.util.Objects;

/** Result of parsing one source text: the root node plus every syntax problem encountered. */
public final class SyntaxTree {
    public final SyntaxNode root;
    public final List<SyntaxProblem> problems;

    public SyntaxTree(SyntaxNode root, List<SyntaxProblem> problems) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }

    public List<SyntaxNode> modules() {
        return root.descendants(NodeKind.MODULE);
    }
}
