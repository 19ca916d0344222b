package info.isaksson.erland.svtofsm.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A node of the concrete syntax tree.
 *
 * <p>Nodes are built bottom-up: constructing a node adopts its children, so the parent link is
 * set exactly once. The text is the exact source span, including inner whitespace and comments.</p>
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final int line;
    private final String text;
    private final List<SyntaxNode> children;
    private SyntaxNode parent;

    public SyntaxNode(NodeKind kind, int line, String text, List<SyntaxNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.line = line;
        this.text = text == null ? "" : text;
        this.children = children == null ? List.of() : List.copyOf(children);
        for (SyntaxNode child : this.children) {
            if (child.parent != null) {
                throw new IllegalArgumentException("node already has a parent: " + child);
            }
            child.parent = this;
        }
    }

    /** Leaf node. */
    public SyntaxNode(NodeKind kind, int line, String text) {
        this(kind, line, text, List.of());
    }

    public NodeKind kind() {
        return kind;
    }

    /** 1-indexed source line of the first token. */
    public int line() {
        return line;
    }

    public String text() {
        return text;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    /** Parent node, or {@code null} for the root. */
    public SyntaxNode parent() {
        return parent;
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    public Optional<SyntaxNode> child(NodeKind k) {
        for (SyntaxNode c : children) {
            if (c.kind == k) return Optional.of(c);
        }
        return Optional.empty();
    }

    public List<SyntaxNode> children(NodeKind k) {
        List<SyntaxNode> out = new ArrayList<>();
        for (SyntaxNode c : children) {
            if (c.kind == k) out.add(c);
        }
        return out;
    }

    /** First child whose kind is an expression kind. */
    public Optional<SyntaxNode> expressionChild() {
        for (SyntaxNode c : children) {
            if (c.kind.isExpression()) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Nearest ancestor of the given kind. */
    public Optional<SyntaxNode> ancestor(NodeKind k) {
        SyntaxNode p = parent;
        while (p != null) {
            if (p.kind == k) return Optional.of(p);
            p = p.parent;
        }
        return Optional.empty();
    }

    /** All descendants (excluding this node) of the given kind, in document order. */
    public List<SyntaxNode> descendants(NodeKind k) {
        List<SyntaxNode> out = new ArrayList<>();
        for (SyntaxNode c : children) {
            c.walk(n -> {
                if (n.kind == k) out.add(n);
                return true;
            });
        }
        return out;
    }

    /**
     * Pre-order walk. The visitor returns {@code false} to skip the children of the node it was
     * given.
     */
    public void walk(Predicate<SyntaxNode> visitor) {
        if (!visitor.test(this)) return;
        for (SyntaxNode c : children) {
            c.walk(visitor);
        }
    }

    @Override
    public String toString() {
        String t = text.length() > 40 ? text.substring(0, 40) + "..." : text;
        return kind + "@" + line + "[" + t.replace('\n', ' ') + "]";
    }
}
