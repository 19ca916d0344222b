package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Small helpers for reading names and values out of syntax nodes.
 */
final class SvNodes {

    private SvNodes() {}

    /** Collapses whitespace runs (including newlines) to single spaces. */
    static String normalize(String text) {
        if (text == null) return "";
        return text.replaceAll("\\s+", " ").trim();
    }

    /** First identifier directly under the node, e.g. the name of a declarator or enum member. */
    static String firstIdentifier(SyntaxNode node) {
        if (node == null) return null;
        return node.child(NodeKind.IDENTIFIER).map(n -> n.text().trim()).orElse(null);
    }

    /**
     * Name of a plain reference: {@code pkg::IDLE} yields {@code IDLE}, {@code a.b} yields
     * {@code a.b}. Returns null for anything with a bit or part select.
     */
    static String referenceName(SyntaxNode ref) {
        if (ref == null || !ref.is(NodeKind.REFERENCE)) return null;
        if (!ref.children(NodeKind.SELECT).isEmpty()) return null;
        return identifierPath(ref);
    }

    private static String identifierPath(SyntaxNode node) {
        List<SyntaxNode> ids = node.children(NodeKind.IDENTIFIER);
        if (ids.isEmpty()) return null;
        if (node.text().contains("::")) return ids.get(ids.size() - 1).text().trim();
        StringBuilder sb = new StringBuilder();
        for (SyntaxNode id : ids) {
            if (sb.length() > 0) sb.append('.');
            sb.append(id.text().trim());
        }
        return sb.toString();
    }

    /** Strips parentheses and casts around an expression: {@code state_t'(IDLE)} yields the IDLE reference. */
    static SyntaxNode unwrap(SyntaxNode expr) {
        SyntaxNode e = expr;
        while (e != null && (e.is(NodeKind.PAREN_EXPRESSION) || e.is(NodeKind.CAST_EXPRESSION))) {
            e = e.expressionChild().orElse(null);
        }
        return e;
    }

    /** Reference name of an expression after unwrapping parentheses and casts, or null. */
    static String valueName(SyntaxNode expr) {
        return referenceName(unwrap(expr));
    }

    /** Variable an assignment writes, or null for concatenation targets. */
    static String assignmentTarget(SyntaxNode assignment) {
        SyntaxNode lvalue = assignment.child(NodeKind.LVALUE).orElse(null);
        if (lvalue == null || !lvalue.children(NodeKind.LVALUE).isEmpty()) return null;
        return identifierPath(lvalue);
    }

    /** True when the assignment target carries a bit or part select. */
    static boolean hasSelectedTarget(SyntaxNode assignment) {
        return assignment.child(NodeKind.LVALUE)
                .map(lv -> !lv.children(NodeKind.SELECT).isEmpty())
                .orElse(false);
    }

    /** Printable form of an assignment target, selects included. */
    static String targetText(SyntaxNode assignment) {
        return assignment.child(NodeKind.LVALUE).map(lv -> normalize(lv.text())).orElse("");
    }

    /** Right-hand side expression of an assignment. */
    static Optional<SyntaxNode> assignedValue(SyntaxNode assignment) {
        SyntaxNode last = null;
        for (SyntaxNode c : assignment.children()) {
            if (c.kind().isExpression()) last = c;
        }
        return Optional.ofNullable(last);
    }

    /** Statement nodes of a body: a begin/end block is flattened one level, anything else is a single statement. */
    static List<SyntaxNode> statements(SyntaxNode body) {
        List<SyntaxNode> out = new ArrayList<>();
        if (body == null) return out;
        if (!body.is(NodeKind.SEQ_BLOCK)) {
            if (isStatement(body)) out.add(body);
            return out;
        }
        for (SyntaxNode c : body.children()) {
            if (isStatement(c)) out.add(c);
        }
        return out;
    }

    /** The single statement inside a branch or case item, or null for an empty statement. */
    static SyntaxNode statementOf(SyntaxNode holder) {
        if (holder == null) return null;
        for (SyntaxNode c : holder.children()) {
            if (isStatement(c)) return c;
        }
        return null;
    }

    static boolean isStatement(SyntaxNode n) {
        switch (n.kind()) {
            case SEQ_BLOCK:
            case IF_STATEMENT:
            case CASE_STATEMENT:
            case BLOCKING_ASSIGNMENT:
            case NONBLOCKING_ASSIGNMENT:
            case LOOP_STATEMENT:
            case CALL_STATEMENT:
            case OTHER_STATEMENT:
            case EVENT_CONTROL:
            case DELAY:
                return true;
            default:
                return false;
        }
    }

    /** Names of all plain references inside an expression, in order of first appearance. */
    static Set<String> referencedNames(SyntaxNode expr) {
        Set<String> out = new LinkedHashSet<>();
        if (expr == null) return out;
        expr.walk(n -> {
            if (n.is(NodeKind.REFERENCE)) {
                String name = identifierPath(n);
                if (name != null) out.add(name);
            }
            return true;
        });
        return out;
    }

    /** The operator token of a unary or binary expression. */
    static String operator(SyntaxNode expr) {
        return expr.child(NodeKind.OPERATOR).map(SyntaxNode::text).orElse("");
    }

    /** Expression operands of a unary or binary expression, in source order. */
    static List<SyntaxNode> operands(SyntaxNode expr) {
        List<SyntaxNode> out = new ArrayList<>();
        for (SyntaxNode c : expr.children()) {
            if (c.kind().isExpression()) out.add(c);
        }
        return out;
    }
}
