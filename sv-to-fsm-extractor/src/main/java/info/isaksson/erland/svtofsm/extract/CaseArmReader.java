package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the case statement that switches on a state register into {@link CaseArm}s.
 */
public final class CaseArmReader {

    private static final Pattern WILDCARD_DIGITS = Pattern.compile("'[sS]?[bBoOdDhH].*[?xXzZ]");

    private CaseArmReader() {}

    /** First case statement under {@code scope} whose subject is one of the given variables. */
    public static Optional<SyntaxNode> findStateCase(SyntaxNode scope, Set<String> subjects) {
        if (scope == null || subjects == null) return Optional.empty();
        for (SyntaxNode c : scope.descendants(NodeKind.CASE_STATEMENT)) {
            String subject = subjectName(c);
            if (subject != null && subjects.contains(subject)) return Optional.of(c);
        }
        return Optional.empty();
    }

    static String subjectName(SyntaxNode caseNode) {
        return caseNode.child(NodeKind.CASE_SUBJECT)
                .flatMap(SyntaxNode::expressionChild)
                .map(SvNodes::valueName)
                .orElse(null);
    }

    /** {@code case}, {@code casez} or {@code casex}. */
    static String keyword(SyntaxNode caseNode) {
        return caseNode.child(NodeKind.CASE_KEYWORD).map(k -> k.text().trim()).orElse("case");
    }

    /** Names of all labels that are plain identifiers, in order, without duplicates. */
    public static List<String> labelNames(SyntaxNode caseNode) {
        Set<String> out = new LinkedHashSet<>();
        for (SyntaxNode item : caseNode.children(NodeKind.CASE_ITEM)) {
            for (SyntaxNode label : item.children(NodeKind.CASE_LABEL)) {
                String name = label.expressionChild().map(SvNodes::valueName).orElse(null);
                if (name != null) out.add(name);
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * One arm per label that names a state, plus a label-less arm for {@code default}. Wildcard
     * labels of {@code casez}/{@code casex} statements are collected, not resolved.
     */
    public static StateCase read(SyntaxNode caseNode, Collection<String> stateNames) {
        if (caseNode == null) throw new IllegalArgumentException("caseNode is null");
        Set<String> states = stateNames == null ? Set.of() : Set.copyOf(stateNames);
        boolean wildcardCase = !keyword(caseNode).equals("case");

        List<CaseArm> arms = new ArrayList<>();
        List<SyntaxNode> wildcards = new ArrayList<>();
        for (SyntaxNode item : caseNode.children()) {
            if (item.is(NodeKind.DEFAULT_CASE_ITEM)) {
                arms.add(new CaseArm(null, item.line(), readBody(SvNodes.statementOf(item))));
                continue;
            }
            if (!item.is(NodeKind.CASE_ITEM)) continue;

            List<ArmStatement> body = null;
            for (SyntaxNode label : item.children(NodeKind.CASE_LABEL)) {
                SyntaxNode expr = label.expressionChild().orElse(null);
                String name = expr == null ? null : SvNodes.valueName(expr);
                if (name != null && states.contains(name)) {
                    if (body == null) body = readBody(SvNodes.statementOf(item));
                    arms.add(new CaseArm(name, item.line(), body));
                } else if (wildcardCase && expr != null && isWildcardLiteral(expr)) {
                    wildcards.add(label);
                }
            }
        }
        return new StateCase(caseNode, arms, wildcards);
    }

    private static boolean isWildcardLiteral(SyntaxNode expr) {
        return expr.is(NodeKind.NUMBER) && WILDCARD_DIGITS.matcher(expr.text()).find();
    }

    /** Statements of an arm body, with begin/end blocks flattened and nested cases read as if-chains. */
    static List<ArmStatement> readBody(SyntaxNode statement) {
        List<ArmStatement> out = new ArrayList<>();
        if (statement == null) return out;
        for (SyntaxNode s : SvNodes.statements(statement)) {
            switch (s.kind()) {
                case SEQ_BLOCK:
                    out.addAll(readBody(s));
                    break;
                case BLOCKING_ASSIGNMENT:
                case NONBLOCKING_ASSIGNMENT:
                    out.add(toAssignment(s));
                    break;
                case IF_STATEMENT:
                    out.add(toConditional(s));
                    break;
                case CASE_STATEMENT:
                    out.addAll(caseAsChain(s));
                    break;
                default:
                    break;
            }
        }
        return out;
    }

    private static Assignment toAssignment(SyntaxNode s) {
        SyntaxNode value = SvNodes.assignedValue(s).orElse(null);
        return new Assignment(
                SvNodes.assignmentTarget(s),
                SvNodes.targetText(s),
                value == null ? "" : SvNodes.normalize(value.text()),
                value,
                s.is(NodeKind.BLOCKING_ASSIGNMENT),
                SvNodes.hasSelectedTarget(s),
                s.line());
    }

    private static ConditionalBlock toConditional(SyntaxNode ifNode) {
        SyntaxNode condition = ifNode.child(NodeKind.CONDITION).flatMap(SyntaxNode::expressionChild).orElse(null);
        String text = condition == null
                ? ifNode.child(NodeKind.CONDITION).map(c -> SvNodes.normalize(c.text())).orElse("")
                : SvNodes.normalize(condition.text());
        List<SyntaxNode> nodes = condition == null ? List.of() : List.of(condition);

        List<ArmStatement> then = readBody(ifNode.child(NodeKind.THEN_BRANCH).map(SvNodes::statementOf).orElse(null));

        SyntaxNode elseBranch = ifNode.child(NodeKind.ELSE_BRANCH).orElse(null);
        if (elseBranch == null) return new ConditionalBlock(text, nodes, then, null, null, ifNode.line());
        SyntaxNode elseStatement = SvNodes.statementOf(elseBranch);
        if (elseStatement != null && elseStatement.is(NodeKind.IF_STATEMENT)) {
            return new ConditionalBlock(text, nodes, then, null, toConditional(elseStatement), ifNode.line());
        }
        return new ConditionalBlock(text, nodes, then, readBody(elseStatement), null, ifNode.line());
    }

    /**
     * {@code case (cmd) A: x; B, C: y; default: z; endcase} reads as
     * {@code if (cmd == A) x; else if (cmd == B || cmd == C) y; else z;}.
     */
    private static List<ArmStatement> caseAsChain(SyntaxNode caseNode) {
        SyntaxNode subject = caseNode.child(NodeKind.CASE_SUBJECT).flatMap(SyntaxNode::expressionChild).orElse(null);
        String subjectText = subject == null ? "" : SvNodes.normalize(subject.text());
        boolean reverseCase = subject != null && isLiteralOne(subject);

        List<SyntaxNode> items = caseNode.children(NodeKind.CASE_ITEM);
        SyntaxNode dflt = caseNode.child(NodeKind.DEFAULT_CASE_ITEM).orElse(null);
        List<ArmStatement> defaultBody = dflt == null ? null : readBody(SvNodes.statementOf(dflt));

        ConditionalBlock chain = null;
        for (int i = items.size() - 1; i >= 0; i--) {
            SyntaxNode item = items.get(i);
            List<String> alternatives = new ArrayList<>();
            List<SyntaxNode> nodes = new ArrayList<>();
            if (subject != null && !reverseCase) nodes.add(subject);
            for (SyntaxNode label : item.children(NodeKind.CASE_LABEL)) {
                String labelText = SvNodes.normalize(label.text());
                alternatives.add(reverseCase ? labelText : subjectText + " == " + labelText);
                label.expressionChild().ifPresent(nodes::add);
            }
            if (alternatives.isEmpty()) continue;
            String condition = alternatives.size() == 1
                    ? alternatives.get(0)
                    : "(" + String.join(") || (", alternatives) + ")";
            List<ArmStatement> then = readBody(SvNodes.statementOf(item));
            chain = chain == null
                    ? new ConditionalBlock(condition, nodes, then, defaultBody, null, item.line())
                    : new ConditionalBlock(condition, nodes, then, null, chain, item.line());
        }

        if (chain != null) return List.of(chain);
        return defaultBody == null ? List.of() : defaultBody;
    }

    private static boolean isLiteralOne(SyntaxNode expr) {
        if (!expr.is(NodeKind.NUMBER)) return false;
        OptionalLong v = EnumerationDetector.parseLiteral(expr.text());
        return v.isPresent() && v.getAsLong() == 1;
    }

    /**
     * True when {@code next = state} (or {@code <=}) appears before the case statement in one of
     * the begin/end blocks enclosing it.
     */
    public static boolean hasDefaultAssignment(SyntaxNode caseNode, String nextVar, String stateVar) {
        if (caseNode == null || nextVar == null || stateVar == null) return false;
        SyntaxNode node = caseNode;
        SyntaxNode parent = node.parent();
        while (parent != null && !parent.is(NodeKind.ALWAYS_CONSTRUCT)) {
            if (parent.is(NodeKind.SEQ_BLOCK)) {
                for (SyntaxNode s : parent.children()) {
                    if (s == node) break;
                    if (s.kind().isAssignment()
                            && nextVar.equals(SvNodes.assignmentTarget(s))
                            && !SvNodes.hasSelectedTarget(s)
                            && stateVar.equals(SvNodes.assignedValue(s).map(SvNodes::valueName).orElse(null))) {
                        return true;
                    }
                }
            }
            node = parent;
            parent = node.parent();
        }
        return false;
    }

    /** The arms of one state case statement. */
    public static final class StateCase {
        public final SyntaxNode node;
        public final List<CaseArm> arms;

        /** {@code casez}/{@code casex} labels with wildcard digits; these name no state. */
        public final List<SyntaxNode> wildcardLabels;

        StateCase(SyntaxNode node, List<CaseArm> arms, List<SyntaxNode> wildcardLabels) {
            this.node = node;
            this.arms = List.copyOf(arms);
            this.wildcardLabels = List.copyOf(wildcardLabels);
        }

        public int line() {
            return node.line();
        }
    }
}
