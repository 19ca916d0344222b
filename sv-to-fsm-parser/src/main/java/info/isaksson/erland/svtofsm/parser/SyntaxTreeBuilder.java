package info.isaksson.erland.svtofsm.parser;

import info.isaksson.erland.svtofsm.parser.SystemVerilogFsmParser.BinaryExpressionContext;
import info.isaksson.erland.svtofsm.parser.SystemVerilogFsmParser.InsideExpressionContext;
import info.isaksson.erland.svtofsm.parser.SystemVerilogFsmParser.UnaryExpressionContext;
import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers an ANTLR parse tree into {@link SyntaxNode}s.
 *
 * <p>Contexts with a mapped kind become nodes; all other contexts are flattened into their
 * parent. Terminals are dropped except for the operator token of unary and binary expressions.</p>
 */
final class SyntaxTreeBuilder {

    private static final Map<Class<? extends ParserRuleContext>, NodeKind> KINDS = new HashMap<>();

    static {
        KINDS.put(SystemVerilogFsmParser.SourceTextContext.class, NodeKind.SOURCE);
        KINDS.put(SystemVerilogFsmParser.ModuleDeclarationContext.class, NodeKind.MODULE);
        KINDS.put(SystemVerilogFsmParser.PackageDeclarationContext.class, NodeKind.PACKAGE);
        KINDS.put(SystemVerilogFsmParser.DeclaredNameContext.class, NodeKind.NAME);

        KINDS.put(SystemVerilogFsmParser.TypeDeclarationContext.class, NodeKind.TYPE_DECLARATION);
        KINDS.put(SystemVerilogFsmParser.DataTypeContext.class, NodeKind.DATA_TYPE);
        KINDS.put(SystemVerilogFsmParser.TypeReferenceContext.class, NodeKind.TYPE_REFERENCE);
        KINDS.put(SystemVerilogFsmParser.EnumTypeContext.class, NodeKind.ENUM_TYPE);
        KINDS.put(SystemVerilogFsmParser.EnumMemberContext.class, NodeKind.ENUM_MEMBER);
        KINDS.put(SystemVerilogFsmParser.PackedDimensionContext.class, NodeKind.PACKED_DIMENSION);
        KINDS.put(SystemVerilogFsmParser.DataDeclarationContext.class, NodeKind.DATA_DECLARATION);
        KINDS.put(SystemVerilogFsmParser.BlockDeclarationContext.class, NodeKind.DATA_DECLARATION);
        KINDS.put(SystemVerilogFsmParser.AnsiPortDeclarationContext.class, NodeKind.DATA_DECLARATION);
        KINDS.put(SystemVerilogFsmParser.VariableDeclaratorContext.class, NodeKind.VARIABLE_DECLARATOR);
        KINDS.put(SystemVerilogFsmParser.ParameterDeclarationContext.class, NodeKind.PARAMETER_DECLARATION);
        KINDS.put(SystemVerilogFsmParser.ParamAssignmentContext.class, NodeKind.PARAMETER_ASSIGNMENT);

        KINDS.put(SystemVerilogFsmParser.AlwaysConstructContext.class, NodeKind.ALWAYS_CONSTRUCT);
        KINDS.put(SystemVerilogFsmParser.AlwaysKeywordContext.class, NodeKind.ALWAYS_KEYWORD);
        KINDS.put(SystemVerilogFsmParser.InitialConstructContext.class, NodeKind.INITIAL_CONSTRUCT);
        KINDS.put(SystemVerilogFsmParser.EventControlContext.class, NodeKind.EVENT_CONTROL);
        KINDS.put(SystemVerilogFsmParser.EventTermContext.class, NodeKind.EVENT_TERM);
        KINDS.put(SystemVerilogFsmParser.NamedEventContext.class, NodeKind.EVENT_TERM);
        KINDS.put(SystemVerilogFsmParser.EdgeKeywordContext.class, NodeKind.EDGE);
        KINDS.put(SystemVerilogFsmParser.EventWildcardContext.class, NodeKind.EVENT_WILDCARD);
        KINDS.put(SystemVerilogFsmParser.DelayControlContext.class, NodeKind.DELAY);

        KINDS.put(SystemVerilogFsmParser.SeqBlockContext.class, NodeKind.SEQ_BLOCK);
        KINDS.put(SystemVerilogFsmParser.ConditionalStatementContext.class, NodeKind.IF_STATEMENT);
        KINDS.put(SystemVerilogFsmParser.ConditionContext.class, NodeKind.CONDITION);
        KINDS.put(SystemVerilogFsmParser.ThenBranchContext.class, NodeKind.THEN_BRANCH);
        KINDS.put(SystemVerilogFsmParser.ElseBranchContext.class, NodeKind.ELSE_BRANCH);
        KINDS.put(SystemVerilogFsmParser.CaseStatementContext.class, NodeKind.CASE_STATEMENT);
        KINDS.put(SystemVerilogFsmParser.CaseKeywordContext.class, NodeKind.CASE_KEYWORD);
        KINDS.put(SystemVerilogFsmParser.CaseSubjectContext.class, NodeKind.CASE_SUBJECT);
        KINDS.put(SystemVerilogFsmParser.LabeledCaseItemContext.class, NodeKind.CASE_ITEM);
        KINDS.put(SystemVerilogFsmParser.DefaultCaseItemContext.class, NodeKind.DEFAULT_CASE_ITEM);
        KINDS.put(SystemVerilogFsmParser.CaseLabelContext.class, NodeKind.CASE_LABEL);
        KINDS.put(SystemVerilogFsmParser.BlockingAssignmentContext.class, NodeKind.BLOCKING_ASSIGNMENT);
        KINDS.put(SystemVerilogFsmParser.NonblockingAssignmentContext.class, NodeKind.NONBLOCKING_ASSIGNMENT);
        KINDS.put(SystemVerilogFsmParser.VariableLvalueContext.class, NodeKind.LVALUE);
        KINDS.put(SystemVerilogFsmParser.LoopStatementContext.class, NodeKind.LOOP_STATEMENT);
        KINDS.put(SystemVerilogFsmParser.CallStatementContext.class, NodeKind.CALL_STATEMENT);
        KINDS.put(SystemVerilogFsmParser.JumpStatementContext.class, NodeKind.OTHER_STATEMENT);
        KINDS.put(SystemVerilogFsmParser.IncOrDecStatementContext.class, NodeKind.OTHER_STATEMENT);

        KINDS.put(UnaryExpressionContext.class, NodeKind.UNARY_EXPRESSION);
        KINDS.put(BinaryExpressionContext.class, NodeKind.BINARY_EXPRESSION);
        KINDS.put(InsideExpressionContext.class, NodeKind.BINARY_EXPRESSION);
        KINDS.put(SystemVerilogFsmParser.ConditionalExpressionContext.class, NodeKind.CONDITIONAL_EXPRESSION);
        KINDS.put(SystemVerilogFsmParser.ParenPrimaryContext.class, NodeKind.PAREN_EXPRESSION);
        KINDS.put(SystemVerilogFsmParser.ConcatenationPrimaryContext.class, NodeKind.CONCATENATION);
        KINDS.put(SystemVerilogFsmParser.ReplicationPrimaryContext.class, NodeKind.CONCATENATION);
        KINDS.put(SystemVerilogFsmParser.PatternPrimaryContext.class, NodeKind.CONCATENATION);
        KINDS.put(SystemVerilogFsmParser.CallPrimaryContext.class, NodeKind.CALL_EXPRESSION);
        KINDS.put(SystemVerilogFsmParser.SystemCallPrimaryContext.class, NodeKind.CALL_EXPRESSION);
        KINDS.put(SystemVerilogFsmParser.CastPrimaryContext.class, NodeKind.CAST_EXPRESSION);
        KINDS.put(SystemVerilogFsmParser.ReferencePrimaryContext.class, NodeKind.REFERENCE);
        KINDS.put(SystemVerilogFsmParser.NumberPrimaryContext.class, NodeKind.NUMBER);
        KINDS.put(SystemVerilogFsmParser.StringPrimaryContext.class, NodeKind.STRING);
        KINDS.put(SystemVerilogFsmParser.SelectContext.class, NodeKind.SELECT);
        KINDS.put(SystemVerilogFsmParser.IdentifierContext.class, NodeKind.IDENTIFIER);
    }

    private final CharStream input;

    SyntaxTreeBuilder(CharStream input) {
        this.input = input;
    }

    SyntaxNode build(SystemVerilogFsmParser.SourceTextContext root) {
        List<SyntaxNode> nodes = convert(root);
        if (nodes.size() == 1 && nodes.get(0).is(NodeKind.SOURCE)) {
            return nodes.get(0);
        }
        return new SyntaxNode(NodeKind.SOURCE, 1, textOf(root), nodes);
    }

    private List<SyntaxNode> convert(ParseTree tree) {
        if (tree instanceof ErrorNode) return List.of();
        if (tree instanceof TerminalNode) {
            Token op = operatorToken(tree.getParent());
            Token symbol = ((TerminalNode) tree).getSymbol();
            if (op != null && op == symbol) {
                return List.of(new SyntaxNode(NodeKind.OPERATOR, symbol.getLine(), symbol.getText()));
            }
            return List.of();
        }

        ParserRuleContext ctx = (ParserRuleContext) tree;
        List<SyntaxNode> children = new ArrayList<>();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            children.addAll(convert(ctx.getChild(i)));
        }

        NodeKind kind = KINDS.get(ctx.getClass());
        if (kind == null) return children;
        return List.of(new SyntaxNode(kind, ctx.getStart().getLine(), textOf(ctx), children));
    }

    private static Token operatorToken(ParseTree parent) {
        if (parent instanceof BinaryExpressionContext) return ((BinaryExpressionContext) parent).op;
        if (parent instanceof UnaryExpressionContext) return ((UnaryExpressionContext) parent).op;
        if (parent instanceof InsideExpressionContext) return ((InsideExpressionContext) parent).op;
        return null;
    }

    private String textOf(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (start == null || stop == null) return "";
        int from = start.getStartIndex();
        int to = stop.getStopIndex();
        if (from < 0 || to < from) return "";
        return input.getText(Interval.of(from, to));
    }
}
