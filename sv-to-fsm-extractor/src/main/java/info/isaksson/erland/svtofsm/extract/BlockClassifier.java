package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.BlockKind;
import info.isaksson.erland.svtofsm.model.BlockStyle;
import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies the {@code always} constructs of a module: kind, sensitivity list, reset and the
 * state variables each one assigns. Also decides the block style of a register pair.
 */
public final class BlockClassifier {

    private static final Pattern EVENT_TEXT = Pattern.compile("@\\s*\\(([^)]*)\\)");
    private static final Pattern EVENT_TERM_TEXT = Pattern.compile("^(posedge|negedge|edge)?\\s*([A-Za-z_][\\w$.]*)$");

    private final FsmHeuristics heuristics;

    public BlockClassifier(FsmHeuristics heuristics) {
        if (heuristics == null) throw new IllegalArgumentException("heuristics is null");
        this.heuristics = heuristics;
    }

    /**
     * @param stateVars names of the candidate state registers; only these are recorded in
     *                  {@link ProceduralBlock#assignedStateVars}
     */
    public List<ProceduralBlock> classify(SyntaxNode module, Set<String> stateVars) {
        if (module == null) throw new IllegalArgumentException("module is null");
        List<ProceduralBlock> out = new ArrayList<>();
        for (SyntaxNode always : module.descendants(NodeKind.ALWAYS_CONSTRUCT)) {
            out.add(classifyBlock(always, stateVars == null ? Set.of() : stateVars));
        }
        return out;
    }

    ProceduralBlock classifyBlock(SyntaxNode always, Set<String> stateVars) {
        String keyword = always.child(NodeKind.ALWAYS_KEYWORD).map(k -> k.text().trim()).orElse("always");
        BlockKind kind = kindOf(keyword);

        List<SensitivityEntry> sensitivity = new ArrayList<>();
        boolean wildcard = readSensitivity(always, sensitivity);

        Set<String> assigned = new LinkedHashSet<>();
        always.walk(n -> {
            if (n.kind().isAssignment()) {
                String target = SvNodes.assignmentTarget(n);
                if (target != null && stateVars.contains(target) && !SvNodes.hasSelectedTarget(n)) {
                    assigned.add(target);
                }
            }
            return true;
        });

        ResetDescriptor reset = detectReset(sensitivity, always);
        return new ProceduralBlock(kind, keyword, always.line(), sensitivity, wildcard, reset, assigned, always);
    }

    static BlockKind kindOf(String keyword) {
        switch (keyword) {
            case "always_ff":
                return BlockKind.CLOCKED;
            case "always_comb":
            case "always_latch":
                return BlockKind.COMBINATIONAL;
            default:
                return BlockKind.LEGACY;
        }
    }

    /** Fills {@code out} and returns true for a wildcard list. */
    private static boolean readSensitivity(SyntaxNode always, List<SensitivityEntry> out) {
        SyntaxNode control = always.child(NodeKind.EVENT_CONTROL).orElse(null);
        if (control != null) {
            if (control.child(NodeKind.EVENT_WILDCARD).isPresent()) return true;
            for (SyntaxNode term : control.children(NodeKind.EVENT_TERM)) {
                String edge = term.child(NodeKind.EDGE).map(e -> e.text().trim()).orElse(null);
                String signal = term.expressionChild()
                        .map(SvNodes::valueName)
                        .orElseGet(() -> SvNodes.firstIdentifier(term));
                if (signal == null) signal = SvNodes.normalize(term.text());
                out.add(new SensitivityEntry(edge, signal));
            }
            return false;
        }

        // Recovered trees can lose the event control node; read it from the text instead.
        Matcher m = EVENT_TEXT.matcher(always.text());
        if (!m.find()) return false;
        String list = m.group(1).trim();
        if (list.equals("*")) return true;
        for (String part : list.split("\\s+or\\s+|,")) {
            Matcher t = EVENT_TERM_TEXT.matcher(part.trim());
            if (t.matches()) out.add(new SensitivityEntry(t.group(1), t.group(2)));
        }
        return false;
    }

    /**
     * Reset from an edge of the sensitivity list ({@code negedge} means active low), else from
     * the level guard of the block's leading {@code if}.
     */
    ResetDescriptor detectReset(List<SensitivityEntry> sensitivity, SyntaxNode always) {
        for (SensitivityEntry e : sensitivity) {
            if (!e.isEdge() || heuristics.isClockSignalName(e.signal)) continue;
            if (heuristics.isResetSignalName(e.signal)) {
                return new ResetDescriptor(e.signal, "negedge".equals(e.edge), true);
            }
        }

        SyntaxNode lead = leadingConditional(always);
        if (lead == null) return null;
        SyntaxNode condition = lead.child(NodeKind.CONDITION).flatMap(SyntaxNode::expressionChild).orElse(null);
        Optional<LevelGuard> guard = LevelGuard.of(condition);
        if (guard.isPresent() && heuristics.isResetSignalName(guard.get().signal)) {
            return new ResetDescriptor(guard.get().signal, guard.get().trueWhenLow, false);
        }
        return null;
    }

    /** The statement an always construct runs, after its timing control. */
    static SyntaxNode bodyOf(SyntaxNode always) {
        for (SyntaxNode c : always.children()) {
            if (c.is(NodeKind.EVENT_CONTROL) || c.is(NodeKind.DELAY)) continue;
            if (SvNodes.isStatement(c)) return c;
        }
        return null;
    }

    /** The {@code if} the block starts with, looking through leading begin/end blocks. */
    static SyntaxNode leadingConditional(SyntaxNode always) {
        SyntaxNode s = bodyOf(always);
        while (s != null && s.is(NodeKind.SEQ_BLOCK)) {
            List<SyntaxNode> statements = SvNodes.statements(s);
            s = statements.isEmpty() ? null : statements.get(0);
        }
        return s != null && s.is(NodeKind.IF_STATEMENT) ? s : null;
    }

    /**
     * One-block when there is no separate next-state register or a single clocked block writes
     * the state directly; two-block when a clocked block writes the state and a combinational
     * block writes the next state; three-block when a further combinational block switches on
     * the state without writing it.
     */
    public BlockStyle styleFor(List<ProceduralBlock> blocks, String stateVar, String nextVar) {
        if (nextVar == null || nextVar.equals(stateVar)) return BlockStyle.ONE_BLOCK;

        List<ProceduralBlock> stateWriters = writersOf(blocks, stateVar);
        List<ProceduralBlock> nextWriters = writersOf(blocks, nextVar);
        if (nextWriters.isEmpty() && stateWriters.size() == 1 && stateWriters.get(0).actsClocked()) {
            return BlockStyle.ONE_BLOCK;
        }

        boolean clocked = stateWriters.stream().anyMatch(ProceduralBlock::actsClocked);
        boolean combinational = nextWriters.stream().anyMatch(ProceduralBlock::actsCombinational);
        if (clocked && combinational) {
            return outputBlock(blocks, stateVar, nextVar).isPresent() ? BlockStyle.THREE_BLOCK : BlockStyle.TWO_BLOCK;
        }
        return stateWriters.size() == 1 ? BlockStyle.ONE_BLOCK : BlockStyle.TWO_BLOCK;
    }

    /**
     * Blocks that may hold the transition logic, best first: combinational writers of the next
     * state, other writers of the next state, clocked writers of the state, other writers of the
     * state.
     */
    public List<ProceduralBlock> transitionBlockCandidates(List<ProceduralBlock> blocks, String stateVar, String nextVar) {
        Set<ProceduralBlock> ordered = new LinkedHashSet<>();
        if (nextVar != null && !nextVar.equals(stateVar)) {
            List<ProceduralBlock> nextWriters = writersOf(blocks, nextVar);
            nextWriters.stream().filter(ProceduralBlock::actsCombinational).forEach(ordered::add);
            ordered.addAll(nextWriters);
        }
        List<ProceduralBlock> stateWriters = writersOf(blocks, stateVar);
        stateWriters.stream().filter(ProceduralBlock::actsClocked).forEach(ordered::add);
        ordered.addAll(stateWriters);
        return new ArrayList<>(ordered);
    }

    /** A combinational block that switches on the state but writes neither register. */
    public Optional<ProceduralBlock> outputBlock(List<ProceduralBlock> blocks, String stateVar, String nextVar) {
        for (ProceduralBlock b : blocks) {
            if (!b.actsCombinational() || b.assigns(stateVar) || b.assigns(nextVar)) continue;
            if (CaseArmReader.findStateCase(b.node, Set.of(stateVar)).isPresent()) return Optional.of(b);
        }
        return Optional.empty();
    }

    private static List<ProceduralBlock> writersOf(List<ProceduralBlock> blocks, String variable) {
        List<ProceduralBlock> out = new ArrayList<>();
        for (ProceduralBlock b : blocks) {
            if (b.assigns(variable)) out.add(b);
        }
        return out;
    }
}
