package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.BlockStyle;
import info.isaksson.erland.svtofsm.model.ConfidenceBreakdown;
import info.isaksson.erland.svtofsm.model.ErrorCode;
import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmDiagnostic;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.model.ModuleAnalysis;
import info.isaksson.erland.svtofsm.model.StateEncoding;
import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the extraction stages over one module and assembles an {@link Fsm} per state machine.
 *
 * <p>Typed enumerations are tried first. Only when none of them yields a machine are the register
 * pairs used on their own, with state names inferred from the case labels.</p>
 *
 * <p>Validators are not run here; the machines come back without warnings.</p>
 */
public final class FsmAssembler {

    private static final Logger logger = LogManager.getLogger(FsmAssembler.class);

    private final FsmHeuristics heuristics;
    private final EnumerationDetector enumerationDetector;
    private final RegisterDetector registerDetector;
    private final BlockClassifier blockClassifier;
    private final TransitionExtractor transitionExtractor = new TransitionExtractor();
    private final OutputExtractor outputExtractor = new OutputExtractor();
    private final ConfidenceScorer scorer;

    public FsmAssembler() {
        this(FsmHeuristics.defaults());
    }

    public FsmAssembler(FsmHeuristics heuristics) {
        if (heuristics == null) throw new IllegalArgumentException("heuristics is null");
        this.heuristics = heuristics;
        this.enumerationDetector = new EnumerationDetector(heuristics);
        this.registerDetector = new RegisterDetector(heuristics);
        this.blockClassifier = new BlockClassifier(heuristics);
        this.scorer = new ConfidenceScorer(heuristics);
    }

    /**
     * @param module a {@link NodeKind#MODULE} node
     * @return the machines found, possibly none, plus recoverable diagnostics
     */
    public ModuleAnalysis assemble(SyntaxNode module) {
        if (module == null) throw new IllegalArgumentException("module is null");
        if (!module.is(NodeKind.MODULE)) throw new IllegalArgumentException("not a module: " + module);

        String moduleName = moduleName(module);
        List<FsmDiagnostic> diagnostics = new ArrayList<>();

        List<EnumDefinition> enums = enumerationDetector.detect(module);
        List<StateRegister> registers = registerDetector.detect(module, enums);
        List<RegisterPair> pairs = registerDetector.pair(registers);
        Set<String> registerNames = new LinkedHashSet<>();
        for (StateRegister r : registers) registerNames.add(r.name);
        List<ProceduralBlock> blocks = blockClassifier.classify(module, registerNames);

        logger.debug("Module {}: {} enumeration(s), {} register(s), {} pair(s), {} always block(s)",
                moduleName, enums.size(), registers.size(), pairs.size(), blocks.size());

        List<EnumDefinition> likely = new ArrayList<>();
        List<EnumDefinition> others = new ArrayList<>();
        for (EnumDefinition e : enums) {
            if (enumerationDetector.looksLikeStateEnum(e)) likely.add(e);
            else others.add(e);
        }

        List<Fsm> fsms = new ArrayList<>();
        for (EnumDefinition e : likely) {
            assembleEnum(e, true, pairs, blocks, diagnostics).ifPresent(fsms::add);
        }
        for (EnumDefinition e : others) {
            assembleEnum(e, false, pairs, blocks, diagnostics).ifPresent(fsms::add);
        }

        if (fsms.isEmpty() && !pairs.isEmpty()) {
            logger.debug("Module {}: no machine from enumerations, inferring states from case labels", moduleName);
            Map<String, SyntaxNode> parameters = parameterValues(module);
            for (RegisterPair pair : pairs) {
                assembleInferred(pair, blocks, parameters, diagnostics).ifPresent(fsms::add);
            }
        }

        logger.debug("Module {}: {} machine(s), {} diagnostic(s)", moduleName, fsms.size(), diagnostics.size());
        return new ModuleAnalysis(moduleName, fsms, diagnostics);
    }

    static String moduleName(SyntaxNode module) {
        return module.child(NodeKind.NAME)
                .map(n -> n.text().trim())
                .orElseGet(() -> {
                    String id = SvNodes.firstIdentifier(module);
                    return id == null ? "" : id;
                });
    }

    private Optional<Fsm> assembleEnum(EnumDefinition def, boolean stateLike, List<RegisterPair> pairs,
                                       List<ProceduralBlock> blocks, List<FsmDiagnostic> diagnostics) {
        Optional<RegisterPair> pair = RegisterDetector.pairFor(def, pairs);
        if (pair.isEmpty() || def.members.isEmpty()) {
            logger.debug("Enumeration {} skipped: no register of that type", def.typeName);
            return Optional.empty();
        }
        if (stateLike && def.parameterizedWidth) {
            diagnostics.add(FsmDiagnostic.of(ErrorCode.UNSUPPORTED_PATTERN,
                    "enumeration " + def.typeName + " has a parameterized width; encodings are not resolved", def.line));
        }

        Optional<Located> located = locate(pair.get(), blocks);
        if (located.isEmpty()) {
            if (stateLike) {
                logger.warn("Enumeration {}: no case statement on {} found", def.typeName, pair.get().state.name);
                diagnostics.add(FsmDiagnostic.of(ErrorCode.NO_TRANSITIONS,
                        "no case statement on " + pair.get().state.name + " for " + def.typeName, def.line));
            }
            return Optional.empty();
        }

        List<StateSeed> seeds = new ArrayList<>();
        for (EnumMember m : def.members) seeds.add(new StateSeed(m.name, m.encoding, m.line));

        Draft draft = draft(def.typeName, seeds, pair.get(), located.get(), blocks, true, diagnostics);
        long explicit = draft.transitions.stream().filter(t -> !t.isImplicit).count();
        if (!stateLike && explicit == 0) {
            logger.debug("Enumeration {} skipped: not state-like and no explicit transitions", def.typeName);
            return Optional.empty();
        }
        if (draft.transitions.isEmpty()) {
            logger.warn("Enumeration {}: case statement on {} yields no transitions", def.typeName, pair.get().state.name);
            diagnostics.add(FsmDiagnostic.of(ErrorCode.NO_TRANSITIONS, def.typeName, located.get().caseNode.line()));
            return Optional.empty();
        }

        ConfidenceBreakdown breakdown = scorer.breakdown(seeds.size(), draft.transitions, draft.resetState != null,
                !draft.outputs.inputSignals.isEmpty() || !draft.outputs.outputSignals.isEmpty());
        return Optional.of(draft.toFsm(EnumerationDetector.classifyEncoding(def), breakdown, scorer.score(breakdown)));
    }

    private Optional<Fsm> assembleInferred(RegisterPair pair, List<ProceduralBlock> blocks,
                                           Map<String, SyntaxNode> parameters, List<FsmDiagnostic> diagnostics) {
        Optional<Located> located = locate(pair, blocks);
        if (located.isEmpty()) {
            logger.debug("Register {} skipped: no case statement on it", pair.state.name);
            return Optional.empty();
        }
        SyntaxNode caseNode = located.get().caseNode;

        List<StateSeed> seeds = new ArrayList<>();
        List<EnumMember> members = new ArrayList<>();
        for (String label : CaseArmReader.labelNames(caseNode)) {
            if (!heuristics.isInferredStateLabel(label)) continue;
            SyntaxNode param = parameters.get(label);
            String encoding = param == null ? null
                    : param.expressionChild().map(v -> SvNodes.normalize(v.text())).orElse(null);
            int line = param == null ? caseNode.line() : param.line();
            seeds.add(new StateSeed(label, encoding, line));
            members.add(new EnumMember(label, encoding, line));
        }
        if (seeds.isEmpty()) {
            logger.warn("Register {}: case labels name no states", pair.state.name);
            diagnostics.add(FsmDiagnostic.of(ErrorCode.NO_STATES,
                    "case statement on " + pair.state.name, caseNode.line()));
            return Optional.empty();
        }

        Draft draft = draft(pair.state.name, seeds, pair, located.get(), blocks, false, diagnostics);
        if (draft.transitions.isEmpty()) {
            logger.warn("Register {}: inferred states but no transitions", pair.state.name);
            diagnostics.add(FsmDiagnostic.of(ErrorCode.NO_TRANSITIONS, pair.state.name, caseNode.line()));
            return Optional.empty();
        }

        StateEncoding encoding = EnumerationDetector.classifyEncoding(
                new EnumDefinition(pair.state.name, members, pair.state.line, false, false));
        return Optional.of(draft.toFsm(encoding,
                ConfidenceBreakdown.flat(heuristics.inferredConfidence), heuristics.inferredConfidence));
    }

    /** The first candidate block holding a case statement on either register. */
    private Optional<Located> locate(RegisterPair pair, List<ProceduralBlock> blocks) {
        String stateVar = pair.state.name;
        String nextVar = pair.nextVarName();
        Set<String> subjects = new LinkedHashSet<>();
        subjects.add(stateVar);
        if (nextVar != null) subjects.add(nextVar);

        for (ProceduralBlock b : blockClassifier.transitionBlockCandidates(blocks, stateVar, nextVar)) {
            Optional<SyntaxNode> found = CaseArmReader.findStateCase(b.node, subjects);
            if (found.isPresent()) {
                logger.debug("Register {}: transition block {} at line {}", stateVar, b.keyword, b.line);
                return Optional.of(new Located(b, found.get()));
            }
        }
        return Optional.empty();
    }

    /** @param defaultToFirst without a detected reset, the first declared state becomes the reset state */
    private Draft draft(String name, List<StateSeed> seeds, RegisterPair pair, Located located,
                        List<ProceduralBlock> blocks, boolean defaultToFirst, List<FsmDiagnostic> diagnostics) {
        String stateVar = pair.state.name;
        String nextVar = pair.nextVarName();
        String drivenVar = nextVar != null && located.block.assigns(nextVar) ? nextVar : stateVar;

        List<String> stateNames = new ArrayList<>();
        for (StateSeed s : seeds) stateNames.add(s.name);

        CaseArmReader.StateCase stateCase = CaseArmReader.read(located.caseNode, stateNames);
        for (SyntaxNode label : stateCase.wildcardLabels) {
            diagnostics.add(FsmDiagnostic.of(ErrorCode.UNSUPPORTED_PATTERN,
                    "wildcard case label '" + SvNodes.normalize(label.text()) + "' on " + stateVar
                            + " is not resolved to a state", label.line()));
        }

        boolean defaultHold = CaseArmReader.hasDefaultAssignment(located.caseNode, drivenVar, stateVar);
        TransitionExtractor.Result tr = transitionExtractor.extract(
                stateCase, drivenVar, stateVar, stateNames, located.block.kind, defaultHold);

        OutputExtractor.Result outputs = outputExtractor.extract(stateCase.arms, stateVar, drivenVar, stateNames);
        BlockStyle style = blockClassifier.styleFor(blocks, stateVar, nextVar);
        if (style == BlockStyle.THREE_BLOCK) {
            blockClassifier.outputBlock(blocks, stateVar, nextVar)
                    .flatMap(ob -> CaseArmReader.findStateCase(ob.node, Set.of(stateVar)))
                    .ifPresent(c -> outputs.merge(outputExtractor.extract(
                            CaseArmReader.read(c, stateNames).arms, stateVar, drivenVar, stateNames)));
        }

        Optional<String> reset = ResetStateFinder.find(blocks, stateVar, stateNames);
        if (reset.isEmpty() && defaultToFirst) {
            reset = Optional.of(stateNames.get(0));
            logger.debug("Machine {}: no reset found, defaulting to {}", name, reset.get());
        } else if (reset.isEmpty()) {
            logger.debug("Machine {}: no reset found", name);
        }

        List<FsmState> states = new ArrayList<>();
        for (StateSeed s : seeds) states.add(new FsmState(s.name, s.encoding, s.line, outputs.mooreOf(s.name)));

        return new Draft(name, states, OutputExtractor.attach(tr.transitions, outputs.mealy),
                reset.orElse(null), stateVar, nextVar, style, tr.errors, outputs);
    }

    /** {@code localparam}/{@code parameter} name to its assignment node. */
    private static Map<String, SyntaxNode> parameterValues(SyntaxNode module) {
        Map<String, SyntaxNode> out = new HashMap<>();
        for (SyntaxNode p : module.descendants(NodeKind.PARAMETER_ASSIGNMENT)) {
            String name = SvNodes.firstIdentifier(p);
            if (name != null) out.putIfAbsent(name, p);
        }
        return out;
    }

    private static final class Located {
        final ProceduralBlock block;
        final SyntaxNode caseNode;

        Located(ProceduralBlock block, SyntaxNode caseNode) {
            this.block = block;
            this.caseNode = caseNode;
        }
    }

    private static final class StateSeed {
        final String name;
        final String encoding;
        final int line;

        StateSeed(String name, String encoding, int line) {
            this.name = name;
            this.encoding = encoding;
            this.line = line;
        }
    }

    /** Everything but the encoding and the score. */
    private static final class Draft {
        final String name;
        final List<FsmState> states;
        final List<FsmTransition> transitions;
        final String resetState;
        final String stateVar;
        final String nextVar;
        final BlockStyle style;
        final List<String> errors;
        final OutputExtractor.Result outputs;

        Draft(String name, List<FsmState> states, List<FsmTransition> transitions, String resetState,
              String stateVar, String nextVar, BlockStyle style, List<String> errors,
              OutputExtractor.Result outputs) {
            this.name = name;
            this.states = states;
            this.transitions = transitions;
            this.resetState = resetState;
            this.stateVar = stateVar;
            this.nextVar = nextVar;
            this.style = style;
            this.errors = errors;
            this.outputs = outputs;
        }

        Fsm toFsm(StateEncoding encoding, ConfidenceBreakdown breakdown, double confidence) {
            return new Fsm(name, states, transitions, resetState, encoding, stateVar, nextVar, style,
                    confidence, breakdown, null, errors,
                    new ArrayList<>(outputs.inputSignals), new ArrayList<>(outputs.outputSignals));
        }
    }
}
