package info.isaksson.erland.svtofsm.core;

import info.isaksson.erland.svtofsm.emitter.MermaidEmitter;
import info.isaksson.erland.svtofsm.extract.FsmAssembler;
import info.isaksson.erland.svtofsm.extract.FsmHeuristics;
import info.isaksson.erland.svtofsm.model.ErrorCode;
import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmDiagnostic;
import info.isaksson.erland.svtofsm.model.FsmExtractionException;
import info.isaksson.erland.svtofsm.model.FsmJson;
import info.isaksson.erland.svtofsm.model.FsmWarning;
import info.isaksson.erland.svtofsm.model.ModuleAnalysis;
import info.isaksson.erland.svtofsm.parser.AntlrSourceParser;
import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SourceParser;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;
import info.isaksson.erland.svtofsm.syntax.SyntaxProblem;
import info.isaksson.erland.svtofsm.syntax.SyntaxTree;
import info.isaksson.erland.svtofsm.validate.FsmValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Core (server-friendly) API for recovering state machines from SystemVerilog source.
 *
 * <p>Wrappers should use this class instead of re-implementing the parse, assemble, validate and
 * render pipeline. The parser is injected; each call is independent, so one service can be shared
 * by callers that do not call it concurrently with a non-thread-safe parser.</p>
 */
public final class FsmExtractionService {
    private static final Logger logger = LogManager.getLogger(FsmExtractionService.class);

    private static final List<Pattern> FSM_HINTS = List.of(
            Pattern.compile("typedef\\s+enum", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bstate\\b.*\\bcase\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\\bfsm\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bnext_state\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\balways_ff\\b.*state", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\\balways_comb\\b.*state", Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
    );

    private final SourceParser parser;
    private final MermaidEmitter emitter = new MermaidEmitter();

    public FsmExtractionService() {
        this(new AntlrSourceParser());
    }

    public FsmExtractionService(SourceParser parser) {
        if (parser == null) throw new IllegalArgumentException("parser must not be null");
        this.parser = parser;
    }

    /**
     * Fast textual pre-check. A false result means extraction is pointless; a true result
     * promises nothing.
     */
    public static boolean mightContainFsm(String source) {
        if (source == null) return false;
        for (Pattern p : FSM_HINTS) {
            if (p.matcher(source).find()) return true;
        }
        return false;
    }

    /**
     * Parse, assemble and validate every FSM of one module.
     *
     * <p>Syntax problems that still leave a module behind are reported as leading
     * {@link ErrorCode#PARSE_ERROR} diagnostics of the returned analysis.</p>
     *
     * @throws FsmExtractionException with {@code INVALID_INPUT}, {@code PARSER_INIT},
     *                                {@code PARSE_ERROR}, {@code NO_MODULE} or {@code NO_FSM}
     */
    public ModuleAnalysis analyze(String source, FsmExtractionOptions options) throws FsmExtractionException {
        if (source == null || source.isBlank()) {
            throw new FsmExtractionException(ErrorCode.INVALID_INPUT, "source is empty", (Integer) null);
        }
        if (options == null) options = new FsmExtractionOptions();
        FsmHeuristics heuristics = options.heuristics == null ? FsmHeuristics.defaults() : options.heuristics;

        SyntaxTree tree = parse(source);
        List<SyntaxNode> modules = tree.modules();
        if (modules.isEmpty()) {
            if (tree.hasProblems()) {
                SyntaxProblem first = tree.problems.get(0);
                throw new FsmExtractionException(ErrorCode.PARSE_ERROR, first.message, first.line);
            }
            throw new FsmExtractionException(ErrorCode.NO_MODULE);
        }

        SyntaxNode module = selectModule(modules, options.moduleName);
        ModuleAnalysis assembled = new FsmAssembler(heuristics).assemble(module);

        FsmValidator validator = new FsmValidator(heuristics);
        for (Fsm fsm : assembled.fsms) {
            validator.validate(fsm);
        }

        List<FsmDiagnostic> diagnostics = new ArrayList<>();
        for (SyntaxProblem p : tree.problems) {
            diagnostics.add(FsmDiagnostic.of(ErrorCode.PARSE_ERROR, p.message, p.line));
        }
        diagnostics.addAll(assembled.parseErrors);
        ModuleAnalysis analysis = new ModuleAnalysis(assembled.moduleName, assembled.fsms, diagnostics);

        if (analysis.fsms.isEmpty()) {
            logger.warn("Module {}: no FSM detected ({} diagnostic(s))", analysis.moduleName, diagnostics.size());
            throw new FsmExtractionException(ErrorCode.NO_FSM, "module " + analysis.moduleName, (Integer) null);
        }
        logger.debug("Module {}: {} FSM(s) extracted", analysis.moduleName, analysis.fsms.size());
        return analysis;
    }

    /** Analyze, select one FSM and render it in the requested format. */
    public FsmExtractionResult extract(String source, FsmExtractionOptions options) throws FsmExtractionException {
        if (options == null) options = new FsmExtractionOptions();

        ModuleAnalysis analysis = analyze(source, options);
        Fsm fsm = selectFsm(analysis, options.fsmName);

        OutputFormat format = options.format == null ? OutputFormat.MERMAID : options.format;
        String output;
        if (format == OutputFormat.JSON) {
            output = FsmJson.toJson(fsm);
        } else {
            output = emitter.emit(fsm, options.mermaidOptions());
            if (options.includeWarnings && !fsm.warnings.isEmpty()) {
                String prefix = fsm.warnings.stream()
                        .map((FsmWarning w) -> "%% WARNING: " + w.message)
                        .collect(Collectors.joining("\n"));
                output = prefix + "\n\n" + output;
            }
        }
        return new FsmExtractionResult(output, format, fsm, analysis);
    }

    private SyntaxTree parse(String source) throws FsmExtractionException {
        try {
            return parser.parse(source);
        } catch (LinkageError e) {
            throw new FsmExtractionException(ErrorCode.PARSER_INIT, e.getMessage(), e);
        }
    }

    private static SyntaxNode selectModule(List<SyntaxNode> modules, String wanted) throws FsmExtractionException {
        if (wanted == null || wanted.isBlank()) return modules.get(0);

        List<String> names = new ArrayList<>();
        for (SyntaxNode m : modules) {
            String name = m.child(NodeKind.NAME).map(SyntaxNode::text).orElse("");
            if (name.equals(wanted)) return m;
            names.add(name);
        }
        throw new FsmExtractionException(ErrorCode.NO_MODULE,
                "module '" + wanted + "' not found. Available: " + String.join(", ", names), (Integer) null);
    }

    private static Fsm selectFsm(ModuleAnalysis analysis, String wanted) throws FsmExtractionException {
        if (wanted == null || wanted.isBlank()) return analysis.fsms.get(0);

        Optional<Fsm> byName = analysis.fsm(wanted);
        if (byName.isPresent()) return byName.get();
        for (Fsm f : analysis.fsms) {
            if (f.stateVarName.equals(wanted)) return f;
        }
        String available = analysis.fsms.stream().map(f -> f.name).collect(Collectors.joining(", "));
        throw new FsmExtractionException(ErrorCode.NO_FSM,
                "FSM '" + wanted + "' not found. Available: " + available, (Integer) null);
    }
}
