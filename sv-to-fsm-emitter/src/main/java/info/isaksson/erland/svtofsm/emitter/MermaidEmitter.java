package info.isaksson.erland.svtofsm.emitter;

import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmOutput;
import info.isaksson.erland.svtofsm.model.FsmState;
import info.isaksson.erland.svtofsm.model.FsmTransition;
import info.isaksson.erland.svtofsm.model.FsmWarning;
import info.isaksson.erland.svtofsm.model.WarningKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders an {@link Fsm} as Mermaid {@code stateDiagram-v2} text.
 *
 * <p>Output is a pure function of the FSM and the options: states and transitions are written in
 * model order, lines are joined with {@code \n} and there is no trailing newline.</p>
 */
public final class MermaidEmitter {

    private static final String INDENT = "    ";

    public String emit(Fsm fsm) {
        return emit(fsm, MermaidOptions.defaults());
    }

    public String emit(Fsm fsm, MermaidOptions options) {
        return String.join("\n", render(fsm, options));
    }

    /** Same as {@link #emit(Fsm, MermaidOptions)} plus a note right of every state named by a warning. */
    public String emitAnnotated(Fsm fsm, MermaidOptions options) {
        List<String> lines = render(fsm, options);
        List<String> notes = new ArrayList<>();
        for (FsmWarning w : fsm.warnings) {
            for (String state : w.states) {
                notes.add(INDENT + "note right of " + state + ": " + noteText(w.type));
            }
        }
        if (!notes.isEmpty()) {
            lines.add("");
            lines.addAll(notes);
        }
        return String.join("\n", lines);
    }

    /** Same diagram without indentation or blank lines. */
    public String emitCompact(Fsm fsm, MermaidOptions options) {
        return render(fsm, options).stream()
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    /** Escapes characters that Mermaid would otherwise read as syntax inside a label. */
    public static String escapeLabel(String label) {
        if (label == null) return "";
        return label
                .replace("\"", "\\\"")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("[", "&#91;")
                .replace("]", "&#93;")
                .replace("{", "&#123;")
                .replace("}", "&#125;");
    }

    private List<String> render(Fsm fsm, MermaidOptions options) {
        if (fsm == null) throw new IllegalArgumentException("fsm is null");
        if (options == null) options = MermaidOptions.defaults();

        List<String> lines = new ArrayList<>();
        Set<String> mentioned = new LinkedHashSet<>();

        lines.add("stateDiagram-v2");
        lines.add(INDENT + "direction " + options.direction.name());

        if (fsm.resetState != null) {
            lines.add(INDENT + "[*] --> " + fsm.resetState);
            mentioned.add(fsm.resetState);
        }

        if (options.showOutputs) {
            List<FsmState> withOutputs = fsm.states.stream()
                    .filter(s -> !s.outputs.isEmpty())
                    .collect(Collectors.toList());
            if (!withOutputs.isEmpty()) {
                lines.add("");
                for (FsmState s : withOutputs) {
                    lines.add(INDENT + s.name + ": " + s.name);
                    for (FsmOutput o : s.outputs) {
                        lines.add(INDENT + s.name + ": " + OutputFormatter.format(o));
                    }
                    mentioned.add(s.name);
                }
            }
        }

        lines.add("");
        for (FsmTransition t : fsm.transitions) {
            if (!options.showSelfLoops && (t.isSelfLoop || t.isImplicit)) continue;
            lines.add(INDENT + transitionLine(t, options));
            mentioned.add(t.from);
            mentioned.add(t.to);
        }

        if (options.declareIsolatedStates) {
            for (FsmState s : fsm.states) {
                if (!mentioned.contains(s.name)) {
                    lines.add(INDENT + s.name);
                }
            }
        }
        return lines;
    }

    private static String transitionLine(FsmTransition t, MermaidOptions options) {
        List<String> parts = new ArrayList<>();
        if (options.showConditions && t.hasCondition()) {
            parts.add(t.condition);
        }
        if (options.showOutputs && !t.outputs.isEmpty()) {
            String outs = OutputFormatter.format(t.outputs);
            if (parts.isEmpty()) {
                parts.add("/ " + outs);
            } else {
                parts.add("/");
                parts.add(outs);
            }
        }
        String edge = t.from + " --> " + t.to;
        return parts.isEmpty() ? edge : edge + ": " + String.join(" ", parts);
    }

    private static String noteText(WarningKind kind) {
        switch (kind) {
            case UNREACHABLE_STATE: return "Unreachable";
            case TERMINAL_STATE: return "Terminal";
            case MISSING_CASE: return "Not handled";
            default: return "Warning";
        }
    }
}
