package info.isaksson.erland.svtofsm.emitter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Basic structural check of rendered {@code stateDiagram-v2} text.
 *
 * <p>Besides header and bracket balance it re-derives the state and transition counts, so callers
 * can compare them against the FSM the text was rendered from.</p>
 */
public final class MermaidSyntaxCheck {

    private static final Pattern TRANSITION = Pattern.compile("^\\s*(\\[\\*]|\\w+)\\s+-->\\s+(\\w+)(\\s*:.*)?$");
    private static final Pattern STATE_LINE = Pattern.compile("^\\s*(\\w+)\\s*:.*$");
    private static final Pattern BARE_STATE = Pattern.compile("^\\s*(\\w+)\\s*$");
    private static final Pattern DIRECTIVE = Pattern.compile("^\\s*(direction|note|click)\\b.*$");

    public static final class Result {
        public final boolean valid;
        public final List<String> errors;

        /** Distinct state names, in order of first appearance. */
        public final List<String> states;

        /** Transition lines, excluding the initial {@code [*]} arrow. */
        public final int transitionCount;

        Result(List<String> errors, List<String> states, int transitionCount) {
            this.valid = errors.isEmpty();
            this.errors = List.copyOf(errors);
            this.states = List.copyOf(states);
            this.transitionCount = transitionCount;
        }

        public int stateCount() {
            return states.size();
        }
    }

    private MermaidSyntaxCheck() {}

    public static Result check(String mermaid) {
        if (mermaid == null) throw new IllegalArgumentException("mermaid is null");

        List<String> errors = new ArrayList<>();
        if (!mermaid.contains("stateDiagram-v2")) {
            errors.add("Missing stateDiagram-v2 header");
        }
        if (count(mermaid, '[') != count(mermaid, ']')) {
            errors.add("Unbalanced square brackets");
        }

        Set<String> states = new LinkedHashSet<>();
        int transitions = 0;
        String[] lines = mermaid.split("\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.trim().startsWith("%%")) continue;
            if (line.contains("stateDiagram-v2") || DIRECTIVE.matcher(line).matches()) continue;

            Matcher m = TRANSITION.matcher(line);
            if (m.matches()) {
                if (!"[*]".equals(m.group(1))) {
                    states.add(m.group(1));
                    transitions++;
                }
                states.add(m.group(2));
                continue;
            }
            if (line.contains("-->")) {
                errors.add("Malformed transition at line " + (i + 1) + ": " + line.trim());
                continue;
            }
            m = STATE_LINE.matcher(line);
            if (m.matches()) {
                states.add(m.group(1));
                continue;
            }
            m = BARE_STATE.matcher(line);
            if (m.matches()) {
                states.add(m.group(1));
                continue;
            }
            errors.add("Unrecognized line " + (i + 1) + ": " + line.trim());
        }
        return new Result(errors, new ArrayList<>(states), transitions);
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) n++;
        }
        return n;
    }
}
