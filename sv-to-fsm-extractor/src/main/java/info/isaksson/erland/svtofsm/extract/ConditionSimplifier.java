package info.isaksson.erland.svtofsm.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual clean-up of guard conditions.
 *
 * <p>Only a handful of idioms are rewritten: comparisons of a lone signal against a one-bit
 * literal, double negation, and parentheses around a single identifier. Anything else is left
 * as written; an unchanged condition is always a correct result.</p>
 */
public final class ConditionSimplifier {

    /** Start of an operand: beginning of text, an open paren, or a logical connective. */
    private static final String BEFORE = "(^|\\(|&&|\\|\\|)(\\s*)";

    /** End of an operand. */
    private static final String AFTER = "(?=\\s*(?:$|\\)|&&|\\|\\|))";

    private static final Rule[] LITERAL_RULES = {
            new Rule(BEFORE + "(\\w+)\\s*===?\\s*1'b1" + AFTER, "$1$2$3"),
            new Rule(BEFORE + "(\\w+)\\s*===?\\s*1'b0" + AFTER, "$1$2!$3"),
            new Rule(BEFORE + "(\\w+)\\s*!==?\\s*1'b0" + AFTER, "$1$2$3"),
            new Rule(BEFORE + "(\\w+)\\s*!==?\\s*1'b1" + AFTER, "$1$2!$3"),
            new Rule("(?<![\\w$'])\\((\\w+)\\)", "$1"),
    };

    private static final Rule[] NEGATION_RULES = {
            new Rule("!!\\s*(\\w+)", "$1"),
            new Rule("!\\s*\\(\\s*!\\s*(\\w+)\\s*\\)", "$1"),
            new Rule("!\\s*\\(\\s*(\\w+)\\s*==\\s*(\\w+)\\s*\\)", "$1 != $2"),
            new Rule("!\\s*\\(\\s*(\\w+)\\s*!=\\s*(\\w+)\\s*\\)", "$1 == $2"),
    };

    private static final Pattern IDENTIFIER = Pattern.compile("^\\w+$");
    private static final Pattern NEGATED_IDENTIFIER = Pattern.compile("^!\\w+$");
    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z_][a-zA-Z0-9_]*\\b");
    private static final Set<String> KEYWORDS = Set.of("and", "or", "not", "if", "else", "begin", "end");

    private ConditionSimplifier() {}

    public static String simplify(String condition) {
        if (condition == null) return null;
        String s = SvNodes.normalize(condition);
        s = removeOuterParens(s);
        for (Rule r : LITERAL_RULES) s = r.apply(s);
        for (Rule r : NEGATION_RULES) s = r.apply(s);
        return s;
    }

    /** Negation with the obvious cases folded: {@code x} gives {@code !x}, {@code !x} gives {@code x}. */
    public static String negate(String condition) {
        String s = simplify(condition);
        if (IDENTIFIER.matcher(s).matches()) return "!" + s;
        if (NEGATED_IDENTIFIER.matcher(s).matches()) return s.substring(1);
        return "!(" + s + ")";
    }

    /** Conjunction; operands containing {@code ||} are parenthesized. */
    public static String and(List<String> conditions) {
        if (conditions == null || conditions.isEmpty()) return "";
        if (conditions.size() == 1) return conditions.get(0);
        List<String> parts = new ArrayList<>();
        for (String c : conditions) {
            String s = simplify(c);
            parts.add(s.contains("||") || s.contains(" or ") ? "(" + s + ")" : s);
        }
        return String.join(" && ", parts);
    }

    public static String or(List<String> conditions) {
        if (conditions == null || conditions.isEmpty()) return "";
        if (conditions.size() == 1) return conditions.get(0);
        List<String> parts = new ArrayList<>();
        for (String c : conditions) parts.add(simplify(c));
        return String.join(" || ", parts);
    }

    /** Same text after simplification, ignoring case. */
    public static boolean equivalent(String a, String b) {
        if (a == null || b == null) return a == b;
        return simplify(a).toLowerCase(Locale.ROOT).equals(simplify(b).toLowerCase(Locale.ROOT));
    }

    /** Identifiers mentioned in a condition string, in order of first appearance. */
    public static List<String> variables(String condition) {
        Set<String> out = new LinkedHashSet<>();
        if (condition == null) return new ArrayList<>();
        // Based literals like 1'b1 would otherwise yield "b1".
        Matcher m = WORD.matcher(condition.replaceAll("'[sS]?[bBoOdDhH][0-9a-fA-FxXzZ?_]+", " "));
        while (m.find()) {
            String w = m.group();
            if (!KEYWORDS.contains(w.toLowerCase(Locale.ROOT))) out.add(w);
        }
        return new ArrayList<>(out);
    }

    static String removeOuterParens(String expr) {
        if (!expr.startsWith("(") || !expr.endsWith(")")) return expr;
        int depth = 0;
        for (int i = 0; i < expr.length() - 1; i++) {
            char c = expr.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            if (depth == 0) return expr;
        }
        return depth == 1 ? expr.substring(1, expr.length() - 1).trim() : expr;
    }

    private static final class Rule {
        private final Pattern pattern;
        private final String replacement;

        Rule(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }

        String apply(String s) {
            return pattern.matcher(s).replaceAll(replacement);
        }
    }
}
