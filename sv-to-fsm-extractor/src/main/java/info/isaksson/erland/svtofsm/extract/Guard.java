package info.isaksson.erland.svtofsm.extract;

/**
 * The condition accumulated on the way down a nest of {@code if}s. Immutable; {@link #and} and
 * {@link #andNot} return extended copies.
 */
final class Guard {

    static final Guard TRUE = new Guard(null);

    /** As written: {@code a && !(b)}. Null when unconditional. */
    private final String raw;

    private Guard(String raw) {
        this.raw = raw;
    }

    Guard and(String condition) {
        return new Guard(raw == null ? condition : grouped(raw) + " && " + grouped(condition));
    }

    Guard andNot(String condition) {
        String negated = "!(" + condition + ")";
        return new Guard(raw == null ? negated : grouped(raw) + " && " + negated);
    }

    /** Parenthesized when an operator outside any bracket binds looser than {@code &&}. */
    private static String grouped(String condition) {
        return bindsLooserThanAnd(condition) ? "(" + condition + ")" : condition;
    }

    static boolean bindsLooserThanAnd(String condition) {
        int depth = 0;
        for (int i = 0; i < condition.length(); i++) {
            char c = condition.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (depth == 0) {
                if (c == '?') return true;
                if (c == '|' && i + 1 < condition.length() && condition.charAt(i + 1) == '|') return true;
            }
        }
        return false;
    }

    boolean isTrue() {
        return raw == null;
    }

    String raw() {
        return raw;
    }

    /** Simplified form, or null when unconditional. */
    String simplified() {
        return raw == null ? null : ConditionSimplifier.simplify(raw);
    }

    @Override public String toString() {
        return raw == null ? "true" : raw;
    }
}
