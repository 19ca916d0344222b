package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.model.StateEncoding;
import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds enumerated types that may hold FSM states.
 *
 * <p>Enums declared in the module come first, in declaration order. Enums declared in a package
 * or at compilation-unit scope of the same source follow when the module declares a variable of
 * that type.</p>
 */
public final class EnumerationDetector {

    private static final Pattern BINARY = Pattern.compile("^\\d*\\s*'[sS]?[bB]([01_]+)$");
    private static final Pattern HEX = Pattern.compile("^\\d*\\s*'[sS]?[hH]([0-9a-fA-F_]+)$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d*\\s*'[sS]?[dD]?([0-9_]+)$");
    private static final Pattern PLAIN = Pattern.compile("^[0-9][0-9_]*$");

    private final FsmHeuristics heuristics;

    public EnumerationDetector(FsmHeuristics heuristics) {
        if (heuristics == null) throw new IllegalArgumentException("heuristics is null");
        this.heuristics = heuristics;
    }

    public List<EnumDefinition> detect(SyntaxNode module) {
        if (module == null) throw new IllegalArgumentException("module is null");

        Map<String, EnumDefinition> byName = new LinkedHashMap<>();
        for (EnumDefinition e : collect(module)) {
            byName.putIfAbsent(e.typeName, e);
        }

        SyntaxNode root = rootOf(module);
        if (root != module) {
            Map<String, EnumDefinition> shared = new LinkedHashMap<>();
            for (SyntaxNode top : root.children()) {
                if (top.is(NodeKind.PACKAGE) || top.is(NodeKind.TYPE_DECLARATION)) {
                    for (EnumDefinition e : collect(top)) shared.putIfAbsent(e.typeName, e);
                }
            }
            for (String used : referencedTypeNames(module)) {
                EnumDefinition e = shared.get(used);
                if (e != null) byName.putIfAbsent(e.typeName, e);
            }
        }
        return new ArrayList<>(byName.values());
    }

    /** Type-name or member-name vocabulary match. */
    public boolean looksLikeStateEnum(EnumDefinition def) {
        if (def == null) return false;
        if (heuristics.isStateLikeTypeName(def.typeName)) return true;
        int matches = 0;
        for (EnumMember m : def.members) {
            if (heuristics.isStateLikeMemberName(m.name)) matches++;
        }
        return matches >= heuristics.minStateLikeMembers;
    }

    /**
     * Classifies the explicit member values. Members without a value are ignored; if none has a
     * value, or one cannot be read as a number, the encoding is unknown.
     */
    public static StateEncoding classifyEncoding(EnumDefinition def) {
        List<Long> values = new ArrayList<>();
        int explicit = 0;
        for (EnumMember m : def.members) {
            if (m.encoding == null) continue;
            explicit++;
            OptionalLong v = parseLiteral(m.encoding);
            if (v.isEmpty()) return StateEncoding.UNKNOWN;
            values.add(v.getAsLong());
        }
        if (explicit == 0) return StateEncoding.UNKNOWN;

        boolean oneHot = values.stream().allMatch(v -> v > 0 && (v & (v - 1)) == 0);
        if (oneHot && values.size() > 1) return StateEncoding.ONEHOT;

        long[] sorted = values.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);
        boolean gray = true;
        for (int i = 1; i < sorted.length; i++) {
            long diff = sorted[i] ^ sorted[i - 1];
            if ((diff & (diff - 1)) != 0) {
                gray = false;
                break;
            }
        }
        if (gray && sorted.length > 1) return StateEncoding.GRAY;
        return StateEncoding.BINARY;
    }

    /** Reads {@code 2'b01}, {@code 8'hFF}, {@code 3'd5}, {@code 'd10} or a plain decimal. */
    static OptionalLong parseLiteral(String literal) {
        if (literal == null) return OptionalLong.empty();
        String s = literal.trim();
        try {
            Matcher m = BINARY.matcher(s);
            if (m.matches()) return OptionalLong.of(Long.parseLong(digits(m), 2));
            m = HEX.matcher(s);
            if (m.matches()) return OptionalLong.of(Long.parseLong(digits(m), 16));
            m = DECIMAL.matcher(s);
            if (m.matches()) return OptionalLong.of(Long.parseLong(digits(m), 10));
            if (PLAIN.matcher(s).matches()) return OptionalLong.of(Long.parseLong(s.replace("_", ""), 10));
        } catch (NumberFormatException e) {
            // wider than 64 bits
            return OptionalLong.empty();
        }
        return OptionalLong.empty();
    }

    private static String digits(Matcher m) {
        String d = m.group(1).replace("_", "");
        if (d.isEmpty()) throw new NumberFormatException("no digits");
        return d;
    }

    private List<EnumDefinition> collect(SyntaxNode scope) {
        List<EnumDefinition> out = new ArrayList<>();
        scope.walk(n -> {
            if (n.is(NodeKind.ALWAYS_CONSTRUCT) || n.is(NodeKind.INITIAL_CONSTRUCT)) return false;
            if (n.is(NodeKind.TYPE_DECLARATION)) {
                SyntaxNode enumType = enumTypeOf(n);
                String name = n.child(NodeKind.NAME).map(x -> x.text().trim()).orElse(null);
                if (enumType != null && name != null) out.add(toDefinition(name, enumType, n.line(), false));
                return false;
            }
            if (n.is(NodeKind.DATA_DECLARATION)) {
                SyntaxNode enumType = enumTypeOf(n);
                if (enumType != null) {
                    List<SyntaxNode> declarators = n.children(NodeKind.VARIABLE_DECLARATOR);
                    String name = declarators.isEmpty() ? null : SvNodes.firstIdentifier(declarators.get(0));
                    if (name != null) out.add(toDefinition(name, enumType, n.line(), true));
                }
                return false;
            }
            return true;
        });
        return out;
    }

    private static SyntaxNode enumTypeOf(SyntaxNode declaration) {
        return declaration.child(NodeKind.DATA_TYPE)
                .flatMap(dt -> dt.child(NodeKind.ENUM_TYPE))
                .orElse(null);
    }

    private static EnumDefinition toDefinition(String typeName, SyntaxNode enumType, int line, boolean inline) {
        List<EnumMember> members = new ArrayList<>();
        for (SyntaxNode m : enumType.children(NodeKind.ENUM_MEMBER)) {
            String name = SvNodes.firstIdentifier(m);
            if (name == null) continue;
            String text = m.text();
            int eq = text.indexOf('=');
            String encoding = eq < 0 ? null : SvNodes.normalize(text.substring(eq + 1));
            members.add(new EnumMember(name, encoding == null || encoding.isEmpty() ? null : encoding, m.line()));
        }

        boolean parameterized = false;
        for (SyntaxNode dim : enumType.children(NodeKind.PACKED_DIMENSION)) {
            if (!dim.descendants(NodeKind.REFERENCE).isEmpty()) parameterized = true;
        }
        return new EnumDefinition(typeName, members, line, inline, parameterized);
    }

    /** Type names referenced anywhere in the module. */
    private static Set<String> referencedTypeNames(SyntaxNode module) {
        Set<String> out = new LinkedHashSet<>();
        for (SyntaxNode ref : module.descendants(NodeKind.TYPE_REFERENCE)) {
            List<SyntaxNode> ids = ref.children(NodeKind.IDENTIFIER);
            if (!ids.isEmpty()) out.add(ids.get(ids.size() - 1).text().trim());
        }
        return out;
    }

    private static SyntaxNode rootOf(SyntaxNode node) {
        SyntaxNode n = node;
        while (n.parent() != null) n = n.parent();
        return n;
    }
}
