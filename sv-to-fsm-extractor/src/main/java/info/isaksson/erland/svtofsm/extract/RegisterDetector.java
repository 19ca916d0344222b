package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds state-holding variables and pairs current-state with next-state registers.
 */
public final class RegisterDetector {

    private final FsmHeuristics heuristics;

    public RegisterDetector(FsmHeuristics heuristics) {
        if (heuristics == null) throw new IllegalArgumentException("heuristics is null");
        this.heuristics = heuristics;
    }

    /**
     * Module-level declarations typed by one of the enums, or named like a state variable.
     * A name seen twice is kept once; a typed declaration wins over an untyped one (non-ANSI
     * port lists declare the name before its type).
     */
    public List<StateRegister> detect(SyntaxNode module, List<EnumDefinition> enums) {
        if (module == null) throw new IllegalArgumentException("module is null");
        Set<String> enumNames = new HashSet<>();
        if (enums != null) {
            for (EnumDefinition e : enums) enumNames.add(e.typeName);
        }

        Map<String, StateRegister> byName = new LinkedHashMap<>();
        module.walk(n -> {
            if (n.is(NodeKind.ALWAYS_CONSTRUCT) || n.is(NodeKind.INITIAL_CONSTRUCT)) return false;
            if (!n.is(NodeKind.DATA_DECLARATION)) return true;

            String typeName = declaredTypeName(n);
            boolean typed = typeName != null && enumNames.contains(typeName);
            for (SyntaxNode d : n.children(NodeKind.VARIABLE_DECLARATOR)) {
                String name = SvNodes.firstIdentifier(d);
                if (name == null || heuristics.isExcludedVariableName(name)) continue;
                if (!typed && !heuristics.isStateVariableName(name)) continue;

                StateRegister reg = new StateRegister(name, typed ? typeName : null,
                        heuristics.isNextStateVariableName(name), d.line());
                StateRegister existing = byName.get(name);
                if (existing == null || (existing.typeName == null && reg.typeName != null)) {
                    byName.put(name, reg);
                }
            }
            return false;
        });
        return new ArrayList<>(byName.values());
    }

    /**
     * Pairs registers of the same type. A current-state register takes the first unused
     * next-state register whose name follows a pairing convention, else the first unused one.
     * Next-state registers left over become one-block drivers on their own.
     */
    public List<RegisterPair> pair(List<StateRegister> registers) {
        List<RegisterPair> pairs = new ArrayList<>();
        if (registers == null || registers.isEmpty()) return pairs;

        Map<String, List<StateRegister>> byType = new LinkedHashMap<>();
        for (StateRegister r : registers) {
            byType.computeIfAbsent(r.typeName, k -> new ArrayList<>()).add(r);
        }

        Set<StateRegister> used = new HashSet<>();
        for (List<StateRegister> group : byType.values()) {
            List<StateRegister> current = new ArrayList<>();
            List<StateRegister> next = new ArrayList<>();
            for (StateRegister r : group) {
                if (r.isNextState) next.add(r);
                else current.add(r);
            }

            for (StateRegister s : current) {
                StateRegister match = null;
                for (StateRegister n : next) {
                    if (!used.contains(n) && heuristics.isRegisterPair(s.name, n.name)) {
                        match = n;
                        break;
                    }
                }
                if (match == null) {
                    match = next.stream().filter(n -> !used.contains(n)).findFirst().orElse(null);
                }
                if (match != null) used.add(match);
                used.add(s);
                pairs.add(new RegisterPair(s, match));
            }

            for (StateRegister n : next) {
                if (used.add(n)) pairs.add(new RegisterPair(n, null));
            }
        }
        return pairs;
    }

    /** First pair whose current-state register has the enum's type. */
    public static Optional<RegisterPair> pairFor(EnumDefinition def, List<RegisterPair> pairs) {
        if (def == null || pairs == null) return Optional.empty();
        for (RegisterPair p : pairs) {
            if (def.typeName.equals(p.state.typeName)) return Optional.of(p);
        }
        return Optional.empty();
    }

    /**
     * Type name of a declaration: the referenced type, or for an inline enum the name of its
     * first variable. Null for built-in types.
     */
    static String declaredTypeName(SyntaxNode declaration) {
        SyntaxNode dataType = declaration.child(NodeKind.DATA_TYPE).orElse(null);
        if (dataType == null) return null;
        if (dataType.child(NodeKind.ENUM_TYPE).isPresent()) {
            List<SyntaxNode> declarators = declaration.children(NodeKind.VARIABLE_DECLARATOR);
            return declarators.isEmpty() ? null : SvNodes.firstIdentifier(declarators.get(0));
        }
        return dataType.child(NodeKind.TYPE_REFERENCE)
                .map(ref -> {
                    List<SyntaxNode> ids = ref.children(NodeKind.IDENTIFIER);
                    return ids.isEmpty() ? null : ids.get(ids.size() - 1).text().trim();
                })
                .orElse(null);
    }
}
