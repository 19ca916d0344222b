package info.isaksson.erland.svtofsm.extract;

import info.isaksson.erland.svtofsm.syntax.NodeKind;
import info.isaksson.erland.svtofsm.syntax.SyntaxNode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds the state a clocked block loads while its reset is asserted.
 */
final class ResetStateFinder {

    private ResetStateFinder() {}

    /**
     * Looks at the leading {@code if} of each clocked block that writes {@code stateVar}. The
     * reset branch is the then-branch when the condition holds while reset is asserted, else the
     * else-branch; it must assign a known state.
     */
    static Optional<String> find(List<ProceduralBlock> blocks, String stateVar, Collection<String> stateNames) {
        for (ProceduralBlock b : blocks) {
            if (!b.actsClocked() || !b.assigns(stateVar) || b.reset == null) continue;
            SyntaxNode lead = BlockClassifier.leadingConditional(b.node);
            if (lead == null) continue;

            SyntaxNode condition = lead.child(NodeKind.CONDITION).flatMap(SyntaxNode::expressionChild).orElse(null);
            Optional<LevelGuard> guard = LevelGuard.of(condition);
            if (guard.isEmpty() || !guard.get().signal.equals(b.reset.signal)) continue;

            boolean thenIsReset = guard.get().trueWhenLow == b.reset.activeLow;
            NodeKind branchKind = thenIsReset ? NodeKind.THEN_BRANCH : NodeKind.ELSE_BRANCH;
            SyntaxNode branch = lead.child(branchKind).map(SvNodes::statementOf).orElse(null);

            String loaded = null;
            for (ArmStatement s : CaseArmReader.readBody(branch)) {
                if (s instanceof Assignment && ((Assignment) s).writes(stateVar)) {
                    String name = SvNodes.valueName(((Assignment) s).valueNode);
                    loaded = name != null && stateNames.contains(name) ? name : null;
                }
            }
            if (loaded != null) return Optional.of(loaded);
        }
        return Optional.empty();
    }
}
