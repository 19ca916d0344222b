package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A guarded edge between two states, with the Mealy outputs that ride on it. */
@JsonPropertyOrder({"from", "to", "condition", "rawCondition", "line", "isDefault", "isSelfLoop", "isImplicit", "sourceBlock", "outputs"})
public final class FsmTransition {
    public final String from;
    public final String to;

    /** Simplified guard; null for an unconditional transition. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String condition;

    /** Guard as accumulated from the source before simplification. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String rawCondition;

    public final int line;
    public final boolean isDefault;
    public final boolean isSelfLoop;
    public final boolean isImplicit;
    public final BlockKind sourceBlock;
    public final List<FsmOutput> outputs;

    @JsonCreator
    public FsmTransition(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("condition") String condition,
            @JsonProperty("rawCondition") String rawCondition,
            @JsonProperty("line") int line,
            @JsonProperty("isDefault") boolean isDefault,
            @JsonProperty("isSelfLoop") boolean isSelfLoop,
            @JsonProperty("isImplicit") boolean isImplicit,
            @JsonProperty("sourceBlock") BlockKind sourceBlock,
            @JsonProperty("outputs") List<FsmOutput> outputs
    ) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.to = Objects.requireNonNull(to, "to must not be null");
        this.condition = condition;
        this.rawCondition = rawCondition;
        this.line = line;
        this.isDefault = isDefault;
        this.isSelfLoop = isSelfLoop;
        this.isImplicit = isImplicit;
        this.sourceBlock = sourceBlock == null ? BlockKind.COMBINATIONAL : sourceBlock;
        this.outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /** Explicit transition; the self-loop flag is derived from the endpoints. */
    public static FsmTransition explicit(String from, String to, String condition, String rawCondition,
                                         int line, BlockKind sourceBlock) {
        return new FsmTransition(from, to, condition, rawCondition, line, false, from.equals(to), false, sourceBlock, null);
    }

    /** Self-loop synthesized from a default {@code next = state} assignment. */
    public static FsmTransition implicitSelfLoop(String state, int line, BlockKind sourceBlock) {
        return new FsmTransition(state, state, null, null, line, true, true, true, sourceBlock, null);
    }

    public FsmTransition withOutputs(List<FsmOutput> newOutputs) {
        return new FsmTransition(from, to, condition, rawCondition, line, isDefault, isSelfLoop, isImplicit, sourceBlock, newOutputs);
    }

    public boolean hasCondition() {
        return condition != null && !condition.isEmpty();
    }

    /** Key used to attach Mealy outputs. */
    public String edgeKey() {
        return from + "->" + to;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FsmTransition)) return false;
        FsmTransition that = (FsmTransition) o;
        return line == that.line &&
                isDefault == that.isDefault &&
                isSelfLoop == that.isSelfLoop &&
                isImplicit == that.isImplicit &&
                from.equals(that.from) &&
                to.equals(that.to) &&
                Objects.equals(condition, that.condition) &&
                Objects.equals(rawCondition, that.rawCondition) &&
                sourceBlock == that.sourceBlock &&
                outputs.equals(that.outputs);
    }

    @Override public int hashCode() {
        return Objects.hash(from, to, condition, rawCondition, line, isDefault, isSelfLoop, isImplicit, sourceBlock, outputs);
    }

    @Override public String toString() {
        return from + " -> " + to + (hasCondition() ? " [" + condition + "]" : "");
    }
}
