package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One recovered state machine.
 *
 * <p>Built once by the assembler. Validators append to {@link #warnings} and set the state
 * annotation flags; nothing else changes afterwards.</p>
 */
@JsonPropertyOrder({"name", "states", "transitions", "resetState", "encoding", "stateVarName", "nextStateVarName",
        "blockStyle", "confidence", "confidenceBreakdown", "warnings", "errors", "inputSignals", "outputSignals"})
public final class Fsm {
    public final String name;
    public final List<FsmState> states;
    public final List<FsmTransition> transitions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String resetState;

    public final StateEncoding encoding;
    public final String stateVarName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String nextStateVarName;

    public final BlockStyle blockStyle;
    public final double confidence;
    public final ConfidenceBreakdown confidenceBreakdown;
    public final List<FsmWarning> warnings;

    /** Non-fatal extraction problems, e.g. a next-state value that names no state. */
    public final List<String> errors;

    public final List<String> inputSignals;
    public final List<String> outputSignals;

    @JsonCreator
    public Fsm(
            @JsonProperty("name") String name,
            @JsonProperty("states") List<FsmState> states,
            @JsonProperty("transitions") List<FsmTransition> transitions,
            @JsonProperty("resetState") String resetState,
            @JsonProperty("encoding") StateEncoding encoding,
            @JsonProperty("stateVarName") String stateVarName,
            @JsonProperty("nextStateVarName") String nextStateVarName,
            @JsonProperty("blockStyle") BlockStyle blockStyle,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("confidenceBreakdown") ConfidenceBreakdown confidenceBreakdown,
            @JsonProperty("warnings") List<FsmWarning> warnings,
            @JsonProperty("errors") List<String> errors,
            @JsonProperty("inputSignals") List<String> inputSignals,
            @JsonProperty("outputSignals") List<String> outputSignals
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.states = states == null ? List.of() : List.copyOf(states);
        this.transitions = transitions == null ? List.of() : List.copyOf(transitions);
        this.resetState = resetState;
        this.encoding = encoding == null ? StateEncoding.UNKNOWN : encoding;
        this.stateVarName = stateVarName == null ? "" : stateVarName;
        this.nextStateVarName = nextStateVarName;
        this.blockStyle = blockStyle == null ? BlockStyle.TWO_BLOCK : blockStyle;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.confidenceBreakdown = confidenceBreakdown == null ? ConfidenceBreakdown.flat(0.0) : confidenceBreakdown;
        this.warnings = warnings == null ? new ArrayList<>() : new ArrayList<>(warnings);
        this.errors = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
        this.inputSignals = inputSignals == null ? List.of() : List.copyOf(inputSignals);
        this.outputSignals = outputSignals == null ? List.of() : List.copyOf(outputSignals);
    }

    @JsonIgnore
    public List<String> stateNames() {
        return states.stream().map(s -> s.name).collect(Collectors.toList());
    }

    public Optional<FsmState> state(String stateName) {
        for (FsmState s : states) {
            if (s.name.equals(stateName)) return Optional.of(s);
        }
        return Optional.empty();
    }

    public List<FsmWarning> warningsOf(WarningKind kind) {
        return warnings.stream().filter(w -> w.type == kind).collect(Collectors.toList());
    }

    @Override public String toString() {
        return "Fsm{" + name + ", states=" + states.size() + ", transitions=" + transitions.size() + "}";
    }
}
