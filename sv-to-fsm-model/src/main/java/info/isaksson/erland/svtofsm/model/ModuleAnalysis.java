package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Everything recovered from one module: its FSMs plus recoverable diagnostics. */
@JsonPropertyOrder({"moduleName", "fsms", "parseErrors"})
public final class ModuleAnalysis {
    public final String moduleName;
    public final List<Fsm> fsms;
    public final List<FsmDiagnostic> parseErrors;

    @JsonCreator
    public ModuleAnalysis(
            @JsonProperty("moduleName") String moduleName,
            @JsonProperty("fsms") List<Fsm> fsms,
            @JsonProperty("parseErrors") List<FsmDiagnostic> parseErrors
    ) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName must not be null");
        this.fsms = fsms == null ? List.of() : List.copyOf(fsms);
        this.parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
    }

    public Optional<Fsm> fsm(String name) {
        for (Fsm f : fsms) {
            if (f.name.equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
