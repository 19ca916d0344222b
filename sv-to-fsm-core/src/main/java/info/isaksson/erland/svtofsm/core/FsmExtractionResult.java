package info.isaksson.erland.svtofsm.core;

import info.isaksson.erland.svtofsm.model.Fsm;
import info.isaksson.erland.svtofsm.model.FsmWarning;
import info.isaksson.erland.svtofsm.model.ModuleAnalysis;

import java.util.List;
import java.util.stream.Collectors;

/** Extraction result container for programmatic usage. */
public final class FsmExtractionResult {
    /** Rendered diagram or JSON document, depending on {@link #format}. */
    public final String output;

    public final OutputFormat format;

    /** The FSM that was rendered. */
    public final Fsm fsm;

    /** Every FSM of the analyzed module, with recoverable diagnostics. */
    public final ModuleAnalysis analysis;

    /** Messages of the rendered FSM's warnings. */
    public final List<String> warnings;

    FsmExtractionResult(String output, OutputFormat format, Fsm fsm, ModuleAnalysis analysis) {
        this.output = output;
        this.format = format;
        this.fsm = fsm;
        this.analysis = analysis;
        this.warnings = fsm.warnings.stream().map((FsmWarning w) -> w.message).collect(Collectors.toList());
    }
}
