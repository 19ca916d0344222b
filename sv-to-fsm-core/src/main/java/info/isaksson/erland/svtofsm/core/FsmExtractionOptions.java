package info.isaksson.erland.svtofsm.core;

import info.isaksson.erland.svtofsm.emitter.DiagramDirection;
import info.isaksson.erland.svtofsm.emitter.MermaidOptions;
import info.isaksson.erland.svtofsm.extract.FsmHeuristics;

/**
 * Core (server-friendly) options for FSM extraction and rendering.
 *
 * <p>Field defaults give the first FSM of the first module as a Mermaid diagram with guards.</p>
 */
public final class FsmExtractionOptions {
    /** Module to analyze when the source declares several; null picks the first. */
    public String moduleName = null;

    /** FSM to render, by enumeration type name or state register name; null picks the first. */
    public String fsmName = null;

    public OutputFormat format = OutputFormat.MERMAID;
    public DiagramDirection direction = DiagramDirection.TB;
    public boolean showConditions = true;
    public boolean showOutputs = false;
    public boolean showSelfLoops = true;

    /** Give states without any transition or output line a bare line of their own. */
    public boolean declareIsolatedStates = false;

    /** Prefix Mermaid text with one {@code %% WARNING: ...} comment per warning. */
    public boolean includeWarnings = false;

    public FsmHeuristics heuristics = FsmHeuristics.defaults();

    MermaidOptions mermaidOptions() {
        return new MermaidOptions(direction, showConditions, showOutputs, showSelfLoops, declareIsolatedStates);
    }
}
