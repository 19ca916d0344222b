package info.isaksson.erland.svtofsm.core;

/** Rendering produced by {@link FsmExtractionService#extract}. */
public enum OutputFormat {
    MERMAID,
    JSON
}
