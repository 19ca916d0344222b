package info.isaksson.erland.svtofsm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Per-factor confidence scores, each in {@code [0,1]}. */
@JsonPropertyOrder({"stateDetection", "transitionExtraction", "resetDetection", "outputExtraction"})
public final class ConfidenceBreakdown {
    public final double stateDetection;
    public final double transitionExtraction;
    public final double resetDetection;
    public final double outputExtraction;

    @JsonCreator
    public ConfidenceBreakdown(
            @JsonProperty("stateDetection") double stateDetection,
            @JsonProperty("transitionExtraction") double transitionExtraction,
            @JsonProperty("resetDetection") double resetDetection,
            @JsonProperty("outputExtraction") double outputExtraction
    ) {
        this.stateDetection = clamp(stateDetection);
        this.transitionExtraction = clamp(transitionExtraction);
        this.resetDetection = clamp(resetDetection);
        this.outputExtraction = clamp(outputExtraction);
    }

    /** Same score for every factor. */
    public static ConfidenceBreakdown flat(double score) {
        return new ConfidenceBreakdown(score, score, score, score);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
