package info.isaksson.erland.svtofsm.extract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Policy tables used by the detectors: vocabularies, naming conventions and confidence weights.
 *
 * <p>The defaults ship as {@code default-heuristics.json} next to this class. All name patterns
 * are matched case-insensitively, except the inferred state label pattern which is about case.</p>
 */
public final class FsmHeuristics {

    private static final String DEFAULT_RESOURCE = "default-heuristics.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public final List<String> stateMemberTokens;
    public final int minStateLikeMembers;
    public final List<String> stateTypeTokens;
    public final List<String> stateVariablePatterns;
    public final List<String> nextStateVariablePatterns;
    public final List<String> excludedVariablePatterns;
    public final List<PairingConvention> pairingConventions;
    public final List<String> resetSignalPatterns;
    public final List<String> clockSignalPatterns;
    public final List<String> terminalStatePatterns;
    public final String inferredStateLabelPattern;
    public final Weights weights;
    public final double transitionCoverageBonus;
    public final double resetFallbackScore;
    public final double signalsFoundScore;
    public final double signalsMissingScore;
    public final double inferredConfidence;

    private final List<Pattern> stateVariable;
    private final List<Pattern> nextStateVariable;
    private final List<Pattern> excludedVariable;
    private final List<Pattern> resetSignal;
    private final List<Pattern> clockSignal;
    private final List<Pattern> terminalState;
    private final Pattern inferredStateLabel;

    @JsonCreator
    public FsmHeuristics(
            @JsonProperty("stateMemberTokens") List<String> stateMemberTokens,
            @JsonProperty("minStateLikeMembers") Integer minStateLikeMembers,
            @JsonProperty("stateTypeTokens") List<String> stateTypeTokens,
            @JsonProperty("stateVariablePatterns") List<String> stateVariablePatterns,
            @JsonProperty("nextStateVariablePatterns") List<String> nextStateVariablePatterns,
            @JsonProperty("excludedVariablePatterns") List<String> excludedVariablePatterns,
            @JsonProperty("pairingConventions") List<PairingConvention> pairingConventions,
            @JsonProperty("resetSignalPatterns") List<String> resetSignalPatterns,
            @JsonProperty("clockSignalPatterns") List<String> clockSignalPatterns,
            @JsonProperty("terminalStatePatterns") List<String> terminalStatePatterns,
            @JsonProperty("inferredStateLabelPattern") String inferredStateLabelPattern,
            @JsonProperty("weights") Weights weights,
            @JsonProperty("transitionCoverageBonus") Double transitionCoverageBonus,
            @JsonProperty("resetFallbackScore") Double resetFallbackScore,
            @JsonProperty("signalsFoundScore") Double signalsFoundScore,
            @JsonProperty("signalsMissingScore") Double signalsMissingScore,
            @JsonProperty("inferredConfidence") Double inferredConfidence
    ) {
        this.stateMemberTokens = lowerCased(stateMemberTokens);
        this.minStateLikeMembers = minStateLikeMembers == null ? 2 : minStateLikeMembers;
        this.stateTypeTokens = lowerCased(stateTypeTokens);
        this.stateVariablePatterns = copy(stateVariablePatterns);
        this.nextStateVariablePatterns = copy(nextStateVariablePatterns);
        this.excludedVariablePatterns = copy(excludedVariablePatterns);
        this.pairingConventions = pairingConventions == null ? List.of() : List.copyOf(pairingConventions);
        this.resetSignalPatterns = copy(resetSignalPatterns);
        this.clockSignalPatterns = copy(clockSignalPatterns);
        this.terminalStatePatterns = copy(terminalStatePatterns);
        this.inferredStateLabelPattern = inferredStateLabelPattern == null || inferredStateLabelPattern.isBlank()
                ? "^[A-Z_][A-Z0-9_]*$" : inferredStateLabelPattern;
        this.weights = weights == null ? new Weights(null, null, null, null) : weights;
        this.transitionCoverageBonus = orDefault(transitionCoverageBonus, 0.2);
        this.resetFallbackScore = orDefault(resetFallbackScore, 0.5);
        this.signalsFoundScore = orDefault(signalsFoundScore, 0.9);
        this.signalsMissingScore = orDefault(signalsMissingScore, 0.7);
        this.inferredConfidence = orDefault(inferredConfidence, 0.5);

        this.stateVariable = compile(this.stateVariablePatterns);
        this.nextStateVariable = compile(this.nextStateVariablePatterns);
        this.excludedVariable = compile(this.excludedVariablePatterns);
        this.resetSignal = compile(this.resetSignalPatterns);
        this.clockSignal = compile(this.clockSignalPatterns);
        this.terminalState = compile(this.terminalStatePatterns);
        this.inferredStateLabel = Pattern.compile(this.inferredStateLabelPattern);
    }

    /** The bundled defaults. */
    public static FsmHeuristics defaults() {
        return Defaults.INSTANCE;
    }

    public static FsmHeuristics read(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("in is null");
        return MAPPER.readValue(in, FsmHeuristics.class);
    }

    public static FsmHeuristics load(Path file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public boolean isStateVariableName(String name) {
        return anyFind(stateVariable, name);
    }

    public boolean isNextStateVariableName(String name) {
        return anyFind(nextStateVariable, name);
    }

    public boolean isExcludedVariableName(String name) {
        return anyFind(excludedVariable, name);
    }

    public boolean isResetSignalName(String name) {
        return anyFind(resetSignal, name);
    }

    public boolean isClockSignalName(String name) {
        return anyFind(clockSignal, name);
    }

    /** Names such as DONE or ERROR, where having no way out is expected. */
    public boolean isIntentionalTerminalName(String name) {
        return anyFind(terminalState, name);
    }

    public boolean isInferredStateLabel(String label) {
        return label != null && inferredStateLabel.matcher(label).matches();
    }

    public boolean isStateLikeTypeName(String typeName) {
        if (typeName == null) return false;
        String t = typeName.toLowerCase(Locale.ROOT);
        for (String token : stateTypeTokens) {
            if (t.contains(token)) return true;
        }
        return false;
    }

    public boolean isStateLikeMemberName(String memberName) {
        if (memberName == null) return false;
        String m = memberName.toLowerCase(Locale.ROOT);
        for (String token : stateMemberTokens) {
            if (m.contains(token)) return true;
        }
        return false;
    }

    /** True when the two register names follow one of the current/next naming conventions. */
    public boolean isRegisterPair(String stateName, String nextName) {
        if (stateName == null || nextName == null) return false;
        for (PairingConvention c : pairingConventions) {
            if (c.matches(stateName, nextName)) return true;
        }
        return false;
    }

    private static boolean anyFind(List<Pattern> patterns, String s) {
        if (s == null) return false;
        for (Pattern p : patterns) {
            if (p.matcher(s).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(List<String> regexes) {
        List<Pattern> out = new ArrayList<>();
        for (String r : regexes) {
            out.add(Pattern.compile(r, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(out);
    }

    private static List<String> copy(List<String> in) {
        return in == null ? List.of() : List.copyOf(in);
    }

    private static List<String> lowerCased(List<String> in) {
        List<String> out = new ArrayList<>();
        if (in != null) {
            for (String s : in) out.add(s.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(out);
    }

    private static double orDefault(Double v, double dflt) {
        return v == null ? dflt : v;
    }

    /**
     * A current/next naming convention. When both patterns capture a group, the captured
     * prefixes must be equal.
     */
    public static final class PairingConvention {
        public final String state;
        public final String next;

        private final Pattern statePattern;
        private final Pattern nextPattern;

        @JsonCreator
        public PairingConvention(@JsonProperty("state") String state, @JsonProperty("next") String next) {
            if (state == null || next == null) throw new IllegalArgumentException("state and next patterns are required");
            this.state = state;
            this.next = next;
            this.statePattern = Pattern.compile(state, Pattern.CASE_INSENSITIVE);
            this.nextPattern = Pattern.compile(next, Pattern.CASE_INSENSITIVE);
        }

        boolean matches(String stateName, String nextName) {
            Matcher s = statePattern.matcher(stateName);
            Matcher n = nextPattern.matcher(nextName);
            if (!s.find() || !n.find()) return false;
            String sp = s.groupCount() > 0 ? lower(s.group(1)) : null;
            String np = n.groupCount() > 0 ? lower(n.group(1)) : null;
            return sp == null ? np == null : sp.equals(np);
        }

        private static String lower(String s) {
            return s == null ? null : s.toLowerCase(Locale.ROOT);
        }
    }

    /** Confidence factor weights. */
    public static final class Weights {
        public final double stateDetection;
        public final double transitionExtraction;
        public final double resetDetection;
        public final double outputExtraction;

        @JsonCreator
        public Weights(
                @JsonProperty("stateDetection") Double stateDetection,
                @JsonProperty("transitionExtraction") Double transitionExtraction,
                @JsonProperty("resetDetection") Double resetDetection,
                @JsonProperty("outputExtraction") Double outputExtraction
        ) {
            this.stateDetection = orDefault(stateDetection, 0.30);
            this.transitionExtraction = orDefault(transitionExtraction, 0.40);
            this.resetDetection = orDefault(resetDetection, 0.15);
            this.outputExtraction = orDefault(outputExtraction, 0.15);
        }
    }

    private static final class Defaults {
        static final FsmHeuristics INSTANCE = loadDefaults();

        private static FsmHeuristics loadDefaults() {
            try (InputStream in = FsmHeuristics.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
                return read(in);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
            }
        }
    }
}
