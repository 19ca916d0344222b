package info.isaksson.erland.svtofsm.emitter;

/** Rendering switches for {@link MermaidEmitter}. */
public final class MermaidOptions {
    public final DiagramDirection direction;

    /** When true, transition labels carry the simplified guard. */
    public final boolean showConditions;

    /** When true, Moore outputs are listed per state and Mealy outputs follow the guard after a slash. */
    public final boolean showOutputs;

    /** When false, self-loops and implicit transitions are left out of the diagram. */
    public final boolean showSelfLoops;

    /** When true, states no other line mentions get a line of their own. Off by default. */
    public final boolean declareIsolatedStates;

    public MermaidOptions(DiagramDirection direction, boolean showConditions, boolean showOutputs, boolean showSelfLoops) {
        this(direction, showConditions, showOutputs, showSelfLoops, false);
    }

    public MermaidOptions(DiagramDirection direction, boolean showConditions, boolean showOutputs,
                          boolean showSelfLoops, boolean declareIsolatedStates) {
        this.direction = direction == null ? DiagramDirection.TB : direction;
        this.showConditions = showConditions;
        this.showOutputs = showOutputs;
        this.showSelfLoops = showSelfLoops;
        this.declareIsolatedStates = declareIsolatedStates;
    }

    public static MermaidOptions defaults() {
        return new MermaidOptions(DiagramDirection.TB, true, false, true, false);
    }

    public MermaidOptions withDirection(DiagramDirection d) {
        return new MermaidOptions(d, showConditions, showOutputs, showSelfLoops, declareIsolatedStates);
    }

    public MermaidOptions withConditions(boolean show) {
        return new MermaidOptions(direction, show, showOutputs, showSelfLoops, declareIsolatedStates);
    }

    public MermaidOptions withOutputs(boolean show) {
        return new MermaidOptions(direction, showConditions, show, showSelfLoops, declareIsolatedStates);
    }

    public MermaidOptions withSelfLoops(boolean show) {
        return new MermaidOptions(direction, showConditions, showOutputs, show, declareIsolatedStates);
    }

    public MermaidOptions withIsolatedStates(boolean declare) {
        return new MermaidOptions(direction, showConditions, showOutputs, showSelfLoops, declare);
    }

    @Override
    public String toString() {
        return "MermaidOptions{" +
                "direction=" + direction +
                ", showConditions=" + showConditions +
                ", showOutputs=" + showOutputs +
                ", showSelfLoops=" + showSelfLoops +
                ", declareIsolatedStates=" + declareIsolatedStates +
                '}';
    }
}
