package info.isaksson.erland.svtofsm.emitter;

/** Layout direction of a rendered state diagram. */
public enum DiagramDirection {
    /** Top to bottom. */
    TB,
    /** Left to right. */
    LR
}
