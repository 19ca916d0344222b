package info.isaksson.erland.svtofsm.extract;

/** A statement inside a case arm: an {@link Assignment} or a {@link ConditionalBlock}. */
public interface ArmStatement {

    int line();
}
