package dfakit;

/**
 * Adding a transition would give a state two targets on the same symbol.
 */
public class NonDeterministicTransitionException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 2215816104479650367L;

  /**
   * Transition already in the automaton.
   */
  public final Transition existing;

  /**
   * Transition which was refused.
   */
  public final Transition rejected;

  public NonDeterministicTransitionException(Transition existing, Transition rejected) {
    super(
      "State '" + existing.from() + "' already moves to '" + existing.to() + "' on '"
        + existing.symbol() + "', cannot also move to '" + rejected.to() + "'"
    );
    this.existing = existing;
    this.rejected = rejected;
  }
}
