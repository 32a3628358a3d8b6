package dfakit;

/**
 * An operation referred to a state which is not in the automaton.
 */
public class UnknownStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -7523190447616148208L;

  /**
   * Identifier which could not be found.
   */
  public final String stateId;

  public UnknownStateException(String stateId) {
    super("Unknown state '" + stateId + "'");
    this.stateId = stateId;
  }
}
