package dfakit;

/**
 * A state with the same identifier already exists.
 */
public class DuplicateStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 4410925383766226413L;

  /**
   * Identifier which was already taken.
   */
  public final String stateId;

  public DuplicateStateException(String stateId) {
    super("State '" + stateId + "' already exists");
    this.stateId = stateId;
  }
}
