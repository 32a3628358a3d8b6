package dfakit;

/**
 * Failure of an operation on an automaton or one of its file formats.
 *
 * <p>Every failure leaves the automaton it was applied to unchanged.
 */
public class AutomatonException extends Exception {

  @java.io.Serial
  private static final long serialVersionUID = -3086135722160532817L;

  public AutomatonException(String message) {
    super(message);
  }

  public AutomatonException(String message, Throwable cause) {
    super(message, cause);
  }
}
