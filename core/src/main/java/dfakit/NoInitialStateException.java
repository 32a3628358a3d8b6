package dfakit;

/**
 * The automaton has no initial state to start a run from.
 */
public class NoInitialStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 6925703166400934152L;

  public NoInitialStateException() {
    super("No initial state defined");
  }
}
