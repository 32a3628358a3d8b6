package dfakit;

/**
 * An automaton file is not well-formed (bad JSON or XML).
 */
public class AutomatonParseException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -1290054315830963207L;

  /**
   * Name of the format being read.
   */
  public final String format;

  public AutomatonParseException(String format, String message, Throwable cause) {
    super("Malformed " + format + " input: " + message, cause);
    this.format = format;
  }
}
