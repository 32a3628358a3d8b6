package dfakit;

/**
 * An automaton file is well-formed but its content does not fit the schema:
 * missing or ill-typed fields, or references to undeclared states.
 */
public class SchemaException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 7371563208921560214L;

  /**
   * Field or element at fault.
   */
  public final String field;

  public SchemaException(String field, String message) {
    super("Invalid '" + field + "': " + message);
    this.field = field;
  }
}
