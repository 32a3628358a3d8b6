package dfakit;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The automaton does not pass {@link Automaton#validate()} and cannot be used
 * for the requested operation.
 */
public class InvalidAutomatonException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 1853365400913127025L;

  /**
   * Problems reported by validation (never empty).
   */
  public final List<ValidationError> errors;

  public InvalidAutomatonException(List<ValidationError> errors) {
    super(errors.stream().map(ValidationError::message).collect(Collectors.joining("; ")));
    this.errors = List.copyOf(errors);
  }
}
