package dfakit;

/**
 * Problem found by {@link Automaton#validate()}.
 *
 * @param kind category of the problem
 * @param message human readable description
 */
public record ValidationError(Kind kind, String message) {

  public enum Kind {
    NO_STATES,
    NO_INITIAL_STATE,
    EPSILON_TRANSITION,
    SYMBOL_NOT_IN_ALPHABET
  }
}
