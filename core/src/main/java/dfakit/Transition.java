package dfakit;

/**
 * Transition between two states of an automaton.
 *
 * @param from source state id
 * @param symbol symbol read
 * @param to target state id
 */
public record Transition(String from, Symbol symbol, String to) {

  @Override
  public String toString() {
    return from + " --" + (symbol.isEpsilon() ? "λ" : symbol.toString()) + "--> " + to;
  }
}
