package dfakit;

/**
 * Snapshot of a state and its markings.
 *
 * @param id identifier, unique within one automaton
 * @param initial is this the initial state?
 * @param accepting is this a final (accepting) state?
 */
public record State(String id, boolean initial, boolean accepting) {

  /**
   * Label with markers, as shown in transition tables: {@code q0 (I) (F)}.
   *
   * @return decorated identifier
   */
  public String label() {
    return id + (initial ? " (I)" : "") + (accepting ? " (F)" : "");
  }
}
