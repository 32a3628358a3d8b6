package dfakit;

/**
 * Decides membership of strings in the language of a fixed automaton.
 *
 * <p>Implementations work on a snapshot: editing the automaton afterwards
 * does not change the verdicts.
 */
@FunctionalInterface
public interface Acceptor {

  /**
   * Does the automaton accept the whole input?
   *
   * @param input string to check
   * @return whether the run consumes every character and ends in a final state
   */
  boolean accepts(CharSequence input);
}
