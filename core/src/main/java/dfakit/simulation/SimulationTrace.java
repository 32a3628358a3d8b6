package dfakit.simulation;

import java.util.List;
import java.util.Optional;

/**
 * Recorded run of an automaton over one input.
 *
 * <p>The trace holds {@code k + 1} configurations, where {@code k} is the
 * number of characters consumed before the input ran out or no transition
 * matched (the trace is then <em>stuck</em>). It is immutable: stepping
 * through it is done with an index kept by the caller, so it can be walked
 * forwards, backwards and from the start as often as needed.
 *
 * @param input string that was replayed
 * @param configurations configurations in order, never empty
 * @param accepted whether the input was fully consumed into a final state
 * @param revision revision of the automaton the trace was built from
 */
public record SimulationTrace(
  String input,
  List<Configuration> configurations,
  boolean accepted,
  long revision
) {

  public SimulationTrace {
    configurations = List.copyOf(configurations);
    if (configurations.isEmpty()) {
      throw new IllegalArgumentException("A trace has at least the initial configuration");
    }
  }

  public int size() {
    return configurations.size();
  }

  /**
   * Configuration at an index.
   *
   * @param index position in the trace
   * @return configuration at that position
   * @throws IndexOutOfBoundsException if the index is outside the trace
   */
  public Configuration config(int index) {
    return configurations.get(index);
  }

  public Configuration last() {
    return configurations.get(configurations.size() - 1);
  }

  /**
   * Index after stepping forward (stays put at the last configuration).
   *
   * @param index current index
   * @return next index
   */
  public int next(int index) {
    return Math.min(clamp(index) + 1, configurations.size() - 1);
  }

  /**
   * Index after stepping back (stays put at the first configuration).
   *
   * @param index current index
   * @return previous index
   */
  public int prev(int index) {
    return Math.max(clamp(index) - 1, 0);
  }

  /**
   * Index of the first configuration.
   */
  public int resetIndex() {
    return 0;
  }

  /**
   * Did the run stop before the end of the input?
   */
  public boolean isStuck() {
    return last().consumed() < input.length();
  }

  /**
   * Character for which the last state had no transition.
   *
   * @return offending character, if the trace is stuck
   */
  public Optional<Character> stuckSymbol() {
    return isStuck() ? Optional.of(input.charAt(last().consumed())) : Optional.empty();
  }

  /**
   * Input still to be read at a configuration.
   *
   * @param index position in the trace
   * @return unread suffix of the input
   */
  public String remaining(int index) {
    return input.substring(config(index).consumed());
  }

  /**
   * Input with the character about to be read at a configuration wrapped in
   * brackets, eg. {@code ab[a]b}.
   *
   * <p>No brackets appear at the last configuration: there the run either
   * finished or is stuck, and nothing more gets read.
   *
   * @param index position in the trace
   * @return annotated input
   */
  public String highlight(int index) {
    final int position = config(index).consumed();
    if (index == configurations.size() - 1 || position >= input.length()) {
      return input;
    }
    return input.substring(0, position)
      + "[" + input.charAt(position) + "]"
      + input.substring(position + 1);
  }

  private int clamp(int index) {
    return Math.max(0, Math.min(index, configurations.size() - 1));
  }
}
