package dfakit.simulation;

/**
 * One configuration of a run: the state reached after consuming a prefix of
 * the input.
 *
 * @param step position of this configuration in the trace
 * @param state state the automaton is in
 * @param consumed number of input characters consumed so far
 */
public record Configuration(int step, String state, int consumed) { }
