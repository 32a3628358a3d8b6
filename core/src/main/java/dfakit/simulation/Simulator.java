package dfakit.simulation;

import dfakit.Acceptor;
import dfakit.Automaton;
import dfakit.NoInitialStateException;
import dfakit.Symbol;
import java.util.ArrayList;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs automata over input strings.
 *
 * <p>Missing transitions are not errors: the run simply stops in a stuck
 * configuration, which is a normal (rejecting) outcome.
 */
public final class Simulator {

  private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

  private Simulator() { }

  /**
   * Does the automaton accept the input?
   *
   * @param automaton automaton to run
   * @param input input string
   * @return whether the input was fully consumed into a final state
   * @throws NoInitialStateException if the automaton has no initial state
   */
  public static boolean accept(Automaton automaton, String input) throws NoInitialStateException {
    return buildTrace(automaton, input).accepted();
  }

  /**
   * Replay the input, recording every configuration.
   *
   * @param automaton automaton to run
   * @param input input string
   * @return trace of the run, stuck-terminated if a transition is missing
   * @throws NoInitialStateException if the automaton has no initial state
   */
  public static SimulationTrace buildTrace(Automaton automaton, String input) throws NoInitialStateException {
    final var configurations = new ArrayList<Configuration>(input.length() + 1);
    final String last = run(
      automaton,
      input,
      state -> configurations.add(new Configuration(configurations.size(), state, configurations.size())),
      position -> LOG.debug("Stuck at position {} of '{}'", position, input)
    );

    final boolean accepted = configurations.size() == input.length() + 1 && automaton.isFinal(last);
    LOG.debug("Run over '{}' ended in '{}' after {} step(s): {}",
      input, last, configurations.size() - 1, accepted ? "accepted" : "rejected");
    return new SimulationTrace(input, configurations, accepted, automaton.revision());
  }

  /**
   * Interpreting acceptor over a snapshot of the automaton.
   *
   * @param automaton automaton to snapshot
   * @return acceptor unaffected by later edits to {@code automaton}
   * @throws NoInitialStateException if the automaton has no initial state
   */
  public static Acceptor interpreted(Automaton automaton) throws NoInitialStateException {
    final Automaton snapshot = automaton.copy();
    requireInitial(snapshot);
    return input -> {
      final String text = input.toString();
      final int[] entered = { 0 };
      try {
        final String last = run(snapshot, text, state -> entered[0]++, position -> { });
        return entered[0] == text.length() + 1 && snapshot.isFinal(last);
      } catch (NoInitialStateException e) {
        throw new IllegalStateException("Snapshot lost its initial state", e);
      }
    };
  }

  /**
   * Run the automaton either to completion or to a stuck state.
   *
   * @param automaton automaton to run
   * @param input input string
   * @param onState callback invoked whenever a state is entered (including the first)
   * @param onMissingJump callback invoked with the input position that had no transition
   * @return last state entered
   */
  private static String run(
    Automaton automaton,
    String input,
    Consumer<String> onState,
    IntConsumer onMissingJump
  ) throws NoInitialStateException {
    String currentState = requireInitial(automaton);
    onState.accept(currentState);

    for (int position = 0; position < input.length(); position++) {
      final Optional<String> target = automaton.target(currentState, Symbol.of(input.charAt(position)));

      // No transition found
      if (target.isEmpty()) {
        onMissingJump.accept(position);
        break;
      }

      currentState = target.get();
      onState.accept(currentState);
    }

    return currentState;
  }

  private static String requireInitial(Automaton automaton) throws NoInitialStateException {
    return automaton.initialState().orElseThrow(NoInitialStateException::new);
  }
}
