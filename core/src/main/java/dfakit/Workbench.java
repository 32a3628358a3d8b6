package dfakit;

import dfakit.io.AutomatonFiles;
import dfakit.simulation.SimulationTrace;
import dfakit.simulation.Simulator;
import dfakit.strings.ClosureEnumeration;
import dfakit.strings.ClosureGenerator;
import dfakit.strings.Decomposition;
import dfakit.strings.SubsequenceAnalyzer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session state behind an editor: the automaton being worked on and the last
 * string that was checked against it.
 *
 * <p>The automaton is edited in place through {@link #automaton()}. A trace
 * kept from {@link #validateString} is only handed out while the automaton
 * is still at the revision the trace was built from.
 */
public final class Workbench {

  private static final Logger LOG = LoggerFactory.getLogger(Workbench.class);

  private final ClosureGenerator closureGenerator;
  private Automaton automaton = new Automaton();
  private SimulationTrace lastTrace;

  public Workbench() {
    this(new ClosureGenerator());
  }

  /**
   * @param closureGenerator generator used by {@link #closure}
   */
  public Workbench(ClosureGenerator closureGenerator) {
    this.closureGenerator = closureGenerator;
  }

  /**
   * Active automaton (edits go straight to it).
   */
  public Automaton automaton() {
    return automaton;
  }

  /**
   * Replace the active automaton with one read from a file.
   *
   * <p>If reading or parsing fails, the active automaton and trace are left
   * as they were.
   *
   * @param path {@code .afd} or {@code .jff} file
   * @throws IOException if the file cannot be read
   * @throws AutomatonException if the file does not hold a valid automaton
   */
  public void load(Path path) throws IOException, AutomatonException {
    final Automaton loaded = AutomatonFiles.load(path);
    automaton = loaded;
    lastTrace = null;
    LOG.info("Workbench now holds automaton from {} ({} state(s))", path, loaded.stateIds().size());
  }

  /**
   * Save the active automaton in the native format.
   *
   * @param path destination file
   * @throws IOException if the file cannot be written
   * @throws InvalidAutomatonException if the automaton does not validate
   */
  public void save(Path path) throws IOException, InvalidAutomatonException {
    AutomatonFiles.save(path, automaton);
  }

  /**
   * Clear the active automaton and forget the last trace.
   */
  public void reset() {
    automaton.reset();
    lastTrace = null;
  }

  /**
   * Check a string against the active automaton, keeping the trace.
   *
   * @param input string to check
   * @return trace of the run
   * @throws NoInitialStateException if the automaton has no initial state
   */
  public SimulationTrace validateString(String input) throws NoInitialStateException {
    lastTrace = Simulator.buildTrace(automaton, input);
    return lastTrace;
  }

  /**
   * Trace of the last checked string.
   *
   * @return the trace, unless there is none or the automaton changed since
   */
  public Optional<SimulationTrace> currentTrace() {
    if (lastTrace != null && lastTrace.revision() != automaton.revision()) {
      LOG.debug("Dropping trace of '{}': automaton moved from revision {} to {}",
        lastTrace.input(), lastTrace.revision(), automaton.revision());
      lastTrace = null;
    }
    return Optional.ofNullable(lastTrace);
  }

  /**
   * @see ClosureGenerator#generate(CharSequence, int, boolean)
   */
  public ClosureEnumeration closure(CharSequence symbols, int maxLength, boolean includeEmpty)
      throws ResourceLimitException {
    return closureGenerator.generate(symbols, maxLength, includeEmpty);
  }

  /**
   * @see SubsequenceAnalyzer#compute(String)
   */
  public Decomposition decompose(String input) {
    return SubsequenceAnalyzer.compute(input);
  }
}
