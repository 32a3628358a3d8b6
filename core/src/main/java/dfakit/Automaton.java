package dfakit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Editable deterministic finite automaton.
 *
 * <p>The automaton is only ever changed through the mutators on this class,
 * each of which checks the structural invariants before touching anything:
 *
 * <ul>
 *   <li>state identifiers are unique
 *   <li>there is at most one initial state
 *   <li>final states and transition endpoints are states of the automaton
 *   <li>every {@code (state, symbol)} pair has at most one target
 *       (determinism invariant)
 * </ul>
 *
 * <p>A mutator that throws leaves the automaton exactly as it was. Queries
 * return unmodifiable snapshots. Instances are not thread-safe.
 */
public final class Automaton {

  private static final Logger LOG = LoggerFactory.getLogger(Automaton.class);

  /**
   * States, in insertion order.
   */
  private final Set<String> states = new LinkedHashSet<>();

  /**
   * Non-epsilon symbols, in code unit order.
   */
  private final SortedSet<Symbol> alphabet = new TreeSet<>();

  /**
   * Accepting states, in the order they were marked.
   */
  private final Set<String> finalStates = new LinkedHashSet<>();

  /**
   * Outgoing transitions of each state, keyed by the symbol read.
   *
   * <p>Every state has an entry (possibly empty) so that transition order
   * follows state order.
   */
  private final Map<String, Map<Symbol, String>> transitions = new LinkedHashMap<>();

  private String initialState = null;

  private long revision = 0;

  /**
   * Add a new state.
   *
   * <p>Marking the state as initial moves the initial marking away from any
   * state previously holding it.
   *
   * @param id identifier of the state (not blank)
   * @param isInitial should the state be the initial one?
   * @param isFinal should the state be accepting?
   * @throws DuplicateStateException if a state with this id already exists
   */
  public void addState(String id, boolean isInitial, boolean isFinal) throws DuplicateStateException {
    requireId(id);
    if (states.contains(id)) {
      throw new DuplicateStateException(id);
    }

    states.add(id);
    transitions.put(id, new LinkedHashMap<>());
    if (isInitial) {
      if (initialState != null) {
        LOG.debug("Initial marking moves from '{}' to '{}'", initialState, id);
      }
      initialState = id;
    }
    if (isFinal) {
      finalStates.add(id);
    }
    revision++;
    LOG.debug("Added state '{}' (initial={}, final={})", id, isInitial, isFinal);
  }

  /**
   * Add a transition.
   *
   * <p>The symbol joins the alphabet if it is not epsilon and not there yet.
   * Re-adding a transition that already exists changes nothing.
   *
   * @param from source state
   * @param symbol symbol read
   * @param to target state
   * @throws UnknownStateException if either state is not in the automaton
   * @throws NonDeterministicTransitionException if {@code from} already moves
   *   somewhere else on {@code symbol}
   */
  public void addTransition(String from, Symbol symbol, String to)
  throws UnknownStateException, NonDeterministicTransitionException {
    requireState(from);
    requireState(to);
    if (symbol == null) {
      throw new NullPointerException("symbol");
    }

    final Map<Symbol, String> outgoing = transitions.get(from);
    final String existing = outgoing.get(symbol);
    if (existing != null) {
      if (existing.equals(to)) {
        return;
      }
      throw new NonDeterministicTransitionException(
        new Transition(from, symbol, existing),
        new Transition(from, symbol, to)
      );
    }

    if (!symbol.isEpsilon()) {
      alphabet.add(symbol);
    }
    outgoing.put(symbol, to);
    revision++;
    LOG.debug("Added transition {}", new Transition(from, symbol, to));
  }

  /**
   * Add a transition on a character.
   *
   * @see #addTransition(String, Symbol, String)
   */
  public void addTransition(String from, char symbol, String to)
  throws UnknownStateException, NonDeterministicTransitionException {
    addTransition(from, Symbol.of(symbol), to);
  }

  /**
   * Remove the transition leaving a state on some symbol, if there is one.
   *
   * <p>The alphabet is left as is.
   *
   * @param from source state
   * @param symbol symbol read
   * @return whether a transition was removed
   * @throws UnknownStateException if the state is not in the automaton
   */
  public boolean removeTransition(String from, Symbol symbol) throws UnknownStateException {
    requireState(from);
    final boolean removed = transitions.get(from).remove(symbol) != null;
    if (removed) {
      revision++;
    }
    return removed;
  }

  /**
   * Remove a state along with every transition into or out of it.
   *
   * @param id state to remove
   * @throws UnknownStateException if the state is not in the automaton
   */
  public void removeState(String id) throws UnknownStateException {
    requireState(id);

    states.remove(id);
    finalStates.remove(id);
    transitions.remove(id);
    for (Map<Symbol, String> outgoing : transitions.values()) {
      outgoing.values().removeIf(id::equals);
    }
    if (id.equals(initialState)) {
      initialState = null;
    }
    revision++;
    LOG.debug("Removed state '{}'", id);
  }

  /**
   * Mark or unmark a state as accepting.
   *
   * @param id state to update
   * @param isFinal new marking
   * @throws UnknownStateException if the state is not in the automaton
   */
  public void setFinal(String id, boolean isFinal) throws UnknownStateException {
    requireState(id);
    final boolean changed = isFinal ? finalStates.add(id) : finalStates.remove(id);
    if (changed) {
      revision++;
    }
  }

  /**
   * Make a state the initial one, clearing the previous initial marking.
   *
   * @param id new initial state
   * @throws UnknownStateException if the state is not in the automaton
   */
  public void setInitial(String id) throws UnknownStateException {
    requireState(id);
    if (!id.equals(initialState)) {
      initialState = id;
      revision++;
    }
  }

  /**
   * Add a symbol to the alphabet even if no transition reads it yet.
   *
   * @param symbol non-epsilon symbol
   */
  public void addSymbol(Symbol symbol) {
    if (symbol.isEpsilon()) {
      throw new IllegalArgumentException("Epsilon is not part of an alphabet");
    }
    if (alphabet.add(symbol)) {
      revision++;
    }
  }

  /**
   * Remove every state, symbol and transition.
   */
  public void reset() {
    states.clear();
    alphabet.clear();
    finalStates.clear();
    transitions.clear();
    initialState = null;
    revision++;
    LOG.debug("Automaton reset");
  }

  /**
   * Check whether the automaton is a usable DFA.
   *
   * <p>This never modifies the automaton.
   *
   * @return problems found, empty if there are none
   */
  public List<ValidationError> validate() {
    final var errors = new ArrayList<ValidationError>();

    if (states.isEmpty()) {
      errors.add(new ValidationError(ValidationError.Kind.NO_STATES, "no states defined"));
    }
    if (initialState == null) {
      errors.add(new ValidationError(ValidationError.Kind.NO_INITIAL_STATE, "no initial state defined"));
    }
    for (Transition transition : transitions()) {
      final Symbol symbol = transition.symbol();
      if (symbol.isEpsilon()) {
        errors.add(new ValidationError(
          ValidationError.Kind.EPSILON_TRANSITION,
          "lambda transition " + transition + " is not allowed in a DFA"
        ));
      } else if (!alphabet.contains(symbol)) {
        errors.add(new ValidationError(
          ValidationError.Kind.SYMBOL_NOT_IN_ALPHABET,
          "transition " + transition + " reads a symbol outside the alphabet"
        ));
      }
    }

    return errors;
  }

  /**
   * Counter bumped by every mutation that changed something.
   *
   * <p>Results derived from the automaton (traces, compiled acceptors) can
   * compare revisions to tell whether they are stale.
   *
   * @return current revision
   */
  public long revision() {
    return revision;
  }

  /**
   * Copy this automaton.
   *
   * @return independent automaton with the same definition
   */
  public Automaton copy() {
    final var copy = new Automaton();
    copy.states.addAll(states);
    copy.alphabet.addAll(alphabet);
    copy.finalStates.addAll(finalStates);
    for (Map.Entry<String, Map<Symbol, String>> entry : transitions.entrySet()) {
      copy.transitions.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
    }
    copy.initialState = initialState;
    return copy;
  }

  public boolean isEmpty() {
    return states.isEmpty();
  }

  public boolean hasState(String id) {
    return states.contains(id);
  }

  /**
   * Look up a state.
   *
   * @param id identifier of the state
   * @return snapshot of the state, if it exists
   */
  public Optional<State> state(String id) {
    if (!states.contains(id)) {
      return Optional.empty();
    }
    return Optional.of(new State(id, id.equals(initialState), finalStates.contains(id)));
  }

  /**
   * All states, in insertion order.
   *
   * @return snapshots of the states
   */
  public List<State> states() {
    final var snapshot = new ArrayList<State>(states.size());
    for (String id : states) {
      snapshot.add(new State(id, id.equals(initialState), finalStates.contains(id)));
    }
    return Collections.unmodifiableList(snapshot);
  }

  /**
   * State identifiers, in insertion order.
   */
  public List<String> stateIds() {
    return List.copyOf(states);
  }

  public Optional<String> initialState() {
    return Optional.ofNullable(initialState);
  }

  public Set<String> finalStates() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(finalStates));
  }

  public boolean isFinal(String id) {
    return finalStates.contains(id);
  }

  public SortedSet<Symbol> alphabet() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
  }

  /**
   * All transitions, grouped by source state in state order.
   *
   * @return snapshot of the transitions
   */
  public List<Transition> transitions() {
    final var snapshot = new ArrayList<Transition>();
    for (Map.Entry<String, Map<Symbol, String>> outgoing : transitions.entrySet()) {
      for (Map.Entry<Symbol, String> entry : outgoing.getValue().entrySet()) {
        snapshot.add(new Transition(outgoing.getKey(), entry.getKey(), entry.getValue()));
      }
    }
    return Collections.unmodifiableList(snapshot);
  }

  /**
   * Outgoing transitions of one state.
   *
   * @param from source state
   * @return map of symbols to targets (empty if the state does not exist)
   */
  public Map<Symbol, String> transitionsFrom(String from) {
    final Map<Symbol, String> outgoing = transitions.get(from);
    return outgoing == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(outgoing));
  }

  /**
   * Follow one transition.
   *
   * @param from source state
   * @param symbol symbol read
   * @return target state, if there is a transition
   */
  public Optional<String> target(String from, Symbol symbol) {
    final Map<Symbol, String> outgoing = transitions.get(from);
    return outgoing == null ? Optional.empty() : Optional.ofNullable(outgoing.get(symbol));
  }

  /**
   * Tabulate the transition function.
   *
   * @return one row per state, one column per alphabet symbol
   */
  public TransitionTable transitionTable() {
    return TransitionTable.of(this);
  }

  @Override
  public String toString() {
    return "Automaton(states=" + states + ", initial=" + initialState + ", final=" + finalStates
      + ", alphabet=" + alphabet + ", transitions=" + transitions() + ")";
  }

  private static void requireId(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("State id must not be blank");
    }
  }

  private void requireState(String id) throws UnknownStateException {
    if (id == null || !states.contains(id)) {
      throw new UnknownStateException(id);
    }
  }
}
