package dfakit.io;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dfakit.Automaton;
import dfakit.AutomatonParseException;
import dfakit.DuplicateStateException;
import dfakit.InvalidAutomatonException;
import dfakit.NonDeterministicTransitionException;
import dfakit.SchemaException;
import dfakit.State;
import dfakit.Symbol;
import dfakit.Transition;
import dfakit.UnknownStateException;
import dfakit.ValidationError;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec for the native JSON automaton format ({@code .afd} files).
 *
 * <p>Loading is all-or-nothing: the document is bound and checked field by
 * field before a fresh automaton is built from it, and nothing is returned
 * unless every step succeeds.
 *
 * <p>Transition keys are unique in any file written by {@link #save}. A
 * corrupted file repeating a key is still read, keeping the last value for
 * that key. This is more lenient than {@link Automaton#addTransition}, which
 * refuses a second target outright.
 */
public final class NativeFormat {

  private static final Logger LOG = LoggerFactory.getLogger(NativeFormat.class);

  static final String FORMAT = "native JSON";

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .enable(SerializationFeature.INDENT_OUTPUT)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private NativeFormat() { }

  /**
   * Serialize an automaton.
   *
   * @param automaton automaton to save (must pass validation)
   * @return UTF-8 encoded JSON document
   * @throws InvalidAutomatonException if {@link Automaton#validate()} reports problems
   */
  public static byte[] save(Automaton automaton) throws InvalidAutomatonException {
    final List<ValidationError> errors = automaton.validate();
    if (!errors.isEmpty()) {
      throw new InvalidAutomatonException(errors);
    }

    final var document = new NativeDocument();
    document.alphabet = automaton.alphabet().stream().map(Symbol::toString).toList();
    document.states = automaton.stateIds();
    document.initialState = automaton.initialState().orElse("");
    document.finalStates = automaton.states().stream().filter(State::accepting).map(State::id).toList();
    document.transitions = new NativeDocument.TransitionEntries();
    for (Transition transition : automaton.transitions()) {
      document.transitions.put(transitionKey(transition.from(), transition.symbol()), transition.to());
    }

    try {
      return MAPPER.writeValueAsBytes(document);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize automaton", e);
    }
  }

  /**
   * Deserialize an automaton.
   *
   * @param bytes UTF-8 encoded JSON document
   * @return freshly built automaton
   * @throws AutomatonParseException if the input is not well-formed JSON
   * @throws SchemaException if a field is missing, ill-typed or inconsistent
   */
  public static Automaton load(byte[] bytes) throws AutomatonParseException, SchemaException {
    final NativeDocument document = bind(bytes);
    final Automaton automaton = build(document);
    LOG.info("Loaded {} automaton with {} state(s) and {} transition(s)",
      FORMAT, automaton.stateIds().size(), automaton.transitions().size());
    return automaton;
  }

  /**
   * Key of a transition in the {@code transitions} object.
   *
   * @param from source state
   * @param symbol symbol read (epsilon is written as nothing)
   * @return {@code "from,symbol"}
   */
  static String transitionKey(String from, Symbol symbol) {
    return from + "," + symbol;
  }

  private static NativeDocument bind(byte[] bytes) throws AutomatonParseException, SchemaException {
    if (new String(bytes, StandardCharsets.UTF_8).isBlank()) {
      throw new AutomatonParseException(FORMAT, "empty document", null);
    }

    final NativeDocument document;
    try (JsonParser parser = MAPPER.createParser(bytes)) {
      document = MAPPER.readValue(parser, NativeDocument.class);
      if (parser.nextToken() != null) {
        throw new AutomatonParseException(FORMAT, "unexpected content after the document at line "
          + parser.currentLocation().getLineNr(), null);
      }
    } catch (StreamReadException e) {
      throw new AutomatonParseException(FORMAT, e.getOriginalMessage(), e);
    } catch (JsonMappingException e) {
      // Binding wraps read errors hit inside a field
      final StreamReadException readError = readErrorCause(e);
      if (readError != null) {
        throw new AutomatonParseException(FORMAT, readError.getOriginalMessage(), e);
      }
      final String field = e.getPath()
        .stream()
        .map(JsonMappingException.Reference::getFieldName)
        .filter(Objects::nonNull)
        .findFirst()
        .orElse("$");
      throw new SchemaException(field, e.getOriginalMessage());
    } catch (IOException e) {
      throw new AutomatonParseException(FORMAT, e.getMessage(), e);
    }

    if (document == null) {
      throw new SchemaException("$", "expected an object, found null");
    }
    require(document.alphabet, "alphabet");
    require(document.states, "states");
    require(document.initialState, "initial_state");
    require(document.finalStates, "final_states");
    require(document.transitions, "transitions");
    for (String key : document.transitions.duplicateKeys()) {
      LOG.warn("Transition key '{}' appears more than once, keeping the last target", key);
    }
    return document;
  }

  private static StreamReadException readErrorCause(Throwable error) {
    for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof StreamReadException) {
        return (StreamReadException) cause;
      }
    }
    return null;
  }

  private static Automaton build(NativeDocument document) throws SchemaException {
    final var automaton = new Automaton();

    for (String text : document.alphabet) {
      if (text == null || text.length() != 1) {
        throw new SchemaException("alphabet", "symbols must be single characters, found '" + text + "'");
      }
      automaton.addSymbol(Symbol.of(text.charAt(0)));
    }

    final String initial = document.initialState.isEmpty() ? null : document.initialState;
    for (String id : document.states) {
      if (id == null || id.isBlank()) {
        throw new SchemaException("states", "state ids must not be blank");
      }
      try {
        automaton.addState(id, id.equals(initial), false);
      } catch (DuplicateStateException e) {
        throw new SchemaException("states", e.getMessage());
      }
    }
    if (initial != null && !automaton.hasState(initial)) {
      throw new SchemaException("initial_state", "'" + initial + "' is not listed in states");
    }

    for (String id : document.finalStates) {
      try {
        automaton.setFinal(id, true);
      } catch (UnknownStateException e) {
        throw new SchemaException("final_states", "'" + id + "' is not listed in states");
      }
    }

    for (Map.Entry<String, String> entry : document.transitions.entries().entrySet()) {
      final String key = entry.getKey();
      final String[] parts = splitKey(automaton, key);
      final String from = parts[0];
      final String symbolText = parts[1];
      final String to = entry.getValue();
      if (to == null) {
        throw new SchemaException("transitions", "key '" + key + "' has no target");
      }

      try {
        automaton.addTransition(from, Symbol.parse(symbolText), to);
      } catch (UnknownStateException e) {
        throw new SchemaException("transitions", "key '" + key + "' refers to unknown state '" + e.stateId + "'");
      } catch (NonDeterministicTransitionException e) {
        // Keys are unique once bound, so each (state, symbol) pair shows up once
        throw new IllegalStateException("Transition keys collided after binding", e);
      }
    }

    return automaton;
  }

  /**
   * Split a transition key into its state and symbol.
   *
   * <p>The symbol is the part after the last comma, except that a key ending
   * in two commas reads a comma when the part before them is a known state.
   */
  private static String[] splitKey(Automaton automaton, String key) throws SchemaException {
    final int n = key.length();
    if (n >= 2 && key.charAt(n - 2) == ',' && automaton.hasState(key.substring(0, n - 2))) {
      return new String[] { key.substring(0, n - 2), key.substring(n - 1) };
    }

    final int comma = key.lastIndexOf(',');
    if (comma < 0) {
      throw new SchemaException("transitions", "key '" + key + "' is not of the form 'state,symbol'");
    } else if (comma < n - 2) {
      throw new SchemaException("transitions", "key '" + key + "' has a multi-character symbol");
    }
    return new String[] { key.substring(0, comma), key.substring(comma + 1) };
  }

  private static void require(Object value, String field) throws SchemaException {
    if (value == null) {
      throw new SchemaException(field, "missing required field");
    }
  }
}
