package dfakit.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dfakit.Automaton;
import dfakit.AutomatonException;
import dfakit.AutomatonParseException;
import dfakit.InvalidAutomatonException;
import dfakit.SampleAutomata;
import dfakit.SchemaException;
import dfakit.Symbol;
import dfakit.ValidationError;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NativeFormatTest {

  static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  static void assertSameDefinition(Automaton expected, Automaton actual) {
    assertEquals(expected.alphabet(), actual.alphabet());
    assertEquals(expected.stateIds(), actual.stateIds());
    assertEquals(expected.initialState(), actual.initialState());
    assertEquals(expected.finalStates(), actual.finalStates());
    assertEquals(expected.transitionTable(), actual.transitionTable());
  }

  @Test
  void roundTrip() throws AutomatonException {
    for (Automaton automaton : List.of(SampleAutomata.endsInA(), SampleAutomata.evenOnes())) {
      assertSameDefinition(automaton, NativeFormat.load(NativeFormat.save(automaton)));
    }
  }

  @Test
  void roundTripKeepsUnusedSymbolsAndCommas() throws AutomatonException {
    final Automaton automaton = SampleAutomata.endsInA();
    automaton.addSymbol(Symbol.of('z'));
    automaton.addTransition("q1", ',', "q1");

    final Automaton loaded = NativeFormat.load(NativeFormat.save(automaton));
    assertSameDefinition(automaton, loaded);
    assertEquals(Optional.of("q1"), loaded.target("q1", Symbol.of(',')));
  }

  @Test
  void fixture() throws IOException, AutomatonException {
    final byte[] bytes;
    try (InputStream in = getClass().getResourceAsStream("/automata/ends-in-a.afd")) {
      bytes = in.readAllBytes();
    }
    assertSameDefinition(SampleAutomata.endsInA(), NativeFormat.load(bytes));
  }

  @Test
  void savedDocumentShape() throws InvalidAutomatonException {
    final String json = new String(NativeFormat.save(SampleAutomata.endsInA()), StandardCharsets.UTF_8);

    assertTrue(json.contains("\"initial_state\" : \"q0\""), json);
    assertTrue(json.contains("\"final_states\" : [ \"q1\" ]"), json);
    assertTrue(json.contains("\"q0,a\" : \"q1\""), json);
    assertTrue(json.indexOf("\"alphabet\"") < json.indexOf("\"transitions\""), json);
  }

  @Test
  void refusesInvalidAutomaton() throws AutomatonException {
    final Automaton automaton = SampleAutomata.endsInA();
    automaton.addTransition("q0", Symbol.EPSILON, "q1");

    final var error = assertThrows(InvalidAutomatonException.class, () -> NativeFormat.save(automaton));
    assertEquals(ValidationError.Kind.EPSILON_TRANSITION, error.errors.get(0).kind());
    assertThrows(InvalidAutomatonException.class, () -> NativeFormat.save(new Automaton()));
  }

  @Test
  void malformedJson() {
    assertThrows(AutomatonParseException.class, () -> NativeFormat.load(utf8("{\"alphabet\": [")));
    assertThrows(AutomatonParseException.class, () -> NativeFormat.load(utf8("   ")));
    assertThrows(AutomatonParseException.class, () -> NativeFormat.load(utf8("not json")));
    assertThrows(AutomatonParseException.class, () -> NativeFormat.load(utf8(
      "{\"alphabet\": [\"a\"], \"states\": [\"q0\", \"q1\"")));
  }

  @Test
  void trailingContent() {
    final String valid = "{\"alphabet\": [], \"states\": [\"q0\"], \"initial_state\": \"q0\","
      + " \"final_states\": [], \"transitions\": {}}";

    assertThrows(AutomatonParseException.class, () -> NativeFormat.load(utf8(valid + " this is not json")));
    assertThrows(AutomatonParseException.class, () -> NativeFormat.load(utf8(valid + " {}")));
  }

  @Test
  void missingField() {
    final var error = assertThrows(SchemaException.class, () -> NativeFormat.load(utf8(
      "{\"alphabet\": [\"a\"], \"states\": [\"q0\"], \"final_states\": [], \"transitions\": {}}"
    )));
    assertEquals("initial_state", error.field);
  }

  @Test
  void wrongFieldType() {
    final var error = assertThrows(SchemaException.class, () -> NativeFormat.load(utf8(
      "{\"alphabet\": [\"a\"], \"states\": {\"q0\": 1}, \"initial_state\": \"q0\","
        + " \"final_states\": [], \"transitions\": {}}"
    )));
    assertEquals("states", error.field);
  }

  @Test
  void inconsistentReferences() {
    final String template = "{\"alphabet\": [\"a\"], \"states\": [\"q0\"], \"initial_state\": \"%s\","
      + " \"final_states\": [%s], \"transitions\": {%s}}";

    assertEquals("initial_state", assertThrows(SchemaException.class,
      () -> NativeFormat.load(utf8(String.format(template, "q9", "", "")))).field);
    assertEquals("final_states", assertThrows(SchemaException.class,
      () -> NativeFormat.load(utf8(String.format(template, "q0", "\"q9\"", "")))).field);
    assertEquals("transitions", assertThrows(SchemaException.class,
      () -> NativeFormat.load(utf8(String.format(template, "q0", "", "\"q0,a\": \"q9\"")))).field);
    assertEquals("transitions", assertThrows(SchemaException.class,
      () -> NativeFormat.load(utf8(String.format(template, "q0", "", "\"q0a\": \"q0\"")))).field);
    assertEquals("transitions", assertThrows(SchemaException.class,
      () -> NativeFormat.load(utf8(String.format(template, "q0", "", "\"q0,ab\": \"q0\"")))).field);
  }

  @Test
  void duplicateStates() {
    final var error = assertThrows(SchemaException.class, () -> NativeFormat.load(utf8(
      "{\"alphabet\": [], \"states\": [\"q0\", \"q0\"], \"initial_state\": \"q0\","
        + " \"final_states\": [], \"transitions\": {}}"
    )));
    assertEquals("states", error.field);
  }

  @Test
  void duplicateTransitionKeyKeepsLast() throws AutomatonException {
    final Automaton automaton = NativeFormat.load(utf8(
      "{\"alphabet\": [\"a\"], \"states\": [\"q0\", \"q1\"], \"initial_state\": \"q0\","
        + " \"final_states\": [\"q1\"], \"transitions\": {\"q0,a\": \"q0\", \"q0,a\": \"q1\"}}"
    ));
    assertEquals(Optional.of("q1"), automaton.target("q0", Symbol.of('a')));
    assertEquals(1, automaton.transitions().size());
  }

  @Test
  void emptyInitialState() throws AutomatonException {
    final Automaton automaton = NativeFormat.load(utf8(
      "{\"alphabet\": [], \"states\": [\"q0\"], \"initial_state\": \"\","
        + " \"final_states\": [\"q0\"], \"transitions\": {}, \"layout\": {}}"
    ));
    assertEquals(Optional.empty(), automaton.initialState());
    assertEquals(Set.of("q0"), automaton.finalStates());
  }
}
