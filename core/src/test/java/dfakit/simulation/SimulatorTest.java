package dfakit.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dfakit.Acceptor;
import dfakit.Automaton;
import dfakit.AutomatonException;
import dfakit.NoInitialStateException;
import dfakit.SampleAutomata;
import dfakit.Symbol;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SimulatorTest {

  @Test
  void endToEnd() throws NoInitialStateException {
    final Automaton automaton = SampleAutomata.endsInA();

    assertTrue(Simulator.accept(automaton, "a"));
    assertTrue(Simulator.accept(automaton, "ba"));
    assertFalse(Simulator.accept(automaton, "bb"));

    final SimulationTrace trace = Simulator.buildTrace(automaton, "ba");
    assertEquals(
      List.of(new Configuration(0, "q0", 0), new Configuration(1, "q0", 1), new Configuration(2, "q1", 2)),
      trace.configurations()
    );
    assertTrue(trace.accepted());
    assertFalse(trace.isStuck());
  }

  @Test
  void emptyInputAcceptedIffInitialIsFinal() throws AutomatonException {
    final Automaton automaton = SampleAutomata.endsInA();
    assertFalse(Simulator.accept(automaton, ""));

    automaton.setFinal("q0", true);
    assertTrue(Simulator.accept(automaton, ""));
    assertEquals(1, Simulator.buildTrace(automaton, "").size());

    assertTrue(Simulator.accept(SampleAutomata.evenOnes(), ""));
  }

  @Test
  void stuckTrace() throws NoInitialStateException {
    final SimulationTrace trace = Simulator.buildTrace(SampleAutomata.endsInA(), "abcab");

    assertEquals(3, trace.size());
    assertTrue(trace.isStuck());
    assertFalse(trace.accepted());
    assertEquals(Optional.of('c'), trace.stuckSymbol());
    assertEquals("q0", trace.last().state());
    assertEquals(2, trace.last().consumed());
    assertEquals("cab", trace.remaining(trace.size() - 1));
  }

  @Test
  void stuckInFinalStateRejects() throws NoInitialStateException {
    // Stops in q1 (final) with input left over
    assertFalse(Simulator.accept(SampleAutomata.endsInA(), "ac"));
  }

  @Test
  void traceLengthIsConsumedPlusOne() throws NoInitialStateException {
    final Automaton automaton = SampleAutomata.evenOnes();
    for (String input : List.of("", "0", "0110", "01x", "x0", "1x1", "10101")) {
      final SimulationTrace trace = Simulator.buildTrace(automaton, input);
      final int consumed = trace.last().consumed();
      assertTrue(consumed <= input.length());
      assertEquals(consumed + 1, trace.size(), input);
      for (int i = 0; i < trace.size(); i++) {
        assertEquals(i, trace.config(i).step());
        assertEquals(i, trace.config(i).consumed());
      }
    }
  }

  @Test
  void epsilonTransitionsAreNotFollowed() throws AutomatonException {
    final var automaton = new Automaton();
    automaton.addState("s", true, false);
    automaton.addState("f", false, true);
    automaton.addTransition("s", Symbol.EPSILON, "f");

    assertFalse(Simulator.accept(automaton, ""));
    assertTrue(Simulator.buildTrace(automaton, "a").isStuck());
  }

  @Test
  void navigation() throws NoInitialStateException {
    final SimulationTrace trace = Simulator.buildTrace(SampleAutomata.endsInA(), "ab");

    int index = trace.resetIndex();
    assertEquals(0, index);
    assertEquals(0, trace.prev(index));

    index = trace.next(index);
    index = trace.next(index);
    assertEquals(2, index);
    assertEquals(2, trace.next(index));
    assertEquals(1, trace.prev(index));

    // Walking again gives the same configurations
    assertEquals(trace.config(1), trace.config(trace.next(trace.resetIndex())));
  }

  @Test
  void highlight() throws NoInitialStateException {
    final SimulationTrace trace = Simulator.buildTrace(SampleAutomata.endsInA(), "aba");

    assertEquals("[a]ba", trace.highlight(0));
    assertEquals("a[b]a", trace.highlight(1));
    assertEquals("ab[a]", trace.highlight(2));
    assertEquals("aba", trace.highlight(3));
    assertEquals("ba", trace.remaining(1));
  }

  @Test
  void revisionIsRecorded() throws AutomatonException {
    final Automaton automaton = SampleAutomata.endsInA();
    final SimulationTrace trace = Simulator.buildTrace(automaton, "a");
    assertEquals(automaton.revision(), trace.revision());
  }

  @Test
  void noInitialState() throws AutomatonException {
    final Automaton automaton = SampleAutomata.endsInA();
    automaton.removeState("q0");

    assertThrows(NoInitialStateException.class, () -> Simulator.accept(automaton, "a"));
    assertThrows(NoInitialStateException.class, () -> Simulator.buildTrace(automaton, ""));
    assertThrows(NoInitialStateException.class, () -> Simulator.interpreted(automaton));
  }

  @Test
  void interpretedAcceptorUsesSnapshot() throws AutomatonException {
    final Automaton automaton = SampleAutomata.endsInA();
    final Acceptor acceptor = Simulator.interpreted(automaton);
    automaton.setFinal("q0", true);

    assertFalse(acceptor.accepts(""));
    assertTrue(acceptor.accepts(new StringBuilder("bba")));
    assertFalse(acceptor.accepts("abc"));
  }
}
