package dfakit;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TransitionTableTest {

  @Test
  void rowsAndColumns() {
    final TransitionTable table = SampleAutomata.evenOnes().transitionTable();

    assertEquals(List.of(Symbol.of('0'), Symbol.of('1'), Symbol.of('x')), table.symbols());
    assertEquals(3, table.rows().size());
    assertEquals(
      List.of(Optional.of("odd"), Optional.of("even"), Optional.empty()),
      table.rows().get(1).targets()
    );
  }

  @Test
  void render() throws DuplicateStateException {
    final Automaton automaton = SampleAutomata.endsInA();
    automaton.addState("q2", true, true);

    final String expected = String.join("\n",
      "State      | a  | b",
      "q0         | q1 | q0",
      "q1 (F)     | q1 | q0",
      "q2 (I) (F) | -  | -",
      ""
    );
    assertEquals(expected, automaton.transitionTable().render());
  }
}
