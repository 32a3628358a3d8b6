package dfakit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dfakit.simulation.SimulationTrace;
import dfakit.strings.ClosureGenerator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkbenchTest {

  @TempDir
  Path directory;

  private Workbench loaded() throws IOException, AutomatonException {
    final Path file = directory.resolve("ends-in-a.afd");
    try (var in = getClass().getResourceAsStream("/automata/ends-in-a.afd")) {
      Files.write(file, in.readAllBytes());
    }
    final var workbench = new Workbench();
    workbench.load(file);
    return workbench;
  }

  @Test
  void failedLoadKeepsModel() throws IOException, AutomatonException {
    final Workbench workbench = loaded();
    final Automaton before = workbench.automaton();
    workbench.validateString("ba");

    final Path broken = Files.writeString(directory.resolve("broken.afd"), "{\"alphabet\": []}", StandardCharsets.UTF_8);
    assertThrows(SchemaException.class, () -> workbench.load(broken));
    final Path nonDeterministic = directory.resolve("nd.jff");
    try (var in = getClass().getResourceAsStream("/automata/nondeterministic.jff")) {
      Files.write(nonDeterministic, in.readAllBytes());
    }
    assertThrows(NonDeterministicTransitionException.class, () -> workbench.load(nonDeterministic));

    assertEquals(before, workbench.automaton());
    assertEquals(SampleAutomata.endsInA().transitionTable(), workbench.automaton().transitionTable());
    assertTrue(workbench.currentTrace().isPresent());
  }

  @Test
  void traceIsDroppedOnEdit() throws IOException, AutomatonException {
    final Workbench workbench = loaded();
    final SimulationTrace trace = workbench.validateString("ba");
    assertTrue(trace.accepted());
    assertEquals(Optional.of(trace), workbench.currentTrace());

    workbench.automaton().setFinal("q0", true);
    assertEquals(Optional.empty(), workbench.currentTrace());
  }

  @Test
  void resetClearsEverything() throws IOException, AutomatonException {
    final Workbench workbench = loaded();
    workbench.validateString("a");
    workbench.reset();

    assertTrue(workbench.automaton().isEmpty());
    assertEquals(Optional.empty(), workbench.currentTrace());
    assertThrows(NoInitialStateException.class, () -> workbench.validateString("a"));
  }

  @Test
  void saveWritesNativeFile() throws IOException, AutomatonException {
    final Workbench workbench = loaded();
    final Path target = directory.resolve("copy.afd");
    workbench.save(target);

    final var other = new Workbench();
    other.load(target);
    assertEquals(workbench.automaton().transitionTable(), other.automaton().transitionTable());

    workbench.reset();
    assertThrows(InvalidAutomatonException.class, () -> workbench.save(directory.resolve("empty.afd")));
  }

  @Test
  void stringTools() throws ResourceLimitException {
    final var workbench = new Workbench(new ClosureGenerator(3));

    assertEquals(List.of("", "a", "aa"), workbench.closure("a", 2, true).strings());
    assertThrows(ResourceLimitException.class, () -> workbench.closure("ab", 2, true));
    assertEquals(List.of("ab", "b"), workbench.decompose("ab").suffixes());
  }
}
