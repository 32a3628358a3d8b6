package dfakit.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dfakit.Automaton;
import dfakit.AutomatonException;
import dfakit.SampleAutomata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AutomatonFilesTest {

  @TempDir
  Path directory;

  @Test
  void saveThenLoad() throws IOException, AutomatonException {
    final Path file = directory.resolve("model.afd");
    AutomatonFiles.save(file, SampleAutomata.evenOnes());

    final Automaton loaded = AutomatonFiles.load(file);
    assertEquals(SampleAutomata.evenOnes().transitionTable(), loaded.transitionTable());
  }

  @Test
  void jflapByExtension() throws IOException, AutomatonException {
    final Path file = directory.resolve("MODEL.JFF");
    Files.write(file, JflapFormatTest.resource("/automata/ends-in-a.jff"));

    assertEquals(SampleAutomata.endsInA().transitionTable(), AutomatonFiles.load(file).transitionTable());
  }

  @Test
  void unknownExtension() throws IOException {
    final Path file = Files.writeString(directory.resolve("model.txt"), "{}");
    assertThrows(IllegalArgumentException.class, () -> AutomatonFiles.load(file));
  }

  @Test
  void missingFile() {
    assertThrows(NoSuchFileException.class, () -> AutomatonFiles.load(directory.resolve("absent.afd")));
  }
}
