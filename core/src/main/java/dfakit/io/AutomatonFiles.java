package dfakit.io;

import dfakit.Automaton;
import dfakit.AutomatonException;
import dfakit.InvalidAutomatonException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes automaton files, picking the format from the extension.
 */
public final class AutomatonFiles {

  private static final Logger LOG = LoggerFactory.getLogger(AutomatonFiles.class);

  /**
   * Extension of native JSON files.
   */
  public static final String NATIVE_EXTENSION = ".afd";

  /**
   * Extension of JFLAP files.
   */
  public static final String JFLAP_EXTENSION = ".jff";

  private AutomatonFiles() { }

  /**
   * Load an automaton.
   *
   * @param path {@code .afd} or {@code .jff} file
   * @return freshly built automaton
   * @throws IOException if the file cannot be read
   * @throws AutomatonException if the content is not a valid automaton
   * @throws IllegalArgumentException if the extension is not recognized
   */
  public static Automaton load(Path path) throws IOException, AutomatonException {
    final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(NATIVE_EXTENSION)) {
      return NativeFormat.load(Files.readAllBytes(path));
    } else if (name.endsWith(JFLAP_EXTENSION)) {
      return JflapFormat.load(Files.readAllBytes(path));
    }
    throw new IllegalArgumentException("Unsupported automaton file '" + path + "' (expected "
      + NATIVE_EXTENSION + " or " + JFLAP_EXTENSION + ")");
  }

  /**
   * Save an automaton in the native format.
   *
   * @param path destination file (replaced if it exists)
   * @param automaton automaton to save
   * @throws IOException if the file cannot be written
   * @throws InvalidAutomatonException if the automaton does not validate
   */
  public static void save(Path path, Automaton automaton) throws IOException, InvalidAutomatonException {
    final byte[] bytes = NativeFormat.save(automaton);
    Files.write(path, bytes);
    LOG.info("Saved automaton to {}", path);
  }
}
