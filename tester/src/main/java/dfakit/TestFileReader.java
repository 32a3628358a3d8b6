package dfakit;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Skips over comment lines, processes escape sequences.
 */
public class TestFileReader implements Closeable {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  /**
   * Input line standing for the empty string (an empty line is skipped).
   */
  static final String EMPTY_INPUT = "<empty>";

  private final BufferedReader reader;

  private final Path filePath;

  private int lineNumber = 0;

  public TestFileReader(Path filePath) throws IOException {
    this.reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8);
    this.filePath = filePath;
  }

  /**
   * Read the next processed line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      } else if (line.startsWith("//") || line.isEmpty()) {
        continue; // Not a valid line
      }

      line = processLineEscapes(line);
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   *
   * @return next test case, or {@code null} at the end of the file
   * @throws IOException if reading fails or the file ends in the middle of a case
   */
  public TestCase readTestCase() throws IOException {

    // Test data
    final String automatonFile = readLine();
    if (automatonFile == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String input = readLine();
    final String outputData = readLine();
    if (input == null || outputData == null) {
      throw new IOException("Truncated test case at " + filePath + ":" + lineNumber);
    }

    final Path directory = filePath.toAbsolutePath().getParent();
    return new TestCase(
      directory.resolve(automatonFile),
      input.equals(EMPTY_INPUT) ? "" : input,
      outputData.trim(),
      filePath,
      lineNumber
    );
  }

  /**
   * Run an action for every remaining test case in the file.
   *
   * @param action action to run on each test case
   */
  public void forEachTestCase(Consumer<? super TestCase> action) throws IOException {
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      action.accept(testCase);
    }
  }

  public int getLineNumber() {
    return lineNumber;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  /**
   * Process a line to replace some escape sequences with the actual characters
   *
   * @param line line to escape
   * @return escaped line
   */
  static String processLineEscapes(String line) {

    // process newline escapes
    line = line.replace("\\n", "\n");

    // process unicode escapes
    line = UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Character.toString((char) Integer.parseInt(result.group(1), 16))
    );

    return line;
  }
}
