package dfakit;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Processes `.txt` files that encode automaton test cases.
  *
  * Each case is three lines: the automaton file (relative to the test file),
  * the input string and the expected output ({@code true|false <state> <consumed>}
  * or {@code error}).
  */
class FileTesterMain {

  private static final Logger LOG = LoggerFactory.getLogger(FileTesterMain.class);

  static int successes = 0;
  static int failures = 0;

  public static void main(String[] testFiles) throws IOException {

    // Console reporter - writes its output through the logger
    final var consoleReporter = new TestReporter() {
      @Override
      public void onAutomatonError(TestCase testCase, Exception error) {
        LOG.error("Unexpected error running {}: {}", testCase.getSummary(), error.getMessage());
        FileTesterMain.failures++;
      }

      @Override
      public void onUnexpectedOutput(TestCase testCase, String foundOutput) {
        LOG.error("Unexpected output running {}: expected '{}' but got '{}'",
          testCase.getSummary(), testCase.output, foundOutput);
        FileTesterMain.failures++;
      }

      @Override
      public void onSuccess(TestCase testCase, boolean expectedFailure) {
        FileTesterMain.successes++;
      }
    };

    final var runner = newRunner(consoleReporter);
    for (String testFile : testFiles) {
      processFileOfTests(runner, Path.of(testFile));
    }

    System.err.println();
    System.err.println("PASSED: " + successes + ", FAILED: " + failures);
  }

  /**
   * Runner loading every case into one fresh workbench.
   *
   * @param reporter where outcomes go
   * @return test runner
   */
  static TestRunner newRunner(TestReporter reporter) {
    return new TestRunner(reporter, new Workbench());
  }

  /**
   * Process all of the tests inside a test file.
   *
   * @param runner test runner
   * @param testFile filepath to the tests
   */
  public static void processFileOfTests(TestRunner runner, Path testFile) throws IOException {
    try (var reader = new TestFileReader(testFile)) {
      reader.forEachTestCase(runner);
    } catch (NoSuchFileException err) {
      LOG.error("Failed to open file {}: {}", testFile, err.getMessage());
    }
  }
}
