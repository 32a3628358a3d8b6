package dfakit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestRunnerTest {

  /**
   * Reporter which remembers every outcome.
   */
  static final class RecordingReporter implements TestReporter {
    final List<String> successes = new ArrayList<>();
    final List<String> expectedFailures = new ArrayList<>();
    final List<String> unexpectedOutputs = new ArrayList<>();
    final List<Exception> errors = new ArrayList<>();

    @Override
    public void onAutomatonError(TestCase testCase, Exception error) {
      errors.add(error);
    }

    @Override
    public void onUnexpectedOutput(TestCase testCase, String foundOutput) {
      unexpectedOutputs.add(foundOutput);
    }

    @Override
    public void onSuccess(TestCase testCase, boolean expectedFailure) {
      (expectedFailure ? expectedFailures : successes).add(testCase.input);
    }
  }

  static Path resource(String name) throws URISyntaxException {
    return Path.of(TestRunnerTest.class.getResource(name).toURI());
  }

  @Test
  void passingFile() throws Exception {
    final var reporter = new RecordingReporter();
    FileTesterMain.processFileOfTests(FileTesterMain.newRunner(reporter), resource("/cases/ends-in-a.txt"));

    assertEquals(List.of("a", "ba", "bb", "", "acb", "aa"), reporter.successes);
    assertEquals(List.of("a", "a"), reporter.expectedFailures);
    assertTrue(reporter.unexpectedOutputs.isEmpty());
    assertTrue(reporter.errors.isEmpty());
  }

  @Test
  void failingFile() throws Exception {
    final var reporter = new RecordingReporter();
    FileTesterMain.processFileOfTests(FileTesterMain.newRunner(reporter), resource("/cases/wrong-expectation.txt"));

    assertEquals(List.of("false q0 1", "true q1 1"), reporter.unexpectedOutputs);
    assertTrue(reporter.successes.isEmpty());
  }

  @Test
  void unexpectedLoadError() throws Exception {
    final var reporter = new RecordingReporter();
    final Path automaton = resource("/cases/automata/nondeterministic.jff");
    final var testCase = new TestCase(automaton, "a", "true q0 1", automaton, 1);

    new TestRunner(reporter, new Workbench()).accept(testCase);

    assertEquals(1, reporter.errors.size());
    assertTrue(reporter.errors.get(0) instanceof NonDeterministicTransitionException);
  }
}
