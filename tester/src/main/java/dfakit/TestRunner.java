package dfakit;

import dfakit.simulation.SimulationTrace;
import java.util.function.Consumer;

/**
 * Charged with running test cases.
 */
public class TestRunner implements Consumer<TestCase> {

  /**
   * Expected output of cases where loading or running must fail.
   */
  static final String ERROR_OUTPUT = "error";

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  /**
   * Workbench into which each case's automaton is loaded.
   */
  final Workbench workbench;

  public TestRunner(TestReporter reporter, Workbench workbench) {
    this.reporter = reporter;
    this.workbench = workbench;
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {

    // Load the automaton and run it
    final SimulationTrace trace;
    try {
      workbench.load(testCase.automatonPath);
      trace = workbench.validateString(testCase.input);
    } catch (Exception error) {
      if (testCase.output.equals(ERROR_OUTPUT)) {
        reporter.onSuccess(testCase, true);
      } else {
        reporter.onAutomatonError(testCase, error);
      }
      return;
    }

    // Compare the outputs
    final String foundOutput = TestCase.createOutput(trace);
    if (testCase.output.equals(foundOutput)) {
      reporter.onSuccess(testCase, false);
    } else {
      reporter.onUnexpectedOutput(testCase, foundOutput);
    }
  }
}
