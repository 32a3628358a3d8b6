package dfakit;

interface TestReporter {

  /**
   * Handler for when an automaton (unexpectedly) fails to load or run.
   *
   * @param testCase test which failed
   * @param error exception that was thrown
   */
  public void onAutomatonError(TestCase testCase, Exception error);

  /**
   * Handler for when the run output does not match the expected output.
   *
   * @param testCase test which failed
   * @param foundOutput output which was found
   */
  public void onUnexpectedOutput(TestCase testCase, String foundOutput);

  /**
   * Handler for a test passing.
   *
   * @param testCase test which passed
   * @param expectedFailure the successful behaviour was an error
   */
  public void onSuccess(TestCase testCase, boolean expectedFailure);
}
