package dfakit;

import dfakit.simulation.SimulationTrace;
import java.nio.file.Path;

/**
 * Test case in a test file.
 */
public class TestCase {

  /**
   * Automaton file, already resolved against the directory of the test file.
   */
  public final Path automatonPath;

  /**
   * Input string to feed to the automaton.
   */
  public final String input;

  /**
   * Expected output.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final Path filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    Path automatonPath,
    String input,
    String output,
    Path filePath,
    int lineNumber
  ) {
    this.automatonPath = automatonPath;
    this.input = input;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Construct an output string from a run: the verdict, the state the run
   * ended in and how many characters were read.
   *
   * @param trace trace of the run
   * @return output string, eg. {@code true q1 2}
   */
  public static String createOutput(SimulationTrace trace) {
    return trace.accepted() + " " + trace.last().state() + " " + trace.last().consumed();
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return automatonPath.getFileName() + " on '" + input + "' (at " + filePath + ":" + lineNumber + ")";
  }
}
