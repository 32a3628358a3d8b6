package dfakit.strings;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Splits strings into their substrings, prefixes and suffixes.
 */
public final class SubsequenceAnalyzer {

  private SubsequenceAnalyzer() { }

  /**
   * Decompose a string.
   *
   * <p>A string of length {@code n} has at most {@code n(n+1)/2} distinct
   * non-empty substrings, {@code n} non-empty prefixes and {@code n} non-empty
   * suffixes. The empty string has none of any.
   *
   * @param input string to decompose
   * @return decomposition of the input
   */
  public static Decomposition compute(String input) {
    final int n = input.length();

    final var substrings = new LinkedHashSet<String>();
    for (int start = 0; start < n; start++) {
      for (int end = start + 1; end <= n; end++) {
        substrings.add(input.substring(start, end));
      }
    }

    final var prefixes = new ArrayList<String>(n);
    for (int k = 1; k <= n; k++) {
      prefixes.add(input.substring(0, k));
    }

    final var suffixes = new ArrayList<String>(n);
    for (int k = 0; k < n; k++) {
      suffixes.add(input.substring(k));
    }

    return new Decomposition(input, substrings, prefixes, suffixes);
  }
}
