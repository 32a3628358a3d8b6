package dfakit.strings;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Substrings, prefixes and suffixes of a string.
 *
 * @param input decomposed string
 * @param substrings distinct non-empty substrings, by start index then length
 * @param prefixes non-empty prefixes, shortest first
 * @param suffixes non-empty suffixes, longest first
 */
public record Decomposition(
  String input,
  Set<String> substrings,
  List<String> prefixes,
  List<String> suffixes
) {

  public Decomposition {
    substrings = Collections.unmodifiableSet(new LinkedHashSet<>(substrings));
    prefixes = List.copyOf(prefixes);
    suffixes = List.copyOf(suffixes);
  }
}
