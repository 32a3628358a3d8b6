package dfakit.strings;

import java.util.List;

/**
 * Bounded enumeration of a Kleene (or positive) closure.
 *
 * @param symbols distinct symbols, in the order they were iterated
 * @param maxLength longest string length included
 * @param includesEmpty whether the empty string is part of the enumeration
 * @param strings strings ordered by length, then by symbol order
 */
public record ClosureEnumeration(
  List<Character> symbols,
  int maxLength,
  boolean includesEmpty,
  List<String> strings
) {

  public ClosureEnumeration {
    symbols = List.copyOf(symbols);
    strings = List.copyOf(strings);
  }

  public int size() {
    return strings.size();
  }

  /**
   * Strings of one length.
   *
   * @param length length to select
   * @return strings of exactly that length, in enumeration order
   */
  public List<String> ofLength(int length) {
    return strings.stream().filter(s -> s.length() == length).toList();
  }
}
