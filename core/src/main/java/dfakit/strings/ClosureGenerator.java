package dfakit.strings;

import dfakit.ResourceLimitException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the strings of bounded length over a set of symbols.
 *
 * <p>The output grows as {@code |symbols|^maxLength}, so every request is
 * sized up front and refused with {@link ResourceLimitException} when it
 * would produce more than {@link #maxStrings()} strings. Nothing is
 * allocated for a refused request.
 */
public final class ClosureGenerator {

  private static final Logger LOG = LoggerFactory.getLogger(ClosureGenerator.class);

  /**
   * Default ceiling on the number of generated strings.
   */
  public static final long DEFAULT_MAX_STRINGS = 100_000L;

  private static final int MAX_PREALLOCATED = 1 << 16;

  private final long maxStrings;

  public ClosureGenerator() {
    this(DEFAULT_MAX_STRINGS);
  }

  /**
   * @param maxStrings largest enumeration this generator agrees to produce
   */
  public ClosureGenerator(long maxStrings) {
    if (maxStrings < 1) {
      throw new IllegalArgumentException("Ceiling must be positive, got " + maxStrings);
    }
    this.maxStrings = maxStrings;
  }

  public long maxStrings() {
    return maxStrings;
  }

  /**
   * Kleene closure up to some length (includes the empty string).
   *
   * @see #generate(CharSequence, int, boolean)
   */
  public ClosureEnumeration kleene(CharSequence symbols, int maxLength) throws ResourceLimitException {
    return generate(symbols, maxLength, true);
  }

  /**
   * Positive closure up to some length (excludes the empty string).
   *
   * @see #generate(CharSequence, int, boolean)
   */
  public ClosureEnumeration positive(CharSequence symbols, int maxLength) throws ResourceLimitException {
    return generate(symbols, maxLength, false);
  }

  /**
   * Enumerate all strings of length at most {@code maxLength}.
   *
   * <p>Repeated characters in {@code symbols} count once and whitespace is
   * ignored. Strings come out by increasing length; each length is obtained
   * by appending every symbol, in order, to every string of the previous
   * length.
   *
   * @param symbols characters making up the alphabet
   * @param maxLength longest string to generate (non-negative)
   * @param includeEmpty whether to include the empty string
   * @return the enumeration
   * @throws ResourceLimitException if the output would exceed the ceiling
   */
  public ClosureEnumeration generate(
    CharSequence symbols,
    int maxLength,
    boolean includeEmpty
  ) throws ResourceLimitException {
    if (maxLength < 0) {
      throw new IllegalArgumentException("Maximum length must not be negative, got " + maxLength);
    }
    final List<Character> distinct = distinctSymbols(symbols);

    final long projected = projectedSize(distinct.size(), maxLength, includeEmpty);
    if (projected > maxStrings) {
      LOG.warn("Refusing closure of {} symbol(s) up to length {}: {} strings over the ceiling of {}",
        distinct.size(), maxLength, projected, maxStrings);
      throw new ResourceLimitException(projected, maxStrings);
    }

    final var strings = new ArrayList<String>(initialCapacity(projected));
    List<String> level = List.of("");
    if (includeEmpty) {
      strings.add("");
    }
    for (int length = 1; length <= maxLength && !distinct.isEmpty(); length++) {
      final var nextLevel = new ArrayList<String>(initialCapacity((long) level.size() * distinct.size()));
      for (String prefix : level) {
        for (char symbol : distinct) {
          nextLevel.add(prefix + symbol);
        }
      }
      strings.addAll(nextLevel);
      level = nextLevel;
    }

    LOG.debug("Generated {} string(s) over {} up to length {}", strings.size(), distinct, maxLength);
    return new ClosureEnumeration(distinct, maxLength, includeEmpty, strings);
  }

  /**
   * Number of strings a closure enumeration would hold.
   *
   * @param symbolCount number of distinct symbols
   * @param maxLength longest string length
   * @param includeEmpty whether the empty string counts
   * @return {@code sum(symbolCount^L)} over the lengths, saturated at {@code Long.MAX_VALUE}
   */
  public static long projectedSize(int symbolCount, int maxLength, boolean includeEmpty) {
    long total = includeEmpty ? 1 : 0;
    if (symbolCount == 1) {
      return total + maxLength;
    }
    long levelSize = 1;
    for (int length = 1; length <= maxLength && symbolCount > 0; length++) {
      if (levelSize > Long.MAX_VALUE / symbolCount) {
        return Long.MAX_VALUE;
      }
      levelSize *= symbolCount;
      if (total > Long.MAX_VALUE - levelSize) {
        return Long.MAX_VALUE;
      }
      total += levelSize;
    }
    return total;
  }

  /**
   * Capacity to preallocate for a list expected to grow to some size (large
   * lists grow on demand).
   */
  static int initialCapacity(long expectedSize) {
    return (int) Math.min(expectedSize, MAX_PREALLOCATED);
  }

  private static List<Character> distinctSymbols(CharSequence symbols) {
    final var distinct = new LinkedHashSet<Character>();
    for (int i = 0; i < symbols.length(); i++) {
      final char c = symbols.charAt(i);
      if (!Character.isWhitespace(c)) {
        distinct.add(c);
      }
    }
    return List.copyOf(distinct);
  }
}
