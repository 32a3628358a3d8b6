package dfakit;

/**
 * Input symbol of an automaton.
 *
 * <p>A symbol is either a single character or the distinguished
 * {@link #EPSILON} symbol, which reads no input. Epsilon transitions only
 * arrive through file formats that allow them; the simulator never follows
 * them and {@link Automaton#validate()} reports them.
 *
 * @param character the character read, or {@code null} for epsilon
 */
public record Symbol(Character character) implements Comparable<Symbol> {

  /**
   * Empty (lambda) symbol.
   */
  public static final Symbol EPSILON = new Symbol(null);

  public static Symbol of(char character) {
    return new Symbol(character);
  }

  /**
   * Parse the textual form of a symbol.
   *
   * @param text empty for epsilon, otherwise exactly one character
   * @return parsed symbol
   * @throws IllegalArgumentException if the text has more than one character
   */
  public static Symbol parse(String text) {
    if (text == null || text.isEmpty()) {
      return EPSILON;
    } else if (text.length() == 1) {
      return of(text.charAt(0));
    }
    throw new IllegalArgumentException("Symbol must be a single character, got '" + text + "'");
  }

  public boolean isEpsilon() {
    return character == null;
  }

  /**
   * Does this symbol read the given character?
   *
   * @param c input character
   * @return whether a transition on this symbol consumes {@code c}
   */
  public boolean reads(char c) {
    return character != null && character == c;
  }

  // Epsilon sorts first, everything else by code unit
  @Override
  public int compareTo(Symbol other) {
    if (isEpsilon() || other.isEpsilon()) {
      return Boolean.compare(!isEpsilon(), !other.isEpsilon());
    }
    return Character.compare(character, other.character);
  }

  /**
   * Textual form, as written in files: empty for epsilon.
   */
  @Override
  public String toString() {
    return isEpsilon() ? "" : character.toString();
  }
}
