package dfakit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tabular view of a transition function: one row per state, one column per
 * alphabet symbol, and a {@code -} wherever a transition is missing.
 *
 * @param symbols column headers, in alphabet order
 * @param rows one row per state, in state order
 */
public record TransitionTable(List<Symbol> symbols, List<Row> rows) {

  /**
   * Placeholder shown for a missing transition.
   */
  public static final String MISSING = "-";

  /**
   * Row of the table.
   *
   * @param state state whose transitions are listed
   * @param targets target of each column ({@code Optional.empty()} if missing)
   */
  public record Row(State state, List<Optional<String>> targets) { }

  public TransitionTable {
    symbols = List.copyOf(symbols);
    rows = List.copyOf(rows);
  }

  static TransitionTable of(Automaton automaton) {
    final List<Symbol> symbols = List.copyOf(automaton.alphabet());
    final var rows = new ArrayList<Row>();
    for (State state : automaton.states()) {
      final var targets = new ArrayList<Optional<String>>(symbols.size());
      for (Symbol symbol : symbols) {
        targets.add(automaton.target(state.id(), symbol));
      }
      rows.add(new Row(state, List.copyOf(targets)));
    }
    return new TransitionTable(symbols, rows);
  }

  /**
   * Render as aligned plain text.
   *
   * @return table with a header line and one line per state
   */
  public String render() {
    final int columns = symbols.size() + 1;
    final var cells = new ArrayList<List<String>>();

    final var header = new ArrayList<String>(columns);
    header.add("State");
    symbols.forEach(symbol -> header.add(symbol.toString()));
    cells.add(header);

    for (Row row : rows) {
      final var line = new ArrayList<String>(columns);
      line.add(row.state().label());
      row.targets().forEach(target -> line.add(target.orElse(MISSING)));
      cells.add(line);
    }

    final int[] widths = new int[columns];
    for (List<String> line : cells) {
      for (int i = 0; i < columns; i++) {
        widths[i] = Math.max(widths[i], line.get(i).length());
      }
    }

    final var builder = new StringBuilder();
    for (List<String> line : cells) {
      for (int i = 0; i < columns; i++) {
        if (i > 0) {
          builder.append(" | ");
        }
        builder.append(line.get(i));
        if (i < columns - 1) {
          builder.append(" ".repeat(widths[i] - line.get(i).length()));
        }
      }
      builder.append('\n');
    }
    return builder.toString();
  }
}
