package dfakit.io;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of a native ({@code .afd}) automaton file.
 *
 * <pre>
 * {
 *   "alphabet": ["a", "b"],
 *   "states": ["q0", "q1"],
 *   "initial_state": "q0",
 *   "final_states": ["q1"],
 *   "transitions": { "q0,a": "q1", "q1,b": "q0" }
 * }
 * </pre>
 *
 * <p>Fields are left {@code null} when absent so that the loader can report
 * exactly which one is missing.
 */
@JsonPropertyOrder({ "alphabet", "states", "initial_state", "final_states", "transitions" })
final class NativeDocument {

  @JsonProperty("alphabet")
  List<String> alphabet;

  @JsonProperty("states")
  List<String> states;

  @JsonProperty("initial_state")
  String initialState;

  @JsonProperty("final_states")
  List<String> finalStates;

  @JsonProperty("transitions")
  TransitionEntries transitions;

  NativeDocument() { }

  /**
   * The {@code "state,symbol" -> target} object.
   *
   * <p>Entries go through {@link #put} one by one, which is how repeated keys
   * (only possible in a corrupted file) are noticed. The last value wins.
   */
  static final class TransitionEntries {

    private final Map<String, String> entries = new LinkedHashMap<>();

    private final List<String> duplicateKeys = new ArrayList<>();

    @JsonAnySetter
    public void put(String key, String target) {
      if (entries.containsKey(key)) {
        duplicateKeys.add(key);
      }
      entries.put(key, target);
    }

    @JsonAnyGetter
    public Map<String, String> entries() {
      return entries;
    }

    List<String> duplicateKeys() {
      return duplicateKeys;
    }
  }
}
