package dfakit.io;

import dfakit.Automaton;
import dfakit.AutomatonException;
import dfakit.AutomatonParseException;
import dfakit.SchemaException;
import dfakit.Symbol;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Loader for finite automata saved by JFLAP ({@code .jff} files).
 *
 * <pre>
 * &lt;structure&gt;
 *   &lt;type&gt;fa&lt;/type&gt;
 *   &lt;automaton&gt;
 *     &lt;state id="0" name="q0"&gt;&lt;initial/&gt;&lt;/state&gt;
 *     &lt;state id="1" name="q1"&gt;&lt;final/&gt;&lt;/state&gt;
 *     &lt;transition&gt;&lt;from&gt;0&lt;/from&gt;&lt;to&gt;1&lt;/to&gt;&lt;read&gt;a&lt;/read&gt;&lt;/transition&gt;
 *   &lt;/automaton&gt;
 * &lt;/structure&gt;
 * </pre>
 *
 * <p>JFLAP happily stores non-deterministic automata. Transitions are replayed
 * through {@link Automaton#addTransition}, so the first pair of transitions
 * leaving a state on the same symbol for different targets rejects the whole
 * file with {@link dfakit.NonDeterministicTransitionException}. A missing or
 * empty {@code read} element is an epsilon transition.
 *
 * <p>States are named after their {@code name} attribute, falling back to
 * their {@code id}.
 */
public final class JflapFormat {

  private static final Logger LOG = LoggerFactory.getLogger(JflapFormat.class);

  static final String FORMAT = "JFLAP XML";

  private static final String FINITE_AUTOMATON_TYPE = "fa";

  private JflapFormat() { }

  /**
   * Deserialize a JFLAP finite automaton.
   *
   * @param bytes XML document
   * @return freshly built automaton
   * @throws AutomatonParseException if the input is not well-formed XML
   * @throws SchemaException if required elements or attributes are missing or inconsistent
   * @throws AutomatonException if the automaton itself breaks an invariant
   *   (duplicate state names, non-deterministic transitions)
   */
  public static Automaton load(byte[] bytes) throws AutomatonException {
    final Element root = parse(bytes).getDocumentElement();

    final Optional<Element> type = firstChild(root, "type");
    if (type.isPresent() && !FINITE_AUTOMATON_TYPE.equals(type.get().getTextContent().trim())) {
      throw new SchemaException("type", "expected '" + FINITE_AUTOMATON_TYPE + "', found '"
        + type.get().getTextContent().trim() + "'");
    }

    final var automaton = new Automaton();

    // JFLAP ids are internal; the automaton is keyed on names
    final Map<String, String> idToName = new HashMap<>();
    final NodeList states = root.getElementsByTagName("state");
    for (int i = 0; i < states.getLength(); i++) {
      final var state = (Element) states.item(i);
      final String id = state.getAttribute("id");
      if (id.isEmpty()) {
        throw new SchemaException("state.id", "state #" + i + " has no id");
      }
      final String name = state.hasAttribute("name") ? state.getAttribute("name") : id;
      if (name.isBlank()) {
        throw new SchemaException("state.name", "state '" + id + "' has a blank name");
      }
      if (idToName.putIfAbsent(id, name) != null) {
        throw new SchemaException("state.id", "id '" + id + "' is used by more than one state");
      }

      final boolean initial = firstChild(state, "initial").isPresent();
      final boolean accepting = firstChild(state, "final").isPresent();
      if (initial && automaton.initialState().isPresent()) {
        LOG.warn("Several initial states, '{}' replaces '{}'", name, automaton.initialState().get());
      }
      automaton.addState(name, initial, accepting);
    }

    final NodeList transitions = root.getElementsByTagName("transition");
    for (int i = 0; i < transitions.getLength(); i++) {
      final var transition = (Element) transitions.item(i);
      final String from = stateName(idToName, transition, "from", i);
      final String to = stateName(idToName, transition, "to", i);
      final String read = firstChild(transition, "read").map(Element::getTextContent).orElse("");
      if (read.length() > 1) {
        throw new SchemaException("transition.read", "transition #" + i + " reads '" + read
          + "', only single characters are supported");
      }

      automaton.addTransition(from, Symbol.parse(read), to);
    }

    LOG.info("Loaded {} automaton with {} state(s) and {} transition(s)",
      FORMAT, automaton.stateIds().size(), automaton.transitions().size());
    return automaton;
  }

  private static String stateName(
    Map<String, String> idToName,
    Element transition,
    String endpoint,
    int index
  ) throws SchemaException {
    final String id = firstChild(transition, endpoint)
      .map(element -> element.getTextContent().trim())
      .filter(text -> !text.isEmpty())
      .orElseThrow(() -> new SchemaException("transition." + endpoint, "transition #" + index + " has no " + endpoint));
    final String name = idToName.get(id);
    if (name == null) {
      throw new SchemaException("transition." + endpoint, "transition #" + index + " refers to unknown state id '" + id + "'");
    }
    return name;
  }

  private static Optional<Element> firstChild(Element parent, String tagName) {
    for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE && tagName.equals(child.getNodeName())) {
        return Optional.of((Element) child);
      }
    }
    return Optional.empty();
  }

  private static Document parse(byte[] bytes) throws AutomatonParseException {
    final DocumentBuilder builder;
    try {
      final var factory = DocumentBuilderFactory.newInstance();
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      builder = factory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
    builder.setErrorHandler(new ErrorHandler() {
      @Override
      public void warning(SAXParseException e) {
        LOG.warn("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
      }

      @Override
      public void error(SAXParseException e) throws SAXException {
        throw e;
      }

      @Override
      public void fatalError(SAXParseException e) throws SAXException {
        throw e;
      }
    });

    try {
      return builder.parse(new ByteArrayInputStream(bytes));
    } catch (SAXException e) {
      throw new AutomatonParseException(FORMAT, e.getMessage(), e);
    } catch (IOException e) {
      throw new AutomatonParseException(FORMAT, e.getMessage(), e);
    }
  }
}
