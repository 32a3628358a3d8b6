package dfakit.codegen;

import dfakit.Automaton;
import dfakit.Symbol;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.TreeMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Generates the body of {@code Acceptor.accepts(CharSequence)} for one
 * automaton.
 *
 * <p>States map naturally onto the control-flow graph of the method: each
 * state is a block, and following a transition is a jump to the block of the
 * target state. A block first checks whether the input is exhausted (then the
 * verdict is whether the state is final), otherwise reads the next character
 * and switches on it. A character with no case falls through to rejection,
 * which is how a stuck run looks in bytecode.
 */
final class AcceptorMethodCodegen {

  private static final String SYSTEM_CLASS_NAME = Type.getInternalName(System.class);
  private static final String SYSTEM_ERR = "err";
  private static final String PRINTSTREAM_DESC = Type.getDescriptor(PrintStream.class);

  /**
   * Method body into which code is emitted.
   */
  private final MethodVisitor mv;

  /**
   * Automaton for which code is generated (a private snapshot).
   */
  private final Automaton automaton;

  /**
   * If set, the generated method prints entered states and the verdict to
   * "standard" error.
   */
  private final boolean printDebugInfo;

  /**
   * Offset for argument of type {@code CharSequence}, corresponding to the
   * input string.
   */
  private final int inputLocal;

  /**
   * Offset for a local of type {@code int} holding the position of the next
   * character to read.
   */
  private final int offsetLocal;

  /**
   * Offset for a local of type {@code int} holding the input length.
   */
  private final int lengthLocal;

  /**
   * Labels of the states reachable from the initial state, in discovery order.
   */
  private final Map<String, Label> stateLabels;

  /**
   * Label for the block which ends in acceptance being returned.
   */
  private final Label returnSuccess = new Label();

  /**
   * Label for the block which ends in rejection being returned.
   */
  private final Label returnFailure = new Label();

  AcceptorMethodCodegen(
    MethodVisitor mv,
    Automaton automaton,
    boolean printDebugInfo
  ) {
    this.mv = mv;
    this.automaton = automaton;
    this.printDebugInfo = printDebugInfo;

    // Local 0 is `this`, all others are single-width
    int nextLocal = 1;
    this.inputLocal = nextLocal++;
    this.offsetLocal = nextLocal++;
    this.lengthLocal = nextLocal++;

    final var labels = new LinkedHashMap<String, Label>();
    for (String state : reachableStates(automaton)) {
      labels.put(state, new Label());
    }
    this.stateLabels = Collections.unmodifiableMap(labels);
  }

  /**
   * States reachable from the initial state (epsilon transitions are never
   * taken, so they do not count).
   */
  private static Iterable<String> reachableStates(Automaton automaton) {
    final var visited = new LinkedHashSet<String>();
    final var toVisit = new ArrayDeque<String>();
    automaton.initialState().ifPresent(initial -> {
      visited.add(initial);
      toVisit.push(initial);
    });

    while (!toVisit.isEmpty()) {
      for (Map.Entry<Symbol, String> transition : automaton.transitionsFrom(toVisit.pop()).entrySet()) {
        if (!transition.getKey().isEpsilon() && visited.add(transition.getValue())) {
          toVisit.push(transition.getValue());
        }
      }
    }

    return visited;
  }

  /**
   * Emit the whole method body.
   */
  void visitAcceptsMethod() {
    mv.visitCode();

    // offset = 0; length = input.length();
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    JvmCall.INPUT_LENGTH.emit(mv);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);

    if (printDebugInfo) {
      traceWithInput("[DFA] starting run on: ");
    }

    final String initial = automaton.initialState()
      .orElseThrow(() -> new IllegalStateException("Cannot compile an automaton without initial state"));
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(initial));

    for (Map.Entry<String, Label> entry : stateLabels.entrySet()) {
      visitState(entry.getKey(), entry.getValue());
    }

    mv.visitLabel(returnFailure);
    if (printDebugInfo) {
      traceWithOffset("[DFA] rejected, characters read: ");
    }
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);

    mv.visitLabel(returnSuccess);
    if (printDebugInfo) {
      trace("[DFA] accepted");
    }
    mv.visitInsn(Opcodes.ICONST_1);
    mv.visitInsn(Opcodes.IRETURN);

    // `COMPUTE_FRAMES` means the arguments are ignored
    mv.visitMaxs(0, 0);
    mv.visitEnd();
  }

  /**
   * Emit the block of one state.
   *
   * @param state state of the automaton
   * @param label label at which the block starts
   */
  private void visitState(String state, Label label) {
    mv.visitLabel(label);

    if (printDebugInfo) {
      trace("[DFA] entering " + state);
    }

    // if (offset >= length) return isFinal(state);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
    mv.visitJumpInsn(Opcodes.IF_ICMPGE, automaton.isFinal(state) ? returnSuccess : returnFailure);

    // switch (input.charAt(offset++))
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    JvmCall.INPUT_CHAR_AT.emit(mv);
    mv.visitIincInsn(offsetLocal, 1);

    final var targets = new TreeMap<Character, Label>();
    for (Map.Entry<Symbol, String> transition : automaton.transitionsFrom(state).entrySet()) {
      final Symbol symbol = transition.getKey();
      if (!symbol.isEpsilon()) {
        targets.put(symbol.character(), stateLabels.get(transition.getValue()));
      }
    }
    CharDispatch.emit(mv, targets, returnFailure);
  }

  // System.err.println(message)
  private void trace(String message) {
    mv.visitFieldInsn(Opcodes.GETSTATIC, SYSTEM_CLASS_NAME, SYSTEM_ERR, PRINTSTREAM_DESC);
    mv.visitLdcInsn(message);
    JvmCall.PRINTLN.emit(mv);
  }

  // System.err.println(prefix.concat(input.toString()))
  private void traceWithInput(String prefix) {
    mv.visitFieldInsn(Opcodes.GETSTATIC, SYSTEM_CLASS_NAME, SYSTEM_ERR, PRINTSTREAM_DESC);
    mv.visitLdcInsn(prefix);
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    JvmCall.INPUT_TO_STRING.emit(mv);
    JvmCall.CONCAT.emit(mv);
    JvmCall.PRINTLN.emit(mv);
  }

  // System.err.println(prefix.concat(String.valueOf(offset)))
  private void traceWithOffset(String prefix) {
    mv.visitFieldInsn(Opcodes.GETSTATIC, SYSTEM_CLASS_NAME, SYSTEM_ERR, PRINTSTREAM_DESC);
    mv.visitLdcInsn(prefix);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    JvmCall.INT_TO_STRING.emit(mv);
    JvmCall.CONCAT.emit(mv);
    JvmCall.PRINTLN.emit(mv);
  }
}
