package dfakit.codegen;

import java.util.Map;
import java.util.SortedMap;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Emits the jump from a state on the character just read.
 *
 * <p>The character is on top of the stack and is always consumed, so every
 * target is entered with an empty stack. Out of the three shapes the JVM
 * offers (a single comparison, {@code tableswitch} and {@code lookupswitch})
 * the smallest encoding is picked, since a method body holds at most 64KiB of
 * code and each state of the automaton costs one dispatch.
 */
final class CharDispatch {

  private CharDispatch() { }

  /**
   * @param mv method body being generated
   * @param targets label of the target state for each character read
   * @param otherwise where characters without a transition go
   */
  static void emit(MethodVisitor mv, SortedMap<Character, Label> targets, Label otherwise) {
    if (targets.isEmpty()) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, otherwise);
      return;
    }

    if (targets.size() == 1) {
      final Map.Entry<Character, Label> only = targets.entrySet().iterator().next();
      pushChar(mv, only.getKey());
      mv.visitJumpInsn(Opcodes.IF_ICMPEQ, only.getValue());
      mv.visitJumpInsn(Opcodes.GOTO, otherwise);
      return;
    }

    final int low = targets.firstKey();
    final int high = targets.lastKey();
    if (prefersTable(targets.size(), high - low + 1)) {
      final var labels = new Label[high - low + 1];
      for (int c = low; c <= high; c++) {
        labels[c - low] = targets.getOrDefault((char) c, otherwise);
      }
      mv.visitTableSwitchInsn(low, high, otherwise, labels);
    } else {
      final int[] keys = new int[targets.size()];
      final var labels = new Label[targets.size()];
      int i = 0;
      for (Map.Entry<Character, Label> target : targets.entrySet()) {
        keys[i] = target.getKey();
        labels[i] = target.getValue();
        i++;
      }
      mv.visitLookupSwitchInsn(otherwise, keys, labels);
    }
  }

  /**
   * Is a {@code tableswitch} no bigger than a {@code lookupswitch}?
   *
   * <p>Past the shared header, a table takes one offset per character in the
   * span and a lookup takes a key and an offset per case.
   *
   * @param cases number of characters with a transition
   * @param span distance between the lowest and highest of them, inclusive
   */
  static boolean prefersTable(int cases, int span) {
    return (long) span + 1 <= 2L * cases;
  }

  private static void pushChar(MethodVisitor mv, char c) {
    if (c <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + c);
    } else if (c <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, c);
    } else if (c <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, c);
    } else {
      mv.visitLdcInsn((int) c);
    }
  }
}
