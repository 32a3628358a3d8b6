package dfakit.codegen;

import dfakit.Acceptor;
import dfakit.Automaton;
import dfakit.NoInitialStateException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles automata into JVM classes implementing {@link Acceptor}.
 *
 * <p>The output is a fresh hidden class where each state is a block of
 * bytecode and transitions are {@code GOTO}s, so checking a string costs one
 * switch per character with no map lookups. The class is built from a
 * snapshot of the automaton: editing the automaton afterwards does not affect
 * acceptors already compiled.
 *
 * <p>Compiled acceptors agree with {@link dfakit.simulation.Simulator#accept}
 * on every input. Epsilon transitions are never followed.
 */
public final class AcceptorCodegen {

  private static final Logger LOG = LoggerFactory.getLogger(AcceptorCodegen.class);

  /**
   * Internal name of the generated classes (hidden classes get a unique suffix).
   */
  static final String CLASS_NAME = "dfakit/codegen/CompiledAcceptor";

  private AcceptorCodegen() { }

  /**
   * Compile an automaton into an acceptor.
   *
   * @param automaton automaton to compile
   * @return acceptor backed by generated bytecode
   * @throws NoInitialStateException if the automaton has no initial state
   */
  public static Acceptor compile(Automaton automaton) throws NoInitialStateException {
    return compile(automaton, false);
  }

  /**
   * Compile an automaton into an acceptor.
   *
   * @param automaton automaton to compile
   * @param printDebugInfo generate code which prints the run to "standard" error
   * @return acceptor backed by generated bytecode
   * @throws NoInitialStateException if the automaton has no initial state
   * @throws org.objectweb.asm.MethodTooLargeException if the automaton is too
   *   large to fit in a single method
   */
  public static Acceptor compile(Automaton automaton, boolean printDebugInfo) throws NoInitialStateException {
    final Automaton snapshot = automaton.copy();
    if (snapshot.initialState().isEmpty()) {
      throw new NoInitialStateException();
    }

    final int classFlags = Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC;
    final byte[] classBytes = generateAcceptorClass(snapshot, CLASS_NAME, classFlags, printDebugInfo)
      .toByteArray();
    LOG.debug("Compiled automaton with {} state(s) into {} bytes of bytecode",
      snapshot.stateIds().size(), classBytes.length);

    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return (Acceptor) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to load compiled acceptor", error);
    }
  }

  /**
   * Code generator for a compiled acceptor class.
   *
   * @param automaton automaton to compile (must have an initial state)
   * @param className internal name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @param printDebugInfo generate code which prints debug info to STDERR
   * @return class implementing {@code Acceptor}
   */
  static ClassWriter generateAcceptorClass(
    Automaton automaton,
    String className,
    int classFlags,
    boolean printDebugInfo
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      JvmCall.OBJECT_INIT.owner,
      new String[] { JvmCall.ACCEPTS.owner }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = JvmCall.OBJECT_INIT.declareOn(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      JvmCall.OBJECT_INIT.emit(mv);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method
    {
      final var mv = JvmCall.ACCEPTS.declareOn(cw, Opcodes.ACC_PUBLIC);
      new AcceptorMethodCodegen(mv, automaton, printDebugInfo).visitAcceptsMethod();
    }

    cw.visitEnd();
    return cw;
  }
}
