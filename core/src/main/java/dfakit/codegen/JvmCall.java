package dfakit.codegen;

import dfakit.Acceptor;
import java.io.PrintStream;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * JDK and library methods referenced from a compiled acceptor, along with
 * the instruction needed to call each one.
 */
enum JvmCall {
  OBJECT_INIT(Object.class, "<init>", MethodType.methodType(void.class), Opcodes.INVOKESPECIAL),
  ACCEPTS(Acceptor.class, "accepts", MethodType.methodType(boolean.class, CharSequence.class), Opcodes.INVOKEINTERFACE),
  INPUT_LENGTH(CharSequence.class, "length", MethodType.methodType(int.class), Opcodes.INVOKEINTERFACE),
  INPUT_CHAR_AT(CharSequence.class, "charAt", MethodType.methodType(char.class, int.class), Opcodes.INVOKEINTERFACE),
  INPUT_TO_STRING(CharSequence.class, "toString", MethodType.methodType(String.class), Opcodes.INVOKEINTERFACE),
  INT_TO_STRING(String.class, "valueOf", MethodType.methodType(String.class, int.class), Opcodes.INVOKESTATIC),
  CONCAT(String.class, "concat", MethodType.methodType(String.class, String.class), Opcodes.INVOKEVIRTUAL),
  PRINTLN(PrintStream.class, "println", MethodType.methodType(void.class, String.class), Opcodes.INVOKEVIRTUAL);

  /**
   * Internal name of the class or interface declaring the method.
   */
  final String owner;

  final String name;

  final String descriptor;

  /**
   * One of the {@code Opcodes.INVOKE*} instructions.
   */
  final int opcode;

  JvmCall(Class<?> owner, String name, MethodType type, int opcode) {
    this.owner = Type.getInternalName(owner);
    this.name = name;
    this.descriptor = type.descriptorString();
    this.opcode = opcode;
  }

  /**
   * Emit the call (arguments and receiver must already be on the stack).
   *
   * @param mv method body being generated
   */
  void emit(MethodVisitor mv) {
    mv.visitMethodInsn(opcode, owner, name, descriptor, opcode == Opcodes.INVOKEINTERFACE);
  }

  /**
   * Declare a method with the same name and descriptor on a generated class,
   * eg. to implement an interface method.
   *
   * @param cv generated class
   * @param access access flags of the new method
   * @return visitor for the method body
   */
  MethodVisitor declareOn(ClassVisitor cv, int access) {
    return cv.visitMethod(access, name, descriptor, null, null);
  }
}
