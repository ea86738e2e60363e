package ncsdecomp;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.base.VerifyException;

/**
 * Stateless queries over lifted commands: classification, operand extraction, operator symbols
 * and stack arithmetic. All bytecode-semantics knowledge the later stages need lives here.
 */
public final class NodeQueries {
  /** Encoded size of JMP, JSR, JZ and JNZ. */
  public static final int JUMP_SIZE = 6;

  public static boolean isJz(Command command) {
    return command.kind() == Command.Kind.CONDITIONAL_JUMP
        && command.<Command.ConditionalJump>cast().ifZero();
  }

  public static boolean isJnz(Command command) {
    return command.kind() == Command.Kind.CONDITIONAL_JUMP
        && !command.<Command.ConditionalJump>cast().ifZero();
  }

  /** A JZ that skips exactly one following jump: the guard of an empty branch. */
  public static boolean isJzPastOne(Command command) {
    return isJz(command) && command.<Command.ConditionalJump>cast().offset() == 2 * JUMP_SIZE;
  }

  /**
   * Whether the stack at a jump into the command after {@code command} may be recorded. False
   * only for a logical OR, whose right operand is conditionally evaluated.
   */
  public static boolean isStoreStackNode(Command command) {
    return !(command.kind() == Command.Kind.LOGICAL
        && command.<Command.Logical>cast().op() == Command.LogicalOp.OR);
  }

  public static boolean isJump(Command command) {
    switch (command.kind()) {
      case JUMP:
      case CONDITIONAL_JUMP:
      case JUMP_TO_SUBROUTINE:
        return true;
      default:
        return false;
    }
  }

  public static boolean isSaveBp(Command command) {
    return command.kind() == Command.Kind.BP && command.<Command.Bp>cast().save();
  }

  public static int jumpDestination(Command command) {
    switch (command.kind()) {
      case JUMP:
        return command.pos() + command.<Command.Jump>cast().offset();
      case CONDITIONAL_JUMP:
        return command.pos() + command.<Command.ConditionalJump>cast().offset();
      case JUMP_TO_SUBROUTINE:
        return command.pos() + command.<Command.JumpToSubroutine>cast().offset();
      default:
        throw new IllegalArgumentException("not a jump: " + command);
    }
  }

  private static Command.Constant constant(Command command, ValueType expected) {
    Preconditions.checkArgument(command.kind() == Command.Kind.CONSTANT, "not a constant");
    Command.Constant constant = command.cast();
    Verify.verify(
        constant.type() == expected,
        "expected %s constant, found %s",
        expected.typeName(),
        constant.type().typeName());
    return constant;
  }

  public static int intConstant(Command command) {
    return constant(command, ValueType.INT).value().intValue();
  }

  public static String unaryOperator(Command.UnaryOp op) {
    switch (op) {
      case NEGATE:
        return "-";
      case COMPLEMENT:
        return "~";
      case NOT:
        return "!";
    }
    throw new VerifyException("unknown unary operator " + op);
  }

  public static String binaryOperator(Command.BinaryOp op) {
    switch (op) {
      case ADD:
        return "+";
      case SUB:
        return "-";
      case DIV:
        return "/";
      case MUL:
        return "*";
      case MOD:
        return "%";
      case SHIFT_LEFT:
        return "<<";
      case SHIFT_RIGHT:
        return ">>";
      case EQUAL:
        return "==";
      case NOT_EQUAL:
        return "!=";
      case LESS:
        return "<";
      case LESS_EQUAL:
        return "<=";
      case GREATER:
        return ">";
      case GREATER_EQUAL:
        return ">=";
      case UNSIGNED_SHIFT_RIGHT:
        throw new VerifyException("found an unsigned bit shift");
    }
    throw new VerifyException("unknown binary operator " + op);
  }

  public static String logicalOperator(Command.LogicalOp op) {
    switch (op) {
      case AND:
        return "&&";
      case OR:
        return "||";
      case INCLUSIVE_OR:
        return "|";
      case EXCLUSIVE_OR:
        return "^";
      case BITWISE_AND:
        return "&";
    }
    throw new VerifyException("unknown logical operator " + op);
  }

  public static String stackOperator(Command.StackOpKind op) {
    switch (op) {
      case INCREMENT:
        return "++";
      case DECREMENT:
        return "--";
    }
    throw new VerifyException("unknown stack operator " + op);
  }

  /** Slots taken by the left operand. */
  public static int leftWidth(Command.Binary binary) {
    if (binary.types() == TypePair.TT) return slot(binary.structSize());
    return binary.types().left().width();
  }

  /** Slots taken by the right operand. */
  public static int rightWidth(Command.Binary binary) {
    if (binary.types() == TypePair.TT) return slot(binary.structSize());
    return binary.types().right().width();
  }

  public static int resultWidth(Command.Binary binary) {
    return resultType(binary).width();
  }

  /**
   * Result type of a binary operation. Comparisons yield int; any arithmetic with a vector operand
   * yields a vector.
   */
  public static ValueType resultType(Command.Binary binary) {
    if (binary.op().isComparison()) return ValueType.INT;
    TypePair types = binary.types();
    if (types.hasVector()) return ValueType.VECTOR;
    switch (types) {
      case II:
        return ValueType.INT;
      case IF:
      case FI:
      case FF:
        return ValueType.FLOAT;
      case SS:
        return ValueType.STRING;
      default:
        throw new VerifyException("no arithmetic over " + types);
    }
  }

  /** Byte offset to slot count; offsets are always multiples of 4. */
  public static int slot(int byteOffset) {
    Preconditions.checkArgument(byteOffset % 4 == 0, "unaligned offset %s", byteOffset);
    return byteOffset / 4;
  }

  /** Depth below the top addressed by a negative stack offset: -4 is depth 1, the top slot. */
  public static int depth(int byteOffset) {
    return -slot(byteOffset);
  }

  private NodeQueries() {}
}
