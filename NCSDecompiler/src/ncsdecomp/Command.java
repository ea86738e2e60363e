package ncsdecomp;

/**
 * The payload of a command node: one of a closed set of instruction families. Each family is a
 * nested subclass, and {@link #kind()} is the tag to switch on.
 */
public abstract class Command {
  public enum Kind {
    CONDITIONAL_JUMP,
    JUMP,
    JUMP_TO_SUBROUTINE,
    RETURN,
    COPY_DOWN_SP,
    COPY_TOP_SP,
    COPY_DOWN_BP,
    COPY_TOP_BP,
    MOVE_SP,
    RSADD,
    CONSTANT,
    ACTION,
    LOGICAL,
    BINARY,
    UNARY,
    STACK_OP,
    DESTRUCT,
    BP,
    STORE_STATE;
  }

  private final Kind kind;
  private final Instruction instruction;

  protected Command(Kind kind, Instruction instruction) {
    this.kind = kind;
    this.instruction = instruction;
  }

  public Kind kind() {
    return kind;
  }

  public Instruction instruction() {
    return instruction;
  }

  public int pos() {
    return instruction.pos();
  }

  public int length() {
    return instruction.length();
  }

  @SuppressWarnings("unchecked")
  public <T extends Command> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return instruction.toString();
  }

  public static final class ConditionalJump extends Command {
    private final boolean ifZero;
    private final int offset;

    ConditionalJump(Instruction instruction, boolean ifZero, int offset) {
      super(Kind.CONDITIONAL_JUMP, instruction);
      this.ifZero = ifZero;
      this.offset = offset;
    }

    /** True for JZ, false for JNZ. */
    public boolean ifZero() {
      return ifZero;
    }

    public int offset() {
      return offset;
    }
  }

  public static final class Jump extends Command {
    private final int offset;

    Jump(Instruction instruction, int offset) {
      super(Kind.JUMP, instruction);
      this.offset = offset;
    }

    public int offset() {
      return offset;
    }
  }

  public static final class JumpToSubroutine extends Command {
    private final int offset;

    JumpToSubroutine(Instruction instruction, int offset) {
      super(Kind.JUMP_TO_SUBROUTINE, instruction);
      this.offset = offset;
    }

    public int offset() {
      return offset;
    }
  }

  public static final class Return extends Command {
    Return(Instruction instruction) {
      super(Kind.RETURN, instruction);
    }
  }

  /** CPDOWNSP, CPTOPSP, CPDOWNBP and CPTOPBP. */
  public static final class StackCopy extends Command {
    private final int offset;
    private final int size;

    StackCopy(Kind kind, Instruction instruction, int offset, int size) {
      super(kind, instruction);
      this.offset = offset;
      this.size = size;
    }

    /** Byte offset, negative, relative to the stack top or the base pointer. */
    public int offset() {
      return offset;
    }

    /** Bytes copied. */
    public int size() {
      return size;
    }

    public boolean isDown() {
      return kind() == Kind.COPY_DOWN_SP || kind() == Kind.COPY_DOWN_BP;
    }

    public boolean isGlobal() {
      return kind() == Kind.COPY_DOWN_BP || kind() == Kind.COPY_TOP_BP;
    }
  }

  public static final class MoveSp extends Command {
    private final int offset;

    MoveSp(Instruction instruction, int offset) {
      super(Kind.MOVE_SP, instruction);
      this.offset = offset;
    }

    public int offset() {
      return offset;
    }
  }

  public static final class RsAdd extends Command {
    private final ValueType type;

    RsAdd(Instruction instruction, ValueType type) {
      super(Kind.RSADD, instruction);
      this.type = type;
    }

    public ValueType type() {
      return type;
    }
  }

  public static final class Constant extends Command {
    private final ValueType type;
    private final Operand value;

    Constant(Instruction instruction, ValueType type, Operand value) {
      super(Kind.CONSTANT, instruction);
      this.type = type;
      this.value = value;
    }

    public ValueType type() {
      return type;
    }

    public Operand value() {
      return value;
    }
  }

  public static final class Action extends Command {
    private final int actionId;
    private final int argCount;

    Action(Instruction instruction, int actionId, int argCount) {
      super(Kind.ACTION, instruction);
      this.actionId = actionId;
      this.argCount = argCount;
    }

    public int actionId() {
      return actionId;
    }

    public int argCount() {
      return argCount;
    }
  }

  public enum LogicalOp {
    AND,
    OR,
    INCLUSIVE_OR,
    EXCLUSIVE_OR,
    BITWISE_AND;
  }

  public static final class Logical extends Command {
    private final LogicalOp op;

    Logical(Instruction instruction, LogicalOp op) {
      super(Kind.LOGICAL, instruction);
      this.op = op;
    }

    public LogicalOp op() {
      return op;
    }
  }

  public enum BinaryOp {
    ADD,
    SUB,
    MUL,
    DIV,
    MOD,
    SHIFT_LEFT,
    SHIFT_RIGHT,
    UNSIGNED_SHIFT_RIGHT,
    EQUAL,
    NOT_EQUAL,
    GREATER_EQUAL,
    GREATER,
    LESS,
    LESS_EQUAL;

    public boolean isEquality() {
      return this == EQUAL || this == NOT_EQUAL;
    }

    public boolean isComparison() {
      return isEquality()
          || this == GREATER_EQUAL
          || this == GREATER
          || this == LESS
          || this == LESS_EQUAL;
    }
  }

  public static final class Binary extends Command {
    private final BinaryOp op;
    private final TypePair types;
    private final int structSize;

    Binary(Instruction instruction, BinaryOp op, TypePair types, int structSize) {
      super(Kind.BINARY, instruction);
      this.op = op;
      this.types = types;
      this.structSize = structSize;
    }

    public BinaryOp op() {
      return op;
    }

    public TypePair types() {
      return types;
    }

    /** Bytes per operand of a structure comparison, zero otherwise. */
    public int structSize() {
      return structSize;
    }
  }

  public enum UnaryOp {
    NEGATE,
    COMPLEMENT,
    NOT;
  }

  public static final class Unary extends Command {
    private final UnaryOp op;
    private final ValueType type;

    Unary(Instruction instruction, UnaryOp op, ValueType type) {
      super(Kind.UNARY, instruction);
      this.op = op;
      this.type = type;
    }

    public UnaryOp op() {
      return op;
    }

    public ValueType type() {
      return type;
    }
  }

  public enum StackOpKind {
    INCREMENT,
    DECREMENT;
  }

  /** INCISP, DECISP, INCIBP and DECIBP: in-place integer increment of a stack slot. */
  public static final class StackOp extends Command {
    private final StackOpKind op;
    private final boolean global;
    private final int offset;

    StackOp(Instruction instruction, StackOpKind op, boolean global, int offset) {
      super(Kind.STACK_OP, instruction);
      this.op = op;
      this.global = global;
      this.offset = offset;
    }

    public StackOpKind op() {
      return op;
    }

    public boolean global() {
      return global;
    }

    public int offset() {
      return offset;
    }
  }

  public static final class Destruct extends Command {
    private final int removeSize;
    private final int saveOffset;
    private final int saveSize;

    Destruct(Instruction instruction, int removeSize, int saveOffset, int saveSize) {
      super(Kind.DESTRUCT, instruction);
      this.removeSize = removeSize;
      this.saveOffset = saveOffset;
      this.saveSize = saveSize;
    }

    public int removeSize() {
      return removeSize;
    }

    public int saveOffset() {
      return saveOffset;
    }

    public int saveSize() {
      return saveSize;
    }
  }

  public static final class Bp extends Command {
    private final boolean save;

    Bp(Instruction instruction, boolean save) {
      super(Kind.BP, instruction);
      this.save = save;
    }

    /** True for SAVEBP, false for RESTOREBP. */
    public boolean save() {
      return save;
    }
  }

  public static final class StoreState extends Command {
    private final int bpSize;
    private final int spSize;

    StoreState(Instruction instruction, int bpSize, int spSize) {
      super(Kind.STORE_STATE, instruction);
      this.bpSize = bpSize;
      this.spSize = spSize;
    }

    public int bpSize() {
      return bpSize;
    }

    public int spSize() {
      return spSize;
    }
  }
}
