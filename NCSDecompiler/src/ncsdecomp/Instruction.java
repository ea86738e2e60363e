package ncsdecomp;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A decoded instruction: opcode, qualifier byte, immediates and its location in the file. */
@AutoValue
public abstract class Instruction {
  /** Byte offset of the opcode within the file. */
  public abstract int pos();

  /** Encoded length in bytes, opcode and qualifier included. */
  public abstract int length();

  public abstract Opcode opcode();

  public abstract int qualifier();

  public abstract ImmutableList<Operand> operands();

  public final int end() {
    return pos() + length();
  }

  public final Operand operand(int index) {
    return operands().get(index);
  }

  public static Instruction create(
      int pos, int length, Opcode opcode, int qualifier, ImmutableList<Operand> operands) {
    return new AutoValue_Instruction(pos, length, opcode, qualifier, operands);
  }

  @Override
  public final String toString() {
    return String.format("%08X %s %02X %s", pos(), opcode(), qualifier(), operands());
  }
}
