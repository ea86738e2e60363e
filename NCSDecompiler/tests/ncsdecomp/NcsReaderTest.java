package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class NcsReaderTest {

  private static DecompilerException readError(byte[] bytes) {
    return assertThrows(DecompilerException.class, () -> NcsReader.read(bytes));
  }

  @Test
  public void decodesOperandsAndPositions() throws DecompilerException {
    ImmutableList<Instruction> instructions =
        new NcsAssembler()
            .consti(-7)
            .constf(1.5f)
            .consts("hi")
            .cptopsp(-8, 4)
            .action(42, 2)
            .movsp(-12)
            .retn()
            .instructions();

    assertThat(instructions).hasSize(7);
    assertThat(instructions.get(0).pos()).isEqualTo(13);
    assertThat(instructions.get(0).operand(0).intValue()).isEqualTo(-7);
    assertThat(instructions.get(1).pos()).isEqualTo(19);
    assertThat(instructions.get(1).operand(0).floatValue()).isEqualTo(1.5f);
    assertThat(instructions.get(2).pos()).isEqualTo(25);
    assertThat(instructions.get(2).length()).isEqualTo(6);
    assertThat(instructions.get(2).operand(0).stringValue()).isEqualTo("hi");
    assertThat(instructions.get(3).opcode()).isEqualTo(Opcode.CPTOPSP);
    assertThat(instructions.get(3).operand(0).intValue()).isEqualTo(-8);
    assertThat(instructions.get(3).operand(1).intValue()).isEqualTo(4);
    assertThat(instructions.get(4).length()).isEqualTo(5);
    assertThat(instructions.get(4).operand(0).intValue()).isEqualTo(42);
    assertThat(instructions.get(4).operand(1).intValue()).isEqualTo(2);
    assertThat(instructions.get(5).operand(0).intValue()).isEqualTo(-12);
    assertThat(instructions.get(6).end()).isEqualTo(52);
  }

  @Test
  public void emptyProgramHasNoInstructions() throws DecompilerException {
    assertThat(new NcsAssembler().instructions()).isEmpty();
  }

  @Test
  public void rejectsMissingSignature() {
    byte[] bytes = new NcsAssembler().retn().bytes();
    bytes[0] = 'X';

    DecompilerException ex = readError(bytes);

    assertThat(ex.kind()).isEqualTo(DecompilerException.ErrorKind.DECODE);
    assertThat(ex.pos()).isEqualTo(0);
  }

  @Test
  public void rejectsShortHeader() {
    assertThat(readError(new byte[] {'N', 'C', 'S'}).kind())
        .isEqualTo(DecompilerException.ErrorKind.DECODE);
  }

  @Test
  public void rejectsBadProgramMarker() {
    byte[] bytes = new NcsAssembler().retn().bytes();
    bytes[8] = 0x41;

    assertThat(readError(bytes).getMessage()).contains("marker");
  }

  @Test
  public void rejectsSizeLargerThanFile() {
    byte[] bytes = new NcsAssembler().retn().bytes();
    byte[] truncated = Arrays.copyOf(bytes, bytes.length - 1);

    assertThat(readError(truncated).getMessage()).contains("does not match file size");
  }

  @Test
  public void rejectsUnknownOpcode() {
    byte[] bytes = new NcsAssembler().retn().bytes();
    bytes[13] = 0x1C;

    DecompilerException ex = readError(bytes);

    assertThat(ex.pos()).isEqualTo(13);
    assertThat(ex.getMessage()).contains("unknown opcode 0x1C");
  }

  @Test
  public void rejectsInstructionRunningPastEnd() {
    byte[] bytes = new NcsAssembler().retn().bytes();
    // Turn the RETN into a JMP whose offset is missing.
    bytes[13] = (byte) Opcode.JMP.code();

    DecompilerException ex = readError(bytes);

    assertThat(ex.kind()).isEqualTo(DecompilerException.ErrorKind.DECODE);
    assertThat(ex.pos()).isEqualTo(13);
  }

  @Test
  public void rejectsConstantOfNonLiteralType() {
    byte[] bytes = new NcsAssembler().consti(1).bytes();
    bytes[14] = (byte) ValueType.EFFECT.code();

    assertThat(readError(bytes).getMessage()).contains("non-literal");
  }

  @Test
  public void equalityReadsStructureSizeOnlyForStructures() throws DecompilerException {
    byte[] bytes = new NcsAssembler().binary(Opcode.EQUAL, TypePair.II).retn().bytes();

    ImmutableList<Instruction> instructions = NcsReader.read(bytes);

    assertThat(instructions.get(0).length()).isEqualTo(2);
    assertThat(instructions.get(0).operands()).isEmpty();
    assertThat(instructions.get(1).opcode()).isEqualTo(Opcode.RETN);
  }
}
