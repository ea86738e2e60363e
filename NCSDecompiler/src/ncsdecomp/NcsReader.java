package ncsdecomp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteStreams;

import ncsdecomp.DecompilerException.ErrorKind;

/**
 * Decodes a compiled script file into its instruction stream.
 *
 * <p>The file starts with {@code "NCS V1.0"}, a 0x42 marker byte and the big-endian total size;
 * instructions follow from offset 13. All immediates are big-endian.
 */
public final class NcsReader {
  public static final int HEADER_SIZE = 13;

  private static final byte[] SIGNATURE = "NCS V1.0".getBytes(StandardCharsets.US_ASCII);
  private static final int PROGRAM_MARKER = 0x42;

  public static ImmutableList<Instruction> read(byte[] bytes) throws DecompilerException {
    if (bytes.length < HEADER_SIZE
        || !Arrays.equals(Arrays.copyOf(bytes, SIGNATURE.length), SIGNATURE)) {
      throw new DecompilerException(0, ErrorKind.DECODE, "missing NCS V1.0 signature");
    }
    ByteArrayDataInput header = ByteStreams.newDataInput(bytes, SIGNATURE.length);
    if (header.readUnsignedByte() != PROGRAM_MARKER) {
      throw new DecompilerException(SIGNATURE.length, ErrorKind.DECODE, "bad program marker");
    }
    int size = header.readInt();
    if (size < HEADER_SIZE || size > bytes.length) {
      throw new DecompilerException(
          SIGNATURE.length + 1,
          ErrorKind.DECODE,
          String.format("declared size %d does not match file size %d", size, bytes.length));
    }

    ImmutableList.Builder<Instruction> out = ImmutableList.builder();
    int pos = HEADER_SIZE;
    while (pos < size) {
      Instruction instruction = readInstruction(bytes, pos, size);
      out.add(instruction);
      pos = instruction.end();
    }
    return out.build();
  }

  private static Instruction readInstruction(byte[] bytes, int pos, int size)
      throws DecompilerException {
    if (pos + 2 > size) {
      throw new DecompilerException(pos, ErrorKind.DECODE, "truncated instruction");
    }
    int code = bytes[pos] & 0xFF;
    int qualifier = bytes[pos + 1] & 0xFF;
    Opcode opcode =
        Opcode.fromCode(code)
            .orElseThrow(
                () ->
                    new DecompilerException(
                        pos, ErrorKind.DECODE, String.format("unknown opcode 0x%02X", code)));

    ByteArrayDataInput in = ByteStreams.newDataInput(bytes, pos + 2);
    ImmutableList.Builder<Operand> operands = ImmutableList.builder();
    int length = 2;
    try {
      switch (opcode.layout()) {
        case NONE:
          break;
        case OFFSET_SIZE:
          operands.add(Operand.ofInt(in.readInt()));
          operands.add(Operand.ofInt(in.readUnsignedShort()));
          length += 6;
          break;
        case INT:
          operands.add(Operand.ofInt(in.readInt()));
          length += 4;
          break;
        case CONSTANT:
          length += readConstant(in, pos, qualifier, operands);
          break;
        case ACTION:
          operands.add(Operand.ofInt(in.readUnsignedShort()));
          operands.add(Operand.ofInt(in.readUnsignedByte()));
          length += 3;
          break;
        case EQUALITY:
          if (qualifier == TypePair.TT.qualifier()) {
            operands.add(Operand.ofInt(in.readUnsignedShort()));
            length += 2;
          }
          break;
        case DESTRUCT:
          operands.add(Operand.ofInt(in.readUnsignedShort()));
          operands.add(Operand.ofInt(in.readShort()));
          operands.add(Operand.ofInt(in.readUnsignedShort()));
          length += 6;
          break;
        case STORE_STATE:
          operands.add(Operand.ofInt(in.readInt()));
          operands.add(Operand.ofInt(in.readInt()));
          length += 8;
          break;
      }
    } catch (IllegalStateException ex) {
      throw new DecompilerException(pos, ErrorKind.DECODE, "truncated operands of " + opcode, ex);
    }

    if (pos + length > size) {
      throw new DecompilerException(pos, ErrorKind.DECODE, "instruction runs past end of file");
    }
    return Instruction.create(pos, length, opcode, qualifier, operands.build());
  }

  private static int readConstant(
      ByteArrayDataInput in, int pos, int qualifier, ImmutableList.Builder<Operand> operands)
      throws DecompilerException {
    ValueType type =
        ValueType.fromQualifier(qualifier)
            .orElseThrow(
                () ->
                    new DecompilerException(
                        pos,
                        ErrorKind.DECODE,
                        String.format("constant with qualifier 0x%02X", qualifier)));
    switch (type) {
      case INT:
      case OBJECT:
        operands.add(Operand.ofInt(in.readInt()));
        return 4;
      case FLOAT:
        operands.add(Operand.ofFloat(in.readFloat()));
        return 4;
      case STRING:
        int len = in.readUnsignedShort();
        byte[] chars = new byte[len];
        in.readFully(chars);
        operands.add(Operand.ofString(new String(chars, StandardCharsets.ISO_8859_1)));
        return 2 + len;
      default:
        throw new DecompilerException(
            pos, ErrorKind.DECODE, "constant of non-literal type " + type.typeName());
    }
  }

  private NcsReader() {}
}
