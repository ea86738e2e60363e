package ncsdecomp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * Writes compiled scripts for tests. Instructions are appended in file order; jumps name a label
 * that may be defined before or after them.
 */
final class NcsAssembler {

  private interface Operands {
    void write(ByteArrayDataOutput out, int pos);
  }

  private static final class Entry {
    final int pos;
    final Opcode opcode;
    final int qualifier;
    final Operands operands;

    Entry(int pos, Opcode opcode, int qualifier, Operands operands) {
      this.pos = pos;
      this.opcode = opcode;
      this.qualifier = qualifier;
      this.operands = operands;
    }
  }

  private final List<Entry> entries = new ArrayList<>();
  private final Map<String, Integer> labels = new HashMap<>();
  private int pos = NcsReader.HEADER_SIZE;

  NcsAssembler label(String name) {
    Preconditions.checkState(labels.put(name, pos) == null, "duplicate label %s", name);
    return this;
  }

  int position(String label) {
    Integer position = labels.get(label);
    Preconditions.checkArgument(position != null, "undefined label %s", label);
    return position;
  }

  /** Position the next instruction will be written at. */
  int pos() {
    return pos;
  }

  private NcsAssembler add(Opcode opcode, int qualifier, int operandBytes, Operands operands) {
    entries.add(new Entry(pos, opcode, qualifier, operands));
    pos += 2 + operandBytes;
    return this;
  }

  private NcsAssembler jump(Opcode opcode, String label) {
    return add(opcode, 0x00, 4, (out, at) -> out.writeInt(position(label) - at));
  }

  private NcsAssembler copy(Opcode opcode, int offset, int size) {
    return add(
        opcode,
        Opcode.QUALIFIER_STACK,
        6,
        (out, at) -> {
          out.writeInt(offset);
          out.writeShort(size);
        });
  }

  NcsAssembler rsadd(ValueType type) {
    return add(Opcode.RSADD, type.code(), 0, (out, at) -> {});
  }

  NcsAssembler consti(int value) {
    return add(Opcode.CONST, ValueType.INT.code(), 4, (out, at) -> out.writeInt(value));
  }

  NcsAssembler constf(float value) {
    return add(Opcode.CONST, ValueType.FLOAT.code(), 4, (out, at) -> out.writeFloat(value));
  }

  NcsAssembler consts(String value) {
    byte[] chars = value.getBytes(StandardCharsets.ISO_8859_1);
    return add(
        Opcode.CONST,
        ValueType.STRING.code(),
        2 + chars.length,
        (out, at) -> {
          out.writeShort(chars.length);
          out.write(chars);
        });
  }

  NcsAssembler consto(int value) {
    return add(Opcode.CONST, ValueType.OBJECT.code(), 4, (out, at) -> out.writeInt(value));
  }

  NcsAssembler cptopsp(int offset, int size) {
    return copy(Opcode.CPTOPSP, offset, size);
  }

  NcsAssembler cpdownsp(int offset, int size) {
    return copy(Opcode.CPDOWNSP, offset, size);
  }

  NcsAssembler cptopbp(int offset, int size) {
    return copy(Opcode.CPTOPBP, offset, size);
  }

  NcsAssembler cpdownbp(int offset, int size) {
    return copy(Opcode.CPDOWNBP, offset, size);
  }

  NcsAssembler movsp(int offset) {
    return add(Opcode.MOVSP, 0x00, 4, (out, at) -> out.writeInt(offset));
  }

  NcsAssembler jmp(String label) {
    return jump(Opcode.JMP, label);
  }

  NcsAssembler jsr(String label) {
    return jump(Opcode.JSR, label);
  }

  NcsAssembler jz(String label) {
    return jump(Opcode.JZ, label);
  }

  NcsAssembler jnz(String label) {
    return jump(Opcode.JNZ, label);
  }

  NcsAssembler retn() {
    return add(Opcode.RETN, 0x00, 0, (out, at) -> {});
  }

  NcsAssembler action(int id, int argCount) {
    return add(
        Opcode.ACTION,
        0x00,
        3,
        (out, at) -> {
          out.writeShort(id);
          out.writeByte(argCount);
        });
  }

  NcsAssembler binary(Opcode opcode, TypePair types) {
    Preconditions.checkArgument(types != TypePair.TT, "structure comparisons take a size");
    return add(opcode, types.qualifier(), 0, (out, at) -> {});
  }

  NcsAssembler logical(Opcode opcode) {
    return add(opcode, TypePair.II.qualifier(), 0, (out, at) -> {});
  }

  NcsAssembler unary(Opcode opcode, ValueType type) {
    return add(opcode, type.code(), 0, (out, at) -> {});
  }

  NcsAssembler incisp(int offset) {
    return add(Opcode.INCISP, Opcode.QUALIFIER_INT, 4, (out, at) -> out.writeInt(offset));
  }

  NcsAssembler decisp(int offset) {
    return add(Opcode.DECISP, Opcode.QUALIFIER_INT, 4, (out, at) -> out.writeInt(offset));
  }

  NcsAssembler incibp(int offset) {
    return add(Opcode.INCIBP, Opcode.QUALIFIER_INT, 4, (out, at) -> out.writeInt(offset));
  }

  NcsAssembler savebp() {
    return add(Opcode.SAVEBP, 0x00, 0, (out, at) -> {});
  }

  NcsAssembler restorebp() {
    return add(Opcode.RESTOREBP, 0x00, 0, (out, at) -> {});
  }

  NcsAssembler storeState(int bpSize, int spSize) {
    return add(
        Opcode.STORE_STATE,
        Opcode.QUALIFIER_STORE_STATE,
        8,
        (out, at) -> {
          out.writeInt(bpSize);
          out.writeInt(spSize);
        });
  }

  NcsAssembler destruct(int removeSize, int saveOffset, int saveSize) {
    return add(
        Opcode.DESTRUCT,
        0x01,
        6,
        (out, at) -> {
          out.writeShort(removeSize);
          out.writeShort(saveOffset);
          out.writeShort(saveSize);
        });
  }

  NcsAssembler nop() {
    return add(Opcode.NOP, 0x00, 0, (out, at) -> {});
  }

  byte[] bytes() {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.write("NCS V1.0".getBytes(StandardCharsets.US_ASCII));
    out.writeByte(0x42);
    out.writeInt(pos);
    for (Entry entry : entries) {
      out.writeByte(entry.opcode.code());
      out.writeByte(entry.qualifier);
      entry.operands.write(out, entry.pos);
    }
    byte[] bytes = out.toByteArray();
    Preconditions.checkState(bytes.length == pos, "wrote %s bytes, expected %s", bytes.length, pos);
    return bytes;
  }

  ImmutableList<Instruction> instructions() throws DecompilerException {
    return NcsReader.read(bytes());
  }

  Program program() throws DecompilerException {
    return new NodeTreeBuilder(instructions()).build();
  }
}
