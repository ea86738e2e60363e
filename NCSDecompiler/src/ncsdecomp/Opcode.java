package ncsdecomp;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** Bytecode opcodes and the immediate operand layout that follows the qualifier byte. */
public enum Opcode {
  CPDOWNSP(0x01, Layout.OFFSET_SIZE),
  RSADD(0x02, Layout.NONE),
  CPTOPSP(0x03, Layout.OFFSET_SIZE),
  CONST(0x04, Layout.CONSTANT),
  ACTION(0x05, Layout.ACTION),
  LOGAND(0x06, Layout.NONE),
  LOGOR(0x07, Layout.NONE),
  INCOR(0x08, Layout.NONE),
  EXCOR(0x09, Layout.NONE),
  BOOLAND(0x0A, Layout.NONE),
  EQUAL(0x0B, Layout.EQUALITY),
  NEQUAL(0x0C, Layout.EQUALITY),
  GEQ(0x0D, Layout.NONE),
  GT(0x0E, Layout.NONE),
  LT(0x0F, Layout.NONE),
  LEQ(0x10, Layout.NONE),
  SHLEFT(0x11, Layout.NONE),
  SHRIGHT(0x12, Layout.NONE),
  USHRIGHT(0x13, Layout.NONE),
  ADD(0x14, Layout.NONE),
  SUB(0x15, Layout.NONE),
  MUL(0x16, Layout.NONE),
  DIV(0x17, Layout.NONE),
  MOD(0x18, Layout.NONE),
  NEG(0x19, Layout.NONE),
  COMP(0x1A, Layout.NONE),
  MOVSP(0x1B, Layout.INT),
  JMP(0x1D, Layout.INT),
  JSR(0x1E, Layout.INT),
  JZ(0x1F, Layout.INT),
  RETN(0x20, Layout.NONE),
  DESTRUCT(0x21, Layout.DESTRUCT),
  NOTI(0x22, Layout.NONE),
  DECISP(0x23, Layout.INT),
  INCISP(0x24, Layout.INT),
  JNZ(0x25, Layout.INT),
  CPDOWNBP(0x26, Layout.OFFSET_SIZE),
  CPTOPBP(0x27, Layout.OFFSET_SIZE),
  DECIBP(0x28, Layout.INT),
  INCIBP(0x29, Layout.INT),
  SAVEBP(0x2A, Layout.NONE),
  RESTOREBP(0x2B, Layout.NONE),
  STORE_STATE(0x2C, Layout.STORE_STATE),
  NOP(0x2D, Layout.NONE);

  /** Immediate operands, in file order. */
  public enum Layout {
    NONE,
    // int32 offset, uint16 size
    OFFSET_SIZE,
    // one int32
    INT,
    // depends on the qualifier: int32, float32, or uint16 length + bytes
    CONSTANT,
    // uint16 action id, uint8 argument count
    ACTION,
    // uint16 size, only present for the TT qualifier
    EQUALITY,
    // uint16 removed size, int16 offset, uint16 saved size
    DESTRUCT,
    // int32 bp size, int32 sp size
    STORE_STATE;
  }

  public static final int QUALIFIER_STORE_STATE = 0x10;
  public static final int QUALIFIER_STACK = 0x01;
  public static final int QUALIFIER_INT = 0x03;

  private static final ImmutableMap<Integer, Opcode> BY_CODE =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(o -> o.code, o -> o));

  private final int code;
  private final Layout layout;

  private Opcode(int code, Layout layout) {
    this.code = code;
    this.layout = layout;
  }

  public int code() {
    return code;
  }

  public Layout layout() {
    return layout;
  }

  public boolean isJump() {
    return this == JMP || this == JSR || this == JZ || this == JNZ;
  }

  public static Optional<Opcode> fromCode(int code) {
    return Optional.ofNullable(BY_CODE.get(code));
  }
}
