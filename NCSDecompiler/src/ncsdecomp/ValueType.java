package ncsdecomp;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** Value types of the scripting language, with their bytecode codes and stack widths. */
public enum ValueType {
  VOID(0x00, "void", 0),
  INT(0x03, "int", 1),
  FLOAT(0x04, "float", 1),
  STRING(0x05, "string", 1),
  OBJECT(0x06, "object", 1),
  EFFECT(0x10, "effect", 1),
  EVENT(0x11, "event", 1),
  LOCATION(0x12, "location", 1),
  TALENT(0x13, "talent", 1),
  // Vectors have no qualifier of their own; -16 is the code the action tables use for them.
  VECTOR(-16, "vector", 3),
  // Closures passed to actions such as DelayCommand. They live outside the value stack.
  ACTION(-1, "action", 0),
  // Structures have a per-variable width, see Variable#width().
  STRUCT(-2, "struct", 1);

  private static final ImmutableMap<Integer, ValueType> BY_QUALIFIER =
      Arrays.stream(values())
          .filter(t -> t.code > 0)
          .collect(ImmutableMap.toImmutableMap(t -> t.code, t -> t));

  private static final ImmutableMap<String, ValueType> BY_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(t -> t.typeName, t -> t));

  private final int code;
  private final String typeName;
  private final int width;

  private ValueType(int code, String typeName, int width) {
    this.code = code;
    this.typeName = typeName;
    this.width = width;
  }

  public int code() {
    return code;
  }

  public String typeName() {
    return typeName;
  }

  /** Number of 4-byte stack slots a value of this type occupies. */
  public int width() {
    return width;
  }

  public int byteSize() {
    return width * 4;
  }

  public boolean isEngineType() {
    return code >= EFFECT.code && code <= TALENT.code;
  }

  public static Optional<ValueType> fromQualifier(int qualifier) {
    return Optional.ofNullable(BY_QUALIFIER.get(qualifier));
  }

  public static Optional<ValueType> fromName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }
}
