package ncsdecomp;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A temporary on the simulated stack. Most values are produced by exactly one command; the others
 * are views assembled when a consumer takes slots that do not line up with one produced value.
 */
public final class Value {
  public enum Kind {
    // Result of the command at producer().
    PRODUCED,
    // Adjacent values taken together, e.g. three floats forming a vector literal.
    COMPOSITE,
    // Some slots of a wider value.
    MEMBER,
    // Variable slots consumed directly.
    READ;
  }

  private final int id;
  private final Kind kind;
  private final ValueType type;
  private final int width;
  private final int producer;
  private final ImmutableList<Value> parts;
  private final Value source;
  private final int offset;
  private final VarAccess access;

  private Value(
      int id,
      Kind kind,
      ValueType type,
      int width,
      int producer,
      ImmutableList<Value> parts,
      Value source,
      int offset,
      VarAccess access) {
    this.id = id;
    this.kind = kind;
    this.type = type;
    this.width = width;
    this.producer = producer;
    this.parts = parts;
    this.source = source;
    this.offset = offset;
    this.access = access;
  }

  static Value produced(int id, ValueType type, int width, int producer) {
    return new Value(id, Kind.PRODUCED, type, width, producer, ImmutableList.of(), null, 0, null);
  }

  static Value composite(int id, List<Value> parts) {
    Preconditions.checkArgument(parts.size() > 1, "composite of %s", parts);
    int width = parts.stream().mapToInt(Value::width).sum();
    boolean vector = width == 3 && parts.stream().allMatch(p -> p.type == ValueType.FLOAT);
    return new Value(
        id,
        Kind.COMPOSITE,
        vector ? ValueType.VECTOR : ValueType.STRUCT,
        width,
        -1,
        ImmutableList.copyOf(parts),
        null,
        0,
        null);
  }

  static Value member(int id, Value source, int offset, int width) {
    ValueType type;
    if (source.type == ValueType.VECTOR && width == 1) {
      type = ValueType.FLOAT;
    } else if (width == 3 && source.type == ValueType.STRUCT) {
      type = ValueType.VECTOR;
    } else {
      type = width == 1 ? ValueType.INT : ValueType.STRUCT;
    }
    return new Value(id, Kind.MEMBER, type, width, -1, ImmutableList.of(), source, offset, null);
  }

  static Value read(int id, VarAccess access) {
    return new Value(
        id, Kind.READ, access.type(), access.width(), -1, ImmutableList.of(), null, 0, access);
  }

  public int id() {
    return id;
  }

  public Kind kind() {
    return kind;
  }

  public ValueType type() {
    return type;
  }

  public int width() {
    return width;
  }

  /** Index of the producing command, or -1 for assembled views. */
  public int producer() {
    return producer;
  }

  public ImmutableList<Value> parts() {
    return parts;
  }

  public Optional<Value> source() {
    return Optional.ofNullable(source);
  }

  public int offset() {
    return offset;
  }

  public Optional<VarAccess> access() {
    return Optional.ofNullable(access);
  }

  @Override
  public String toString() {
    return String.format("v%d:%s/%s", id, type.typeName(), kind);
  }
}
