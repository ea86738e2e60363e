package ncsdecomp;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

/** Operand type qualifiers of the two-operand instructions. */
public enum TypePair {
  II(0x20, ValueType.INT, ValueType.INT),
  FF(0x21, ValueType.FLOAT, ValueType.FLOAT),
  OO(0x22, ValueType.OBJECT, ValueType.OBJECT),
  SS(0x23, ValueType.STRING, ValueType.STRING),
  TT(0x24, ValueType.STRUCT, ValueType.STRUCT),
  IF(0x25, ValueType.INT, ValueType.FLOAT),
  FI(0x26, ValueType.FLOAT, ValueType.INT),
  EFFECT_EFFECT(0x30, ValueType.EFFECT, ValueType.EFFECT),
  EVENT_EVENT(0x31, ValueType.EVENT, ValueType.EVENT),
  LOCATION_LOCATION(0x32, ValueType.LOCATION, ValueType.LOCATION),
  TALENT_TALENT(0x33, ValueType.TALENT, ValueType.TALENT),
  VV(0x3A, ValueType.VECTOR, ValueType.VECTOR),
  VF(0x3B, ValueType.VECTOR, ValueType.FLOAT),
  FV(0x3C, ValueType.FLOAT, ValueType.VECTOR);

  private static final ImmutableMap<Integer, TypePair> BY_QUALIFIER =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(p -> p.qualifier, p -> p));

  private final int qualifier;
  private final ValueType left;
  private final ValueType right;

  private TypePair(int qualifier, ValueType left, ValueType right) {
    this.qualifier = qualifier;
    this.left = left;
    this.right = right;
  }

  public int qualifier() {
    return qualifier;
  }

  public ValueType left() {
    return left;
  }

  public ValueType right() {
    return right;
  }

  public boolean hasVector() {
    return left == ValueType.VECTOR || right == ValueType.VECTOR;
  }

  public static Optional<TypePair> fromQualifier(int qualifier) {
    return Optional.ofNullable(BY_QUALIFIER.get(qualifier));
  }
}
