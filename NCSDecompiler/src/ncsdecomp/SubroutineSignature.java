package ncsdecomp;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

/**
 * Calling convention of one subroutine. The caller reserves {@link #returnSlots()} with RSADD,
 * pushes the arguments last parameter first and jumps; the callee removes {@link #paramSlots()}
 * before returning.
 */
@AutoValue
public abstract class SubroutineSignature {
  public abstract int index();

  /** Parameter types, first parameter first; empty while only the slot count is known. */
  public abstract ImmutableList<ValueType> paramTypes();

  public abstract int paramSlots();

  public abstract ValueType returnType();

  public abstract int returnSlots();

  /**
   * True for a main routine entered through the globals routine whose return slot lies below the
   * globals, reserved by the conditional entry stub.
   */
  public abstract boolean returnBelowGlobals();

  @Memoized
  public ImmutableList<Integer> paramWidths() {
    ImmutableList.Builder<Integer> widths = ImmutableList.builder();
    for (ValueType type : paramTypes()) {
      widths.add(type.width());
    }
    return widths.build();
  }

  /** Whether the parameter types account for every parameter slot. */
  public final boolean isTyped() {
    return paramWidths().stream().mapToInt(Integer::intValue).sum() == paramSlots();
  }

  /** Slots the caller reserves before pushing arguments. */
  public final int callerReservedSlots() {
    return returnBelowGlobals() ? 0 : returnSlots();
  }

  public abstract Builder toBuilder();

  public static Builder builder(int index) {
    return new AutoValue_SubroutineSignature.Builder()
        .setIndex(index)
        .setParamTypes(ImmutableList.of())
        .setParamSlots(0)
        .setReturnType(ValueType.VOID)
        .setReturnSlots(0)
        .setReturnBelowGlobals(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndex(int index);

    public abstract Builder setParamTypes(ImmutableList<ValueType> paramTypes);

    public abstract Builder setParamSlots(int paramSlots);

    public abstract Builder setReturnType(ValueType returnType);

    public abstract Builder setReturnSlots(int returnSlots);

    public abstract Builder setReturnBelowGlobals(boolean returnBelowGlobals);

    public abstract SubroutineSignature build();
  }
}
