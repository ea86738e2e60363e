package ncsdecomp;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** What one command did to the simulated stack, as recorded by {@link StackTracker}. */
@AutoValue
public abstract class StackEffect {
  public abstract int index();

  /** False for commands no path reaches. */
  public abstract boolean reachable();

  /** Values popped as operands, left operand or first argument first. */
  public abstract ImmutableList<Value> consumed();

  public abstract Optional<Value> produced();

  /** Variable read by a copy, written by an assignment, or stepped by an increment. */
  public abstract Optional<VarAccess> access();

  /** Variable reserved by an RSADD. */
  public abstract Optional<Variable> declared();

  /** Temporaries dropped by a MOVSP without being used, bottom first. */
  public abstract ImmutableList<Value> discarded();

  /** Assignment into the caller-reserved return slots. */
  public abstract boolean returnWrite();

  /** Value left above the frame at the routine's final return. */
  public abstract Optional<Value> returnValue();

  /** For STORE_STATE: index of the first command after the deferred action body, else -1. */
  public abstract int closureEnd();

  /** For SAVEBP in the globals routine: temporaries that became globals without an RSADD. */
  public abstract ImmutableList<Variable> promoted();

  public abstract Builder toBuilder();

  public static Builder builder(int index) {
    return new AutoValue_StackEffect.Builder()
        .setIndex(index)
        .setReachable(true)
        .setConsumed(ImmutableList.of())
        .setDiscarded(ImmutableList.of())
        .setReturnWrite(false)
        .setClosureEnd(-1)
        .setPromoted(ImmutableList.of());
  }

  public static StackEffect unreachable(int index) {
    return builder(index).setReachable(false).build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setIndex(int index);

    public abstract Builder setReachable(boolean reachable);

    public abstract Builder setConsumed(ImmutableList<Value> consumed);

    public abstract Builder setProduced(Value produced);

    public abstract Builder setAccess(VarAccess access);

    public abstract Builder setDeclared(Variable declared);

    public abstract Builder setDiscarded(ImmutableList<Value> discarded);

    public abstract Builder setReturnWrite(boolean returnWrite);

    public abstract Builder setReturnValue(Value returnValue);

    public abstract Builder setClosureEnd(int closureEnd);

    public abstract Builder setPromoted(ImmutableList<Variable> promoted);

    public abstract StackEffect build();
  }
}
