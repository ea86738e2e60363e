package ncsdecomp;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** Whether one subroutine of a program decompiled, and why not. */
@AutoValue
public abstract class SubroutineOutcome {
  public abstract int index();

  public abstract Subroutine.Role role();

  /** The name the routine is emitted under; the globals routine is {@code globals}. */
  public abstract String name();

  public abstract Optional<DecompilerException> error();

  public final boolean succeeded() {
    return !error().isPresent();
  }

  public static SubroutineOutcome success(int index, Subroutine.Role role, String name) {
    return new AutoValue_SubroutineOutcome(index, role, name, Optional.empty());
  }

  public static SubroutineOutcome failure(
      int index, Subroutine.Role role, String name, DecompilerException error) {
    return new AutoValue_SubroutineOutcome(index, role, name, Optional.of(error));
  }
}
