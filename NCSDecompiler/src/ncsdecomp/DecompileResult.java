package ncsdecomp;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A decompiled program: its lifted form, the reconstructed tree and the emitted text. */
@AutoValue
public abstract class DecompileResult {
  public abstract Program program();

  public abstract Script script();

  public abstract String source();

  /** One entry per emitted subroutine, plus the globals routine when the program has one. */
  public abstract ImmutableList<SubroutineOutcome> outcomes();

  /** True when every subroutine decompiled. */
  public final boolean complete() {
    return outcomes().stream().allMatch(SubroutineOutcome::succeeded);
  }

  public final ImmutableList<SubroutineOutcome> failures() {
    return outcomes().stream()
        .filter(o -> !o.succeeded())
        .collect(ImmutableList.toImmutableList());
  }

  static DecompileResult create(
      Program program, Script script, String source, ImmutableList<SubroutineOutcome> outcomes) {
    return new AutoValue_DecompileResult(program, script, source, outcomes);
  }
}
