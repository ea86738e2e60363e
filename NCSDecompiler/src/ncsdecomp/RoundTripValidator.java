package ncsdecomp;

import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Checks that decompilation is stable: the decompiled source is recompiled by an external
 * compiler and decompiled again, and both trees must have the same {@link ScriptShape}.
 */
public final class RoundTripValidator {
  private static final Logger LOGGER = LogManager.getLogger();

  public enum Status {
    MATCH,
    MISMATCH,
    // The round trip could not be confirmed; nothing is known about the decompilation.
    COMPILER_FAILURE,
    DECOMPILE_FAILURE;
  }

  @AutoValue
  public abstract static class Result {
    public abstract Status status();

    public abstract Optional<String> original();

    public abstract Optional<String> recompiled();

    /** First normalised line that differs, as {@code line N: <original> | <recompiled>}. */
    public abstract Optional<String> firstDifference();

    public abstract Optional<DecompilerException> error();

    static Result failure(Status status, Optional<String> original, DecompilerException error) {
      return new AutoValue_RoundTripValidator_Result(
          status, original, Optional.empty(), Optional.empty(), Optional.of(error));
    }

    static Result compared(
        Status status, String original, String recompiled, Optional<String> firstDifference) {
      return new AutoValue_RoundTripValidator_Result(
          status,
          Optional.of(original),
          Optional.of(recompiled),
          firstDifference,
          Optional.empty());
    }
  }

  private final Decompiler decompiler;
  private final ExternalCompiler compiler;

  public RoundTripValidator(Decompiler decompiler, ExternalCompiler compiler) {
    this.decompiler = decompiler;
    this.compiler = compiler;
  }

  public Result validate(byte[] ncs) {
    DecompileResult first;
    try {
      first = decompiler.decompile(ncs);
    } catch (DecompilerException ex) {
      return Result.failure(Status.DECOMPILE_FAILURE, Optional.empty(), ex);
    }

    byte[] recompiled;
    try {
      recompiled = compiler.compile(first.source(), decompiler.options().variant());
    } catch (DecompilerException ex) {
      LOGGER.warn("Round trip not confirmed: {}", ex.describe());
      return Result.failure(Status.COMPILER_FAILURE, Optional.of(first.source()), ex);
    }

    DecompileResult second;
    try {
      second = decompiler.decompile(recompiled);
    } catch (DecompilerException ex) {
      return Result.failure(Status.DECOMPILE_FAILURE, Optional.of(first.source()), ex);
    }

    boolean same = ScriptShape.of(first.script()).equals(ScriptShape.of(second.script()));
    Optional<String> difference =
        firstDifference(normalize(first.source()), normalize(second.source()));
    if (!same) {
      LOGGER.info("Round trip mismatch at {}", difference.orElse("tree shape"));
    }
    return Result.compared(
        same ? Status.MATCH : Status.MISMATCH, first.source(), second.source(), difference);
  }

  /** Non-empty lines with runs of whitespace collapsed and comment lines dropped. */
  static ImmutableList<String> normalize(String source) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (String line : Splitter.on('\n').split(source)) {
      String collapsed = CharMatcher.whitespace().trimAndCollapseFrom(line, ' ');
      if (collapsed.isEmpty() || collapsed.startsWith("//")) continue;
      lines.add(collapsed);
    }
    return lines.build();
  }

  static Optional<String> firstDifference(List<String> original, List<String> recompiled) {
    int common = Math.min(original.size(), recompiled.size());
    for (int i = 0; i < common; i++) {
      if (!original.get(i).equals(recompiled.get(i))) {
        return Optional.of(difference(i, original.get(i), recompiled.get(i)));
      }
    }
    if (original.size() == recompiled.size()) return Optional.empty();
    return Optional.of(
        difference(
            common,
            common < original.size() ? original.get(common) : "<end>",
            common < recompiled.size() ? recompiled.get(common) : "<end>"));
  }

  private static String difference(int index, String original, String recompiled) {
    return String.format("line %d: %s | %s", index + 1, original, recompiled);
  }
}
