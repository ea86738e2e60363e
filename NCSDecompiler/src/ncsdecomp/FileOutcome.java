package ncsdecomp;

import java.io.File;
import java.util.Optional;

import com.google.auto.value.AutoValue;

/** What a batch run did with one input file. */
@AutoValue
public abstract class FileOutcome {
  public enum Status {
    DECOMPILED,
    // Written, but some routines are placeholders.
    PARTIAL,
    FAILED;
  }

  public abstract File input();

  public abstract Status status();

  public abstract Optional<File> output();

  /** Description of the error, or of the first failed routine for a partial result. */
  public abstract Optional<String> message();

  static FileOutcome written(File input, File output, DecompileResult result) {
    if (result.complete()) {
      return new AutoValue_FileOutcome(
          input, Status.DECOMPILED, Optional.of(output), Optional.empty());
    }
    String message =
        result.failures().size()
            + " routine(s) failed, first: "
            + result.failures().get(0).error().get().describe();
    return new AutoValue_FileOutcome(
        input, Status.PARTIAL, Optional.of(output), Optional.of(message));
  }

  static FileOutcome failed(File input, String message) {
    return new AutoValue_FileOutcome(input, Status.FAILED, Optional.empty(), Optional.of(message));
  }

  /** One line for console summaries. */
  public String summary() {
    switch (status()) {
      case DECOMPILED:
        return String.format("OK       %s -> %s", input(), output().get());
      case PARTIAL:
        return String.format("PARTIAL  %s -> %s: %s", input(), output().get(), message().get());
      case FAILED:
        return String.format("FAILED   %s: %s", input(), message().get());
    }
    throw new IllegalStateException("unknown status " + status());
  }
}
