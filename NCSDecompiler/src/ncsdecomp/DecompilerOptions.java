package ncsdecomp;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

import com.google.auto.value.AutoValue;

/** Settings of a decompilation run. */
@AutoValue
public abstract class DecompilerOptions {
  public static final String VARIANT = "ncsdecomp.variant";
  public static final String CHARSET = "ncsdecomp.charset";
  public static final String FOLD_CONSTANTS = "ncsdecomp.foldConstants";
  public static final String PREFER_SWITCHES = "ncsdecomp.preferSwitches";
  public static final String PARALLEL = "ncsdecomp.parallel";
  public static final String COMPILER = "ncsdecomp.compiler";
  public static final String COMPILER_TIMEOUT_SECONDS = "ncsdecomp.compilerTimeoutSeconds";
  public static final String NWSCRIPT_K1 = "ncsdecomp.nwscript.k1";
  public static final String NWSCRIPT_K2 = "ncsdecomp.nwscript.k2";

  public abstract GameVariant variant();

  /** Encoding of emitted source files. */
  public abstract Charset charset();

  /** Fold arithmetic over literals, rendering {@code 8} instead of {@code 5 + 3}. */
  public abstract boolean foldConstants();

  /**
   * Render a chain of {@code if}/{@code else if} that compares one variable against integer
   * literals as a {@code switch}.
   */
  public abstract boolean preferSwitches();

  /** Decompile the subroutines of one program concurrently. */
  public abstract boolean parallelSubroutines();

  public abstract Duration compilerTimeout();

  public abstract Optional<File> compiler();

  public abstract Optional<File> nwscriptK1();

  public abstract Optional<File> nwscriptK2();

  public Optional<File> nwscriptFile(GameVariant variant) {
    return variant == GameVariant.K1 ? nwscriptK1() : nwscriptK2();
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_DecompilerOptions.Builder()
        .setVariant(GameVariant.K1)
        .setCharset(StandardCharsets.UTF_8)
        .setFoldConstants(false)
        .setPreferSwitches(false)
        .setParallelSubroutines(false)
        .setCompilerTimeout(Duration.ofSeconds(30));
  }

  public static DecompilerOptions defaults() {
    return builder().build();
  }

  /** Reads the {@code ncsdecomp.*} keys; absent keys keep their defaults. */
  public static DecompilerOptions fromProperties(Properties properties) {
    Builder builder = builder();
    String variant = properties.getProperty(VARIANT);
    if (variant != null) {
      builder.setVariant(
          GameVariant.parse(variant)
              .orElseThrow(() -> new IllegalArgumentException("unknown variant: " + variant)));
    }
    String charset = properties.getProperty(CHARSET);
    if (charset != null) {
      builder.setCharset(Charset.forName(charset.trim()));
    }
    String fold = properties.getProperty(FOLD_CONSTANTS);
    if (fold != null) {
      builder.setFoldConstants(Boolean.parseBoolean(fold.trim()));
    }
    String switches = properties.getProperty(PREFER_SWITCHES);
    if (switches != null) {
      builder.setPreferSwitches(Boolean.parseBoolean(switches.trim()));
    }
    String parallel = properties.getProperty(PARALLEL);
    if (parallel != null) {
      builder.setParallelSubroutines(Boolean.parseBoolean(parallel.trim()));
    }
    String compiler = properties.getProperty(COMPILER);
    if (compiler != null) {
      builder.setCompiler(new File(compiler.trim()));
    }
    String timeout = properties.getProperty(COMPILER_TIMEOUT_SECONDS);
    if (timeout != null) {
      try {
        builder.setCompilerTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("bad " + COMPILER_TIMEOUT_SECONDS + ": " + timeout, ex);
      }
    }
    String k1 = properties.getProperty(NWSCRIPT_K1);
    if (k1 != null) {
      builder.setNwscriptK1(new File(k1.trim()));
    }
    String k2 = properties.getProperty(NWSCRIPT_K2);
    if (k2 != null) {
      builder.setNwscriptK2(new File(k2.trim()));
    }
    return builder.build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setVariant(GameVariant variant);

    public abstract Builder setCharset(Charset charset);

    public abstract Builder setFoldConstants(boolean foldConstants);

    public abstract Builder setPreferSwitches(boolean preferSwitches);

    public abstract Builder setParallelSubroutines(boolean parallelSubroutines);

    public abstract Builder setCompilerTimeout(Duration compilerTimeout);

    public abstract Builder setCompiler(File compiler);

    public abstract Builder setNwscriptK1(File nwscriptK1);

    public abstract Builder setNwscriptK2(File nwscriptK2);

    public abstract DecompilerOptions build();
  }
}
