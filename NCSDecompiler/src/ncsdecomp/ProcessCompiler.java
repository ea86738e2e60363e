package ncsdecomp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/**
 * Runs an {@code nwnnsscomp}-style executable: {@code <exe> -c <source> -o <output> -g <1|2>}.
 *
 * <p>Every call works in a fresh temporary directory that is removed afterwards, whatever the
 * outcome. Failing to remove it is logged and otherwise ignored.
 */
public final class ProcessCompiler implements ExternalCompiler {
  private static final Logger LOGGER = LogManager.getLogger();

  private final File executable;
  private final Duration timeout;
  private final Charset charset;
  // Parent of the per-call directories; the system default when absent.
  private final Optional<File> workRoot;

  public ProcessCompiler(File executable, Duration timeout, Charset charset) {
    this(executable, timeout, charset, Optional.empty());
  }

  ProcessCompiler(File executable, Duration timeout, Charset charset, Optional<File> workRoot) {
    this.executable = executable;
    this.timeout = timeout;
    this.charset = charset;
    this.workRoot = workRoot;
  }

  public static ProcessCompiler fromOptions(DecompilerOptions options) throws DecompilerException {
    File executable =
        options
            .compiler()
            .orElseThrow(
                () -> failure("no compiler configured; set " + DecompilerOptions.COMPILER));
    return new ProcessCompiler(executable, options.compilerTimeout(), options.charset());
  }

  @Override
  public byte[] compile(String source, GameVariant variant) throws DecompilerException {
    File dir;
    try {
      dir =
          workRoot.isPresent()
              ? java.nio.file.Files.createTempDirectory(workRoot.get().toPath(), "ncsdecomp")
                  .toFile()
              : java.nio.file.Files.createTempDirectory("ncsdecomp").toFile();
    } catch (IOException ex) {
      throw new DecompilerException(
          DecompilerException.NO_POS,
          DecompilerException.ErrorKind.IO,
          "cannot create a temporary directory: " + ex.getMessage(),
          ex);
    }
    try {
      return run(dir, source, variant);
    } finally {
      try {
        MoreFiles.deleteRecursively(dir.toPath(), RecursiveDeleteOption.ALLOW_INSECURE);
      } catch (IOException ex) {
        LOGGER.warn("Could not remove {}: {}", dir, ex.getMessage());
      }
    }
  }

  private byte[] run(File dir, String source, GameVariant variant) throws DecompilerException {
    File input = new File(dir, "script.nss");
    File output = new File(dir, "script.ncs");
    File log = new File(dir, "compiler.log");
    List<String> command =
        ImmutableList.of(
            executable.getPath(),
            "-c",
            input.getPath(),
            "-o",
            output.getPath(),
            "-g",
            variant.compilerGameFlag());
    try {
      Files.asCharSink(input, charset).write(source);
      LOGGER.info("Running {}", String.join(" ", command));
      Process process =
          new ProcessBuilder(command)
              .directory(dir)
              .redirectErrorStream(true)
              .redirectOutput(log)
              .start();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw logged(failure("compiler timed out after " + timeout.getSeconds() + "s"));
      }
      String diagnostics = Files.asCharSource(log, StandardCharsets.UTF_8).read().trim();
      if (process.exitValue() != 0) {
        throw logged(failure("compiler exited with " + process.exitValue() + ": " + diagnostics));
      }
      if (!output.isFile()) {
        throw logged(failure("compiler wrote no output: " + diagnostics));
      }
      return Files.toByteArray(output);
    } catch (IOException ex) {
      throw logged(
          new DecompilerException(
              DecompilerException.NO_POS,
              DecompilerException.ErrorKind.COMPILER,
              "cannot run " + executable + ": " + ex.getMessage(),
              ex));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw failure("interrupted while waiting for the compiler");
    }
  }

  private static DecompilerException failure(String message) {
    return new DecompilerException(
        DecompilerException.NO_POS, DecompilerException.ErrorKind.COMPILER, message);
  }

  private static DecompilerException logged(DecompilerException ex) {
    LOGGER.warn("Compilation failed: {}", ex.describe());
    return ex;
  }
}
