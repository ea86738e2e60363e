package ncsdecomp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/** Decompiles {@code .ncs} files into {@code .nss} files, one at a time or in batches. */
public final class FileDecompiler {
  private static final Logger LOGGER = LogManager.getLogger();

  static final String INPUT_EXTENSION = "ncs";
  static final String OUTPUT_EXTENSION = "nss";

  private final Decompiler decompiler;

  public FileDecompiler(Decompiler decompiler) {
    this.decompiler = decompiler;
  }

  public DecompileResult decompileFile(File input) throws DecompilerException {
    return decompiler.decompile(read(input));
  }

  /** Decompiles {@code input} into {@code output}, creating missing parent directories. */
  public DecompileResult decompileToFile(File input, File output, Charset charset)
      throws DecompilerException {
    DecompileResult result = decompileFile(input);
    write(result.source(), output, charset);
    return result;
  }

  public DecompileResult decompileToFile(File input, File output) throws DecompilerException {
    return decompileToFile(input, output, decompiler.options().charset());
  }

  /**
   * Decompiles every input into {@code outDir}, named after the input with an {@code .nss}
   * extension. A bad file is recorded in its outcome and does not stop the run.
   */
  public ImmutableList<FileOutcome> decompileAll(List<File> inputs, File outDir) {
    ImmutableList.Builder<FileOutcome> outcomes = ImmutableList.builder();
    int done = 0;
    for (File input : inputs) {
      File output = outputFile(input, outDir);
      FileOutcome outcome;
      try {
        outcome = FileOutcome.written(input, output, decompileToFile(input, output));
      } catch (DecompilerException ex) {
        LOGGER.warn("{} failed: {}", input, ex.describe());
        outcome = FileOutcome.failed(input, ex.describe());
      } catch (CancellationException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        LOGGER.error("{} failed unexpectedly", input, ex);
        outcome = FileOutcome.failed(input, "internal error: " + ex);
      }
      outcomes.add(outcome);
      done++;
      LOGGER.info("{}/{} {}", done, inputs.size(), outcome.summary());
    }
    return outcomes.build();
  }

  /** {@code fileOrDir} itself, or the {@code .ncs} files directly inside it, sorted by name. */
  public static ImmutableList<File> listScripts(File fileOrDir) throws DecompilerException {
    if (fileOrDir.isFile()) return ImmutableList.of(fileOrDir);
    File[] children = fileOrDir.listFiles();
    if (children == null) {
      throw ioError("not a file or directory: " + fileOrDir, null);
    }
    return Arrays.stream(children)
        .filter(f -> f.isFile() && INPUT_EXTENSION.equalsIgnoreCase(extension(f)))
        .sorted(Comparator.comparing(File::getName))
        .collect(ImmutableList.toImmutableList());
  }

  static File outputFile(File input, File outDir) {
    String name = Files.getNameWithoutExtension(input.getName());
    return new File(outDir, name + "." + OUTPUT_EXTENSION);
  }

  private static String extension(File file) {
    return Files.getFileExtension(file.getName());
  }

  /**
   * Compiles {@code source} into {@code output}. When the compiler fails, {@code output} receives
   * the diagnostic text instead, so a missing file is never mistaken for success, and the failure
   * is rethrown.
   */
  public static void compileToFile(
      ExternalCompiler compiler, String source, GameVariant variant, File output)
      throws DecompilerException {
    byte[] compiled;
    try {
      compiled = compiler.compile(source, variant);
    } catch (DecompilerException ex) {
      try {
        Files.createParentDirs(output);
        Files.asCharSink(output, StandardCharsets.UTF_8)
            .write("// compilation failed\n// " + ex.describe() + "\n");
      } catch (IOException writeError) {
        ex.addSuppressed(writeError);
      }
      throw ex;
    }
    try {
      Files.createParentDirs(output);
      Files.write(compiled, output);
    } catch (IOException ex) {
      throw ioError("cannot write " + output + ": " + ex.getMessage(), ex);
    }
  }

  static byte[] read(File input) throws DecompilerException {
    try {
      return Files.toByteArray(input);
    } catch (IOException ex) {
      throw ioError("cannot read " + input + ": " + ex.getMessage(), ex);
    }
  }

  static void write(String text, File output, Charset charset) throws DecompilerException {
    try {
      Files.createParentDirs(output);
      Files.asCharSink(output, charset).write(text);
    } catch (IOException ex) {
      throw ioError("cannot write " + output + ": " + ex.getMessage(), ex);
    }
  }

  private static DecompilerException ioError(String message, Throwable cause) {
    return new DecompilerException(
        DecompilerException.NO_POS, DecompilerException.ErrorKind.IO, message, cause);
  }
}
