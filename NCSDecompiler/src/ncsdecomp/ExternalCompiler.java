package ncsdecomp;

/** A script compiler outside this process, used to recompile decompiled source. */
public interface ExternalCompiler {

  /**
   * Compiles {@code source} for {@code variant} and returns the compiled program's bytes.
   *
   * @throws DecompilerException of kind {@code COMPILER} when the compiler fails, times out or
   *     writes no output
   */
  byte[] compile(String source, GameVariant variant) throws DecompilerException;
}
