package ncsdecomp;

/** A failure to decompile, positioned at the byte offset of the offending instruction. */
public class DecompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum ErrorKind {
    // Malformed bytes or operands; the whole program is abandoned.
    DECODE,
    // A variable reference that no tracked declaration resolves.
    UNRESOLVED_VARIABLE,
    // More slots popped than the tracked stack holds.
    STACK_UNDERFLOW,
    // The external compiler failed, timed out or produced nothing.
    COMPILER,
    IO;

    public boolean isSubroutineScoped() {
      return this == UNRESOLVED_VARIABLE || this == STACK_UNDERFLOW;
    }
  }

  public static final int NO_POS = -1;

  private final int pos;
  private final ErrorKind kind;
  private final String errorMsg;

  public DecompilerException(int pos, ErrorKind kind, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.kind = kind;
    this.errorMsg = errorMsg;
  }

  public DecompilerException(int pos, ErrorKind kind, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.pos = pos;
    this.kind = kind;
    this.errorMsg = errorMsg;
  }

  public int pos() {
    return pos;
  }

  public ErrorKind kind() {
    return kind;
  }

  public String describe() {
    if (pos == NO_POS) {
      return String.format("ERROR: %s %s", kind, errorMsg);
    }
    return String.format("ERROR: %s@%08X %s", kind, pos, errorMsg);
  }

  public void print() {
    System.out.println(describe());
  }
}
