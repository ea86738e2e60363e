package ncsdecomp;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A lifted program: the node arena and its subroutines in file order. */
@AutoValue
public abstract class Program {
  public enum EntryStyle {
    // JSR; RETN.
    STUB,
    // RSADDI; JSR; RETN: the script returns an int to the engine.
    CONDITIONAL_STUB,
    // No stub: the first subroutine is the entry routine itself.
    DIRECT;
  }

  public abstract NodeTree tree();

  public abstract ImmutableList<Subroutine> subroutines();

  public abstract EntryStyle entryStyle();

  public static Program create(
      NodeTree tree, ImmutableList<Subroutine> subroutines, EntryStyle entryStyle) {
    return new AutoValue_Program(tree, subroutines, entryStyle);
  }

  public Optional<Subroutine> startingAt(int pos) {
    return subroutines().stream().filter(s -> s.startPos() == pos).findFirst();
  }

  public Optional<Subroutine> containing(int pos) {
    return subroutines().stream().filter(s -> s.contains(pos)).findFirst();
  }

  public Optional<Subroutine> globals() {
    return withRole(Subroutine.Role.GLOBALS);
  }

  public Subroutine main() {
    return withRole(Subroutine.Role.MAIN).orElseGet(() -> subroutines().get(0));
  }

  private Optional<Subroutine> withRole(Subroutine.Role role) {
    return subroutines().stream().filter(s -> s.role() == role).findFirst();
  }
}
