package ncsdecomp;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/** A subroutine of a program: its command block and the span it covers. */
@AutoValue
public abstract class Subroutine {
  public enum Role {
    // [RSADDI] JSR; RETN at offset 13, jumping to the globals or the main routine.
    ENTRY_STUB,
    // Declares and initialises globals, then SAVEBP; JSR main.
    GLOBALS,
    MAIN,
    ORDINARY;
  }

  public abstract int index();

  /** SUBROUTINE node in the program's {@link NodeTree}. */
  public abstract int node();

  public abstract Role role();

  public abstract ImmutableList<Command> commands();

  public final int startPos() {
    return commands().get(0).pos();
  }

  /** Position of the terminating return. */
  public final int endPos() {
    return commands().get(commands().size() - 1).pos();
  }

  /** First byte after the subroutine. */
  public final int limitPos() {
    Command last = commands().get(commands().size() - 1);
    return last.pos() + last.length();
  }

  public final boolean contains(int pos) {
    return pos >= startPos() && pos < limitPos();
  }

  @Memoized
  ImmutableSortedMap<Integer, Integer> indexByPos() {
    ImmutableSortedMap.Builder<Integer, Integer> builder = ImmutableSortedMap.naturalOrder();
    for (int i = 0; i < commands().size(); i++) {
      builder.put(commands().get(i).pos(), i);
    }
    return builder.build();
  }

  /** Index of the command at exactly {@code pos}, or -1. */
  public final int indexAt(int pos) {
    Integer index = indexByPos().get(pos);
    return index == null ? -1 : index;
  }

  /** Index of the first command at or after {@code pos}, or -1 if none lies inside this routine. */
  public final int indexAtOrAfter(int pos) {
    if (!contains(pos)) return -1;
    Integer key = indexByPos().ceilingKey(pos);
    return key == null ? -1 : indexByPos().get(key);
  }

  public final Command command(int index) {
    return commands().get(index);
  }

  public final int size() {
    return commands().size();
  }

  public static Subroutine create(int index, int node, Role role, ImmutableList<Command> commands) {
    return new AutoValue_Subroutine(index, node, role, commands);
  }

  @Override
  public final String toString() {
    return String.format("%s#%d@%08X", role(), index(), startPos());
  }
}
