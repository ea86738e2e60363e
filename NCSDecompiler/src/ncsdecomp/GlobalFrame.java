package ncsdecomp;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * The stack as it stands at the globals routine's SAVEBP: the slots every BP-relative access
 * addresses. Shared read-only by all subroutines once {@link #groupAccesses} has run.
 */
public final class GlobalFrame {
  private final ImmutableList<Variable> slots;

  GlobalFrame(List<Variable> slots) {
    this.slots = ImmutableList.copyOf(slots);
  }

  /** Scalars, bottom of the stack first. */
  public ImmutableList<Variable> slots() {
    return slots;
  }

  public int size() {
    return slots.size();
  }

  /** Index of the slot {@code depth} slots below BP, or -1 when out of range. */
  public int indexAtDepth(int depth) {
    int index = slots.size() - depth;
    return index >= 0 && depth > 0 ? index : -1;
  }

  /** Declared globals in declaration order, grouped members folded into their group. */
  public ImmutableList<Variable> variables() {
    Set<Variable> roots = new LinkedHashSet<>();
    for (Variable slot : slots) {
      roots.add(slot.root());
    }
    return ImmutableList.copyOf(roots);
  }

  /**
   * Groups globals that any routine copies as a multi-slot unit. Doing this before routines are
   * tracked keeps the frame immutable while they are tracked in parallel.
   */
  void groupAccesses(Program program) {
    for (Subroutine subroutine : program.subroutines()) {
      for (Command command : subroutine.commands()) {
        if (command.kind() != Command.Kind.COPY_TOP_BP
            && command.kind() != Command.Kind.COPY_DOWN_BP) {
          continue;
        }
        Command.StackCopy copy = command.cast();
        int width = NodeQueries.slot(copy.size());
        int start = indexAtDepth(NodeQueries.depth(copy.offset()));
        if (width < 2 || start < 0 || start + width > slots.size()) continue;

        List<Variable> members = new ArrayList<>(slots.subList(start, start + width));
        if (members.stream().noneMatch(m -> m.group().isPresent())) {
          boolean vector =
              width == 3 && members.stream().allMatch(m -> m.type() == ValueType.FLOAT);
          Variable.group(vector ? ValueType.VECTOR : ValueType.STRUCT, members);
        }
      }
    }
  }
}
