package ncsdecomp;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Finds the jump shapes the reconstructor needs before it walks a subroutine: loop tails,
 * short-circuit guards, jump destinations and the shared return epilogue.
 *
 * <p>The short-circuit shapes, with {@code a} already on the stack:
 *
 * <pre>
 *   a && b:   CPTOPSP -4 4; JZ L; b; LOGANDII; L:
 *   a || b:   CPTOPSP -4 4; JZ +12; JMP L; b; LOGORII; L:
 *   a || b:   CPTOPSP -4 4; JNZ L; b; LOGORII; L:
 * </pre>
 */
final class ControlFlowClassifier {

  @AutoValue
  abstract static class ControlFlow {
    /** Loop head index to the index of its last backward jump. */
    abstract ImmutableMap<Integer, Integer> loopTails();

    /** Jumps belonging to a short-circuit operator rather than to a statement. */
    abstract ImmutableSet<Integer> shortCircuitJumps();

    abstract ImmutableSet<Integer> jumpTargets();

    /** First index of the trailing MOVSP/RETN run every return jumps into. */
    abstract int epilogueStart();

    boolean isLoopHead(int index) {
      return loopTails().containsKey(index);
    }

    boolean isShortCircuit(int index) {
      return shortCircuitJumps().contains(index);
    }

    boolean isReturnTarget(int index) {
      return index >= epilogueStart();
    }
  }

  private ControlFlowClassifier() {}

  static ControlFlow classify(Program program, Subroutine subroutine) {
    NodeTree tree = program.tree();
    Map<Integer, Integer> loopTails = new HashMap<>();
    Set<Integer> shortCircuit = new HashSet<>();
    Set<Integer> targets = new HashSet<>();

    // Later jumps first, so the outermost tail of a head is the first one recorded.
    NodeTraversal.prunedReversed(
        tree,
        subroutine.node(),
        new NodeTraversal.Handlers()
            .onEach(
                EnumSet.allOf(Command.Kind.class),
                (node, command) -> NodeTraversal.Visit.SKIP_CHILDREN)
            .on(
                Command.Kind.JUMP,
                (node, command) -> {
                  classifyJump(subroutine, command, loopTails, shortCircuit);
                  return NodeTraversal.Visit.SKIP_CHILDREN;
                })
            .on(
                Command.Kind.CONDITIONAL_JUMP,
                (node, command) -> {
                  classifyJump(subroutine, command, loopTails, shortCircuit);
                  return NodeTraversal.Visit.SKIP_CHILDREN;
                }));

    NodeTraversal.Handler collectTarget =
        (node, command) -> {
          int target = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(command));
          if (target >= 0) {
            targets.add(target);
          }
          return NodeTraversal.Visit.SKIP_CHILDREN;
        };
    NodeTraversal.forward(
        tree,
        subroutine.node(),
        new NodeTraversal.Handlers()
            .onEach(
                EnumSet.allOf(Command.Kind.class),
                (node, command) -> NodeTraversal.Visit.SKIP_CHILDREN)
            .on(Command.Kind.JUMP, collectTarget)
            .on(Command.Kind.CONDITIONAL_JUMP, collectTarget));

    return new AutoValue_ControlFlowClassifier_ControlFlow(
        ImmutableMap.copyOf(loopTails),
        ImmutableSet.copyOf(shortCircuit),
        ImmutableSet.copyOf(targets),
        epilogueStart(subroutine));
  }

  private static void classifyJump(
      Subroutine subroutine,
      Command command,
      Map<Integer, Integer> loopTails,
      Set<Integer> shortCircuit) {
    int index = subroutine.indexAt(command.pos());
    int destination = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(command));
    if (index < 0 || destination < 0) return;

    if (destination <= index) {
      loopTails.putIfAbsent(destination, index);
      return;
    }
    if (command.kind() != Command.Kind.CONDITIONAL_JUMP || !isDuplicate(subroutine, index - 1)) {
      return;
    }

    Command beforeTarget = subroutine.command(destination - 1);
    if (NodeQueries.isJz(command) && isLogical(beforeTarget, Command.LogicalOp.AND)) {
      shortCircuit.add(index);
    } else if (NodeQueries.isJnz(command) && isLogical(beforeTarget, Command.LogicalOp.OR)) {
      shortCircuit.add(index);
    } else if (NodeQueries.isJzPastOne(command)
        && destination == index + 2
        && subroutine.command(index + 1).kind() == Command.Kind.JUMP) {
      int end =
          subroutine.indexAtOrAfter(NodeQueries.jumpDestination(subroutine.command(index + 1)));
      if (end > index + 2 && isLogical(subroutine.command(end - 1), Command.LogicalOp.OR)) {
        shortCircuit.add(index);
        shortCircuit.add(index + 1);
      }
    }
  }

  private static boolean isDuplicate(Subroutine subroutine, int index) {
    if (index < 0) return false;
    Command command = subroutine.command(index);
    if (command.kind() != Command.Kind.COPY_TOP_SP) return false;
    Command.StackCopy copy = command.cast();
    return copy.offset() == -4 && copy.size() == 4;
  }

  private static boolean isLogical(Command command, Command.LogicalOp op) {
    return command.kind() == Command.Kind.LOGICAL && command.<Command.Logical>cast().op() == op;
  }

  private static int epilogueStart(Subroutine subroutine) {
    int start = subroutine.size() - 1;
    while (start > 0 && subroutine.command(start - 1).kind() == Command.Kind.MOVE_SP) {
      start--;
    }
    return start;
  }
}
