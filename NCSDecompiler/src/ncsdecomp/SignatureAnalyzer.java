package ncsdecomp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import com.google.common.graph.Traverser;

/**
 * Infers every subroutine's calling convention.
 *
 * <p>Slot counts come first, callees before callers: a routine's parameter slots are the slots it
 * removes below its entry height, and its return slots are those it writes below its parameters.
 * Mutually recursive routines are iterated until the counts settle. Types come second, callers
 * before callees: each call site reports its argument types and the type of the slots reserved
 * for the result.
 */
final class SignatureAnalyzer {
  private static final Logger LOGGER = LogManager.getLogger();
  private static final int MAX_ROUNDS = 16;

  @AutoValue
  abstract static class Analysis {
    abstract ImmutableMap<Integer, SubroutineSignature> signatures();

    abstract Optional<GlobalFrame> globalFrame();

    /** Tracking of the globals routine, whose variables make up {@link #globalFrame()}. */
    abstract Optional<StackTracker.Result> globalsResult();

    /** The action table with the return types guessed for unknown actions filled in. */
    abstract ActionTable actions();
  }

  private static final class SlotCounts {
    final int paramSlots;
    final int writtenBelow;

    SlotCounts(int paramSlots, int writtenBelow) {
      this.paramSlots = paramSlots;
      this.writtenBelow = writtenBelow;
    }

    int returnSlots() {
      return Math.max(0, writtenBelow - paramSlots);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof SlotCounts)) return false;
      SlotCounts other = (SlotCounts) o;
      return paramSlots == other.paramSlots && writtenBelow == other.writtenBelow;
    }

    @Override
    public int hashCode() {
      return paramSlots * 31 + writtenBelow;
    }
  }

  private final Program program;
  private final ActionTable declared;
  private ActionTable actions;

  SignatureAnalyzer(Program program, ActionTable actions) {
    this.program = program;
    this.declared = actions;
    this.actions = actions;
  }

  Analysis analyze() {
    List<Integer> calleesFirst = calleesFirstOrder();

    // Every pass that guesses a new action result changes the heights, so count again.
    Map<Integer, SubroutineSignature> provisional;
    ImmutableMap<Integer, ValueType> guessed = ImmutableMap.of();
    while (true) {
      provisional = provisionalSignatures(countAll(calleesFirst));
      ImmutableMap<Integer, ValueType> next =
          ActionReturnInference.infer(program, declared, provisional, guessed);
      if (next.equals(guessed)) break;
      guessed = next;
      actions = ActionReturnInference.withReturnTypes(declared, guessed);
    }
    Map<Integer, SubroutineSignature> signatures = provisional;

    Optional<StackTracker.Result> globalsResult = Optional.empty();
    Optional<GlobalFrame> globalFrame = Optional.empty();
    if (program.globals().isPresent()) {
      try {
        StackTracker.Result result =
            new StackTracker(
                    program, program.globals().get(), signatures, Optional.empty(), actions)
                .run();
        globalsResult = Optional.of(result);
        globalFrame = result.globalFrame();
        globalFrame.ifPresent(frame -> frame.groupAccesses(program));
      } catch (DecompilerException ex) {
        LOGGER.warn("Globals could not be tracked: {}", ex.describe());
      }
    }

    Map<Integer, ValueType> resultTypes = new HashMap<>();
    Map<Integer, ValueType> returnedTypes = new HashMap<>();
    for (int index : Lists.reverse(calleesFirst)) {
      Subroutine subroutine = program.subroutines().get(index);
      if (subroutine.role() == Subroutine.Role.GLOBALS) {
        globalsResult.ifPresent(r -> recordCallSites(r, signatures, resultTypes));
        continue;
      }
      try {
        StackTracker.Result result =
            new StackTracker(program, subroutine, signatures, globalFrame, actions).run();
        recordCallSites(result, signatures, resultTypes);
        result.returnedType().ifPresent(type -> returnedTypes.put(index, type));
      } catch (DecompilerException ex) {
        LOGGER.debug("Type inference skipped {}: {}", subroutine, ex.describe());
      }
    }

    ImmutableMap.Builder<Integer, SubroutineSignature> finished = ImmutableMap.builder();
    for (Subroutine subroutine : program.subroutines()) {
      SubroutineSignature signature =
          finish(
              subroutine,
              signatures.get(subroutine.index()),
              Optional.ofNullable(resultTypes.get(subroutine.index())),
              Optional.ofNullable(returnedTypes.get(subroutine.index())));
      LOGGER.debug("{}: {}", subroutine, signature);
      finished.put(subroutine.index(), signature);
    }
    return new AutoValue_SignatureAnalyzer_Analysis(
        finished.build(), globalFrame, globalsResult, actions);
  }

  private Map<Integer, SlotCounts> countAll(List<Integer> calleesFirst) {
    Map<Integer, SlotCounts> counts = new HashMap<>();
    for (int round = 0; round < MAX_ROUNDS; round++) {
      boolean changed = false;
      for (int index : calleesFirst) {
        SlotCounts updated = countSlots(program.subroutines().get(index), counts);
        changed |= !updated.equals(counts.put(index, updated));
      }
      if (!changed) break;
    }
    return counts;
  }

  private Map<Integer, SubroutineSignature> provisionalSignatures(
      Map<Integer, SlotCounts> counts) {
    Map<Integer, SubroutineSignature> signatures = new HashMap<>();
    for (Subroutine subroutine : program.subroutines()) {
      signatures.put(
          subroutine.index(),
          provisionalSignature(subroutine, counts.get(subroutine.index())).build());
    }
    return signatures;
  }

  private List<Integer> calleesFirstOrder() {
    MutableGraph<Integer> calls = GraphBuilder.directed().allowsSelfLoops(true).build();
    for (Subroutine subroutine : program.subroutines()) {
      calls.addNode(subroutine.index());
      for (Command command : subroutine.commands()) {
        if (command.kind() != Command.Kind.JUMP_TO_SUBROUTINE) continue;
        program
            .startingAt(NodeQueries.jumpDestination(command))
            .ifPresent(callee -> calls.putEdge(subroutine.index(), callee.index()));
      }
    }
    List<Integer> order = new ArrayList<>();
    Traverser.forGraph(calls).depthFirstPostOrder(calls.nodes()).forEach(order::add);
    return order;
  }

  /** Walks stack heights relative to the routine's entry. */
  private SlotCounts countSlots(Subroutine subroutine, Map<Integer, SlotCounts> counts) {
    int height = 0;
    int lowestWrite = 0;
    Integer finalHeight = null;
    boolean reachable = true;
    int pendingActions = 0;
    Map<Integer, Integer> saved = new HashMap<>();
    Deque<int[]> closures = new ArrayDeque<>();

    for (int i = 0; i < subroutine.size(); i++) {
      while (!closures.isEmpty() && closures.peek()[2] <= i) {
        height = closures.pop()[0];
        reachable = true;
        pendingActions++;
      }
      if (!reachable) {
        Integer restored = saved.remove(i);
        if (restored == null) continue;
        height = restored;
        reachable = true;
      }

      Command command = subroutine.command(i);
      switch (command.kind()) {
        case CONDITIONAL_JUMP:
          height--;
          saveHeight(subroutine, i, command, height, saved);
          break;
        case JUMP:
          if (!closures.isEmpty() && closures.peek()[1] == i - 1) break;
          saveHeight(subroutine, i, command, height, saved);
          reachable = false;
          break;
        case JUMP_TO_SUBROUTINE:
          {
            Optional<Subroutine> callee =
                program.startingAt(NodeQueries.jumpDestination(command));
            if (callee.isPresent() && counts.containsKey(callee.get().index())) {
              height -= counts.get(callee.get().index()).paramSlots;
            }
            break;
          }
        case RETURN:
          if (closures.isEmpty()) {
            finalHeight = height;
          }
          reachable = false;
          break;
        case COPY_TOP_SP:
        case COPY_TOP_BP:
          height += NodeQueries.slot(command.<Command.StackCopy>cast().size());
          break;
        case COPY_DOWN_SP:
          lowestWrite =
              Math.min(
                  lowestWrite,
                  height - NodeQueries.depth(command.<Command.StackCopy>cast().offset()));
          break;
        case MOVE_SP:
          height += NodeQueries.slot(command.<Command.MoveSp>cast().offset());
          break;
        case RSADD:
        case CONSTANT:
          height++;
          break;
        case ACTION:
          {
            Command.Action action = command.cast();
            for (ValueType type :
                StackTracker.actionParamTypes(actions, action, pendingActions)) {
              if (type == ValueType.ACTION) {
                pendingActions = Math.max(0, pendingActions - 1);
              } else {
                height -= type.width();
              }
            }
            height += actions.resolvedReturnType(action.actionId()).width();
            break;
          }
        case LOGICAL:
          height--;
          break;
        case BINARY:
          {
            Command.Binary binary = command.cast();
            height -=
                NodeQueries.leftWidth(binary)
                    + NodeQueries.rightWidth(binary)
                    - NodeQueries.resultWidth(binary);
            break;
          }
        case DESTRUCT:
          {
            Command.Destruct destruct = command.cast();
            height -=
                NodeQueries.slot(destruct.removeSize()) - NodeQueries.slot(destruct.saveSize());
            break;
          }
        case STORE_STATE:
          {
            int end =
                i + 1 < subroutine.size()
                    ? subroutine.indexAtOrAfter(
                        NodeQueries.jumpDestination(subroutine.command(i + 1)))
                    : -1;
            if (end > i + 1) {
              closures.push(new int[] {height, i, end});
            }
            break;
          }
        case COPY_DOWN_BP:
        case UNARY:
        case STACK_OP:
        case BP:
          break;
      }
    }

    int paramSlots = finalHeight != null && finalHeight < 0 ? -finalHeight : 0;
    return new SlotCounts(paramSlots, -lowestWrite);
  }

  private static void saveHeight(
      Subroutine subroutine, int index, Command jump, int height, Map<Integer, Integer> saved) {
    int destination = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(jump));
    if (destination > index
        && NodeQueries.isStoreStackNode(subroutine.command(destination - 1))) {
      saved.putIfAbsent(destination, height);
    }
  }

  private SubroutineSignature.Builder provisionalSignature(
      Subroutine subroutine, SlotCounts counts) {
    SubroutineSignature.Builder builder =
        SubroutineSignature.builder(subroutine.index()).setParamSlots(counts.paramSlots);
    int returnSlots = counts.returnSlots();
    if (subroutine.role() == Subroutine.Role.MAIN
        && program.globals().isPresent()
        && returnSlots > 1) {
      // Writes reach past the globals into the slot the conditional stub reserved.
      return builder.setReturnSlots(1).setReturnBelowGlobals(true);
    }
    return builder.setReturnSlots(returnSlots);
  }

  private static void recordCallSites(
      StackTracker.Result result,
      Map<Integer, SubroutineSignature> signatures,
      Map<Integer, ValueType> resultTypes) {
    for (StackTracker.CallSite site : result.callSites()) {
      SubroutineSignature callee = signatures.get(site.callee());
      if (callee == null) continue;
      if (callee.paramTypes().isEmpty() && callee.paramSlots() > 0) {
        SubroutineSignature typed = callee.toBuilder().setParamTypes(site.argTypes()).build();
        if (typed.isTyped()) {
          signatures.put(site.callee(), typed);
        }
      }
      site.resultType().ifPresent(type -> resultTypes.putIfAbsent(site.callee(), type));
    }
  }

  private SubroutineSignature finish(
      Subroutine subroutine,
      SubroutineSignature provisional,
      Optional<ValueType> resultType,
      Optional<ValueType> returnedType) {
    SubroutineSignature.Builder builder = provisional.toBuilder();
    if (!provisional.isTyped()) {
      builder.setParamTypes(
          ImmutableList.copyOf(Collections.nCopies(provisional.paramSlots(), ValueType.INT)));
    }

    int returnSlots = provisional.returnSlots();
    ValueType returnType;
    if (subroutine.role() == Subroutine.Role.MAIN
        && program.entryStyle() == Program.EntryStyle.CONDITIONAL_STUB) {
      returnType = ValueType.INT;
    } else if (returnSlots == 0) {
      returnType = returnedType.orElse(ValueType.VOID);
    } else {
      returnType =
          resultType
              .filter(t -> t.width() == returnSlots)
              .orElse(returnedType.filter(t -> t.width() == returnSlots).orElse(null));
      if (returnType == null) {
        returnType =
            returnSlots == 1
                ? ValueType.INT
                : returnSlots == 3 ? ValueType.VECTOR : ValueType.STRUCT;
      }
    }
    return builder.setReturnType(returnType).build();
  }
}
