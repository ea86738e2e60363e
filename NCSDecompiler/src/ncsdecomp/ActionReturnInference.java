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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Guesses the results of actions the table has no signature for.
 *
 * <p>Each routine is walked with every slot marked as a variable (reserved by RSADD or lying below
 * the entry) or a temporary. Operators, conditional jumps, stores and call arguments only ever
 * consume temporaries, so when one of them would eat a variable under the assumption that an
 * earlier unknown action returned nothing, that action is taken to return a single slot instead.
 * An unknown action whose next command drops exactly one slot in the middle of a block is read as
 * a call whose result is ignored. Inferences hold program-wide: one action id has one return type.
 */
final class ActionReturnInference {
  private static final Logger LOGGER = LogManager.getLogger();
  // Slots standing for whatever lies below the routine's entry.
  private static final int ENTRY = 64;

  private final Program program;
  private final ActionTable base;
  private final Map<Integer, SubroutineSignature> signatures;
  private final Map<Integer, ValueType> inferred = new HashMap<>();

  private ActionReturnInference(
      Program program, ActionTable base, Map<Integer, SubroutineSignature> signatures) {
    this.program = program;
    this.base = base;
    this.signatures = signatures;
  }

  /**
   * Return types for unknown actions whose results the program consumes, given the provisional
   * slot counts in {@code signatures}. Types already in {@code known} are kept.
   */
  static ImmutableMap<Integer, ValueType> infer(
      Program program,
      ActionTable base,
      Map<Integer, SubroutineSignature> signatures,
      Map<Integer, ValueType> known) {
    ActionReturnInference inference = new ActionReturnInference(program, base, signatures);
    inference.inferred.putAll(known);
    for (Subroutine subroutine : program.subroutines()) {
      // Each new inference can expose another, so walk again until nothing changes.
      while (inference.walk(subroutine)) {}
    }
    return ImmutableMap.copyOf(inference.inferred);
  }

  /** {@code base} with the given return types filled in where it knows none. */
  static ActionTable withReturnTypes(ActionTable base, Map<Integer, ValueType> returnTypes) {
    if (returnTypes.isEmpty()) return base;
    ImmutableMap<Integer, ValueType> types = ImmutableMap.copyOf(returnTypes);
    return new ActionTable() {
      @Override
      public Optional<String> name(int actionId) {
        return base.name(actionId);
      }

      @Override
      public Optional<ImmutableList<ValueType>> paramTypes(int actionId) {
        return base.paramTypes(actionId);
      }

      @Override
      public Optional<ValueType> returnType(int actionId) {
        Optional<ValueType> known = base.returnType(actionId);
        return known.isPresent() ? known : Optional.ofNullable(types.get(actionId));
      }
    };
  }

  private static final class Candidate {
    final int actionId;
    // Where the result would sit, relative to the entry height.
    final int height;
    final ValueType type;

    Candidate(int actionId, int height, ValueType type) {
      this.actionId = actionId;
      this.height = height;
      this.type = type;
    }
  }

  /** A run of slots one consumer pops, top first, with the type it expects there. */
  private static final class Operand {
    final int width;
    final ValueType type;

    Operand(int width, ValueType type) {
      this.width = width;
      this.type = type;
    }
  }

  // Per walk.
  private List<Boolean> temps;
  private final List<Candidate> candidates = new ArrayList<>();

  /** Returns whether the walk inferred a new return type. */
  private boolean walk(Subroutine subroutine) {
    ActionTable actions = withReturnTypes(base, inferred);
    temps = entryStack();
    candidates.clear();
    boolean reachable = true;
    int pendingActions = 0;
    Map<Integer, List<Boolean>> saved = new HashMap<>();
    Deque<Closure> closures = new ArrayDeque<>();

    for (int i = 0; i < subroutine.size(); i++) {
      while (!closures.isEmpty() && closures.peek().end <= i) {
        temps = closures.pop().stack;
        reachable = true;
        pendingActions++;
      }
      if (!reachable) {
        List<Boolean> restored = saved.remove(i);
        if (restored == null) continue;
        temps = restored;
        reachable = true;
      }

      Command command = subroutine.command(i);
      Optional<Candidate> culprit = Optional.empty();
      switch (command.kind()) {
        case CONDITIONAL_JUMP:
          culprit = consume(ImmutableList.of(new Operand(1, ValueType.INT)));
          save(subroutine, i, command, saved);
          break;
        case JUMP:
          if (!closures.isEmpty() && closures.peek().storeIndex == i - 1) break;
          save(subroutine, i, command, saved);
          reachable = false;
          break;
        case JUMP_TO_SUBROUTINE:
          callSubroutine(command);
          break;
        case RETURN:
          reachable = false;
          break;
        case COPY_TOP_SP:
        case COPY_TOP_BP:
          push(NodeQueries.slot(command.<Command.StackCopy>cast().size()), true);
          break;
        case COPY_DOWN_SP:
        case COPY_DOWN_BP:
          {
            int width = NodeQueries.slot(command.<Command.StackCopy>cast().size());
            culprit = consume(ImmutableList.of(new Operand(width, ValueType.INT)));
            push(width, true);
            break;
          }
        case MOVE_SP:
          pop(NodeQueries.depth(command.<Command.MoveSp>cast().offset()));
          break;
        case RSADD:
          push(1, false);
          break;
        case CONSTANT:
          push(1, true);
          break;
        case ACTION:
          {
            Command.Action action = command.cast();
            List<Operand> operands = new ArrayList<>();
            for (ValueType type :
                StackTracker.actionParamTypes(actions, action, pendingActions)) {
              if (type == ValueType.ACTION) {
                pendingActions = Math.max(0, pendingActions - 1);
              } else {
                operands.add(new Operand(type.width(), type));
              }
            }
            culprit = consume(operands);
            if (culprit.isPresent()) break;
            int id = action.actionId();
            if (actions.returnType(id).isPresent()) {
              push(actions.resolvedReturnType(id).width(), true);
            } else if (discardsResult(subroutine, i)) {
              culprit = Optional.of(new Candidate(id, height(), ValueType.INT));
            } else {
              candidates.add(new Candidate(id, height(), ValueType.INT));
            }
            break;
          }
        case LOGICAL:
          culprit =
              consume(
                  ImmutableList.of(
                      new Operand(1, ValueType.INT), new Operand(1, ValueType.INT)));
          push(1, true);
          break;
        case BINARY:
          {
            Command.Binary binary = command.cast();
            culprit =
                consume(
                    ImmutableList.of(
                        new Operand(NodeQueries.rightWidth(binary), binary.types().right()),
                        new Operand(NodeQueries.leftWidth(binary), binary.types().left())));
            push(NodeQueries.resultWidth(binary), true);
            break;
          }
        case UNARY:
          {
            ValueType type = command.<Command.Unary>cast().type();
            culprit = consume(ImmutableList.of(new Operand(type.width(), type)));
            push(type.width(), true);
            break;
          }
        case DESTRUCT:
          {
            Command.Destruct destruct = command.cast();
            culprit =
                consume(
                    ImmutableList.of(
                        new Operand(NodeQueries.slot(destruct.removeSize()), ValueType.INT)));
            push(NodeQueries.slot(destruct.saveSize()), true);
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
              closures.push(new Closure(new ArrayList<>(temps), i, end));
            }
            break;
          }
        case STACK_OP:
        case BP:
          break;
      }
      if (culprit.isPresent()) {
        Candidate found = culprit.get();
        inferred.put(found.actionId, found.type);
        LOGGER.debug(
            "Action {} in {} taken to return {}",
            found.actionId,
            subroutine,
            found.type.typeName());
        return true;
      }
    }
    return false;
  }

  private static final class Closure {
    final List<Boolean> stack;
    final int storeIndex;
    final int end;

    Closure(List<Boolean> stack, int storeIndex, int end) {
      this.stack = stack;
      this.storeIndex = storeIndex;
      this.end = end;
    }
  }

  /**
   * Pops the arguments of a call without judging them: the callee's slot counts are themselves
   * provisional until the unknown actions settle.
   */
  private void callSubroutine(Command command) {
    Optional<Subroutine> callee = program.startingAt(NodeQueries.jumpDestination(command));
    if (!callee.isPresent()) return;
    SubroutineSignature signature = signatures.get(callee.get().index());
    if (signature == null) return;
    pop(signature.paramSlots());
    // The slots the caller reserved now hold the result.
    int reserved = Math.min(signature.callerReservedSlots(), temps.size());
    for (int k = temps.size() - reserved; k < temps.size(); k++) {
      temps.set(k, true);
    }
  }

  /**
   * Pops {@code operands}, top first. When one of them lands on a variable, returns the latest
   * unknown void action whose result would have been among the popped slots.
   */
  private Optional<Candidate> consume(List<Operand> operands) {
    int before = height();
    int lowestVariable = Integer.MAX_VALUE;
    for (Operand operand : operands) {
      for (int k = 0; k < operand.width; k++) {
        int position = height() - 1;
        if (!popOne()) {
          lowestVariable = Math.min(lowestVariable, position);
        }
      }
    }
    int after = height();
    Optional<Candidate> culprit = Optional.empty();
    if (lowestVariable != Integer.MAX_VALUE) {
      for (int k = candidates.size() - 1; k >= 0; k--) {
        Candidate candidate = candidates.get(k);
        if (candidate.height >= lowestVariable && candidate.height <= before) {
          ValueType type = operandTypeAt(operands, before + 1, candidate.height);
          culprit =
              Optional.of(
                  new Candidate(
                      candidate.actionId,
                      candidate.height,
                      type.width() == 1 ? type : ValueType.INT));
          break;
        }
      }
    }
    dropCandidatesAbove(after);
    return culprit;
  }

  /** The type of the operand that would cover {@code position} on a stack of {@code top}. */
  private static ValueType operandTypeAt(List<Operand> operands, int top, int position) {
    for (Operand operand : operands) {
      if (position >= top - operand.width && position < top) return operand.type;
      top -= operand.width;
    }
    return ValueType.INT;
  }

  /**
   * Whether the command after an action at {@code index} drops exactly its one-slot result: a
   * one-slot MOVSP that neither closes a block nor precedes a jump or the routine's end.
   */
  private static boolean discardsResult(Subroutine subroutine, int index) {
    if (index + 2 >= subroutine.size()) return false;
    Command next = subroutine.command(index + 1);
    if (next.kind() != Command.Kind.MOVE_SP
        || NodeQueries.depth(next.<Command.MoveSp>cast().offset()) != 1) {
      return false;
    }
    Command after = subroutine.command(index + 2);
    switch (after.kind()) {
      case JUMP:
      case RETURN:
      case MOVE_SP:
        return false;
      default:
        break;
    }
    // At a join the MOVSP may be popping what another path left.
    for (Command command : subroutine.commands()) {
      if (NodeQueries.isJump(command)
          && command.kind() != Command.Kind.JUMP_TO_SUBROUTINE
          && (NodeQueries.jumpDestination(command) == next.pos()
              || NodeQueries.jumpDestination(command) == after.pos())) {
        return false;
      }
    }
    return true;
  }

  private void save(
      Subroutine subroutine, int index, Command jump, Map<Integer, List<Boolean>> saved) {
    int destination = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(jump));
    if (destination > index
        && NodeQueries.isStoreStackNode(subroutine.command(destination - 1))) {
      saved.putIfAbsent(destination, new ArrayList<>(temps));
    }
  }

  private static List<Boolean> entryStack() {
    return new ArrayList<>(Collections.nCopies(ENTRY, false));
  }

  private int height() {
    return temps.size() - ENTRY;
  }

  private void push(int width, boolean temporary) {
    for (int k = 0; k < width; k++) {
      temps.add(temporary);
    }
  }

  /** Pops one slot and reports whether it was a temporary; an exhausted stack yields variables. */
  private boolean popOne() {
    if (temps.isEmpty()) return false;
    return temps.remove(temps.size() - 1);
  }

  private void pop(int width) {
    for (int k = 0; k < width; k++) {
      popOne();
    }
    dropCandidatesAbove(height());
  }

  private void dropCandidatesAbove(int height) {
    candidates.removeIf(candidate -> candidate.height > height);
  }
}
