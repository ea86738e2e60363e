package ncsdecomp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.auto.value.AutoValue;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

import ncsdecomp.DecompilerException.ErrorKind;

/**
 * Simulates the evaluation stack of one subroutine, recording for each command the values it
 * consumed and produced and the variables it touched.
 *
 * <p>Commands are walked in file order. At a forward jump the stack is saved for the destination;
 * after an unconditional jump or a return the walk resumes from that saved stack, and commands
 * with none are unreachable. When both a fallthrough and a saved stack reach a command, the
 * fallthrough wins. A STORE_STATE body (a deferred action argument) is walked on a copy of the
 * stack and leaves one pending action value behind for the ACTION that consumes it.
 */
public final class StackTracker {
  private static final Logger LOGGER = LogManager.getLogger();

  /** Argument shapes seen at one JSR. */
  @AutoValue
  public abstract static class CallSite {
    public abstract int callee();

    /** Argument types, first parameter first. */
    public abstract ImmutableList<ValueType> argTypes();

    /** Type of the slots the caller reserved for the result, if any. */
    public abstract Optional<ValueType> resultType();

    static CallSite create(
        int callee, ImmutableList<ValueType> argTypes, Optional<ValueType> resultType) {
      return new AutoValue_StackTracker_CallSite(callee, argTypes, resultType);
    }
  }

  @AutoValue
  public abstract static class Result {
    public abstract Subroutine subroutine();

    public abstract ImmutableList<StackEffect> effects();

    /** Parameters, first parameter first. */
    public abstract ImmutableList<Variable> parameters();

    public abstract ImmutableList<CallSite> callSites();

    /** Type of the values written into the return slots or left for the caller. */
    public abstract Optional<ValueType> returnedType();

    /** For the globals routine: the frame at SAVEBP. */
    public abstract Optional<GlobalFrame> globalFrame();

    public final StackEffect effect(int index) {
      return effects().get(index);
    }
  }

  private static final class Slot {
    final Variable variable;
    final Value value;
    final int component;

    private Slot(Variable variable, Value value, int component) {
      this.variable = variable;
      this.value = value;
      this.component = component;
    }

    static Slot of(Variable variable) {
      return new Slot(variable, null, 0);
    }

    static Slot of(Value value, int component) {
      return new Slot(null, value, component);
    }

    boolean isVariable() {
      return variable != null;
    }
  }

  private static final class ClosureFrame {
    final List<Slot> saved;
    final int storeIndex;
    final int end;

    ClosureFrame(List<Slot> saved, int storeIndex, int end) {
      this.saved = saved;
      this.storeIndex = storeIndex;
      this.end = end;
    }
  }

  private final Program program;
  private final Subroutine subroutine;
  private final Map<Integer, SubroutineSignature> signatures;
  private final SubroutineSignature signature;
  private final Optional<GlobalFrame> globals;
  private final ActionTable actions;

  private List<Slot> stack = new ArrayList<>();
  private int frameBase;
  private boolean reachable = true;
  private int nextValueId;
  private final Map<Integer, List<Slot>> savedStacks = new HashMap<>();
  private final Deque<ClosureFrame> closures = new ArrayDeque<>();
  private final Deque<Value> pendingActions = new ArrayDeque<>();
  private final List<StackEffect> effects = new ArrayList<>();
  private final ImmutableList.Builder<CallSite> callSites = ImmutableList.builder();
  private final Set<Integer> reportedActions = new HashSet<>();
  private ImmutableList<Variable> parameters = ImmutableList.of();
  private ValueType returnedType;
  private GlobalFrame frameAtSaveBp;

  public StackTracker(
      Program program,
      Subroutine subroutine,
      Map<Integer, SubroutineSignature> signatures,
      Optional<GlobalFrame> globals,
      ActionTable actions) {
    this.program = program;
    this.subroutine = subroutine;
    this.signatures = signatures;
    this.signature =
        signatures.getOrDefault(
            subroutine.index(), SubroutineSignature.builder(subroutine.index()).build());
    this.globals = globals;
    this.actions = actions;
  }

  public Result run() throws DecompilerException {
    enterFrame();
    for (int i = 0; i < subroutine.size(); i++) {
      while (!closures.isEmpty() && closures.peek().end <= i) {
        finishClosure();
      }
      if (!reachable) {
        List<Slot> saved = savedStacks.remove(i);
        if (saved == null) {
          effects.add(StackEffect.unreachable(i));
          continue;
        }
        stack = saved;
        reachable = true;
      }
      effects.add(step(i, subroutine.command(i)));
    }
    return new AutoValue_StackTracker_Result(
        subroutine,
        ImmutableList.copyOf(effects),
        parameters,
        callSites.build(),
        Optional.ofNullable(returnedType),
        Optional.ofNullable(frameAtSaveBp));
  }

  private void enterFrame() {
    boolean underGlobals = subroutine.role() == Subroutine.Role.MAIN && globals.isPresent();
    if (underGlobals && signature.returnBelowGlobals()) {
      pushVariables(returnVariables());
    }
    if (underGlobals) {
      for (Variable global : globals.get().slots()) {
        stack.add(Slot.of(global));
      }
    }
    if (!signature.returnBelowGlobals()) {
      pushVariables(returnVariables());
    }

    List<Variable> params = new ArrayList<>();
    if (signature.isTyped()) {
      for (ValueType type : signature.paramTypes()) {
        params.add(
            type == ValueType.VECTOR
                ? Variable.vector(Variable.Scope.PARAMETER, -1)
                : Variable.scalar(Variable.Scope.PARAMETER, scalarType(type), -1));
      }
    } else {
      for (int i = 0; i < signature.paramSlots(); i++) {
        params.add(Variable.scalar(Variable.Scope.PARAMETER, ValueType.INT, -1));
      }
    }
    // The first parameter is pushed last and sits on top.
    for (int i = params.size() - 1; i >= 0; i--) {
      pushVariables(ImmutableList.of(params.get(i)));
    }
    parameters = ImmutableList.copyOf(params);
    frameBase = stack.size();
  }

  private ImmutableList<Variable> returnVariables() {
    int slots = signature.returnSlots();
    if (slots == 0) return ImmutableList.of();
    if (slots == 3 && signature.returnType() == ValueType.VECTOR) {
      return ImmutableList.of(Variable.vector(Variable.Scope.RETURN, -1));
    }
    ImmutableList.Builder<Variable> vars = ImmutableList.builder();
    for (int i = 0; i < slots; i++) {
      ValueType type = slots == 1 ? scalarType(signature.returnType()) : ValueType.INT;
      vars.add(Variable.scalar(Variable.Scope.RETURN, type, -1));
    }
    return vars.build();
  }

  private static ValueType scalarType(ValueType type) {
    return type.width() == 1 ? type : ValueType.INT;
  }

  private void pushVariables(List<Variable> variables) {
    for (Variable variable : variables) {
      if (variable.members().isEmpty()) {
        stack.add(Slot.of(variable));
      } else {
        for (Variable member : variable.members()) {
          stack.add(Slot.of(member));
        }
      }
    }
  }

  private StackEffect step(int index, Command command) throws DecompilerException {
    StackEffect.Builder effect = StackEffect.builder(index);
    switch (command.kind()) {
      case CONDITIONAL_JUMP:
        effect.setConsumed(ImmutableList.of(popValue(command, 1)));
        saveForDestination(index, command);
        break;
      case JUMP:
        if (!closures.isEmpty() && closures.peek().storeIndex == index - 1) {
          // Skips the deferred action body, which is walked inline.
          break;
        }
        saveForDestination(index, command);
        reachable = false;
        break;
      case JUMP_TO_SUBROUTINE:
        callSubroutine(index, command, effect);
        break;
      case RETURN:
        if (closures.isEmpty()) {
          returnFromFrame(command, effect);
        }
        reachable = false;
        break;
      case COPY_TOP_SP:
      case COPY_TOP_BP:
        copyTop(index, command.cast(), effect);
        break;
      case COPY_DOWN_SP:
      case COPY_DOWN_BP:
        copyDown(index, command.cast(), effect);
        break;
      case MOVE_SP:
        moveSp(command.cast(), effect);
        break;
      case RSADD:
        {
          Command.RsAdd rsadd = command.cast();
          Variable.Scope scope =
              subroutine.role() == Subroutine.Role.GLOBALS
                  ? Variable.Scope.GLOBAL
                  : Variable.Scope.LOCAL;
          Variable variable = Variable.scalar(scope, rsadd.type(), index);
          stack.add(Slot.of(variable));
          effect.setDeclared(variable);
          break;
        }
      case CONSTANT:
        {
          Command.Constant constant = command.cast();
          effect.setProduced(push(Value.produced(nextValueId++, constant.type(), 1, index)));
          break;
        }
      case ACTION:
        callAction(index, command.cast(), effect);
        break;
      case LOGICAL:
        {
          Value right = popValue(command, 1);
          Value left = popValue(command, 1);
          effect.setConsumed(ImmutableList.of(left, right));
          effect.setProduced(push(Value.produced(nextValueId++, ValueType.INT, 1, index)));
          break;
        }
      case BINARY:
        {
          Command.Binary binary = command.cast();
          Value right = popValue(command, NodeQueries.rightWidth(binary));
          Value left = popValue(command, NodeQueries.leftWidth(binary));
          effect.setConsumed(ImmutableList.of(left, right));
          ValueType type = NodeQueries.resultType(binary);
          effect.setProduced(push(Value.produced(nextValueId++, type, type.width(), index)));
          break;
        }
      case UNARY:
        {
          Command.Unary unary = command.cast();
          effect.setConsumed(ImmutableList.of(popValue(command, 1)));
          effect.setProduced(push(Value.produced(nextValueId++, unary.type(), 1, index)));
          break;
        }
      case STACK_OP:
        {
          Command.StackOp op = command.cast();
          List<Slot> target =
              op.global()
                  ? globalSlots(command, op.offset(), 4)
                  : stackSlots(command, op.offset(), 4);
          effect.setAccess(accessFor(command, target));
          break;
        }
      case DESTRUCT:
        destruct(index, command.cast(), effect);
        break;
      case BP:
        {
          Command.Bp bp = command.cast();
          if (bp.save() && subroutine.role() == Subroutine.Role.GLOBALS) {
            saveGlobalFrame(effect);
          }
          break;
        }
      case STORE_STATE:
        storeState(index, command, effect);
        break;
    }
    return effect.build();
  }

  private Value push(Value value) {
    for (int i = 0; i < value.width(); i++) {
      stack.add(Slot.of(value, i));
    }
    return value;
  }

  private List<Slot> popSlots(Command command, int count) throws DecompilerException {
    if (count > stack.size()) {
      throw new DecompilerException(
          command.pos(),
          ErrorKind.STACK_UNDERFLOW,
          String.format("%s pops %d slots of %d", command, count, stack.size()));
    }
    List<Slot> top = stack.subList(stack.size() - count, stack.size());
    List<Slot> popped = new ArrayList<>(top);
    top.clear();
    return popped;
  }

  private Value popValue(Command command, int width) throws DecompilerException {
    return view(command, popSlots(command, width));
  }

  /** The value held by {@code slots}, assembling a view when they are not one produced value. */
  private Value view(Command command, List<Slot> slots) throws DecompilerException {
    Verify.verify(!slots.isEmpty(), "empty view at %s", command);
    List<Value> parts = new ArrayList<>();
    int start = 0;
    while (start < slots.size()) {
      int end = start + 1;
      Slot first = slots.get(start);
      if (first.isVariable()) {
        Variable root = first.variable.root();
        while (end < slots.size()
            && slots.get(end).isVariable()
            && root != first.variable
            && slots.get(end).variable.root() == root) {
          end++;
        }
        parts.add(Value.read(nextValueId++, accessFor(command, slots.subList(start, end))));
      } else {
        while (end < slots.size()
            && !slots.get(end).isVariable()
            && slots.get(end).value == first.value
            && slots.get(end).component == first.component + (end - start)) {
          end++;
        }
        int width = end - start;
        parts.add(
            first.component == 0 && width == first.value.width()
                ? first.value
                : Value.member(nextValueId++, first.value, first.component, width));
      }
      start = end;
    }
    return parts.size() == 1 ? parts.get(0) : Value.composite(nextValueId++, parts);
  }

  private List<Slot> stackSlots(Command command, int offset, int size) throws DecompilerException {
    int width = NodeQueries.slot(size);
    int start = stack.size() - NodeQueries.depth(offset);
    if (start < 0 || start + width > stack.size()) {
      throw new DecompilerException(
          command.pos(),
          ErrorKind.UNRESOLVED_VARIABLE,
          String.format("%s addresses beyond the %d tracked slots", command, stack.size()));
    }
    return stack.subList(start, start + width);
  }

  private List<Slot> globalSlots(Command command, int offset, int size)
      throws DecompilerException {
    if (!globals.isPresent()) {
      throw new DecompilerException(
          command.pos(), ErrorKind.UNRESOLVED_VARIABLE, command + " without a global frame");
    }
    GlobalFrame frame = globals.get();
    int width = NodeQueries.slot(size);
    int start = frame.indexAtDepth(NodeQueries.depth(offset));
    if (start < 0 || start + width > frame.size()) {
      throw new DecompilerException(
          command.pos(),
          ErrorKind.UNRESOLVED_VARIABLE,
          String.format("%s addresses beyond the %d globals", command, frame.size()));
    }
    List<Slot> slots = new ArrayList<>();
    for (Variable global : frame.slots().subList(start, start + width)) {
      slots.add(Slot.of(global));
    }
    return slots;
  }

  /** Resolves variable slots to one access, grouping scalars copied as a unit. */
  private VarAccess accessFor(Command command, List<Slot> slots) throws DecompilerException {
    List<Variable> scalars = new ArrayList<>();
    for (Slot slot : slots) {
      if (!slot.isVariable()) {
        throw new DecompilerException(
            command.pos(),
            ErrorKind.UNRESOLVED_VARIABLE,
            command + " addresses a temporary as a variable");
      }
      scalars.add(slot.variable);
    }

    Variable first = scalars.get(0);
    if (scalars.size() == 1) {
      return VarAccess.of(first.root(), first.offsetInRoot(), 1);
    }

    Variable root = first.root();
    if (root != first) {
      for (int i = 1; i < scalars.size(); i++) {
        Variable scalar = scalars.get(i);
        if (scalar.root() != root || scalar.offsetInRoot() != first.offsetInRoot() + i) {
          throw new DecompilerException(
              command.pos(),
              ErrorKind.UNRESOLVED_VARIABLE,
              command + " copies slots of overlapping structures");
        }
      }
      return VarAccess.of(root, first.offsetInRoot(), scalars.size());
    }

    if (scalars.stream().anyMatch(s -> s.group().isPresent())) {
      throw new DecompilerException(
          command.pos(),
          ErrorKind.UNRESOLVED_VARIABLE,
          command + " copies slots of overlapping structures");
    }
    if (first.scope() == Variable.Scope.GLOBAL
        && subroutine.role() != Subroutine.Role.GLOBALS) {
      throw new DecompilerException(
          command.pos(), ErrorKind.UNRESOLVED_VARIABLE, command + " regroups shared globals");
    }
    boolean vector =
        scalars.size() == 3 && scalars.stream().allMatch(s -> s.type() == ValueType.FLOAT);
    return VarAccess.whole(Variable.group(vector ? ValueType.VECTOR : ValueType.STRUCT, scalars));
  }

  private void copyTop(int index, Command.StackCopy copy, StackEffect.Builder effect)
      throws DecompilerException {
    List<Slot> source =
        copy.isGlobal()
            ? globalSlots(copy, copy.offset(), copy.size())
            : stackSlots(copy, copy.offset(), copy.size());
    int width = source.size();
    ValueType type;
    if (source.stream().allMatch(Slot::isVariable)) {
      VarAccess access = accessFor(copy, source);
      effect.setAccess(access);
      type = access.type();
    } else if (source.stream().noneMatch(Slot::isVariable)) {
      // A duplicated temporary: the copy stands for the same expression.
      Value copied = view(copy, new ArrayList<>(source));
      effect.setConsumed(ImmutableList.of(copied));
      type = copied.type();
    } else {
      throw new DecompilerException(
          copy.pos(), ErrorKind.UNRESOLVED_VARIABLE, copy + " mixes variables and temporaries");
    }
    effect.setProduced(push(Value.produced(nextValueId++, type, width, index)));
  }

  private void copyDown(int index, Command.StackCopy copy, StackEffect.Builder effect)
      throws DecompilerException {
    int width = NodeQueries.slot(copy.size());
    List<Slot> target =
        copy.isGlobal()
            ? globalSlots(copy, copy.offset(), copy.size())
            : stackSlots(copy, copy.offset(), copy.size());
    VarAccess access = accessFor(copy, target);
    Value source = popValue(copy, width);
    effect.setAccess(access);
    effect.setConsumed(ImmutableList.of(source));
    if (access.variable().scope() == Variable.Scope.RETURN) {
      effect.setReturnWrite(true);
      returnedType = access.isWhole() ? access.variable().type() : source.type();
    }
    effect.setProduced(push(Value.produced(nextValueId++, access.type(), width, index)));
  }

  private void moveSp(Command.MoveSp move, StackEffect.Builder effect)
      throws DecompilerException {
    int count = -NodeQueries.slot(move.offset());
    if (count <= 0) return;
    List<Slot> popped = popSlots(move, count);
    Map<Integer, Value> discarded = new LinkedHashMap<>();
    for (Slot slot : popped) {
      if (!slot.isVariable()) {
        discarded.putIfAbsent(slot.value.id(), slot.value);
      }
    }
    effect.setDiscarded(ImmutableList.copyOf(discarded.values()));
  }

  private void callSubroutine(int index, Command command, StackEffect.Builder effect)
      throws DecompilerException {
    int destination = NodeQueries.jumpDestination(command);
    Subroutine callee =
        program
            .startingAt(destination)
            .orElseThrow(
                () ->
                    new DecompilerException(
                        command.pos(),
                        ErrorKind.UNRESOLVED_VARIABLE,
                        String.format("JSR to %08X which starts no subroutine", destination)));
    SubroutineSignature calleeSignature =
        signatures.getOrDefault(
            callee.index(), SubroutineSignature.builder(callee.index()).build());

    ImmutableList.Builder<Value> args = ImmutableList.builder();
    ImmutableList.Builder<ValueType> argTypes = ImmutableList.builder();
    if (calleeSignature.isTyped()) {
      for (int width : calleeSignature.paramWidths()) {
        Value arg = popValue(command, width);
        args.add(arg);
        argTypes.add(arg.type());
      }
    } else {
      for (Value arg : popArgumentsByValue(command, calleeSignature.paramSlots())) {
        args.add(arg);
        argTypes.add(arg.type());
      }
    }
    effect.setConsumed(args.build());

    int reserved = calleeSignature.callerReservedSlots();
    Optional<ValueType> resultType = Optional.empty();
    if (reserved > 0) {
      List<Slot> placeholders = popSlots(command, reserved);
      resultType = Optional.of(placeholderType(placeholders));
      for (Slot slot : placeholders) {
        if (slot.isVariable()) {
          slot.variable.markCallResult();
        }
      }
      ValueType type =
          calleeSignature.returnType() != ValueType.VOID
              ? calleeSignature.returnType()
              : resultType.get();
      effect.setProduced(push(Value.produced(nextValueId++, type, reserved, index)));
    }
    callSites.add(CallSite.create(callee.index(), argTypes.build(), resultType));
  }

  /** Splits argument slots by the value that fills them, for callees whose types are unknown. */
  private List<Value> popArgumentsByValue(Command command, int slots)
      throws DecompilerException {
    List<Slot> popped = popSlots(command, slots);
    List<Value> args = new ArrayList<>();
    int end = popped.size();
    while (end > 0) {
      int start = end - 1;
      Slot last = popped.get(start);
      while (start > 0
          && !last.isVariable()
          && !popped.get(start - 1).isVariable()
          && popped.get(start - 1).value == last.value) {
        start--;
      }
      args.add(view(command, popped.subList(start, end)));
      end = start;
    }
    return args;
  }

  private static ValueType placeholderType(List<Slot> slots) {
    if (slots.size() == 3
        && slots.stream().allMatch(s -> s.isVariable() && s.variable.type() == ValueType.FLOAT)) {
      return ValueType.VECTOR;
    }
    if (slots.size() == 1 && slots.get(0).isVariable()) {
      return slots.get(0).variable.type();
    }
    return slots.size() == 1 ? ValueType.INT : ValueType.STRUCT;
  }

  private void callAction(int index, Command.Action action, StackEffect.Builder effect)
      throws DecompilerException {
    if (!actions.paramTypes(action.actionId()).isPresent()
        && reportedActions.add(action.actionId())) {
      LOGGER.debug("No signature for action {}, assuming int parameters", action.actionId());
    }
    ImmutableList<ValueType> paramTypes =
        actionParamTypes(actions, action, pendingActions.size());
    ImmutableList.Builder<Value> args = ImmutableList.builder();
    for (ValueType type : paramTypes) {
      if (type == ValueType.ACTION) {
        if (pendingActions.isEmpty()) {
          throw new DecompilerException(
              action.pos(),
              ErrorKind.STACK_UNDERFLOW,
              action + " takes an action argument that was never stored");
        }
        args.add(pendingActions.pop());
      } else {
        args.add(popValue(action, type.width()));
      }
    }
    effect.setConsumed(args.build());

    ValueType returnType = actions.resolvedReturnType(action.actionId());
    if (returnType.width() > 0) {
      effect.setProduced(
          push(Value.produced(nextValueId++, returnType, returnType.width(), index)));
    }
  }

  /**
   * Parameter types for an action call. When the table does not know the action, the trailing
   * parameters are assumed to be the stored action arguments still pending.
   */
  static ImmutableList<ValueType> actionParamTypes(
      ActionTable actions, Command.Action action, int pending) {
    ImmutableList<ValueType> types =
        actions.resolvedParamTypes(action.actionId(), action.argCount());
    if (actions.paramTypes(action.actionId()).isPresent() || pending == 0) {
      return types;
    }
    List<ValueType> adjusted = new ArrayList<>(types);
    for (int i = adjusted.size() - 1; i >= 0 && pending > 0; i--, pending--) {
      adjusted.set(i, ValueType.ACTION);
    }
    return ImmutableList.copyOf(adjusted);
  }

  private void destruct(int index, Command.Destruct destruct, StackEffect.Builder effect)
      throws DecompilerException {
    Value source = popValue(destruct, NodeQueries.slot(destruct.removeSize()));
    int offset = NodeQueries.slot(destruct.saveOffset());
    int width = NodeQueries.slot(destruct.saveSize());
    ValueType type = memberType(source, offset, width);
    effect.setConsumed(ImmutableList.of(source));
    effect.setProduced(push(Value.produced(nextValueId++, type, width, index)));
  }

  private ValueType memberType(Value source, int offset, int width) {
    if (source.producer() >= 0 && source.producer() < effects.size()) {
      Optional<VarAccess> access = effects.get(source.producer()).access();
      if (access.isPresent()) {
        return access.get().variable().memberType(access.get().offset() + offset, width);
      }
    }
    if (source.type() == ValueType.VECTOR && width == 1) return ValueType.FLOAT;
    if (width == 3) return ValueType.VECTOR;
    return width == 1 ? ValueType.INT : ValueType.STRUCT;
  }

  private void returnFromFrame(Command command, StackEffect.Builder effect)
      throws DecompilerException {
    int expected = frameBase - signature.paramSlots();
    int extra = stack.size() - expected;
    if (extra > 0) {
      List<Slot> top = new ArrayList<>(stack.subList(expected, stack.size()));
      Value left = view(command, top);
      effect.setReturnValue(left);
      returnedType = left.type();
    }
  }

  private void saveGlobalFrame(StackEffect.Builder effect) {
    List<Variable> frame = new ArrayList<>();
    ImmutableList.Builder<Variable> promoted = ImmutableList.builder();
    ImmutableList.Builder<Value> initializers = ImmutableList.builder();
    Value current = null;
    List<Variable> currentMembers = new ArrayList<>();
    for (Slot slot : stack) {
      if (slot.isVariable()) {
        frame.add(slot.variable);
        continue;
      }
      // A temporary left below SAVEBP is a global declared with its initializer.
      if (slot.value != current) {
        current = slot.value;
        currentMembers = new ArrayList<>();
      }
      ValueType type = current.type() == ValueType.VECTOR ? ValueType.FLOAT : current.type();
      Variable scalar =
          Variable.scalar(Variable.Scope.GLOBAL, type.width() == 1 ? type : ValueType.INT, -1);
      frame.add(scalar);
      currentMembers.add(scalar);
      if (currentMembers.size() == current.width()) {
        promoted.add(
            currentMembers.size() == 1
                ? scalar
                : Variable.group(current.type(), currentMembers));
        initializers.add(current);
      }
    }
    effect.setPromoted(promoted.build());
    effect.setConsumed(initializers.build());
    frameAtSaveBp = new GlobalFrame(frame);
  }

  private void storeState(int index, Command command, StackEffect.Builder effect)
      throws DecompilerException {
    if (index + 1 >= subroutine.size()
        || subroutine.command(index + 1).kind() != Command.Kind.JUMP) {
      throw new DecompilerException(
          command.pos(), ErrorKind.DECODE, "STORE_STATE not followed by a jump over its body");
    }
    int end = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(subroutine.command(index + 1)));
    if (end <= index + 1) {
      throw new DecompilerException(
          command.pos(), ErrorKind.DECODE, "STORE_STATE body jump does not go forward");
    }
    closures.push(new ClosureFrame(new ArrayList<>(stack), index, end));
    effect.setClosureEnd(end);
    effect.setProduced(Value.produced(nextValueId++, ValueType.ACTION, 0, index));
  }

  private void finishClosure() {
    ClosureFrame frame = closures.pop();
    stack = frame.saved;
    reachable = true;
    StackEffect store = effects.get(frame.storeIndex);
    pendingActions.push(store.produced().get());
  }

  private void saveForDestination(int index, Command jump) {
    int destination = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(jump));
    if (destination <= index) return;
    if (NodeQueries.isStoreStackNode(subroutine.command(destination - 1))) {
      savedStacks.putIfAbsent(destination, new ArrayList<>(stack));
    }
  }
}
