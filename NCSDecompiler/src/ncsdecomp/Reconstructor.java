package ncsdecomp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;

import ncsdecomp.ControlFlowClassifier.ControlFlow;
import ncsdecomp.DecompilerException.ErrorKind;
import ncsdecomp.Script.ActionArgument;
import ncsdecomp.Script.ActionCall;
import ncsdecomp.Script.Assignment;
import ncsdecomp.Script.Binary;
import ncsdecomp.Script.Block;
import ncsdecomp.Script.Constant;
import ncsdecomp.Script.DoWhile;
import ncsdecomp.Script.Expression;
import ncsdecomp.Script.ExpressionStatement;
import ncsdecomp.Script.For;
import ncsdecomp.Script.Goto;
import ncsdecomp.Script.If;
import ncsdecomp.Script.IncDec;
import ncsdecomp.Script.Logical;
import ncsdecomp.Script.Member;
import ncsdecomp.Script.Statement;
import ncsdecomp.Script.SubroutineCall;
import ncsdecomp.Script.Unary;
import ncsdecomp.Script.VarDecl;
import ncsdecomp.Script.VariableRef;
import ncsdecomp.Script.VectorLiteral;
import ncsdecomp.Script.While;

/**
 * Rebuilds statements and structured control flow for one subroutine from its tracked stack
 * effects.
 *
 * <p>Expressions are folded by value provenance: every produced value maps to the expression that
 * computes it, and an operator's operands are the expressions of the values it consumed. A value
 * becomes a statement when it is dropped unused by a MOVSP, or immediately for calls that produce
 * nothing.
 *
 * <p>Regions are parsed by command index. Loops are found through their backward jumps, then
 * conditionals through their forward jumps:
 *
 * <pre>
 *   while:     h: cond; JZ end; body; JMP h; end:
 *   do-while:  h: body; cond; JZ +12; JMP h; end:
 *   if:        cond; JZ end; then; end:
 *   if-else:   cond; JZ else; then; JMP end; else: otherwise; end:
 *   switch:    subject; (CPTOPSP -4; CONSTI k; EQUALII; JNZ case_k)+; JMP default;
 *              case bodies, each break a JMP end; end: MOVSP -4
 * </pre>
 *
 * A jump that fits none of the shapes becomes a {@code goto} to a label.
 */
final class Reconstructor {
  private static final Logger LOGGER = LogManager.getLogger();

  private static final class LoopContext {
    final int breakTarget;
    final int continueTarget;
    // Forward jumps to a jump-free stretch ending here are continues.
    final int updateLimit;
    final boolean allowsUpdate;
    final Map<Statement, Integer> updateJumps = new IdentityHashMap<>();

    LoopContext(int breakTarget, int continueTarget, int updateLimit, boolean allowsUpdate) {
      this.breakTarget = breakTarget;
      this.continueTarget = continueTarget;
      this.updateLimit = updateLimit;
      this.allowsUpdate = allowsUpdate;
    }
  }

  private final Program program;
  private final Subroutine subroutine;
  private final StackTracker.Result result;
  private final ControlFlow flow;
  private final ActionTable actions;
  private final boolean foldConstants;
  private final boolean preferSwitches;

  private final Map<Integer, Expression> expressions = new HashMap<>();
  private final Set<Integer> used = new HashSet<>();
  private final Set<Variable> declaredGroups = new HashSet<>();
  // Returns that close a deferred action body rather than the routine.
  private final Set<Integer> closureReturns = new HashSet<>();
  private int statementStart = -1;
  private int currentPos;
  private VarAccess pendingPrefix;
  private Command.StackOpKind pendingPrefixOp;

  Reconstructor(
      Program program,
      StackTracker.Result result,
      ControlFlow flow,
      ActionTable actions,
      DecompilerOptions options) {
    this.program = program;
    this.subroutine = result.subroutine();
    this.result = result;
    this.flow = flow;
    this.actions = actions;
    this.foldConstants = options.foldConstants();
    this.preferSwitches = options.preferSwitches();
  }

  Script.Function reconstructFunction(SubroutineSignature signature) throws DecompilerException {
    List<Statement> body = new ArrayList<>();
    parseBlock(0, subroutine.size(), body, null, -1);
    if (!body.isEmpty()) {
      Statement last = body.get(body.size() - 1);
      if (last.kind() == Statement.Kind.RETURN
          && !last.<Script.Return>cast().value().isPresent()) {
        body.remove(body.size() - 1);
      }
    }
    Block block = Block.create(subroutine.startPos(), body);
    block = new ForLoopFolder().rewrite(block);
    if (preferSwitches) {
      block = new SwitchFolder().rewrite(block);
    }
    block = LabelResolver.resolve(block);
    return Script.Function.create(
        signature, subroutine.role(), subroutine.startPos(), result.parameters(), block);
  }

  /** Global declarations: everything the globals routine does before its SAVEBP. */
  ImmutableList<Statement> reconstructGlobals() throws DecompilerException {
    int end = subroutine.size();
    for (int i = 0; i < subroutine.size(); i++) {
      if (NodeQueries.isSaveBp(subroutine.command(i))) {
        end = i + 1;
        break;
      }
    }
    List<Statement> globals = new ArrayList<>();
    parseBlock(0, end, globals, null, -1);
    return ImmutableList.copyOf(globals);
  }

  // ---------------------------------------------------------------------------------------------
  // Regions

  /** Parses commands {@code [from, to)} into {@code out}. */
  private void parseBlock(int from, int to, List<Statement> out, LoopContext loop, int loopHandled)
      throws DecompilerException {
    int i = from;
    while (i < to) {
      StackEffect effect = result.effect(i);
      if (!effect.reachable()) {
        i++;
        continue;
      }
      Command command = subroutine.command(i);
      currentPos = command.pos();
      if (statementStart < 0) {
        statementStart = command.pos();
      }

      if (i != loopHandled && flow.isLoopHead(i)) {
        int tail = flow.loopTails().get(i);
        if (tail < to && result.effect(tail).reachable()) {
          i = parseLoop(i, tail, out);
          continue;
        }
      }

      int switchEnd = switchEnd(i, to);
      if (switchEnd >= 0) {
        i = parseSwitch(i, switchEnd, out, loop);
        continue;
      }

      switch (command.kind()) {
        case CONDITIONAL_JUMP:
          i = parseConditional(i, to, out, loop);
          break;
        case JUMP:
          parseJump(i, out, loop);
          i++;
          break;
        case STORE_STATE:
          i = parseClosure(i, effect);
          break;
        default:
          step(i, command, effect, out);
          i++;
          break;
      }
    }
  }

  private int parseLoop(int head, int tail, List<Statement> out) throws DecompilerException {
    int pos = takeStart(head);
    Command tailCommand = subroutine.command(tail);
    int exit = tail + 1;
    Statement loop;

    if (tailCommand.kind() == Command.Kind.JUMP) {
      int guard = whileGuard(head, tail);
      if (guard >= 0) {
        List<Statement> conditionCode = new ArrayList<>();
        parseBlock(head, guard, conditionCode, null, head);
        out.addAll(conditionCode);
        Expression condition = take(result.effect(guard).consumed().get(0));
        LoopContext context = new LoopContext(exit, head, tail, true);
        List<Statement> body = new ArrayList<>();
        statementStart = -1;
        parseBlock(guard + 1, tail, body, context, -1);
        loop = whileOrFor(pos, condition, body, context);
      } else if (tail > head && isJzTo(tail - 1, exit)) {
        LoopContext context = new LoopContext(exit, -1, tail - 1, false);
        List<Statement> body = new ArrayList<>();
        parseBlock(head, tail - 1, body, context, head);
        Expression condition = take(result.effect(tail - 1).consumed().get(0));
        loop = DoWhile.create(pos, Block.create(pos, body), condition);
      } else {
        LoopContext context = new LoopContext(exit, head, tail, false);
        List<Statement> body = new ArrayList<>();
        parseBlock(head, tail, body, context, head);
        loop = While.create(pos, Constant.ofInt(1), Block.create(pos, body));
      }
    } else {
      // A conditional jump back to the head: the guard sits at the bottom.
      LoopContext context = new LoopContext(exit, -1, tail, false);
      List<Statement> body = new ArrayList<>();
      parseBlock(head, tail, body, context, head);
      Expression condition = take(result.effect(tail).consumed().get(0));
      if (NodeQueries.isJz(tailCommand)) {
        condition = negate(condition);
      }
      loop = DoWhile.create(pos, Block.create(pos, body), condition);
    }

    statementStart = -1;
    emit(out, loop);
    return exit;
  }

  /** Index of the JZ that leaves a while loop, when everything before it only computes a value. */
  private int whileGuard(int head, int tail) {
    for (int j = head; j < tail; j++) {
      StackEffect effect = result.effect(j);
      if (!effect.reachable()) return -1;
      Command command = subroutine.command(j);
      switch (command.kind()) {
        case CONDITIONAL_JUMP:
          if (isShortCircuit(j)) continue;
          return isJzTo(j, tail + 1) ? j : -1;
        case JUMP:
          if (isShortCircuit(j)) continue;
          return -1;
        case CONSTANT:
        case COPY_TOP_SP:
        case COPY_TOP_BP:
        case BINARY:
        case UNARY:
        case LOGICAL:
        case DESTRUCT:
          continue;
        case RSADD:
          if (effect.declared().get().isCallResult()) continue;
          return -1;
        case ACTION:
        case JUMP_TO_SUBROUTINE:
          if (effect.produced().isPresent()) continue;
          return -1;
        default:
          return -1;
      }
    }
    return -1;
  }

  private Statement whileOrFor(
      int pos, Expression condition, List<Statement> body, LoopContext context) {
    if (context.updateJumps.isEmpty()) {
      return While.create(pos, condition, Block.create(pos, body));
    }

    int update = context.updateJumps.values().iterator().next();
    boolean oneTarget = context.updateJumps.values().stream().allMatch(t -> t == update);
    int updatePos = subroutine.command(update).pos();
    int split = body.size();
    for (int k = 0; k < body.size(); k++) {
      if (body.get(k).pos() >= updatePos) {
        split = k;
        break;
      }
    }
    if (oneTarget
        && split == body.size() - 1
        && body.get(split).kind() == Statement.Kind.EXPRESSION) {
      Expression step = body.get(split).<ExpressionStatement>cast().expression();
      return For.create(
          pos,
          Optional.empty(),
          condition,
          Optional.of(step),
          Block.create(pos, body.subList(0, split)));
    }

    // The continues skip to code that is not a single update expression.
    Block rewritten =
        new StatementRewriter() {
          @Override
          protected List<Statement> rewriteList(List<Statement> statements) {
            List<Statement> out = new ArrayList<>();
            for (Statement statement : statements) {
              Integer target = context.updateJumps.get(statement);
              out.add(
                  target == null
                      ? statement
                      : Goto.create(statement.pos(), subroutine.command(target).pos()));
            }
            return out;
          }
        }.rewrite(Block.create(pos, body));
    LOGGER.debug("Loop at {} in {} continues into a multi-statement update", pos, subroutine);
    return While.create(pos, condition, rewritten);
  }

  private int parseConditional(int index, int to, List<Statement> out, LoopContext loop)
      throws DecompilerException {
    if (isShortCircuit(index)) {
      return index + 1;
    }
    int pos = takeStart(index);
    Command command = subroutine.command(index);
    Expression condition = take(result.effect(index).consumed().get(0));
    // JZ skips the block when the condition is false, JNZ when it is true.
    Expression test = NodeQueries.isJz(command) ? condition : negate(condition);
    int destination = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(command));

    if (destination > index && destination <= to) {
      int beforeTarget = destination - 1;
      if (beforeTarget > index
          && subroutine.command(beforeTarget).kind() == Command.Kind.JUMP
          && !isShortCircuit(beforeTarget)) {
        Command skip = subroutine.command(beforeTarget);
        int end = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(skip));
        boolean emptyThen = beforeTarget == index + 1;
        if (end > destination && end <= to && !(emptyThen && flow.isReturnTarget(end))) {
          List<Statement> then = new ArrayList<>();
          parseBlock(index + 1, beforeTarget, then, loop, -1);
          statementStart = -1;
          List<Statement> otherwise = new ArrayList<>();
          parseBlock(destination, end, otherwise, loop, -1);
          statementStart = -1;
          emit(
              out,
              If.create(
                  pos,
                  test,
                  Block.create(pos, then),
                  Optional.of(Block.create(subroutine.command(destination).pos(), otherwise))));
          return end;
        }
      }

      List<Statement> then = new ArrayList<>();
      parseBlock(index + 1, destination, then, loop, -1);
      statementStart = -1;
      if (then.isEmpty() && !test.hasSideEffects()) {
        // Nothing guarded: the jump only skips a no-op.
        return destination;
      }
      emit(out, If.create(pos, test, Block.create(pos, then), Optional.empty()));
      return destination;
    }

    // The jump leaves the region: a guarded exit.
    Statement exit;
    if (loop != null && destination == loop.breakTarget) {
      exit = Script.Break.create(pos);
    } else if (loop != null && destination == loop.continueTarget) {
      exit = Script.Continue.create(pos);
    } else if (destination >= 0 && flow.isReturnTarget(destination)) {
      exit = Script.Return.create(pos, Optional.empty());
    } else {
      exit = unstructuredJump(pos, command);
    }
    emit(
        out,
        If.create(pos, negate(test), Block.create(pos, ImmutableList.of(exit)), Optional.empty()));
    return index + 1;
  }

  private void parseJump(int index, List<Statement> out, LoopContext loop) {
    if (isShortCircuit(index)) return;
    Command command = subroutine.command(index);
    int destination = subroutine.indexAtOrAfter(NodeQueries.jumpDestination(command));
    if (destination == index + 1) return;

    int pos = takeStart(index);
    if (loop != null && destination == loop.breakTarget) {
      emit(out, Script.Break.create(pos));
    } else if (loop != null && destination == loop.continueTarget) {
      emit(out, Script.Continue.create(pos));
    } else if (loop != null
        && destination > index
        && destination <= loop.updateLimit
        && isStraightLine(destination, loop.updateLimit)) {
      Statement statement = Script.Continue.create(pos);
      if (loop.allowsUpdate) {
        loop.updateJumps.put(statement, destination);
      }
      emit(out, statement);
    } else if (destination >= 0 && flow.isReturnTarget(destination)) {
      if (out.isEmpty() || out.get(out.size() - 1).kind() != Statement.Kind.RETURN) {
        emit(out, Script.Return.create(pos, Optional.empty()));
      }
    } else {
      emit(out, unstructuredJump(pos, command));
    }
  }

  private Statement unstructuredJump(int pos, Command command) {
    int target = NodeQueries.jumpDestination(command);
    LOGGER.debug(
        "Unstructured jump at {} in {} to {}",
        String.format("%08X", command.pos()),
        subroutine,
        String.format("%08X", target));
    int destination = subroutine.indexAtOrAfter(target);
    return Goto.create(pos, destination >= 0 ? subroutine.command(destination).pos() : target);
  }

  /**
   * When a switch dispatch starts at {@code index}, the index of the MOVSP that drops its subject
   * after the last case; otherwise -1.
   */
  private int switchEnd(int index, int to) {
    int k = index;
    int subject = -1;
    List<Integer> targets = new ArrayList<>();
    while (isCaseTest(k, to, subject)) {
      subject = result.effect(k).consumed().get(0).id();
      targets.add(destinationIndex(k + 3));
      k += 4;
    }
    if (targets.isEmpty() || k >= to || subroutine.command(k).kind() != Command.Kind.JUMP) {
      return -1;
    }
    int fallback = destinationIndex(k);
    if (fallback <= k) return -1;

    // Breaks jump to the subject's MOVSP; a return pops it on the way out instead.
    int end = -1;
    for (int j = k; j < to; j++) {
      if (subroutine.command(j).kind() != Command.Kind.JUMP) continue;
      int destination = destinationIndex(j);
      if (destination > k
          && destination < to
          && (end < 0 || destination < end)
          && dropsValue(destination, subject)) {
        end = destination;
      }
    }
    if (end < 0) {
      for (int j = k + 1; j < to; j++) {
        if (dropsValue(j, subject)
            && (j + 1 >= subroutine.size() || !isExitStep(subroutine.command(j + 1)))) {
          end = j;
          break;
        }
      }
    }
    if (end < 0 || fallback > end) return -1;
    // The first body starts right after the dispatch.
    int first = fallback;
    for (int target : targets) {
      if (target <= k || target > end) return -1;
      first = Math.min(first, target);
    }
    return first == k + 1 ? end : -1;
  }

  /** {@code CPTOPSP -4 4; CONSTI; EQUALII; JNZ} comparing a duplicate of {@code subject}. */
  private boolean isCaseTest(int k, int to, int subject) {
    if (k + 3 >= to) return false;
    for (int j = k; j <= k + 3; j++) {
      if (!result.effect(j).reachable()) return false;
    }
    StackEffect copy = result.effect(k);
    Command constant = subroutine.command(k + 1);
    Command compare = subroutine.command(k + 2);
    Command jump = subroutine.command(k + 3);
    if (subroutine.command(k).kind() != Command.Kind.COPY_TOP_SP
        || copy.access().isPresent()
        || copy.consumed().size() != 1
        || copy.consumed().get(0).kind() != Value.Kind.PRODUCED
        || copy.consumed().get(0).width() != 1
        || (subject >= 0 && copy.consumed().get(0).id() != subject)) {
      return false;
    }
    if (constant.kind() != Command.Kind.CONSTANT
        || constant.<Command.Constant>cast().type() != ValueType.INT
        || compare.kind() != Command.Kind.BINARY
        || compare.<Command.Binary>cast().op() != Command.BinaryOp.EQUAL
        || NodeQueries.resultType(compare.cast()) != ValueType.INT
        || NodeQueries.leftWidth(compare.cast()) != 1
        || !NodeQueries.isJnz(jump)) {
      return false;
    }
    return destinationIndex(k + 3) > k + 3;
  }

  private boolean dropsValue(int index, int id) {
    StackEffect effect = result.effect(index);
    return effect.reachable()
        && subroutine.command(index).kind() == Command.Kind.MOVE_SP
        && effect.discarded().stream().anyMatch(value -> value.id() == id);
  }

  private static boolean isExitStep(Command command) {
    return command.kind() == Command.Kind.JUMP
        || command.kind() == Command.Kind.RETURN
        || command.kind() == Command.Kind.MOVE_SP;
  }

  private int parseSwitch(int index, int end, List<Statement> out, LoopContext loop)
      throws DecompilerException {
    int pos = takeStart(index);
    Expression subject = take(result.effect(index).consumed().get(0));
    // Case values in dispatch order, grouped by the body they enter.
    Map<Integer, List<Integer>> labels = new TreeMap<>();
    int k = index;
    while (subroutine.command(k).kind() == Command.Kind.COPY_TOP_SP) {
      int target = destinationIndex(k + 3);
      labels
          .computeIfAbsent(target, t -> new ArrayList<>())
          .add(NodeQueries.intConstant(subroutine.command(k + 1)));
      k += 4;
    }
    int fallback = destinationIndex(k);
    if (fallback != end) {
      labels.computeIfAbsent(fallback, t -> new ArrayList<>());
    }

    LoopContext context =
        new LoopContext(end, loop == null ? -1 : loop.continueTarget, -1, false);
    List<Integer> starts = new ArrayList<>(labels.keySet());
    List<Script.SwitchCase> cases = new ArrayList<>();
    for (int c = 0; c < starts.size(); c++) {
      int start = starts.get(c);
      int stop = c + 1 < starts.size() ? starts.get(c + 1) : end;
      List<Statement> body = new ArrayList<>();
      statementStart = -1;
      parseBlock(start, stop, body, context, -1);
      int bodyPos = start < subroutine.size() ? subroutine.command(start).pos() : pos;
      cases.add(
          Script.SwitchCase.create(
              labels.get(start), start == fallback, Block.create(bodyPos, body)));
    }
    statementStart = -1;
    emit(out, Script.Switch.create(pos, subject, cases));
    return end;
  }

  private int parseClosure(int index, StackEffect effect) throws DecompilerException {
    int end = effect.closureEnd();
    int saved = statementStart;
    List<Statement> body = new ArrayList<>();
    statementStart = -1;
    closureReturns.add(end - 1);
    parseBlock(index + 2, end, body, null, -1);
    statementStart = saved;
    expressions.put(
        effect.produced().get().id(),
        ActionArgument.create(Block.create(subroutine.command(index).pos(), body)));
    return end;
  }

  // ---------------------------------------------------------------------------------------------
  // Straight-line commands

  private void step(int index, Command command, StackEffect effect, List<Statement> out)
      throws DecompilerException {
    switch (command.kind()) {
      case CONSTANT:
        {
          Command.Constant constant = command.cast();
          produce(effect, Constant.create(constant.type(), constant.value()));
          break;
        }
      case COPY_TOP_SP:
      case COPY_TOP_BP:
        if (effect.access().isPresent()) {
          VarAccess access = effect.access().get();
          if (access.equals(pendingPrefix)) {
            produce(effect, IncDec.create(access, pendingPrefixOp, true));
            pendingPrefix = null;
          } else {
            produce(effect, VariableRef.create(access));
          }
        } else {
          // A duplicate of a temporary stands for the same expression.
          Value copied = effect.consumed().get(0);
          produce(effect, peek(copied));
        }
        break;
      case COPY_DOWN_SP:
      case COPY_DOWN_BP:
        {
          Expression value = take(effect.consumed().get(0));
          if (effect.returnWrite()) {
            used.add(effect.produced().get().id());
            emit(out, Script.Return.create(takeStart(index), Optional.of(value)));
          } else {
            produce(effect, Assignment.create(effect.access().get(), value));
          }
          break;
        }
      case MOVE_SP:
        for (Value discarded : effect.discarded()) {
          if (used.contains(discarded.id())) continue;
          emit(out, ExpressionStatement.create(takeStart(index), take(discarded)));
        }
        break;
      case RSADD:
        {
          Variable variable = effect.declared().get();
          if (variable.isCallResult()) break;
          Variable root = variable.root();
          if (root != variable && !declaredGroups.add(root)) break;
          emit(out, VarDecl.create(takeStart(index), root, Optional.empty()));
          break;
        }
      case ACTION:
        {
          Command.Action action = command.cast();
          List<Expression> args = takeAll(effect.consumed());
          ActionCall call =
              ActionCall.create(
                  action.actionId(), actions.resolvedReturnType(action.actionId()), args);
          produceOrEmit(index, effect, call, out);
          break;
        }
      case JUMP_TO_SUBROUTINE:
        {
          int destination = NodeQueries.jumpDestination(command);
          Optional<Subroutine> callee = program.startingAt(destination);
          if (!callee.isPresent()) {
            throw new DecompilerException(
                command.pos(),
                ErrorKind.UNRESOLVED_VARIABLE,
                String.format("JSR to %08X which starts no subroutine", destination));
          }
          List<Expression> args = takeAll(effect.consumed());
          ValueType type = effect.produced().map(Value::type).orElse(ValueType.VOID);
          SubroutineCall call = SubroutineCall.create(callee.get().index(), type, args);
          produceOrEmit(index, effect, call, out);
          break;
        }
      case LOGICAL:
        {
          Command.Logical logical = command.cast();
          Expression left = take(effect.consumed().get(0));
          Expression right = take(effect.consumed().get(1));
          produce(effect, Logical.create(logical.op(), left, right));
          break;
        }
      case BINARY:
        {
          Command.Binary binary = command.cast();
          Expression left = take(effect.consumed().get(0));
          Expression right = take(effect.consumed().get(1));
          ValueType type = effect.produced().get().type();
          Optional<Constant> folded =
              foldConstants
                  ? ConstantFolder.fold(binary.op(), type, left, right)
                  : Optional.empty();
          produce(
              effect,
              folded.isPresent()
                  ? folded.get()
                  : Binary.create(binary.op(), type, left, right));
          break;
        }
      case UNARY:
        {
          Command.Unary unary = command.cast();
          Expression operand = take(effect.consumed().get(0));
          Optional<Constant> folded =
              foldConstants ? ConstantFolder.fold(unary.op(), operand) : Optional.empty();
          produce(
              effect,
              folded.isPresent()
                  ? folded.get()
                  : Unary.create(unary.op(), unary.type(), operand));
          break;
        }
      case STACK_OP:
        stackOp(index, command.cast(), effect, out);
        break;
      case DESTRUCT:
        {
          Command.Destruct destruct = command.cast();
          Value produced = effect.produced().get();
          Expression source = take(effect.consumed().get(0));
          produce(
              effect,
              Member.create(
                  produced.type(),
                  source,
                  NodeQueries.slot(destruct.saveOffset()),
                  produced.width()));
          break;
        }
      case BP:
        for (int k = 0; k < effect.promoted().size(); k++) {
          emit(
              out,
              VarDecl.create(
                  takeStart(index),
                  effect.promoted().get(k),
                  Optional.of(take(effect.consumed().get(k)))));
        }
        break;
      case RETURN:
        if (effect.returnValue().isPresent()) {
          Expression value = take(effect.returnValue().get());
          emit(out, Script.Return.create(takeStart(index), Optional.of(value)));
        } else if (!flow.isReturnTarget(index)
            && !closureReturns.contains(index)
            && (out.isEmpty() || out.get(out.size() - 1).kind() != Statement.Kind.RETURN)) {
          // A bare return ahead of the epilogue leaves the routine early.
          emit(out, Script.Return.create(takeStart(index), Optional.empty()));
        }
        break;
      case CONDITIONAL_JUMP:
      case JUMP:
      case STORE_STATE:
        throw new IllegalStateException("control command in straight-line code: " + command);
    }
  }

  private void stackOp(int index, Command.StackOp op, StackEffect effect, List<Statement> out) {
    VarAccess access = effect.access().get();
    if (index > 0 && readsVariable(index - 1, access)) {
      int previous = result.effect(index - 1).produced().get().id();
      if (!used.contains(previous)) {
        // The value copied just before the step is the old one.
        expressions.put(previous, IncDec.create(access, op.op(), false));
        return;
      }
    }
    if (index + 1 < subroutine.size() && readsVariable(index + 1, access)) {
      pendingPrefix = access;
      pendingPrefixOp = op.op();
      return;
    }
    emit(out, ExpressionStatement.create(takeStart(index), IncDec.create(access, op.op(), false)));
  }

  private boolean readsVariable(int index, VarAccess access) {
    StackEffect effect = result.effect(index);
    Command.Kind kind = subroutine.command(index).kind();
    return effect.reachable()
        && (kind == Command.Kind.COPY_TOP_SP || kind == Command.Kind.COPY_TOP_BP)
        && effect.access().isPresent()
        && effect.access().get().equals(access)
        && effect.produced().isPresent();
  }

  private void produceOrEmit(int index, StackEffect effect, Expression call, List<Statement> out) {
    if (effect.produced().isPresent()) {
      produce(effect, call);
    } else {
      emit(out, ExpressionStatement.create(takeStart(index), call));
    }
  }

  private void produce(StackEffect effect, Expression expression) {
    expressions.put(effect.produced().get().id(), expression);
  }

  // ---------------------------------------------------------------------------------------------
  // Values

  /** The expression computing {@code value}, marking it consumed. */
  private Expression take(Value value) throws DecompilerException {
    switch (value.kind()) {
      case PRODUCED:
        used.add(value.id());
        return peek(value);
      case COMPOSITE:
        return VectorLiteral.create(value.type(), takeAll(value.parts()));
      case MEMBER:
        return Member.create(
            value.type(), take(value.source().get()), value.offset(), value.width());
      case READ:
        return VariableRef.create(value.access().get());
    }
    throw new IllegalStateException("unknown value kind " + value.kind());
  }

  private Expression peek(Value value) throws DecompilerException {
    if (value.kind() != Value.Kind.PRODUCED) {
      return take(value);
    }
    Expression expression = expressions.get(value.id());
    if (expression == null) {
      throw new DecompilerException(
          currentPos, ErrorKind.UNRESOLVED_VARIABLE, "no expression computes " + value);
    }
    return expression;
  }

  private List<Expression> takeAll(List<Value> values) throws DecompilerException {
    List<Expression> expressions = new ArrayList<>();
    for (Value value : values) {
      expressions.add(take(value));
    }
    return expressions;
  }

  private static Expression negate(Expression condition) {
    if (condition.kind() == Expression.Kind.UNARY
        && condition.<Unary>cast().op() == Command.UnaryOp.NOT) {
      return condition.<Unary>cast().operand();
    }
    return Unary.create(Command.UnaryOp.NOT, ValueType.INT, condition);
  }

  // ---------------------------------------------------------------------------------------------
  // Helpers

  private int takeStart(int index) {
    int pos = statementStart >= 0 ? statementStart : subroutine.command(index).pos();
    statementStart = -1;
    return pos;
  }

  /** Appends a statement, merging an assignment into the declaration just before it. */
  private static void emit(List<Statement> out, Statement statement) {
    if (statement.kind() == Statement.Kind.EXPRESSION && !out.isEmpty()) {
      Expression expression = statement.<ExpressionStatement>cast().expression();
      Statement last = out.get(out.size() - 1);
      if (expression.kind() == Expression.Kind.ASSIGNMENT
          && last.kind() == Statement.Kind.VAR_DECL) {
        Assignment assignment = expression.cast();
        VarDecl decl = last.cast();
        if (!decl.initializer().isPresent()
            && assignment.target().isWhole()
            && assignment.target().variable() == decl.variable()
            && !mentions(assignment.value(), decl.variable())) {
          out.set(
              out.size() - 1,
              VarDecl.create(decl.pos(), decl.variable(), Optional.of(assignment.value())));
          return;
        }
      }
    }
    out.add(statement);
  }

  /** Whether {@code expression} reads or writes {@code variable} or any part of it. */
  static boolean mentions(Expression expression, Variable variable) {
    Variable root = variable.root();
    return expression.accept(
        new DefaultScriptVisitor<Boolean>() {
          @Override
          public Boolean visit(VariableRef node, Boolean value) {
            return value || node.access().variable().root() == root;
          }

          @Override
          public Boolean visit(Assignment node, Boolean value) {
            return super.visit(node, value || node.target().variable().root() == root);
          }

          @Override
          public Boolean visit(IncDec node, Boolean value) {
            return value || node.target().variable().root() == root;
          }
        },
        false);
  }

  /** Short-circuit jumps whose guard duplicates a temporary rather than reading a variable. */
  private boolean isShortCircuit(int index) {
    if (!flow.isShortCircuit(index)) return false;
    int guard = subroutine.command(index).kind() == Command.Kind.JUMP ? index - 1 : index;
    return guard > 0 && !result.effect(guard - 1).access().isPresent();
  }

  private int destinationIndex(int index) {
    return subroutine.indexAtOrAfter(NodeQueries.jumpDestination(subroutine.command(index)));
  }

  private boolean isJzTo(int index, int destination) {
    Command command = subroutine.command(index);
    return NodeQueries.isJz(command)
        && subroutine.indexAtOrAfter(NodeQueries.jumpDestination(command)) == destination;
  }

  private boolean isStraightLine(int from, int to) {
    for (int j = from; j < to; j++) {
      switch (subroutine.command(j).kind()) {
        case JUMP:
        case CONDITIONAL_JUMP:
          if (!isShortCircuit(j)) return false;
          break;
        case RETURN:
        case STORE_STATE:
          return false;
        default:
          break;
      }
    }
    return true;
  }
}
