package ncsdecomp;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import ncsdecomp.Command.BinaryOp;
import ncsdecomp.DecompilerException.ErrorKind;

/**
 * Lifts an instruction stream into a {@link Program}: one command per instruction, threaded into
 * subroutine blocks in instruction order.
 */
public final class NodeTreeBuilder {
  private static final Logger LOGGER = LogManager.getLogger();

  private static final ImmutableMap<Opcode, BinaryOp> BINARY_OPS =
      ImmutableMap.<Opcode, BinaryOp>builder()
          .put(Opcode.ADD, BinaryOp.ADD)
          .put(Opcode.SUB, BinaryOp.SUB)
          .put(Opcode.MUL, BinaryOp.MUL)
          .put(Opcode.DIV, BinaryOp.DIV)
          .put(Opcode.MOD, BinaryOp.MOD)
          .put(Opcode.SHLEFT, BinaryOp.SHIFT_LEFT)
          .put(Opcode.SHRIGHT, BinaryOp.SHIFT_RIGHT)
          .put(Opcode.USHRIGHT, BinaryOp.UNSIGNED_SHIFT_RIGHT)
          .put(Opcode.EQUAL, BinaryOp.EQUAL)
          .put(Opcode.NEQUAL, BinaryOp.NOT_EQUAL)
          .put(Opcode.GEQ, BinaryOp.GREATER_EQUAL)
          .put(Opcode.GT, BinaryOp.GREATER)
          .put(Opcode.LT, BinaryOp.LESS)
          .put(Opcode.LEQ, BinaryOp.LESS_EQUAL)
          .build();

  private static final ImmutableSet<TypePair> ARITHMETIC =
      Sets.immutableEnumSet(TypePair.II, TypePair.IF, TypePair.FI, TypePair.FF);
  private static final ImmutableSet<TypePair> INT_ONLY = Sets.immutableEnumSet(TypePair.II);

  private static final ImmutableMap<BinaryOp, ImmutableSet<TypePair>> LEGAL_PAIRS =
      ImmutableMap.<BinaryOp, ImmutableSet<TypePair>>builder()
          .put(
              BinaryOp.ADD,
              Sets.immutableEnumSet(
                  TypePair.II, TypePair.IF, TypePair.FI, TypePair.FF, TypePair.SS, TypePair.VV))
          .put(
              BinaryOp.SUB,
              Sets.immutableEnumSet(
                  TypePair.II, TypePair.IF, TypePair.FI, TypePair.FF, TypePair.VV))
          .put(
              BinaryOp.MUL,
              Sets.immutableEnumSet(
                  TypePair.II, TypePair.IF, TypePair.FI, TypePair.FF, TypePair.VF, TypePair.FV))
          .put(
              BinaryOp.DIV,
              Sets.immutableEnumSet(
                  TypePair.II, TypePair.IF, TypePair.FI, TypePair.FF, TypePair.VF))
          .put(BinaryOp.MOD, INT_ONLY)
          .put(BinaryOp.SHIFT_LEFT, INT_ONLY)
          .put(BinaryOp.SHIFT_RIGHT, INT_ONLY)
          .put(BinaryOp.UNSIGNED_SHIFT_RIGHT, INT_ONLY)
          .put(BinaryOp.EQUAL, ImmutableSet.copyOf(TypePair.values()))
          .put(BinaryOp.NOT_EQUAL, ImmutableSet.copyOf(TypePair.values()))
          .put(BinaryOp.GREATER_EQUAL, ARITHMETIC)
          .put(BinaryOp.GREATER, ARITHMETIC)
          .put(BinaryOp.LESS, ARITHMETIC)
          .put(BinaryOp.LESS_EQUAL, ARITHMETIC)
          .build();

  private final ImmutableList<Instruction> instructions;

  public NodeTreeBuilder(ImmutableList<Instruction> instructions) {
    this.instructions = instructions;
  }

  public Program build() throws DecompilerException {
    List<Command> commands = new ArrayList<>();
    for (Instruction instruction : instructions) {
      lift(instruction).ifPresent(commands::add);
    }
    if (commands.isEmpty()) {
      throw new DecompilerException(
          NcsReader.HEADER_SIZE, ErrorKind.DECODE, "program has no instructions");
    }

    TreeSet<Integer> commandPositions = new TreeSet<>();
    commands.forEach(c -> commandPositions.add(c.pos()));

    // Subroutines begin at the first command and at every call target.
    TreeSet<Integer> starts = new TreeSet<>();
    starts.add(commands.get(0).pos());
    for (Command command : commands) {
      if (command.kind() != Command.Kind.JUMP_TO_SUBROUTINE) continue;
      int target = NodeQueries.jumpDestination(command);
      Integer resolved = commandPositions.ceiling(target);
      if (resolved == null || target < commands.get(0).pos()) {
        throw new DecompilerException(
            command.pos(),
            ErrorKind.DECODE,
            String.format("call target %08X is outside the program", target));
      }
      starts.add(resolved);
    }

    NodeTree tree = new NodeTree();
    // Every command is first owned by one staging block, then moved into its subroutine's block.
    int staging = tree.addNode(NodeTree.NodeKind.COMMAND_BLOCK);
    List<Integer> wrappers = new ArrayList<>();
    for (Command command : commands) {
      wrappers.add(tree.attach(staging, tree.addCommand(command)));
    }

    List<List<Command>> spans = new ArrayList<>();
    List<Integer> blocks = new ArrayList<>();
    List<Integer> subroutineNodes = new ArrayList<>();
    for (int i = 0; i < commands.size(); i++) {
      Command command = commands.get(i);
      if (starts.contains(command.pos())) {
        int subroutine = tree.attach(tree.root(), tree.addNode(NodeTree.NodeKind.SUBROUTINE));
        blocks.add(tree.attach(subroutine, tree.addNode(NodeTree.NodeKind.COMMAND_BLOCK)));
        subroutineNodes.add(subroutine);
        spans.add(new ArrayList<>());
      }
      tree.attach(blocks.get(blocks.size() - 1), wrappers.get(i));
      spans.get(spans.size() - 1).add(command);
    }
    tree.rebuildParents();

    for (List<Command> span : spans) {
      Command last = span.get(span.size() - 1);
      if (last.kind() != Command.Kind.RETURN) {
        LOGGER.warn("Subroutine at [{}] does not end with a return.", hex(span.get(0).pos()));
      }
    }

    Program.EntryStyle entryStyle = entryStyle(spans);
    ImmutableList.Builder<Subroutine> subroutines = ImmutableList.builder();
    int mainPos = mainPosition(spans, entryStyle);
    for (int i = 0; i < spans.size(); i++) {
      List<Command> span = spans.get(i);
      Subroutine.Role role;
      if (i == 0 && entryStyle != Program.EntryStyle.DIRECT) {
        role = Subroutine.Role.ENTRY_STUB;
      } else if (span.stream().anyMatch(NodeQueries::isSaveBp)) {
        role = Subroutine.Role.GLOBALS;
      } else if (span.get(0).pos() == mainPos) {
        role = Subroutine.Role.MAIN;
      } else {
        role = Subroutine.Role.ORDINARY;
      }
      subroutines.add(
          Subroutine.create(i, subroutineNodes.get(i), role, ImmutableList.copyOf(span)));
    }
    tree.freeze();
    return Program.create(tree, subroutines.build(), entryStyle);
  }

  private static Program.EntryStyle entryStyle(List<List<Command>> spans) {
    List<Command> first = spans.get(0);
    if (spans.size() < 2) return Program.EntryStyle.DIRECT;
    int i = 0;
    boolean conditional = false;
    if (first.get(i).kind() == Command.Kind.RSADD) {
      conditional = true;
      i++;
    }
    if (first.size() == i + 2
        && first.get(i).kind() == Command.Kind.JUMP_TO_SUBROUTINE
        && first.get(i + 1).kind() == Command.Kind.RETURN) {
      return conditional ? Program.EntryStyle.CONDITIONAL_STUB : Program.EntryStyle.STUB;
    }
    return Program.EntryStyle.DIRECT;
  }

  private static int mainPosition(List<List<Command>> spans, Program.EntryStyle entryStyle) {
    if (entryStyle == Program.EntryStyle.DIRECT) return spans.get(0).get(0).pos();
    // The routine called after SAVEBP, if there are globals, else the stub's callee.
    for (List<Command> span : spans) {
      boolean saved = false;
      for (Command command : span) {
        if (NodeQueries.isSaveBp(command)) saved = true;
        if (saved && command.kind() == Command.Kind.JUMP_TO_SUBROUTINE) {
          return NodeQueries.jumpDestination(command);
        }
      }
    }
    for (Command command : spans.get(0)) {
      if (command.kind() == Command.Kind.JUMP_TO_SUBROUTINE) {
        return NodeQueries.jumpDestination(command);
      }
    }
    return spans.get(0).get(0).pos();
  }

  /** Lifts one instruction; NOPs carry no semantics and yield nothing. */
  static Optional<Command> lift(Instruction in) throws DecompilerException {
    switch (in.opcode()) {
      case NOP:
        return Optional.empty();
      case CPDOWNSP:
        return Optional.of(stackCopy(Command.Kind.COPY_DOWN_SP, in));
      case CPTOPSP:
        return Optional.of(stackCopy(Command.Kind.COPY_TOP_SP, in));
      case CPDOWNBP:
        return Optional.of(stackCopy(Command.Kind.COPY_DOWN_BP, in));
      case CPTOPBP:
        return Optional.of(stackCopy(Command.Kind.COPY_TOP_BP, in));
      case RSADD:
        {
          ValueType type = singleType(in);
          if (type == ValueType.STRUCT || type == ValueType.VECTOR) {
            throw badQualifier(in);
          }
          return Optional.of(new Command.RsAdd(in, type));
        }
      case CONST:
        {
          ValueType type = singleType(in);
          Operand.Kind expected;
          switch (type) {
            case INT:
            case OBJECT:
              expected = Operand.Kind.INT_VALUE;
              break;
            case FLOAT:
              expected = Operand.Kind.FLOAT_VALUE;
              break;
            case STRING:
              expected = Operand.Kind.STRING_VALUE;
              break;
            default:
              throw badQualifier(in);
          }
          checkOperands(in, expected);
          return Optional.of(new Command.Constant(in, type, in.operand(0)));
        }
      case ACTION:
        checkOperands(in, Operand.Kind.INT_VALUE, Operand.Kind.INT_VALUE);
        return Optional.of(
            new Command.Action(in, in.operand(0).intValue(), in.operand(1).intValue()));
      case LOGAND:
      case LOGOR:
      case INCOR:
      case EXCOR:
      case BOOLAND:
        checkOperands(in);
        if (in.qualifier() != TypePair.II.qualifier()) throw badQualifier(in);
        return Optional.of(new Command.Logical(in, logicalOp(in.opcode())));
      case EQUAL:
      case NEQUAL:
      case GEQ:
      case GT:
      case LT:
      case LEQ:
      case SHLEFT:
      case SHRIGHT:
      case USHRIGHT:
      case ADD:
      case SUB:
      case MUL:
      case DIV:
      case MOD:
        return Optional.of(binary(in));
      case NEG:
      case COMP:
      case NOTI:
        return Optional.of(unary(in));
      case MOVSP:
        checkOperands(in, Operand.Kind.INT_VALUE);
        return Optional.of(new Command.MoveSp(in, in.operand(0).intValue()));
      case JMP:
        checkOperands(in, Operand.Kind.INT_VALUE);
        return Optional.of(new Command.Jump(in, in.operand(0).intValue()));
      case JSR:
        checkOperands(in, Operand.Kind.INT_VALUE);
        return Optional.of(new Command.JumpToSubroutine(in, in.operand(0).intValue()));
      case JZ:
      case JNZ:
        checkOperands(in, Operand.Kind.INT_VALUE);
        return Optional.of(
            new Command.ConditionalJump(
                in, in.opcode() == Opcode.JZ, in.operand(0).intValue()));
      case RETN:
        checkOperands(in);
        return Optional.of(new Command.Return(in));
      case DESTRUCT:
        checkOperands(in, Operand.Kind.INT_VALUE, Operand.Kind.INT_VALUE, Operand.Kind.INT_VALUE);
        return Optional.of(
            new Command.Destruct(
                in,
                in.operand(0).intValue(),
                in.operand(1).intValue(),
                in.operand(2).intValue()));
      case DECISP:
      case INCISP:
      case DECIBP:
      case INCIBP:
        {
          checkOperands(in, Operand.Kind.INT_VALUE);
          if (in.qualifier() != Opcode.QUALIFIER_INT) throw badQualifier(in);
          Command.StackOpKind op =
              in.opcode() == Opcode.INCISP || in.opcode() == Opcode.INCIBP
                  ? Command.StackOpKind.INCREMENT
                  : Command.StackOpKind.DECREMENT;
          boolean global = in.opcode() == Opcode.INCIBP || in.opcode() == Opcode.DECIBP;
          return Optional.of(new Command.StackOp(in, op, global, in.operand(0).intValue()));
        }
      case SAVEBP:
      case RESTOREBP:
        checkOperands(in);
        return Optional.of(new Command.Bp(in, in.opcode() == Opcode.SAVEBP));
      case STORE_STATE:
        checkOperands(in, Operand.Kind.INT_VALUE, Operand.Kind.INT_VALUE);
        if (in.qualifier() != Opcode.QUALIFIER_STORE_STATE) throw badQualifier(in);
        return Optional.of(
            new Command.StoreState(in, in.operand(0).intValue(), in.operand(1).intValue()));
    }
    throw new DecompilerException(in.pos(), ErrorKind.DECODE, "unhandled opcode " + in.opcode());
  }

  private static Command stackCopy(Command.Kind kind, Instruction in) throws DecompilerException {
    checkOperands(in, Operand.Kind.INT_VALUE, Operand.Kind.INT_VALUE);
    int offset = in.operand(0).intValue();
    int size = in.operand(1).intValue();
    if (size <= 0 || size % 4 != 0 || offset % 4 != 0) {
      throw new DecompilerException(
          in.pos(),
          ErrorKind.DECODE,
          String.format("misaligned stack copy offset %d size %d", offset, size));
    }
    return new Command.StackCopy(kind, in, offset, size);
  }

  private static Command binary(Instruction in) throws DecompilerException {
    BinaryOp op = BINARY_OPS.get(in.opcode());
    if (op == BinaryOp.UNSIGNED_SHIFT_RIGHT) {
      throw new DecompilerException(in.pos(), ErrorKind.DECODE, "found an unsigned bit shift");
    }
    TypePair types = TypePair.fromQualifier(in.qualifier()).orElseThrow(() -> badQualifier(in));
    if (!LEGAL_PAIRS.get(op).contains(types)) throw badQualifier(in);
    int structSize = 0;
    if (types == TypePair.TT) {
      checkOperands(in, Operand.Kind.INT_VALUE);
      structSize = in.operand(0).intValue();
      if (structSize <= 0 || structSize % 4 != 0) {
        throw new DecompilerException(
            in.pos(), ErrorKind.DECODE, "bad structure size " + structSize);
      }
    } else {
      checkOperands(in);
    }
    return new Command.Binary(in, op, types, structSize);
  }

  private static Command unary(Instruction in) throws DecompilerException {
    checkOperands(in);
    ValueType type = singleType(in);
    Command.UnaryOp op;
    switch (in.opcode()) {
      case NEG:
        op = Command.UnaryOp.NEGATE;
        if (type != ValueType.INT && type != ValueType.FLOAT) throw badQualifier(in);
        break;
      case COMP:
        op = Command.UnaryOp.COMPLEMENT;
        if (type != ValueType.INT) throw badQualifier(in);
        break;
      default:
        op = Command.UnaryOp.NOT;
        if (type != ValueType.INT) throw badQualifier(in);
    }
    return new Command.Unary(in, op, type);
  }

  private static Command.LogicalOp logicalOp(Opcode opcode) {
    switch (opcode) {
      case LOGAND:
        return Command.LogicalOp.AND;
      case LOGOR:
        return Command.LogicalOp.OR;
      case INCOR:
        return Command.LogicalOp.INCLUSIVE_OR;
      case EXCOR:
        return Command.LogicalOp.EXCLUSIVE_OR;
      default:
        return Command.LogicalOp.BITWISE_AND;
    }
  }

  private static ValueType singleType(Instruction in) throws DecompilerException {
    return ValueType.fromQualifier(in.qualifier()).orElseThrow(() -> badQualifier(in));
  }

  private static void checkOperands(Instruction in, Operand.Kind... kinds)
      throws DecompilerException {
    boolean ok = in.operands().size() == kinds.length;
    for (int i = 0; ok && i < kinds.length; i++) {
      ok = in.operand(i).kind() == kinds[i];
    }
    if (!ok) {
      throw new DecompilerException(
          in.pos(), ErrorKind.DECODE, "operands " + in.operands() + " do not fit " + in.opcode());
    }
  }

  private static DecompilerException badQualifier(Instruction in) {
    return new DecompilerException(
        in.pos(),
        ErrorKind.DECODE,
        String.format("qualifier 0x%02X is incompatible with %s", in.qualifier(), in.opcode()));
  }

  private static String hex(int pos) {
    return String.format("%08X", pos);
  }
}
