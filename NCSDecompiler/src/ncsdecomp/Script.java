package ncsdecomp;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import ncsdecomp.processor.ScriptChild;
import ncsdecomp.processor.ScriptNode;

/**
 * The reconstructed source tree of one program: global declarations followed by the routines in
 * file order. Statements and expressions are closed families tagged by a {@code Kind} enum, like
 * {@link Command}; visitors are generated for every node class.
 */
@ScriptNode
public final class Script implements Script_ScriptNode {
  private final ImmutableList<Statement> globals;
  private final ImmutableList<Routine> routines;
  private final ImmutableMap<Integer, String> routineNames;

  private Script(
      List<Statement> globals, List<Routine> routines, ImmutableMap<Integer, String> routineNames) {
    this.globals = ImmutableList.copyOf(globals);
    this.routines = ImmutableList.copyOf(routines);
    this.routineNames = routineNames;
  }

  public static Script create(
      List<Statement> globals, List<Routine> routines, ImmutableMap<Integer, String> routineNames) {
    return new Script(globals, routines, routineNames);
  }

  /** Global variable declarations, in stack order. */
  @ScriptChild
  @Override
  public ImmutableList<Statement> globals() {
    return globals;
  }

  @ScriptChild
  @Override
  public ImmutableList<Routine> routines() {
    return routines;
  }

  /** Emitted name of every subroutine index that is called or defined. */
  public ImmutableMap<Integer, String> routineNames() {
    return routineNames;
  }

  public String routineName(int subroutine) {
    String name = routineNames.get(subroutine);
    return name != null ? name : "sub" + subroutine;
  }

  // ---------------------------------------------------------------------------------------------
  // Routines

  public abstract static class Routine implements ScriptNodeInterface {
    private final SubroutineSignature signature;
    private final Subroutine.Role role;
    private final int pos;

    Routine(SubroutineSignature signature, Subroutine.Role role, int pos) {
      this.signature = signature;
      this.role = role;
      this.pos = pos;
    }

    public final SubroutineSignature signature() {
      return signature;
    }

    public final Subroutine.Role role() {
      return role;
    }

    /** Byte position of the routine's first command. */
    public final int pos() {
      return pos;
    }

    public abstract boolean failed();
  }

  @ScriptNode
  public static final class Function extends Routine implements Script_Function_ScriptNode {
    private final ImmutableList<Variable> parameters;
    private final Block body;

    private Function(
        SubroutineSignature signature,
        Subroutine.Role role,
        int pos,
        List<Variable> parameters,
        Block body) {
      super(signature, role, pos);
      this.parameters = ImmutableList.copyOf(parameters);
      this.body = body;
    }

    public static Function create(
        SubroutineSignature signature,
        Subroutine.Role role,
        int pos,
        List<Variable> parameters,
        Block body) {
      return new Function(signature, role, pos, parameters, body);
    }

    /** First parameter first. */
    public ImmutableList<Variable> parameters() {
      return parameters;
    }

    @ScriptChild
    @Override
    public Block body() {
      return body;
    }

    public Function withBody(Block body) {
      return new Function(signature(), role(), pos(), parameters, body);
    }

    @Override
    public boolean failed() {
      return false;
    }
  }

  /** Placeholder for a routine whose stack could not be tracked. */
  @ScriptNode
  public static final class FailedFunction extends Routine
      implements Script_FailedFunction_ScriptNode {
    private final DecompilerException error;

    private FailedFunction(
        SubroutineSignature signature,
        Subroutine.Role role,
        int pos,
        DecompilerException error) {
      super(signature, role, pos);
      this.error = error;
    }

    public static FailedFunction create(
        SubroutineSignature signature,
        Subroutine.Role role,
        int pos,
        DecompilerException error) {
      return new FailedFunction(signature, role, pos, error);
    }

    public DecompilerException error() {
      return error;
    }

    @Override
    public boolean failed() {
      return true;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Statements

  public abstract static class Statement implements ScriptNodeInterface {
    public enum Kind {
      BLOCK,
      VAR_DECL,
      EXPRESSION,
      IF,
      WHILE,
      DO_WHILE,
      FOR,
      SWITCH,
      RETURN,
      BREAK,
      CONTINUE,
      GOTO,
      LABEL,
      ERROR_COMMENT;
    }

    private final Kind kind;
    private final int pos;

    Statement(Kind kind, int pos) {
      this.kind = kind;
      this.pos = pos;
    }

    public final Kind kind() {
      return kind;
    }

    /** Byte position of the first command the statement was built from, or -1. */
    public final int pos() {
      return pos;
    }

    @SuppressWarnings("unchecked")
    public final <T extends Statement> T cast() {
      return (T) this;
    }
  }

  @ScriptNode
  public static final class Block extends Statement implements Script_Block_ScriptNode {
    private final ImmutableList<Statement> statements;

    private Block(int pos, List<Statement> statements) {
      super(Kind.BLOCK, pos);
      this.statements = ImmutableList.copyOf(statements);
    }

    public static Block create(int pos, List<Statement> statements) {
      return new Block(pos, statements);
    }

    public static Block empty(int pos) {
      return new Block(pos, ImmutableList.of());
    }

    @ScriptChild
    @Override
    public ImmutableList<Statement> statements() {
      return statements;
    }

    public boolean isEmpty() {
      return statements.isEmpty();
    }
  }

  @ScriptNode
  public static final class VarDecl extends Statement implements Script_VarDecl_ScriptNode {
    private final Variable variable;
    private final Optional<Expression> initializer;

    private VarDecl(int pos, Variable variable, Optional<Expression> initializer) {
      super(Kind.VAR_DECL, pos);
      this.variable = variable;
      this.initializer = initializer;
    }

    public static VarDecl create(int pos, Variable variable, Optional<Expression> initializer) {
      return new VarDecl(pos, variable, initializer);
    }

    public Variable variable() {
      return variable;
    }

    @ScriptChild
    @Override
    public Optional<Expression> initializer() {
      return initializer;
    }
  }

  @ScriptNode
  public static final class ExpressionStatement extends Statement
      implements Script_ExpressionStatement_ScriptNode {
    private final Expression expression;

    private ExpressionStatement(int pos, Expression expression) {
      super(Kind.EXPRESSION, pos);
      this.expression = expression;
    }

    public static ExpressionStatement create(int pos, Expression expression) {
      return new ExpressionStatement(pos, expression);
    }

    @ScriptChild
    @Override
    public Expression expression() {
      return expression;
    }
  }

  @ScriptNode
  public static final class If extends Statement implements Script_If_ScriptNode {
    private final Expression condition;
    private final Block then;
    private final Optional<Block> otherwise;

    private If(int pos, Expression condition, Block then, Optional<Block> otherwise) {
      super(Kind.IF, pos);
      this.condition = condition;
      this.then = then;
      this.otherwise = otherwise;
    }

    public static If create(int pos, Expression condition, Block then, Optional<Block> otherwise) {
      return new If(pos, condition, then, otherwise);
    }

    @ScriptChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ScriptChild
    @Override
    public Block then() {
      return then;
    }

    @ScriptChild
    @Override
    public Optional<Block> otherwise() {
      return otherwise;
    }
  }

  @ScriptNode
  public static final class While extends Statement implements Script_While_ScriptNode {
    private final Expression condition;
    private final Block body;

    private While(int pos, Expression condition, Block body) {
      super(Kind.WHILE, pos);
      this.condition = condition;
      this.body = body;
    }

    public static While create(int pos, Expression condition, Block body) {
      return new While(pos, condition, body);
    }

    @ScriptChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ScriptChild
    @Override
    public Block body() {
      return body;
    }
  }

  @ScriptNode
  public static final class DoWhile extends Statement implements Script_DoWhile_ScriptNode {
    private final Block body;
    private final Expression condition;

    private DoWhile(int pos, Block body, Expression condition) {
      super(Kind.DO_WHILE, pos);
      this.body = body;
      this.condition = condition;
    }

    public static DoWhile create(int pos, Block body, Expression condition) {
      return new DoWhile(pos, body, condition);
    }

    @ScriptChild
    @Override
    public Block body() {
      return body;
    }

    @ScriptChild
    @Override
    public Expression condition() {
      return condition;
    }
  }

  @ScriptNode
  public static final class For extends Statement implements Script_For_ScriptNode {
    private final Optional<Expression> init;
    private final Expression condition;
    private final Optional<Expression> update;
    private final Block body;

    private For(
        int pos,
        Optional<Expression> init,
        Expression condition,
        Optional<Expression> update,
        Block body) {
      super(Kind.FOR, pos);
      this.init = init;
      this.condition = condition;
      this.update = update;
      this.body = body;
    }

    public static For create(
        int pos,
        Optional<Expression> init,
        Expression condition,
        Optional<Expression> update,
        Block body) {
      return new For(pos, init, condition, update, body);
    }

    @ScriptChild
    @Override
    public Optional<Expression> init() {
      return init;
    }

    @ScriptChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ScriptChild
    @Override
    public Optional<Expression> update() {
      return update;
    }

    @ScriptChild
    @Override
    public Block body() {
      return body;
    }
  }

  @ScriptNode
  public static final class Switch extends Statement implements Script_Switch_ScriptNode {
    private final Expression subject;
    private final ImmutableList<SwitchCase> cases;

    private Switch(int pos, Expression subject, List<SwitchCase> cases) {
      super(Kind.SWITCH, pos);
      this.subject = subject;
      this.cases = ImmutableList.copyOf(cases);
    }

    public static Switch create(int pos, Expression subject, List<SwitchCase> cases) {
      return new Switch(pos, subject, cases);
    }

    @ScriptChild
    @Override
    public Expression subject() {
      return subject;
    }

    /** In source order; control falls from one case into the next. */
    @ScriptChild
    @Override
    public ImmutableList<SwitchCase> cases() {
      return cases;
    }
  }

  /** The labels sharing one run of statements in a {@link Switch}. */
  @ScriptNode
  public static final class SwitchCase implements Script_SwitchCase_ScriptNode {
    private final ImmutableList<Integer> values;
    private final boolean isDefault;
    private final Block body;

    private SwitchCase(List<Integer> values, boolean isDefault, Block body) {
      Preconditions.checkArgument(isDefault || !values.isEmpty(), "case without a label");
      this.values = ImmutableList.copyOf(values);
      this.isDefault = isDefault;
      this.body = body;
    }

    public static SwitchCase create(List<Integer> values, boolean isDefault, Block body) {
      return new SwitchCase(values, isDefault, body);
    }

    public ImmutableList<Integer> values() {
      return values;
    }

    public boolean isDefault() {
      return isDefault;
    }

    @ScriptChild
    @Override
    public Block body() {
      return body;
    }

    public SwitchCase withBody(Block body) {
      return new SwitchCase(values, isDefault, body);
    }
  }

  @ScriptNode
  public static final class Return extends Statement implements Script_Return_ScriptNode {
    private final Optional<Expression> value;

    private Return(int pos, Optional<Expression> value) {
      super(Kind.RETURN, pos);
      this.value = value;
    }

    public static Return create(int pos, Optional<Expression> value) {
      return new Return(pos, value);
    }

    @ScriptChild
    @Override
    public Optional<Expression> value() {
      return value;
    }
  }

  @ScriptNode
  public static final class Break extends Statement implements Script_Break_ScriptNode {
    private Break(int pos) {
      super(Kind.BREAK, pos);
    }

    public static Break create(int pos) {
      return new Break(pos);
    }
  }

  @ScriptNode
  public static final class Continue extends Statement implements Script_Continue_ScriptNode {
    private Continue(int pos) {
      super(Kind.CONTINUE, pos);
    }

    public static Continue create(int pos) {
      return new Continue(pos);
    }
  }

  /** Unstructured jump to the statement starting at {@link #target()}. */
  @ScriptNode
  public static final class Goto extends Statement implements Script_Goto_ScriptNode {
    private final int target;

    private Goto(int pos, int target) {
      super(Kind.GOTO, pos);
      this.target = target;
    }

    public static Goto create(int pos, int target) {
      return new Goto(pos, target);
    }

    public int target() {
      return target;
    }
  }

  @ScriptNode
  public static final class Label extends Statement implements Script_Label_ScriptNode {
    private Label(int pos) {
      super(Kind.LABEL, pos);
    }

    public static Label create(int pos) {
      return new Label(pos);
    }
  }

  @ScriptNode
  public static final class ErrorComment extends Statement
      implements Script_ErrorComment_ScriptNode {
    private final String text;

    private ErrorComment(int pos, String text) {
      super(Kind.ERROR_COMMENT, pos);
      this.text = text;
    }

    public static ErrorComment create(int pos, String text) {
      return new ErrorComment(pos, text);
    }

    public String text() {
      return text;
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Expressions

  public abstract static class Expression implements ScriptNodeInterface {
    public enum Kind {
      CONSTANT,
      VARIABLE,
      UNARY,
      BINARY,
      LOGICAL,
      SUBROUTINE_CALL,
      ACTION_CALL,
      ASSIGNMENT,
      INC_DEC,
      VECTOR_LITERAL,
      MEMBER,
      ACTION_ARGUMENT;

      public boolean isCall() {
        return this == SUBROUTINE_CALL || this == ACTION_CALL;
      }
    }

    private final Kind kind;
    private final ValueType type;

    Expression(Kind kind, ValueType type) {
      this.kind = kind;
      this.type = type;
    }

    public final Kind kind() {
      return kind;
    }

    public final ValueType type() {
      return type;
    }

    /** Whether evaluating the expression can change state: calls, assignments, increments. */
    public abstract boolean hasSideEffects();

    @SuppressWarnings("unchecked")
    public final <T extends Expression> T cast() {
      return (T) this;
    }
  }

  @ScriptNode
  public static final class Constant extends Expression implements Script_Constant_ScriptNode {
    private final Operand value;

    private Constant(ValueType type, Operand value) {
      super(Kind.CONSTANT, type);
      this.value = value;
    }

    public static Constant create(ValueType type, Operand value) {
      return new Constant(type, value);
    }

    public static Constant ofInt(int value) {
      return new Constant(ValueType.INT, Operand.ofInt(value));
    }

    public Operand value() {
      return value;
    }

    @Override
    public boolean hasSideEffects() {
      return false;
    }
  }

  @ScriptNode
  public static final class VariableRef extends Expression
      implements Script_VariableRef_ScriptNode {
    private final VarAccess access;

    private VariableRef(VarAccess access) {
      super(Kind.VARIABLE, access.type());
      this.access = access;
    }

    public static VariableRef create(VarAccess access) {
      return new VariableRef(access);
    }

    public VarAccess access() {
      return access;
    }

    @Override
    public boolean hasSideEffects() {
      return false;
    }
  }

  @ScriptNode
  public static final class Unary extends Expression implements Script_Unary_ScriptNode {
    private final Command.UnaryOp op;
    private final Expression operand;

    private Unary(Command.UnaryOp op, ValueType type, Expression operand) {
      super(Kind.UNARY, type);
      this.op = op;
      this.operand = operand;
    }

    public static Unary create(Command.UnaryOp op, ValueType type, Expression operand) {
      return new Unary(op, type, operand);
    }

    public Command.UnaryOp op() {
      return op;
    }

    @ScriptChild
    @Override
    public Expression operand() {
      return operand;
    }

    @Override
    public boolean hasSideEffects() {
      return operand.hasSideEffects();
    }
  }

  @ScriptNode
  public static final class Binary extends Expression implements Script_Binary_ScriptNode {
    private final Command.BinaryOp op;
    private final Expression left;
    private final Expression right;

    private Binary(Command.BinaryOp op, ValueType type, Expression left, Expression right) {
      super(Kind.BINARY, type);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public static Binary create(
        Command.BinaryOp op, ValueType type, Expression left, Expression right) {
      return new Binary(op, type, left, right);
    }

    public Command.BinaryOp op() {
      return op;
    }

    @ScriptChild
    @Override
    public Expression left() {
      return left;
    }

    @ScriptChild
    @Override
    public Expression right() {
      return right;
    }

    @Override
    public boolean hasSideEffects() {
      return left.hasSideEffects() || right.hasSideEffects();
    }
  }

  @ScriptNode
  public static final class Logical extends Expression implements Script_Logical_ScriptNode {
    private final Command.LogicalOp op;
    private final Expression left;
    private final Expression right;

    private Logical(Command.LogicalOp op, Expression left, Expression right) {
      super(Kind.LOGICAL, ValueType.INT);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public static Logical create(Command.LogicalOp op, Expression left, Expression right) {
      return new Logical(op, left, right);
    }

    public Command.LogicalOp op() {
      return op;
    }

    @ScriptChild
    @Override
    public Expression left() {
      return left;
    }

    @ScriptChild
    @Override
    public Expression right() {
      return right;
    }

    @Override
    public boolean hasSideEffects() {
      return left.hasSideEffects() || right.hasSideEffects();
    }
  }

  @ScriptNode
  public static final class SubroutineCall extends Expression
      implements Script_SubroutineCall_ScriptNode {
    private final int subroutine;
    private final ImmutableList<Expression> arguments;

    private SubroutineCall(int subroutine, ValueType type, List<Expression> arguments) {
      super(Kind.SUBROUTINE_CALL, type);
      this.subroutine = subroutine;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public static SubroutineCall create(
        int subroutine, ValueType type, List<Expression> arguments) {
      return new SubroutineCall(subroutine, type, arguments);
    }

    /** Index of the called subroutine. */
    public int subroutine() {
      return subroutine;
    }

    @ScriptChild
    @Override
    public ImmutableList<Expression> arguments() {
      return arguments;
    }

    @Override
    public boolean hasSideEffects() {
      return true;
    }
  }

  @ScriptNode
  public static final class ActionCall extends Expression implements Script_ActionCall_ScriptNode {
    private final int actionId;
    private final ImmutableList<Expression> arguments;

    private ActionCall(int actionId, ValueType type, List<Expression> arguments) {
      super(Kind.ACTION_CALL, type);
      this.actionId = actionId;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public static ActionCall create(int actionId, ValueType type, List<Expression> arguments) {
      return new ActionCall(actionId, type, arguments);
    }

    public int actionId() {
      return actionId;
    }

    @ScriptChild
    @Override
    public ImmutableList<Expression> arguments() {
      return arguments;
    }

    @Override
    public boolean hasSideEffects() {
      return true;
    }
  }

  @ScriptNode
  public static final class Assignment extends Expression implements Script_Assignment_ScriptNode {
    private final VarAccess target;
    private final Expression value;

    private Assignment(VarAccess target, Expression value) {
      super(Kind.ASSIGNMENT, target.type());
      this.target = target;
      this.value = value;
    }

    public static Assignment create(VarAccess target, Expression value) {
      return new Assignment(target, value);
    }

    public VarAccess target() {
      return target;
    }

    @ScriptChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    public boolean hasSideEffects() {
      return true;
    }
  }

  @ScriptNode
  public static final class IncDec extends Expression implements Script_IncDec_ScriptNode {
    private final VarAccess target;
    private final Command.StackOpKind op;
    private final boolean prefix;

    private IncDec(VarAccess target, Command.StackOpKind op, boolean prefix) {
      super(Kind.INC_DEC, ValueType.INT);
      this.target = target;
      this.op = op;
      this.prefix = prefix;
    }

    public static IncDec create(VarAccess target, Command.StackOpKind op, boolean prefix) {
      return new IncDec(target, op, prefix);
    }

    public VarAccess target() {
      return target;
    }

    public Command.StackOpKind op() {
      return op;
    }

    public boolean prefix() {
      return prefix;
    }

    @Override
    public boolean hasSideEffects() {
      return true;
    }
  }

  @ScriptNode
  public static final class VectorLiteral extends Expression
      implements Script_VectorLiteral_ScriptNode {
    private final ImmutableList<Expression> components;

    private VectorLiteral(ValueType type, List<Expression> components) {
      super(Kind.VECTOR_LITERAL, type);
      this.components = ImmutableList.copyOf(components);
    }

    /** Adjacent values taken as one: a vector for three floats, else an anonymous structure. */
    public static VectorLiteral create(ValueType type, List<Expression> components) {
      Preconditions.checkArgument(components.size() > 1, "literal of %s", components);
      return new VectorLiteral(type, components);
    }

    @ScriptChild
    @Override
    public ImmutableList<Expression> components() {
      return components;
    }

    @Override
    public boolean hasSideEffects() {
      return components.stream().anyMatch(Expression::hasSideEffects);
    }
  }

  /** Some slots of a wider value: a vector component or a structure field. */
  @ScriptNode
  public static final class Member extends Expression implements Script_Member_ScriptNode {
    private final Expression source;
    private final int offset;
    private final int width;

    private Member(ValueType type, Expression source, int offset, int width) {
      super(Kind.MEMBER, type);
      this.source = source;
      this.offset = offset;
      this.width = width;
    }

    public static Member create(ValueType type, Expression source, int offset, int width) {
      return new Member(type, source, offset, width);
    }

    @ScriptChild
    @Override
    public Expression source() {
      return source;
    }

    public int offset() {
      return offset;
    }

    public int width() {
      return width;
    }

    @Override
    public boolean hasSideEffects() {
      return source.hasSideEffects();
    }
  }

  /** A deferred action passed to an engine call, such as the second argument of DelayCommand. */
  @ScriptNode
  public static final class ActionArgument extends Expression
      implements Script_ActionArgument_ScriptNode {
    private final Block body;

    private ActionArgument(Block body) {
      super(Kind.ACTION_ARGUMENT, ValueType.ACTION);
      this.body = body;
    }

    public static ActionArgument create(Block body) {
      return new ActionArgument(body);
    }

    @ScriptChild
    @Override
    public Block body() {
      return body;
    }

    @Override
    public boolean hasSideEffects() {
      return false;
    }
  }
}
