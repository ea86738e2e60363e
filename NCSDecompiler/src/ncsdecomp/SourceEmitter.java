package ncsdecomp;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Strings;
import com.google.common.base.VerifyException;

import ncsdecomp.Script.Block;
import ncsdecomp.Script.Constant;
import ncsdecomp.Script.Expression;
import ncsdecomp.Script.Routine;
import ncsdecomp.Script.Statement;

/**
 * Renders a {@link Script} as source text: prototypes of the ordinary routines, then the global
 * declarations, then every routine in file order.
 *
 * <p>Variables are named while rendering, so a script should be emitted once; a second emission
 * reuses the names the first one chose.
 */
public final class SourceEmitter extends VoidDefaultScriptVisitor {
  private static final String INDENT = "\t";
  private static final String VECTOR_COMPONENTS = "xyz";

  private final Script script;
  private final ActionTable actions;
  private final StringBuilder out = new StringBuilder();
  private final VariableNamer globalNames = VariableNamer.forGlobals();

  private VariableNamer names = globalNames;
  private int depth = 0;

  private SourceEmitter(Script script, ActionTable actions) {
    this.script = script;
    this.actions = actions;
  }

  public static String emit(Script script, ActionTable actions) {
    SourceEmitter emitter = new SourceEmitter(script, actions);
    script.accept(emitter, null);
    return emitter.out.toString();
  }

  @Override
  public void visitImpl(Script node) {
    boolean section = false;
    for (Routine routine : node.routines()) {
      if (routine.role() != Subroutine.Role.ORDINARY) continue;
      line(header(routine) + ";");
      section = true;
    }

    if (!node.globals().isEmpty()) {
      if (section) out.append('\n');
      node.globals().forEach(s -> s.accept(this, null));
      section = true;
    }

    for (Routine routine : node.routines()) {
      if (section) out.append('\n');
      routine.accept(this, null);
      section = true;
    }
  }

  @Override
  public void visitImpl(Script.Function node) {
    names = VariableNamer.forRoutine(globalNames);
    line(header(node) + " {");
    body(node.body());
    line("}");
    names = globalNames;
  }

  @Override
  public void visitImpl(Script.FailedFunction node) {
    line(header(node) + " {");
    depth++;
    line("// decompilation failed for this routine");
    for (String message : node.error().describe().split("\n")) {
      line("// " + message);
    }
    depth--;
    line("}");
  }

  // ---------------------------------------------------------------------------------------------
  // Statements

  @Override
  public void visitImpl(Block node) {
    line("{");
    body(node);
    line("}");
  }

  @Override
  public void visitImpl(Script.VarDecl node) {
    Variable variable = node.variable().root();
    String declaration = variable.type().typeName() + " " + names.name(variable);
    line(
        node.initializer()
            .map(init -> declaration + " = " + render(init, Precedence.ASSIGNMENT, false) + ";")
            .orElse(declaration + ";"));
  }

  @Override
  public void visitImpl(Script.ExpressionStatement node) {
    line(render(node.expression()) + ";");
  }

  @Override
  public void visitImpl(Script.If node) {
    emitIf(node, "if");
  }

  private void emitIf(Script.If node, String keyword) {
    line(keyword + " (" + render(node.condition()) + ") {");
    body(node.then());
    line("}");
    if (!node.otherwise().isPresent()) return;

    List<Statement> otherwise = node.otherwise().get().statements();
    if (otherwise.size() == 1 && otherwise.get(0).kind() == Statement.Kind.IF) {
      emitIf(otherwise.get(0).cast(), "else if");
    } else {
      line("else {");
      body(node.otherwise().get());
      line("}");
    }
  }

  @Override
  public void visitImpl(Script.While node) {
    line("while (" + render(node.condition()) + ") {");
    body(node.body());
    line("}");
  }

  @Override
  public void visitImpl(Script.DoWhile node) {
    line("do {");
    body(node.body());
    line("} while (" + render(node.condition()) + ");");
  }

  @Override
  public void visitImpl(Script.For node) {
    String init = node.init().map(this::render).orElse("");
    String update = node.update().map(this::render).orElse("");
    line("for (" + init + "; " + render(node.condition()) + "; " + update + ") {");
    body(node.body());
    line("}");
  }

  @Override
  public void visitImpl(Script.Switch node) {
    line("switch (" + render(node.subject()) + ") {");
    depth++;
    for (Script.SwitchCase switchCase : node.cases()) {
      switchCase.values().forEach(value -> line("case " + value + ":"));
      if (switchCase.isDefault()) {
        line("default:");
      }
      body(switchCase.body());
    }
    depth--;
    line("}");
  }

  @Override
  public void visitImpl(Script.Return node) {
    line(node.value().map(v -> "return " + render(v) + ";").orElse("return;"));
  }

  @Override
  public void visitImpl(Script.Break node) {
    line("break;");
  }

  @Override
  public void visitImpl(Script.Continue node) {
    line("continue;");
  }

  @Override
  public void visitImpl(Script.Goto node) {
    line("goto " + labelName(node.target()) + ";");
  }

  @Override
  public void visitImpl(Script.Label node) {
    line(labelName(node.pos()) + ":");
  }

  @Override
  public void visitImpl(Script.ErrorComment node) {
    line("// " + node.text());
  }

  private void body(Block block) {
    depth++;
    block.statements().forEach(s -> s.accept(this, null));
    depth--;
  }

  private void line(String text) {
    out.append(Strings.repeat(INDENT, depth)).append(text).append('\n');
  }

  static String labelName(int pos) {
    return String.format("loc_%08X", pos);
  }

  private String header(Routine routine) {
    SubroutineSignature signature = routine.signature();
    List<String> parameters = new ArrayList<>();
    if (routine.failed()) {
      for (int i = 0; i < signature.paramTypes().size(); i++) {
        ValueType type = signature.paramTypes().get(i);
        parameters.add(type.typeName() + " " + VariableNamer.parameterName(type, i));
      }
    } else {
      List<Variable> variables = ((Script.Function) routine).parameters();
      VariableNamer.nameParameters(variables);
      for (Variable variable : variables) {
        parameters.add(variable.root().type().typeName() + " " + variable.root().name());
      }
    }
    return String.format(
        "%s %s(%s)",
        signature.returnType().typeName(),
        script.routineName(signature.index()),
        String.join(", ", parameters));
  }

  // ---------------------------------------------------------------------------------------------
  // Expressions

  private String render(Expression expression) {
    return render(expression, Precedence.LOWEST, false);
  }

  /**
   * Renders {@code expression} as an operand of an operator binding at {@code context}. With
   * {@code strict}, an operand binding exactly as tightly is parenthesized too, which keeps the
   * right side of left-associative operators intact.
   */
  private String render(Expression expression, Precedence context, boolean strict) {
    String text = bare(expression);
    Precedence own = Precedence.of(expression);
    return own.bindsLooserThan(context) || (strict && own == context) ? "(" + text + ")" : text;
  }

  private String bare(Expression expression) {
    switch (expression.kind()) {
      case CONSTANT:
        return literal(expression.cast());
      case VARIABLE:
        return access(expression.<Script.VariableRef>cast().access());
      case UNARY:
        {
          Script.Unary node = expression.cast();
          String op = NodeQueries.unaryOperator(node.op());
          String operand = render(node.operand(), Precedence.UNARY, false);
          // "- -x" must not collapse into a decrement.
          if (operand.startsWith(op) && !op.equals("!")) operand = "(" + operand + ")";
          return op + operand;
        }
      case BINARY:
        {
          Script.Binary node = expression.cast();
          return infix(
              node.left(),
              NodeQueries.binaryOperator(node.op()),
              Precedence.of(node.op()),
              node.right());
        }
      case LOGICAL:
        {
          Script.Logical node = expression.cast();
          return infix(
              node.left(),
              NodeQueries.logicalOperator(node.op()),
              Precedence.of(node.op()),
              node.right());
        }
      case SUBROUTINE_CALL:
        {
          Script.SubroutineCall node = expression.cast();
          return script.routineName(node.subroutine()) + arguments(node.arguments());
        }
      case ACTION_CALL:
        {
          Script.ActionCall node = expression.cast();
          return actions.resolvedName(node.actionId()) + arguments(node.arguments());
        }
      case ASSIGNMENT:
        {
          Script.Assignment node = expression.cast();
          return access(node.target())
              + " = "
              + render(node.value(), Precedence.ASSIGNMENT, false);
        }
      case INC_DEC:
        {
          Script.IncDec node = expression.cast();
          String op = NodeQueries.stackOperator(node.op());
          return node.prefix() ? op + access(node.target()) : access(node.target()) + op;
        }
      case VECTOR_LITERAL:
        return composite(expression.cast());
      case MEMBER:
        {
          Script.Member node = expression.cast();
          return render(node.source(), Precedence.POSTFIX, false)
              + memberSuffix(node.source().type(), node.offset(), node.width());
        }
      case ACTION_ARGUMENT:
        return actionArgument(expression.cast());
    }
    throw new VerifyException("unknown expression " + expression.kind());
  }

  private String infix(Expression left, String op, Precedence precedence, Expression right) {
    return render(left, precedence, false) + " " + op + " " + render(right, precedence, true);
  }

  private String arguments(List<Expression> arguments) {
    return arguments.stream()
        .map(a -> render(a, Precedence.ASSIGNMENT, false))
        .collect(Collectors.joining(", ", "(", ")"));
  }

  private String access(VarAccess access) {
    String name = names.name(access.variable());
    if (access.isWhole()) return name;
    return name + memberSuffix(access.variable().type(), access.offset(), access.width());
  }

  private static String memberSuffix(ValueType type, int offset, int width) {
    if (type == ValueType.VECTOR && width == 1) {
      return "." + VECTOR_COMPONENTS.charAt(offset);
    }
    return ".field" + offset;
  }

  private String composite(Script.VectorLiteral node) {
    List<String> parts =
        node.components().stream()
            .map(c -> render(c, Precedence.ASSIGNMENT, false))
            .collect(Collectors.toList());
    if (node.type() != ValueType.VECTOR) {
      return "{" + String.join(", ", parts) + "}";
    }
    boolean literal =
        node.components().stream().allMatch(c -> c.kind() == Expression.Kind.CONSTANT);
    return literal
        ? "[" + String.join(", ", parts) + "]"
        : "Vector(" + String.join(", ", parts) + ")";
  }

  /** A deferred action is written as the call it wraps. */
  private String actionArgument(Script.ActionArgument node) {
    for (Statement statement : node.body().statements()) {
      if (statement.kind() == Statement.Kind.EXPRESSION) {
        return render(statement.<Script.ExpressionStatement>cast().expression());
      }
    }
    return "/* empty action */";
  }

  // ---------------------------------------------------------------------------------------------
  // Literals

  static String literal(Constant constant) {
    switch (constant.type()) {
      case FLOAT:
        return floatLiteral(constant.value().floatValue());
      case STRING:
        return stringLiteral(constant.value().stringValue());
      case OBJECT:
        switch (constant.value().intValue()) {
          case 0:
            return "OBJECT_SELF";
          case 1:
            return "OBJECT_INVALID";
          default:
            return Integer.toString(constant.value().intValue());
        }
      default:
        return Integer.toString(constant.value().intValue());
    }
  }

  static String floatLiteral(float value) {
    if (Float.isNaN(value) || Float.isInfinite(value)) return Float.toString(value);
    if (value == 0 && Float.floatToRawIntBits(value) != 0) return "-0.0";
    String text = new BigDecimal(Float.toString(value)).toPlainString();
    return text.contains(".") ? text : text + ".0";
  }

  static String stringLiteral(String value) {
    StringBuilder builder = new StringBuilder("\"");
    for (char ch : value.toCharArray()) {
      switch (ch) {
        case '\\':
          builder.append("\\\\");
          break;
        case '"':
          builder.append("\\\"");
          break;
        case '\n':
          builder.append("\\n");
          break;
        default:
          builder.append(ch);
      }
    }
    return builder.append('"').toString();
  }
}
