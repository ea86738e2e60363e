package ncsdecomp;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableList;

/**
 * Flattens a {@link Script} into tokens naming node kinds, operators, literals and names. Two
 * decompilations have the same shape when their token lists are equal; whitespace, comments and
 * byte positions do not take part.
 *
 * <p>Variable names are those the {@link SourceEmitter} assigned, so both scripts should have
 * been emitted first.
 */
final class ScriptShape extends VoidDefaultScriptVisitor {
  private final Script script;
  private final List<String> tokens = new ArrayList<>();

  private ScriptShape(Script script) {
    this.script = script;
  }

  static ImmutableList<String> of(Script script) {
    ScriptShape shape = new ScriptShape(script);
    script.accept(shape, null);
    return ImmutableList.copyOf(shape.tokens);
  }

  private void add(String token) {
    tokens.add(token);
  }

  private String routineName(Script.Routine routine) {
    return script.routineName(routine.signature().index());
  }

  @Override
  public void visitImpl(Script.Function node) {
    add("function " + node.signature().returnType().typeName() + " " + routineName(node));
    for (Variable parameter : node.parameters()) {
      add("param " + parameter.root().type().typeName());
    }
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.FailedFunction node) {
    add("failed " + routineName(node));
  }

  @Override
  public void visitImpl(Script.Block node) {
    add("{");
    node.visitChildren(this, null);
    add("}");
  }

  @Override
  public void visitImpl(Script.VarDecl node) {
    add("decl " + node.variable().root().type().typeName() + " " + name(node.variable()));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.ExpressionStatement node) {
    add("expr");
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.If node) {
    add(node.otherwise().isPresent() ? "if-else" : "if");
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.While node) {
    add("while");
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.DoWhile node) {
    add("do");
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.For node) {
    add("for " + node.init().isPresent() + " " + node.update().isPresent());
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.Switch node) {
    add("switch");
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.SwitchCase node) {
    node.values().forEach(value -> add("case " + value));
    if (node.isDefault()) {
      add("default");
    }
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.Return node) {
    add(node.value().isPresent() ? "return value" : "return");
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.Break node) {
    add("break");
  }

  @Override
  public void visitImpl(Script.Continue node) {
    add("continue");
  }

  // Jump targets are byte positions, which shift whenever the code does.
  @Override
  public void visitImpl(Script.Goto node) {
    add("goto");
  }

  @Override
  public void visitImpl(Script.Label node) {
    add("label");
  }

  @Override
  public void visitImpl(Script.ErrorComment node) {
    // Comments carry no shape.
  }

  @Override
  public void visitImpl(Script.Constant node) {
    add("const " + node.type().typeName() + " " + SourceEmitter.literal(node));
  }

  @Override
  public void visitImpl(Script.VariableRef node) {
    add("var " + access(node.access()));
  }

  @Override
  public void visitImpl(Script.Unary node) {
    add("unary " + NodeQueries.unaryOperator(node.op()));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.Binary node) {
    add("binary " + NodeQueries.binaryOperator(node.op()));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.Logical node) {
    add("logical " + NodeQueries.logicalOperator(node.op()));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.SubroutineCall node) {
    add("call " + script.routineName(node.subroutine()));
    node.visitChildren(this, null);
    add(")");
  }

  @Override
  public void visitImpl(Script.ActionCall node) {
    add("action " + node.actionId());
    node.visitChildren(this, null);
    add(")");
  }

  @Override
  public void visitImpl(Script.Assignment node) {
    add("assign " + access(node.target()));
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.IncDec node) {
    String op = NodeQueries.stackOperator(node.op());
    add((node.prefix() ? op + " " : "") + access(node.target()) + (node.prefix() ? "" : " " + op));
  }

  @Override
  public void visitImpl(Script.VectorLiteral node) {
    add("composite " + node.type().typeName());
    node.visitChildren(this, null);
    add(")");
  }

  @Override
  public void visitImpl(Script.Member node) {
    add("member " + node.offset() + " " + node.width());
    node.visitChildren(this, null);
  }

  @Override
  public void visitImpl(Script.ActionArgument node) {
    add("closure");
    node.visitChildren(this, null);
  }

  private static String access(VarAccess access) {
    return name(access.variable()) + "[" + access.offset() + "+" + access.width() + "]";
  }

  private static String name(Variable variable) {
    Variable root = variable.root();
    return root.hasName() ? root.name() : root.scope().name().toLowerCase(Locale.ROOT);
  }
}
