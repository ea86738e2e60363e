package ncsdecomp;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import ncsdecomp.Script.Block;
import ncsdecomp.Script.Expression;
import ncsdecomp.Script.ExpressionStatement;
import ncsdecomp.Script.For;
import ncsdecomp.Script.If;
import ncsdecomp.Script.Statement;
import ncsdecomp.Script.While;

/**
 * Folds counter loops into {@code for}: an assignment to a variable, followed by a {@code while}
 * testing it whose body ends by updating it. A loop whose body continues is left alone, since
 * {@code continue} would start running the update.
 */
final class ForLoopFolder extends StatementRewriter {

  @Override
  protected List<Statement> rewriteList(List<Statement> statements) {
    List<Statement> out = new ArrayList<>();
    for (int k = 0; k < statements.size(); k++) {
      Statement statement = statements.get(k);
      Statement next = k + 1 < statements.size() ? statements.get(k + 1) : null;
      Optional<Variable> counter = assignedVariable(statement);
      if (next != null && counter.isPresent()) {
        Optional<Statement> folded = fold(statement, counter.get(), next);
        if (folded.isPresent()) {
          out.add(folded.get());
          k++;
          continue;
        }
      }
      out.add(statement);
    }
    return out;
  }

  private static Optional<Statement> fold(Statement init, Variable counter, Statement loop) {
    Expression initExpression = init.<ExpressionStatement>cast().expression();
    if (loop.kind() == Statement.Kind.FOR) {
      For existing = loop.cast();
      if (existing.init().isPresent() || !mentions(existing.condition(), counter)) {
        return Optional.empty();
      }
      return Optional.of(
          For.create(
              init.pos(),
              Optional.of(initExpression),
              existing.condition(),
              existing.update(),
              existing.body()));
    }
    if (loop.kind() != Statement.Kind.WHILE) return Optional.empty();

    While node = loop.cast();
    List<Statement> body = node.body().statements();
    if (body.isEmpty() || !mentions(node.condition(), counter) || continues(body)) {
      return Optional.empty();
    }
    Statement last = body.get(body.size() - 1);
    if (!assignedVariable(last).filter(v -> v == counter).isPresent()) {
      return Optional.empty();
    }
    return Optional.of(
        For.create(
            init.pos(),
            Optional.of(initExpression),
            node.condition(),
            Optional.of(last.<ExpressionStatement>cast().expression()),
            Block.create(node.body().pos(), body.subList(0, body.size() - 1))));
  }

  /** The variable an assignment or increment statement updates as a whole. */
  private static Optional<Variable> assignedVariable(Statement statement) {
    if (statement.kind() != Statement.Kind.EXPRESSION) return Optional.empty();
    Expression expression = statement.<ExpressionStatement>cast().expression();
    VarAccess target;
    switch (expression.kind()) {
      case ASSIGNMENT:
        target = expression.<Script.Assignment>cast().target();
        break;
      case INC_DEC:
        target = expression.<Script.IncDec>cast().target();
        break;
      default:
        return Optional.empty();
    }
    return target.isWhole() ? Optional.of(target.variable()) : Optional.empty();
  }

  private static boolean mentions(Expression expression, Variable variable) {
    Set<Variable> found = new HashSet<>();
    expression.accept(
        new VoidDefaultScriptVisitor() {
          @Override
          public void visitImpl(Script.VariableRef node) {
            found.add(node.access().variable());
          }

          @Override
          public void visitImpl(Script.IncDec node) {
            found.add(node.target().variable());
          }
        },
        null);
    return found.contains(variable);
  }

  /** Whether a loop body holds a continue of its own, outside nested loops. */
  private static boolean continues(List<Statement> statements) {
    for (Statement statement : statements) {
      switch (statement.kind()) {
        case CONTINUE:
          return true;
        case BLOCK:
          if (continues(statement.<Block>cast().statements())) return true;
          break;
        case IF:
          {
            If node = statement.cast();
            if (continues(node.then().statements())
                || node.otherwise().map(b -> continues(b.statements())).orElse(false)) {
              return true;
            }
            break;
          }
        default:
          break;
      }
    }
    return false;
  }
}
