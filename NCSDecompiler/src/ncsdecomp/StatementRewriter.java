package ncsdecomp;

import java.util.ArrayList;
import java.util.List;

import ncsdecomp.Script.Block;
import ncsdecomp.Script.DoWhile;
import ncsdecomp.Script.For;
import ncsdecomp.Script.If;
import ncsdecomp.Script.Statement;
import ncsdecomp.Script.Switch;
import ncsdecomp.Script.SwitchCase;
import ncsdecomp.Script.While;

/**
 * Rebuilds a statement tree bottom-up. Nested blocks are rewritten first, then each statement list
 * is handed to {@link #rewriteList}.
 */
abstract class StatementRewriter {

  protected abstract List<Statement> rewriteList(List<Statement> statements);

  Block rewrite(Block block) {
    List<Statement> children = new ArrayList<>();
    for (Statement statement : block.statements()) {
      children.add(rewriteNested(statement));
    }
    return Block.create(block.pos(), rewriteList(children));
  }

  private Statement rewriteNested(Statement statement) {
    switch (statement.kind()) {
      case BLOCK:
        return rewrite(statement.<Block>cast());
      case IF:
        {
          If node = statement.cast();
          return If.create(
              node.pos(),
              node.condition(),
              rewrite(node.then()),
              node.otherwise().map(this::rewrite));
        }
      case WHILE:
        {
          While node = statement.cast();
          return While.create(node.pos(), node.condition(), rewrite(node.body()));
        }
      case DO_WHILE:
        {
          DoWhile node = statement.cast();
          return DoWhile.create(node.pos(), rewrite(node.body()), node.condition());
        }
      case FOR:
        {
          For node = statement.cast();
          return For.create(
              node.pos(), node.init(), node.condition(), node.update(), rewrite(node.body()));
        }
      case SWITCH:
        {
          Switch node = statement.cast();
          List<SwitchCase> cases = new ArrayList<>();
          for (SwitchCase switchCase : node.cases()) {
            cases.add(switchCase.withBody(rewrite(switchCase.body())));
          }
          return Switch.create(node.pos(), node.subject(), cases);
        }
      default:
        return statement;
    }
  }
}
