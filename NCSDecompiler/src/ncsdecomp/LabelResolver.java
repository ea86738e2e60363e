package ncsdecomp;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import ncsdecomp.Script.Block;
import ncsdecomp.Script.ErrorComment;
import ncsdecomp.Script.Label;
import ncsdecomp.Script.Statement;

/**
 * Places a label before the statement each {@code goto} of a routine jumps to. A {@code goto}
 * whose target starts no statement becomes an error comment.
 */
final class LabelResolver {

  static Block resolve(Block body) {
    Set<Integer> targets = new TreeSet<>();
    body.accept(
        new VoidDefaultScriptVisitor() {
          @Override
          public void visitImpl(Script.Goto node) {
            targets.add(node.target());
          }
        },
        null);
    if (targets.isEmpty()) return body;

    Block labelled =
        new StatementRewriter() {
          @Override
          protected List<Statement> rewriteList(List<Statement> statements) {
            List<Statement> out = new ArrayList<>();
            for (Statement statement : statements) {
              if (targets.remove(statement.pos())) {
                out.add(Label.create(statement.pos()));
              }
              out.add(statement);
            }
            return out;
          }
        }.rewrite(body);
    if (targets.isEmpty()) return labelled;

    // A goto with nowhere to land would not compile; it is kept only as a comment.
    return new StatementRewriter() {
      @Override
      protected List<Statement> rewriteList(List<Statement> statements) {
        List<Statement> out = new ArrayList<>();
        for (Statement statement : statements) {
          if (statement.kind() == Statement.Kind.GOTO
              && targets.contains(statement.<Script.Goto>cast().target())) {
            out.add(
                ErrorComment.create(
                    statement.pos(),
                    String.format(
                        "ERROR: jump to loc_%08X, where no statement of this routine starts",
                        statement.<Script.Goto>cast().target())));
          } else {
            out.add(statement);
          }
        }
        return out;
      }
    }.rewrite(labelled);
  }

  private LabelResolver() {}
}
