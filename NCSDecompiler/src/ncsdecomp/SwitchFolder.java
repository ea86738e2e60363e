package ncsdecomp;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import ncsdecomp.Script.Binary;
import ncsdecomp.Script.Block;
import ncsdecomp.Script.Constant;
import ncsdecomp.Script.Expression;
import ncsdecomp.Script.If;
import ncsdecomp.Script.Statement;
import ncsdecomp.Script.Switch;
import ncsdecomp.Script.SwitchCase;
import ncsdecomp.Script.VariableRef;

/**
 * Turns {@code if (x == 1) ... else if (x == 2) ...} into a {@code switch} on {@code x}. Chains
 * whose arms contain a {@code break} are left alone, since inside the switch it would leave the
 * switch rather than the loop.
 */
final class SwitchFolder extends StatementRewriter {

  @Override
  protected List<Statement> rewriteList(List<Statement> statements) {
    List<Statement> out = new ArrayList<>();
    for (Statement statement : statements) {
      out.add(statement.kind() == Statement.Kind.IF ? fold(statement.cast()) : statement);
    }
    return out;
  }

  private static Statement fold(If chain) {
    VarAccess subject = null;
    Set<Integer> seen = new HashSet<>();
    List<Integer> values = new ArrayList<>();
    List<Block> bodies = new ArrayList<>();
    Optional<Block> otherwise = Optional.of(Block.create(chain.pos(), ImmutableList.of(chain)));
    while (otherwise.isPresent() && isOnly(otherwise.get(), Statement.Kind.IF)) {
      If arm = otherwise.get().statements().get(0).cast();
      Optional<Comparison> comparison = Comparison.of(arm.condition());
      if (!comparison.isPresent()
          || (subject != null && !subject.equals(comparison.get().access))
          || seen.contains(comparison.get().value)
          || containsBreak(arm.then())) {
        break;
      }
      subject = comparison.get().access;
      seen.add(comparison.get().value);
      values.add(comparison.get().value);
      bodies.add(arm.then());
      otherwise = arm.otherwise();
    }
    if (values.isEmpty()) return chain;

    List<SwitchCase> cases = new ArrayList<>();
    for (int k = 0; k < values.size(); k++) {
      Block body = bodies.get(k);
      boolean last = k == values.size() - 1 && !otherwise.isPresent();
      cases.add(
          SwitchCase.create(ImmutableList.of(values.get(k)), false, last ? body : withBreak(body)));
    }
    if (otherwise.isPresent()) {
      // Nested chains are folded first, so the tail may already be a switch on the same variable.
      Optional<Switch> tail = sameSubject(otherwise.get(), subject, seen);
      if (tail.isPresent()) {
        cases.addAll(tail.get().cases());
      } else if (values.size() < 2 || containsBreak(otherwise.get())) {
        return chain;
      } else {
        cases.add(SwitchCase.create(ImmutableList.of(), true, otherwise.get()));
      }
    } else if (values.size() < 2) {
      return chain;
    }
    return Switch.create(chain.pos(), VariableRef.create(subject), cases);
  }

  private static boolean isOnly(Block block, Statement.Kind kind) {
    return block.statements().size() == 1 && block.statements().get(0).kind() == kind;
  }

  /** The block's lone switch, when it tests {@code subject} against none of {@code seen}. */
  private static Optional<Switch> sameSubject(Block block, VarAccess subject, Set<Integer> seen) {
    if (!isOnly(block, Statement.Kind.SWITCH)) return Optional.empty();
    Switch node = block.statements().get(0).cast();
    if (node.subject().kind() != Expression.Kind.VARIABLE
        || !node.subject().<VariableRef>cast().access().equals(subject)) {
      return Optional.empty();
    }
    for (SwitchCase switchCase : node.cases()) {
      for (int value : switchCase.values()) {
        if (seen.contains(value)) return Optional.empty();
      }
    }
    return Optional.of(node);
  }

  private static Block withBreak(Block body) {
    List<Statement> statements = body.statements();
    if (!statements.isEmpty()
        && statements.get(statements.size() - 1).kind() == Statement.Kind.RETURN) {
      return body;
    }
    List<Statement> withBreak = new ArrayList<>(statements);
    withBreak.add(Script.Break.create(body.pos()));
    return Block.create(body.pos(), withBreak);
  }

  private static boolean containsBreak(Block block) {
    boolean[] found = {false};
    block.accept(
        new VoidDefaultScriptVisitor() {
          @Override
          public void visitImpl(Script.Break node) {
            found[0] = true;
          }
        },
        null);
    return found[0];
  }

  /** {@code variable == literal} with a whole int variable on either side. */
  private static final class Comparison {
    final VarAccess access;
    final int value;

    private Comparison(VarAccess access, int value) {
      this.access = access;
      this.value = value;
    }

    static Optional<Comparison> of(Expression condition) {
      if (condition.kind() != Expression.Kind.BINARY) return Optional.empty();
      Binary binary = condition.cast();
      if (binary.op() != Command.BinaryOp.EQUAL) return Optional.empty();
      Optional<Comparison> direct = of(binary.left(), binary.right());
      return direct.isPresent() ? direct : of(binary.right(), binary.left());
    }

    private static Optional<Comparison> of(Expression variable, Expression literal) {
      if (variable.kind() != Expression.Kind.VARIABLE
          || literal.kind() != Expression.Kind.CONSTANT) {
        return Optional.empty();
      }
      VarAccess access = variable.<VariableRef>cast().access();
      Constant constant = literal.cast();
      if (!access.isWhole()
          || access.type() != ValueType.INT
          || constant.value().kind() != Operand.Kind.INT_VALUE) {
        return Optional.empty();
      }
      return Optional.of(new Comparison(access, constant.value().intValue()));
    }
  }
}
