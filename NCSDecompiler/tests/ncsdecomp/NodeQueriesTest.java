package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.base.VerifyException;

public class NodeQueriesTest {

  private NcsAssembler asm;
  private Subroutine routine;

  @BeforeEach
  public void assemble() throws DecompilerException {
    asm =
        new NcsAssembler()
            .consti(7)
            .jz("past")
            .jmp("past")
            .label("past")
            .jnz("end")
            .constf(1.5f)
            .binary(Opcode.ADD, TypePair.VV)
            .binary(Opcode.EQUAL, TypePair.VV)
            .logical(Opcode.LOGOR)
            .logical(Opcode.LOGAND)
            .label("end")
            .retn();
    routine = asm.program().main();
  }

  private Command command(int index) {
    return routine.command(index);
  }

  @Test
  public void conditionalJumpIsEitherZeroOrNonZero() {
    for (Command command : routine.commands()) {
      assertThat(NodeQueries.isJz(command) && NodeQueries.isJnz(command)).isFalse();
    }
    assertThat(NodeQueries.isJz(command(1))).isTrue();
    assertThat(NodeQueries.isJnz(command(1))).isFalse();
    assertThat(NodeQueries.isJnz(command(3))).isTrue();
    assertThat(NodeQueries.isJz(command(0))).isFalse();
  }

  @Test
  public void jumpsAreClassifiedByKind() {
    assertThat(NodeQueries.isJump(command(1))).isTrue();
    assertThat(NodeQueries.isJump(command(2))).isTrue();
    assertThat(NodeQueries.isJump(command(3))).isTrue();
    assertThat(NodeQueries.isJump(command(0))).isFalse();
    assertThat(NodeQueries.isJump(command(9))).isFalse();
  }

  @Test
  public void jzOverOneJumpGuardsAnEmptyBranch() {
    assertThat(NodeQueries.isJzPastOne(command(1))).isTrue();
    assertThat(NodeQueries.isJzPastOne(command(3))).isFalse();
    assertThat(NodeQueries.isJzPastOne(command(2))).isFalse();
  }

  @Test
  public void jumpDestinationIsRelativeToTheJump() {
    assertThat(NodeQueries.jumpDestination(command(1))).isEqualTo(asm.position("past"));
    assertThat(NodeQueries.jumpDestination(command(3))).isEqualTo(asm.position("end"));

    assertThrows(IllegalArgumentException.class, () -> NodeQueries.jumpDestination(command(0)));
  }

  @Test
  public void onlyLogicalOrKeepsTheStackAtItsTarget() {
    assertThat(NodeQueries.isStoreStackNode(command(7))).isFalse();
    assertThat(NodeQueries.isStoreStackNode(command(8))).isTrue();
    assertThat(NodeQueries.isStoreStackNode(command(0))).isTrue();
  }

  @Test
  public void intConstantChecksItsOperand() {
    assertThat(NodeQueries.intConstant(command(0))).isEqualTo(7);

    assertThrows(VerifyException.class, () -> NodeQueries.intConstant(command(4)));
    assertThrows(IllegalArgumentException.class, () -> NodeQueries.intConstant(command(1)));
  }

  @Test
  public void vectorOperandsTakeThreeSlots() {
    Command.Binary add = command(5).cast();
    Command.Binary equal = command(6).cast();

    assertThat(NodeQueries.leftWidth(add)).isEqualTo(3);
    assertThat(NodeQueries.rightWidth(add)).isEqualTo(3);
    assertThat(NodeQueries.resultType(add)).isEqualTo(ValueType.VECTOR);
    assertThat(NodeQueries.resultWidth(add)).isEqualTo(3);
    assertThat(NodeQueries.resultType(equal)).isEqualTo(ValueType.INT);
    assertThat(NodeQueries.resultWidth(equal)).isEqualTo(1);
  }

  @Test
  public void offsetsConvertToSlots() {
    assertThat(NodeQueries.slot(12)).isEqualTo(3);
    assertThat(NodeQueries.slot(-8)).isEqualTo(-2);
    assertThat(NodeQueries.depth(-4)).isEqualTo(1);
    assertThat(NodeQueries.depth(-12)).isEqualTo(3);

    assertThrows(IllegalArgumentException.class, () -> NodeQueries.slot(6));
  }

  @Test
  public void operatorSymbols() {
    assertThat(NodeQueries.binaryOperator(Command.BinaryOp.SHIFT_LEFT)).isEqualTo("<<");
    assertThat(NodeQueries.binaryOperator(Command.BinaryOp.NOT_EQUAL)).isEqualTo("!=");
    assertThat(NodeQueries.logicalOperator(Command.LogicalOp.OR)).isEqualTo("||");
    assertThat(NodeQueries.logicalOperator(Command.LogicalOp.EXCLUSIVE_OR)).isEqualTo("^");
    assertThat(NodeQueries.unaryOperator(Command.UnaryOp.NOT)).isEqualTo("!");
    assertThat(NodeQueries.stackOperator(Command.StackOpKind.DECREMENT)).isEqualTo("--");

    assertThrows(
        VerifyException.class,
        () -> NodeQueries.binaryOperator(Command.BinaryOp.UNSIGNED_SHIFT_RIGHT));
  }
}
