package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class NodeTreeBuilderTest {

  private static DecompilerException buildError(NcsAssembler asm) {
    return assertThrows(DecompilerException.class, asm::program);
  }

  @Test
  public void singleRoutineIsDirect() throws DecompilerException {
    Program program = new NcsAssembler().consti(1).movsp(-4).retn().program();

    assertThat(program.entryStyle()).isEqualTo(Program.EntryStyle.DIRECT);
    assertThat(program.subroutines()).hasSize(1);
    assertThat(program.main().role()).isEqualTo(Subroutine.Role.MAIN);
    assertThat(program.main().startPos()).isEqualTo(13);
  }

  @Test
  public void stubCallsMain() throws DecompilerException {
    Program program =
        new NcsAssembler()
            .jsr("main")
            .retn()
            .label("main")
            .jsr("helper")
            .retn()
            .label("helper")
            .retn()
            .program();

    assertThat(program.entryStyle()).isEqualTo(Program.EntryStyle.STUB);
    assertThat(program.subroutines().stream().map(Subroutine::role).collect(Collectors.toList()))
        .containsExactly(
            Subroutine.Role.ENTRY_STUB, Subroutine.Role.MAIN, Subroutine.Role.ORDINARY)
        .inOrder();
    assertThat(program.main().startPos()).isEqualTo(21);
    assertThat(program.globals()).isEmpty();
  }

  @Test
  public void conditionalStubReservesResult() throws DecompilerException {
    Program program =
        new NcsAssembler()
            .rsadd(ValueType.INT)
            .jsr("main")
            .retn()
            .label("main")
            .retn()
            .program();

    assertThat(program.entryStyle()).isEqualTo(Program.EntryStyle.CONDITIONAL_STUB);
    assertThat(program.subroutines().get(0).role()).isEqualTo(Subroutine.Role.ENTRY_STUB);
  }

  @Test
  public void mainIsCalledAfterSaveBp() throws DecompilerException {
    NcsAssembler asm =
        new NcsAssembler()
            .jsr("globals")
            .retn()
            .label("globals")
            .rsadd(ValueType.INT)
            .savebp()
            .jsr("main")
            .restorebp()
            .movsp(-4)
            .retn()
            .label("helper")
            .retn()
            .label("main")
            .jsr("helper")
            .retn();
    Program program = asm.program();

    assertThat(program.subroutines()).hasSize(4);
    assertThat(program.globals().get().startPos()).isEqualTo(asm.position("globals"));
    assertThat(program.main().startPos()).isEqualTo(asm.position("main"));
    assertThat(program.startingAt(asm.position("helper")).get().role())
        .isEqualTo(Subroutine.Role.ORDINARY);
  }

  @Test
  public void nopsAreDropped() throws DecompilerException {
    Program program = new NcsAssembler().nop().consti(1).nop().movsp(-4).retn().program();

    assertThat(program.main().size()).isEqualTo(3);
    assertThat(program.main().command(0).kind()).isEqualTo(Command.Kind.CONSTANT);
  }

  @Test
  public void subroutineCommandsAreInTheTree() throws DecompilerException {
    Program program =
        new NcsAssembler().jsr("main").retn().label("main").consti(3).movsp(-4).retn().program();
    Subroutine main = program.main();

    assertThat(program.tree().parent(main.node())).isEqualTo(program.tree().root());
    assertThat(program.tree().commands(program.tree().block(main.node())))
        .containsExactlyElementsIn(main.commands())
        .inOrder();
    assertThat(program.tree().isFrozen()).isTrue();
    assertThat(program.containing(main.endPos()).get()).isEqualTo(main);
    assertThat(main.indexAtOrAfter(main.startPos() + 1)).isEqualTo(1);
  }

  @Test
  public void rejectsCallOutsideProgram() {
    NcsAssembler asm = new NcsAssembler().jsr("end").retn().label("end");

    assertThat(buildError(asm).getMessage()).contains("outside the program");
  }

  @Test
  public void rejectsEmptyProgram() {
    assertThat(buildError(new NcsAssembler()).getMessage()).contains("no instructions");
  }

  @Test
  public void rejectsIncompatibleQualifiers() {
    assertThat(buildError(new NcsAssembler().binary(Opcode.MOD, TypePair.FF).retn()).getMessage())
        .contains("incompatible");
    assertThat(buildError(new NcsAssembler().unary(Opcode.COMP, ValueType.FLOAT).retn()).kind())
        .isEqualTo(DecompilerException.ErrorKind.DECODE);
    assertThat(buildError(new NcsAssembler().binary(Opcode.ADD, TypePair.VF).retn()).kind())
        .isEqualTo(DecompilerException.ErrorKind.DECODE);
  }

  @Test
  public void rejectsMisalignedStackCopy() {
    assertThat(buildError(new NcsAssembler().cptopsp(-6, 4).retn()).getMessage())
        .contains("misaligned");
  }

  @Test
  public void rejectsUnsignedShift() {
    assertThat(
            buildError(new NcsAssembler().binary(Opcode.USHRIGHT, TypePair.II).retn())
                .getMessage())
        .contains("unsigned bit shift");
  }
}
