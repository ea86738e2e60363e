package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class ActionReturnInferenceTest {

  private static ActionTable inferred(NcsAssembler asm) throws DecompilerException {
    return new SignatureAnalyzer(asm.program(), ActionTable.EMPTY).analyze().actions();
  }

  private static NcsAssembler withStub() {
    return new NcsAssembler().jsr("main").retn().label("main");
  }

  @Test
  public void resultUsedByAnOperatorIsAnInt() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .cptopsp(-4, 4)
            .cptopsp(-4, 4)
            .jnz("done")
            .action(5, 0)
            .logical(Opcode.LOGOR)
            .label("done")
            .action(3, 1)
            .movsp(-4)
            .retn();

    ActionTable actions = inferred(asm);

    assertThat(actions.returnType(5)).hasValue(ValueType.INT);
    assertThat(actions.returnType(3)).isEmpty();
  }

  @Test
  public void operandTypeCarriesOver() throws DecompilerException {
    NcsAssembler asm =
        withStub().constf(1.5f).action(8, 0).binary(Opcode.ADD, TypePair.FF).action(3, 1).retn();

    ActionTable actions = inferred(asm);

    assertThat(actions.returnType(8)).hasValue(ValueType.FLOAT);
  }

  @Test
  public void droppedResultIsAnInt() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .action(7, 0)
            .movsp(-4)
            .cptopsp(-4, 4)
            .action(3, 1)
            .movsp(-4)
            .retn();

    assertThat(inferred(asm).returnType(7)).hasValue(ValueType.INT);
  }

  @Test
  public void callsWhoseResultNothingTakesStayVoid() throws DecompilerException {
    NcsAssembler asm = withStub().action(1, 0).consti(4).action(2, 1).retn();

    ActionTable actions = inferred(asm);

    assertThat(actions.returnType(1)).isEmpty();
    assertThat(actions.returnType(2)).isEmpty();
    assertThat(actions.resolvedReturnType(1)).isEqualTo(ValueType.VOID);
  }

  @Test
  public void popAtAJoinIsNotADroppedResult() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .cptopsp(-4, 4)
            .jz("skip")
            .consti(1)
            .jmp("join")
            .label("skip")
            .consti(2)
            .action(9, 0)
            .label("join")
            .movsp(-4)
            .action(4, 0)
            .movsp(-4)
            .retn();

    assertThat(inferred(asm).returnType(9)).isEmpty();
  }

  @Test
  public void knownSignaturesWin() throws Exception {
    NwscriptActionTable table = NwscriptActionTable.parse("// 0\nvoid Sleep();\n");
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .action(0, 0)
            .movsp(-4)
            .consti(1)
            .action(3, 1)
            .retn();

    ActionTable actions = new SignatureAnalyzer(asm.program(), table).analyze().actions();

    assertThat(actions.returnType(0)).hasValue(ValueType.VOID);
    assertThat(actions.name(0)).hasValue("Sleep");
  }
}
