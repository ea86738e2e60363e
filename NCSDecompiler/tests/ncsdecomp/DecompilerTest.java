package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

public class DecompilerTest {

  private static DecompileResult decompile(NcsAssembler asm) throws DecompilerException {
    return decompile(asm, DecompilerOptions.defaults());
  }

  private static DecompileResult decompile(NcsAssembler asm, DecompilerOptions options)
      throws DecompilerException {
    return new Decompiler(options, ActionTables.none()).decompile(asm.bytes());
  }

  /** A stub calling the entry routine, whose body the caller appends. */
  private static NcsAssembler withStub() {
    return new NcsAssembler().jsr("main").retn().label("main");
  }

  @Test
  public void directScriptReturnsExpression() throws DecompilerException {
    NcsAssembler asm =
        new NcsAssembler().consti(5).consti(3).binary(Opcode.ADD, TypePair.II).retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source()).isEqualTo("int StartingConditional() {\n\treturn 5 + 3;\n}\n");
    assertThat(result.complete()).isTrue();
  }

  @Test
  public void foldsConstantsWhenAsked() throws DecompilerException {
    NcsAssembler asm =
        new NcsAssembler().consti(5).consti(3).binary(Opcode.ADD, TypePair.II).retn();

    DecompileResult result =
        decompile(asm, DecompilerOptions.builder().setFoldConstants(true).build());

    assertThat(result.source()).isEqualTo("int StartingConditional() {\n\treturn 8;\n}\n");
  }

  @Test
  public void jumpOverEmptyBranchEmitsNothing() throws DecompilerException {
    NcsAssembler asm = withStub().consti(1).jz("end").jmp("end").label("end").retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source()).isEqualTo("void main() {\n}\n");
  }

  @Test
  public void ifElse() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .consti(1)
            .jz("else")
            .consti(10)
            .action(1, 1)
            .jmp("end")
            .label("else")
            .consti(20)
            .action(2, 1)
            .label("end")
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tif (1) {\n"
                + "\t\taction_1(10);\n"
                + "\t}\n"
                + "\telse {\n"
                + "\t\taction_2(20);\n"
                + "\t}\n"
                + "}\n");
  }

  @Test
  public void unknownActionTakesIntArguments() throws DecompilerException {
    // The first argument is pushed last.
    NcsAssembler asm = withStub().consti(8).consti(7).action(42, 2).retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source()).isEqualTo("void main() {\n\taction_42(7, 8);\n}\n");
  }

  @Test
  public void localDeclarationTakesItsFirstAssignment() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .consti(5)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .cptopsp(-4, 4)
            .consti(1)
            .binary(Opcode.ADD, TypePair.II)
            .action(3, 1)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo("void main() {\n\tint int1 = 5;\n\taction_3(int1 + 1);\n}\n");
  }

  @Test
  public void whileLoop() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .consti(0)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .label("head")
            .cptopsp(-4, 4)
            .consti(10)
            .binary(Opcode.LT, TypePair.II)
            .jz("end")
            .action(4, 0)
            .incisp(-4)
            .jmp("head")
            .label("end")
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1 = 0;\n"
                + "\twhile (int1 < 10) {\n"
                + "\t\taction_4();\n"
                + "\t\tint1++;\n"
                + "\t}\n"
                + "}\n");
  }

  @Test
  public void counterLoopBecomesFor() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .action(5, 0)
            .consti(0)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .label("head")
            .cptopsp(-4, 4)
            .consti(10)
            .binary(Opcode.LT, TypePair.II)
            .jz("end")
            .action(4, 0)
            .incisp(-4)
            .jmp("head")
            .label("end")
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1;\n"
                + "\taction_5();\n"
                + "\tfor (int1 = 0; int1 < 10; int1++) {\n"
                + "\t\taction_4();\n"
                + "\t}\n"
                + "}\n");
  }

  @Test
  public void doWhileLoop() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .consti(0)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .label("head")
            .incisp(-4)
            .action(4, 0)
            .cptopsp(-4, 4)
            .consti(10)
            .binary(Opcode.LT, TypePair.II)
            .jnz("head")
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1 = 0;\n"
                + "\tdo {\n"
                + "\t\tint1++;\n"
                + "\t\taction_4();\n"
                + "\t} while (int1 < 10);\n"
                + "}\n");
  }

  @Test
  public void incrementBeforeReadIsPrefix() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .incisp(-4)
            .cptopsp(-4, 4)
            .action(3, 1)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source()).contains("\taction_3(++int1);\n");
  }

  @Test
  public void unstructuredJumpBecomesGoto() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .action(1, 0)
            .jmp("skip")
            .action(2, 0)
            .label("skip")
            .action(3, 0)
            .retn();
    String label = String.format("loc_%08X", asm.position("skip"));

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\taction_1();\n"
                + "\tgoto "
                + label
                + ";\n"
                + "\t"
                + label
                + ":\n"
                + "\taction_3();\n"
                + "}\n");
  }

  @Test
  public void parametersAreTypedFromCallSites() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .consti(4)
            .jsr("sub")
            .retn()
            .label("sub")
            .cptopsp(-4, 4)
            .action(3, 1)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void sub1(int intParam1);\n"
                + "\n"
                + "void main() {\n"
                + "\tsub1(4);\n"
                + "}\n"
                + "\n"
                + "void sub1(int intParam1) {\n"
                + "\taction_3(intParam1);\n"
                + "}\n");
  }

  @Test
  public void returnSlotsBecomeReturnValue() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .jsr("sub")
            .action(3, 1)
            .retn()
            .label("sub")
            .consti(9)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "int sub1();\n"
                + "\n"
                + "void main() {\n"
                + "\taction_3(sub1());\n"
                + "}\n"
                + "\n"
                + "int sub1() {\n"
                + "\treturn 9;\n"
                + "}\n");
  }

  @Test
  public void globalsAreDeclaredBeforeRoutines() throws DecompilerException {
    NcsAssembler asm =
        new NcsAssembler()
            .jsr("globals")
            .retn()
            .label("globals")
            .rsadd(ValueType.INT)
            .consti(7)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .savebp()
            .jsr("main")
            .restorebp()
            .movsp(-4)
            .retn()
            .label("main")
            .cptopbp(-4, 4)
            .action(3, 1)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "int intGLOB_1 = 7;\n\nvoid main() {\n\taction_3(intGLOB_1);\n}\n");
    assertThat(result.outcomes()).hasSize(2);
    assertThat(result.outcomes().get(0).name()).isEqualTo("globals");
    assertThat(result.complete()).isTrue();
  }

  @Test
  public void failedRoutineBecomesPlaceholder() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .jsr("sub")
            .retn()
            .label("sub")
            .cptopsp(-4, 4)
            .movsp(-4)
            .retn();
    String failedAt = String.format("UNRESOLVED_VARIABLE@%08X", asm.position("sub"));

    DecompileResult result = decompile(asm);

    assertThat(result.source()).startsWith("void sub1();\n\nvoid main() {\n\tsub1();\n}\n");
    assertThat(result.source()).contains("void sub1() {\n");
    assertThat(result.source()).contains("\t// decompilation failed for this routine\n");
    assertThat(result.source()).contains(failedAt);
    assertThat(result.complete()).isFalse();
    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).name()).isEqualTo("sub1");
    assertThat(result.failures().get(0).role()).isEqualTo(Subroutine.Role.ORDINARY);
    assertThat(result.failures().get(0).error().get().kind())
        .isEqualTo(DecompilerException.ErrorKind.UNRESOLVED_VARIABLE);
  }

  @Test
  public void decodeErrorAbandonsProgram() {
    byte[] bytes = withStub().retn().bytes();
    bytes[13] = 0x1C;

    Decompiler decompiler = new Decompiler(DecompilerOptions.defaults(), ActionTables.none());

    DecompilerException ex =
        assertThrows(DecompilerException.class, () -> decompiler.decompile(bytes));

    assertThat(ex.kind()).isEqualTo(DecompilerException.ErrorKind.DECODE);
  }

  @Test
  public void cancellationStopsDecompilation() {
    byte[] bytes = withStub().action(1, 0).retn().bytes();
    Decompiler decompiler = new Decompiler(DecompilerOptions.defaults(), ActionTables.none());

    assertThrows(CancellationException.class, () -> decompiler.decompile(bytes, () -> true));
  }

  @Test
  public void parallelDecompilationKeepsFileOrder() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .jsr("a")
            .jsr("b")
            .jsr("c")
            .retn()
            .label("a")
            .action(1, 0)
            .retn()
            .label("b")
            .action(2, 0)
            .retn()
            .label("c")
            .action(3, 0)
            .retn();

    String sequential = decompile(asm).source();
    String parallel =
        decompile(asm, DecompilerOptions.builder().setParallelSubroutines(true).build()).source();

    assertThat(parallel).isEqualTo(sequential);
    assertThat(sequential).startsWith("void sub1();\nvoid sub2();\nvoid sub3();\n\n");
  }

  @Test
  public void objectConstantsUseEngineNames() throws DecompilerException {
    NcsAssembler asm = withStub().consto(1).consto(0).action(9, 2).retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source()).contains("\taction_9(OBJECT_SELF, OBJECT_INVALID);\n");
  }

  @Test
  public void shortCircuitAndIsOneExpression() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .rsadd(ValueType.INT)
            .cptopsp(-8, 4)
            .cptopsp(-4, 4)
            .jz("done")
            .cptopsp(-8, 4)
            .logical(Opcode.LOGAND)
            .label("done")
            .action(3, 1)
            .movsp(-8)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1;\n"
                + "\tint int2;\n"
                + "\taction_3(int1 && int2);\n"
                + "}\n");
  }

  @Test
  public void deferredActionIsWrittenAsItsCall() throws Exception {
    NwscriptActionTable table =
        NwscriptActionTable.parse(
            "// 0\n"
                + "void DelayCommand(float fSeconds, action aActionToDelay);\n"
                + "// 1\n"
                + "void PrintString(string sString);\n");
    NcsAssembler asm =
        withStub()
            .storeState(0, 0)
            .jmp("after")
            .consts("hi")
            .action(1, 1)
            .retn()
            .label("after")
            .constf(1.5f)
            .action(0, 2)
            .retn();
    Decompiler decompiler =
        new Decompiler(
            DecompilerOptions.defaults(), ActionTables.of(ImmutableMap.of(GameVariant.K1, table)));

    DecompileResult result = decompiler.decompile(asm.bytes());

    assertThat(result.source())
        .isEqualTo("void main() {\n\tDelayCommand(1.5, PrintString(\"hi\"));\n}\n");
  }

  @Test
  public void returnBeforeTheEndLeavesEarly() throws DecompilerException {
    NcsAssembler asm =
        withStub().consti(1).jz("rest").action(1, 0).retn().label("rest").action(2, 0).retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tif (1) {\n"
                + "\t\taction_1();\n"
                + "\t\treturn;\n"
                + "\t}\n"
                + "\taction_2();\n"
                + "}\n");
  }

  @Test
  public void earlyReturnAfterDroppingLocals() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .cptopsp(-4, 4)
            .jz("rest")
            .movsp(-4)
            .retn()
            .label("rest")
            .action(2, 0)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1;\n"
                + "\tif (int1) {\n"
                + "\t\treturn;\n"
                + "\t}\n"
                + "\taction_2();\n"
                + "}\n");
  }

  @Test
  public void unknownActionInsideOrReturnsAValue() throws DecompilerException {
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

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1;\n"
                + "\taction_3(int1 || action_5());\n"
                + "}\n");
    assertThat(result.complete()).isTrue();
  }

  @Test
  public void unknownActionStoredIntoALocalReturnsAValue() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .action(7, 0)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .cptopsp(-4, 4)
            .action(3, 1)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo("void main() {\n\tint int1 = action_7();\n\taction_3(int1);\n}\n");
  }

  @Test
  public void unknownActionWithDroppedResultStaysAStatement() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .action(7, 0)
            .movsp(-4)
            .cptopsp(-4, 4)
            .action(3, 1)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n\tint int1;\n\taction_7();\n\taction_3(int1);\n}\n");
  }

  @Test
  public void selfReferencingAssignmentIsNotAnInitializer() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .cptopsp(-4, 4)
            .consti(1)
            .binary(Opcode.ADD, TypePair.II)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .cptopsp(-4, 4)
            .action(3, 1)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1;\n"
                + "\tint1 = int1 + 1;\n"
                + "\taction_3(int1);\n"
                + "}\n");
  }

  @Test
  public void jumpIntoAnotherRoutineBecomesAnErrorComment() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .jsr("sub")
            .action(1, 0)
            .jmp("inside")
            .retn()
            .label("sub")
            .action(2, 0)
            .label("inside")
            .action(3, 0)
            .retn();
    String comment =
        String.format(
            "\t// ERROR: jump to loc_%08X, where no statement of this routine starts\n",
            asm.position("inside"));

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .contains("void main() {\n\tsub1();\n\taction_1();\n" + comment + "}\n");
    assertThat(result.source()).doesNotContain("goto");
  }

  @Test
  public void switchWithDefault() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .consti(2)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .cptopsp(-4, 4)
            .cptopsp(-4, 4)
            .consti(1)
            .binary(Opcode.EQUAL, TypePair.II)
            .jnz("one")
            .cptopsp(-4, 4)
            .consti(2)
            .binary(Opcode.EQUAL, TypePair.II)
            .jnz("two")
            .jmp("other")
            .label("one")
            .action(1, 0)
            .jmp("end")
            .label("two")
            .action(2, 0)
            .jmp("end")
            .label("other")
            .action(3, 0)
            .label("end")
            .movsp(-4)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1 = 2;\n"
                + "\tswitch (int1) {\n"
                + "\t\tcase 1:\n"
                + "\t\t\taction_1();\n"
                + "\t\t\tbreak;\n"
                + "\t\tcase 2:\n"
                + "\t\t\taction_2();\n"
                + "\t\t\tbreak;\n"
                + "\t\tdefault:\n"
                + "\t\t\taction_3();\n"
                + "\t}\n"
                + "}\n");
  }

  @Test
  public void switchCasesSharingABody() throws DecompilerException {
    NcsAssembler asm =
        withStub()
            .rsadd(ValueType.INT)
            .consti(3)
            .cpdownsp(-8, 4)
            .movsp(-4)
            .cptopsp(-4, 4)
            .cptopsp(-4, 4)
            .consti(1)
            .binary(Opcode.EQUAL, TypePair.II)
            .jnz("low")
            .cptopsp(-4, 4)
            .consti(2)
            .binary(Opcode.EQUAL, TypePair.II)
            .jnz("low")
            .cptopsp(-4, 4)
            .consti(5)
            .binary(Opcode.EQUAL, TypePair.II)
            .jnz("five")
            .jmp("end")
            .label("low")
            .action(1, 0)
            .jmp("end")
            .label("five")
            .action(2, 0)
            .label("end")
            .movsp(-4)
            .action(4, 0)
            .movsp(-4)
            .retn();

    DecompileResult result = decompile(asm);

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1 = 3;\n"
                + "\tswitch (int1) {\n"
                + "\t\tcase 1:\n"
                + "\t\tcase 2:\n"
                + "\t\t\taction_1();\n"
                + "\t\t\tbreak;\n"
                + "\t\tcase 5:\n"
                + "\t\t\taction_2();\n"
                + "\t}\n"
                + "\taction_4();\n"
                + "}\n");
  }

  private static NcsAssembler equalityChain() {
    return withStub()
        .rsadd(ValueType.INT)
        .consti(2)
        .cpdownsp(-8, 4)
        .movsp(-4)
        .cptopsp(-4, 4)
        .consti(1)
        .binary(Opcode.EQUAL, TypePair.II)
        .jz("second")
        .action(1, 0)
        .jmp("end")
        .label("second")
        .cptopsp(-4, 4)
        .consti(2)
        .binary(Opcode.EQUAL, TypePair.II)
        .jz("other")
        .action(2, 0)
        .jmp("end")
        .label("other")
        .action(3, 0)
        .label("end")
        .movsp(-4)
        .retn();
  }

  @Test
  public void equalityChainStaysIfElseByDefault() throws DecompilerException {
    DecompileResult result = decompile(equalityChain());

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1 = 2;\n"
                + "\tif (int1 == 1) {\n"
                + "\t\taction_1();\n"
                + "\t}\n"
                + "\telse if (int1 == 2) {\n"
                + "\t\taction_2();\n"
                + "\t}\n"
                + "\telse {\n"
                + "\t\taction_3();\n"
                + "\t}\n"
                + "}\n");
  }

  @Test
  public void equalityChainBecomesSwitchWhenPreferred() throws DecompilerException {
    DecompileResult result =
        decompile(equalityChain(), DecompilerOptions.builder().setPreferSwitches(true).build());

    assertThat(result.source())
        .isEqualTo(
            "void main() {\n"
                + "\tint int1 = 2;\n"
                + "\tswitch (int1) {\n"
                + "\t\tcase 1:\n"
                + "\t\t\taction_1();\n"
                + "\t\t\tbreak;\n"
                + "\t\tcase 2:\n"
                + "\t\t\taction_2();\n"
                + "\t\t\tbreak;\n"
                + "\t\tdefault:\n"
                + "\t\t\taction_3();\n"
                + "\t}\n"
                + "}\n");
  }
}
