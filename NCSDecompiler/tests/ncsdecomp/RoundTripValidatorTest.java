package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class RoundTripValidatorTest {

  private static final Decompiler DECOMPILER =
      new Decompiler(DecompilerOptions.defaults(), ActionTables.none());

  private static byte[] callingAction(int id) {
    return new NcsAssembler().jsr("main").retn().label("main").action(id, 0).retn().bytes();
  }

  @Test
  public void identicalRecompilationMatches() {
    byte[] ncs = callingAction(1);
    RoundTripValidator validator = new RoundTripValidator(DECOMPILER, (source, variant) -> ncs);

    RoundTripValidator.Result result = validator.validate(ncs);

    assertThat(result.status()).isEqualTo(RoundTripValidator.Status.MATCH);
    assertThat(result.recompiled()).isEqualTo(result.original());
    assertThat(result.firstDifference()).isEmpty();
  }

  @Test
  public void differentRecompilationIsAMismatch() {
    byte[] other = callingAction(2);
    RoundTripValidator validator = new RoundTripValidator(DECOMPILER, (source, variant) -> other);

    RoundTripValidator.Result result = validator.validate(callingAction(1));

    assertThat(result.status()).isEqualTo(RoundTripValidator.Status.MISMATCH);
    assertThat(result.firstDifference()).hasValue("line 2: action_1(); | action_2();");
  }

  @Test
  public void compilerFailureIsNotAMismatch() {
    RoundTripValidator validator =
        new RoundTripValidator(
            DECOMPILER,
            (source, variant) -> {
              throw new DecompilerException(
                  DecompilerException.NO_POS, DecompilerException.ErrorKind.COMPILER, "timed out");
            });

    RoundTripValidator.Result result = validator.validate(callingAction(1));

    assertThat(result.status()).isEqualTo(RoundTripValidator.Status.COMPILER_FAILURE);
    assertThat(result.original()).hasValue("void main() {\n\taction_1();\n}\n");
    assertThat(result.error().get().kind()).isEqualTo(DecompilerException.ErrorKind.COMPILER);
  }

  @Test
  public void undecodableInputFailsBeforeCompiling() {
    RoundTripValidator validator =
        new RoundTripValidator(
            DECOMPILER,
            (source, variant) -> {
              throw new AssertionError("compiler must not run");
            });

    RoundTripValidator.Result result = validator.validate(new byte[] {1, 2, 3});

    assertThat(result.status()).isEqualTo(RoundTripValidator.Status.DECOMPILE_FAILURE);
    assertThat(result.original()).isEmpty();
  }

  @Test
  public void normalizeDropsBlankAndCommentLines() {
    assertThat(RoundTripValidator.normalize("void main() {\n\n\t// note\n\tx  =\t1;\n}\n"))
        .containsExactly("void main() {", "x = 1;", "}")
        .inOrder();
  }

  @Test
  public void differenceReportsMissingLines() {
    assertThat(
            RoundTripValidator.firstDifference(
                ImmutableList.of("a", "b"), ImmutableList.of("a")))
        .hasValue("line 2: b | <end>");
    assertThat(RoundTripValidator.firstDifference(ImmutableList.of("a"), ImmutableList.of("a")))
        .isEmpty();
  }

  /** Two locals and three levels of if/else, about fifty instructions in all. */
  private static byte[] nestedConditionals() {
    return new NcsAssembler()
        .jsr("main")
        .retn()
        .label("main")
        .rsadd(ValueType.INT)
        .consti(3)
        .cpdownsp(-8, 4)
        .movsp(-4)
        .rsadd(ValueType.INT)
        .consti(0)
        .cpdownsp(-8, 4)
        .movsp(-4)
        .cptopsp(-8, 4)
        .consti(2)
        .binary(Opcode.GT, TypePair.II)
        .jz("outerElse")
        .cptopsp(-4, 4)
        .consti(0)
        .binary(Opcode.EQUAL, TypePair.II)
        .jz("innerElse")
        .consti(10)
        .action(1, 1)
        .cptopsp(-8, 4)
        .consti(1)
        .binary(Opcode.ADD, TypePair.II)
        .cpdownsp(-8, 4)
        .movsp(-4)
        .jmp("innerEnd")
        .label("innerElse")
        .consti(20)
        .action(2, 1)
        .label("innerEnd")
        .cptopsp(-4, 4)
        .consti(5)
        .binary(Opcode.LT, TypePair.II)
        .jz("smallEnd")
        .cptopsp(-4, 4)
        .action(3, 1)
        .label("smallEnd")
        .jmp("outerEnd")
        .label("outerElse")
        .cptopsp(-8, 4)
        .jz("flagEnd")
        .consti(30)
        .action(4, 1)
        .label("flagEnd")
        .consti(40)
        .action(5, 1)
        .label("outerEnd")
        .cptopsp(-8, 4)
        .cptopsp(-8, 4)
        .binary(Opcode.ADD, TypePair.II)
        .action(3, 1)
        .movsp(-8)
        .retn()
        .bytes();
  }

  @Test
  public void nestedConditionalsSurviveRecompilation() {
    String expected =
        "void main() {\n"
            + "\tint int1 = 3;\n"
            + "\tint int2 = 0;\n"
            + "\tif (int1 > 2) {\n"
            + "\t\tif (int2 == 0) {\n"
            + "\t\t\taction_1(10);\n"
            + "\t\t\tint2 = int1 + 1;\n"
            + "\t\t}\n"
            + "\t\telse {\n"
            + "\t\t\taction_2(20);\n"
            + "\t\t}\n"
            + "\t\tif (int2 < 5) {\n"
            + "\t\t\taction_3(int2);\n"
            + "\t\t}\n"
            + "\t}\n"
            + "\telse {\n"
            + "\t\tif (int1) {\n"
            + "\t\t\taction_4(30);\n"
            + "\t\t}\n"
            + "\t\taction_5(40);\n"
            + "\t}\n"
            + "\taction_3(int1 + int2);\n"
            + "}\n";
    byte[] ncs = nestedConditionals();
    List<String> compiled = new ArrayList<>();
    RoundTripValidator validator =
        new RoundTripValidator(
            DECOMPILER,
            (source, variant) -> {
              compiled.add(source);
              return ncs;
            });

    RoundTripValidator.Result result = validator.validate(ncs);

    assertThat(result.status()).isEqualTo(RoundTripValidator.Status.MATCH);
    assertThat(result.original()).hasValue(expected);
    assertThat(compiled).containsExactly(expected);
  }
}
