package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

public class NwscriptActionTableTest {

  private NwscriptActionTable table;

  @BeforeEach
  public void setUp() throws IOException {
    table =
        NwscriptActionTable.parse(
            Resources.toString(
                Resources.getResource("ncsdecomp/nwscript.nss"), StandardCharsets.ISO_8859_1));
  }

  @Test
  public void readsNumberedSignatures() {
    assertThat(table.size()).isEqualTo(6);
    assertThat(table.name(0)).hasValue("Random");
    assertThat(table.returnType(0)).hasValue(ValueType.INT);
    assertThat(table.paramTypes(0)).hasValue(ImmutableList.of(ValueType.INT));
    assertThat(table.name(1)).hasValue("PrintString");
    assertThat(table.returnType(9)).hasValue(ValueType.VECTOR);
  }

  @Test
  public void commentLinesBetweenHeaderAndSignatureAreSkipped() {
    assertThat(table.name(7)).hasValue("DelayCommand");
    assertThat(table.paramTypes(7)).hasValue(ImmutableList.of(ValueType.FLOAT, ValueType.ACTION));
  }

  @Test
  public void defaultsMakeTrailingParametersOptional() {
    ActionSignature printFloat = table.signature(2).get();

    assertThat(printFloat.parameters()).hasSize(3);
    assertThat(printFloat.requiredParamCount()).isEqualTo(1);
    assertThat(printFloat.parameters().get(1).defaultValue()).hasValue("18");
  }

  @Test
  public void defaultsMayContainCommas() {
    ActionSignature visual = table.signature(10).get();

    assertThat(visual.paramTypes()).containsExactly(ValueType.VECTOR, ValueType.STRING).inOrder();
    assertThat(visual.parameters().get(0).defaultValue()).hasValue("[0.0, 0.0, 0.0]");
    assertThat(visual.parameters().get(1).defaultValue()).hasValue("\"x,y\"");
    assertThat(visual.requiredParamCount()).isEqualTo(0);
  }

  @Test
  public void unreadableSignatureIsSkipped() {
    assertThat(table.signature(11)).isEmpty();
    assertThat(table.resolvedName(11)).isEqualTo("action_11");
    assertThat(table.resolvedReturnType(11)).isEqualTo(ValueType.VOID);
  }

  @Test
  public void resolvedParameterTypesFitTheArgumentCount() {
    assertThat(table.resolvedParamTypes(2, 1)).containsExactly(ValueType.FLOAT);
    assertThat(table.resolvedParamTypes(1, 3))
        .containsExactly(ValueType.STRING, ValueType.INT, ValueType.INT)
        .inOrder();
  }

  @Test
  public void fileWithoutHeadersNumbersDeclarations() throws IOException {
    NwscriptActionTable numbered =
        NwscriptActionTable.parse("int First(int n);\n\nvoid Second();\nobject Third(string s);\n");

    assertThat(numbered.name(0)).hasValue("First");
    assertThat(numbered.name(1)).hasValue("Second");
    assertThat(numbered.paramTypes(1)).hasValue(ImmutableList.of());
    assertThat(numbered.returnType(2)).hasValue(ValueType.OBJECT);
  }

  @Test
  public void emptyTableKnowsNothing() {
    assertThat(ActionTable.EMPTY.name(3)).isEqualTo(Optional.empty());
    assertThat(ActionTable.EMPTY.resolvedName(3)).isEqualTo("action_3");
    assertThat(ActionTable.EMPTY.resolvedParamTypes(3, 2))
        .containsExactly(ValueType.INT, ValueType.INT);
  }
}
