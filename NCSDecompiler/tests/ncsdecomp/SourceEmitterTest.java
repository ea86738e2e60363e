package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class SourceEmitterTest {

  @Test
  public void floatLiteralsAlwaysHaveAFraction() {
    assertThat(SourceEmitter.floatLiteral(1.5f)).isEqualTo("1.5");
    assertThat(SourceEmitter.floatLiteral(2f)).isEqualTo("2.0");
    assertThat(SourceEmitter.floatLiteral(-0.25f)).isEqualTo("-0.25");
  }

  @Test
  public void floatLiteralsAvoidExponents() {
    assertThat(SourceEmitter.floatLiteral(1e10f)).isEqualTo("10000000000.0");
    assertThat(SourceEmitter.floatLiteral(1e-3f)).isEqualTo("0.001");
  }

  @Test
  public void negativeZeroKeepsItsSign() {
    assertThat(SourceEmitter.floatLiteral(-0f)).isEqualTo("-0.0");
    assertThat(SourceEmitter.floatLiteral(0f)).isEqualTo("0.0");
  }

  @Test
  public void stringLiteralsAreEscaped() {
    assertThat(SourceEmitter.stringLiteral("a\"b\\c\n")).isEqualTo("\"a\\\"b\\\\c\\n\"");
    assertThat(SourceEmitter.stringLiteral("")).isEqualTo("\"\"");
  }

  @Test
  public void labelsAreNamedByPosition() {
    assertThat(SourceEmitter.labelName(0x2A)).isEqualTo("loc_0000002A");
  }
}
