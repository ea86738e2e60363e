package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class DecompilerOptionsTest {

  @TempDir public File tempDir;

  @Test
  public void defaults() {
    DecompilerOptions options = DecompilerOptions.defaults();

    assertThat(options.variant()).isEqualTo(GameVariant.K1);
    assertThat(options.charset()).isEqualTo(StandardCharsets.UTF_8);
    assertThat(options.foldConstants()).isFalse();
    assertThat(options.preferSwitches()).isFalse();
    assertThat(options.parallelSubroutines()).isFalse();
    assertThat(options.compilerTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(options.compiler()).isEmpty();
    assertThat(options.nwscriptFile(GameVariant.K2)).isEmpty();
  }

  @Test
  public void readsProperties() {
    Properties properties = new Properties();
    properties.setProperty(DecompilerOptions.VARIANT, " tsl ");
    properties.setProperty(DecompilerOptions.CHARSET, "ISO-8859-1");
    properties.setProperty(DecompilerOptions.FOLD_CONSTANTS, "true");
    properties.setProperty(DecompilerOptions.PREFER_SWITCHES, "TRUE");
    properties.setProperty(DecompilerOptions.PARALLEL, "true");
    properties.setProperty(DecompilerOptions.COMPILER, "/opt/nwnnsscomp");
    properties.setProperty(DecompilerOptions.COMPILER_TIMEOUT_SECONDS, "5");
    properties.setProperty(DecompilerOptions.NWSCRIPT_K2, "/data/tsl/nwscript.nss");

    DecompilerOptions options = DecompilerOptions.fromProperties(properties);

    assertThat(options.variant()).isEqualTo(GameVariant.K2);
    assertThat(options.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
    assertThat(options.foldConstants()).isTrue();
    assertThat(options.preferSwitches()).isTrue();
    assertThat(options.parallelSubroutines()).isTrue();
    assertThat(options.compiler()).hasValue(new File("/opt/nwnnsscomp"));
    assertThat(options.compilerTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(options.nwscriptFile(GameVariant.K2)).hasValue(new File("/data/tsl/nwscript.nss"));
    assertThat(options.nwscriptFile(GameVariant.K1)).isEmpty();
  }

  @Test
  public void rejectsUnknownVariant() {
    Properties properties = new Properties();
    properties.setProperty(DecompilerOptions.VARIANT, "k3");

    assertThrows(
        IllegalArgumentException.class, () -> DecompilerOptions.fromProperties(properties));
  }

  @Test
  public void rejectsBadTimeout() {
    Properties properties = new Properties();
    properties.setProperty(DecompilerOptions.COMPILER_TIMEOUT_SECONDS, "soon");

    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class, () -> DecompilerOptions.fromProperties(properties));

    assertThat(ex).hasMessageThat().contains(DecompilerOptions.COMPILER_TIMEOUT_SECONDS);
  }

  @Test
  public void loadsConfiguredActionTables() throws IOException, DecompilerException {
    File nwscript = new File(tempDir, "nwscript.nss");
    Files.asCharSink(nwscript, StandardCharsets.ISO_8859_1)
        .write("// 0\nint Random(int nMaxInteger);\n");
    DecompilerOptions options = DecompilerOptions.builder().setNwscriptK1(nwscript).build();

    ActionTables tables = ActionTables.load(options);

    assertThat(tables.forVariant(GameVariant.K1).name(0)).hasValue("Random");
    assertThat(tables.forVariant(GameVariant.K2)).isSameInstanceAs(ActionTable.EMPTY);
  }

  @Test
  public void missingActionTableIsAnIoError() {
    DecompilerOptions options =
        DecompilerOptions.builder().setNwscriptK2(new File(tempDir, "absent.nss")).build();

    DecompilerException ex =
        assertThrows(DecompilerException.class, () -> ActionTables.load(options));

    assertThat(ex.kind()).isEqualTo(DecompilerException.ErrorKind.IO);
  }

  @Test
  public void variantNames() {
    assertThat(GameVariant.parse("KotOR")).hasValue(GameVariant.K1);
    assertThat(GameVariant.parse("2")).hasValue(GameVariant.K2);
    assertThat(GameVariant.parse("nwn")).isEmpty();
    assertThat(GameVariant.K2.compilerGameFlag()).isEqualTo("2");
  }
}
