package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class DecompilerMainTest {

  @TempDir public File tempDir;

  @Test
  public void usageErrors() {
    assertThat(DecompilerMain.run(new String[0])).isEqualTo(1);
    assertThat(DecompilerMain.run(new String[] {"disassemble", "x.ncs"})).isEqualTo(1);
    assertThat(DecompilerMain.run(new String[] {"decompile", "x.ncs"})).isEqualTo(1);
    assertThat(DecompilerMain.run(new String[] {"decompile", "--config"})).isEqualTo(1);
  }

  @Test
  public void decompilesDirectory() throws IOException {
    File in = new File(tempDir, "in");
    File out = new File(tempDir, "out");
    in.mkdir();
    Files.write(
        new NcsAssembler().jsr("main").retn().label("main").retn().bytes(),
        new File(in, "empty.ncs"));

    int code = DecompilerMain.run(new String[] {"decompile", in.getPath(), out.getPath()});

    assertThat(code).isEqualTo(0);
    assertThat(new File(out, "empty.nss").isFile()).isTrue();
  }

  @Test
  public void failedFileMakesRunFail() throws IOException {
    File bad = new File(tempDir, "bad.ncs");
    Files.write(new byte[] {'N', 'C', 'S'}, bad);

    int code =
        DecompilerMain.run(
            new String[] {"decompile", bad.getPath(), new File(tempDir, "out").getPath()});

    assertThat(code).isEqualTo(1);
  }

  @Test
  public void badConfigurationFails() throws IOException {
    File config = new File(tempDir, "decompiler.properties");
    Files.asCharSink(config, StandardCharsets.UTF_8)
        .write(DecompilerOptions.VARIANT + "=k9\n");

    int code =
        DecompilerMain.run(
            new String[] {"decompile", "in", "out", "--config", config.getPath()});

    assertThat(code).isEqualTo(1);
  }
}
