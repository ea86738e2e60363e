package ncsdecomp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class FileDecompilerTest {

  @TempDir public File tempDir;

  private final FileDecompiler files =
      new FileDecompiler(new Decompiler(DecompilerOptions.defaults(), ActionTables.none()));

  private File script(String name, byte[] bytes) throws IOException {
    File file = new File(tempDir, name);
    Files.write(bytes, file);
    return file;
  }

  private static NcsAssembler withStub() {
    return new NcsAssembler().jsr("main").retn().label("main");
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  @Test
  public void listsScriptsInNameOrder() throws IOException, DecompilerException {
    File b = script("b.ncs", new byte[0]);
    File a = script("a.NCS", new byte[0]);
    script("notes.txt", new byte[0]);
    new File(tempDir, "sub.ncs").mkdir();

    assertThat(FileDecompiler.listScripts(tempDir)).containsExactly(a, b).inOrder();
    assertThat(FileDecompiler.listScripts(b)).containsExactly(b);
  }

  @Test
  public void listingMissingDirectoryFails() {
    DecompilerException ex =
        assertThrows(
            DecompilerException.class,
            () -> FileDecompiler.listScripts(new File(tempDir, "absent")));

    assertThat(ex.kind()).isEqualTo(DecompilerException.ErrorKind.IO);
  }

  @Test
  public void outputIsNamedAfterInput() {
    File out = new File(tempDir, "out");

    assertThat(FileDecompiler.outputFile(new File("k_act_talk.ncs"), out))
        .isEqualTo(new File(out, "k_act_talk.nss"));
  }

  @Test
  public void batchRecordsEveryFile() throws IOException {
    File good = script("good.ncs", withStub().action(1, 0).retn().bytes());
    File bad = script("bad.ncs", new byte[] {'N', 'C', 'S'});
    File partial =
        script(
            "partial.ncs",
            withStub().jsr("sub").retn().label("sub").cptopsp(-4, 4).movsp(-4).retn().bytes());
    File outDir = new File(tempDir, "out");

    ImmutableList<FileOutcome> outcomes =
        files.decompileAll(ImmutableList.of(good, bad, partial), outDir);

    assertThat(outcomes).hasSize(3);
    assertThat(outcomes.get(0).status()).isEqualTo(FileOutcome.Status.DECOMPILED);
    assertThat(read(outcomes.get(0).output().get())).isEqualTo("void main() {\n\taction_1();\n}\n");
    assertThat(outcomes.get(0).summary()).startsWith("OK");

    assertThat(outcomes.get(1).status()).isEqualTo(FileOutcome.Status.FAILED);
    assertThat(outcomes.get(1).output()).isEmpty();
    assertThat(outcomes.get(1).message().get()).contains("DECODE");
    assertThat(new File(outDir, "bad.nss").exists()).isFalse();

    assertThat(outcomes.get(2).status()).isEqualTo(FileOutcome.Status.PARTIAL);
    assertThat(outcomes.get(2).message().get()).contains("1 routine(s) failed");
    assertThat(read(new File(outDir, "partial.nss"))).contains("void sub1() {");
  }

  @Test
  public void failedCompileLeavesDiagnostic() throws IOException {
    File output = new File(tempDir, "build/out.ncs");
    ExternalCompiler compiler =
        (source, variant) -> {
          throw new DecompilerException(
              DecompilerException.NO_POS, DecompilerException.ErrorKind.COMPILER, "syntax error");
        };

    DecompilerException ex =
        assertThrows(
            DecompilerException.class,
            () -> FileDecompiler.compileToFile(compiler, "void main() {}", GameVariant.K1, output));

    assertThat(ex.kind()).isEqualTo(DecompilerException.ErrorKind.COMPILER);
    String diagnostic = read(output);
    assertThat(diagnostic).startsWith("// compilation failed\n// ERROR: COMPILER");
    assertThat(diagnostic).contains("syntax error");
  }

  @Test
  public void compiledBytesAreWritten() throws IOException, DecompilerException {
    File output = new File(tempDir, "out.ncs");
    byte[] compiled = withStub().retn().bytes();

    FileDecompiler.compileToFile(
        (source, variant) -> compiled, "void main() {}", GameVariant.K2, output);

    assertThat(Files.toByteArray(output)).isEqualTo(compiled);
  }
}
