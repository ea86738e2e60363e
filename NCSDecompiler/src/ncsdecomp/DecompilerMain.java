package ncsdecomp;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class DecompilerMain {

  private static final String USAGE =
      "Usage:\n"
          + "  $DECOMPILER decompile <in.ncs|dir> <out-dir> [--k2] [--config file.properties]\n"
          + "  $DECOMPILER roundtrip <in.ncs> [--k2] [--config file.properties]";

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length == 0) return usage();

    List<String> positional = new ArrayList<>();
    boolean k2 = false;
    File config = null;
    for (int i = 1; i < args.length; i++) {
      switch (args[i]) {
        case "--k2":
          k2 = true;
          break;
        case "--config":
          if (++i == args.length) return usage();
          config = new File(args[i]);
          break;
        default:
          positional.add(args[i]);
      }
    }

    DecompilerOptions options;
    ActionTables tables;
    try {
      options = loadOptions(config);
      if (k2) options = options.toBuilder().setVariant(GameVariant.K2).build();
      tables = ActionTables.load(options);
    } catch (DecompilerException ex) {
      ex.print();
      return 1;
    } catch (IllegalArgumentException ex) {
      System.out.println("Bad configuration: " + ex.getMessage());
      return 1;
    }
    Decompiler decompiler = new Decompiler(options, tables);

    switch (args[0]) {
      case "decompile":
        if (positional.size() != 2) return usage();
        return decompile(decompiler, new File(positional.get(0)), new File(positional.get(1)));
      case "roundtrip":
        if (positional.size() != 1) return usage();
        return roundTrip(decompiler, new File(positional.get(0)));
      default:
        return usage();
    }
  }

  private static int decompile(Decompiler decompiler, File input, File outDir) {
    ImmutableList<File> inputs;
    try {
      inputs = FileDecompiler.listScripts(input);
    } catch (DecompilerException ex) {
      ex.print();
      return 1;
    }
    ImmutableList<FileOutcome> outcomes =
        new FileDecompiler(decompiler).decompileAll(inputs, outDir);
    outcomes.forEach(o -> System.out.println(o.summary()));

    long failed =
        outcomes.stream().filter(o -> o.status() != FileOutcome.Status.DECOMPILED).count();
    if (failed > 0) {
      System.out.println(failed + " of " + outcomes.size() + " file(s) had errors.");
      return 1;
    }
    System.out.println("Decompiled " + outcomes.size() + " file(s).");
    return 0;
  }

  private static int roundTrip(Decompiler decompiler, File input) {
    RoundTripValidator.Result result;
    try {
      ExternalCompiler compiler = ProcessCompiler.fromOptions(decompiler.options());
      result = new RoundTripValidator(decompiler, compiler).validate(FileDecompiler.read(input));
    } catch (DecompilerException ex) {
      ex.print();
      return 1;
    }

    System.out.println(result.status() + " " + input);
    result.firstDifference().ifPresent(d -> System.out.println("  first difference: " + d));
    result.error().ifPresent(DecompilerException::print);
    return result.status() == RoundTripValidator.Status.MATCH ? 0 : 1;
  }

  private static DecompilerOptions loadOptions(File config) throws DecompilerException {
    if (config == null) return DecompilerOptions.defaults();
    Properties properties = new Properties();
    try (Reader reader = Files.asCharSource(config, StandardCharsets.UTF_8).openBufferedStream()) {
      properties.load(reader);
    } catch (IOException ex) {
      throw new DecompilerException(
          DecompilerException.NO_POS,
          DecompilerException.ErrorKind.IO,
          "cannot read " + config + ": " + ex.getMessage(),
          ex);
    }
    return DecompilerOptions.fromProperties(properties);
  }

  private static int usage() {
    System.err.println(USAGE);
    return 1;
  }
}
