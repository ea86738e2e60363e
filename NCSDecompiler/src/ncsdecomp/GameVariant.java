package ncsdecomp;

import java.util.Locale;
import java.util.Optional;

/** The two runtimes whose action-id spaces differ. */
public enum GameVariant {
  K1("1"),
  K2("2");

  private final String compilerGameFlag;

  private GameVariant(String compilerGameFlag) {
    this.compilerGameFlag = compilerGameFlag;
  }

  /** Value of the external compiler's {@code -g} option. */
  public String compilerGameFlag() {
    return compilerGameFlag;
  }

  public static Optional<GameVariant> parse(String text) {
    switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "k1":
      case "kotor":
      case "1":
        return Optional.of(K1);
      case "k2":
      case "tsl":
      case "2":
        return Optional.of(K2);
      default:
        return Optional.empty();
    }
  }
}
