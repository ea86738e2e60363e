package ncsdecomp;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** Read-only registry of one action table per game variant. */
public final class ActionTables {
  private static final ActionTables NONE = new ActionTables(ImmutableMap.of());

  private final ImmutableMap<GameVariant, ActionTable> tables;

  private ActionTables(ImmutableMap<GameVariant, ActionTable> tables) {
    this.tables = tables;
  }

  public static ActionTables none() {
    return NONE;
  }

  public static ActionTables of(Map<GameVariant, ? extends ActionTable> tables) {
    return new ActionTables(ImmutableMap.copyOf(tables));
  }

  /** Loads the nwscript files configured in {@code options}; variants without one stay empty. */
  public static ActionTables load(DecompilerOptions options) throws DecompilerException {
    Map<GameVariant, ActionTable> tables = Maps.newEnumMap(GameVariant.class);
    for (GameVariant variant : GameVariant.values()) {
      Optional<File> file = options.nwscriptFile(variant);
      if (!file.isPresent()) continue;
      try {
        tables.put(variant, NwscriptActionTable.load(file.get()));
      } catch (IOException ex) {
        throw new DecompilerException(
            DecompilerException.NO_POS,
            DecompilerException.ErrorKind.IO,
            "cannot read " + file.get() + ": " + ex.getMessage(),
            ex);
      }
    }
    return of(tables);
  }

  /** The table for {@code variant}, or one that knows no actions. */
  public ActionTable forVariant(GameVariant variant) {
    return tables.getOrDefault(variant, ActionTable.EMPTY);
  }
}
