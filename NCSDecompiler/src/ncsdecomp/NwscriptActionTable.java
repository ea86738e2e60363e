package ncsdecomp;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

/**
 * Action table read from an {@code nwscript.nss}. Signatures are bound to the index of the
 * preceding {@code // <n>} comment header; a file without headers numbers its function
 * declarations in order of appearance.
 */
public final class NwscriptActionTable implements ActionTable {
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Pattern HEADER = Pattern.compile("^\\s*//\\s*(\\d+)\\b.*$");
  private static final Pattern SIGNATURE =
      Pattern.compile("^\\s*(\\w+)\\s+(\\w+)\\s*\\((.*)\\)\\s*;?.*$");
  private static final Pattern PARAMETER =
      Pattern.compile("^\\s*(\\w+)\\s+(\\w+)(?:\\s*=\\s*(.+?))?\\s*$");

  private final ImmutableMap<Integer, ActionSignature> actions;

  private NwscriptActionTable(ImmutableMap<Integer, ActionSignature> actions) {
    this.actions = actions;
  }

  public static NwscriptActionTable load(File file) throws IOException {
    return parse(Files.asCharSource(file, StandardCharsets.ISO_8859_1).read());
  }

  public static NwscriptActionTable parse(String text) throws IOException {
    try (Reader reader = new StringReader(text)) {
      return parse(reader);
    }
  }

  public static NwscriptActionTable parse(Reader reader) throws IOException {
    List<String> lines = new ArrayList<>();
    try (BufferedReader br = new BufferedReader(reader)) {
      String line;
      while ((line = br.readLine()) != null) {
        lines.add(line);
      }
    }

    boolean headered = lines.stream().anyMatch(l -> headerIndex(l).orElse(-1) == 0);
    ImmutableMap.Builder<Integer, ActionSignature> actions = ImmutableMap.builder();
    boolean started = !headered;
    int pendingIndex = -1;
    int nextIndex = 0;
    for (String line : lines) {
      Optional<Integer> header = headerIndex(line);
      if (headered && header.isPresent()) {
        if (header.get() == 0) started = true;
        if (started) pendingIndex = header.get();
        continue;
      }
      String trimmed = line.trim();
      if (!started || trimmed.isEmpty() || trimmed.startsWith("//")) continue;

      Matcher m = SIGNATURE.matcher(line);
      if (!m.matches() || m.group(1).equals("return")) continue;
      int index;
      if (headered) {
        if (pendingIndex < 0) continue;
        index = pendingIndex;
        pendingIndex = -1;
      } else {
        index = nextIndex++;
      }
      parseSignature(index, m.group(1), m.group(2), m.group(3))
          .ifPresent(a -> actions.put(index, a));
    }
    ImmutableMap<Integer, ActionSignature> built = actions.buildKeepingLast();
    LOGGER.debug("Read {} action signatures.", built.size());
    return new NwscriptActionTable(built);
  }

  private static Optional<Integer> headerIndex(String line) {
    Matcher h = HEADER.matcher(line);
    if (!h.matches()) return Optional.empty();
    try {
      return Optional.of(Integer.parseInt(h.group(1)));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  private static Optional<ActionSignature> parseSignature(
      int index, String returnTypeName, String name, String params) {
    Optional<ValueType> returnType = ValueType.fromName(returnTypeName);
    if (!returnType.isPresent()) {
      LOGGER.warn("Skipping action {} [{}]: unknown return type {}.", index, name, returnTypeName);
      return Optional.empty();
    }
    ImmutableList.Builder<ActionSignature.Parameter> parameters = ImmutableList.builder();
    for (String param : splitParameters(params)) {
      if (param.trim().isEmpty() || param.trim().equals("void")) continue;
      Matcher m = PARAMETER.matcher(param);
      if (!m.matches()) {
        LOGGER.warn("Skipping action {} [{}]: cannot read parameter '{}'.", index, name, param);
        return Optional.empty();
      }
      ValueType type = ValueType.fromName(m.group(1)).orElse(ValueType.INT);
      parameters.add(
          ActionSignature.Parameter.create(
              type, m.group(2), Optional.ofNullable(m.group(3)).map(String::trim)));
    }
    return Optional.of(ActionSignature.create(index, name, returnType.get(), parameters.build()));
  }

  // Splits on top-level commas so that defaults like [0.0, 0.0, 0.0] or "a,b" stay whole.
  private static List<String> splitParameters(String params) {
    List<String> out = new ArrayList<>();
    int depth = 0;
    boolean quoted = false;
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < params.length(); i++) {
      char c = params.charAt(i);
      if (c == '"' && (i == 0 || params.charAt(i - 1) != '\\')) quoted = !quoted;
      if (!quoted) {
        if (c == '[' || c == '(') depth++;
        if (c == ']' || c == ')') depth--;
        if (c == ',' && depth == 0) {
          out.add(current.toString());
          current.setLength(0);
          continue;
        }
      }
      current.append(c);
    }
    out.add(current.toString());
    return out;
  }

  public Optional<ActionSignature> signature(int actionId) {
    return Optional.ofNullable(actions.get(actionId));
  }

  public int size() {
    return actions.size();
  }

  @Override
  public Optional<String> name(int actionId) {
    return signature(actionId).map(ActionSignature::name);
  }

  @Override
  public Optional<ImmutableList<ValueType>> paramTypes(int actionId) {
    return signature(actionId).map(ActionSignature::paramTypes);
  }

  @Override
  public Optional<ValueType> returnType(int actionId) {
    return signature(actionId).map(ActionSignature::returnType);
  }
}
