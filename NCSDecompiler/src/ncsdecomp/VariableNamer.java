package ncsdecomp;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names variables the first time they are rendered. Locals become {@code int1}, {@code float2};
 * parameters are named by position ({@code intParam1}); globals get {@code intGLOB_1}. Counters run
 * per type, so each type numbers its variables from one.
 */
final class VariableNamer {
  private final VariableNamer globals;
  private final Map<String, Integer> counters = new HashMap<>();

  private VariableNamer(VariableNamer globals) {
    this.globals = globals;
  }

  /** A namer for the global scope of one program. */
  static VariableNamer forGlobals() {
    return new VariableNamer(null);
  }

  /** A namer for one routine; globals it meets are named by {@code globals}. */
  static VariableNamer forRoutine(VariableNamer globals) {
    return new VariableNamer(globals);
  }

  static String parameterName(ValueType type, int position) {
    return type.typeName() + "Param" + (position + 1);
  }

  static void nameParameters(List<Variable> parameters) {
    for (int i = 0; i < parameters.size(); i++) {
      Variable root = parameters.get(i).root();
      if (!root.hasName()) root.setName(parameterName(root.type(), i));
    }
  }

  String name(Variable variable) {
    Variable root = variable.root();
    if (!root.hasName()) {
      if (root.scope() == Variable.Scope.GLOBAL && globals != null) return globals.name(root);
      root.setName(freshName(root));
    }
    return root.name();
  }

  private String freshName(Variable variable) {
    String type = variable.type().typeName();
    switch (variable.scope()) {
      case GLOBAL:
        return next(type + "GLOB_");
      case PARAMETER:
        return next(type + "Param");
      case RETURN:
        return next(type + "Return");
      case LOCAL:
        return next(type);
    }
    throw new IllegalStateException("unknown scope " + variable.scope());
  }

  private String next(String prefix) {
    int n = counters.merge(prefix, 1, Integer::sum);
    return prefix + n;
  }
}
