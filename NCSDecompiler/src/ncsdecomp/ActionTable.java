package ncsdecomp;

import java.util.Collections;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Signatures of engine actions by numeric id. Every lookup may come back empty; the {@code
 * resolved*} methods substitute the defaults the decompiler uses for unknown actions.
 * Implementations must be safe for concurrent reads.
 */
public interface ActionTable {
  ActionTable EMPTY =
      new ActionTable() {
        @Override
        public Optional<String> name(int actionId) {
          return Optional.empty();
        }

        @Override
        public Optional<ImmutableList<ValueType>> paramTypes(int actionId) {
          return Optional.empty();
        }

        @Override
        public Optional<ValueType> returnType(int actionId) {
          return Optional.empty();
        }
      };

  Optional<String> name(int actionId);

  Optional<ImmutableList<ValueType>> paramTypes(int actionId);

  Optional<ValueType> returnType(int actionId);

  default String resolvedName(int actionId) {
    return name(actionId).orElse("action_" + actionId);
  }

  /** Parameter types for a call passing {@code argCount} arguments; unknown ones are int. */
  default ImmutableList<ValueType> resolvedParamTypes(int actionId, int argCount) {
    ImmutableList<ValueType> known = paramTypes(actionId).orElse(ImmutableList.of());
    if (known.size() >= argCount) {
      return known.subList(0, argCount);
    }
    return ImmutableList.<ValueType>builder()
        .addAll(known)
        .addAll(Collections.nCopies(argCount - known.size(), ValueType.INT))
        .build();
  }

  default ValueType resolvedReturnType(int actionId) {
    return returnType(actionId).orElse(ValueType.VOID);
  }
}
