package ncsdecomp;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

/** One engine action as declared in nwscript.nss. */
@AutoValue
public abstract class ActionSignature {

  @AutoValue
  public abstract static class Parameter {
    public abstract ValueType type();

    public abstract String name();

    public abstract Optional<String> defaultValue();

    public static Parameter create(ValueType type, String name, Optional<String> defaultValue) {
      return new AutoValue_ActionSignature_Parameter(type, name, defaultValue);
    }
  }

  public abstract int id();

  public abstract String name();

  public abstract ValueType returnType();

  public abstract ImmutableList<Parameter> parameters();

  @Memoized
  public ImmutableList<ValueType> paramTypes() {
    return parameters().stream().map(Parameter::type).collect(ImmutableList.toImmutableList());
  }

  /** Parameters up to and including the last one without a default. */
  @Memoized
  public int requiredParamCount() {
    int count = 0;
    for (int i = 0; i < parameters().size(); i++) {
      if (!parameters().get(i).defaultValue().isPresent()) {
        count = i + 1;
      }
    }
    return count;
  }

  public static ActionSignature create(
      int id, String name, ValueType returnType, ImmutableList<Parameter> parameters) {
    return new AutoValue_ActionSignature(id, name, returnType, parameters);
  }
}
