package ncsdecomp;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A storage location discovered on the simulated stack.
 *
 * <p>Every stack slot that holds a variable holds a scalar one. When a multi-slot copy addresses
 * several adjacent scalars as a unit they are gathered into a group (a vector or a structure) and
 * each scalar becomes a member of it; references then go through {@link #root()}.
 */
public final class Variable {
  public enum Scope {
    LOCAL,
    PARAMETER,
    GLOBAL,
    // Caller-reserved slot receiving the routine's return value.
    RETURN;
  }

  private final Scope scope;
  private final ValueType type;
  private final int declaredAt;
  private final ImmutableList<Variable> members;

  private Variable group;
  private int component;
  private boolean callResult;
  private String name;

  private Variable(Scope scope, ValueType type, int declaredAt, ImmutableList<Variable> members) {
    this.scope = scope;
    this.type = type;
    this.declaredAt = declaredAt;
    this.members = members;
  }

  /** A one-slot variable; {@code declaredAt} is the index of its RSADD command, or -1. */
  public static Variable scalar(Scope scope, ValueType type, int declaredAt) {
    Preconditions.checkArgument(type.width() == 1, "not scalar: %s", type);
    return new Variable(scope, type, declaredAt, ImmutableList.of());
  }

  /** Gathers adjacent, ungrouped scalars into one variable. */
  public static Variable group(ValueType type, List<Variable> members) {
    Preconditions.checkArgument(members.size() > 1, "a group needs several members");
    for (Variable member : members) {
      Preconditions.checkArgument(
          member.group == null && member.members.isEmpty(), "%s is already grouped", member);
    }
    Variable first = members.get(0);
    Variable grouped =
        new Variable(first.scope, type, first.declaredAt, ImmutableList.copyOf(members));
    for (int i = 0; i < members.size(); i++) {
      members.get(i).group = grouped;
      members.get(i).component = i;
    }
    return grouped;
  }

  /** Builds a vector variable out of three fresh float scalars. */
  public static Variable vector(Scope scope, int declaredAt) {
    ImmutableList.Builder<Variable> members = ImmutableList.builder();
    for (int i = 0; i < 3; i++) {
      members.add(scalar(scope, ValueType.FLOAT, declaredAt));
    }
    return group(ValueType.VECTOR, members.build());
  }

  public Scope scope() {
    return scope;
  }

  public ValueType type() {
    return type;
  }

  public int declaredAt() {
    return declaredAt;
  }

  public int width() {
    return members.isEmpty() ? 1 : members.size();
  }

  public ImmutableList<Variable> members() {
    return members;
  }

  public Optional<Variable> group() {
    return Optional.ofNullable(group);
  }

  /** The outermost variable this scalar belongs to. */
  public Variable root() {
    Variable v = this;
    while (v.group != null) {
      v = v.group;
    }
    return v;
  }

  /** Slot offset of this variable inside {@link #root()}. */
  public int offsetInRoot() {
    int offset = 0;
    for (Variable v = this; v.group != null; v = v.group) {
      offset += v.component;
    }
    return offset;
  }

  /** Type of {@code width} slots starting at {@code offset}. */
  public ValueType memberType(int offset, int width) {
    if (offset == 0 && width == width()) return type;
    if (type == ValueType.VECTOR && width == 1) return ValueType.FLOAT;
    if (width == 1 && !members.isEmpty()) return members.get(offset).type;
    return ValueType.STRUCT;
  }

  /** True for an RSADD placeholder that a JSR filled with its return value. */
  public boolean isCallResult() {
    return callResult;
  }

  void markCallResult() {
    callResult = true;
  }

  public boolean hasName() {
    return name != null;
  }

  public String name() {
    Preconditions.checkState(name != null, "unnamed %s variable", scope);
    return name;
  }

  void setName(String name) {
    Preconditions.checkState(this.name == null, "already named %s", this.name);
    this.name = name;
  }

  @Override
  public String toString() {
    return (name != null ? name : scope.name().toLowerCase()) + ":" + type.typeName();
  }
}
