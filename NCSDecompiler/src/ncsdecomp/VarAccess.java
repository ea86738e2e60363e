package ncsdecomp;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** A read or write of {@code width} slots of a variable, starting {@code offset} slots in. */
@AutoValue
public abstract class VarAccess {
  public abstract Variable variable();

  public abstract int offset();

  public abstract int width();

  public final boolean isWhole() {
    return offset() == 0 && width() == variable().width();
  }

  public final ValueType type() {
    return variable().memberType(offset(), width());
  }

  public static VarAccess of(Variable variable, int offset, int width) {
    Preconditions.checkArgument(
        offset >= 0 && offset + width <= variable.width(),
        "access [%s, +%s) outside %s",
        offset,
        width,
        variable);
    return new AutoValue_VarAccess(variable, offset, width);
  }

  public static VarAccess whole(Variable variable) {
    return of(variable, 0, variable.width());
  }
}
