package ncsdecomp;

import com.google.auto.value.AutoOneOf;

/** One immediate operand of an instruction. */
@AutoOneOf(Operand.Kind.class)
public abstract class Operand {
  public enum Kind {
    INT_VALUE,
    FLOAT_VALUE,
    STRING_VALUE;
  }

  public abstract Kind kind();

  public abstract int intValue();

  public abstract float floatValue();

  public abstract String stringValue();

  public static Operand ofInt(int value) {
    return AutoOneOf_Operand.intValue(value);
  }

  public static Operand ofFloat(float value) {
    return AutoOneOf_Operand.floatValue(value);
  }

  public static Operand ofString(String value) {
    return AutoOneOf_Operand.stringValue(value);
  }
}
