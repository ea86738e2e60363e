package ncsdecomp;

import java.util.Optional;

import ncsdecomp.Script.Constant;
import ncsdecomp.Script.Expression;

/** Folds arithmetic over int and float literals, for callers that ask for folded output. */
final class ConstantFolder {

  static Optional<Constant> fold(
      Command.BinaryOp op, ValueType type, Expression left, Expression right) {
    if (!isNumber(left) || !isNumber(right)) return Optional.empty();
    Constant l = left.cast();
    Constant r = right.cast();

    if (type == ValueType.INT && l.type() == ValueType.INT && r.type() == ValueType.INT) {
      int a = l.value().intValue();
      int b = r.value().intValue();
      switch (op) {
        case ADD:
          return Optional.of(Constant.ofInt(a + b));
        case SUB:
          return Optional.of(Constant.ofInt(a - b));
        case MUL:
          return Optional.of(Constant.ofInt(a * b));
        case DIV:
          return b == 0 ? Optional.empty() : Optional.of(Constant.ofInt(a / b));
        case MOD:
          return b == 0 ? Optional.empty() : Optional.of(Constant.ofInt(a % b));
        case SHIFT_LEFT:
          return Optional.of(Constant.ofInt(a << b));
        case SHIFT_RIGHT:
          return Optional.of(Constant.ofInt(a >> b));
        default:
          return Optional.empty();
      }
    }

    if (type == ValueType.FLOAT) {
      float a = floatValue(l);
      float b = floatValue(r);
      switch (op) {
        case ADD:
          return Optional.of(ofFloat(a + b));
        case SUB:
          return Optional.of(ofFloat(a - b));
        case MUL:
          return Optional.of(ofFloat(a * b));
        case DIV:
          return b == 0 ? Optional.empty() : Optional.of(ofFloat(a / b));
        default:
          return Optional.empty();
      }
    }
    return Optional.empty();
  }

  static Optional<Constant> fold(Command.UnaryOp op, Expression operand) {
    if (!isNumber(operand)) return Optional.empty();
    Constant c = operand.cast();
    switch (op) {
      case NEGATE:
        return c.type() == ValueType.INT
            ? Optional.of(Constant.ofInt(-c.value().intValue()))
            : Optional.of(ofFloat(-c.value().floatValue()));
      case COMPLEMENT:
        return c.type() == ValueType.INT
            ? Optional.of(Constant.ofInt(~c.value().intValue()))
            : Optional.empty();
      default:
        return Optional.empty();
    }
  }

  private static boolean isNumber(Expression expression) {
    return expression.kind() == Expression.Kind.CONSTANT
        && (expression.type() == ValueType.INT || expression.type() == ValueType.FLOAT);
  }

  private static float floatValue(Constant constant) {
    return constant.type() == ValueType.INT
        ? constant.value().intValue()
        : constant.value().floatValue();
  }

  private static Constant ofFloat(float value) {
    return Constant.create(ValueType.FLOAT, Operand.ofFloat(value));
  }

  private ConstantFolder() {}
}
