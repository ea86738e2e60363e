package ncsdecomp;

import com.google.common.base.VerifyException;

import ncsdecomp.Script.Expression;

/** Binding strength of rendered expressions, loosest first. */
enum Precedence {
  LOWEST,
  ASSIGNMENT,
  LOGICAL_OR,
  LOGICAL_AND,
  BITWISE_OR,
  BITWISE_XOR,
  BITWISE_AND,
  EQUALITY,
  RELATIONAL,
  SHIFT,
  ADDITIVE,
  MULTIPLICATIVE,
  UNARY,
  POSTFIX,
  ATOMIC;

  boolean bindsLooserThan(Precedence other) {
    return compareTo(other) < 0;
  }

  static Precedence of(Expression expression) {
    switch (expression.kind()) {
      case ASSIGNMENT:
        return ASSIGNMENT;
      case LOGICAL:
        return of(expression.<Script.Logical>cast().op());
      case BINARY:
        return of(expression.<Script.Binary>cast().op());
      case UNARY:
        return UNARY;
      case INC_DEC:
        return expression.<Script.IncDec>cast().prefix() ? UNARY : POSTFIX;
      case CONSTANT:
        return isNegative(expression.cast()) ? UNARY : ATOMIC;
      case MEMBER:
      case SUBROUTINE_CALL:
      case ACTION_CALL:
        return POSTFIX;
      case VARIABLE:
      case VECTOR_LITERAL:
      case ACTION_ARGUMENT:
        return ATOMIC;
    }
    throw new VerifyException("unknown expression " + expression.kind());
  }

  static Precedence of(Command.LogicalOp op) {
    switch (op) {
      case AND:
        return LOGICAL_AND;
      case OR:
        return LOGICAL_OR;
      case INCLUSIVE_OR:
        return BITWISE_OR;
      case EXCLUSIVE_OR:
        return BITWISE_XOR;
      case BITWISE_AND:
        return BITWISE_AND;
    }
    throw new VerifyException("unknown logical operator " + op);
  }

  static Precedence of(Command.BinaryOp op) {
    switch (op) {
      case ADD:
      case SUB:
        return ADDITIVE;
      case MUL:
      case DIV:
      case MOD:
        return MULTIPLICATIVE;
      case SHIFT_LEFT:
      case SHIFT_RIGHT:
      case UNSIGNED_SHIFT_RIGHT:
        return SHIFT;
      case EQUAL:
      case NOT_EQUAL:
        return EQUALITY;
      case GREATER_EQUAL:
      case GREATER:
      case LESS:
      case LESS_EQUAL:
        return RELATIONAL;
    }
    throw new VerifyException("unknown binary operator " + op);
  }

  private static boolean isNegative(Script.Constant constant) {
    switch (constant.type()) {
      case INT:
        return constant.value().intValue() < 0;
      case FLOAT:
        return constant.value().floatValue() < 0
            || Float.floatToRawIntBits(constant.value().floatValue()) == Integer.MIN_VALUE;
      default:
        return false;
    }
  }
}
