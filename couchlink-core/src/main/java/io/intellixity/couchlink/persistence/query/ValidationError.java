package io.intellixity.couchlink.persistence.query;

import java.util.Objects;

/** Structured reason a query could not be compiled. */
public record ValidationError(Reason reason, String detail) {
  public ValidationError {
    Objects.requireNonNull(reason, "reason");
    detail = (detail == null) ? "" : detail;
  }

  public enum Reason {
    UNSUPPORTED_OPERATOR,
    PLACEHOLDER_OUT_OF_RANGE,
    MALFORMED_PREDICATE,
    UNKNOWN_FIELD
  }

  public static ValidationError unsupportedOperator(String operator) {
    return new ValidationError(Reason.UNSUPPORTED_OPERATOR, "unsupported operator '" + operator + "'");
  }

  public static ValidationError placeholderOutOfRange(int index, int size) {
    return new ValidationError(Reason.PLACEHOLDER_OUT_OF_RANGE,
        "placeholder index " + index + " out of range for " + size + " parameter(s)");
  }

  public static ValidationError malformed(String detail) {
    return new ValidationError(Reason.MALFORMED_PREDICATE, detail);
  }

  public static ValidationError unknownField(String detail) {
    return new ValidationError(Reason.UNKNOWN_FIELD, detail);
  }
}
