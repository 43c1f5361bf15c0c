package io.intellixity.couchlink.persistence.query;

import java.util.Objects;

/**
 * Raised when a query cannot be compiled: unsupported operator, out-of-range placeholder, malformed tree or
 * an unknown field.
 * <p>
 * Carries a {@link ValidationError} so callers can react to the reason without parsing the message.
 */
public final class QueryValidationException extends RuntimeException {
  private final ValidationError error;

  public QueryValidationException(ValidationError error) {
    super(Objects.requireNonNull(error, "error").detail());
    this.error = error;
  }

  public QueryValidationException(ValidationError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").detail(), cause);
    this.error = error;
  }

  public ValidationError error() {
    return error;
  }

  public ValidationError.Reason reason() {
    return error.reason();
  }
}
