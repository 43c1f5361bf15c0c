package io.intellixity.couchlink.persistence.exec;

import io.intellixity.couchlink.persistence.constraint.ConstraintViolation;

import java.util.*;

/**
 * Result of a single-document write.
 *
 * @param status overall result
 * @param returning requested return fields in request order; absent fields map to null
 * @param violations every violated constraint when {@code status == INVALID}
 * @param errors store or lookup failures when {@code status == ERROR}
 */
public record WriteOutcome(
    Status status,
    Map<String, Object> returning,
    List<ConstraintViolation> violations,
    List<String> errors
) {
  public enum Status { OK, INVALID, ERROR }

  public WriteOutcome {
    Objects.requireNonNull(status, "status");
    // LinkedHashMap copy: return values may legitimately be null
    returning = (returning == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(returning));
    violations = (violations == null) ? List.of() : List.copyOf(violations);
    errors = (errors == null) ? List.of() : List.copyOf(errors);
  }

  public static WriteOutcome ok(Map<String, Object> returning) {
    return new WriteOutcome(Status.OK, returning, List.of(), List.of());
  }

  public static WriteOutcome invalid(List<ConstraintViolation> violations) {
    return new WriteOutcome(Status.INVALID, Map.of(), violations, List.of());
  }

  public static WriteOutcome error(List<String> errors) {
    return new WriteOutcome(Status.ERROR, Map.of(), List.of(), errors);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  /** Returned values in request order. */
  public List<Object> values() {
    return Collections.unmodifiableList(new ArrayList<>(returning.values()));
  }
}
