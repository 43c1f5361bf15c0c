package io.intellixity.couchlink.persistence.constraint;

import java.util.Objects;

/**
 * Verdict for one declared constraint: {@link Ok}, {@link Pending}, {@link Invalid} or {@link Error}.
 */
public interface ConstraintResult {
  String constraint();

  static ConstraintResult ok(String constraint) { return new Ok(constraint); }
  static ConstraintResult pending(String constraint, String markerId) { return new Pending(constraint, markerId); }
  static ConstraintResult invalid(ConstraintKind kind, String constraint, String id) {
    return new Invalid(new ConstraintViolation(kind, constraint, id));
  }
  static ConstraintResult error(String constraint, String reason) { return new Error(constraint, reason); }

  /** Accepted without any further action. */
  record Ok(String constraint) implements ConstraintResult {
    public Ok {
      Objects.requireNonNull(constraint, "constraint");
    }
  }

  /** Tentatively accepted; confirmed only once the marker at {@code markerId} has been written. */
  record Pending(String constraint, String markerId) implements ConstraintResult {
    public Pending {
      Objects.requireNonNull(constraint, "constraint");
      Objects.requireNonNull(markerId, "markerId");
    }
  }

  record Invalid(ConstraintViolation violation) implements ConstraintResult {
    public Invalid {
      Objects.requireNonNull(violation, "violation");
    }

    @Override
    public String constraint() {
      return violation.constraint();
    }
  }

  /** The lookup itself failed; the constraint could not be decided. */
  record Error(String constraint, String reason) implements ConstraintResult {
    public Error {
      Objects.requireNonNull(constraint, "constraint");
      reason = (reason == null) ? "unknown error" : reason;
    }
  }
}
