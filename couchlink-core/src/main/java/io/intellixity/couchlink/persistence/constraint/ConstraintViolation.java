package io.intellixity.couchlink.persistence.constraint;

import java.util.Objects;

/**
 * A rejected constraint.
 *
 * @param kind constraint family
 * @param constraint constraint name as declared on the schema
 * @param id marker id (unique) or referenced document id (foreign key)
 */
public record ConstraintViolation(ConstraintKind kind, String constraint, String id) {
  public ConstraintViolation {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(constraint, "constraint");
  }
}
