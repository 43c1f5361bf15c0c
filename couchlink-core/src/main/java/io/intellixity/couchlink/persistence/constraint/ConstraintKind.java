package io.intellixity.couchlink.persistence.constraint;

public enum ConstraintKind {
  UNIQUE,
  FOREIGN_KEY
}
