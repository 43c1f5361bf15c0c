package io.intellixity.couchlink.persistence.authoring;

import java.util.List;

/** Per-schema integrity rules, loaded once and shared read-only. */
public record ConstraintSet(List<UniqueConstraint> unique, List<ForeignKeyConstraint> foreignKeys) {
  public static final ConstraintSet NONE = new ConstraintSet(List.of(), List.of());

  public ConstraintSet {
    unique = (unique == null) ? List.of() : List.copyOf(unique);
    foreignKeys = (foreignKeys == null) ? List.of() : List.copyOf(foreignKeys);
  }

  public boolean isEmpty() {
    return unique.isEmpty() && foreignKeys.isEmpty();
  }
}
