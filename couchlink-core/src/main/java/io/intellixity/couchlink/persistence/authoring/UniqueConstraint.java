package io.intellixity.couchlink.persistence.authoring;

import java.util.ArrayList;
import java.util.List;

/**
 * Uniqueness over one or more fields, enforced through a marker document whose id is derived from the
 * field values.
 *
 * @param name constraint name reported back in violations
 * @param fields composing fields, in marker order
 */
public record UniqueConstraint(String name, List<String> fields) {
  public static final String INDEX_SUFFIX = "index";

  public UniqueConstraint {
    if (name == null || name.isBlank()) throw new SchemaConfigurationException("unique constraint name is required");
    fields = (fields == null) ? List.of() : List.copyOf(fields);
    if (fields.isEmpty()) {
      throw new SchemaConfigurationException(
          "Unique constraint '" + name + "' requires a name with field names separated by \"-\"");
    }
  }

  /** Derives fields from the {@code "username-email-index"} naming convention. */
  public static UniqueConstraint fromName(String name) {
    if (name == null || name.isBlank()) throw new SchemaConfigurationException("unique constraint name is required");
    List<String> fields = new ArrayList<>();
    for (String part : name.split("-")) {
      String f = part.trim();
      if (f.isEmpty() || INDEX_SUFFIX.equals(f)) continue;
      fields.add(f);
    }
    return new UniqueConstraint(name, fields);
  }
}
