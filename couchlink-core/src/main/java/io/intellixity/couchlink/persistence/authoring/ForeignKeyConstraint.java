package io.intellixity.couchlink.persistence.authoring;

/**
 * Reference from {@code field} to a document of the {@code target} namespace.
 */
public record ForeignKeyConstraint(String name, String field, String target) {
  public ForeignKeyConstraint {
    if (field == null || field.isBlank()) throw new SchemaConfigurationException("foreign key field is required");
    if (target == null || target.isBlank()) {
      throw new SchemaConfigurationException("foreign key target is required for field '" + field + "'");
    }
    name = (name == null || name.isBlank()) ? field + "_fkey" : name;
  }
}
