package io.intellixity.couchlink.persistence.authoring;

import io.intellixity.couchlink.persistence.naming.Namespacer;

import java.util.*;

/**
 * Explicit description of one entity type stored in the flat document space.
 *
 * @param type logical type name (e.g. {@code UserProfile})
 * @param namespace id prefix and {@code type} discriminator (e.g. {@code user_profile})
 * @param source prefix of uniqueness marker ids; defaults to the namespace
 * @param primaryKey caller-facing field naming the local id; defaults to {@code id}. {@code _id} always refers
 *                   to the qualified store id
 * @param fields declared fields in declaration order
 * @param constraints integrity rules checked before writes
 */
public record SchemaDef(
    String type,
    String namespace,
    String source,
    String primaryKey,
    Map<String, FieldType> fields,
    ConstraintSet constraints
) {
  public static final String ID_FIELD = "_id";
  public static final String REV_FIELD = "_rev";
  public static final String TYPE_FIELD = "type";
  public static final String DEFAULT_PRIMARY_KEY = "id";

  public SchemaDef {
    if (type == null || type.isBlank()) throw new SchemaConfigurationException("schema type is required");
    namespace = (namespace == null || namespace.isBlank()) ? Namespacer.namespace(type) : namespace;
    source = (source == null || source.isBlank()) ? namespace : source;
    primaryKey = (primaryKey == null || primaryKey.isBlank()) ? DEFAULT_PRIMARY_KEY : primaryKey;
    fields = (fields == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    constraints = (constraints == null) ? ConstraintSet.NONE : constraints;

    if (!fields.isEmpty()) {
      for (UniqueConstraint u : constraints.unique()) {
        for (String f : u.fields()) {
          if (!fields.containsKey(f)) {
            throw new SchemaConfigurationException(
                "Unique constraint '" + u.name() + "' references undeclared field '" + f + "' in schema " + type);
          }
        }
      }
      for (ForeignKeyConstraint fk : constraints.foreignKeys()) {
        if (!fields.containsKey(fk.field())) {
          throw new SchemaConfigurationException(
              "Foreign key '" + fk.name() + "' references undeclared field '" + fk.field() + "' in schema " + type);
        }
      }
    }
  }

  /** Field names in declaration order. */
  public List<String> fieldNames() {
    return List.copyOf(fields.keySet());
  }

  /** True for {@link #primaryKey()} and for the store id field. */
  public boolean isPrimaryKey(String field) {
    return primaryKey.equals(field) || ID_FIELD.equals(field);
  }

  /** True for fields every document carries regardless of declaration. */
  public static boolean isReservedField(String name) {
    return ID_FIELD.equals(name) || REV_FIELD.equals(name) || TYPE_FIELD.equals(name);
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public static final class Builder {
    private final String type;
    private String namespace;
    private String source;
    private String primaryKey;
    private final Map<String, FieldType> fields = new LinkedHashMap<>();
    private final List<UniqueConstraint> unique = new ArrayList<>();
    private final List<ForeignKeyConstraint> foreignKeys = new ArrayList<>();

    private Builder(String type) {
      this.type = type;
    }

    public Builder namespace(String namespace) { this.namespace = namespace; return this; }
    public Builder source(String source) { this.source = source; return this; }
    public Builder primaryKey(String primaryKey) { this.primaryKey = primaryKey; return this; }
    public Builder field(String name, FieldType fieldType) { fields.put(name, Objects.requireNonNull(fieldType, "fieldType")); return this; }
    public Builder unique(String name, String... fieldNames) { unique.add(new UniqueConstraint(name, List.of(fieldNames))); return this; }
    public Builder unique(String name) { unique.add(UniqueConstraint.fromName(name)); return this; }
    public Builder foreignKey(String field, String target) { foreignKeys.add(new ForeignKeyConstraint(null, field, target)); return this; }

    public SchemaDef build() {
      return new SchemaDef(type, namespace, source, primaryKey, fields, new ConstraintSet(unique, foreignKeys));
    }
  }
}
