package io.intellixity.couchlink.persistence.authoring;

import java.util.*;

/**
 * Simple in-memory {@link SchemaRegistry}.\n
 *
 * Populated once at startup; lookups never mutate it.\n
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {
  private final Map<String, SchemaDef> byType = new LinkedHashMap<>();
  private final Map<String, SchemaDef> byNamespace = new HashMap<>();

  public InMemorySchemaRegistry(Collection<SchemaDef> schemas) {
    for (SchemaDef s : schemas) {
      if (byType.putIfAbsent(s.type(), s) != null) {
        throw new SchemaConfigurationException("Duplicate schema type: " + s.type());
      }
      if (byNamespace.putIfAbsent(s.namespace(), s) != null) {
        throw new SchemaConfigurationException("Duplicate schema namespace: " + s.namespace());
      }
    }
  }

  public static InMemorySchemaRegistry of(SchemaDef... schemas) {
    return new InMemorySchemaRegistry(List.of(schemas));
  }

  @Override
  public SchemaDef getSchema(String typeOrNamespace) {
    SchemaDef s = byType.get(typeOrNamespace);
    if (s == null) s = byNamespace.get(typeOrNamespace);
    if (s == null) throw new IllegalArgumentException("Unknown schema: " + typeOrNamespace);
    return s;
  }

  @Override
  public Collection<SchemaDef> allSchemas() {
    return Collections.unmodifiableCollection(byType.values());
  }
}
