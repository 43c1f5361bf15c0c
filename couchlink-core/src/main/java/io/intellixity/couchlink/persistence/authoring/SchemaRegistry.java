package io.intellixity.couchlink.persistence.authoring;

import java.util.Collection;

public interface SchemaRegistry {
  /** Resolves a schema by type name or namespace; throws {@link IllegalArgumentException} when unknown. */
  SchemaDef getSchema(String typeOrNamespace);

  Collection<SchemaDef> allSchemas();
}
