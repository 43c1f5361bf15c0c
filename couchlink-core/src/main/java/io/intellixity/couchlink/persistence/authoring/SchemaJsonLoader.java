package io.intellixity.couchlink.persistence.authoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Loads schema definitions from JSON, once, into plain {@link SchemaDef} values.
 *
 * <pre>
 * { "schemas": [
 *   { "type": "User", "source": "users",
 *     "fields": { "email": "string", "org_id": "id", "tags": "list" },
 *     "unique": [ "email-index", { "name": "org_email", "fields": ["org_id", "email"] } ],
 *     "foreignKeys": [ { "field": "org_id", "target": "org" } ] }
 * ] }
 * </pre>
 */
public final class SchemaJsonLoader {
  private final ObjectMapper json;

  public SchemaJsonLoader() {
    this(new ObjectMapper());
  }

  public SchemaJsonLoader(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public InMemorySchemaRegistry loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SchemaJsonLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new SchemaConfigurationException("Schema resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema resource " + resource, e);
    }
  }

  public InMemorySchemaRegistry load(InputStream in) throws IOException {
    JsonNode root = json.readTree(in);
    JsonNode arr = (root == null) ? null : root.get("schemas");
    if (arr == null || !arr.isArray()) throw new SchemaConfigurationException("Schema JSON requires a 'schemas' array");

    List<SchemaDef> out = new ArrayList<>();
    for (JsonNode s : arr) out.add(parseSchema(s));
    return new InMemorySchemaRegistry(out);
  }

  private static SchemaDef parseSchema(JsonNode s) {
    SchemaDef.Builder b = SchemaDef.builder(textOrNull(s.get("type")))
        .namespace(textOrNull(s.get("namespace")))
        .source(textOrNull(s.get("source")))
        .primaryKey(textOrNull(s.get("primaryKey")));

    JsonNode fields = s.get("fields");
    if (fields != null && fields.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        b.field(e.getKey(), FieldType.parse(e.getValue().asText()));
      }
    }

    JsonNode unique = s.get("unique");
    if (unique != null && unique.isArray()) {
      for (JsonNode u : unique) {
        if (u.isTextual()) {
          b.unique(u.asText());
          continue;
        }
        JsonNode names = u.get("fields");
        String name = textOrNull(u.get("name"));
        if (names == null || !names.isArray()) {
          b.unique(name);
          continue;
        }
        List<String> fs = new ArrayList<>();
        for (JsonNode f : names) fs.add(f.asText());
        b.unique(name, fs.toArray(new String[0]));
      }
    }

    JsonNode fks = s.get("foreignKeys");
    if (fks != null && fks.isArray()) {
      for (JsonNode fk : fks) b.foreignKey(textOrNull(fk.get("field")), textOrNull(fk.get("target")));
    }
    return b.build();
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
