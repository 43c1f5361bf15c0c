package io.intellixity.couchlink.persistence.authoring;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Semantic type of a document field, used to synthesize values for keys a sparse document lacks. */
public enum FieldType {
  STRING,
  INTEGER,
  BOOLEAN,
  LIST,
  MAP,
  /** Identifier-valued field (string form). */
  ID;

  /** Zero value for this type. Collections are immutable and safe to share between rows. */
  public Object zeroValue() {
    return switch (this) {
      case STRING, ID -> "";
      case INTEGER -> 0;
      case BOOLEAN -> false;
      case LIST -> List.of();
      case MAP -> Map.of();
    };
  }

  public static FieldType parse(String raw) {
    if (raw == null || raw.isBlank()) throw new SchemaConfigurationException("field type is required");
    String t = raw.trim().toLowerCase(Locale.ROOT);
    return switch (t) {
      case "string", "text" -> STRING;
      case "integer", "int", "long" -> INTEGER;
      case "boolean", "bool" -> BOOLEAN;
      case "list", "array" -> LIST;
      case "map", "object" -> MAP;
      case "id", "binary_id" -> ID;
      default -> throw new SchemaConfigurationException("Unknown field type '" + raw + "'");
    };
  }
}
