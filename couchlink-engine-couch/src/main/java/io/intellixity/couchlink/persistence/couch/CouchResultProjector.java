package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.authoring.FieldType;
import io.intellixity.couchlink.persistence.mapping.FieldSet;
import io.intellixity.couchlink.persistence.mapping.RowAdapter;
import io.intellixity.couchlink.persistence.mapping.RowAdapters;
import io.intellixity.couchlink.persistence.mapping.RowSet;
import io.intellixity.couchlink.persistence.spi.store.StoreException;

import java.util.*;

/**
 * Shapes raw store responses into fixed-arity rows.
 * <p>
 * Accepted shapes: {@code {"rows": [...]}} (each row's {@code doc} is used), {@code {"docs": [...]}},
 * a plain list of documents, {@code {"doc": {...}}} and a bare document. Empty variants, including
 * {@code {"bookmark": ..., "docs": []}}, project to {@link RowSet#EMPTY}.
 */
public final class CouchResultProjector {
  private CouchResultProjector() {}

  /**
   * @param raw store response
   * @param fields projected fields in output order
   * @param fieldMeta semantic field types; when non-null every missing field is synthesized from its zero value
   */
  public static RowSet project(Object raw, FieldSet fields, Map<String, FieldType> fieldMeta) {
    Objects.requireNonNull(fields, "fields");
    List<Map<String, Object>> docs = documents(raw);
    if (docs.isEmpty()) return RowSet.EMPTY;

    List<List<Object>> rows = new ArrayList<>(docs.size());
    for (Map<String, Object> doc : docs) rows.add(row(RowAdapters.fromMap(doc), fields, fieldMeta));
    return RowSet.of(rows);
  }

  private static List<Object> row(RowAdapter doc, FieldSet fields, Map<String, FieldType> fieldMeta) {
    List<Object> row = new ArrayList<>(fields.size());
    for (String name : fields.names()) {
      if (doc.has(name)) {
        row.add(doc.raw(name));
      } else if (fieldMeta != null && fieldMeta.containsKey(name)) {
        row.add(fieldMeta.get(name).zeroValue());
      } else {
        row.add(fields.defaultFor(name));
      }
    }
    return row;
  }

  @SuppressWarnings("unchecked")
  static List<Map<String, Object>> documents(Object raw) {
    if (raw == null) return List.of();
    if (raw instanceof List<?> list) return asDocuments(list);
    if (!(raw instanceof Map<?, ?> m)) {
      throw new StoreException(-1, "bad_response", "unexpected response type " + raw.getClass().getName());
    }
    Map<String, Object> map = (Map<String, Object>) m;
    if (StoreException.isErrorPayload(map)) throw StoreException.fromPayload(-1, map);

    if (map.containsKey("rows")) return rowDocuments(map.get("rows"));
    if (map.containsKey("docs")) {
      Object docs = map.get("docs");
      return (docs instanceof List<?> l) ? asDocuments(l) : List.of();
    }
    if (map.containsKey("doc")) {
      Object doc = map.get("doc");
      return (doc instanceof Map<?, ?> d) ? List.of((Map<String, Object>) d) : List.of();
    }
    return map.isEmpty() ? List.of() : List.of(map);
  }

  /** Rows of a key lookup: missing keys and deleted documents carry no {@code doc} and are dropped. */
  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> rowDocuments(Object rows) {
    if (!(rows instanceof List<?> list)) return List.of();
    List<Map<String, Object>> out = new ArrayList<>(list.size());
    for (Object r : list) {
      if (!(r instanceof Map<?, ?> row) || row.containsKey("error")) continue;
      if (row.containsKey("doc")) {
        if (row.get("doc") instanceof Map<?, ?> doc) out.add((Map<String, Object>) doc);
      } else {
        // view rows without include_docs
        out.add((Map<String, Object>) row);
      }
    }
    return out;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> asDocuments(List<?> list) {
    List<Map<String, Object>> out = new ArrayList<>(list.size());
    for (Object o : list) {
      if (o instanceof Map<?, ?> d) out.add((Map<String, Object>) d);
    }
    return out;
  }
}
