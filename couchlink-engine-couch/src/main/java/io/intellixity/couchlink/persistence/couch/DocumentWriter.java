package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.constraint.ConstraintReport;
import io.intellixity.couchlink.persistence.exec.BulkItemOutcome;
import io.intellixity.couchlink.persistence.exec.WriteOutcome;
import io.intellixity.couchlink.persistence.naming.Namespacer;
import io.intellixity.couchlink.persistence.spi.store.*;

import java.util.*;

/**
 * Turns caller field maps into stored documents.\n
 *
 * Single-document writes require a settled {@link ConstraintReport}: the constraint phase must have run to
 * completion (markers reserved) before anything reaches the store.
 */
public final class DocumentWriter {
  /** Page size of the namespace scan used by {@link #deleteAll}. */
  static final int DELETE_PAGE_SIZE = 100;

  public WriteOutcome insert(DocumentStore store,
                             SchemaDef schema,
                             Map<String, Object> fields,
                             List<String> returning,
                             ConstraintReport verdict) {
    requireSettled(verdict);
    Map<String, Object> doc = prepareInsert(schema, fields);
    String id = (String) doc.get(SchemaDef.ID_FIELD);
    try {
      PutResult r = store.put(id, doc, null);
      return WriteOutcome.ok(returningValues(schema, doc, r.id(), r.rev(), returning));
    } catch (StoreException e) {
      return WriteOutcome.error(List.of(e.getMessage()));
    }
  }

  /**
   * Merges {@code fields} over {@code current} and writes the result under the current revision.
   * Identity fields ({@code _id}, {@code _rev}, {@code type}) always come from the stored document.
   */
  public WriteOutcome update(DocumentStore store,
                             SchemaDef schema,
                             Map<String, Object> current,
                             Map<String, Object> fields,
                             List<String> returning,
                             ConstraintReport verdict) {
    requireSettled(verdict);
    Objects.requireNonNull(current, "current");
    String id = String.valueOf(current.get(SchemaDef.ID_FIELD));
    Object rev = current.get(SchemaDef.REV_FIELD);

    Map<String, Object> merged = new LinkedHashMap<>(current);
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      if (!SchemaDef.isReservedField(e.getKey())) merged.put(e.getKey(), e.getValue());
    }
    merged.put(SchemaDef.TYPE_FIELD, schema.namespace());
    try {
      PutResult r = store.put(id, merged, rev == null ? null : String.valueOf(rev));
      return WriteOutcome.ok(returningValues(schema, merged, r.id(), r.rev(), returning));
    } catch (StoreException e) {
      return WriteOutcome.error(List.of(e.getMessage()));
    }
  }

  /**
   * One batch request; one outcome per input document in input order. A failed document (e.g. an id
   * collision) never affects its siblings. Constraints are not evaluated for batches.
   */
  public List<BulkItemOutcome> bulkInsert(DocumentStore store,
                                          SchemaDef schema,
                                          List<Map<String, Object>> documents,
                                          List<String> returning) {
    List<Map<String, Object>> prepared = new ArrayList<>(documents.size());
    for (Map<String, Object> d : documents) prepared.add(prepareInsert(schema, d));

    List<BulkResult> results = store.bulkPut(prepared);
    if (results == null || results.size() != prepared.size()) {
      throw new StoreException(-1, "bad_response",
          "bulk write returned " + (results == null ? 0 : results.size()) + " results for " + prepared.size() + " documents");
    }

    List<BulkItemOutcome> out = new ArrayList<>(prepared.size());
    for (int i = 0; i < prepared.size(); i++) {
      Map<String, Object> doc = prepared.get(i);
      BulkResult r = results.get(i);
      String id = (String) doc.get(SchemaDef.ID_FIELD);
      if (r.id() != null && !r.id().equals(id)) {
        throw new StoreException(-1, "bad_response", "bulk write result " + i + " does not match its document");
      }
      Map<String, Object> values = returningValues(schema, doc, id, r.rev(), returning);
      out.add(new BulkItemOutcome(i, id, r.rev(), r.error(), r.reason(), values));
    }
    return out;
  }

  /** Stored document for a local id; raises {@link DocumentNotFoundException} when absent. */
  public Map<String, Object> loadCurrent(DocumentStore store, SchemaDef schema, String id) {
    String qualified = Namespacer.qualify(schema.namespace(), id);
    return store.get(qualified).orElseThrow(() -> new DocumentNotFoundException(qualified));
  }

  public boolean delete(DocumentStore store, SchemaDef schema, String id) {
    String qualified = Namespacer.qualify(schema.namespace(), id);
    Optional<Map<String, Object>> current = store.get(qualified);
    if (current.isEmpty()) return false;
    Object rev = current.get().get(SchemaDef.REV_FIELD);
    store.delete(qualified, rev == null ? null : String.valueOf(rev));
    return true;
  }

  /**
   * Tombstones every document of the namespace, page by page. Rows of the scan that belong to another type
   * (marker documents share the key range when source equals namespace) are skipped, not deleted.
   */
  public long deleteAll(DocumentStore store, SchemaDef schema) {
    String ns = schema.namespace();
    String start = ns;
    String end = ns + CouchQueryCompiler.RANGE_END_SUFFIX;
    long deleted = 0;
    int skip = 0;
    while (true) {
      Map<String, Object> page = store.rangeScan(start, end, DELETE_PAGE_SIZE, skip, false, true);
      List<Map<String, Object>> docs = CouchResultProjector.documents(page);
      if (docs.isEmpty()) break;

      List<Map<String, Object>> tombstones = new ArrayList<>();
      for (Map<String, Object> d : docs) {
        if (!ns.equals(d.get(SchemaDef.TYPE_FIELD))) continue;
        Map<String, Object> t = new LinkedHashMap<>();
        t.put(SchemaDef.ID_FIELD, d.get(SchemaDef.ID_FIELD));
        t.put(SchemaDef.REV_FIELD, d.get(SchemaDef.REV_FIELD));
        t.put("_deleted", true);
        tombstones.add(t);
      }
      int removed = 0;
      if (!tombstones.isEmpty()) {
        for (BulkResult r : store.bulkPut(tombstones)) {
          if (r.ok()) removed++;
        }
      }
      Object rows = page.get("rows");
      int pageRows = (rows instanceof List<?> l) ? l.size() : docs.size();
      deleted += removed;
      // whatever is still in the range sits in front of the next page
      skip += pageRows - removed;
      if (pageRows < DELETE_PAGE_SIZE) break;
    }
    return deleted;
  }

  Map<String, Object> prepareInsert(SchemaDef schema, Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields");
    String ns = schema.namespace();
    Object local = fields.get(schema.primaryKey());
    if (local == null) local = fields.get(SchemaDef.ID_FIELD);
    String localId = (local == null) ? UUID.randomUUID().toString() : String.valueOf(local);

    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put(SchemaDef.ID_FIELD, Namespacer.qualify(ns, localId));
    doc.put(SchemaDef.TYPE_FIELD, ns);
    for (Map.Entry<String, Object> e : fields.entrySet()) {
      if (!SchemaDef.isReservedField(e.getKey())) doc.put(e.getKey(), e.getValue());
    }
    if (!SchemaDef.ID_FIELD.equals(schema.primaryKey())) {
      Object own = fields.get(schema.primaryKey());
      doc.put(schema.primaryKey(), (own == null) ? localId : own);
    }
    return doc;
  }

  /** Requested return fields in request order; {@code _id}/{@code _rev} come from the store result. */
  static Map<String, Object> returningValues(SchemaDef schema,
                                             Map<String, Object> doc,
                                             String id,
                                             String rev,
                                             List<String> returning) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (returning == null) return out;
    for (String name : returning) {
      if (SchemaDef.ID_FIELD.equals(name)) out.put(name, id);
      else if (SchemaDef.REV_FIELD.equals(name)) out.put(name, rev);
      else if (schema.primaryKey().equals(name)) out.put(name, Namespacer.unqualify(schema.namespace(), id));
      else out.put(name, doc.get(name));
    }
    return out;
  }

  private static void requireSettled(ConstraintReport verdict) {
    if (verdict == null || !verdict.settled()) {
      throw new IllegalStateException("document write requires a settled constraint verdict");
    }
  }
}
