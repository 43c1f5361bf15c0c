package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.authoring.FieldType;
import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.authoring.SchemaRegistry;
import io.intellixity.couchlink.persistence.constraint.ConstraintReport;
import io.intellixity.couchlink.persistence.couch.constraint.ConstraintEngine;
import io.intellixity.couchlink.persistence.exec.BulkItemOutcome;
import io.intellixity.couchlink.persistence.exec.ViewOptions;
import io.intellixity.couchlink.persistence.exec.WriteOutcome;
import io.intellixity.couchlink.persistence.mapping.FieldSet;
import io.intellixity.couchlink.persistence.mapping.RowSet;
import io.intellixity.couchlink.persistence.query.Query;
import io.intellixity.couchlink.persistence.spi.exec.AbstractDataEngine;
import io.intellixity.couchlink.persistence.spi.exec.QueryValidationStrategy;
import io.intellixity.couchlink.persistence.spi.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * CouchDB backend engine over a {@link DocumentStore}.
 */
public final class CouchDataEngine extends AbstractDataEngine<CompiledQuery, CouchHandle> {
  private static final Logger log = LoggerFactory.getLogger(CouchDataEngine.class);
  private static final FieldSet VIEW_ROW_FIELDS = FieldSet.of(List.of("id", "key", "value"));

  private final DocumentStore store;
  private final ConstraintEngine constraints;
  private final DocumentWriter writer;

  public CouchDataEngine(CouchHandle handle,
                         SchemaRegistry schemas,
                         QueryValidationStrategy queryValidation,
                         ConstraintEngine constraints,
                         DocumentWriter writer) {
    super(Objects.requireNonNull(handle, "handle"), schemas, queryValidation);
    this.store = handle.client();
    this.constraints = Objects.requireNonNull(constraints, "constraints");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  public CouchDataEngine(CouchHandle handle, SchemaRegistry schemas) {
    this(handle, schemas, null, new ConstraintEngine(), new DocumentWriter());
  }

  /** Validates and compiles {@code query} for {@code type} without touching the store. */
  public CompiledQuery compile(String type, Query query) {
    SchemaDef schema = schema(type);
    Query effective = (query == null) ? new Query() : query;
    queryValidation().validate(schema, effective);
    return compile(schema, effective);
  }

  /** Projects a raw store response; see {@link CouchResultProjector}. */
  public RowSet project(Object raw, FieldSet fields, Map<String, FieldType> fieldMeta) {
    return CouchResultProjector.project(raw, fields, fieldMeta);
  }

  @Override
  protected CompiledQuery compile(SchemaDef schema, Query query) {
    return CouchQueryCompiler.compile(schema, query);
  }

  @Override
  protected Object executeQuery(SchemaDef schema, CompiledQuery compiled) {
    long start = System.nanoTime();
    debugOp("select", schema, kind(compiled));
    Object raw;
    if (compiled instanceof CompiledQuery.PointGet p) {
      // wrapped so a document field named "error" is never read as a store failure
      raw = store.get(p.id()).map(d -> (Object) Map.<String, Object>of("doc", d)).orElse(List.of());
    } else if (compiled instanceof CompiledQuery.BatchGet b) {
      raw = store.allDocs(b.ids(), true);
    } else if (compiled instanceof CompiledQuery.Selector s) {
      raw = store.find(s.toRequest());
    } else if (compiled instanceof CompiledQuery.RangeScan r) {
      raw = scanOwnRows(schema, r);
    } else {
      throw new IllegalArgumentException("Unsupported compiled query: " + compiled.getClass().getName());
    }
    debugDone("select", kind(compiled), raw, System.nanoTime() - start);
    return raw;
  }

  @Override
  protected RowSet projectRows(SchemaDef schema, Query query, Object rawResponse) {
    FieldSet fields = projection(schema, query);
    Map<String, FieldType> meta = schema.fields().isEmpty() ? null : schema.fields();
    return CouchResultProjector.project(rawResponse, fields, meta);
  }

  @Override
  protected Object executeView(SchemaDef schema, String design, String view, ViewOptions options) {
    long start = System.nanoTime();
    debugOp("view", schema, design + "/" + view);
    Map<String, Object> raw = store.view(design, view, options);
    debugDone("view", options.includeDocs() ? "docs" : "rows", raw, System.nanoTime() - start);
    return raw;
  }

  @Override
  protected RowSet projectView(SchemaDef schema, ViewOptions options, List<String> projection, Object rawResponse) {
    if (!options.includeDocs()) {
      FieldSet fields = (projection == null || projection.isEmpty()) ? VIEW_ROW_FIELDS : FieldSet.of(projection);
      return CouchResultProjector.project(rawResponse, fields, null);
    }
    return projectRows(schema, new Query().withProjection(projection), rawResponse);
  }

  @Override
  protected Object executeFind(SchemaDef schema, Map<String, Object> selector, List<String> fields) {
    long start = System.nanoTime();
    debugOp("find", schema, selector.keySet());
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("selector", selector);
    if (fields != null && !fields.isEmpty()) request.put("fields", fields);
    Map<String, Object> raw = store.find(request);
    debugDone("find", "Selector", raw, System.nanoTime() - start);
    return raw;
  }

  @Override
  protected ConstraintReport validateConstraints(SchemaDef schema, Map<String, Object> newFields,
                                                 Map<String, Object> prevFields) {
    return constraints.validate(store, schema, newFields, prevFields);
  }

  @Override
  protected ConstraintReport reserve(SchemaDef schema, ConstraintReport accepted) {
    debugOp("reserve", schema, accepted.pending().size());
    return constraints.reserve(store, accepted);
  }

  @Override
  protected Map<String, Object> loadCurrent(SchemaDef schema, String id) {
    return writer.loadCurrent(store, schema, id);
  }

  @Override
  protected WriteOutcome executeInsert(SchemaDef schema, Map<String, Object> fields, List<String> returning,
                                       ConstraintReport verdict) {
    long start = System.nanoTime();
    debugOp("insert", schema, fields.size());
    WriteOutcome out = writer.insert(store, schema, fields, returning, verdict);
    debugDone("insert", out.status(), null, System.nanoTime() - start);
    return out;
  }

  @Override
  protected WriteOutcome executeUpdate(SchemaDef schema, Map<String, Object> current, Map<String, Object> fields,
                                       List<String> returning, ConstraintReport verdict) {
    long start = System.nanoTime();
    debugOp("update", schema, fields.size());
    WriteOutcome out = writer.update(store, schema, current, fields, returning, verdict);
    debugDone("update", out.status(), null, System.nanoTime() - start);
    return out;
  }

  @Override
  protected List<BulkItemOutcome> executeBulkInsert(SchemaDef schema, List<Map<String, Object>> documents,
                                                    List<String> returning) {
    long start = System.nanoTime();
    debugOp("bulk_insert", schema, documents.size());
    List<BulkItemOutcome> out = writer.bulkInsert(store, schema, documents, returning);
    if (log.isDebugEnabled()) {
      long failed = out.stream().filter(o -> !o.ok()).count();
      debugDone("bulk_insert", "failed=" + failed, out, System.nanoTime() - start);
    }
    return out;
  }

  @Override
  protected boolean executeDelete(SchemaDef schema, String id) {
    debugOp("delete", schema, 1);
    return writer.delete(store, schema, id);
  }

  @Override
  protected long executeDeleteAll(SchemaDef schema) {
    long start = System.nanoTime();
    debugOp("delete_all", schema, null);
    long n = writer.deleteAll(store, schema);
    debugDone("delete_all", "deleted", n, System.nanoTime() - start);
    return n;
  }

  /** Default projection: store identity first, then declared fields in declaration order. */
  static FieldSet projection(SchemaDef schema, Query query) {
    if (query != null && !query.projection().isEmpty()) return FieldSet.of(query.projection());
    List<String> names = new ArrayList<>();
    names.add(SchemaDef.ID_FIELD);
    names.add(SchemaDef.REV_FIELD);
    for (String f : schema.fieldNames()) {
      if (!names.contains(f)) names.add(f);
    }
    return FieldSet.of(names);
  }

  /**
   * The namespace key range can also hold documents of another type, e.g. uniqueness markers whose source
   * equals the namespace. Pages through the range until {@code limit} rows carrying this namespace's
   * discriminator are collected; {@code skip} counts those rows only.
   */
  private Map<String, Object> scanOwnRows(SchemaDef schema, CompiledQuery.RangeScan r) {
    int pageSize = Math.max(r.limit(), CouchQueryCompiler.DEFAULT_SCAN_LIMIT);
    int toSkip = r.skip();
    int offset = 0;
    List<Object> kept = new ArrayList<>(r.limit());
    while (kept.size() < r.limit()) {
      Map<String, Object> page = store.rangeScan(r.startKey(), r.endKey(), pageSize, offset, r.descending(), true);
      if (page == null || !(page.get("rows") instanceof List<?> rows)) break;
      for (Object row : rows) {
        if (!isOwnRow(schema, row)) continue;
        if (toSkip > 0) {
          toSkip--;
          continue;
        }
        kept.add(row);
        if (kept.size() == r.limit()) break;
      }
      if (rows.size() < pageSize) break;
      offset += rows.size();
    }
    return Map.of("rows", kept);
  }

  private static boolean isOwnRow(SchemaDef schema, Object row) {
    return row instanceof Map<?, ?> m && m.get("doc") instanceof Map<?, ?> doc
        && schema.namespace().equals(doc.get(SchemaDef.TYPE_FIELD));
  }

  private static String kind(CompiledQuery q) {
    return q.getClass().getSimpleName();
  }

  private void debugOp(String op, SchemaDef schema, Object detail) {
    if (!log.isDebugEnabled()) return;
    CouchHandle h = handle();
    log.debug("couchlink.couch op={} namespace={} detail={} handleId={} database={}",
        op, schema.namespace(), detail, h.id(), h.database());
  }

  private void debugDone(String op, Object kind, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("couchlink.couch_done op={} kind={} durationMs={} result={}",
        op, kind, durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof Collection<?> c) return "size=" + c.size();
    if (r instanceof Map<?, ?> m) return "keys=" + m.keySet();
    return r.getClass().getSimpleName();
  }
}
