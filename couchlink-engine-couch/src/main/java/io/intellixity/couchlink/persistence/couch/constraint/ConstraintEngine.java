package io.intellixity.couchlink.persistence.couch.constraint;

import io.intellixity.couchlink.persistence.authoring.ForeignKeyConstraint;
import io.intellixity.couchlink.persistence.authoring.SchemaConfigurationException;
import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.authoring.UniqueConstraint;
import io.intellixity.couchlink.persistence.constraint.ConstraintKind;
import io.intellixity.couchlink.persistence.constraint.ConstraintReport;
import io.intellixity.couchlink.persistence.constraint.ConstraintResult;
import io.intellixity.couchlink.persistence.naming.Namespacer;
import io.intellixity.couchlink.persistence.spi.store.DocumentStore;
import io.intellixity.couchlink.persistence.spi.store.PutResult;
import io.intellixity.couchlink.persistence.spi.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Emulates uniqueness and referential integrity on a store that has neither.\n
 *
 * Uniqueness is tracked by marker documents at {@code "<source>-<v1>-<v2>..."}; a marker's presence means
 * the value combination is taken. Foreign keys are checked by probing {@code "<target>/<value>"}.\n
 *
 * {@link #validate} only reads. {@link #reserve} writes the markers of an accepted report; a marker that
 * already exists at that point means a concurrent writer won, and is reported as a unique violation.
 */
public final class ConstraintEngine {
  private static final Logger log = LoggerFactory.getLogger(ConstraintEngine.class);

  public static final String MARKER_TYPE = "constraint";
  static final String MARKER_SEPARATOR = "-";

  /**
   * @param newFields fields being written
   * @param prevFields stored document on update, null on insert
   */
  public ConstraintReport validate(DocumentStore store,
                                   SchemaDef schema,
                                   Map<String, Object> newFields,
                                   Map<String, Object> prevFields) {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(newFields, "newFields");
    if (schema.constraints().isEmpty()) return ConstraintReport.EMPTY;

    List<ConstraintResult> results = new ArrayList<>();
    for (UniqueConstraint u : schema.constraints().unique()) {
      results.add(checkUnique(store, schema, u, newFields, prevFields));
    }
    for (ForeignKeyConstraint fk : schema.constraints().foreignKeys()) {
      results.add(checkForeignKey(store, fk, newFields));
    }
    return new ConstraintReport(results);
  }

  /**
   * Writes one marker per pending result. Returns the report with every pending entry turned into
   * {@code ok}, or into {@code invalid}/{@code error} when its marker could not be written. Markers written
   * by this call are released again when a later one fails.
   *
   * @throws IllegalStateException when {@code report} is not accepted
   */
  public ConstraintReport reserve(DocumentStore store, ConstraintReport report) {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(report, "report");
    if (!report.accepted()) {
      throw new IllegalStateException("cannot reserve markers for a rejected constraint report");
    }
    if (report.pending().isEmpty()) return report;

    List<ConstraintResult> out = new ArrayList<>(report.results().size());
    List<PutResult> written = new ArrayList<>();
    boolean failed = false;
    for (ConstraintResult r : report.results()) {
      if (!(r instanceof ConstraintResult.Pending p) || failed) {
        out.add(r);
        continue;
      }
      try {
        written.add(store.put(p.markerId(), markerDocument(p.markerId()), null));
        out.add(ConstraintResult.ok(p.constraint()));
      } catch (StoreException e) {
        failed = true;
        out.add(e.isConflict()
            ? ConstraintResult.invalid(ConstraintKind.UNIQUE, p.constraint(), p.markerId())
            : ConstraintResult.error(p.constraint(), e.getMessage()));
      }
    }
    if (failed) release(store, written);
    return new ConstraintReport(out);
  }

  /** Marker id for {@code constraint}; fails when any composing field is absent or null. */
  public static String markerId(String source, UniqueConstraint constraint, Map<String, Object> values) {
    List<String> parts = new ArrayList<>(constraint.fields().size());
    List<String> missing = new ArrayList<>();
    for (String f : constraint.fields()) {
      Object v = (values == null) ? null : values.get(f);
      if (v == null) missing.add(f);
      else parts.add(String.valueOf(v));
    }
    if (!missing.isEmpty()) {
      throw new SchemaConfigurationException("All fields of unique constraint '" + constraint.name()
          + "' are required; missing " + missing);
    }
    return source + MARKER_SEPARATOR + String.join(MARKER_SEPARATOR, parts);
  }

  static Map<String, Object> markerDocument(String markerId) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put(SchemaDef.ID_FIELD, markerId);
    doc.put(SchemaDef.TYPE_FIELD, MARKER_TYPE);
    return doc;
  }

  private ConstraintResult checkUnique(DocumentStore store,
                                       SchemaDef schema,
                                       UniqueConstraint u,
                                       Map<String, Object> newFields,
                                       Map<String, Object> prevFields) {
    Map<String, Object> effective = new LinkedHashMap<>();
    if (prevFields != null) effective.putAll(prevFields);
    effective.putAll(newFields);
    String marker = markerId(schema.source(), u, effective);

    if (prevFields != null && marker.equals(previousMarker(schema.source(), u, prevFields))) {
      return ConstraintResult.ok(u.name());
    }

    try {
      return store.get(marker).isPresent()
          ? ConstraintResult.invalid(ConstraintKind.UNIQUE, u.name(), marker)
          : ConstraintResult.pending(u.name(), marker);
    } catch (StoreException e) {
      debugLookupFailed("unique", u.name(), e);
      return ConstraintResult.error(u.name(), e.getMessage());
    }
  }

  private static String previousMarker(String source, UniqueConstraint u, Map<String, Object> prevFields) {
    for (String f : u.fields()) {
      if (prevFields.get(f) == null) return null;
    }
    return markerId(source, u, prevFields);
  }

  private ConstraintResult checkForeignKey(DocumentStore store, ForeignKeyConstraint fk, Map<String, Object> newFields) {
    Object ref = newFields.get(fk.field());
    if (ref == null) return ConstraintResult.ok(fk.name());

    String id = Namespacer.qualify(fk.target(), String.valueOf(ref));
    try {
      return store.get(id).isPresent()
          ? ConstraintResult.ok(fk.name())
          : ConstraintResult.invalid(ConstraintKind.FOREIGN_KEY, fk.name(), id);
    } catch (StoreException e) {
      debugLookupFailed("foreign_key", fk.name(), e);
      return ConstraintResult.error(fk.name(), e.getMessage());
    }
  }

  private static void release(DocumentStore store, List<PutResult> written) {
    for (PutResult m : written) {
      try {
        store.delete(m.id(), m.rev());
      } catch (StoreException e) {
        // an orphaned marker only blocks its own value combination until removed
        log.warn("couchlink.constraint op=release_marker status=failed error={}", e.error(), e);
      }
    }
  }

  private static void debugLookupFailed(String kind, String constraint, StoreException e) {
    if (!log.isDebugEnabled()) return;
    log.debug("couchlink.constraint op=lookup kind={} constraint={} status={} error={}",
        kind, constraint, e.status(), e.error());
  }
}
