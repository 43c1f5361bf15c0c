package io.intellixity.couchlink.persistence.spi.exec;

import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.authoring.SchemaRegistry;
import io.intellixity.couchlink.persistence.constraint.ConstraintReport;
import io.intellixity.couchlink.persistence.exec.BulkItemOutcome;
import io.intellixity.couchlink.persistence.exec.DataEngine;
import io.intellixity.couchlink.persistence.exec.ViewOptions;
import io.intellixity.couchlink.persistence.exec.WriteOutcome;
import io.intellixity.couchlink.persistence.exec.handle.EngineHandle;
import io.intellixity.couchlink.persistence.mapping.RowSet;
import io.intellixity.couchlink.persistence.query.Query;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method orchestrator for persistence operations.\n
 *
 * Responsibilities:\n
 * - Resolve the schema and validate queries via {@link QueryValidationStrategy}\n
 * - Compile queries into the backend form {@code Q}, execute, and project rows\n
 * - Run constraint validation to completion, then reserve, then write\n
 *
 * Engines hold no mutable state: everything a call needs is the bound handle plus its arguments.
 */
public abstract class AbstractDataEngine<Q, H extends EngineHandle<?>> implements DataEngine<H> {
  private final H handle;
  private final SchemaRegistry schemas;
  private final QueryValidationStrategy queryValidation;

  protected AbstractDataEngine(H handle, SchemaRegistry schemas, QueryValidationStrategy queryValidation) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
  }

  protected AbstractDataEngine(H handle, SchemaRegistry schemas) {
    this(handle, schemas, new DefaultQueryValidationStrategy());
  }

  /** Backend-specific query compilation. Pure: no store access. */
  protected abstract Q compile(SchemaDef schema, Query query);

  /** Runs a compiled query and returns the raw store response. */
  protected abstract Object executeQuery(SchemaDef schema, Q compiled);

  /** Shapes a raw store response into rows for the query's projection. */
  protected abstract RowSet projectRows(SchemaDef schema, Query query, Object rawResponse);

  /** Reads a design-document view and returns the raw store response. */
  protected abstract Object executeView(SchemaDef schema, String design, String view, ViewOptions options);

  /** Shapes a raw view response; rows come from documents only when {@code options.includeDocs()}. */
  protected abstract RowSet projectView(SchemaDef schema, ViewOptions options, List<String> projection,
                                        Object rawResponse);

  /** Runs a caller-built selector and returns the raw store response. */
  protected abstract Object executeFind(SchemaDef schema, Map<String, Object> selector, List<String> fields);

  /** Read-only evaluation of every declared constraint. */
  protected abstract ConstraintReport validateConstraints(SchemaDef schema, Map<String, Object> newFields,
                                                          Map<String, Object> prevFields);

  /** Persists pending reservations of an accepted report; may turn a lost race into a violation. */
  protected abstract ConstraintReport reserve(SchemaDef schema, ConstraintReport accepted);

  /** Loads the stored document a write will be merged into. */
  protected abstract Map<String, Object> loadCurrent(SchemaDef schema, String id);

  protected abstract WriteOutcome executeInsert(SchemaDef schema, Map<String, Object> fields,
                                                List<String> returning, ConstraintReport verdict);

  protected abstract WriteOutcome executeUpdate(SchemaDef schema, Map<String, Object> current,
                                                Map<String, Object> fields, List<String> returning,
                                                ConstraintReport verdict);

  protected abstract List<BulkItemOutcome> executeBulkInsert(SchemaDef schema, List<Map<String, Object>> documents,
                                                             List<String> returning);

  protected abstract boolean executeDelete(SchemaDef schema, String id);

  protected abstract long executeDeleteAll(SchemaDef schema);

  @Override
  public final H handle() { return handle; }
  protected final SchemaRegistry schemas() { return schemas; }
  protected QueryValidationStrategy queryValidation() { return queryValidation; }

  protected final SchemaDef schema(String type) {
    return schemas.getSchema(Objects.requireNonNull(type, "type"));
  }

  // --- Reads ---

  @Override
  public final RowSet select(String type, Query query) {
    SchemaDef schema = schema(type);
    Query effective = (query == null) ? new Query() : query;
    queryValidation.validate(schema, effective);
    Q compiled = compile(schema, effective);
    Object raw = executeQuery(schema, compiled);
    return projectRows(schema, effective, raw);
  }

  @Override
  public final RowSet view(String type, String design, String view, ViewOptions options, List<String> projection) {
    SchemaDef schema = schema(type);
    ViewOptions effective = (options == null) ? ViewOptions.DEFAULTS : options;
    Object raw = executeView(schema, requireName(design, "design"), requireName(view, "view"), effective);
    return projectView(schema, effective, projection, raw);
  }

  @Override
  public final RowSet find(String type, Map<String, Object> selector, List<String> fields) {
    SchemaDef schema = schema(type);
    Objects.requireNonNull(selector, "selector");
    Object raw = executeFind(schema, selector, fields);
    return projectRows(schema, new Query().withProjection(fields), raw);
  }

  @Override
  public final ConstraintReport validate(String type, Map<String, Object> newFields, Map<String, Object> prevFields) {
    return validateConstraints(schema(type), Objects.requireNonNull(newFields, "newFields"), prevFields);
  }

  // --- Writes ---

  @Override
  public final WriteOutcome insert(String type, Map<String, Object> fields, List<String> returning) {
    SchemaDef schema = schema(type);
    Objects.requireNonNull(fields, "fields");
    ConstraintReport report = validateConstraints(schema, fields, null);
    WriteOutcome rejected = rejection(report);
    if (rejected != null) return rejected;

    ConstraintReport reserved = reserve(schema, report);
    rejected = rejection(reserved);
    if (rejected != null) return rejected;
    return executeInsert(schema, fields, returning, reserved);
  }

  @Override
  public final WriteOutcome update(String type, String id, Map<String, Object> fields, List<String> returning) {
    SchemaDef schema = schema(type);
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(fields, "fields");
    Map<String, Object> current = loadCurrent(schema, id);
    ConstraintReport report = validateConstraints(schema, fields, current);
    WriteOutcome rejected = rejection(report);
    if (rejected != null) return rejected;

    ConstraintReport reserved = reserve(schema, report);
    rejected = rejection(reserved);
    if (rejected != null) return rejected;
    return executeUpdate(schema, current, fields, returning, reserved);
  }

  @Override
  public final List<BulkItemOutcome> bulkInsert(String type, List<Map<String, Object>> documents, List<String> returning) {
    SchemaDef schema = schema(type);
    if (documents == null || documents.isEmpty()) return List.of();
    return executeBulkInsert(schema, documents, returning);
  }

  @Override
  public final boolean delete(String type, String id) {
    return executeDelete(schema(type), Objects.requireNonNull(id, "id"));
  }

  @Override
  public final long deleteAll(String type) {
    return executeDeleteAll(schema(type));
  }

  private static String requireName(String name, String what) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException(what + " name is required");
    return name;
  }

  /** Invalid verdicts win over lookup errors: callers get every violated constraint in one response. */
  private static WriteOutcome rejection(ConstraintReport report) {
    if (!report.violations().isEmpty()) return WriteOutcome.invalid(report.violations());
    if (!report.errors().isEmpty()) return WriteOutcome.error(report.errors());
    return null;
  }
}
