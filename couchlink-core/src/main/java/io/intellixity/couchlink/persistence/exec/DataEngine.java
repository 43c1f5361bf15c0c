package io.intellixity.couchlink.persistence.exec;

import io.intellixity.couchlink.persistence.constraint.ConstraintReport;
import io.intellixity.couchlink.persistence.exec.handle.EngineHandle;
import io.intellixity.couchlink.persistence.mapping.RowSet;
import io.intellixity.couchlink.persistence.query.Query;

import java.util.List;
import java.util.Map;

public interface DataEngine<H extends EngineHandle<?>> {
  /** Returns the engine handle used by this instance. */
  H handle();

  /** Runs a query for {@code type} and returns fixed-arity rows in projection order. */
  RowSet select(String type, Query query);

  /**
   * Reads the design-document view {@code design/view}. With {@link ViewOptions#includeDocs()} rows are projected
   * from the emitting documents (default projection as in {@link #select}); otherwise from the raw view rows
   * ({@code id}, {@code key}, {@code value}).
   */
  RowSet view(String type, String design, String view, ViewOptions options, List<String> projection);

  /**
   * Runs a caller-built selector as is. Unlike {@link #select} the selector is not scoped to the type's
   * namespace; {@code type} only drives projection.
   */
  RowSet find(String type, Map<String, Object> selector, List<String> fields);

  /** Evaluates every declared constraint of {@code type} without writing anything. */
  ConstraintReport validate(String type, Map<String, Object> newFields, Map<String, Object> prevFields);

  /** Insert a new document. Constraint violations are reported in the outcome, never partially applied. */
  WriteOutcome insert(String type, Map<String, Object> fields, List<String> returning);

  /** Merge {@code fields} into the stored document {@code id} and write it as a new revision. */
  WriteOutcome update(String type, String id, Map<String, Object> fields, List<String> returning);

  /** Insert in one batch; one outcome per document, in input order. */
  List<BulkItemOutcome> bulkInsert(String type, List<Map<String, Object>> documents, List<String> returning);

  /** Delete a document by id. Returns false when it does not exist. */
  boolean delete(String type, String id);

  /** Delete every document of the namespace. Returns the number of documents tombstoned. */
  long deleteAll(String type);
}
