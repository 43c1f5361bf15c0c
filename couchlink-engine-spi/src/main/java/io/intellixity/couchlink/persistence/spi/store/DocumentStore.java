package io.intellixity.couchlink.persistence.spi.store;

import io.intellixity.couchlink.persistence.exec.ViewOptions;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Narrow view of the backing document store consumed by the engine.
 * <p>
 * Ids are passed unencoded ({@code "user/42"}); implementations encode them for transport. Every call is
 * blocking and bounded by the implementation's timeout. Failures other than absence raise
 * {@link StoreException}; nothing is retried.
 */
public interface DocumentStore {
  /** Fetch a document; empty when the store reports it missing. */
  Optional<Map<String, Object>> get(String id);

  /** Create ({@code rev == null}) or replace a document. A stale or missing revision is a conflict. */
  PutResult put(String id, Map<String, Object> body, String rev);

  /** Submit all documents in one request; one result per document in input order. */
  List<BulkResult> bulkPut(List<Map<String, Object>> docs);

  /** Batch lookup by id. Returns the raw {@code {"rows": [...]}} response. */
  Map<String, Object> allDocs(List<String> ids, boolean includeDocs);

  /** Selector query. {@code request} is the full body ({@code selector}, {@code fields}, {@code sort}, ...). */
  Map<String, Object> find(Map<String, Object> request);

  /** Key-ordered scan over {@code [startKey, endKey]}. Returns the raw {@code {"rows": [...]}} response. */
  Map<String, Object> rangeScan(String startKey, String endKey, Integer limit, Integer skip,
                                boolean descending, boolean includeDocs);

  /** Design-document view read. Returns the raw {@code {"rows": [...]}} response. */
  Map<String, Object> view(String design, String view, ViewOptions options);

  /** Delete the given revision of a document. */
  PutResult delete(String id, String rev);
}
