package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.exec.ViewOptions;
import io.intellixity.couchlink.persistence.spi.store.*;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered in-memory {@link DocumentStore} for tests.\n
 *
 * Keys are compared by UTF-16 code unit, which for ASCII ids matches the raw collation of the CouchDB
 * {@code _all_docs} index. Revisions are {@code "<n>-mem"}; writes with a stale or missing revision conflict.
 * Selector support covers what the compiler emits: plain equality, comparison operators, {@code $in},
 * {@code $and} and {@code $or}. Views emit one string key per document (or none) with a null value.
 */
public final class InMemoryDocumentStore implements DocumentStore {
  private final TreeMap<String, Map<String, Object>> docs = new TreeMap<>();
  private final List<String> calls = new ArrayList<>();
  private Predicate<String> failingGets = id -> false;
  private Predicate<String> failingPuts = id -> false;
  private final Map<String, Function<Map<String, Object>, String>> views = new HashMap<>();
  private Map<String, Object> lastFind;

  /** Stores {@code doc} as revision 1, bypassing conflict checks. */
  public InMemoryDocumentStore seed(String id, Map<String, Object> doc) {
    Map<String, Object> copy = new LinkedHashMap<>(doc);
    copy.put("_id", id);
    copy.put("_rev", "1-mem");
    docs.put(id, copy);
    return this;
  }

  /** Defines {@code design/view}; {@code keyOf} returns the emitted key, or null to emit nothing. */
  public InMemoryDocumentStore defineView(String design, String view, Function<Map<String, Object>, String> keyOf) {
    views.put(design + "/" + view, keyOf);
    return this;
  }

  public InMemoryDocumentStore failGets(Predicate<String> ids) {
    this.failingGets = ids;
    return this;
  }

  public InMemoryDocumentStore failPuts(Predicate<String> ids) {
    this.failingPuts = ids;
    return this;
  }

  public List<String> calls() { return calls; }
  public Map<String, Object> lastFind() { return lastFind; }
  public boolean contains(String id) { return docs.containsKey(id); }
  public Map<String, Object> doc(String id) { return docs.get(id); }
  public int size() { return docs.size(); }

  @Override
  public Optional<Map<String, Object>> get(String id) {
    calls.add("get " + id);
    if (failingGets.test(id)) throw new StoreException(-1, "timeout", "get " + id + " timed out");
    Map<String, Object> d = docs.get(id);
    return (d == null) ? Optional.empty() : Optional.of(new LinkedHashMap<>(d));
  }

  @Override
  public PutResult put(String id, Map<String, Object> body, String rev) {
    calls.add("put " + id);
    if (failingPuts.test(id)) throw new StoreException(500, "internal_server_error", "put " + id + " failed");
    String next = write(id, body, rev);
    if (next == null) throw new StoreException(409, "conflict", "Document update conflict.");
    return new PutResult(id, next);
  }

  @Override
  public List<BulkResult> bulkPut(List<Map<String, Object>> batch) {
    calls.add("bulk " + batch.size());
    List<BulkResult> out = new ArrayList<>();
    for (Map<String, Object> d : batch) {
      String id = String.valueOf(d.get("_id"));
      Object rev = d.get("_rev");
      if (Boolean.TRUE.equals(d.get("_deleted"))) {
        Map<String, Object> cur = docs.get(id);
        if (cur == null || !Objects.equals(cur.get("_rev"), rev)) {
          out.add(BulkResult.failed(id, "conflict", "Document update conflict."));
        } else {
          docs.remove(id);
          out.add(BulkResult.ok(id, nextRev(String.valueOf(rev))));
        }
        continue;
      }
      String next = write(id, d, rev == null ? null : String.valueOf(rev));
      out.add(next == null ? BulkResult.failed(id, "conflict", "Document update conflict.") : BulkResult.ok(id, next));
    }
    return out;
  }

  @Override
  public Map<String, Object> allDocs(List<String> ids, boolean includeDocs) {
    calls.add("all_docs " + ids.size());
    List<Object> rows = new ArrayList<>();
    for (String id : ids) {
      Map<String, Object> d = docs.get(id);
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("key", id);
      if (d == null) {
        row.put("error", "not_found");
      } else {
        row.put("id", id);
        row.put("value", Map.of("rev", d.get("_rev")));
        if (includeDocs) row.put("doc", new LinkedHashMap<>(d));
      }
      rows.add(row);
    }
    return Map.of("rows", rows);
  }

  @Override
  @SuppressWarnings("unchecked")
  public Map<String, Object> find(Map<String, Object> request) {
    calls.add("find");
    lastFind = request;
    Map<String, Object> selector = (Map<String, Object>) request.get("selector");
    List<Object> found = new ArrayList<>();
    for (Map<String, Object> d : docs.values()) {
      if (matches(d, selector)) found.add(new LinkedHashMap<>(d));
    }
    Object limit = request.get("limit");
    if (limit instanceof Integer n && found.size() > n) found = found.subList(0, n);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("docs", found);
    out.put("bookmark", "nil");
    return out;
  }

  @Override
  public Map<String, Object> rangeScan(String startKey, String endKey, Integer limit, Integer skip,
                                       boolean descending, boolean includeDocs) {
    calls.add("scan " + startKey + ".." + endKey + (descending ? " desc" : ""));
    NavigableMap<String, Map<String, Object>> range;
    if (descending) {
      range = (startKey.compareTo(endKey) < 0)
          ? new TreeMap<>()
          : docs.subMap(endKey, true, startKey, true).descendingMap();
    } else {
      range = (startKey.compareTo(endKey) > 0) ? new TreeMap<>() : docs.subMap(startKey, true, endKey, true);
    }
    List<Object> rows = new ArrayList<>();
    int toSkip = (skip == null) ? 0 : skip;
    for (Map.Entry<String, Map<String, Object>> e : range.entrySet()) {
      if (toSkip-- > 0) continue;
      if (limit != null && rows.size() >= limit) break;
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("id", e.getKey());
      row.put("key", e.getKey());
      row.put("value", Map.of("rev", e.getValue().get("_rev")));
      if (includeDocs) row.put("doc", new LinkedHashMap<>(e.getValue()));
      rows.add(row);
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("total_rows", docs.size());
    out.put("rows", rows);
    return out;
  }

  @Override
  public Map<String, Object> view(String design, String view, ViewOptions options) {
    calls.add("view " + design + "/" + view);
    Function<Map<String, Object>, String> keyOf = views.get(design + "/" + view);
    if (keyOf == null) throw new StoreException(404, "not_found", "missing_named_view");

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> d : docs.values()) {
      String key = keyOf.apply(d);
      if (key == null || !inView(key, options)) continue;
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("id", d.get("_id"));
      row.put("key", key);
      row.put("value", null);
      if (options.includeDocs()) row.put("doc", new LinkedHashMap<>(d));
      rows.add(row);
    }
    Comparator<Map<String, Object>> order = Comparator.comparing((Map<String, Object> r) -> (String) r.get("key"))
        .thenComparing(r -> (String) r.get("id"));
    rows.sort(options.descending() ? order.reversed() : order);

    int from = Math.min(options.skip() == null ? 0 : options.skip(), rows.size());
    int to = (options.limit() == null) ? rows.size() : Math.min(rows.size(), from + options.limit());
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("total_rows", rows.size());
    out.put("offset", from);
    out.put("rows", new ArrayList<>(rows.subList(from, to)));
    return out;
  }

  private static boolean inView(String key, ViewOptions o) {
    if (o.key() != null) return key.equals(o.key());
    String low = (String) (o.descending() ? o.endKey() : o.startKey());
    String high = (String) (o.descending() ? o.startKey() : o.endKey());
    return (low == null || key.compareTo(low) >= 0) && (high == null || key.compareTo(high) <= 0);
  }

  @Override
  public PutResult delete(String id, String rev) {
    calls.add("delete " + id);
    Map<String, Object> cur = docs.get(id);
    if (cur == null) throw new DocumentNotFoundException(id);
    if (!Objects.equals(cur.get("_rev"), rev)) throw new StoreException(409, "conflict", "Document update conflict.");
    docs.remove(id);
    return new PutResult(id, nextRev(rev));
  }

  /** Returns the new revision, or null on conflict. */
  private String write(String id, Map<String, Object> body, String rev) {
    Map<String, Object> cur = docs.get(id);
    if (cur == null && rev != null) return null;
    if (cur != null && !Objects.equals(cur.get("_rev"), rev)) return null;
    String next = (cur == null) ? "1-mem" : nextRev(rev);
    Map<String, Object> stored = new LinkedHashMap<>(body);
    stored.put("_id", id);
    stored.put("_rev", next);
    docs.put(id, stored);
    return next;
  }

  private static String nextRev(String rev) {
    int dash = rev.indexOf('-');
    return (Integer.parseInt(rev.substring(0, dash)) + 1) + "-mem";
  }

  @SuppressWarnings("unchecked")
  private static boolean matches(Map<String, Object> doc, Map<String, Object> selector) {
    for (Map.Entry<String, Object> e : selector.entrySet()) {
      String key = e.getKey();
      Object cond = e.getValue();
      if ("$and".equals(key)) {
        for (Object part : (List<Object>) cond) {
          if (!matches(doc, (Map<String, Object>) part)) return false;
        }
      } else if ("$or".equals(key)) {
        boolean any = false;
        for (Object part : (List<Object>) cond) {
          if (matches(doc, (Map<String, Object>) part)) any = true;
        }
        if (!any) return false;
      } else if (cond instanceof Map<?, ?> ops && !ops.isEmpty() && ops.keySet().iterator().next().toString().startsWith("$")) {
        for (Map.Entry<String, Object> op : ((Map<String, Object>) ops).entrySet()) {
          if (!test(doc.get(key), op.getKey(), op.getValue())) return false;
        }
      } else if (!Objects.equals(doc.get(key), cond)) {
        return false;
      }
    }
    return true;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static boolean test(Object actual, String op, Object expected) {
    switch (op) {
      case "$eq": return Objects.equals(actual, expected);
      case "$ne": return !Objects.equals(actual, expected);
      case "$in": return ((Collection<Object>) expected).contains(actual);
      default:
        if (!(actual instanceof Comparable a) || expected == null || actual.getClass() != expected.getClass()) return false;
        int c = a.compareTo(expected);
        return switch (op) {
          case "$gt" -> c > 0;
          case "$gte" -> c >= 0;
          case "$lt" -> c < 0;
          case "$lte" -> c <= 0;
          default -> throw new IllegalArgumentException("unsupported selector operator " + op);
        };
    }
  }
}
