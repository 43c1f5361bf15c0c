package io.intellixity.couchlink.persistence.couch;

import java.util.*;

/**
 * Store-level execution form of a query. Exactly one of four shapes:\n
 *
 * - {@link PointGet}: single document by qualified id\n
 * - {@link BatchGet}: several documents by qualified id\n
 * - {@link Selector}: declarative selector query\n
 * - {@link RangeScan}: key-range scan over the namespace\n
 */
public interface CompiledQuery {

  record PointGet(String id) implements CompiledQuery {
    public PointGet {
      Objects.requireNonNull(id, "id");
    }
  }

  record BatchGet(List<String> ids) implements CompiledQuery {
    public BatchGet {
      ids = List.copyOf(ids);
    }
  }

  /**
   * Selector query. The selector always carries the {@code type} discriminator of the namespace.
   */
  record Selector(Map<String, Object> selector, SelectorOptions options) implements CompiledQuery {
    public Selector {
      selector = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(selector, "selector")));
      options = (options == null) ? SelectorOptions.NONE : options;
    }

    /** Full {@code _find} request body. */
    public Map<String, Object> toRequest() {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("selector", selector);
      if (!options.fields().isEmpty()) body.put("fields", options.fields());
      if (!options.sort().isEmpty()) body.put("sort", options.sort());
      if (options.limit() != null) body.put("limit", options.limit());
      if (options.skip() != null) body.put("skip", options.skip());
      return body;
    }
  }

  /**
   * @param fields projected fields; empty means whole documents
   * @param sort {@code [{"field": "asc"|"desc"}]} in sort-key order
   */
  record SelectorOptions(List<String> fields, List<Map<String, String>> sort, Integer limit, Integer skip) {
    public static final SelectorOptions NONE = new SelectorOptions(List.of(), List.of(), null, null);

    public SelectorOptions {
      fields = (fields == null) ? List.of() : List.copyOf(fields);
      sort = (sort == null) ? List.of() : List.copyOf(sort);
    }
  }

  /**
   * Key-range scan. For descending scans the bounds are already swapped: {@code startKey} is the high end.
   */
  record RangeScan(String startKey, String endKey, int limit, int skip, boolean descending) implements CompiledQuery {
    public RangeScan {
      Objects.requireNonNull(startKey, "startKey");
      Objects.requireNonNull(endKey, "endKey");
    }
  }
}
