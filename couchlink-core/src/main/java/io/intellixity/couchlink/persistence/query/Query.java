package io.intellixity.couchlink.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Per-request query: predicate tree, positional params, projection, order and paging.
 * Built, compiled once and discarded.
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private QueryElement filter;
  private List<Object> params = new ArrayList<>();
  private List<String> projection = new ArrayList<>();
  private List<SortField> sort = new ArrayList<>();
  private Integer limit;
  private Integer skip;

  public Query() {}

  public QueryElement filter() { return filter; }
  /** Positional params resolved by {@link QueryValues.Placeholder} indices. */
  public List<Object> params() { return params; }
  public List<String> projection() { return projection; }
  public List<SortField> sort() { return sort; }
  public Integer limit() { return limit; }
  public Integer skip() { return skip; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withParams(List<?> params) { this.params = new ArrayList<>(params == null ? List.of() : params); return this; }
  public Query withProjection(List<String> projection) { this.projection = new ArrayList<>(projection == null ? List.of() : projection); return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }

  public Query withLimit(Integer limit) {
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    this.limit = limit;
    return this;
  }

  public Query withSkip(Integer skip) {
    if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
    this.skip = skip;
    return this;
  }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query and(QueryElement... elements) {
    return Query.of(QueryFilters.and(elements));
  }

  public static Query or(QueryElement... elements) {
    return Query.of(QueryFilters.or(elements));
  }
}
