package io.intellixity.couchlink.persistence.couch;

import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.naming.Namespacer;
import io.intellixity.couchlink.persistence.query.*;

import java.util.*;

/**
 * Compiles a predicate tree plus paging options into a {@link CompiledQuery}.\n
 *
 * Decision order:\n
 * 1. a lone equality on the primary key with a scalar: {@link CompiledQuery.PointGet}\n
 * 2. a lone equality / IN on the primary key with a list: {@link CompiledQuery.BatchGet}\n
 * 3. no predicate at all: {@link CompiledQuery.RangeScan} over the namespace\n
 * 4. anything else: {@link CompiledQuery.Selector} scoped by the {@code type} discriminator\n
 *
 * Pure and deterministic: equal inputs give equal outputs, including map key order.
 */
public final class CouchQueryCompiler {
  /** Appended to the namespace to form the upper bound of a namespace scan. */
  public static final String RANGE_END_SUFFIX = "/{}";
  public static final int DEFAULT_SCAN_LIMIT = 100;

  private static final String AND = "$and";
  private static final String OR = "$or";

  private CouchQueryCompiler() {}

  public static CompiledQuery compile(SchemaDef schema, Query query) {
    Objects.requireNonNull(schema, "schema");
    Query q = (query == null) ? new Query() : query;
    return compile(schema, q.filter(), q.params(), q.projection(), q.sort(), q.limit(), q.skip());
  }

  public static CompiledQuery compile(SchemaDef schema,
                                      QueryElement filter,
                                      List<Object> params,
                                      List<String> projection,
                                      List<SortField> order,
                                      Integer limit,
                                      Integer skip) {
    Objects.requireNonNull(schema, "schema");
    List<Object> p = (params == null) ? List.of() : params;
    List<SortField> sort = (order == null) ? List.of() : order;
    String ns = schema.namespace();

    QueryElement root = simplify(filter);

    if (root instanceof Condition c && schema.isPrimaryKey(c.property())) {
      CompiledQuery direct = directLookup(ns, c, p);
      if (direct != null) return direct;
    }

    if (root == null) {
      int lim = (limit == null) ? DEFAULT_SCAN_LIMIT : limit;
      int off = (skip == null) ? 0 : skip;
      String start = ns;
      String end = ns + RANGE_END_SUFFIX;
      boolean descending = !sort.isEmpty() && sort.get(0).direction() == SortField.Direction.DESC;
      return descending
          ? new CompiledQuery.RangeScan(end, start, lim, off, true)
          : new CompiledQuery.RangeScan(start, end, lim, off, false);
    }

    Map<String, Object> selector = new LinkedHashMap<>();
    selector.put(SchemaDef.TYPE_FIELD, ns);
    mergeInto(selector, translate(schema, root, p));
    return new CompiledQuery.Selector(selector, options(projection, sort, limit, skip));
  }

  /** Unwraps single-child groups; returns null for an absent or empty tree. */
  private static QueryElement simplify(QueryElement el) {
    if (el == null) return null;
    if (el instanceof LogicalGroup g) {
      if (g.elements().isEmpty()) return null;
      if (g.elements().size() == 1) return simplify(g.elements().get(0));
    }
    return el;
  }

  private static CompiledQuery directLookup(String ns, Condition c, List<Object> params) {
    if (c.operator() != Operator.EQ && c.operator() != Operator.IN) return null;
    Object v = resolve(c.value(), params);
    if (v instanceof Collection<?> values) {
      if (values.isEmpty()) {
        throw new QueryValidationException(ValidationError.malformed("empty id list for '" + c.property() + "'"));
      }
      List<String> ids = new ArrayList<>(values.size());
      for (Object id : values) ids.add(qualifiedId(ns, c.property(), id));
      return new CompiledQuery.BatchGet(ids);
    }
    if (c.operator() == Operator.IN) {
      throw new QueryValidationException(ValidationError.malformed("IN on '" + c.property() + "' requires a list"));
    }
    return new CompiledQuery.PointGet(qualifiedId(ns, c.property(), v));
  }

  private static Map<String, Object> translate(SchemaDef schema, QueryElement el, List<Object> params) {
    if (el == null) throw new QueryValidationException(ValidationError.malformed("unsupported query element: null"));
    return el.accept(new SelectorTranslator(schema, params));
  }

  /** Recursive selector translation of one subtree. */
  private static final class SelectorTranslator implements QueryVisitor<Map<String, Object>> {
    private final SchemaDef schema;
    private final List<Object> params;

    SelectorTranslator(SchemaDef schema, List<Object> params) {
      this.schema = schema;
      this.params = params;
    }

    @Override
    public Map<String, Object> visit(Condition condition) {
      return translateCondition(schema, condition, params);
    }

    @Override
    public Map<String, Object> visit(LogicalGroup group) {
      Map<String, Object> out = new LinkedHashMap<>();
      if (group.clause() == Clause.OR) {
        List<Object> branches = new ArrayList<>(group.elements().size());
        for (QueryElement child : group.elements()) branches.add(translate(schema, child, params));
        out.put(OR, branches);
        return out;
      }
      for (QueryElement child : group.elements()) mergeInto(out, translate(schema, child, params));
      return out;
    }
  }

  private static Map<String, Object> translateCondition(SchemaDef schema, Condition c, List<Object> params) {
    String field = c.property();
    boolean pk = schema.isPrimaryKey(field);
    String target = pk ? SchemaDef.ID_FIELD : field;
    Object v = resolve(c.value(), params);
    String ns = schema.namespace();

    Map<String, Object> out = new LinkedHashMap<>();
    switch (c.operator()) {
      case EQ -> {
        if (v instanceof Collection<?>) {
          throw new QueryValidationException(ValidationError.malformed("equality on '" + field + "' takes a scalar"));
        }
        out.put(target, (pk && v != null) ? qualifiedId(ns, field, v) : v);
      }
      case NE, GT, GE, LT, LE -> {
        if (v == null && c.operator() != Operator.NE) {
          throw new QueryValidationException(ValidationError.malformed(
              c.operator().symbol() + " on '" + field + "' requires a value"));
        }
        out.put(target, operatorMap(mangoOperator(c.operator()), (pk && v != null) ? qualifiedId(ns, field, v) : v));
      }
      case IN -> {
        if (!(v instanceof Collection<?> values)) {
          throw new QueryValidationException(ValidationError.malformed("IN on '" + field + "' requires a list"));
        }
        if (values.isEmpty()) {
          throw new QueryValidationException(ValidationError.malformed("IN on '" + field + "' requires values"));
        }
        List<Object> in = new ArrayList<>(values.size());
        for (Object x : values) in.add(pk ? qualifiedId(ns, field, x) : x);
        out.put(target, operatorMap("$in", in));
      }
      default -> throw new QueryValidationException(ValidationError.unsupportedOperator(c.operator().symbol()));
    }
    return out;
  }

  private static String mangoOperator(Operator op) {
    return switch (op) {
      case NE -> "$ne";
      case GT -> "$gt";
      case GE -> "$gte";
      case LT -> "$lt";
      case LE -> "$lte";
      default -> throw new QueryValidationException(ValidationError.unsupportedOperator(op.symbol()));
    };
  }

  private static Map<String, Object> operatorMap(String op, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(op, value);
    return m;
  }

  /**
   * Merges {@code source} into {@code target} as a conjunction. Operator maps on the same field combine when
   * their operators differ; any other clash is moved into an explicit {@code $and} list.
   */
  @SuppressWarnings("unchecked")
  static void mergeInto(Map<String, Object> target, Map<String, Object> source) {
    for (Map.Entry<String, Object> e : source.entrySet()) {
      String key = e.getKey();
      Object value = e.getValue();
      if (!target.containsKey(key)) {
        target.put(key, value);
        continue;
      }
      Object existing = target.get(key);
      if (AND.equals(key) && existing instanceof List<?> a && value instanceof List<?> b) {
        List<Object> joined = new ArrayList<>(a);
        joined.addAll(b);
        target.put(AND, joined);
        continue;
      }
      if (isOperatorMap(existing) && isOperatorMap(value)
          && Collections.disjoint(((Map<String, Object>) existing).keySet(), ((Map<String, Object>) value).keySet())) {
        Map<String, Object> combined = new LinkedHashMap<>((Map<String, Object>) existing);
        combined.putAll((Map<String, Object>) value);
        target.put(key, combined);
        continue;
      }
      Map<String, Object> clash = new LinkedHashMap<>();
      clash.put(key, value);
      Object and = target.get(AND);
      List<Object> list = (and instanceof List<?> l) ? new ArrayList<>(l) : new ArrayList<>();
      list.add(clash);
      target.put(AND, list);
    }
  }

  private static boolean isOperatorMap(Object v) {
    if (!(v instanceof Map<?, ?> m) || m.isEmpty()) return false;
    for (Object k : m.keySet()) {
      if (!(k instanceof String s) || !s.startsWith("$")) return false;
    }
    return true;
  }

  /** Replaces placeholders (also inside lists) by their positional parameter. */
  private static Object resolve(Object value, List<Object> params) {
    if (value instanceof QueryValues.Placeholder ph) {
      int i = ph.index();
      if (i < 0 || i >= params.size()) {
        throw new QueryValidationException(ValidationError.placeholderOutOfRange(i, params.size()));
      }
      Object bound = params.get(i);
      return (bound instanceof Collection<?> c) ? new ArrayList<>(c) : bound;
    }
    if (value instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(resolve(x, params));
      return out;
    }
    return value;
  }

  private static String qualifiedId(String ns, String field, Object local) {
    if (local == null || local instanceof Map<?, ?> || local instanceof Collection<?>) {
      throw new QueryValidationException(ValidationError.malformed("'" + field + "' requires a scalar id, got " + local));
    }
    String s = String.valueOf(local);
    if (s.isEmpty()) throw new QueryValidationException(ValidationError.malformed("'" + field + "' requires a non-empty id"));
    return Namespacer.qualify(ns, s);
  }

  private static CompiledQuery.SelectorOptions options(List<String> projection,
                                                       List<SortField> order,
                                                       Integer limit,
                                                       Integer skip) {
    List<Map<String, String>> sort = new ArrayList<>(order.size());
    for (SortField f : order) {
      Map<String, String> one = new LinkedHashMap<>();
      one.put(f.field(), f.direction() == SortField.Direction.DESC ? "desc" : "asc");
      sort.add(one);
    }
    return new CompiledQuery.SelectorOptions(projection, sort, limit, skip);
  }
}
