package io.intellixity.couchlink.persistence.query;

import java.util.*;

public final class LogicalGroup implements QueryElement {
  private final Clause clause;
  private final List<QueryElement> elements;

  public LogicalGroup(Clause clause, List<QueryElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<QueryElement> elements() { return elements; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @SuppressWarnings("unchecked")
  static LogicalGroup fromMap(Map<String, Object> m) {
    Object raw = m.get("clause");
    Clause clause;
    if (raw == null) {
      clause = Clause.AND;
    } else {
      try {
        clause = Clause.valueOf(String.valueOf(raw).toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new QueryValidationException(ValidationError.malformed("unknown clause '" + raw + "'"), e);
      }
    }
    List<QueryElement> els = new ArrayList<>();
    Object rawElements = m.get("elements");
    if (rawElements instanceof List<?> list) {
      for (Object o : list) {
        if (o instanceof Map<?, ?> child) els.add(parseMap((Map<String, Object>) child));
      }
    }
    return new LogicalGroup(clause, els);
  }

  private static QueryElement parseMap(Map<String, Object> m) {
    if (m.containsKey("clause") || m.containsKey("elements")) return fromMap(m);
    if (m.containsKey("operator") && m.containsKey("property")) return Condition.fromMap(m);
    throw new QueryValidationException(ValidationError.malformed("unknown map query element: " + m.keySet()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup g)) return false;
    return clause == g.clause && elements.equals(g.elements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clause, elements);
  }

  @Override
  public String toString() {
    return clause + elements.toString();
  }
}
