package io.intellixity.couchlink.persistence.query;

import java.util.*;

/**
 * Leaf predicate on a single field: {@code Eq}, {@code Cmp} and {@code In} share this shape and are told
 * apart by {@link #operator()}.
 */
public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;

  public Condition(String property, Operator operator, Object value) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = (value instanceof Collection<?> c) ? Collections.unmodifiableList(new ArrayList<>(c)) : value;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value);
  }

  /** Back-compat map form: {@code {property: "email", operator: "EQ", value: ...}}. */
  public static Condition fromMap(Map<String, Object> m) {
    String property = String.valueOf(m.get("property"));
    Object rawOp = m.get("operator");
    Operator op = Operator.lookup(rawOp == null ? null : String.valueOf(rawOp));
    if (op == null) {
      throw new QueryValidationException(ValidationError.unsupportedOperator(String.valueOf(rawOp)));
    }
    Object value = m.containsKey("values") ? m.get("values") : m.get("value");
    return new Condition(property, op, QueryValues.maybePlaceholder(value));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return property.equals(c.property) && operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(property, operator, value);
  }

  @Override
  public String toString() {
    return property + " " + operator.symbol() + " " + value;
  }
}
