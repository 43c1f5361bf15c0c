package io.intellixity.couchlink.persistence.query;

import java.util.Map;

public final class QueryValues {
  private QueryValues() {}

  /** Positional reference into the parameter list supplied alongside a query. */
  public record Placeholder(int index) {}

  public static Placeholder placeholder(int index) { return new Placeholder(index); }

  static Object maybePlaceholder(Object v) {
    if (v == null) return null;
    if (v instanceof Placeholder) return v;
    if (v instanceof Map<?, ?> m) {
      Object p = m.get("placeholder");
      if (p == null) p = m.get("$placeholder");
      if (p instanceof Number n) return new Placeholder(n.intValue());
      if (p != null) {
        try {
          return new Placeholder(Integer.parseInt(String.valueOf(p).trim()));
        } catch (NumberFormatException e) {
          throw new QueryValidationException(ValidationError.malformed("placeholder index must be an integer: " + p), e);
        }
      }
    }
    return v;
  }
}
