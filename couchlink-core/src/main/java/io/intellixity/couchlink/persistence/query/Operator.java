package io.intellixity.couchlink.persistence.query;

import java.util.Locale;

public enum Operator {
  EQ("=="),
  NE("!="),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),

  IN("in"),

  // Parsed and carried through the tree, but not every backend can compile it.
  LIKE("like");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Resolves an operator from its enum name ({@code "GE"}) or symbol ({@code ">="}); null when unknown. */
  public static Operator lookup(String key) {
    if (key == null) return null;
    String k = key.trim();
    for (Operator op : values()) {
      if (op.symbol.equals(k) || op.name().equals(k.toUpperCase(Locale.ROOT))) return op;
    }
    return null;
  }
}
