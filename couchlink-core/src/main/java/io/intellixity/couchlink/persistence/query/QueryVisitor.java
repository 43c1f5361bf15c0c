package io.intellixity.couchlink.persistence.query;

public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
}
