package io.intellixity.couchlink.persistence.query;

/** Node of an immutable predicate tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
