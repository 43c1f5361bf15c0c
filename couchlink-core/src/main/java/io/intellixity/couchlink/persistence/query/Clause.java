package io.intellixity.couchlink.persistence.query;

public enum Clause {
  AND,
  OR
}
