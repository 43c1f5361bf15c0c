package io.intellixity.couchlink.persistence.spi.exec;

import io.intellixity.couchlink.persistence.authoring.SchemaDef;
import io.intellixity.couchlink.persistence.query.*;

import java.util.List;
import java.util.Objects;

/**
 * Default, backend-agnostic query validation.\n
 *
 * Validates filter, sort and projection fields against the schema's declared fields. Schemas that declare
 * no fields are treated as open and accept any path.\n
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(SchemaDef schema, Query query) {
    Objects.requireNonNull(schema, "schema");
    if (query == null || schema.fields().isEmpty()) return;

    validateElement(schema, query.filter());
    validateSort(schema, query.sort());
    validateProjection(schema, query.projection());
  }

  private static void validateSort(SchemaDef schema, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    for (SortField sf : sort) {
      if (sf == null) continue;
      requireField(schema, sf.field(), "sort");
    }
  }

  private static void validateProjection(SchemaDef schema, List<String> projection) {
    if (projection == null || projection.isEmpty()) return;
    for (String f : projection) requireField(schema, f, "projection");
  }

  private static void validateElement(SchemaDef schema, QueryElement el) {
    if (el == null) return;

    if (el instanceof LogicalGroup g) {
      for (QueryElement c : g.elements()) validateElement(schema, c);
      return;
    }
    if (el instanceof Condition c) {
      requireField(schema, c.property(), "filter");
      return;
    }

    throw new QueryValidationException(ValidationError.malformed("Unsupported QueryElement: " + el.getClass().getName()));
  }

  private static void requireField(SchemaDef schema, String path, String usage) {
    if (path == null || path.isBlank()) {
      throw new QueryValidationException(ValidationError.malformed("Blank field in " + usage + " for schema '" + schema.type() + "'"));
    }
    if (SchemaDef.isReservedField(path) || schema.isPrimaryKey(path)) return;
    String root = path.contains(".") ? path.substring(0, path.indexOf('.')) : path;
    if (!schema.fields().containsKey(root)) {
      throw new QueryValidationException(ValidationError.unknownField(
          "Unknown field '" + path + "' in " + usage + " for schema '" + schema.type() + "'"));
    }
  }
}
