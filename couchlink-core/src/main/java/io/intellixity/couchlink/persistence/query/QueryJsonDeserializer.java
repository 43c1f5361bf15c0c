package io.intellixity.couchlink.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link Query}. */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException(ValidationError.malformed("query JSON must be an object"));

    Query q = new Query();

    JsonNode params = root.get("params");
    if (params != null && params.isArray()) {
      List<Object> out = new ArrayList<>();
      for (JsonNode x : params) out.add(codec.treeToValue(x, Object.class));
      q.withParams(out);
    }

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d));
      }
      q.withSort(fields);
    }

    JsonNode proj = root.get("projection");
    if (proj != null && proj.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode x : proj) if (x.isTextual()) out.add(x.asText());
      q.withProjection(out);
    }

    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) q.withLimit(limit.asInt());
    JsonNode skip = root.get("skip");
    if (skip != null && !skip.isNull()) q.withSkip(skip.asInt());

    return q;
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;

    // Canonical group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.isObject() && n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.isObject() && n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // Back-compat: {clause: AND, elements:[...]} or {operator: EQ, property: email, ...}
    if (n.isObject() && (n.has("clause") || n.has("elements"))) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(n, Map.class);
      return LogicalGroup.fromMap(m);
    }
    if (n.isObject() && n.has("operator") && n.has("property")) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(n, Map.class);
      return Condition.fromMap(m);
    }

    // Canonical condition form: { "eq": { field:..., value:... } }
    if (n.isObject() && n.size() == 1) {
      String k = n.fieldNames().next();
      Operator op = Operator.lookup(k);
      if (op == null) throw new QueryValidationException(ValidationError.unsupportedOperator(k));
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) {
        throw new QueryValidationException(ValidationError.malformed(k + " must be an object"));
      }
      return parseCondition(op, body, codec);
    }

    throw new QueryValidationException(ValidationError.malformed("unsupported filter element: " + n));
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new QueryValidationException(ValidationError.malformed(op + " requires field"));

    if (op == Operator.IN) {
      JsonNode values = body.get("values");
      if (values != null && values.isArray()) {
        List<Object> out = new ArrayList<>();
        for (JsonNode v : values) out.add(decodeValue(v, codec));
        return new Condition(field, op, out);
      }
      return new Condition(field, op, decodeValue(values, codec));
    }

    return new Condition(field, op, decodeValue(body.get("value"), codec));
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    // Placeholder: {"placeholder": 0} or {"$placeholder": 0}
    if (v.isObject()) {
      JsonNode p = v.get("placeholder");
      if (p == null) p = v.get("$placeholder");
      if (p != null && p.canConvertToInt()) return QueryValues.placeholder(p.intValue());
    }
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
