package io.mesabi.analytics.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire JSON deserializer for {@link QueryRequest}.
 * <p>
 * Shape problems surface as {@link QueryValidationException} so the caller sees a BAD_REQUEST rather than a
 * Jackson mapping error.
 */
public final class QueryRequestJsonDeserializer extends JsonDeserializer<QueryRequest> {
  @Override
  public QueryRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("Query request JSON must be an object");

    QueryRequest q = new QueryRequest(Subject.fromWire(textOrNull(root.get("subject"))));

    JsonNode measures = root.get("measures");
    if (measures != null && measures.isArray()) {
      for (JsonNode m : measures) {
        requireObject(m, "measure");
        q.withMeasure(new Measure(
            requiredText(m, "name", "measure"),
            Aggregation.fromWire(textOrNull(m.get("aggregation"))),
            requiredText(m, "field", "measure")));
      }
    }

    JsonNode dimensions = root.get("dimensions");
    if (dimensions != null && dimensions.isArray()) {
      for (JsonNode d : dimensions) {
        requireObject(d, "dimension");
        q.withDimension(new Dimension(
            textOrNull(d.get("name")),
            requiredText(d, "field", "dimension"),
            TimeGrouping.fromWire(textOrNull(d.get("grouping")))));
      }
    }

    JsonNode filters = root.get("filters");
    if (filters != null && filters.isArray()) {
      for (JsonNode f : filters) {
        requireObject(f, "filter");
        FilterOperator op = FilterOperator.fromWire(textOrNull(f.get("op")));
        q.withFilter(new Filter(requiredText(f, "field", "filter"), op, value(f.get("value"), codec)));
      }
    }

    JsonNode tr = root.get("timeRange");
    if (tr != null && tr.isObject()) {
      // combination requests spell the bounds start/end
      String fromKey = tr.has("from") || !tr.has("start") ? "from" : "start";
      String toKey = tr.has("to") || !tr.has("end") ? "to" : "end";
      q.withTimeRange(new TimeRange(requiredText(tr, fromKey, "timeRange"), requiredText(tr, toKey, "timeRange")));
    }

    JsonNode ob = root.get("orderBy");
    if (ob != null && ob.isObject()) {
      q.withOrderBy(new OrderBy(requiredText(ob, "field", "orderBy"),
          OrderBy.Direction.fromWire(textOrNull(ob.get("direction")))));
    }

    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) {
      if (!limit.canConvertToInt() || !limit.isIntegralNumber()) {
        throw new QueryValidationException("limit must be an integer");
      }
      q.withLimit(limit.intValue());
    }

    q.withCompareTo(textOrNull(root.get("compareTo")));
    return q;
  }

  private static Object value(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (n.isArray()) {
      List<Object> out = new ArrayList<>();
      for (JsonNode x : n) out.add(value(x, codec));
      return out;
    }
    if (n.isTextual()) return n.asText();
    if (n.isIntegralNumber()) return n.canConvertToInt() ? (Object) n.intValue() : (Object) n.longValue();
    if (n.isNumber()) return n.doubleValue();
    if (n.isBoolean()) return n.booleanValue();
    return codec.treeToValue(n, Object.class);
  }

  private static void requireObject(JsonNode n, String what) {
    if (n == null || !n.isObject()) throw new QueryValidationException(what + " must be an object");
  }

  private static String requiredText(JsonNode parent, String key, String what) {
    String s = textOrNull(parent.get(key));
    if (s == null || s.isBlank()) throw new QueryValidationException(what + "." + key + " is required");
    return s;
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.isTextual() ? n.asText() : n.toString();
  }
}
