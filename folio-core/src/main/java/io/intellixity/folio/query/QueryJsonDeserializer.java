package io.intellixity.folio.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/**
 * Canonical wire deserializer for {@link Query}.
 * <p>
 * Property filters are rebuilt untyped: the deserializer has no schema, so the condition tag is
 * kept as written and operators are not re-validated. Compound groups keep their wire shape.
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new InvalidArgumentException("Query payload must be an object");

    QueryFilter filter = null;
    JsonNode f = root.get("filter");
    if (f != null && !f.isNull()) filter = parseFilter(f);

    List<SortSpec> sorts = new ArrayList<>();
    JsonNode s = root.get("sorts");
    if (s != null && s.isArray()) {
      for (JsonNode sort : s) sorts.add(parseSort(sort));
    }

    String cursor = textOrNull(root.get("start_cursor"));

    Integer pageSize = null;
    JsonNode ps = root.get("page_size");
    if (ps != null && !ps.isNull()) {
      if (!ps.canConvertToInt()) throw new InvalidArgumentException("page_size must be an integer");
      pageSize = ps.intValue();
    }

    return new Query(filter, sorts, cursor, pageSize);
  }

  static QueryFilter parseFilter(JsonNode n) {
    if (!n.isObject()) throw new InvalidArgumentException("Filter must be an object: " + n);

    for (Clause clause : Clause.values()) {
      JsonNode group = n.get(clause.wireName());
      if (group == null) continue;
      if (!group.isArray()) throw new InvalidArgumentException("'" + clause.wireName() + "' must be an array");
      List<QueryFilter> children = new ArrayList<>();
      for (JsonNode child : group) children.add(parseFilter(child));
      return new CompoundFilter(clause, children);
    }

    String property = textOrNull(n.get("property"));
    if (property != null) {
      String tag = conditionTag(n, "property");
      JsonNode cond = n.get(tag);
      return Filter.property(property, tag, tag.equals("formula") ? parseFormula(cond) : parseConstraint(cond));
    }

    String timestamp = textOrNull(n.get("timestamp"));
    if (timestamp != null) {
      Timestamp ts = Timestamp.fromWire(timestamp);
      JsonNode cond = n.get(ts.wireName());
      if (cond == null) throw new InvalidArgumentException("Missing '" + ts.wireName() + "' condition for timestamp filter");
      return Filter.timestamp(ts, parseConstraint(cond));
    }

    throw new InvalidArgumentException("Unrecognized filter: " + n);
  }

  private static String conditionTag(JsonNode n, String targetKey) {
    String tag = null;
    Iterator<String> names = n.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (name.equals(targetKey) || name.equals("type")) continue;
      if (tag != null) throw new InvalidArgumentException("Filter has more than one condition: " + n);
      tag = name;
    }
    if (tag == null) throw new InvalidArgumentException("Filter has no condition: " + n);
    return tag;
  }

  private static Constraint parseConstraint(JsonNode cond) {
    if (cond == null || !cond.isObject() || cond.size() != 1) {
      throw new InvalidArgumentException("Condition must hold exactly one operator: " + cond);
    }
    Map.Entry<String, JsonNode> e = cond.fields().next();
    Operator op = Operator.fromWire(e.getKey());
    if (op.operandKind() != Operator.OperandKind.VALUE) return Constraint.of(op, null);
    return Constraint.of(op, operand(e.getValue()));
  }

  /** {@code {"<result type>": {"<operator>": <operand>}}} */
  private static Constraint parseFormula(JsonNode cond) {
    if (cond == null || !cond.isObject() || cond.size() != 1) {
      throw new InvalidArgumentException("Formula condition must hold exactly one result type: " + cond);
    }
    Map.Entry<String, JsonNode> e = cond.fields().next();
    return Constraint.formula(FormulaResult.fromWire(e.getKey()), parseConstraint(e.getValue()));
  }

  private static Object operand(JsonNode v) {
    if (v.isTextual()) return v.asText();
    if (v.isBoolean()) return v.booleanValue();
    if (v.isNumber()) return v.numberValue();
    throw new InvalidArgumentException("Unsupported operand: " + v);
  }

  private static SortSpec parseSort(JsonNode n) {
    SortSpec.Direction dir = SortSpec.Direction.fromWire(textOrNull(n.get("direction")));
    String property = textOrNull(n.get("property"));
    if (property != null) return SortSpec.property(property, dir);
    String timestamp = textOrNull(n.get("timestamp"));
    if (timestamp != null) return SortSpec.timestamp(Timestamp.fromWire(timestamp), dir);
    throw new InvalidArgumentException("Sort needs a property or a timestamp: " + n);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
