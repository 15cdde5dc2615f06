package io.intellixity.folio.schema.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.query.ConditionType;
import io.intellixity.folio.schema.DateRange;
import io.intellixity.folio.schema.PropertyDef;
import io.intellixity.folio.schema.PropertyType;
import io.intellixity.folio.schema.PropertyTypeException;
import io.intellixity.folio.schema.PropertyTypeProvider;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Built-in property types of a remote collection. */
public final class DefaultPropertyTypeProvider implements PropertyTypeProvider {
  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  @Override
  public Collection<PropertyType<?>> propertyTypes() {
    return List.of(
        new TextType("title", true),
        new TextType("rich_text", true),
        new TextType("url", false),
        new TextType("email", false),
        new TextType("phone_number", false),
        new NumberType(),
        new CheckboxType(),
        new OptionType("select", ConditionType.SELECT),
        new OptionType("status", ConditionType.STATUS),
        new MultiSelectType(),
        new DateType(),
        new IdListType("people", ConditionType.PEOPLE, true),
        new IdListType("relation", ConditionType.RELATION, false),
        new FilesType(),
        new TimestampType("created_time"),
        new TimestampType("last_edited_time"),
        new OpaquePropertyType("formula", ConditionType.FORMULA),
        new OpaquePropertyType("rollup"),
        new OpaquePropertyType("created_by"),
        new OpaquePropertyType("last_edited_by")
    );
  }

  /** Plain text; title and rich_text travel as an array of text objects. */
  static final class TextType implements PropertyType<String> {
    private final String id;
    private final boolean richText;

    TextType(String id, boolean richText) {
      this.id = id;
      this.richText = richText;
    }

    @Override public String id() { return id; }
    @Override public Class<String> javaType() { return String.class; }
    @Override public ConditionType conditionType() { return ConditionType.TEXT; }

    @Override
    public String decode(JsonNode payload) {
      if (isNull(payload)) return null;
      if (!richText) return payload.asText();
      if (!payload.isArray()) throw new PropertyTypeException("Expected a text array for '" + id + "' but got " + payload.getNodeType());
      StringBuilder sb = new StringBuilder();
      for (JsonNode el : payload) {
        JsonNode plain = el.get("plain_text");
        if (plain != null && plain.isTextual()) {
          sb.append(plain.asText());
        } else {
          sb.append(el.path("text").path("content").asText(""));
        }
      }
      return sb.toString();
    }

    @Override
    public JsonNode encode(String value) {
      if (!richText) return value == null ? F.nullNode() : F.textNode(value);
      ArrayNode arr = F.arrayNode();
      if (value != null && !value.isEmpty()) {
        ObjectNode t = arr.addObject();
        t.put("type", "text");
        t.putObject("text").put("content", value);
      }
      return arr;
    }

    @Override
    public String coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      if (value instanceof CharSequence cs) return cs.toString();
      throw mismatch(def, value, "a String");
    }
  }

  static final class NumberType implements PropertyType<Number> {
    @Override public String id() { return "number"; }
    @Override public Class<Number> javaType() { return Number.class; }
    @Override public ConditionType conditionType() { return ConditionType.NUMBER; }

    @Override
    public Number decode(JsonNode payload) {
      if (isNull(payload)) return null;
      if (!payload.isNumber()) throw new PropertyTypeException("Expected a number payload but got " + payload.getNodeType());
      return payload.numberValue();
    }

    @Override
    public JsonNode encode(Number value) {
      if (value == null) return F.nullNode();
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) return F.numberNode(value.intValue());
      if (value instanceof Long l) return F.numberNode(l);
      if (value instanceof BigDecimal bd) return F.numberNode(bd);
      if (value instanceof BigInteger bi) return F.numberNode(bi);
      return F.numberNode(value.doubleValue());
    }

    @Override
    public Number coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      if (!(value instanceof Number n)) throw mismatch(def, value, "a Number");
      if ((n instanceof Double || n instanceof Float) && !Double.isFinite(n.doubleValue())) {
        throw new PropertyTypeException("Property '" + def.name() + "' requires a finite number, got " + n);
      }
      return n;
    }
  }

  /** A checkbox is never empty on the remote side, so null writes false. */
  static final class CheckboxType implements PropertyType<Boolean> {
    @Override public String id() { return "checkbox"; }
    @Override public Class<Boolean> javaType() { return Boolean.class; }
    @Override public ConditionType conditionType() { return ConditionType.CHECKBOX; }

    @Override
    public Boolean decode(JsonNode payload) {
      if (isNull(payload)) return null;
      if (!payload.isBoolean()) throw new PropertyTypeException("Expected a boolean payload but got " + payload.getNodeType());
      return payload.booleanValue();
    }

    @Override
    public JsonNode encode(Boolean value) {
      return F.booleanNode(Boolean.TRUE.equals(value));
    }

    @Override
    public Boolean coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      if (value instanceof Boolean b) return b;
      throw mismatch(def, value, "a Boolean");
    }
  }

  /** Single option by name ({@code {"name": "High"}}), checked against the declared options. */
  static final class OptionType implements PropertyType<String> {
    private final String id;
    private final ConditionType conditionType;

    OptionType(String id, ConditionType conditionType) {
      this.id = id;
      this.conditionType = conditionType;
    }

    @Override public String id() { return id; }
    @Override public Class<String> javaType() { return String.class; }
    @Override public ConditionType conditionType() { return conditionType; }

    @Override
    public String decode(JsonNode payload) {
      if (isNull(payload)) return null;
      JsonNode name = payload.get("name");
      return (name == null || name.isNull()) ? null : name.asText();
    }

    @Override
    public JsonNode encode(String value) {
      if (value == null) return F.nullNode();
      ObjectNode o = F.objectNode();
      o.put("name", value);
      return o;
    }

    @Override
    public String coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      if (!(value instanceof CharSequence cs)) throw mismatch(def, value, "an option name");
      return requireOption(def, cs.toString());
    }
  }

  static final class MultiSelectType implements PropertyType<List<String>> {
    @Override public String id() { return "multi_select"; }
    @Override public ConditionType conditionType() { return ConditionType.MULTI_SELECT; }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Class<List<String>> javaType() { return (Class) List.class; }

    @Override
    public List<String> decode(JsonNode payload) {
      if (isNull(payload)) return null;
      List<String> out = new ArrayList<>();
      for (JsonNode el : payload) {
        JsonNode name = el.get("name");
        if (name != null && !name.isNull()) out.add(name.asText());
      }
      return List.copyOf(out);
    }

    @Override
    public JsonNode encode(List<String> value) {
      ArrayNode arr = F.arrayNode();
      if (value != null) {
        for (String v : value) arr.addObject().put("name", v);
      }
      return arr;
    }

    @Override
    public List<String> coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      List<String> names = strings(def, value, "option names");
      for (String n : names) requireOption(def, n);
      return names;
    }
  }

  static final class DateType implements PropertyType<DateRange> {
    @Override public String id() { return "date"; }
    @Override public Class<DateRange> javaType() { return DateRange.class; }
    @Override public ConditionType conditionType() { return ConditionType.DATE; }

    @Override
    public DateRange decode(JsonNode payload) {
      if (isNull(payload)) return null;
      JsonNode start = payload.get("start");
      if (start == null || start.isNull()) return null;
      JsonNode end = payload.get("end");
      try {
        return new DateRange(
            DateRange.parseTemporal(start.asText()),
            (end == null || end.isNull()) ? null : DateRange.parseTemporal(end.asText()));
      } catch (IllegalArgumentException e) {
        throw new PropertyTypeException("Malformed date payload: " + payload, e);
      }
    }

    @Override
    public JsonNode encode(DateRange value) {
      if (value == null) return F.nullNode();
      ObjectNode o = F.objectNode();
      o.put("start", value.start().toString());
      if (value.end() != null) o.put("end", value.end().toString());
      return o;
    }

    @Override
    public DateRange coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      if (value instanceof DateRange r) return r;
      if (value instanceof LocalDate d) return DateRange.of(d);
      if (value instanceof OffsetDateTime t) return DateRange.of(t);
      if (value instanceof CharSequence cs) {
        try {
          return DateRange.of(DateRange.parseTemporal(cs.toString()));
        } catch (IllegalArgumentException e) {
          throw new PropertyTypeException("Property '" + def.name() + "' expects an ISO date, got '" + cs + "'", e);
        }
      }
      throw mismatch(def, value, "a DateRange, LocalDate or OffsetDateTime");
    }
  }

  /** People and relations: a list of remote object ids. */
  static final class IdListType implements PropertyType<List<String>> {
    private final String id;
    private final ConditionType conditionType;
    private final boolean users;

    IdListType(String id, ConditionType conditionType, boolean users) {
      this.id = id;
      this.conditionType = conditionType;
      this.users = users;
    }

    @Override public String id() { return id; }
    @Override public ConditionType conditionType() { return conditionType; }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Class<List<String>> javaType() { return (Class) List.class; }

    @Override
    public List<String> decode(JsonNode payload) {
      if (isNull(payload)) return null;
      List<String> out = new ArrayList<>();
      for (JsonNode el : payload) {
        JsonNode ref = el.get("id");
        if (ref != null && ref.isTextual()) out.add(ref.asText());
      }
      return List.copyOf(out);
    }

    @Override
    public JsonNode encode(List<String> value) {
      ArrayNode arr = F.arrayNode();
      if (value != null) {
        for (String v : value) {
          ObjectNode o = arr.addObject();
          if (users) o.put("object", "user");
          o.put("id", v);
        }
      }
      return arr;
    }

    @Override
    public List<String> coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      List<String> ids = strings(def, value, "ids");
      for (String i : ids) {
        if (i.isBlank()) throw new PropertyTypeException("Property '" + def.name() + "' does not accept blank ids");
      }
      return ids;
    }
  }

  /** Files as external URLs. */
  static final class FilesType implements PropertyType<List<String>> {
    @Override public String id() { return "files"; }
    @Override public ConditionType conditionType() { return ConditionType.FILES; }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Class<List<String>> javaType() { return (Class) List.class; }

    @Override
    public List<String> decode(JsonNode payload) {
      if (isNull(payload)) return null;
      List<String> out = new ArrayList<>();
      for (JsonNode el : payload) {
        String url = el.path("external").path("url").asText(null);
        if (url == null) url = el.path("file").path("url").asText(null);
        if (url == null) url = el.path("name").asText(null);
        if (url != null) out.add(url);
      }
      return List.copyOf(out);
    }

    @Override
    public JsonNode encode(List<String> value) {
      ArrayNode arr = F.arrayNode();
      if (value != null) {
        for (String url : value) {
          ObjectNode o = arr.addObject();
          o.put("name", url);
          o.put("type", "external");
          o.putObject("external").put("url", url);
        }
      }
      return arr;
    }

    @Override
    public List<String> coerce(PropertyDef def, Object value) {
      if (value == null) return null;
      return strings(def, value, "URLs");
    }
  }

  /** created_time / last_edited_time properties: server-maintained, filterable as dates. */
  static final class TimestampType implements PropertyType<OffsetDateTime> {
    private final String id;

    TimestampType(String id) {
      this.id = id;
    }

    @Override public String id() { return id; }
    @Override public Class<OffsetDateTime> javaType() { return OffsetDateTime.class; }
    @Override public ConditionType conditionType() { return ConditionType.DATE; }
    @Override public boolean writable() { return false; }

    @Override
    public OffsetDateTime decode(JsonNode payload) {
      if (isNull(payload)) return null;
      try {
        return OffsetDateTime.parse(payload.asText());
      } catch (DateTimeParseException e) {
        throw new PropertyTypeException("Malformed " + id + " payload: " + payload, e);
      }
    }

    @Override
    public JsonNode encode(OffsetDateTime value) {
      return value == null ? F.nullNode() : F.textNode(value.toString());
    }

    @Override
    public OffsetDateTime coerce(PropertyDef def, Object value) {
      throw new PropertyTypeException("Property '" + def.name() + "' of type '" + id + "' is read-only");
    }
  }

  private static boolean isNull(JsonNode n) {
    return n == null || n.isNull() || n.isMissingNode();
  }

  private static String requireOption(PropertyDef def, String option) {
    if (!def.allowsOption(option)) {
      throw new PropertyTypeException(
          "'" + option + "' is not an option of property '" + def.name() + "' (options: " + def.options() + ")");
    }
    return option;
  }

  private static List<String> strings(PropertyDef def, Object value, String what) {
    if (value instanceof CharSequence cs) return List.of(cs.toString());
    if (!(value instanceof Collection<?> c)) throw mismatch(def, value, "a collection of " + what);
    List<String> out = new ArrayList<>(c.size());
    for (Object o : c) {
      if (!(o instanceof CharSequence cs)) throw mismatch(def, o, "a collection of " + what);
      out.add(cs.toString());
    }
    return List.copyOf(out);
  }

  private static PropertyTypeException mismatch(PropertyDef def, Object value, String expected) {
    String got = value == null ? "null" : value.getClass().getSimpleName();
    return new PropertyTypeException(
        "Property '" + def.name() + "' (" + def.typeId() + ") expects " + expected + " but got " + got);
  }
}
