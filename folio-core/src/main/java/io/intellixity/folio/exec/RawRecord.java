package io.intellixity.folio.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A record as returned by the remote side:
 * <pre>
 * {"id": "...", "created_time": "...", "last_edited_time": "...", "archived": false,
 *  "properties": {"Title": {"type": "title", "title": [...]}, ...}}
 * </pre>
 * Only the property binding layer interprets {@link #properties()}.
 */
public final class RawRecord {
  private final ObjectNode json;

  private RawRecord(ObjectNode json) {
    this.json = json;
  }

  /** Wraps a copy of {@code json}. */
  public static RawRecord of(JsonNode json) {
    Objects.requireNonNull(json, "json");
    if (!json.isObject()) throw new IllegalArgumentException("Raw record must be a JSON object, got " + json.getNodeType());
    return new RawRecord(((ObjectNode) json).deepCopy());
  }

  public String id() {
    return text("id");
  }

  public OffsetDateTime createdTime() {
    return time("created_time");
  }

  public OffsetDateTime lastEditedTime() {
    return time("last_edited_time");
  }

  public boolean archived() {
    return json.path("archived").asBoolean(false);
  }

  /** Property bag keyed by property name; empty when the record carries none. */
  public ObjectNode properties() {
    JsonNode p = json.get("properties");
    return (p != null && p.isObject()) ? ((ObjectNode) p).deepCopy() : JsonNodeFactory.instance.objectNode();
  }

  public ObjectNode json() {
    return json.deepCopy();
  }

  private String text(String field) {
    JsonNode n = json.get(field);
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private OffsetDateTime time(String field) {
    String s = text(field);
    if (s == null) return null;
    try {
      return OffsetDateTime.parse(s);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Malformed " + field + " '" + s + "' on record " + id(), e);
    }
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RawRecord r && json.equals(r.json));
  }

  @Override
  public int hashCode() {
    return json.hashCode();
  }

  @Override
  public String toString() {
    return "RawRecord" + json;
  }
}
