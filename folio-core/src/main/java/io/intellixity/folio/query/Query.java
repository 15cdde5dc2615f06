package io.intellixity.folio.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Compiled query request: filter tree, ordered sorts, optional start cursor and page-size hint.
 * Immutable; the wire payload of equal queries is identical.
 */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final QueryFilter filter;
  private final List<SortSpec> sorts;
  private final String startCursor;
  private final Integer pageSize;

  public Query(QueryFilter filter, List<SortSpec> sorts, String startCursor, Integer pageSize) {
    if (pageSize != null && pageSize <= 0) throw new InvalidArgumentException("page_size must be > 0");
    this.filter = filter;
    this.sorts = List.copyOf(sorts == null ? List.of() : sorts);
    this.startCursor = startCursor;
    this.pageSize = pageSize;
  }

  /** Null when the query matches every record. */
  public QueryFilter filter() { return filter; }
  public List<SortSpec> sorts() { return sorts; }
  public String startCursor() { return startCursor; }
  public Integer pageSize() { return pageSize; }

  /** Same query continuing at {@code cursor}; every other field is unchanged. */
  public Query withStartCursor(String cursor) {
    return new Query(filter, sorts, cursor, pageSize);
  }

  /** Wire payload, written by {@link QueryJsonSerializer}. */
  public ObjectNode toPayload() {
    return JSON.valueToTree(this);
  }

  public static Query fromPayload(JsonNode payload) {
    Objects.requireNonNull(payload, "payload");
    try {
      return JSON.treeToValue(payload, Query.class);
    } catch (JsonProcessingException e) {
      throw new InvalidArgumentException("Malformed query payload: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Query q)) return false;
    return Objects.equals(filter, q.filter) && sorts.equals(q.sorts)
        && Objects.equals(startCursor, q.startCursor) && Objects.equals(pageSize, q.pageSize);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filter, sorts, startCursor, pageSize);
  }

  @Override
  public String toString() {
    return toPayload().toString();
  }
}
