package io.intellixity.folio.exec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One batch returned by {@link CollectionEndpoint#query}. */
public record PageResult(List<RawRecord> records, boolean hasMore, String nextCursor) {
  public PageResult {
    records = List.copyOf(records == null ? List.of() : records);
  }

  public static PageResult last(List<RawRecord> records) {
    return new PageResult(records, false, null);
  }

  public static PageResult more(List<RawRecord> records, String nextCursor) {
    return new PageResult(records, true, Objects.requireNonNull(nextCursor, "nextCursor"));
  }

  /** Reads a list response: {@code {"results": [...], "has_more": true, "next_cursor": "..."}}. */
  public static PageResult fromJson(JsonNode json) {
    Objects.requireNonNull(json, "json");
    List<RawRecord> out = new ArrayList<>();
    for (JsonNode r : json.path("results")) out.add(RawRecord.of(r));
    JsonNode cursor = json.get("next_cursor");
    return new PageResult(out, json.path("has_more").asBoolean(false),
        (cursor == null || cursor.isNull()) ? null : cursor.asText());
  }
}
