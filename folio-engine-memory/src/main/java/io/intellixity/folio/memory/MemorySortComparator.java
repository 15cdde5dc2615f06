package io.intellixity.folio.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.query.SortSpec;
import io.intellixity.folio.schema.CollectionSchema;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Orders stored records by a list of sorts, first sort first. Empty values sort last in either direction. */
final class MemorySortComparator implements Comparator<ObjectNode> {
  private final CollectionSchema schema;
  private final List<SortSpec> sorts;

  MemorySortComparator(CollectionSchema schema, List<SortSpec> sorts) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.sorts = List.copyOf(sorts);
  }

  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  public int compare(ObjectNode a, ObjectNode b) {
    for (SortSpec s : sorts) {
      Comparable ka = MemoryValues.sortKey(MemoryValues.valueOf(schema, a, s.target()));
      Comparable kb = MemoryValues.sortKey(MemoryValues.valueOf(schema, b, s.target()));
      if (ka == null && kb == null) continue;
      if (ka == null) return 1;
      if (kb == null) return -1;
      int cmp = ka.compareTo(kb);
      if (cmp != 0) return s.direction() == SortSpec.Direction.DESCENDING ? -cmp : cmp;
    }
    return 0;
  }
}
