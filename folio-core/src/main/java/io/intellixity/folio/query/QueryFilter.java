package io.intellixity.folio.query;

/** Node of a filter tree: a single {@link Filter} or a {@link CompoundFilter}. */
public interface QueryFilter {
  <R> R accept(FilterVisitor<R> visitor);

  /** Combines with {@code other} under AND, appending to this node if it already is an AND group. */
  default QueryFilter and(QueryFilter other) {
    return CompoundFilter.combine(Clause.AND, this, other);
  }

  /** Combines with {@code other} under OR, appending to this node if it already is an OR group. */
  default QueryFilter or(QueryFilter other) {
    return CompoundFilter.combine(Clause.OR, this, other);
  }
}
