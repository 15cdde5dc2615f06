package io.intellixity.folio.query;

import java.util.*;

/**
 * Boolean AND/OR over child filters. Children of the same clause are flattened into the parent, so
 * chaining three ANDs gives one group of three rather than nested pairs.
 */
public final class CompoundFilter implements QueryFilter {
  private final Clause clause;
  private final List<QueryFilter> children;

  public CompoundFilter(Clause clause, List<? extends QueryFilter> children) {
    this.clause = Objects.requireNonNull(clause, "clause");
    Objects.requireNonNull(children, "children");
    if (children.isEmpty()) throw new InvalidArgumentException("A compound filter needs at least one child");
    for (QueryFilter c : children) Objects.requireNonNull(c, "child");
    this.children = List.copyOf(children);
  }

  public static CompoundFilter and(QueryFilter... filters) {
    return of(Clause.AND, Arrays.asList(filters));
  }

  public static CompoundFilter or(QueryFilter... filters) {
    return of(Clause.OR, Arrays.asList(filters));
  }

  public static CompoundFilter of(Clause clause, List<? extends QueryFilter> filters) {
    List<QueryFilter> out = new ArrayList<>();
    for (QueryFilter f : filters) addFlattened(out, clause, f);
    return new CompoundFilter(clause, out);
  }

  static QueryFilter combine(Clause clause, QueryFilter left, QueryFilter right) {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    List<QueryFilter> out = new ArrayList<>();
    addFlattened(out, clause, left);
    addFlattened(out, clause, right);
    return new CompoundFilter(clause, out);
  }

  private static void addFlattened(List<QueryFilter> out, Clause clause, QueryFilter f) {
    Objects.requireNonNull(f, "filter");
    if (f instanceof CompoundFilter cf && cf.clause == clause) {
      out.addAll(cf.children);
    } else {
      out.add(f);
    }
  }

  public Clause clause() { return clause; }
  public List<QueryFilter> children() { return children; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CompoundFilter c)) return false;
    return clause == c.clause && children.equals(c.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clause, children);
  }

  @Override
  public String toString() {
    return clause.wireName() + children;
  }
}
