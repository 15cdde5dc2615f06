package io.intellixity.folio.query;

public interface FilterVisitor<R> {
  R visit(Filter filter);
  R visit(CompoundFilter compound);
}
