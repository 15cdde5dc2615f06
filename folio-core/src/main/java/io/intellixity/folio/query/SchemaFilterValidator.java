package io.intellixity.folio.query;

import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.PropertyDef;

import java.util.List;
import java.util.Objects;

/**
 * Checks filters and sorts against a collection schema.
 * <p>
 * Validates:
 * <ul>
 *   <li>every referenced property is declared ({@link io.intellixity.folio.schema.UnknownPropertyException})</li>
 *   <li>the filter's type tag matches the declared type ({@link SchemaTypeException})</li>
 *   <li>the operator belongs to the type's operator set ({@link SchemaTypeException})</li>
 * </ul>
 */
public final class SchemaFilterValidator implements FilterVisitor<Void> {
  private final CollectionSchema schema;

  public SchemaFilterValidator(CollectionSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public void validate(Query query) {
    Objects.requireNonNull(query, "query");
    validate(query.filter());
    validateSorts(query.sorts());
  }

  public void validate(QueryFilter filter) {
    if (filter != null) filter.accept(this);
  }

  public void validateSorts(List<SortSpec> sorts) {
    for (SortSpec s : sorts) validate(s);
  }

  public void validate(SortSpec sort) {
    if (sort.target() instanceof FilterTarget.PropertyRef p) schema.property(p.name());
  }

  @Override
  public Void visit(Filter filter) {
    if (filter.target() instanceof FilterTarget.PropertyRef p) {
      PropertyDef def = schema.property(p.name());
      if (p.typeTag() != null && !p.typeTag().equals(def.typeId())) {
        throw new SchemaTypeException(
            "Filter on '" + p.name() + "' uses type '" + p.typeTag() + "' but the property is '" + def.typeId() + "'");
      }
      Filter.check(def, filter.constraint());
    }
    return null;
  }

  @Override
  public Void visit(CompoundFilter compound) {
    for (QueryFilter child : compound.children()) child.accept(this);
    return null;
  }
}
