package io.intellixity.folio.query;

import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.PropertyDef;

import java.util.Objects;

/**
 * A {@link Constraint} bound to a property or timestamp. Immutable.
 * <p>
 * Use {@link #property(CollectionSchema, String, Constraint)} when the collection schema is known:
 * the property must exist and the operator must belong to its type's operator set. The untyped
 * {@link #property(String, String, Constraint)} passes the constraint through unchecked.
 */
public final class Filter implements QueryFilter {
  private final FilterTarget target;
  private final Constraint constraint;

  private Filter(FilterTarget target, Constraint constraint) {
    this.target = Objects.requireNonNull(target, "target");
    this.constraint = Objects.requireNonNull(constraint, "constraint");
  }

  public static Filter property(CollectionSchema schema, String name, Constraint constraint) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(constraint, "constraint");
    PropertyDef def = schema.property(name);
    check(def, constraint);
    return new Filter(new FilterTarget.PropertyRef(name, def.typeId()), constraint);
  }

  /** Filter on a property of a collection whose schema is unknown; the operator is not checked. */
  public static Filter property(String name, String typeTag, Constraint constraint) {
    Objects.requireNonNull(typeTag, "typeTag");
    return new Filter(new FilterTarget.PropertyRef(name, typeTag), constraint);
  }

  public static Filter timestamp(Timestamp timestamp, Constraint constraint) {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(constraint, "constraint");
    ConditionType.DATE.check("timestamp '" + timestamp.wireName() + "'", constraint);
    return new Filter(new FilterTarget.TimestampRef(timestamp), constraint);
  }

  static void check(PropertyDef def, Constraint constraint) {
    ConditionType ct = def.type().conditionType();
    String label = "property '" + def.name() + "' (" + def.typeId() + ")";
    if (ct == null) throw new SchemaTypeException("Filtering is not supported on " + label);
    ct.check(label, constraint);
  }

  public FilterTarget target() { return target; }
  public Constraint constraint() { return constraint; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Filter f)) return false;
    return target.equals(f.target) && constraint.equals(f.constraint);
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, constraint);
  }

  @Override
  public String toString() {
    String formula = constraint.formula() == null ? "" : "formula." + constraint.formula().wireName() + " ";
    return "Filter{" + target + " " + formula + constraint.operator().wireName() + " " + constraint.operand() + "}";
  }
}
