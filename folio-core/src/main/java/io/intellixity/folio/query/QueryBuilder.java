package io.intellixity.folio.query;

import io.intellixity.folio.config.FolioSettings;
import io.intellixity.folio.exec.CollectionEndpoint;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.exec.PageIterator;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.schema.CollectionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Fluent, mutable accumulator of filter, sorts and result cap for one collection.
 * <p>
 * Each {@code filter(...)} call is AND-combined with what is already there; chained ANDs stay one
 * flat group. Sorts keep insertion order, first added wins. When a schema is attached every
 * property reference is checked as it is added.
 * <p>
 * {@link #execute()} compiles the current state and returns a fresh lazy {@link PageIterator};
 * later changes to the builder do not affect iterators already handed out.
 */
public final class QueryBuilder<T> {
  private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

  private final CollectionRef collection;
  private final CollectionSchema schema;
  private final CollectionEndpoint endpoint;
  private final Function<RawRecord, T> mapper;
  private final FolioSettings settings;
  private final SchemaFilterValidator validator;

  private QueryFilter root;
  private final List<SortSpec> sorts = new ArrayList<>();
  private Integer limit;
  private Integer pageSize;
  private String startCursor;

  /**
   * @param schema   schema used to validate property references; null disables validation
   *                 and the name-based {@code filter(String, Constraint)}
   * @param endpoint null for a builder that only {@link #compile()}s
   */
  public QueryBuilder(CollectionRef collection,
                      CollectionSchema schema,
                      CollectionEndpoint endpoint,
                      Function<RawRecord, T> mapper,
                      FolioSettings settings) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.schema = schema;
    this.endpoint = endpoint;
    this.validator = (schema == null) ? null : new SchemaFilterValidator(schema);
  }

  /** Builder yielding raw records. */
  public static QueryBuilder<RawRecord> raw(CollectionRef collection, CollectionSchema schema, CollectionEndpoint endpoint) {
    return new QueryBuilder<>(collection, schema, endpoint, Function.identity(), FolioSettings.defaults());
  }

  public QueryBuilder<T> filter(QueryFilter filter) {
    Objects.requireNonNull(filter, "filter");
    if (validator != null) validator.validate(filter);
    root = (root == null) ? filter : root.and(filter);
    return this;
  }

  /** Filters on a schema property by name; the operator is checked against the property type. */
  public QueryBuilder<T> filter(String property, Constraint constraint) {
    if (schema == null) {
      throw new InvalidArgumentException("Filtering by property name needs a collection schema; use filter(Filter.property(name, type, c))");
    }
    return filter(Filter.property(schema, property, constraint));
  }

  public QueryBuilder<T> filter(Timestamp timestamp, Constraint constraint) {
    return filter(Filter.timestamp(timestamp, constraint));
  }

  /** AND-combines one OR group of {@code alternatives}. */
  public QueryBuilder<T> filterAny(QueryFilter... alternatives) {
    Objects.requireNonNull(alternatives, "alternatives");
    if (alternatives.length < 2) {
      throw new InvalidArgumentException("filterAny needs at least two alternatives, got " + alternatives.length);
    }
    return filter(CompoundFilter.of(Clause.OR, Arrays.asList(alternatives)));
  }

  public QueryBuilder<T> sort(String property, SortSpec.Direction direction) {
    return sort(SortSpec.property(property, direction));
  }

  public QueryBuilder<T> sort(Timestamp timestamp, SortSpec.Direction direction) {
    return sort(SortSpec.timestamp(timestamp, direction));
  }

  public QueryBuilder<T> sort(SortSpec sort) {
    Objects.requireNonNull(sort, "sort");
    if (validator != null) validator.validate(sort);
    sorts.add(sort);
    return this;
  }

  /** Caps the number of records the iterator yields. */
  public QueryBuilder<T> limit(int n) {
    if (n <= 0) throw new InvalidArgumentException("limit must be > 0, got " + n);
    this.limit = n;
    return this;
  }

  /** Page-size hint sent to the endpoint; at most the configured maximum. */
  public QueryBuilder<T> pageSize(int n) {
    if (n <= 0 || n > settings.maxPageSize()) {
      throw new InvalidArgumentException("pageSize must be in [1, " + settings.maxPageSize() + "], got " + n);
    }
    this.pageSize = n;
    return this;
  }

  /** Resumes at a cursor obtained from a previous page. */
  public QueryBuilder<T> startAt(String cursor) {
    this.startCursor = cursor;
    return this;
  }

  /**
   * Snapshot of the current state. The page size is the explicit one, or the default, and never
   * more than the result cap.
   */
  public Query compile() {
    int size = (pageSize != null) ? pageSize : settings.defaultPageSize();
    if (limit != null) size = Math.min(size, limit);
    return new Query(root, sorts, startCursor, size);
  }

  public PageIterator<T> execute() {
    if (endpoint == null) throw new IllegalStateException("No collection endpoint attached to this builder");
    Query q = compile();
    log.debug("folio.query collection={} sorts={} limit={} pageSize={}", collection, sorts.size(), limit, q.pageSize());
    return new PageIterator<>(endpoint, collection, q, limit, mapper);
  }

  /** First matching record, fetching a single one-record page. Leaves this builder unchanged. */
  public Optional<T> first() {
    QueryBuilder<T> one = copy();
    one.limit = 1;
    one.pageSize = 1;
    PageIterator<T> it = one.execute();
    return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
  }

  public QueryBuilder<T> copy() {
    QueryBuilder<T> c = new QueryBuilder<>(collection, schema, endpoint, mapper, settings);
    c.root = root;
    c.sorts.addAll(sorts);
    c.limit = limit;
    c.pageSize = pageSize;
    c.startCursor = startCursor;
    return c;
  }

  public CollectionRef collection() { return collection; }
  public Optional<CollectionSchema> schema() { return Optional.ofNullable(schema); }
  public QueryFilter currentFilter() { return root; }
  public List<SortSpec> currentSorts() { return List.copyOf(sorts); }
  public Integer currentLimit() { return limit; }
}
