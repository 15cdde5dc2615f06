package io.intellixity.folio.record;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.folio.binding.PropertyAccessor;
import io.intellixity.folio.config.FolioSettings;
import io.intellixity.folio.exec.CollectionEndpoint;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.RecordStore;
import io.intellixity.folio.query.QueryBuilder;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.DiscoveredPropertyTypeRegistry;
import io.intellixity.folio.schema.PropertyDef;
import io.intellixity.folio.schema.PropertyTypeRegistry;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Binds a record class to a collection: collection id, schema and a constructor.
 * <pre>
 * RecordType&lt;Task&gt; TASKS = RecordType.builder("tasks-db", Task::new)
 *     .property(Task.TITLE, "title")
 *     .property(Task.PRIORITY, "select", "High", "Low")
 *     .build();
 * </pre>
 */
public final class RecordType<R extends PageRecord> {
  private final CollectionRef collection;
  private final CollectionSchema schema;
  private final Function<RecordContext, R> factory;

  private RecordType(CollectionRef collection, CollectionSchema schema, Function<RecordContext, R> factory) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public static <R extends PageRecord> Builder<R> builder(String collectionId, Function<RecordContext, R> factory) {
    return new Builder<>(CollectionRef.of(collectionId), factory, DiscoveredPropertyTypeRegistry.shared());
  }

  public static <R extends PageRecord> RecordType<R> of(CollectionRef collection,
                                                         CollectionSchema schema,
                                                         Function<RecordContext, R> factory) {
    return new RecordType<>(collection, schema, factory);
  }

  /** Untyped records over a schema known only at runtime. */
  public static RecordType<PageRecord> dynamic(CollectionRef collection, CollectionSchema schema) {
    return new RecordType<>(collection, schema, PageRecord::new);
  }

  /** Record type whose schema is read from the remote collection description. */
  public static <R extends PageRecord> RecordType<R> fromSchemaJson(String collectionId,
                                                                     JsonNode schemaJson,
                                                                     Function<RecordContext, R> factory) {
    return new RecordType<>(CollectionRef.of(collectionId), CollectionSchema.fromJson(schemaJson), factory);
  }

  /** Untyped record type over a remote collection description. */
  public static RecordType<PageRecord> fromSchemaJson(CollectionRef collection, JsonNode schemaJson) {
    return new RecordType<>(collection, CollectionSchema.fromJson(schemaJson), PageRecord::new);
  }

  public CollectionRef collection() { return collection; }
  public CollectionSchema schema() { return schema; }

  /** Wraps a record returned by the remote side. */
  public R bind(RawRecord raw, RecordStore store) {
    Objects.requireNonNull(raw, "raw");
    return factory.apply(new RecordContext(this, store, raw));
  }

  /** A local record in state {@link RecordState#NEW}; {@link PageRecord#commit()} creates it. */
  public R newRecord(RecordStore store) {
    return factory.apply(new RecordContext(this, store, null));
  }

  public QueryBuilder<R> query(CollectionEndpoint endpoint, RecordStore store, FolioSettings settings) {
    Objects.requireNonNull(store, "store");
    return new QueryBuilder<>(collection, schema, endpoint, raw -> bind(raw, store), settings);
  }

  @Override
  public String toString() {
    return "RecordType{" + collection + ", " + schema + "}";
  }

  public static final class Builder<R extends PageRecord> {
    private final CollectionRef collection;
    private final Function<RecordContext, R> factory;
    private final PropertyTypeRegistry types;
    private final CollectionSchema.Builder schema;

    private Builder(CollectionRef collection, Function<RecordContext, R> factory, PropertyTypeRegistry types) {
      this.collection = collection;
      this.factory = Objects.requireNonNull(factory, "factory");
      this.types = types;
      this.schema = CollectionSchema.builder(types);
    }

    /**
     * Declares a property. The accessor's Java type must be able to hold the values of {@code typeId}.
     *
     * @throws IllegalArgumentException on an unknown type id or an incompatible accessor
     */
    public Builder<R> property(PropertyAccessor<?> accessor, String typeId, String... options) {
      Objects.requireNonNull(accessor, "accessor");
      PropertyDef def = new PropertyDef(accessor.name(), types.get(typeId), options == null ? List.of() : List.of(options));
      if (!accessor.javaType().isAssignableFrom(def.type().javaType())) {
        throw new IllegalArgumentException("Accessor '" + accessor.name() + "' of " + accessor.javaType().getSimpleName()
            + " cannot hold '" + typeId + "' values (" + def.type().javaType().getSimpleName() + ")");
      }
      schema.property(def);
      return this;
    }

    public RecordType<R> build() {
      return new RecordType<>(collection, schema.build(), factory);
    }
  }
}
