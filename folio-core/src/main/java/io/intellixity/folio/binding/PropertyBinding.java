package io.intellixity.folio.binding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.PropertyDef;
import io.intellixity.folio.schema.PropertyType;
import io.intellixity.folio.schema.PropertyTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Typed view over the raw property bag of one record, plus its dirty set.
 * <p>
 * Values are kept as wire payloads and decoded on read. A successful {@link #set(String, Object)}
 * marks the property dirty; a failed one leaves value and dirty set untouched. Property names not
 * declared by the schema are rejected on access and ignored on load.
 */
public final class PropertyBinding {
  private static final Logger log = LoggerFactory.getLogger(PropertyBinding.class);

  private final CollectionSchema schema;
  private final Map<String, JsonNode> rawValues = new LinkedHashMap<>();
  private final Set<String> dirty = new LinkedHashSet<>();

  private PropertyBinding(CollectionSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public static PropertyBinding empty(CollectionSchema schema) {
    return new PropertyBinding(schema);
  }

  /**
   * Binds a remote property bag {@code {"<name>": {"type": "<tag>", "<tag>": <payload>}}}.
   * Entries for undeclared names are skipped.
   */
  public static PropertyBinding load(CollectionSchema schema, ObjectNode properties) {
    PropertyBinding b = new PropertyBinding(schema);
    if (properties == null) return b;
    Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      Optional<PropertyDef> def = schema.find(e.getKey());
      if (def.isEmpty()) {
        log.debug("folio.bind skip undeclared property={}", e.getKey());
        continue;
      }
      JsonNode payload = e.getValue().get(def.get().typeId());
      if (payload != null) b.rawValues.put(e.getKey(), payload.deepCopy());
    }
    return b;
  }

  public CollectionSchema schema() { return schema; }

  /** Decoded value, or null when the property carries no value. */
  public Object get(String name) {
    PropertyDef def = schema.property(name);
    return def.type().decode(rawValues.get(name));
  }

  public <T> T get(PropertyAccessor<T> accessor) {
    Object v = get(accessor.name());
    try {
      return accessor.javaType().cast(v);
    } catch (ClassCastException e) {
      throw new PropertyTypeException("Property '" + accessor.name() + "' holds " + v.getClass().getSimpleName()
          + ", not " + accessor.javaType().getSimpleName(), e);
    }
  }

  /**
   * Validates {@code value} against the declared type and stores its encoded form.
   *
   * @throws io.intellixity.folio.schema.UnknownPropertyException if the name is not declared
   * @throws PropertyTypeException if the property is read-only or the value does not fit
   */
  public void set(String name, Object value) {
    PropertyDef def = writableDef(name);
    rawValues.put(name, encode(def, value));
    dirty.add(name);
  }

  public <T> void set(PropertyAccessor<T> accessor, T value) {
    set(accessor.name(), value);
  }

  /** Unsets a property; committed as the type's empty value. */
  public void clear(String name) {
    set(name, null);
  }

  /** Raw wire payload of a property, or null. */
  public JsonNode raw(String name) {
    schema.property(name);
    JsonNode n = rawValues.get(name);
    return n == null ? null : n.deepCopy();
  }

  /** Stores a wire payload directly. It must decode to a value the property accepts. */
  public void setRaw(String name, JsonNode payload) {
    PropertyDef def = writableDef(name);
    Object decoded;
    try {
      decoded = def.type().decode(payload);
    } catch (RuntimeException e) {
      throw new PropertyTypeException("Payload " + payload + " is not a valid '" + def.typeId() + "' value", e);
    }
    rawValues.put(name, encode(def, decoded));
    dirty.add(name);
  }

  public boolean isSet(String name) {
    schema.property(name);
    JsonNode n = rawValues.get(name);
    return n != null && !n.isNull();
  }

  public boolean isDirty() {
    return !dirty.isEmpty();
  }

  public Set<String> dirtyNames() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(dirty));
  }

  /** Partial-update payload {@code {"<name>": {"<tag>": <payload>}}} of the dirty properties. */
  public ObjectNode snapshotDirty() {
    return snapshot(dirty);
  }

  /** Payload of every writable property that holds a value, for record creation. */
  public ObjectNode snapshotAll() {
    List<String> names = new ArrayList<>();
    for (String n : rawValues.keySet()) {
      if (schema.property(n).type().writable()) names.add(n);
    }
    return snapshot(names);
  }

  public void clearDirty() {
    dirty.clear();
  }

  private ObjectNode snapshot(Collection<String> names) {
    ObjectNode out = JsonNodeFactory.instance.objectNode();
    for (String n : names) {
      PropertyDef def = schema.property(n);
      JsonNode payload = rawValues.get(n);
      out.putObject(n).set(def.typeId(), payload == null ? JsonNodeFactory.instance.nullNode() : payload.deepCopy());
    }
    return out;
  }

  private PropertyDef writableDef(String name) {
    PropertyDef def = schema.property(name);
    if (!def.type().writable()) {
      throw new PropertyTypeException("Property '" + name + "' of type '" + def.typeId() + "' is read-only");
    }
    return def;
  }

  @SuppressWarnings("unchecked")
  private static JsonNode encode(PropertyDef def, Object value) {
    PropertyType<Object> type = (PropertyType<Object>) def.type();
    return type.encode(type.coerce(def, value));
  }
}
