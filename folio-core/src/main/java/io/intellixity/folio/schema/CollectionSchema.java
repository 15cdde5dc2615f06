package io.intellixity.folio.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Declared schema of a remote collection: an ordered, immutable mapping of property name to
 * {@link PropertyDef}. One instance is shared by every record bound to the collection.
 */
public final class CollectionSchema {
  private final Map<String, PropertyDef> properties;

  private CollectionSchema(Map<String, PropertyDef> properties) {
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public static Builder builder() {
    return new Builder(DiscoveredPropertyTypeRegistry.shared());
  }

  public static Builder builder(PropertyTypeRegistry types) {
    return new Builder(types);
  }

  /**
   * Reads a remote collection schema of the form
   * {@code {"Name": {"type": "title", "title": {}}, "Tags": {"type": "multi_select", "multi_select": {"options": [{"name": "a"}]}}}}.
   * Unknown type tags become opaque read-only properties.
   */
  public static CollectionSchema fromJson(JsonNode json, PropertyTypeRegistry types) {
    Objects.requireNonNull(types, "types");
    if (json == null || !json.isObject()) throw new IllegalArgumentException("Collection schema JSON must be an object");
    Builder b = new Builder(types);
    Iterator<Map.Entry<String, JsonNode>> it = json.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String typeId = e.getValue().path("type").asText(null);
      if (typeId == null) throw new IllegalArgumentException("Property '" + e.getKey() + "' has no type");
      List<String> options = new ArrayList<>();
      for (JsonNode opt : e.getValue().path(typeId).path("options")) {
        JsonNode name = opt.get("name");
        if (name != null && name.isTextual()) options.add(name.asText());
      }
      b.property(new PropertyDef(e.getKey(), types.getOrOpaque(typeId), options));
    }
    return b.build();
  }

  public static CollectionSchema fromJson(JsonNode json) {
    return fromJson(json, DiscoveredPropertyTypeRegistry.shared());
  }

  /** Returns the definition of {@code name}; throws {@link UnknownPropertyException} if absent. */
  public PropertyDef property(String name) {
    PropertyDef def = (name == null) ? null : properties.get(name);
    if (def == null) {
      throw new UnknownPropertyException(name, "Unknown property '" + name + "' (declared: " + properties.keySet() + ")");
    }
    return def;
  }

  public Optional<PropertyDef> find(String name) {
    return Optional.ofNullable(name == null ? null : properties.get(name));
  }

  public boolean contains(String name) {
    return name != null && properties.containsKey(name);
  }

  /** Property names in declaration order. */
  public Set<String> names() {
    return properties.keySet();
  }

  public Collection<PropertyDef> properties() {
    return properties.values();
  }

  public int size() {
    return properties.size();
  }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(", ", "CollectionSchema{", "}");
    for (PropertyDef d : properties.values()) j.add(d.name() + ":" + d.typeId());
    return j.toString();
  }

  public static final class Builder {
    private final PropertyTypeRegistry types;
    private final Map<String, PropertyDef> properties = new LinkedHashMap<>();

    private Builder(PropertyTypeRegistry types) {
      this.types = Objects.requireNonNull(types, "types");
    }

    public Builder property(String name, String typeId, String... options) {
      return property(new PropertyDef(name, types.get(typeId), options == null ? List.of() : List.of(options)));
    }

    public Builder property(PropertyDef def) {
      Objects.requireNonNull(def, "def");
      if (properties.putIfAbsent(def.name(), def) != null) {
        throw new IllegalArgumentException("Duplicate property '" + def.name() + "'");
      }
      return this;
    }

    public CollectionSchema build() {
      return new CollectionSchema(properties);
    }
  }
}
