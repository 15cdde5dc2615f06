package io.intellixity.folio.schema;

import io.intellixity.folio.schema.providers.OpaquePropertyType;
import io.intellixity.folio.util.FolioFactoriesLoader;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PropertyTypeRegistry built via discovery (META-INF/folio.factories).
 * <p>
 * Lookup order:
 * <ul>
 *   <li>types contributed by providers, first registration per id wins</li>
 *   <li>opaque read-only types synthesized on demand by {@link #getOrOpaque(String)}</li>
 * </ul>
 */
public final class DiscoveredPropertyTypeRegistry implements PropertyTypeRegistry {
  private final Map<String, PropertyType<?>> types;
  private final Map<String, PropertyType<?>> opaque = new ConcurrentHashMap<>();

  public DiscoveredPropertyTypeRegistry() {
    this(FolioFactoriesLoader.load(PropertyTypeProvider.class));
  }

  public DiscoveredPropertyTypeRegistry(List<PropertyTypeProvider> providers) {
    Map<String, PropertyType<?>> out = new LinkedHashMap<>();
    for (PropertyTypeProvider p : providers) {
      if (p == null) continue;
      Collection<PropertyType<?>> contributed = p.propertyTypes();
      if (contributed == null) continue;
      for (PropertyType<?> t : contributed) {
        if (t == null) continue;
        out.putIfAbsent(t.id(), t);
      }
    }
    this.types = Collections.unmodifiableMap(out);
  }

  /** Registry shared by schemas that do not name one explicitly. */
  public static PropertyTypeRegistry shared() {
    return Shared.INSTANCE;
  }

  @Override
  public PropertyType<?> get(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Unknown property type: " + id);
    PropertyType<?> t = types.get(id);
    if (t == null) throw new IllegalArgumentException("Unknown property type: " + id + " (known: " + types.keySet() + ")");
    return t;
  }

  @Override
  public PropertyType<?> getOrOpaque(String id) {
    Objects.requireNonNull(id, "id");
    PropertyType<?> t = types.get(id);
    return t != null ? t : opaque.computeIfAbsent(id, OpaquePropertyType::new);
  }

  /** Registered type ids in discovery order. */
  public Set<String> ids() {
    return types.keySet();
  }

  private static final class Shared {
    static final PropertyTypeRegistry INSTANCE = new DiscoveredPropertyTypeRegistry();
  }
}
