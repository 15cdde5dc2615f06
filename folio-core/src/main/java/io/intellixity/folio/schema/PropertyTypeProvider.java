package io.intellixity.folio.schema;

import java.util.Collection;

/**
 * Contributes {@link PropertyType} implementations.
 * <p>
 * Providers are discovered from {@code META-INF/folio.factories}; the first provider to register a
 * given type id wins.
 */
public interface PropertyTypeProvider {
  Collection<PropertyType<?>> propertyTypes();
}
