package io.intellixity.folio.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Properties-based extension loader for folio.
 * <p>
 * Reads every {@code META-INF/folio.factories} resource on the classpath. Each resource maps an
 * SPI interface name to a comma separated list of implementation class names:
 *
 * <pre>
 * io.intellixity.folio.schema.PropertyTypeProvider=com.acme.MoneyTypes,com.acme.GeoTypes
 * </pre>
 *
 * Implementations need a public no-arg constructor. Duplicates are dropped, order is kept.
 */
public final class FolioFactoriesLoader {
  public static final String RESOURCE = "META-INF/folio.factories";

  private FolioFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = FolioFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Extension class not found: " + implName + " for " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
