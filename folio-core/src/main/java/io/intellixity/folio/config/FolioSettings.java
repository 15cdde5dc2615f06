package io.intellixity.folio.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

/**
 * Client-side settings.
 * <p>
 * {@link #load()} reads the first {@code folio.properties} found on the classpath:
 * <pre>
 * folio.page-size.default=100
 * folio.page-size.max=100
 * </pre>
 * Missing keys keep their defaults.
 */
public record FolioSettings(int defaultPageSize, int maxPageSize) {
  public static final String RESOURCE = "folio.properties";
  public static final int MAX_PAGE_SIZE = 100;

  public FolioSettings {
    if (maxPageSize <= 0) throw new IllegalArgumentException("folio.page-size.max must be > 0");
    if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
      throw new IllegalArgumentException("folio.page-size.default must be in [1, " + maxPageSize + "]");
    }
  }

  public static FolioSettings defaults() {
    return new FolioSettings(MAX_PAGE_SIZE, MAX_PAGE_SIZE);
  }

  public static FolioSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static FolioSettings load(ClassLoader cl) {
    if (cl == null) cl = FolioSettings.class.getClassLoader();
    URL url = cl.getResource(RESOURCE);
    if (url == null) return defaults();
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return fromProperties(p);
  }

  public static FolioSettings fromProperties(Properties p) {
    int max = intProperty(p, "folio.page-size.max", MAX_PAGE_SIZE);
    int def = intProperty(p, "folio.page-size.default", Math.min(MAX_PAGE_SIZE, max));
    return new FolioSettings(def, max);
  }

  private static int intProperty(Properties p, String key, int fallback) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return fallback;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": '" + v + "'", e);
    }
  }
}
