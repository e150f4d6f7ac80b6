package io.intellixity.arbor.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Loads SPI implementations listed in {@code META-INF/arbor.factories} resources. Each resource is a properties
 * file keyed by SPI interface name with comma-separated implementation class names:
 * <pre>
 * io.intellixity.arbor.spi.sql.DialectProvider=com.acme.MyDialectProvider
 * </pre>
 * Implementations need a public no-arg constructor; duplicates across resources are loaded once.
 */
public final class ArborFactoriesLoader {
  public static final String RESOURCE = "META-INF/arbor.factories";

  private ArborFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = ArborFactoriesLoader.class.getClassLoader();

    LinkedHashSet<String> names = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to read " + url, e);
      }
      String v = p.getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }

    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(name, spiType, cl));
    return out;
  }

  private static <T> T instantiate(String name, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(name, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException(name + " does not implement " + spiType.getName());
      }
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + name + " for " + spiType.getName(), e);
    }
  }
}
