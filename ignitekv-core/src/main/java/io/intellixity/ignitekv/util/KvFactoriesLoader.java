package io.intellixity.ignitekv.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Instantiates implementations registered under {@code META-INF/ignitekv.factories}.\n
 *
 * Every copy of the resource on the classpath is read as Properties. The key is an interface name and
 * the value a comma-separated list of implementation classes with public no-arg constructors:
 *
 * <pre>
 * io.intellixity.ignitekv.jdbc.dialect.JdbcDialect=io.intellixity.ignitekv.jdbc.h2.H2Dialect
 * </pre>
 *
 * Classes are instantiated once each, in classpath order.
 */
public final class KvFactoriesLoader {
  public static final String RESOURCE = "META-INF/ignitekv.factories";

  private KvFactoriesLoader() {}

  /** Loads through the context class loader, falling back to this class's loader. */
  public static <T> List<T> load(Class<T> type) {
    Objects.requireNonNull(type, "type");
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = KvFactoriesLoader.class.getClassLoader();
    List<T> instances = new ArrayList<>();
    for (String className : registeredNames(type, cl)) {
      instances.add(instantiate(type, className, cl));
    }
    return instances;
  }

  static Set<String> registeredNames(Class<?> type, ClassLoader cl) {
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String listed = read(url).getProperty(type.getName(), "");
      for (String name : listed.split(",")) {
        if (!name.isBlank()) names.add(name.trim());
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties props = new Properties();
    try (InputStream in = url.openStream()) {
      props.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    return props;
  }

  private static <T> T instantiate(Class<T> type, String className, ClassLoader cl) {
    try {
      Class<?> cls = Class.forName(className, true, cl);
      if (!type.isAssignableFrom(cls)) {
        throw new IllegalArgumentException(className + " is registered as " + type.getSimpleName() + " but does not implement it");
      }
      return type.cast(cls.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create " + type.getSimpleName() + " " + className, e);
    }
  }
}
