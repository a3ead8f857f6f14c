package io.intellixity.ignitekv.spi.sql;

import io.intellixity.ignitekv.util.KvFactoriesLoader;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/** Resolves the dialect registered (in {@code META-INF/ignitekv.factories}) for a location scheme. */
public final class Dialects {
  private Dialects() {}

  public static <D extends Dialect> D forScheme(Class<D> dialectType, String scheme) {
    return forScheme(KvFactoriesLoader.load(dialectType), scheme);
  }

  static <D extends Dialect> D forScheme(List<D> candidates, String scheme) {
    Objects.requireNonNull(scheme, "scheme");
    String s = scheme.toLowerCase(Locale.ROOT);
    for (D d : candidates) {
      if (d.schemes().contains(s)) return d;
    }
    TreeSet<String> known = new TreeSet<>();
    for (D d : candidates) known.addAll(d.schemes());
    throw new IllegalArgumentException("No dialect registered for scheme '" + scheme + "' (known: " + known + ")");
  }
}
