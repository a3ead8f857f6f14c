package io.intellixity.ignitekv.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsed store location: {@code scheme://host[:port]/cacheName}, e.g. {@code ignite://127.0.0.1:10800/orders}.\n
 *
 * Port is -1 when absent.
 */
public record StoreLocation(String scheme, String host, int port, String cacheName) {
  private static final Pattern CACHE_NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

  public StoreLocation {
    Objects.requireNonNull(scheme, "scheme");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(cacheName, "cacheName");
    scheme = scheme.toLowerCase(Locale.ROOT);
    if (!CACHE_NAME.matcher(cacheName).matches()) {
      throw new IllegalArgumentException("Invalid cache name '" + cacheName + "'");
    }
  }

  public static StoreLocation parse(String location) {
    if (location == null || location.isBlank()) throw new IllegalArgumentException("location is required");
    URI uri;
    try {
      uri = new URI(location.trim());
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid location '" + location + "'", e);
    }
    if (uri.getScheme() == null) throw new IllegalArgumentException("Location has no scheme: " + location);
    String host = uri.getHost();
    int port = uri.getPort();
    if (host == null) {
      // java.net.URI leaves host unset for names it will not accept, such as "my_host"
      String authority = uri.getAuthority();
      if (authority == null || authority.isEmpty()) {
        throw new IllegalArgumentException("Location has no host: " + location);
      }
      authority = authority.substring(authority.indexOf('@') + 1);
      int colon = authority.lastIndexOf(':');
      if (colon > 0 && colon < authority.length() - 1 && authority.substring(colon + 1).chars().allMatch(Character::isDigit)) {
        port = Integer.parseInt(authority.substring(colon + 1));
        host = authority.substring(0, colon);
      } else {
        host = authority;
      }
      if (host.isEmpty()) throw new IllegalArgumentException("Location has no host: " + location);
    }
    String path = uri.getPath() == null ? "" : uri.getPath();
    String cache = path.startsWith("/") ? path.substring(1) : path;
    if (cache.isEmpty()) throw new IllegalArgumentException("Location has no cache name: " + location);
    return new StoreLocation(uri.getScheme(), host, port, cache);
  }

  /** {@code host} or {@code host:port}. */
  public String authority() {
    return port < 0 ? host : host + ":" + port;
  }

  @Override
  public String toString() {
    return scheme + "://" + authority() + "/" + cacheName;
  }
}
