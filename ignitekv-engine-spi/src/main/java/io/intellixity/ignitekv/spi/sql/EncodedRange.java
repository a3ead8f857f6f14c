package io.intellixity.ignitekv.spi.sql;

/**
 * A range query with its bounds already in column (encoded) form.\n
 *
 * Null bound = unbounded on that side. Negative limit = unlimited.
 */
public record EncodedRange(String lower, boolean lowerInclusive,
                           String upper, boolean upperInclusive,
                           boolean reverse, int limit) {
  public boolean hasLimit() {
    return limit >= 0;
  }
}
