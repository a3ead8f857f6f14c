package io.intellixity.ignitekv.store;

/**
 * Immutable range descriptor for {@link KeyValueStore#iterator(RangeQuery)}.\n
 *
 * At most one lower bound ({@code gt} or {@code gte}) and one upper bound ({@code lt} or {@code lte}).
 * A negative {@code limit} means unlimited.
 */
public final class RangeQuery {
  private static final RangeQuery ALL = new RangeQuery(null, false, null, false, false, -1);

  private final ByteArray lower;
  private final boolean lowerInclusive;
  private final ByteArray upper;
  private final boolean upperInclusive;
  private final boolean reverse;
  private final int limit;

  private RangeQuery(ByteArray lower, boolean lowerInclusive,
                     ByteArray upper, boolean upperInclusive,
                     boolean reverse, int limit) {
    this.lower = lower;
    this.lowerInclusive = lowerInclusive;
    this.upper = upper;
    this.upperInclusive = upperInclusive;
    this.reverse = reverse;
    this.limit = limit;
  }

  /** Full scan in ascending key order. */
  public static RangeQuery all() {
    return ALL;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ByteArray lower() { return lower; }
  public boolean lowerInclusive() { return lowerInclusive; }
  public ByteArray upper() { return upper; }
  public boolean upperInclusive() { return upperInclusive; }
  public boolean reverse() { return reverse; }
  public int limit() { return limit; }

  public boolean hasLimit() {
    return limit >= 0;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RangeQuery{");
    if (lower != null) sb.append(lowerInclusive ? "gte=" : "gt=").append(lower).append(", ");
    if (upper != null) sb.append(upperInclusive ? "lte=" : "lt=").append(upper).append(", ");
    sb.append("reverse=").append(reverse);
    if (hasLimit()) sb.append(", limit=").append(limit);
    return sb.append('}').toString();
  }

  public static final class Builder {
    private ByteArray gt;
    private ByteArray gte;
    private ByteArray lt;
    private ByteArray lte;
    private boolean reverse;
    private int limit = -1;

    private Builder() {}

    public Builder gt(ByteArray key) { this.gt = key; return this; }
    public Builder gte(ByteArray key) { this.gte = key; return this; }
    public Builder lt(ByteArray key) { this.lt = key; return this; }
    public Builder lte(ByteArray key) { this.lte = key; return this; }
    public Builder gt(String key) { return gt(ByteArray.utf8(key)); }
    public Builder gte(String key) { return gte(ByteArray.utf8(key)); }
    public Builder lt(String key) { return lt(ByteArray.utf8(key)); }
    public Builder lte(String key) { return lte(ByteArray.utf8(key)); }
    public Builder reverse(boolean reverse) { this.reverse = reverse; return this; }
    public Builder limit(int limit) { this.limit = limit; return this; }

    public RangeQuery build() {
      if (gt != null && gte != null) throw new IllegalArgumentException("gt and gte are mutually exclusive");
      if (lt != null && lte != null) throw new IllegalArgumentException("lt and lte are mutually exclusive");
      ByteArray lower = (gt != null) ? gt : gte;
      ByteArray upper = (lt != null) ? lt : lte;
      return new RangeQuery(lower, gte != null, upper, lte != null, reverse, limit < 0 ? -1 : limit);
    }
  }
}
