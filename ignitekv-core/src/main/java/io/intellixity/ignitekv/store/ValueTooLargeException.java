package io.intellixity.ignitekv.store;

/** A key or value does not fit the width of its backing column. */
public final class ValueTooLargeException extends KvStoreException {
  private final String column;
  private final int encodedLength;
  private final int maxLength;

  public ValueTooLargeException(String column, int encodedLength, int maxLength) {
    super(column + " too large: encoded length " + encodedLength + " exceeds column width " + maxLength);
    this.column = column;
    this.encodedLength = encodedLength;
    this.maxLength = maxLength;
  }

  public String column() { return column; }
  public int encodedLength() { return encodedLength; }
  public int maxLength() { return maxLength; }
}
