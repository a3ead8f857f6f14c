package io.intellixity.ignitekv.config;

/** How a single {@code put} is turned into statements. Both give the caller identical results. */
public enum PutStrategy {
  /** One MERGE statement (atomic upsert). */
  MERGE,
  /** UPDATE, then INSERT when no row changed; a duplicate-key INSERT is retried as UPDATE. */
  UPDATE_THEN_INSERT
}
