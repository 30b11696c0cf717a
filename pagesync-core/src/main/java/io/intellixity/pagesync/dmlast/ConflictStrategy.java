package io.intellixity.pagesync.dmlast;

public enum ConflictStrategy {
  /** {@code ON CONFLICT (target) DO UPDATE SET c = EXCLUDED.c} for every non-key column. */
  OVERWRITE,
  /** {@code ON CONFLICT (target) DO NOTHING}. */
  IGNORE,
  /** Plain insert; a conflict surfaces as a unique violation. */
  NONE
}
