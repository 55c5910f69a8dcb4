package org.example.shortlinks.core;

/**
 * Behavioral switches of {@link LinkManager}.
 *
 * <p>Fields are public and mutable, like the application config, so they can be filled straight from
 * JSON. {@link LinkManager} copies them when it is created; later changes have no effect on an
 * existing manager.
 */
public class ManagerOptions {

  /** Bump {@code lastAccessedAt} on every successful {@code getTargetUrl}. */
  public boolean shouldUpdateLastAccessOnGet = true;

  /**
   * Maximum candidate batches tried by {@code createShortLink}. Each batch that is entirely taken
   * escalates the id length by one.
   */
  public int maxCreateAttempts = 3;

  /** Number of distinct candidates checked against the backend per attempt. */
  public int candidateBatchSize = 50;

  /** After pruning, delete the removed ids from every cache tier (best effort). */
  public boolean invalidateCachesOnClean = true;

  /** Returns a field-by-field copy. */
  public ManagerOptions copy() {
    ManagerOptions o = new ManagerOptions();
    o.shouldUpdateLastAccessOnGet = shouldUpdateLastAccessOnGet;
    o.maxCreateAttempts = maxCreateAttempts;
    o.candidateBatchSize = candidateBatchSize;
    o.invalidateCachesOnClean = invalidateCachesOnClean;
    return o;
  }

  void validate() {
    if (maxCreateAttempts < 1) {
      throw new IllegalArgumentException("maxCreateAttempts must be >= 1: " + maxCreateAttempts);
    }
    if (candidateBatchSize < 1) {
      throw new IllegalArgumentException("candidateBatchSize must be >= 1: " + candidateBatchSize);
    }
  }
}
