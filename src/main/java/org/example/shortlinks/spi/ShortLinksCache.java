package org.example.shortlinks.spi;

import java.util.Optional;

/**
 * Optional fast-path store for the shortId to target URL mapping.
 *
 * <p>A manager may hold several caches; they are consulted in registration order. Eviction and
 * expiry are each implementation's own business.
 */
public interface ShortLinksCache {

  /** One-time setup. The manager calls it lazily before first use; it must be idempotent. */
  default void init() {}

  /**
   * @param shortId id to look up
   * @return cached target URL, or empty on a miss
   */
  Optional<String> get(String shortId);

  /**
   * @param shortId id
   * @param targetUrl value to cache, never {@code null}
   */
  void set(String shortId, String targetUrl);

  /**
   * Removes the entry for {@code shortId} if present.
   *
   * @param shortId id to drop
   */
  void delete(String shortId);
}
