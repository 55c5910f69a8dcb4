package org.example.shortlinks.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.example.shortlinks.spi.ShortLinksCache;

/**
 * Bounded in-process cache tier with least-recently-used eviction.
 *
 * <p>Backed by an access-ordered {@link LinkedHashMap}; once {@code maxEntries} is exceeded the
 * least recently read or written entry is dropped. All methods are {@code synchronized}.
 */
public class LruCache implements ShortLinksCache {

  private final int maxEntries;
  private final Map<String, String> entries;

  /**
   * @param maxEntries capacity, must be positive
   */
  public LruCache(int maxEntries) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.maxEntries = maxEntries;
    this.entries =
        new LinkedHashMap<>(Math.min(maxEntries, 1024) + 1, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
            return size() > LruCache.this.maxEntries;
          }
        };
  }

  @Override
  public synchronized Optional<String> get(String shortId) {
    return Optional.ofNullable(entries.get(shortId));
  }

  @Override
  public synchronized void set(String shortId, String targetUrl) {
    entries.put(
        Objects.requireNonNull(shortId, "shortId"), Objects.requireNonNull(targetUrl, "targetUrl"));
  }

  @Override
  public synchronized void delete(String shortId) {
    entries.remove(shortId);
  }

  /** Current number of cached entries. */
  public synchronized int size() {
    return entries.size();
  }

  public int maxEntries() {
    return maxEntries;
  }
}
