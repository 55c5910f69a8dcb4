package org.example.shortlinks.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for short link mappings, consumed by {@link
 * org.example.shortlinks.core.LinkManager}.
 *
 * <p>Implementations own timeouts, retries and connection handling. Absence is never a fault:
 * unknown ids are reported as {@link Optional#empty()} or simply left out of result lists. Any other
 * failure is thrown as an unchecked exception and propagates to the manager's caller.
 */
public interface ShortLinksBackend {

  /**
   * One-time setup such as creating tables or files. Invoked once when the manager is created.
   */
  default void init() {}

  /**
   * Returns the target URL for the given short id.
   *
   * @param shortId id to look up
   * @return the target URL, or empty if the id does not exist
   */
  Optional<String> getTargetUrl(String shortId);

  /**
   * Stores a new mapping. {@code createdAt} and {@code lastAccessedAt} are set to now.
   *
   * @param shortId new id
   * @param targetUrl redirect destination
   * @throws RuntimeException if {@code shortId} already exists; implementations must fail rather
   *     than overwrite
   */
  void createShortLink(String shortId, String targetUrl);

  /**
   * Returns the subset of {@code shortIds} that already exist.
   *
   * @param shortIds candidates to check
   * @return existing ids, in any order
   */
  List<String> checkShortIdsExist(List<String> shortIds);

  /**
   * Sets the last access time of the link to now. Unknown ids are ignored.
   *
   * @param shortId id to touch
   */
  void updateShortLinkLastAccessTime(String shortId);

  /**
   * Sets the last access time of the link to {@code time}. Backends that cannot store an explicit
   * time fall back to now.
   *
   * @param shortId id to touch
   * @param time access time
   */
  default void updateShortLinkLastAccessTime(String shortId, Instant time) {
    updateShortLinkLastAccessTime(shortId);
  }

  /**
   * Deletes every link whose last access is older than {@code maxAgeDays} days.
   *
   * @param maxAgeDays number of days a link is kept after its last access
   * @return ids of the deleted links, used to invalidate cache tiers
   */
  List<String> cleanUnusedLinks(int maxAgeDays);
}
