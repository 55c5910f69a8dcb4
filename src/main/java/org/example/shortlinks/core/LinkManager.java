package org.example.shortlinks.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.example.shortlinks.spi.ShortLinksBackend;
import org.example.shortlinks.spi.ShortLinksCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates short links and resolves them through the configured cache tiers and backend.
 *
 * <ul>
 *   <li><b>Create:</b> checks batches of random candidates against the backend, taking the first free
 *       one. A batch that is entirely taken escalates the id length by one and notifies the length
 *       listener. The new mapping is written to the backend and then to every cache tier.
 *   <li><b>Resolve:</b> caches are asked in registration order and the first hit wins; on a full
 *       miss the backend is asked. A found value is written back to every tier and, unless disabled,
 *       the backend access time is bumped. Absence is never cached.
 *   <li><b>Maintenance:</b> touch and prune are delegated to the backend; pruned ids are dropped from
 *       the caches on a best-effort basis.
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> instances may be shared. The only mutable state is the id length
 * counter, which only grows. Backend and cache faults propagate to the caller unchanged.
 */
public class LinkManager {

  private static final Logger log = LoggerFactory.getLogger(LinkManager.class);

  private final ShortLinksBackend backend;
  private final List<CacheTier> caches;
  private final ShortIdLength shortIdLength;
  private final ShortIdLengthListener lengthListener;
  private final ManagerOptions options;
  private final IdGenerator idGenerator;

  private LinkManager(ManagerConfig cfg) {
    this.backend = cfg.backend;
    this.shortIdLength = cfg.shortIdLength;
    this.lengthListener = cfg.onShortIdLengthUpdated;
    this.options = Objects.requireNonNull(cfg.options, "options").copy();
    this.options.validate();
    this.idGenerator = Objects.requireNonNull(cfg.idGenerator, "idGenerator");

    List<CacheTier> tiers = new ArrayList<>();
    if (cfg.caches != null) {
      for (ShortLinksCache c : cfg.caches) tiers.add(new CacheTier(Objects.requireNonNull(c)));
    }
    this.caches = List.copyOf(tiers);
  }

  /**
   * Runs {@link ShortLinksBackend#init()} once and returns a ready manager.
   *
   * @param cfg construction settings
   * @return the manager
   */
  public static LinkManager create(ManagerConfig cfg) {
    Objects.requireNonNull(cfg, "cfg");
    LinkManager manager = new LinkManager(cfg);
    cfg.backend.init();
    log.debug(
        "Link manager ready: shortIdLength={}, caches={}, options.maxCreateAttempts={}",
        cfg.shortIdLength,
        manager.caches.size(),
        manager.options.maxCreateAttempts);
    return manager;
  }

  // ---------- Create ----------

  /**
   * Generates a free short id for {@code targetUrl} and stores the mapping.
   *
   * @param targetUrl redirect destination, stored as given
   * @return the new short id
   * @throws ShortIdExhaustedException if every candidate batch was taken
   */
  public String createShortLink(String targetUrl) {
    Objects.requireNonNull(targetUrl, "targetUrl");

    int len = shortIdLength.get();
    int firstLength = len;
    int lastTried = len;
    String shortId = null;

    for (int attempt = 0; attempt < options.maxCreateAttempts; attempt++) {
      lastTried = len;
      List<String> candidates =
          new ArrayList<>(idGenerator.generateUniqueIds(options.candidateBatchSize, len));
      Set<String> taken = new HashSet<>(backend.checkShortIdsExist(candidates));

      shortId = firstFree(candidates, taken);
      if (shortId != null) break;

      int previous = len;
      len = shortIdLength.raiseTo(len + 1);
      log.warn(
          "All {} candidates of length {} are taken, escalating short id length to {}",
          candidates.size(),
          previous,
          len);
      lengthListener.onShortIdLengthUpdated(len);
    }

    if (shortId == null) {
      log.error(
          "No free short id after {} attempts (lengths {}..{})",
          options.maxCreateAttempts,
          firstLength,
          lastTried);
      throw new ShortIdExhaustedException(options.maxCreateAttempts, firstLength, lastTried);
    }

    backend.createShortLink(shortId, targetUrl);
    for (CacheTier tier : caches) {
      tier.ready().set(shortId, targetUrl);
    }
    return shortId;
  }

  private static String firstFree(List<String> candidates, Set<String> taken) {
    for (String id : candidates) {
      if (!taken.contains(id)) return id;
    }
    return null;
  }

  // ---------- Resolve ----------

  /**
   * Resolves a short id, cache tiers first.
   *
   * @param shortId id to resolve
   * @return the target URL, or empty if neither a cache nor the backend knows the id
   */
  public Optional<String> getTargetUrl(String shortId) {
    Objects.requireNonNull(shortId, "shortId");

    Optional<String> found = Optional.empty();
    for (CacheTier tier : caches) {
      found = tier.ready().get(shortId);
      if (found.isPresent()) break;
    }

    if (found.isEmpty()) {
      found = backend.getTargetUrl(shortId);
    }

    if (found.isPresent()) {
      if (options.shouldUpdateLastAccessOnGet) {
        backend.updateShortLinkLastAccessTime(shortId);
      }
      String url = found.get();
      for (CacheTier tier : caches) {
        tier.ready().set(shortId, url);
      }
    }
    return found;
  }

  // ---------- Maintenance ----------

  /**
   * Sets the link's last access time to now, keeping it from being pruned.
   *
   * @param shortId id to touch; unknown ids are ignored by the backend
   */
  public void updateShortLinkLastAccessTime(String shortId) {
    backend.updateShortLinkLastAccessTime(Objects.requireNonNull(shortId, "shortId"));
  }

  /**
   * Sets the link's last access time to {@code time}.
   *
   * @param shortId id to touch
   * @param time access time; how it is applied is up to the backend
   */
  public void updateShortLinkLastAccessTime(String shortId, Instant time) {
    backend.updateShortLinkLastAccessTime(
        Objects.requireNonNull(shortId, "shortId"), Objects.requireNonNull(time, "time"));
  }

  /**
   * Deletes links not accessed for more than {@code maxAgeDays} days.
   *
   * <p>When {@link ManagerOptions#invalidateCachesOnClean} is set, the deleted ids are also removed
   * from every cache tier. Those deletes are best effort: a failing tier is logged and skipped.
   *
   * @param maxAgeDays days a link is kept after its last access, {@code >= 0}
   * @return ids deleted by the backend
   */
  public List<String> cleanUnusedLinks(int maxAgeDays) {
    if (maxAgeDays < 0) {
      throw new IllegalArgumentException("maxAgeDays must be >= 0: " + maxAgeDays);
    }
    List<String> deleted = backend.cleanUnusedLinks(maxAgeDays);
    deleted = (deleted == null) ? List.of() : List.copyOf(deleted);
    log.info("Pruned {} link(s) unused for more than {} day(s)", deleted.size(), maxAgeDays);

    if (options.invalidateCachesOnClean && !deleted.isEmpty()) {
      for (CacheTier tier : caches) {
        tier.evictAll(deleted);
      }
    }
    return deleted;
  }

  /** Current id length used for new links. */
  public int getShortIdLength() {
    return shortIdLength.get();
  }

  /** Cache plus its one-time init flag. */
  private static final class CacheTier {
    private final ShortLinksCache cache;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    CacheTier(ShortLinksCache cache) {
      this.cache = cache;
    }

    ShortLinksCache ready() {
      if (!initialized.get()) {
        synchronized (this) {
          if (!initialized.get()) {
            cache.init();
            initialized.set(true);
          }
        }
      }
      return cache;
    }

    void evictAll(List<String> shortIds) {
      for (String id : shortIds) {
        try {
          ready().delete(id);
        } catch (RuntimeException e) {
          log.warn(
              "Failed to evict pruned short id {} from cache {}: {}",
              id,
              cache.getClass().getSimpleName(),
              e.getMessage());
        }
      }
    }
  }
}
