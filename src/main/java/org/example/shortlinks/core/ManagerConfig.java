package org.example.shortlinks.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.example.shortlinks.spi.ShortLinksBackend;
import org.example.shortlinks.spi.ShortLinksCache;

/**
 * Construction settings for {@link LinkManager}.
 *
 * <p>The backend, the shared length counter and the length listener are fixed at construction; the
 * cache list, options and id generator are public fields with defaults.
 *
 * <pre>{@code
 * ManagerConfig cfg = new ManagerConfig(backend, 4, len -> config.raiseShortIdLength(len));
 * cfg.caches.add(new LruCache(1000));
 * LinkManager manager = LinkManager.create(cfg);
 * }</pre>
 */
public class ManagerConfig {

  /** Durable store; required. */
  public final ShortLinksBackend backend;

  /** Shared, growing id length. */
  public final ShortIdLength shortIdLength;

  /** Escalation callback; never {@code null} (a no-op is used when none is given). */
  public final ShortIdLengthListener onShortIdLengthUpdated;

  /** Cache tiers, consulted first to last. Empty by default. */
  public List<ShortLinksCache> caches = new ArrayList<>();

  /** Behavioral switches. */
  public ManagerOptions options = new ManagerOptions();

  /** Source of candidate ids. */
  public IdGenerator idGenerator = new IdGenerator();

  /**
   * @param backend durable store
   * @param shortIdLength initial id length, at least 1
   * @param onShortIdLengthUpdated escalation callback, may be {@code null}
   */
  public ManagerConfig(
      ShortLinksBackend backend, int shortIdLength, ShortIdLengthListener onShortIdLengthUpdated) {
    this(backend, new ShortIdLength(shortIdLength), onShortIdLengthUpdated);
  }

  /**
   * Variant for callers that share one counter between several managers.
   *
   * @param backend durable store
   * @param shortIdLength shared counter
   * @param onShortIdLengthUpdated escalation callback, may be {@code null}
   */
  public ManagerConfig(
      ShortLinksBackend backend,
      ShortIdLength shortIdLength,
      ShortIdLengthListener onShortIdLengthUpdated) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.shortIdLength = Objects.requireNonNull(shortIdLength, "shortIdLength");
    this.onShortIdLengthUpdated =
        (onShortIdLengthUpdated != null) ? onShortIdLengthUpdated : n -> {};
  }
}
