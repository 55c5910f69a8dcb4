package org.example.shortlinks.storage;

import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import org.example.shortlinks.model.ShortLinkRecord;
import org.example.shortlinks.spi.ShortLinksBackend;
import org.example.shortlinks.util.TimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ShortLinksBackend} keeping {@link ShortLinkRecord}s in a JSON file.
 *
 * <p>Records are held in memory, keyed by short id, and the whole file is rewritten through {@link
 * JsonFiles#writeAtomic(Path, Object)} after every mutation. A failed write leaves the in-memory
 * state as it was before the call. The file is loaded by {@link #init()} or, failing that, on first
 * use. Suitable for small installations and tests; every public method is {@code synchronized}.
 *
 * <p>Time comes from the supplied {@link Clock}. {@code lastAccessedAt} never moves backwards.
 */
public class JsonFileBackend implements ShortLinksBackend {
  private static final Logger log = LoggerFactory.getLogger(JsonFileBackend.class);
  private static final Type LIST_TYPE = new TypeToken<List<ShortLinkRecord>>() {}.getType();

  private final Path file;
  private final Clock clock;
  private Map<String, ShortLinkRecord> records;

  /** Backend over {@code data/links.json} using the system clock. */
  public JsonFileBackend() {
    this(DataPaths.LINKS_JSON, Clock.systemUTC());
  }

  /**
   * @param file JSON file holding the records; created on first load if missing
   * @param clock time source for creation, access and pruning
   */
  public JsonFileBackend(Path file, Clock clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Loads the file, creating an empty one when missing. */
  @Override
  public synchronized void init() {
    if (records != null) return;
    List<ShortLinkRecord> loaded;
    try {
      loaded = JsonFiles.readOrCreate(file, LIST_TYPE, new ArrayList<>());
    } catch (IOException e) {
      throw new ShortLinkStorageException("Failed to load " + file + ": " + e.getMessage(), e);
    }

    Map<String, ShortLinkRecord> byId = new LinkedHashMap<>();
    for (ShortLinkRecord r : loaded) {
      if (r == null || r.shortId == null || r.targetUrl == null) {
        log.warn("Skipping incomplete record in {}", file);
        continue;
      }
      byId.put(r.shortId, r);
    }
    records = byId;
    log.debug("Loaded {} short link(s) from {}", records.size(), file);
  }

  @Override
  public synchronized Optional<String> getTargetUrl(String shortId) {
    ShortLinkRecord r = loaded().get(shortId);
    return (r == null) ? Optional.empty() : Optional.of(r.targetUrl);
  }

  /**
   * Adds a record and flushes; on flush failure the record is dropped again.
   *
   * @throws DuplicateShortIdException if {@code shortId} is already stored
   */
  @Override
  public synchronized void createShortLink(String shortId, String targetUrl) {
    Objects.requireNonNull(shortId, "shortId");
    Objects.requireNonNull(targetUrl, "targetUrl");
    Map<String, ShortLinkRecord> byId = loaded();
    if (byId.containsKey(shortId)) {
      throw new DuplicateShortIdException(shortId);
    }
    byId.put(shortId, new ShortLinkRecord(shortId, targetUrl, clock.instant()));
    try {
      flush(byId.values());
    } catch (ShortLinkStorageException e) {
      byId.remove(shortId);
      throw e;
    }
  }

  @Override
  public synchronized List<String> checkShortIdsExist(List<String> shortIds) {
    Map<String, ShortLinkRecord> byId = loaded();
    List<String> out = new ArrayList<>();
    for (String id : shortIds) if (byId.containsKey(id)) out.add(id);
    return out;
  }

  @Override
  public synchronized void updateShortLinkLastAccessTime(String shortId) {
    touch(shortId, clock.instant());
  }

  @Override
  public synchronized void updateShortLinkLastAccessTime(String shortId, Instant time) {
    touch(shortId, Objects.requireNonNull(time, "time"));
  }

  private void touch(String shortId, Instant time) {
    ShortLinkRecord r = loaded().get(shortId);
    if (r == null) return;
    Instant previous = r.lastAccessedAt;
    Instant next = TimeUtils.latest(previous, time);
    if (next.equals(previous)) return;
    r.lastAccessedAt = next;
    try {
      flush(records.values());
    } catch (ShortLinkStorageException e) {
      r.lastAccessedAt = previous;
      throw e;
    }
  }

  /**
   * Removes records whose {@code lastAccessedAt} is strictly older than {@code now - maxAgeDays}.
   * Flushes only when something was removed; the in-memory state changes only after the file was
   * written.
   */
  @Override
  public synchronized List<String> cleanUnusedLinks(int maxAgeDays) {
    Instant cutoff = TimeUtils.cutoff(clock.instant(), maxAgeDays);
    List<String> removed = new ArrayList<>();
    Map<String, ShortLinkRecord> kept = new LinkedHashMap<>();
    for (ShortLinkRecord r : loaded().values()) {
      if (TimeUtils.isUnusedSince(r.lastAccessedAt, cutoff)) {
        removed.add(r.shortId);
      } else {
        kept.put(r.shortId, r);
      }
    }
    if (removed.isEmpty()) return removed;

    flush(kept.values());
    records = kept;
    return removed;
  }

  /**
   * Returns a copy of the stored record.
   *
   * @param shortId id to look up
   * @return detached record, or empty if unknown
   */
  public synchronized Optional<ShortLinkRecord> findRecord(String shortId) {
    ShortLinkRecord r = loaded().get(shortId);
    return (r == null) ? Optional.empty() : Optional.of(r.copy());
  }

  /** Number of stored links. */
  public synchronized int size() {
    return loaded().size();
  }

  private Map<String, ShortLinkRecord> loaded() {
    if (records == null) init();
    return records;
  }

  private void flush(Collection<ShortLinkRecord> snapshot) {
    try {
      JsonFiles.writeAtomic(file, new ArrayList<>(snapshot));
    } catch (IOException e) {
      log.error("Failed to write {}: {}", file, e.getMessage());
      throw new ShortLinkStorageException("Failed to write " + file + ": " + e.getMessage(), e);
    }
  }
}
