package org.example.shortlinks.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import org.example.shortlinks.core.ManagerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration with load/save helpers.
 *
 * <p>Holds the tunables of the console application and persists them as pretty-printed JSON,
 * {@code data/config.json} by default. A missing file is created with defaults; an unreadable one
 * is logged and replaced in memory by defaults.
 *
 * <p>{@link #raiseShortIdLength(int)} is meant as the manager's length listener: it stores an
 * escalated id length so the next start resumes there.
 *
 * <pre>{@code
 * ConfigJson cfg = ConfigJson.loadOrCreateDefault(DataPaths.CONFIG_JSON);
 * ManagerConfig mc = new ManagerConfig(backend, cfg.shortIdLength, cfg::raiseShortIdLength);
 * }</pre>
 */
public class ConfigJson {
  private static final Logger log = LoggerFactory.getLogger(ConfigJson.class);

  /** Length of newly generated short ids; grows when the id space fills up. */
  public int shortIdLength = 4;

  /** Maximum accepted target URL length in the console. */
  public int maxUrlLength = 2048;

  /** Capacity of the in-process cache tier; {@code 0} disables it. */
  public int cacheMaxEntries = 1000;

  /** Default age, in days since last access, after which links are pruned. */
  public int cleanupMaxAgeDays = 30;

  /** Prune unused links once at startup. */
  public boolean cleanupOnStart = false;

  /** See {@link ManagerOptions#shouldUpdateLastAccessOnGet}. */
  public boolean shouldUpdateLastAccessOnGet = true;

  /** See {@link ManagerOptions#maxCreateAttempts}. */
  public int maxCreateAttempts = 3;

  /** Location of the links file, relative to the working directory. */
  public String linksFile = DataPaths.LINKS_JSON.toString();

  /** File this instance was loaded from; not serialized. */
  private transient Path source;

  /**
   * Loads the configuration from {@code path}, writing defaults there when the file is missing.
   *
   * @param path config file location
   * @return loaded or default configuration, never {@code null}
   */
  public static ConfigJson loadOrCreateDefault(Path path) {
    Objects.requireNonNull(path, "path");
    ConfigJson cfg;
    try {
      cfg = JsonFiles.readOrCreate(path, ConfigJson.class, new ConfigJson());
    } catch (IOException e) {
      log.warn("Failed to load {}, using in-memory defaults. Cause: {}", path, e.getMessage());
      cfg = new ConfigJson();
    }
    cfg.source = path;
    return cfg;
  }

  /** Loads {@code data/config.json}. */
  public static ConfigJson loadOrCreateDefault() {
    return loadOrCreateDefault(DataPaths.CONFIG_JSON);
  }

  /** File this configuration was loaded from, or {@code null} for an in-memory instance. */
  public Path getSource() {
    return source;
  }

  /**
   * Resolves {@link #linksFile}. A relative value is taken relative to the folder that contains the
   * config's {@code data/} directory, which is the working directory for the default layout.
   *
   * @return links file location
   */
  public Path resolveLinksFile() {
    Path links = Paths.get(linksFile);
    if (links.isAbsolute() || source == null) return links;
    Path dataDir = source.toAbsolutePath().getParent();
    Path base = (dataDir != null) ? dataDir.getParent() : null;
    return (base != null) ? base.resolve(links) : links;
  }

  /**
   * Builds manager options from the matching fields.
   *
   * @return fresh options
   */
  public ManagerOptions toManagerOptions() {
    ManagerOptions o = new ManagerOptions();
    o.shouldUpdateLastAccessOnGet = shouldUpdateLastAccessOnGet;
    o.maxCreateAttempts = maxCreateAttempts;
    return o;
  }

  /**
   * Stores {@code newLength} if it is larger than both the in-memory and the on-disk value.
   *
   * <p>The file is re-read first, so a concurrent writer that already stored a larger length is
   * never overwritten with a smaller one.
   *
   * @param newLength escalated id length
   * @throws ShortLinkStorageException if the file cannot be written
   */
  public synchronized void raiseShortIdLength(int newLength) {
    int onDisk = shortIdLength;
    if (source != null) {
      try {
        onDisk = JsonFiles.readOrCreate(source, ConfigJson.class, this).shortIdLength;
      } catch (IOException e) {
        log.warn("Could not re-read {} before update: {}", source, e.getMessage());
      }
    }
    int target = Math.max(newLength, Math.max(shortIdLength, onDisk));
    if (target == shortIdLength && target == onDisk) return;

    shortIdLength = target;
    log.info("Short id length raised to {}", target);
    save();
  }

  /**
   * Writes this configuration back to its source file. In-memory instances are not persisted.
   *
   * @throws ShortLinkStorageException if the write fails
   */
  public synchronized void save() {
    if (source == null) return;
    try {
      JsonFiles.writeAtomic(source, this);
    } catch (IOException e) {
      throw new ShortLinkStorageException("Failed to write " + source + ": " + e.getMessage(), e);
    }
  }
}
