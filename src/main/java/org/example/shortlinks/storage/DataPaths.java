package org.example.shortlinks.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default file-system locations, relative to the working directory.
 *
 * <ul>
 *   <li>{@link #DATA_DIR} – root data folder.
 *   <li>{@link #CONFIG_JSON} – application configuration.
 *   <li>{@link #LINKS_JSON} – short link records of {@link JsonFileBackend}.
 * </ul>
 */
public final class DataPaths {
  private DataPaths() {}

  /** {@code data/} */
  public static final Path DATA_DIR = Paths.get("data");

  /** {@code data/config.json} */
  public static final Path CONFIG_JSON = DATA_DIR.resolve("config.json");

  /** {@code data/links.json} */
  public static final Path LINKS_JSON = DATA_DIR.resolve("links.json");
}
