package org.example.shortlinks.app;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import org.example.shortlinks.cache.LruCache;
import org.example.shortlinks.cli.ConsoleInput;
import org.example.shortlinks.cli.ConsoleMenu;
import org.example.shortlinks.core.LinkManager;
import org.example.shortlinks.core.ManagerConfig;
import org.example.shortlinks.storage.ConfigJson;
import org.example.shortlinks.storage.JsonFileBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the short links console.
 *
 * <ol>
 *   <li>Loads {@code data/config.json}, creating defaults if it does not exist.
 *   <li>Wires a {@link JsonFileBackend}, an optional {@link LruCache} tier and a {@link LinkManager}
 *       that persists escalated id lengths back into the config.
 *   <li>Optionally prunes unused links.
 *   <li>Runs the {@link ConsoleMenu} until the user exits.
 * </ol>
 */
public class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) {
    ConfigJson config = ConfigJson.loadOrCreateDefault();
    LinkManager manager = buildManager(config, Clock.systemUTC());

    if (config.cleanupOnStart) {
      List<String> removed = manager.cleanUnusedLinks(config.cleanupMaxAgeDays);
      log.info("Startup cleanup removed {} link(s)", removed.size());
    }

    PrintStream out = System.out;
    out.println("========================================");
    out.println(" Short Links Manager");
    out.println("========================================");
    out.println("Config loaded from: " + config.getSource().toAbsolutePath());
    out.println("Links stored in: " + config.resolveLinksFile().toAbsolutePath());
    out.println("Type a number to choose an option, 'q' to quit.");

    BufferedReader in =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    new ConsoleMenu(manager, config, new ConsoleInput(in, out), out).mainLoop();

    out.println();
    out.println("Bye!");
  }

  /**
   * Builds the manager described by {@code config}.
   *
   * @param config loaded configuration; also receives escalated id lengths
   * @param clock time source for the backend
   * @return ready manager, backend already initialised
   */
  public static LinkManager buildManager(ConfigJson config, Clock clock) {
    JsonFileBackend backend = new JsonFileBackend(config.resolveLinksFile(), clock);
    ManagerConfig mc =
        new ManagerConfig(backend, config.shortIdLength, config::raiseShortIdLength);
    mc.options = config.toManagerOptions();
    if (config.cacheMaxEntries > 0) {
      mc.caches.add(new LruCache(config.cacheMaxEntries));
    }
    return LinkManager.create(mc);
  }
}
