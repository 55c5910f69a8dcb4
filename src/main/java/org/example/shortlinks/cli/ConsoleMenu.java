package org.example.shortlinks.cli;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.example.shortlinks.core.LinkManager;
import org.example.shortlinks.core.ShortIdExhaustedException;
import org.example.shortlinks.storage.ConfigJson;
import org.example.shortlinks.storage.ShortLinkStorageException;
import org.example.shortlinks.util.UrlValidator;

/**
 * Interactive console over a {@link LinkManager}.
 *
 * <h2>Responsibilities</h2>
 *
 * <ul>
 *   <li>Create links (target URL checked with {@link UrlValidator})
 *   <li>Resolve and touch links
 *   <li>Prune unused links
 *   <li>Show the effective settings
 * </ul>
 *
 * <h2>Error handling</h2>
 *
 * <p>Validation problems, exhausted id space and storage failures are printed and the loop goes on.
 * End of input leaves the loop.
 */
public class ConsoleMenu {

  private final LinkManager manager;
  private final ConfigJson config;
  private final ConsoleInput input;
  private final PrintStream out;

  /**
   * @param manager link manager to drive
   * @param config settings shown in the menu and used for defaults
   * @param input line source
   * @param out console output
   */
  public ConsoleMenu(LinkManager manager, ConfigJson config, ConsoleInput input, PrintStream out) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.config = Objects.requireNonNull(config, "config");
    this.input = Objects.requireNonNull(input, "input");
    this.out = Objects.requireNonNull(out, "out");
  }

  /** Runs until the user exits or input ends. */
  public void mainLoop() {
    while (true) {
      printMainMenu();
      String choice = input.readTrimmed("Select: ");

      if (choice == null) {
        out.println("Input closed. Exiting.");
        return;
      }

      switch (choice.toLowerCase()) {
        case "1" -> actionCreate();
        case "2" -> actionResolve();
        case "3" -> actionTouch();
        case "4" -> actionClean();
        case "5" -> showSettings();
        case "q", "quit", "exit" -> {
          return;
        }
        default -> out.println("Unknown option. Please try again.");
      }
    }
  }

  private void printMainMenu() {
    out.println();
    out.println("Main Menu");
    out.println("1. Create Short Link");
    out.println("2. Resolve Short Link");
    out.println("3. Touch Short Link");
    out.println("4. Clean Unused Links");
    out.println("5. Settings");
    out.println("q. Exit");
  }

  private void actionCreate() {
    String raw = input.readTrimmed("Target URL: ");
    if (raw == null) return;
    Optional<String> url = UrlValidator.normalizeHttpUrl(raw, config.maxUrlLength);
    if (url.isEmpty()) {
      out.println("Invalid URL. Only http/https with host are allowed.");
      return;
    }
    try {
      String shortId = manager.createShortLink(url.get());
      out.println("Created: " + shortId + " -> " + url.get());
    } catch (ShortIdExhaustedException e) {
      out.println("Could not create link: " + e.getMessage());
    } catch (ShortLinkStorageException e) {
      out.println("Storage error: " + e.getMessage());
    }
  }

  private void actionResolve() {
    String shortId = readShortId();
    if (shortId == null) return;
    try {
      Optional<String> target = manager.getTargetUrl(shortId);
      if (target.isPresent()) {
        out.println("Target: " + target.get());
      } else {
        out.println("Link not found: " + shortId);
      }
    } catch (ShortLinkStorageException e) {
      out.println("Storage error: " + e.getMessage());
    }
  }

  private void actionTouch() {
    String shortId = readShortId();
    if (shortId == null) return;
    try {
      manager.updateShortLinkLastAccessTime(shortId);
      out.println("Touched: " + shortId);
    } catch (ShortLinkStorageException e) {
      out.println("Storage error: " + e.getMessage());
    }
  }

  private void actionClean() {
    String raw = input.readTrimmed("Max age in days [" + config.cleanupMaxAgeDays + "]: ");
    if (raw == null) return;
    int days;
    if (raw.isEmpty()) {
      days = config.cleanupMaxAgeDays;
    } else {
      try {
        days = Integer.parseInt(raw);
      } catch (NumberFormatException e) {
        out.println("Invalid number: " + raw);
        return;
      }
      if (days < 0) {
        out.println("Max age must not be negative.");
        return;
      }
    }
    try {
      List<String> removed = manager.cleanUnusedLinks(days);
      out.println(
          "Removed " + removed.size() + " link(s) unused for more than " + days + " day(s).");
      for (String id : removed) out.println("  - " + id);
    } catch (ShortLinkStorageException e) {
      out.println("Storage error: " + e.getMessage());
    }
  }

  private void showSettings() {
    out.println();
    out.println("Settings");
    out.println("shortIdLength (current): " + manager.getShortIdLength());
    out.println("maxUrlLength: " + config.maxUrlLength);
    out.println("cacheMaxEntries: " + config.cacheMaxEntries);
    out.println("cleanupMaxAgeDays: " + config.cleanupMaxAgeDays);
    out.println("cleanupOnStart: " + config.cleanupOnStart);
    out.println("shouldUpdateLastAccessOnGet: " + config.shouldUpdateLastAccessOnGet);
    out.println("maxCreateAttempts: " + config.maxCreateAttempts);
    out.println("linksFile: " + config.linksFile);
  }

  /** Reads a short id; prints a hint and returns {@code null} when it is blank or input ended. */
  private String readShortId() {
    String shortId = input.readTrimmed("Short id: ");
    if (shortId == null) return null;
    if (shortId.isEmpty()) {
      out.println("Short id is empty.");
      return null;
    }
    return shortId;
  }
}
