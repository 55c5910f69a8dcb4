package org.example.shortlinks.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.Gson;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import org.example.shortlinks.core.ManagerOptions;
import org.example.shortlinks.util.JsonUtils;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigJson}: default creation, loading, fallback on broken files and monotonic
 * persistence of the short id length.
 */
public class ConfigJsonTest {

  @TempDir Path tempDir;

  private static final Gson GSON = JsonUtils.gson();

  private Path configPath;

  @BeforeEach
  void setUp() {
    configPath = tempDir.resolve("data").resolve("config.json");
  }

  private ConfigJson readRaw() throws Exception {
    return GSON.fromJson(Files.readString(configPath, StandardCharsets.UTF_8), ConfigJson.class);
  }

  @Test
  @DisplayName("missing config.json is created with defaults")
  void loadOrCreateDefault_createsFile() throws Exception {
    ConfigJson cfg = ConfigJson.loadOrCreateDefault(configPath);

    assertTrue(Files.exists(configPath));
    assertEquals(4, cfg.shortIdLength);
    assertEquals(30, cfg.cleanupMaxAgeDays);
    assertTrue(cfg.shouldUpdateLastAccessOnGet);
    assertEquals(configPath, cfg.getSource());
    assertEquals(4, readRaw().shortIdLength);
  }

  @Test
  void loadOrCreateDefault_readsExistingValues() throws Exception {
    Files.createDirectories(configPath.getParent());
    Files.writeString(
        configPath,
        "{\"shortIdLength\": 6, \"cacheMaxEntries\": 0, \"maxCreateAttempts\": 10}",
        StandardCharsets.UTF_8);

    ConfigJson cfg = ConfigJson.loadOrCreateDefault(configPath);

    assertEquals(6, cfg.shortIdLength);
    assertEquals(0, cfg.cacheMaxEntries);
    assertEquals(10, cfg.maxCreateAttempts);
    assertEquals(2048, cfg.maxUrlLength);
  }

  @Test
  void loadOrCreateDefault_brokenFileFallsBackToDefaults() throws Exception {
    Files.createDirectories(configPath.getParent());
    Files.writeString(configPath, "[1, 2", StandardCharsets.UTF_8);

    ConfigJson cfg = ConfigJson.loadOrCreateDefault(configPath);

    assertEquals(4, cfg.shortIdLength);
  }

  @Test
  void raiseShortIdLength_persistsLargerValue() throws Exception {
    ConfigJson cfg = ConfigJson.loadOrCreateDefault(configPath);

    cfg.raiseShortIdLength(5);

    assertEquals(5, cfg.shortIdLength);
    assertEquals(5, readRaw().shortIdLength);
  }

  @Test
  @DisplayName("a smaller, late escalation never lowers the stored length")
  void raiseShortIdLength_isMonotonic() throws Exception {
    ConfigJson fast = ConfigJson.loadOrCreateDefault(configPath);
    ConfigJson slow = ConfigJson.loadOrCreateDefault(configPath);

    fast.raiseShortIdLength(7);
    slow.raiseShortIdLength(5);

    assertEquals(7, readRaw().shortIdLength);
    assertEquals(7, slow.shortIdLength);

    fast.raiseShortIdLength(6);
    assertEquals(7, readRaw().shortIdLength);
  }

  @Test
  void raiseShortIdLength_inMemoryInstanceOnlyUpdatesField() {
    ConfigJson cfg = new ConfigJson();
    cfg.raiseShortIdLength(9);
    cfg.raiseShortIdLength(3);
    assertEquals(9, cfg.shortIdLength);
    assertNull(cfg.getSource());
  }

  @Test
  void toManagerOptions_copiesMatchingFields() {
    ConfigJson cfg = new ConfigJson();
    cfg.shouldUpdateLastAccessOnGet = false;
    cfg.maxCreateAttempts = 10;

    ManagerOptions o = cfg.toManagerOptions();

    assertFalse(o.shouldUpdateLastAccessOnGet);
    assertEquals(10, o.maxCreateAttempts);
    assertEquals(50, o.candidateBatchSize);
  }

  @Test
  void resolveLinksFile_relativeToDataParent() {
    ConfigJson cfg = ConfigJson.loadOrCreateDefault(configPath);

    assertEquals(
        tempDir.toAbsolutePath().resolve("data").resolve("links.json"), cfg.resolveLinksFile());

    Path absolute = tempDir.resolve("elsewhere.json").toAbsolutePath();
    cfg.linksFile = absolute.toString();
    assertEquals(absolute, cfg.resolveLinksFile());
  }
}
