package org.example.shortlinks.app;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.Gson;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.example.shortlinks.core.LinkManager;
import org.example.shortlinks.storage.ConfigJson;
import org.example.shortlinks.testing.MutableClock;
import org.example.shortlinks.util.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Wiring done by {@link Main#buildManager(ConfigJson, java.time.Clock)}. */
class MainTest {

  @TempDir Path tempDir;

  @Test
  void buildManager_usesConfiguredFilesAndLength() throws Exception {
    Path configPath = tempDir.resolve("data").resolve("config.json");
    ConfigJson config = ConfigJson.loadOrCreateDefault(configPath);
    config.shortIdLength = 6;
    MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

    LinkManager manager = Main.buildManager(config, clock);
    String id = manager.createShortLink("https://example.com/wired");

    assertEquals(6, id.length());
    Path links = tempDir.resolve("data").resolve("links.json");
    assertTrue(Files.readString(links, StandardCharsets.UTF_8).contains(id));

    LinkManager reopened = Main.buildManager(config, clock);
    assertEquals(Optional.of("https://example.com/wired"), reopened.getTargetUrl(id));
  }

  @Test
  void buildManager_escalationIsPersistedToConfig() throws Exception {
    Path configPath = tempDir.resolve("data").resolve("config.json");
    ConfigJson config = ConfigJson.loadOrCreateDefault(configPath);
    config.shortIdLength = 1;
    config.save();
    MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    LinkManager manager = Main.buildManager(config, clock);

    // 62 single-character ids exist; the 63rd link needs a longer id
    for (int i = 0; i < 63; i++) {
      manager.createShortLink("https://example.com/" + i);
    }

    assertTrue(manager.getShortIdLength() >= 2);
    Gson gson = JsonUtils.gson();
    ConfigJson onDisk =
        gson.fromJson(Files.readString(configPath, StandardCharsets.UTF_8), ConfigJson.class);
    assertEquals(manager.getShortIdLength(), onDisk.shortIdLength);
  }
}
