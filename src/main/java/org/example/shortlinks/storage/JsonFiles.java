package org.example.shortlinks.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Objects;
import org.example.shortlinks.util.JsonUtils;

/**
 * JSON file helpers shared by the storage classes.
 *
 * <ul>
 *   <li>{@link #readOrCreate(Path, Type, Object)} — read a file, creating it with a default value
 *       when it does not exist.
 *   <li>{@link #writeAtomic(Path, Object)} — write to a sibling temp file, then move it into place.
 * </ul>
 *
 * <p>UTF-8 throughout; parent directories are created as needed. The class holds no state, so
 * callers synchronize concurrent writers of the same path themselves.
 */
final class JsonFiles {
  private JsonFiles() {}

  private static final Gson GSON = JsonUtils.gson();

  /**
   * Reads {@code path} as {@code typeOfT}. A missing file is created holding {@code defaultValue};
   * an empty or {@code null} document also yields {@code defaultValue}.
   *
   * @param path file to read
   * @param typeOfT target type, e.g. a {@code TypeToken} type for generic lists
   * @param defaultValue value for a missing or empty file
   * @param <T> result type
   * @return parsed value or {@code defaultValue}
   * @throws IOException if the file cannot be read or created, or does not hold valid JSON
   */
  static <T> T readOrCreate(Path path, Type typeOfT, T defaultValue) throws IOException {
    if (!Files.exists(path)) {
      writeAtomic(path, defaultValue);
      return defaultValue;
    }
    try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      T data = GSON.fromJson(br, typeOfT);
      return (data != null) ? data : defaultValue;
    } catch (JsonParseException e) {
      throw new IOException("Malformed JSON in " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Writes {@code value} as JSON to {@code target}: first into {@code .<name>.tmp} next to it, then
   * {@link StandardCopyOption#ATOMIC_MOVE} over the target, so readers never see half a file.
   *
   * @param target destination, must have a parent directory
   * @param value object to serialize
   * @throws IOException if the directory, temp file or move fails
   */
  static void writeAtomic(Path target, Object value) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(value, "value");

    Path parent = target.toAbsolutePath().getParent();
    if (parent == null) {
      throw new IOException("Target path has no parent directory: " + target);
    }
    Files.createDirectories(parent);

    Path fn = target.getFileName();
    String baseName = (fn != null) ? fn.toString() : "data";
    Path tmp = parent.resolve("." + baseName + ".tmp");

    try (BufferedWriter bw =
        Files.newBufferedWriter(
            tmp,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(value, bw);
    }

    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
