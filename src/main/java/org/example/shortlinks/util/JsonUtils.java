package org.example.shortlinks.util;

import com.google.gson.*;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * JSON utilities for the short links manager.
 *
 * <p>This class provides a shared {@link Gson} configuration with:
 * <ul>
 *   <li><b>Pretty printing</b> for human-readable JSON files;</li>
 *   <li>Custom (de)serializers for {@link Instant} using {@link DateTimeFormatter#ISO_INSTANT}.</li>
 * </ul>
 *
 * <p><b>Instant format:</b> values are encoded/decoded as UTC strings like
 * {@code 2025-11-10T12:34:56.789Z}. Gson does not invoke the adapters for {@code null} values.</p>
 */
public final class JsonUtils {
    private JsonUtils() {}

    /** Formatter used for {@link Instant} serialization. */
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    /** Writes {@link Instant} values as ISO-8601 UTC strings. */
    private static final JsonSerializer<Instant> INSTANT_SER =
            (src, t, ctx) -> new JsonPrimitive(ISO.format(src));

    /** Parses strings produced by {@link #INSTANT_SER}. */
    private static final JsonDeserializer<Instant> INSTANT_DES =
            (json, t, ctx) -> {
                try {
                    return Instant.parse(json.getAsString());
                } catch (java.time.format.DateTimeParseException e) {
                    throw new JsonParseException("Invalid instant: " + json, e);
                }
            };

    /**
     * Returns a {@link Gson} instance with pretty printing and {@link Instant} support.
     *
     * @return configured {@link Gson}, safe to share across threads
     */
    public static Gson gson() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .registerTypeAdapter(Instant.class, INSTANT_SER)
                .registerTypeAdapter(Instant.class, INSTANT_DES)
                .create();
    }
}
