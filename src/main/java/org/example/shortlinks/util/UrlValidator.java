package org.example.shortlinks.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks target URLs typed into the console front end before they are handed to the manager.
 *
 * <p>The manager itself stores any string it is given; this guard only keeps obvious typos out of
 * the links file. Accepted URLs parse as a {@link URI}, use {@code http} or {@code https} and carry a
 * host. Surrounding whitespace is dropped.
 */
public final class UrlValidator {
  private UrlValidator() {}

  /**
   * Returns the trimmed URL when it is an acceptable redirect target.
   *
   * @param url raw input, may be {@code null}
   * @param maxLen maximum length after trimming
   * @return the trimmed URL, or empty when it is missing, too long, unparsable, not http(s) or has
   *     no host
   */
  public static Optional<String> normalizeHttpUrl(String url, int maxLen) {
    if (url == null) return Optional.empty();
    String trimmed = url.trim();
    if (trimmed.isEmpty() || trimmed.length() > maxLen) return Optional.empty();

    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      return Optional.empty();
    }

    String scheme = uri.getScheme();
    if (scheme == null) return Optional.empty();
    String lower = scheme.toLowerCase(Locale.ROOT);
    if (!lower.equals("http") && !lower.equals("https")) return Optional.empty();

    String host = uri.getHost();
    if (host == null || host.isBlank()) return Optional.empty();
    return Optional.of(trimmed);
  }
}
