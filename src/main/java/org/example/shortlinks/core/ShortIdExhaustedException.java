package org.example.shortlinks.core;

/**
 * Thrown by {@link LinkManager#createShortLink(String)} when no free short id was found within the
 * configured number of attempts.
 *
 * <p>The id space is effectively full at every length tried. The manager does not retry further;
 * callers may inspect the backend and bump the length manually.
 */
public class ShortIdExhaustedException extends RuntimeException {

  private final int firstLength;
  private final int lastLength;

  public ShortIdExhaustedException(int attempts, int firstLength, int lastLength) {
    super(
        "Unable to create a short link after "
            + attempts
            + " attempts (tried lengths "
            + firstLength
            + ".."
            + lastLength
            + "); the id space may be exhausted");
    this.firstLength = firstLength;
    this.lastLength = lastLength;
  }

  /** Length used by the first attempt. */
  public int getFirstLength() {
    return firstLength;
  }

  /** Length used by the last attempt. */
  public int getLastLength() {
    return lastLength;
  }
}
