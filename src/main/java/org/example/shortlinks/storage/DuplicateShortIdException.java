package org.example.shortlinks.storage;

/** Thrown when a backend is asked to create a short id that already exists. */
public class DuplicateShortIdException extends ShortLinkStorageException {

  private final String shortId;

  public DuplicateShortIdException(String shortId) {
    super("Short id already exists: " + shortId);
    this.shortId = shortId;
  }

  public String getShortId() {
    return shortId;
  }
}
