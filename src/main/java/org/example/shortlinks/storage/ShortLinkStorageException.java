package org.example.shortlinks.storage;

/** Failure of a storage backend, typically wrapping an {@link java.io.IOException}. */
public class ShortLinkStorageException extends RuntimeException {

  public ShortLinkStorageException(String message) {
    super(message);
  }

  public ShortLinkStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
