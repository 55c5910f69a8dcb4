package org.example.shortlinks.core;

/**
 * Notified whenever {@link LinkManager} escalates the short id length.
 *
 * <p>Implementations usually persist the value so the next process start resumes at it. Persist with
 * "set if greater" semantics: concurrent escalations may report lengths out of order.
 */
@FunctionalInterface
public interface ShortIdLengthListener {

  /**
   * @param newLength the escalated length
   */
  void onShortIdLengthUpdated(int newLength);
}
