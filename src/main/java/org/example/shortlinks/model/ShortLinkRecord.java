package org.example.shortlinks.model;

import java.time.Instant;

/**
 * A single short link mapping as stored by a backend.
 *
 * <p>{@code shortId} and {@code targetUrl} are fixed once the record is created; there is no
 * operation that renames a link or points it to another URL. Only {@code lastAccessedAt} moves, and
 * it never moves backwards.
 *
 * <p>All fields are public to keep JSON serialization simple. Backends own these objects; callers
 * outside a backend should treat them as read-only snapshots.
 *
 * <h2>Fields overview</h2>
 *
 * <ul>
 *   <li>{@code shortId} – generated identifier, unique within a backend.
 *   <li>{@code targetUrl} – the redirect destination.
 *   <li>{@code createdAt} – creation timestamp.
 *   <li>{@code lastAccessedAt} – last successful lookup or explicit touch; set on creation.
 * </ul>
 */
public class ShortLinkRecord {

  /** Generated identifier, primary key. */
  public String shortId;

  /** Redirect destination. */
  public String targetUrl;

  /** Timestamp when the link was created. */
  public Instant createdAt;

  /** Timestamp of the last access; used to decide whether the link is unused. */
  public Instant lastAccessedAt;

  /** No-arg constructor for Gson. */
  public ShortLinkRecord() {}

  /**
   * Creates a record whose {@code createdAt} and {@code lastAccessedAt} are both {@code now}.
   *
   * @param shortId generated identifier
   * @param targetUrl redirect destination
   * @param now creation time
   */
  public ShortLinkRecord(String shortId, String targetUrl, Instant now) {
    this.shortId = shortId;
    this.targetUrl = targetUrl;
    this.createdAt = now;
    this.lastAccessedAt = now;
  }

  /** Returns a detached copy, so callers cannot mutate backend state. */
  public ShortLinkRecord copy() {
    ShortLinkRecord r = new ShortLinkRecord();
    r.shortId = shortId;
    r.targetUrl = targetUrl;
    r.createdAt = createdAt;
    r.lastAccessedAt = lastAccessedAt;
    return r;
  }
}
