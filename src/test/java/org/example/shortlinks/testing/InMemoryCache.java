package org.example.shortlinks.testing;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.example.shortlinks.spi.ShortLinksCache;

/** Unbounded map cache that counts {@link #init()} calls. */
public class InMemoryCache implements ShortLinksCache {

  private final Map<String, String> cache = new HashMap<>();
  private int initCalls;

  @Override
  public synchronized void init() {
    initCalls++;
  }

  @Override
  public synchronized Optional<String> get(String shortId) {
    return Optional.ofNullable(cache.get(shortId));
  }

  @Override
  public synchronized void set(String shortId, String targetUrl) {
    cache.put(shortId, targetUrl);
  }

  @Override
  public synchronized void delete(String shortId) {
    cache.remove(shortId);
  }

  public synchronized boolean contains(String shortId) {
    return cache.containsKey(shortId);
  }

  public synchronized int initCalls() {
    return initCalls;
  }
}
