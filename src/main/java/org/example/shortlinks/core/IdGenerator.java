package org.example.shortlinks.core;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Produces random short ids from a fixed 62-character alphabet.
 *
 * <p>Ids are sampled uniformly per character; this is not a cryptographic generator. Instances are
 * safe to share between threads because {@link Random} is.
 */
public class IdGenerator {

  /** Digits, then lowercase, then uppercase letters. */
  public static final String ALPHABET =
      "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

  /** Draw budget per requested id in {@link #generateUniqueIds(int, int)}. */
  static final int ATTEMPTS_PER_ID = 100;

  private final Random rnd;

  public IdGenerator() {
    this(new Random());
  }

  /**
   * @param rnd randomness source; pass a seeded instance for reproducible ids
   */
  public IdGenerator(Random rnd) {
    this.rnd = Objects.requireNonNull(rnd, "rnd");
  }

  /**
   * Draws {@code length} characters independently from {@link #ALPHABET}.
   *
   * @param length id length, at least 1
   * @return a random id; two calls may return the same value
   */
  public String generateRandomId(int length) {
    requirePositiveLength(length);
    char[] c = new char[length];
    for (int i = 0; i < length; i++) c[i] = ALPHABET.charAt(rnd.nextInt(ALPHABET.length()));
    return new String(c);
  }

  /**
   * Collects distinct random ids of the given length.
   *
   * <p>Stops after {@code count} distinct ids or {@code count * 100} draws, whichever comes first,
   * so the result can be smaller than {@code count} when the length leaves too few combinations.
   *
   * @param count number of distinct ids wanted, {@code >= 0}
   * @param length id length, at least 1
   * @return distinct ids in the order they were first drawn
   */
  public Set<String> generateUniqueIds(int count, int length) {
    if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);
    requirePositiveLength(length);

    Set<String> ids = new LinkedHashSet<>();
    long budget = (long) count * ATTEMPTS_PER_ID;
    for (long draws = 0; ids.size() < count && draws < budget; draws++) {
      ids.add(generateRandomId(length));
    }
    return ids;
  }

  private static void requirePositiveLength(int length) {
    if (length < 1) throw new IllegalArgumentException("length must be >= 1: " + length);
  }
}
