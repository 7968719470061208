package ca.gc.cra.lookout.application.events;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Capacity-bounded seen-set guaranteeing at-most-once emission per record key.
 * <p><strong>Why:</strong> Overlapping reads, restart re-scans and duplicate notifications can present the
 * same line more than once.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Insert unseen keys and reject known ones.</li>
 *   <li>Evict in insertion order once the size would exceed the capacity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All operations synchronize on the instance.</p>
 * <p><strong>Performance:</strong> O(1) per check; memory proportional to the capacity.</p>
 *
 * @implNote Re-presenting a known key does not refresh its position, so eviction follows first emission.
 * @since 0.1.0
 */
public final class BoundedDeduplicator {
  /** Default number of keys retained. */
  public static final int DEFAULT_CAPACITY = 100_000;

  private final int capacity;
  private final Map<SeenKey, Boolean> seen;

  public BoundedDeduplicator() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a deduplicator retaining at most {@code capacity} keys.
   *
   * @param capacity maximum number of keys; must be positive
   */
  public BoundedDeduplicator(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.seen = new LinkedHashMap<>(16, 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<SeenKey, Boolean> eldest) {
        return size() > BoundedDeduplicator.this.capacity;
      }
    };
  }

  /**
   * Marks a key as seen.
   *
   * @param key record key
   * @return {@code true} when the key was new and the record may be emitted
   */
  public synchronized boolean tryMarkSeen(SeenKey key) {
    if (seen.containsKey(key)) {
      return false;
    }
    seen.put(key, Boolean.TRUE);
    return true;
  }

  /**
   * Reports whether a key is currently retained.
   *
   * @param key record key
   * @return {@code true} when a record with this key would be rejected
   */
  public synchronized boolean contains(SeenKey key) {
    return seen.containsKey(key);
  }

  public synchronized int size() {
    return seen.size();
  }

  public int capacity() {
    return capacity;
  }

  /** Forgets all keys. */
  public synchronized void clear() {
    seen.clear();
  }
}
