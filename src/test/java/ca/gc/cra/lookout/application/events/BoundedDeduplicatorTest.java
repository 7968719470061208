package ca.gc.cra.lookout.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BoundedDeduplicatorTest {

  @Test
  void secondPresentationOfKeyIsRejected() {
    BoundedDeduplicator dedup = new BoundedDeduplicator(10);

    assertTrue(dedup.tryMarkSeen(new SeenKey("uuid:a")));
    assertFalse(dedup.tryMarkSeen(new SeenKey("uuid:a")));
    assertEquals(1, dedup.size());
  }

  @Test
  void sizeNeverExceedsCapacityAndOldestKeysAreEvictedFirst() {
    BoundedDeduplicator dedup = new BoundedDeduplicator();
    for (int i = 0; i < 150_000; i++) {
      assertTrue(dedup.tryMarkSeen(new SeenKey("uuid:" + i)));
    }

    assertEquals(BoundedDeduplicator.DEFAULT_CAPACITY, dedup.size());
    assertFalse(dedup.contains(new SeenKey("uuid:0")));
    assertFalse(dedup.contains(new SeenKey("uuid:49999")));
    assertTrue(dedup.contains(new SeenKey("uuid:50000")));
    assertTrue(dedup.contains(new SeenKey("uuid:149999")));
    assertTrue(dedup.tryMarkSeen(new SeenKey("uuid:0")), "evicted key is accepted again");
  }

  @Test
  void duplicateDoesNotRefreshEvictionOrder() {
    BoundedDeduplicator dedup = new BoundedDeduplicator(2);
    dedup.tryMarkSeen(new SeenKey("a"));
    dedup.tryMarkSeen(new SeenKey("b"));
    dedup.tryMarkSeen(new SeenKey("a"));

    dedup.tryMarkSeen(new SeenKey("c"));

    assertFalse(dedup.contains(new SeenKey("a")));
    assertTrue(dedup.contains(new SeenKey("b")));
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new BoundedDeduplicator(0));
  }
}
