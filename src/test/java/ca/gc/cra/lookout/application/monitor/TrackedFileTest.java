package ca.gc.cra.lookout.application.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class TrackedFileTest {

  @Test
  void readGuardAdmitsOneReaderAtATime() {
    TrackedFile file = new TrackedFile(Path.of("/x/s.jsonl"), true, null, 0);

    assertTrue(file.tryBeginRead());
    assertFalse(file.tryBeginRead());
    file.endRead();
    assertTrue(file.tryBeginRead());
  }

  @Test
  void restartResetsOffsetAndPendingTail() {
    TrackedFile file = new TrackedFile(Path.of("/x/s.jsonl"), false, "abc", 10);
    file.framer().append(new byte[] {'{', '"'});
    file.advance(2);

    file.restartFromBeginning();

    assertEquals(0, file.offset());
    assertEquals(0, file.pendingBytes());
    assertEquals("abc", file.subAgentId());
  }

  @Test
  void negativeInitialOffsetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TrackedFile(Path.of("/x/s.jsonl"), true, null, -1));
  }
}
