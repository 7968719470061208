package ca.gc.cra.lookout.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.domain.record.RecordHeader;
import ca.gc.cra.lookout.domain.record.RecordType;
import ca.gc.cra.lookout.domain.record.SummaryRecord;
import ca.gc.cra.lookout.domain.record.SystemRecord;
import org.junit.jupiter.api.Test;

class SeenKeyTest {

  @Test
  void uuidIdentifiesRecordRegardlessOfLineText() {
    RecordHeader header = new RecordHeader(
        RecordType.SYSTEM, null, "s", "uuid-1", null, null, false, null, null, null, null);
    SystemRecord record = new SystemRecord(header, "x", null, null);

    assertEquals(new SeenKey("uuid:uuid-1"), SeenKey.of(record, "line one"));
    assertEquals(SeenKey.of(record, "line one"), SeenKey.of(record, "line two"));
  }

  @Test
  void recordsWithoutUuidAreKeyedByContent() {
    SummaryRecord summary = new SummaryRecord(RecordHeader.of(RecordType.SUMMARY, null), "s", "leaf");

    SeenKey first = SeenKey.of(summary, "{\"type\":\"summary\",\"summary\":\"a\"}");
    SeenKey same = SeenKey.of(summary, "{\"type\":\"summary\",\"summary\":\"a\"}");
    SeenKey other = SeenKey.of(summary, "{\"type\":\"summary\",\"summary\":\"b\"}");

    assertEquals(first, same);
    assertNotEquals(first, other);
    assertTrue(first.value().startsWith("summary|null|"));
  }
}
