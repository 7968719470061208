package ca.gc.cra.lookout.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.domain.record.AssistantRecord;
import ca.gc.cra.lookout.domain.record.FileHistorySnapshotRecord;
import ca.gc.cra.lookout.domain.record.RecordType;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.domain.record.SummaryRecord;
import ca.gc.cra.lookout.domain.record.SystemRecord;
import ca.gc.cra.lookout.domain.record.TextBlock;
import ca.gc.cra.lookout.domain.record.ThinkingBlock;
import ca.gc.cra.lookout.domain.record.ToolUseBlock;
import ca.gc.cra.lookout.domain.record.UserRecord;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RecordParserTest {
  private final RecordParser parser = new RecordParser();

  @Test
  void assistantBlocksKeepOrderAndToolInputStaysRawJson() {
    String line = "{\"type\":\"assistant\",\"uuid\":\"a-1\",\"parentUuid\":\"u-1\",\"sessionId\":\"s-1\","
        + "\"timestamp\":\"2026-03-02T10:00:02.000Z\",\"requestId\":\"req-1\",\"message\":{\"id\":\"msg-1\","
        + "\"model\":\"claude-sonnet-4-5\",\"stop_reason\":\"tool_use\",\"content\":["
        + "{\"type\":\"thinking\",\"thinking\":\"plan\"},{\"type\":\"text\",\"text\":\"ok\"},"
        + "{\"type\":\"tool_use\",\"id\":\"toolu_1\",\"name\":\"Bash\",\"input\":{\"command\":\"ls\",\"n\":[1,2]}},"
        + "{\"type\":\"image\"}],"
        + "\"usage\":{\"input_tokens\":12,\"output_tokens\":3,\"cache_read_input_tokens\":100,"
        + "\"server_tool_use\":{\"web_search_requests\":2},\"service_tier\":\"standard\"}}}";

    AssistantRecord record = assertInstanceOf(AssistantRecord.class, parser.parse(line).orElseThrow());

    assertEquals(RecordType.ASSISTANT, record.type());
    assertEquals(Instant.parse("2026-03-02T10:00:02Z"), record.timestamp());
    assertEquals("s-1", record.sessionId());
    assertEquals("u-1", record.header().parentUuid());
    assertEquals("req-1", record.requestId());
    assertEquals("claude-sonnet-4-5", record.model());
    assertEquals(3, record.content().size());
    assertInstanceOf(ThinkingBlock.class, record.content().get(0));
    assertInstanceOf(TextBlock.class, record.content().get(1));
    ToolUseBlock use = assertInstanceOf(ToolUseBlock.class, record.content().get(2));
    assertEquals("toolu_1", use.id());
    assertEquals("Bash", use.name());
    assertEquals("{\"command\":\"ls\",\"n\":[1,2]}", use.inputJson());
    assertEquals(12, record.usage().inputTokens());
    assertEquals(100, record.usage().cacheReadInputTokens());
    assertEquals(2, record.usage().webSearchRequests());
    assertEquals("standard", record.usage().serviceTier());
    assertFalse(record.subAgent());
  }

  @Test
  void toolResultErrorFlagDefaultsToFalse() {
    String line = "{\"type\":\"user\",\"uuid\":\"u-2\",\"message\":{\"content\":["
        + "{\"type\":\"tool_result\",\"tool_use_id\":\"toolu_1\",\"content\":\"fine\"},"
        + "{\"type\":\"tool_result\",\"tool_use_id\":\"toolu_2\",\"content\":[{\"type\":\"text\",\"text\":\"x\"}],"
        + "\"is_error\":true}]}}";

    UserRecord record = assertInstanceOf(UserRecord.class, parser.parse(line).orElseThrow());

    assertEquals(2, record.toolResults().size());
    assertFalse(record.toolResults().get(0).error());
    assertEquals("fine", record.toolResults().get(0).content());
    assertTrue(record.toolResults().get(1).error());
    assertEquals("[{\"type\":\"text\",\"text\":\"x\"}]", record.toolResults().get(1).content());
    assertNull(record.text());
  }

  @Test
  void userTextTodosAndExecutionMetadataAreExtracted() {
    String line = "{\"type\":\"user\",\"uuid\":\"u-3\",\"message\":{\"content\":\"hello\"},"
        + "\"todos\":[{\"content\":\"write tests\",\"status\":\"in_progress\",\"activeForm\":\"Writing tests\"}],"
        + "\"toolUseResult\":{\"stdout\":\"out\",\"stderr\":\"\",\"interrupted\":true}}";

    UserRecord record = assertInstanceOf(UserRecord.class, parser.parse(line).orElseThrow());

    assertEquals("hello", record.text());
    assertEquals(1, record.todoSnapshot().orElseThrow().size());
    assertTrue(record.todoSnapshot().orElseThrow().get(0).inProgress());
    assertTrue(record.toolExecutionMeta().orElseThrow().hasStdout());
    assertFalse(record.toolExecutionMeta().orElseThrow().hasStderr());
    assertTrue(record.toolExecutionMeta().orElseThrow().interrupted());
  }

  @Test
  void sidechainAndAgentIdMarkSubAgentRecords() {
    SessionRecord sidechain = parser.parse("{\"type\":\"user\",\"isSidechain\":true,\"message\":{}}").orElseThrow();
    SessionRecord withAgent = parser.parse("{\"type\":\"user\",\"agentId\":\"ag-1\",\"message\":{}}").orElseThrow();

    assertTrue(sidechain.subAgent());
    assertTrue(withAgent.subAgent());
    assertEquals("ag-1", withAgent.header().agentId());
  }

  @Test
  void systemSummaryAndSnapshotRecordsParse() {
    SystemRecord system = assertInstanceOf(SystemRecord.class, parser.parse(
        "{\"type\":\"system\",\"content\":\"boom\",\"level\":\"error\",\"subtype\":\"api_error\"}").orElseThrow());
    SummaryRecord summary = assertInstanceOf(SummaryRecord.class, parser.parse(
        "{\"type\":\"summary\",\"summary\":\"Did things\",\"leafUuid\":\"u-9\"}").orElseThrow());
    FileHistorySnapshotRecord snapshot = assertInstanceOf(FileHistorySnapshotRecord.class, parser.parse(
        "{\"type\":\"file-history-snapshot\",\"messageId\":\"m-1\",\"isSnapshotUpdate\":true,\"snapshot\":"
            + "{\"timestamp\":\"2026-03-02T10:00:08Z\",\"trackedFileBackups\":{\"/a.txt\":"
            + "{\"backupFileName\":\"a@v2\",\"version\":2}}}}").orElseThrow());

    assertTrue(system.isError());
    assertEquals("api_error", system.subtype());
    assertEquals("Did things", summary.summary());
    assertNull(summary.timestamp());
    assertTrue(snapshot.update());
    assertEquals(Instant.parse("2026-03-02T10:00:08Z"), snapshot.timestamp());
    assertEquals("/a.txt", snapshot.backups().get(0).path());
    assertEquals(2, snapshot.backups().get(0).version());
  }

  @Test
  void unknownOrMissingTypeYieldsNoRecord() {
    assertTrue(parser.parse("{\"type\":\"progress\",\"uuid\":\"p-1\"}").isEmpty());
    assertTrue(parser.parse("{\"uuid\":\"p-2\"}").isEmpty());
    assertTrue(parser.parse("").isEmpty());
  }

  @Test
  void malformedLineIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("this line is not json"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"type\":\"user\""));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("[1,2,3]"));
  }

  @Test
  void unparsableTimestampBecomesNull() {
    SessionRecord record = parser.parse("{\"type\":\"system\",\"timestamp\":\"yesterday\"}").orElseThrow();

    assertNull(record.timestamp());
    assertEquals(Instant.parse("2026-03-02T08:00:00Z"), RecordParser.timestamp("2026-03-02T10:00:00+02:00"));
  }
}
