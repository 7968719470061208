package ca.gc.cra.lookout.infrastructure.output;

import static ca.gc.cra.lookout.testutil.SessionLogFixtures.assistantToolUse;
import static ca.gc.cra.lookout.testutil.SessionLogFixtures.toolResult;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import org.junit.jupiter.api.Test;

class RecordJsonEncoderTest {
  private final RecordParser parser = new RecordParser();
  private final RecordJsonEncoder encoder = new RecordJsonEncoder();

  @Test
  void assistantRecordKeepsToolInputAsJson() {
    String json = encoder.encode(parse(assistantToolUse("a-1", "s-1", "2026-03-02T10:00:01Z", "toolu_1", "Bash")));

    assertTrue(json.startsWith("{\"schemaVersion\":" + RecordJsonEncoder.SCHEMA_VERSION + ",\"type\":\"assistant\""));
    assertTrue(json.contains("\"timestamp\":\"2026-03-02T10:00:01Z\""));
    assertTrue(json.contains("\"parentUuid\":\"p-a-1\""));
    assertTrue(json.contains("\"model\":\"claude-sonnet-4-5\""));
    assertTrue(json.contains("\"input\":{\"command\":\"ls\"}"));
    assertTrue(json.contains("\"inputTokens\":10"));
    assertFalse(json.contains("\n"));
  }

  @Test
  void userToolResultCarriesErrorFlag() {
    String json = encoder.encode(parse(toolResult("u-2", "s-1", "2026-03-02T10:00:02Z", "toolu_1", true)));

    assertTrue(json.contains("\"type\":\"user\""));
    assertTrue(json.contains("\"toolUseId\":\"toolu_1\""));
    assertTrue(json.contains("\"isError\":true"));
  }

  @Test
  void absentFieldsAreOmitted() {
    String json = encoder.encode(parse("{\"type\":\"summary\",\"summary\":\"Refactor \\\"parser\\\"\"}"));

    assertTrue(json.contains("\"summary\":\"Refactor \\\"parser\\\"\""));
    assertFalse(json.contains("\"timestamp\""));
    assertFalse(json.contains("\"leafUuid\""));
  }

  private SessionRecord parse(String line) {
    return parser.parse(line).orElseThrow();
  }
}
