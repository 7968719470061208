package ca.gc.cra.lookout.infrastructure.output;

import static ca.gc.cra.lookout.testutil.SessionLogFixtures.assistantToolUse;
import static ca.gc.cra.lookout.testutil.SessionLogFixtures.toolResult;
import static ca.gc.cra.lookout.testutil.SessionLogFixtures.userText;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.application.session.SessionAggregator;
import ca.gc.cra.lookout.domain.session.SessionStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStatsJsonEncoderTest {
  private SessionStats stats;

  @BeforeEach
  void setUp() {
    RecordParser parser = new RecordParser();
    SessionAggregator aggregator = new SessionAggregator();
    for (String line : new String[] {
        userText("u-1", "s-1", "2026-03-02T10:00:00Z", "run ls"),
        assistantToolUse("a-1", "s-1", "2026-03-02T10:00:01Z", "toolu_1", "Bash"),
        toolResult("u-2", "s-1", "2026-03-02T10:00:03Z", "toolu_1", false)}) {
      aggregator.onRecord(parser.parse(line).orElseThrow());
    }
    stats = aggregator.snapshot();
  }

  @Test
  void compactReportCarriesTotalsAndCorrelations() {
    String json = new SessionStatsJsonEncoder(false).encode(stats);

    assertFalse(json.contains("\n"));
    assertTrue(json.contains("\"sessionId\":\"s-1\""));
    assertTrue(json.contains("\"totalRecords\":3"));
    assertTrue(json.contains("\"calls\":1"));
    assertTrue(json.contains("\"results\":1"));
    assertTrue(json.contains("\"Bash\":1"));
    assertTrue(json.contains("\"toolUseId\":\"toolu_1\""));
    assertTrue(json.contains("\"durationMillis\":2000"));
    assertTrue(json.contains("\"success\":true"));
    assertTrue(json.contains("\"input\":10"));
  }

  @Test
  void prettyReportIsIndented() {
    String json = new SessionStatsJsonEncoder(true).encode(stats);

    assertTrue(json.contains("\n"));
    assertTrue(json.contains("\"totalRecords\" : 3"));
  }
}
