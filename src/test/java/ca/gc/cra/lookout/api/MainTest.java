package ca.gc.cra.lookout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("watch"));
    assertTrue(buffer.toString().contains("replay"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: lookout"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: lookout"));
  }

  @Test
  void commandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"replay", "--help"}));
    assertTrue(buffer.toString().contains("LOOKOUT replay"));
  }

  @Test
  void commandArgumentsAreDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"watch", "sessionId=abc", "--dry-run"}));
    assertTrue(buffer.toString().contains("SESSION_ID abc"));
  }
}
