package ca.gc.cra.lookout.domain.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Pairing of a tool invocation with its result.
 * <p><strong>Role:</strong> Value held in the session correlation table; pending until a result arrives.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param toolUseId shared id of the tool use and its result; never {@code null}
 * @param toolName tool name, or {@code null}
 * @param agentId sub-agent that invoked the tool, or {@code null} for the primary agent
 * @param callTimestamp instant of the tool use, or {@code null}
 * @param resultTimestamp instant of the tool result; {@code null} while pending
 * @param duration non-negative time between call and result; {@code null} while pending
 * @param success tool outcome; meaningful only once {@link #completed()}
 * @param completed {@code true} once the result was observed
 * @since 0.1.0
 */
public record ToolCorrelation(
    String toolUseId,
    String toolName,
    String agentId,
    Instant callTimestamp,
    Instant resultTimestamp,
    Duration duration,
    boolean success,
    boolean completed) {

  public ToolCorrelation {
    Objects.requireNonNull(toolUseId, "toolUseId");
    if (duration != null && duration.isNegative()) {
      throw new IllegalArgumentException("duration must be non-negative");
    }
  }

  /**
   * Opens a correlation for a tool use that has no result yet.
   *
   * @param toolUseId tool-use id
   * @param toolName tool name
   * @param agentId invoking sub-agent, or {@code null}
   * @param callTimestamp instant of the call
   * @return pending correlation
   */
  public static ToolCorrelation pending(
      String toolUseId, String toolName, String agentId, Instant callTimestamp) {
    return new ToolCorrelation(toolUseId, toolName, agentId, callTimestamp, null, null, false, false);
  }

  /**
   * Completes this correlation with the observed result.
   *
   * <p>The duration is clamped at zero when the result is stamped before the call, which happens when
   * records from different files are written with skewed clocks.</p>
   *
   * @param resultTimestamp instant of the result; may be {@code null}
   * @param resultSuccess tool outcome
   * @return completed correlation
   */
  public ToolCorrelation complete(Instant resultTimestamp, boolean resultSuccess) {
    Duration elapsed = Duration.ZERO;
    if (callTimestamp != null && resultTimestamp != null) {
      elapsed = Duration.between(callTimestamp, resultTimestamp);
      if (elapsed.isNegative()) {
        elapsed = Duration.ZERO;
      }
    }
    return new ToolCorrelation(
        toolUseId, toolName, agentId, callTimestamp, resultTimestamp, elapsed, resultSuccess, true);
  }
}
