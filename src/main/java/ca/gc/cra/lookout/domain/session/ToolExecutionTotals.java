package ca.gc.cra.lookout.domain.session;

import ca.gc.cra.lookout.domain.record.ToolExecutionMeta;

/**
 * Counts of tool execution metadata flags seen in a session.
 *
 * @param withStdout results that produced standard output
 * @param withStderr results that produced standard error
 * @param interrupted interrupted executions
 * @param images image results
 * @since 0.1.0
 */
public record ToolExecutionTotals(long withStdout, long withStderr, long interrupted, long images) {
  /** Totals with every counter at zero. */
  public static final ToolExecutionTotals ZERO = new ToolExecutionTotals(0, 0, 0, 0);

  public ToolExecutionTotals plus(ToolExecutionMeta meta) {
    if (meta == null) {
      return this;
    }
    return new ToolExecutionTotals(
        withStdout + (meta.hasStdout() ? 1 : 0),
        withStderr + (meta.hasStderr() ? 1 : 0),
        interrupted + (meta.interrupted() ? 1 : 0),
        images + (meta.image() ? 1 : 0));
  }
}
