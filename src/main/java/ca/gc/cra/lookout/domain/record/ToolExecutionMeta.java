package ca.gc.cra.lookout.domain.record;

/**
 * Execution details the agent attaches to a tool result.
 *
 * @param hasStdout tool produced standard output
 * @param hasStderr tool produced standard error
 * @param interrupted execution was interrupted
 * @param image result is an image
 * @since 0.1.0
 */
public record ToolExecutionMeta(boolean hasStdout, boolean hasStderr, boolean interrupted, boolean image) {}
