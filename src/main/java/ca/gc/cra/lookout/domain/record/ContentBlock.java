package ca.gc.cra.lookout.domain.record;

/**
 * Ordered unit of an assistant message.
 *
 * @since 0.1.0
 */
public sealed interface ContentBlock permits ToolUseBlock, TextBlock, ThinkingBlock {}
