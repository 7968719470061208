package ca.gc.cra.lookout.domain.record;

/**
 * Extended reasoning emitted by the assistant.
 *
 * @param text reasoning content; empty when absent
 * @since 0.1.0
 */
public record ThinkingBlock(String text) implements ContentBlock {
  public ThinkingBlock {
    text = text == null ? "" : text;
  }
}
