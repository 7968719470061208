package ca.gc.cra.lookout.domain.record;

/**
 * Plain text emitted by the assistant.
 *
 * @param text text content; empty when absent
 * @since 0.1.0
 */
public record TextBlock(String text) implements ContentBlock {
  public TextBlock {
    text = text == null ? "" : text;
  }
}
