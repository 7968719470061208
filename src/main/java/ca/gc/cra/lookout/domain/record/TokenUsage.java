package ca.gc.cra.lookout.domain.record;

/**
 * <strong>What:</strong> Token accounting attached to an assistant message.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputTokens uncached prompt tokens
 * @param outputTokens generated tokens
 * @param cacheReadInputTokens prompt tokens served from the prompt cache
 * @param cacheCreationInputTokens prompt tokens written to the prompt cache
 * @param webSearchRequests server-side web search invocations
 * @param webFetchRequests server-side web fetch invocations
 * @param serviceTier service tier reported by the API, or {@code null}
 * @since 0.1.0
 */
public record TokenUsage(
    long inputTokens,
    long outputTokens,
    long cacheReadInputTokens,
    long cacheCreationInputTokens,
    long webSearchRequests,
    long webFetchRequests,
    String serviceTier) {

  /** Usage with every counter at zero. */
  public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0, 0, 0, 0, null);

  public TokenUsage {
    if (inputTokens < 0 || outputTokens < 0 || cacheReadInputTokens < 0 || cacheCreationInputTokens < 0) {
      throw new IllegalArgumentException("token counts must be non-negative");
    }
    if (webSearchRequests < 0 || webFetchRequests < 0) {
      throw new IllegalArgumentException("server tool counts must be non-negative");
    }
  }

  /**
   * Returns input plus output tokens.
   *
   * @return total billed tokens excluding cache traffic
   */
  public long totalTokens() {
    return inputTokens + outputTokens;
  }
}
