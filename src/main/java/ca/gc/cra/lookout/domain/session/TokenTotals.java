package ca.gc.cra.lookout.domain.session;

import ca.gc.cra.lookout.domain.record.TokenUsage;

/**
 * Cumulative token usage of a session.
 *
 * @param inputTokens uncached prompt tokens
 * @param outputTokens generated tokens
 * @param cacheReadInputTokens prompt tokens read from cache
 * @param cacheCreationInputTokens prompt tokens written to cache
 * @param webSearchRequests server-side web searches
 * @param webFetchRequests server-side web fetches
 * @since 0.1.0
 */
public record TokenTotals(
    long inputTokens,
    long outputTokens,
    long cacheReadInputTokens,
    long cacheCreationInputTokens,
    long webSearchRequests,
    long webFetchRequests) {

  /** Totals with every counter at zero. */
  public static final TokenTotals ZERO = new TokenTotals(0, 0, 0, 0, 0, 0);

  /**
   * Adds one message's usage.
   *
   * @param usage usage to add; {@code null} is ignored
   * @return new totals
   */
  public TokenTotals plus(TokenUsage usage) {
    if (usage == null) {
      return this;
    }
    return new TokenTotals(
        inputTokens + usage.inputTokens(),
        outputTokens + usage.outputTokens(),
        cacheReadInputTokens + usage.cacheReadInputTokens(),
        cacheCreationInputTokens + usage.cacheCreationInputTokens(),
        webSearchRequests + usage.webSearchRequests(),
        webFetchRequests + usage.webFetchRequests());
  }

  public long totalTokens() {
    return inputTokens + outputTokens;
  }

  /**
   * Share of prompt tokens served from the cache.
   *
   * @return {@code cacheRead / (input + cacheRead)}, or {@code 0.0} before any prompt tokens
   */
  public double cacheHitRate() {
    long prompt = inputTokens + cacheReadInputTokens;
    return prompt == 0 ? 0.0 : (double) cacheReadInputTokens / prompt;
  }
}
