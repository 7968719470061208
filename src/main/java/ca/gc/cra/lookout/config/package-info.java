/**
 * <strong>Purpose:</strong> Typed configuration for monitoring and output plus the YAML/CLI/default merge.
 * <p><strong>Pipeline role:</strong> Built once by the CLI before any pipeline starts.</p>
 * <p><strong>Error handling:</strong> Invalid values raise {@link java.lang.IllegalArgumentException}, which
 * the CLI maps to {@code CONFIG_ERROR} or {@code INVALID_ARGS}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.config;
