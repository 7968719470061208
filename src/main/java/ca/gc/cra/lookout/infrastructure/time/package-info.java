/**
 * Wall-clock adapter for {@link ca.gc.cra.lookout.application.port.ClockPort}.
 */
package ca.gc.cra.lookout.infrastructure.time;
