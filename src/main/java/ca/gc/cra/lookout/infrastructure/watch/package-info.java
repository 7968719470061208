/**
 * File-system notification adapters for session log directories.
 */
package ca.gc.cra.lookout.infrastructure.watch;
