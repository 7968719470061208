/**
 * Executor construction for the poll loop, reader pool and watch thread.
 */
package ca.gc.cra.lookout.infrastructure.exec;
