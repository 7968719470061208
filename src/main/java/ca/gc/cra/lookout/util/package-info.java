/**
 * General-purpose helpers without domain knowledge.
 */
package ca.gc.cra.lookout.util;
