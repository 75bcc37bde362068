/**
 * Operator command line: {@code queue-stats}, {@code list}, {@code retry-dead-letter}, {@code cleanup}.
 * Workers are never run from here; applications host them.
 */
package eventqueue.cli;
