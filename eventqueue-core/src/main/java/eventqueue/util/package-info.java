/**
 * Small shared helpers: JSON document codec and daemon thread naming.
 */
package eventqueue.util;
