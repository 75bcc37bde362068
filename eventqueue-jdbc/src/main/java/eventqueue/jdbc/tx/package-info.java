/**
 * Manual JDBC transaction support for code that does not run under a framework
 * transaction manager.
 */
package eventqueue.jdbc.tx;
