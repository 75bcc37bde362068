/**
 * Event record model.
 */
package eventqueue.model;
