/**
 * Write-time fan-out producer.
 *
 * @see eventqueue.producer.EventProducer
 */
package eventqueue.producer;
