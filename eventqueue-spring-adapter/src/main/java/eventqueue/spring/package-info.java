/**
 * Spring transaction support: {@link eventqueue.spring.SpringTxContext} lets
 * {@link eventqueue.producer.EventProducer} join {@code @Transactional} work.
 */
package eventqueue.spring;
