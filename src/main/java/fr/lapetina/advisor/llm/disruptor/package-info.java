/**
 * LMAX Disruptor ring buffer carrying lifecycle events.
 *
 * <p>The lifecycle manager publishes without blocking; when the ring buffer is full the
 * event is dropped and counted. Handlers run in parallel on daemon threads:
 * <pre>
 * publish → [Journal | Metrics | extra handlers]
 * </pre>
 *
 * @see fr.lapetina.advisor.llm.disruptor.LifecycleEventBus
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.advisor.llm.disruptor;
