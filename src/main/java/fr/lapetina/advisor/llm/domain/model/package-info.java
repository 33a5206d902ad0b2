/**
 * Domain model of the model lifecycle.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.advisor.llm.domain.model.ModelId} - Hub identifier of a model</li>
 *   <li>{@link fr.lapetina.advisor.llm.domain.model.LifecycleState} - UNLOADED, LOADING, READY or FAILED</li>
 *   <li>{@link fr.lapetina.advisor.llm.domain.model.StatusSnapshot} - Copy of the state plus device telemetry</li>
 *   <li>{@link fr.lapetina.advisor.llm.domain.model.GenerationRequest} - Immutable chat request with decoding parameters</li>
 *   <li>{@link fr.lapetina.advisor.llm.domain.model.ErrorType} - Categorized failures for logs and metrics</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type in this package is an immutable record or enum and may be shared freely.
 */
package fr.lapetina.advisor.llm.domain.model;
