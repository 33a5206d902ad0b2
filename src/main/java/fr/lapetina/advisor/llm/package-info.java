/**
 * Advisor LLM runtime - owns the local language model that narrates the stock-advisor dashboard.
 *
 * <p>The runtime loads, swaps and unloads one model at a time while dashboard threads,
 * the startup thread and status pollers call into it concurrently.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.advisor.llm.RuntimeFactory} - Composition root wiring the lifecycle
 *       manager from YAML configuration</li>
 *   <li>{@link fr.lapetina.advisor.llm.AdvisorLlmApplication} - Standalone HTTP server</li>
 *   <li>{@link fr.lapetina.advisor.llm.lifecycle.ModelLifecycleManager} - Load, unload, status and
 *       generation entry points</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RuntimeFactory factory = RuntimeFactory.create("config.yaml").start()) {
 *     ModelLifecycleManager manager = factory.getManager();
 *     manager.load(ModelId.of("Qwen/Qwen3-4B"));
 *
 *     String text = manager.generate(GenerationRequest.ofPrompt(null, "Hello!", 0.0));
 *     System.out.println(text);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Blocking and streaming generation with cumulative snapshots</li>
 *   <li>Background loads with progress milestones and auto-resume of the last model</li>
 *   <li>Hot-reload of the model catalog</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Lifecycle events over an LMAX Disruptor ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.advisor.llm.RuntimeFactory
 * @see fr.lapetina.advisor.llm.lifecycle.ModelLifecycleManager
 */
package fr.lapetina.advisor.llm;
