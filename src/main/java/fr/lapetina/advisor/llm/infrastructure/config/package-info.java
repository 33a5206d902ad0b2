/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML is bound onto {@link fr.lapetina.advisor.llm.infrastructure.config.AdvisorConfig}
 * with SnakeYAML. Missing sections fall back to defaults; invalid values are rejected
 * with a {@link fr.lapetina.advisor.llm.infrastructure.config.ConfigLoader.ConfigurationException}.
 *
 * <h2>Hot-Reload</h2>
 * <p>When the configuration file changes on disk it is reloaded and registered
 * {@link fr.lapetina.advisor.llm.infrastructure.config.ConfigChangeListener}s are notified.
 * Only the model catalog and the decoding defaults of the HTTP layer follow a reload;
 * paths, ports and the event bus are fixed at startup.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (host, port, backlog)</li>
 *   <li>{@code model} - weight cache, persistence file, device, auto-resume, decoding defaults</li>
 *   <li>{@code streaming} - abandonment timeout and channel capacity</li>
 *   <li>{@code download} - artifact hub URL and timeouts</li>
 *   <li>{@code events} - lifecycle event ring buffer</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code catalog} - selectable models</li>
 * </ul>
 */
package fr.lapetina.advisor.llm.infrastructure.config;
