/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Admin HTTP server settings</li>
 *   <li>{@code mailbox} - Ring buffer size and wait strategy of every stage</li>
 *   <li>{@code subscription} - Default demand window, cancel mode and subscribe timeout</li>
 *   <li>{@code stage} - Buffer warning threshold, inspect and shutdown timeouts</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 *   <li>{@code demo} - Sample pipeline started by the application</li>
 * </ul>
 *
 * <p>Only the {@code subscription} defaults are applied on reload; they affect later subscriptions.
 *
 * @see fr.lapetina.stages.infrastructure.config.PipelineConfig
 * @see fr.lapetina.stages.infrastructure.config.ConfigLoader
 */
package fr.lapetina.stages.infrastructure.config;
