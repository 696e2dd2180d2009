/**
 * Dispatchers deciding which downstream subscription receives the events a stage produces.
 *
 * <p>A dispatcher is owned by its producing stage and only used from the stage's thread. It
 * tracks the outstanding demand of every subscriber and tells the stage how much demand may be
 * passed on to its handler.
 *
 * <h2>Available Dispatchers</h2>
 * <table border="1">
 *   <tr><th>Dispatcher</th><th>Description</th><th>Demand passed on</th></tr>
 *   <tr><td>{@code demand}</td><td>Each event to one subscriber, the one with the highest demand</td><td>Every ask</td></tr>
 *   <tr><td>{@code broadcast}</td><td>Every event to every subscriber, optionally filtered by a selector</td><td>Lowest subscriber demand</td></tr>
 *   <tr><td>{@code partition}</td><td>Each event to the subscriber bound to its partition</td><td>Asks not served from partition queues</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Dispatcher<Order> dispatcher = DispatcherFactory.create(
 *         DispatcherConfig.partition(List.of("eu", "us"), order -> order.region()));
 * }</pre>
 *
 * @see fr.lapetina.stages.domain.dispatcher.Dispatcher
 * @see fr.lapetina.stages.domain.dispatcher.DispatcherFactory
 */
package fr.lapetina.stages.domain.dispatcher;
