/**
 * Stage runtime: lifecycle, subscriptions and demand accounting.
 *
 * <p>{@link fr.lapetina.stages.runtime.StageRuntime} starts stages, each with its own mailbox,
 * and wires them with a synchronous subscribe handshake. Everything else is message passing
 * between mailboxes:
 * <pre>
 * downstream --Ask(n)--&gt; upstream --Events(&lt;= n)--&gt; downstream
 * </pre>
 *
 * <p>When an upstream cancels or terminates, the downstream applies the subscription's
 * {@link fr.lapetina.stages.domain.model.CancelMode} to decide whether it terminates too.
 *
 * @see fr.lapetina.stages.runtime.StageRuntime
 * @see fr.lapetina.stages.runtime.ConsumerSubscription
 */
package fr.lapetina.stages.runtime;
