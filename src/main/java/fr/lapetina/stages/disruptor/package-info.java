/**
 * Actor substrate of the pipeline, built on the LMAX Disruptor.
 *
 * <p>Each stage owns one {@link fr.lapetina.stages.disruptor.Mailbox}: a pre-allocated ring
 * buffer drained by a single consumer thread. This provides what the stage runtime needs from
 * an actor system:
 *
 * <ul>
 *   <li><b>Isolation</b> - a stage's state is only touched from its mailbox thread</li>
 *   <li><b>Ordering</b> - messages are handled in publication order, one at a time</li>
 *   <li><b>Async send</b> - any thread publishes with a CAS claim, no lock</li>
 *   <li><b>Bounded inbox</b> - publishers wait while the ring buffer is full</li>
 * </ul>
 *
 * @see fr.lapetina.stages.disruptor.Mailbox
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.stages.disruptor;
