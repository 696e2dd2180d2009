package fr.lapetina.stages.disruptor;

/**
 * Receives the messages of one mailbox, one at a time, on the mailbox thread.
 */
@FunctionalInterface
public interface MessageHandler<M> {

    void onMessage(M message);
}
