package fr.lapetina.stages.disruptor;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates mailbox slots.
 */
public final class MessageEnvelopeFactory<M> implements EventFactory<MessageEnvelope<M>> {

    @Override
    public MessageEnvelope<M> newInstance() {
        return new MessageEnvelope<>();
    }
}
