package fr.lapetina.stages.disruptor;

/**
 * Slot of a mailbox ring buffer.
 *
 * Mutable and reused across the ring buffer; only touched by the publishing
 * thread before publication and by the mailbox's consumer thread after.
 */
public final class MessageEnvelope<M> {

    private M message;
    private long sequence = -1;

    public void set(M message, long sequence) {
        this.message = message;
        this.sequence = sequence;
    }

    public void clear() {
        this.message = null;
        this.sequence = -1;
    }

    public M getMessage() {
        return message;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "MessageEnvelope{seq=" + sequence + ", message=" + message + '}';
    }
}
