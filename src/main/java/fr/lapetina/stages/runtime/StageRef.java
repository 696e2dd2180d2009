package fr.lapetina.stages.runtime;

import fr.lapetina.stages.disruptor.Mailbox;
import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.Role;
import fr.lapetina.stages.runtime.message.StageMessage;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a running stage. Safe to share between threads.
 *
 * Messages are only sent through the {@link StageRuntime}; the reference
 * itself exposes identity and liveness.
 */
public final class StageRef {

    private final String id;
    private final String name;
    private final Role role;
    private final CompletableFuture<Reason> termination = new CompletableFuture<>();
    private volatile Mailbox<StageMessage> mailbox;

    StageRef(String id, String name, Role role) {
        this.id = Objects.requireNonNull(id, "Stage ID is required");
        this.name = Objects.requireNonNull(name, "Stage name is required");
        this.role = Objects.requireNonNull(role, "Role is required");
    }

    void attach(Mailbox<StageMessage> mailbox) {
        this.mailbox = mailbox;
    }

    Mailbox<StageMessage> mailbox() {
        return mailbox;
    }

    /**
     * Fire-and-forget delivery to this stage's mailbox.
     *
     * @return false if the mailbox is gone and the message was dropped
     */
    boolean send(StageMessage message) {
        Mailbox<StageMessage> current = mailbox;
        return current != null && current.send(message);
    }

    void markTerminated(Reason reason) {
        termination.complete(reason);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Role getRole() {
        return role;
    }

    public boolean isAlive() {
        return !termination.isDone();
    }

    /**
     * Completes with the termination reason once the stage has terminated.
     */
    public CompletableFuture<Reason> terminationFuture() {
        return termination.copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((StageRef) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
