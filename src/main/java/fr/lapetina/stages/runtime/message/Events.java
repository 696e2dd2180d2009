package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.domain.model.SubscriptionTag;

import java.util.List;

/**
 * Upstream to downstream: a batch answering previously asked demand.
 */
public record Events(SubscriptionTag tag, List<?> events) implements StageMessage {

    @Override
    public String toString() {
        return "Events[tag=" + tag + ", size=" + events.size() + "]";
    }
}
