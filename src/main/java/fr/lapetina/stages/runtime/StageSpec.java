package fr.lapetina.stages.runtime;

import fr.lapetina.stages.domain.dispatcher.DispatcherConfig;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.Role;
import fr.lapetina.stages.domain.stage.StageHandler;

import java.util.Objects;

/**
 * Everything needed to start a stage.
 *
 * @param name         human readable name, used in logs, metrics and thread names
 * @param role         producer, producer-consumer or consumer
 * @param handler      user callbacks
 * @param initialState state passed to the first callback, may be null
 * @param dispatcher   dispatcher of a producing stage, demand dispatcher when null; must be null for a consumer
 * @param demandMode   initial demand mode of a producing stage
 */
public record StageSpec<I, O, S>(
        String name,
        Role role,
        StageHandler<I, O, S> handler,
        S initialState,
        DispatcherConfig dispatcher,
        DemandMode demandMode
) {
    public StageSpec {
        Objects.requireNonNull(name, "Stage name is required");
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(handler, "Handler is required");
        if (role.isProducing()) {
            if (dispatcher == null) {
                dispatcher = DispatcherConfig.demand();
            }
        } else if (dispatcher != null) {
            throw new IllegalArgumentException("A consumer stage has no dispatcher: " + name);
        }
        if (demandMode == null) {
            demandMode = DemandMode.FORWARD;
        }
    }

    public static <O, S> StageSpec<Void, O, S> producer(
            String name, StageHandler<Void, O, S> handler, S initialState, DispatcherConfig dispatcher) {
        return new StageSpec<>(name, Role.PRODUCER, handler, initialState, dispatcher, DemandMode.FORWARD);
    }

    public static <I, O, S> StageSpec<I, O, S> producerConsumer(
            String name, StageHandler<I, O, S> handler, S initialState, DispatcherConfig dispatcher) {
        return new StageSpec<>(name, Role.PRODUCER_CONSUMER, handler, initialState, dispatcher, DemandMode.FORWARD);
    }

    public static <I, S> StageSpec<I, Void, S> consumer(
            String name, StageHandler<I, Void, S> handler, S initialState) {
        return new StageSpec<>(name, Role.CONSUMER, handler, initialState, null, DemandMode.FORWARD);
    }

    /**
     * Returns a copy starting in the given demand mode.
     */
    public StageSpec<I, O, S> withDemandMode(DemandMode mode) {
        return new StageSpec<>(name, role, handler, initialState, dispatcher, mode);
    }
}
