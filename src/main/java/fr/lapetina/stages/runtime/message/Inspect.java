package fr.lapetina.stages.runtime.message;

import fr.lapetina.stages.runtime.StageSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Runtime to stage: report the stage's current accounting.
 */
public record Inspect(CompletableFuture<StageSnapshot> reply) implements StageMessage {
}
