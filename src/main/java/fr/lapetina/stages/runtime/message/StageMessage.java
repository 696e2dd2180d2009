package fr.lapetina.stages.runtime.message;

/**
 * Marker for everything a stage's mailbox can carry.
 */
public interface StageMessage {
}
