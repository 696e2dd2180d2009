package fr.lapetina.stages.runtime;

import fr.lapetina.stages.domain.model.Reason;

/**
 * Notified on the stage's thread once the stage has terminated.
 */
@FunctionalInterface
interface TerminationListener {

    void onTerminated(StageRef stage, Reason reason);
}
