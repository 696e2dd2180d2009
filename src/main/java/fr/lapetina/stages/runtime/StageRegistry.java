package fr.lapetina.stages.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the stages started by a runtime that have not terminated yet.
 *
 * Thread-safe. Stages are added on start and removed once terminated.
 */
public final class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final Map<String, StageRef> stages = new ConcurrentHashMap<>();

    void register(StageRef stage) {
        stages.put(stage.getId(), stage);
        log.debug("Stage registered: {}", stage);
    }

    void remove(StageRef stage) {
        if (stages.remove(stage.getId()) != null) {
            log.debug("Stage removed: {}", stage);
        }
    }

    /**
     * Gets a running stage by ID.
     */
    public Optional<StageRef> getStage(String stageId) {
        return Optional.ofNullable(stages.get(stageId));
    }

    /**
     * Gets all running stages, ordered by ID.
     */
    public List<StageRef> getAllStages() {
        List<StageRef> result = new ArrayList<>(stages.values());
        result.sort((a, b) -> Long.compare(Long.parseLong(a.getId()), Long.parseLong(b.getId())));
        return result;
    }

    public int size() {
        return stages.size();
    }
}
