package fr.lapetina.stages.integration;

import fr.lapetina.stages.PipelineFactory;
import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.runtime.StageRef;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Test extension of PipelineFactory over test-config.yaml, with helpers to
 * wait for asynchronous stage behaviour.
 */
public final class TestPipelineFactory extends PipelineFactory {

    public static final Duration TIMEOUT = Duration.ofSeconds(5);

    private TestPipelineFactory(String configPath) {
        super(configPath);
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestPipelineFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a test factory from a custom configuration path.
     */
    public static TestPipelineFactory create(String configPath) {
        TestPipelineFactory factory = new TestPipelineFactory(configPath);
        factory.start();
        return factory;
    }

    /**
     * Polls until the condition holds.
     *
     * @throws AssertionError if it does not hold within {@link #TIMEOUT}
     */
    public static void await(String description, BooleanSupplier condition) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for: " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted waiting for: " + description, e);
            }
        }
    }

    /**
     * Waits for the stage to terminate and returns the reason.
     */
    public static Reason awaitTermination(StageRef stage) throws Exception {
        return stage.terminationFuture().get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    }
}
