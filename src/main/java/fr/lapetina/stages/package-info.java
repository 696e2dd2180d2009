/**
 * Staged Pipeline - demand-driven event pipelines of producer and consumer stages.
 *
 * <p>Stages exchange events only in response to demand sent upstream by their consumers, so a
 * slow consumer naturally throttles everything before it. Each stage runs on its own LMAX
 * Disruptor mailbox.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.stages.PipelineFactory} - Main entry point for creating a
 *       configured {@link fr.lapetina.stages.runtime.StageRuntime} from YAML configuration</li>
 *   <li>{@link fr.lapetina.stages.StagePipelineApplication} - Standalone runtime with the
 *       admin HTTP API and an optional sample pipeline</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml").start()) {
 *     StageRuntime runtime = factory.getRuntime();
 *
 *     StageRef numbers = runtime.startProducer("numbers",
 *             Producers.<Integer>fromIterator(), List.of(1, 2, 3).iterator(), DispatcherConfig.demand());
 *     StageRef printer = runtime.startConsumer("printer",
 *             Producers.<Integer>forEach(System.out::println), null);
 *
 *     runtime.subscribe(printer, numbers, SubscriptionOptions.builder().maxDemand(10).build());
 * }
 * }</pre>
 *
 * @see fr.lapetina.stages.PipelineFactory
 * @see fr.lapetina.stages.runtime.StageRuntime
 */
package fr.lapetina.stages;
