package fr.lapetina.stages.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.stages.domain.dispatcher.DispatcherConfig;
import fr.lapetina.stages.domain.model.CancelMode;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.domain.stage.Producers;
import fr.lapetina.stages.integration.TestPipelineFactory;
import fr.lapetina.stages.runtime.StageRef;
import fr.lapetina.stages.runtime.StageRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;

import static fr.lapetina.stages.integration.TestPipelineFactory.await;
import static org.assertj.core.api.Assertions.assertThat;

class AdminHttpServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private TestPipelineFactory factory;
    private StageRuntime runtime;
    private AdminHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestPipelineFactory.create();
        runtime = factory.getRuntime();
        server = new AdminHttpServer("127.0.0.1", 0, 10, 2, runtime, factory.getMetricsRegistry());
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.noBody()).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    private StageRef idleProducer() {
        return runtime.startProducer("source", Producers.<Integer>fromIterator(),
                Collections.<Integer>emptyIterator(), DispatcherConfig.demand());
    }

    @Nested
    @DisplayName("health and metrics")
    class HealthTests {

        @Test
        @DisplayName("should report status and subscription defaults")
        void shouldReportHealth() throws Exception {
            idleProducer();

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.get("status").asText()).isEqualTo("UP");
            assertThat(body.get("stages").asInt()).isEqualTo(1);
            assertThat(body.get("subscriptionDefaults").get("minDemand").asInt()).isEqualTo(5);
            assertThat(body.get("subscriptionDefaults").get("maxDemand").asInt()).isEqualTo(10);
            assertThat(body.get("subscriptionDefaults").get("cancelMode").asText()).isEqualTo("PERMANENT");
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            idleProducer();

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("test_stages_stages_running");
        }

        @Test
        @DisplayName("should reject other methods on health")
        void shouldRejectPostOnHealth() throws Exception {
            assertThat(post("/health").statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("stage administration")
    class StageAdminTests {

        @Test
        @DisplayName("should list running stages")
        void shouldListStages() throws Exception {
            StageRef producer = idleProducer();
            StageRef consumer = runtime.startConsumer("sink", Producers.<Integer>forEach(n -> { }), null);

            HttpResponse<String> response = get("/admin/stages");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body).hasSize(2);
            assertThat(body.get(0).get("id").asText()).isEqualTo(producer.getId());
            assertThat(body.get(0).get("role").asText()).isEqualTo("PRODUCER");
            assertThat(body.get(1).get("id").asText()).isEqualTo(consumer.getId());
            assertThat(body.get(1).has("pending_demand")).isFalse();
        }

        @Test
        @DisplayName("should inspect a stage with its subscriptions")
        void shouldInspectStage() throws Exception {
            StageRef producer = idleProducer();
            StageRef consumer = runtime.startConsumer("sink", Producers.<Integer>forEach(n -> { }), null);
            SubscriptionTag tag = runtime.subscribe(consumer, producer);

            HttpResponse<String> response = get("/admin/stages/" + consumer.getId());

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.get("name").asText()).isEqualTo("sink");
            assertThat(body.get("subscriptions")).hasSize(1);
            assertThat(body.get("subscriptions").get(0).get("tag").asText()).isEqualTo(tag.value());

            JsonNode upstream = objectMapper.readTree(get("/admin/stages/" + producer.getId()).body());
            assertThat(upstream.get("pending_demand").asLong()).isEqualTo(10);
        }

        @Test
        @DisplayName("should return 404 for an unknown stage")
        void shouldReturnNotFound() throws Exception {
            assertThat(get("/admin/stages/999").statusCode()).isEqualTo(404);
            assertThat(post("/admin/stages/999/subscriptions/abc/cancel").statusCode()).isEqualTo(404);
            assertThat(post("/admin/stages/999/demand/forward").statusCode()).isEqualTo(404);
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should cancel a subscription")
        void shouldCancelSubscription() throws Exception {
            StageRef producer = idleProducer();
            StageRef consumer = runtime.startConsumer("sink", Producers.<Integer>forEach(n -> { }), null);
            SubscriptionTag tag = runtime.subscribe(consumer, producer,
                    SubscriptionOptions.builder().cancelMode(CancelMode.TEMPORARY).build());

            HttpResponse<String> response = post(
                    "/admin/stages/" + consumer.getId() + "/subscriptions/" + tag.value() + "/cancel");

            assertThat(response.statusCode()).isEqualTo(202);
            await("subscription removed", () ->
                    runtime.inspect(consumer).orElseThrow().subscriptions().isEmpty());
            assertThat(consumer.isAlive()).isTrue();
        }

        @Test
        @DisplayName("should switch the demand mode of a producing stage")
        void shouldSwitchDemandMode() throws Exception {
            StageRef producer = idleProducer();

            HttpResponse<String> response = post("/admin/stages/" + producer.getId() + "/demand/accumulate");

            assertThat(response.statusCode()).isEqualTo(202);
            await("accumulate mode", () ->
                    runtime.inspect(producer).orElseThrow().demandMode() == DemandMode.ACCUMULATE);
        }

        @Test
        @DisplayName("should reject an unknown demand mode or a consumer stage")
        void shouldRejectInvalidDemandMode() throws Exception {
            StageRef producer = idleProducer();
            StageRef consumer = runtime.startConsumer("sink", Producers.<Integer>forEach(n -> { }), null);

            assertThat(post("/admin/stages/" + producer.getId() + "/demand/sideways").statusCode()).isEqualTo(400);
            assertThat(post("/admin/stages/" + consumer.getId() + "/demand/forward").statusCode()).isEqualTo(400);
        }
    }
}
