package marouter.placement.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import marouter.placement.config.PlacementConfig;
import marouter.placement.server.PlacementNettyServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the HTTP endpoints of a real Netty server backed by an in-memory
 * database seeded from seed-nodes.json.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final int TEST_PORT = 18181;
        private static final String API_KEY = "test-key";
        private static final String BASE_URL = "http://localhost:" + TEST_PORT;

        private static final String REQUEST_BODY = """
                        {
                            "requesterId": "tenant-1",
                            "requiredVramGb": 24,
                            "preferredRegion": "us-east-1"
                        }
                        """;

        private HttpClient httpClient;

        @BeforeEach
        void setUp() throws Exception {
                if (PlacementNettyServer.isRunning()) {
                        PlacementNettyServer.stop();
                }

                PlacementConfig config = PlacementConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withApiKey(API_KEY)
                                .withSeedNodesPath("classpath:seed-nodes.json");

                assertTrue(PlacementNettyServer.start(TEST_PORT, config));

                // Wait for server to be ready
                TimeUnit.MILLISECONDS.sleep(200);

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                PlacementNettyServer.stop();
        }

        @Test
        @DisplayName("Quote requires the API key and records nothing")
        void quoteEndpoint() throws Exception {
                HttpResponse<String> withoutKey = post("/api/v1/public/placement/quote", REQUEST_BODY, null);
                assertEquals(403, withoutKey.statusCode());

                HttpResponse<String> withKey = post("/api/v1/public/placement/quote", REQUEST_BODY, API_KEY);
                assertEquals(200, withKey.statusCode(), "Body: " + withKey.body());

                JsonNode quote = MAPPER.readTree(withKey.body());
                assertEquals("NodeA", quote.get("chosenNodeName").asText());
                assertTrue(quote.get("requestId").isNull());
                assertEquals(0, PlacementNettyServer.dependencies().decisionStore().count());
        }

        @Test
        @DisplayName("Placement is recorded and can be read back by id and in the list")
        void placementEndpoints() throws Exception {
                HttpResponse<String> created = post("/api/v1/placement/requests", REQUEST_BODY, null);
                assertEquals(201, created.statusCode(), "Body: " + created.body());

                JsonNode decision = MAPPER.readTree(created.body());
                String requestId = decision.get("requestId").asText();
                assertEquals(1, decision.get("chosenNodeId").asLong());
                assertTrue(decision.get("justification").asText().startsWith("Node 'NodeA' selected"));

                HttpResponse<String> byId = get("/api/v1/placement/requests/" + requestId);
                assertEquals(200, byId.statusCode());
                assertEquals(decision, MAPPER.readTree(byId.body()));

                HttpResponse<String> list = get("/api/v1/placement/requests?limit=10");
                assertEquals(200, list.statusCode());
                JsonNode listed = MAPPER.readTree(list.body());
                assertEquals(1, listed.get("count").asInt());
                assertEquals(requestId, listed.get("decisions").get(0).get("requestId").asText());
        }

        @Test
        @DisplayName("Model name alone is resolved from the seeded profiles")
        void placementByModelName() throws Exception {
                HttpResponse<String> created = post("/api/v1/placement/requests",
                                "{\"modelName\": \"llama-3-70b\", \"preferredRegion\": \"us-west-2\"}", null);
                assertEquals(201, created.statusCode(), "Body: " + created.body());

                JsonNode decision = MAPPER.readTree(created.body());
                assertEquals("NodeB", decision.get("chosenNodeName").asText());
                assertEquals(40.0, decision.get("headroomGb").asDouble());
        }

        @Test
        @DisplayName("Request with no eligible node still returns a decision")
        void noEligibleNode() throws Exception {
                HttpResponse<String> created = post("/api/v1/placement/requests",
                                "{\"requiredVramGb\": 128}", null);
                assertEquals(201, created.statusCode());

                JsonNode decision = MAPPER.readTree(created.body());
                assertTrue(decision.get("chosenNodeId").isNull());
                assertTrue(decision.get("justification").asText().startsWith("No eligible node"));
        }

        @Test
        @DisplayName("Invalid input gives 400, unknown ids give 404")
        void errorResponses() throws Exception {
                assertEquals(400, post("/api/v1/placement/requests", "{\"requiredVramGb\": -1}", null).statusCode());
                assertEquals(400, post("/api/v1/placement/requests", "{not json", null).statusCode());
                assertEquals(400, post("/api/v1/placement/requests",
                                "{\"requiredVramGb\": 8, \"latitude\": 40.0}", null).statusCode());
                assertEquals(400, get("/api/v1/placement/requests?limit=abc").statusCode());
                assertEquals(404, get("/api/v1/placement/requests/does-not-exist").statusCode());
                assertEquals(404, get("/api/v1/nothing-here").statusCode());
                assertEquals(0, PlacementNettyServer.dependencies().decisionStore().count());
        }

        @Test
        @DisplayName("A JSON null body is a bad request on both endpoints")
        void nullBodyIsRejected() throws Exception {
                HttpResponse<String> placement = post("/api/v1/placement/requests", "null", null);
                assertEquals(400, placement.statusCode(), "Body: " + placement.body());
                assertTrue(placement.body().contains("request body is required"), placement.body());

                HttpResponse<String> quote = post("/api/v1/public/placement/quote", "null", API_KEY);
                assertEquals(400, quote.statusCode(), "Body: " + quote.body());
                assertEquals(0, PlacementNettyServer.dependencies().decisionStore().count());
        }

        @Test
        @DisplayName("Max distance without a location is a bad request")
        void maxDistanceWithoutLocation() throws Exception {
                HttpResponse<String> response = post("/api/v1/placement/requests",
                                "{\"requiredVramGb\": 8, \"maxDistanceKm\": 100}", null);
                assertEquals(400, response.statusCode(), "Body: " + response.body());
        }

        @Test
        @DisplayName("Health reports node count and policy")
        void health() throws Exception {
                HttpResponse<String> response = get("/api/v1/health");
                assertEquals(200, response.statusCode());

                JsonNode health = MAPPER.readTree(response.body());
                assertEquals("healthy", health.get("status").asText());
                assertEquals(3, health.get("nodes").asInt());
                assertEquals("headroom", health.get("scoringPolicy").asText());
        }

        private HttpResponse<String> post(String path, String body, String apiKey) throws Exception {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                                .uri(URI.create(BASE_URL + path))
                                .header("Content-Type", "application/json")
                                .POST(HttpRequest.BodyPublishers.ofString(body));
                if (apiKey != null) {
                        builder.header("X-API-Key", apiKey);
                }
                return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(
                                HttpRequest.newBuilder().uri(URI.create(BASE_URL + path)).GET().build(),
                                HttpResponse.BodyHandlers.ofString());
        }
}
