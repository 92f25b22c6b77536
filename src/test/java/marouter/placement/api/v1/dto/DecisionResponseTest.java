package marouter.placement.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import marouter.placement.model.Decision;
import marouter.placement.model.SubScore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionResponseTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    @Test
    void serializesDecisionFields() throws Exception {
        Decision decision = Decision.builder()
                .requestId("req-1")
                .chosenNodeId(1L)
                .chosenNodeName("NodeA")
                .policy("marketplace")
                .fitScore(175.5)
                .rawScore(175.5)
                .subScores(List.of(new SubScore("proximity", 100.0), new SubScore("price", 25.5)))
                .headroomGb(32.0)
                .justification("Node 'NodeA' selected")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(DecisionResponse.from(decision)));

        assertEquals("req-1", json.get("requestId").asText());
        assertEquals(1, json.get("chosenNodeId").asLong());
        assertEquals("marketplace", json.get("policy").asText());
        assertEquals(175.5, json.get("fitScore").asDouble());
        assertEquals("proximity", json.get("subScores").get(0).get("name").asText());
        assertEquals(25.5, json.get("subScores").get(1).get("value").asDouble());
        assertEquals("2026-01-01T00:00:00Z", json.get("createdAt").asText());
    }

    @Test
    void quoteWithoutNodeKeepsNullFields() throws Exception {
        Decision decision = Decision.builder()
                .policy("headroom")
                .subScores(List.of())
                .justification("No eligible node: the node directory is empty.")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();

        String body = mapper.writeValueAsString(DecisionResponse.from(decision));
        JsonNode json = mapper.readTree(body);

        assertTrue(json.get("requestId").isNull());
        assertTrue(json.get("chosenNodeId").isNull());
        assertEquals(decision, mapper.readValue(body, DecisionResponse.class).toDecision());
    }
}
