package marouter.placement.service;

import marouter.placement.config.PlacementConfig;
import marouter.placement.engine.HeadroomScoringPolicy;
import marouter.placement.engine.InvalidRequestException;
import marouter.placement.engine.PlacementEngine;
import marouter.placement.engine.SnapshotUnavailableException;
import marouter.placement.model.Decision;
import marouter.placement.model.ModelProfile;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.store.Database;
import marouter.placement.store.JdbcDecisionStore;
import marouter.placement.store.JdbcModelProfileRepository;
import marouter.placement.store.JdbcNodeDirectory;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlacementServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-20T14:00:00.987654Z");

    private static Database db;
    private static JdbcNodeDirectory directory;
    private static JdbcDecisionStore store;
    private static JdbcModelProfileRepository profiles;
    private static PlacementService service;

    @BeforeAll
    static void setup() {
        PlacementConfig config = PlacementConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-placement;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        directory = new JdbcNodeDirectory(db);
        store = new JdbcDecisionStore(db);
        profiles = new JdbcModelProfileRepository(db);
        service = new PlacementService(directory, store, profiles,
                new PlacementEngine(new HeadroomScoringPolicy()), Clock.fixed(NOW, ZoneOffset.UTC));

        directory.save(NodeSnapshot.builder().id(1).name("NodeA").region("us-east-1")
                .vramTotalGb(80).vramFreeGb(56).bandwidthGbps(1935).latencyMs(2.5).build());
        directory.save(NodeSnapshot.builder().id(2).name("NodeB").region("us-west-2")
                .vramTotalGb(80).vramFreeGb(80).bandwidthGbps(2039).latencyMs(4.0).build());
        profiles.save(new ModelProfile("llama-3-70b", 40.0, ModelProfile.Category.LLM));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanDecisions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM placement_decisions");
            st.execute("DELETE FROM placement_requests");
            conn.commit();
        }
    }

    @Test
    void placedDecisionIsRecordedAndReadsBackEqual() {
        Decision decision = service.place(ResourceRequest.builder()
                .requesterId("tenant-1")
                .requiredVramGb(24.0)
                .preferredRegion("us-east-1")
                .build());

        assertNotNull(decision.requestId());
        assertEquals("NodeA", decision.chosenNodeName());
        assertEquals(Instant.parse("2026-05-20T14:00:00.987Z"), decision.createdAt());
        assertEquals(decision, service.findDecision(decision.requestId()).orElseThrow());
        assertEquals(1, store.count());
    }

    @Test
    void noCandidateDecisionIsRecordedToo() {
        Decision decision = service.place(ResourceRequest.builder().requiredVramGb(96.0).build());

        assertFalse(decision.hasChosenNode());
        assertEquals(decision, service.findDecision(decision.requestId()).orElseThrow());
    }

    @Test
    void modelProfileSuppliesMissingVram() {
        Decision decision = service.place(ResourceRequest.builder()
                .modelName("llama-3-70b")
                .preferredRegion("us-west-2")
                .build());

        assertEquals("NodeB", decision.chosenNodeName());
        assertEquals(40.0, decision.headroomGb());
    }

    @Test
    void explicitVramWinsOverModelProfile() {
        Decision decision = service.place(ResourceRequest.builder()
                .modelName("llama-3-70b")
                .requiredVramGb(70.0)
                .build());

        assertEquals("NodeB", decision.chosenNodeName());
        assertEquals(10.0, decision.headroomGb());
    }

    @Test
    void unknownModelRecordsNothing() {
        assertThrows(InvalidRequestException.class,
                () -> service.place(ResourceRequest.builder().modelName("no-such-model").build()));
        assertThrows(InvalidRequestException.class,
                () -> service.place(ResourceRequest.builder().build()));
        assertEquals(0, store.count());
    }

    @Test
    void invalidRequestRecordsNothing() {
        assertThrows(InvalidRequestException.class,
                () -> service.place(ResourceRequest.builder().requiredVramGb(-2.0).build()));
        assertEquals(0, store.count());
    }

    @Test
    void snapshotFailureRecordsNothing() {
        PlacementService failing = new PlacementService(() -> {
            throw new SnapshotUnavailableException("directory down");
        }, store, profiles, new PlacementEngine(new HeadroomScoringPolicy()));

        assertThrows(SnapshotUnavailableException.class,
                () -> failing.place(ResourceRequest.builder().requiredVramGb(8.0).build()));
        assertEquals(0, store.count());
    }

    @Test
    void listRecentReturnsRecordedDecisions() {
        service.place(ResourceRequest.builder().requiredVramGb(8.0).build());
        service.place(ResourceRequest.builder().requiredVramGb(16.0).build());

        List<Decision> recent = service.listRecent(10);

        assertEquals(2, recent.size());
        assertTrue(service.listRecent(1).size() <= 1);
    }
}
