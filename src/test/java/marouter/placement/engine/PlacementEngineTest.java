package marouter.placement.engine;

import marouter.placement.model.Decision;
import marouter.placement.model.DirectorySnapshot;
import marouter.placement.model.NodeCategory;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PlacementEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static final NodeSnapshot NODE_A = NodeSnapshot.builder()
            .id(1).name("NodeA").region("us-east-1")
            .vramTotalGb(80).vramFreeGb(56).bandwidthGbps(1935).latencyMs(2.5)
            .pricePerHour(2.5)
            .build();
    private static final NodeSnapshot NODE_B = NodeSnapshot.builder()
            .id(2).name("NodeB").region("us-west-2")
            .vramTotalGb(80).vramFreeGb(80).bandwidthGbps(1935).latencyMs(2.5)
            .pricePerHour(2.5)
            .build();

    private final PlacementEngine engine = new PlacementEngine(new HeadroomScoringPolicy());

    @Test
    void regionFilterLeavesNodeA() {
        ResourceRequest request = ResourceRequest.builder()
                .requiredVramGb(24.0)
                .preferredRegion("us-east-1")
                .build();

        Decision decision = engine.evaluate("r1", request, DirectorySnapshot.of(NOW, List.of(NODE_A, NODE_B)), NOW);

        assertEquals(1L, decision.chosenNodeId());
        assertEquals("NodeA", decision.chosenNodeName());
        assertEquals("headroom", decision.policy());
        assertEquals(32.0, decision.headroomGb());
        double headroom = decision.subScores().stream()
                .filter(s -> s.name().equals("headroom"))
                .findFirst().orElseThrow().value();
        assertTrue(headroom > 0);
        assertTrue(decision.justification().startsWith("Node 'NodeA' selected"), decision.justification());
        assertEquals(NOW, decision.createdAt());
    }

    @Test
    void insufficientCapacityGivesDecisionWithoutNode() {
        ResourceRequest request = ResourceRequest.builder().requiredVramGb(96.0).build();

        Decision decision = engine.evaluate("r2", request, DirectorySnapshot.of(NOW, List.of(NODE_A, NODE_B)), NOW);

        assertFalse(decision.hasChosenNode());
        assertNull(decision.chosenNodeId());
        assertEquals(0.0, decision.fitScore());
        assertTrue(decision.justification().contains(">= 96.0 GB VRAM free"), decision.justification());
    }

    @Test
    void equalScoresGoToMoreReliableNode() {
        NodeSnapshot nodeD = NODE_A.toBuilder().id(3).name("NodeD").reliability(95.0).build();
        NodeSnapshot nodeC = NODE_A.toBuilder().id(4).name("NodeC").reliability(99.0).build();
        ResourceRequest request = ResourceRequest.builder().requiredVramGb(24.0).build();

        Decision decision = engine.evaluate("r3", request, DirectorySnapshot.of(NOW, List.of(nodeD, nodeC)), NOW);

        assertEquals("NodeC", decision.chosenNodeName());
    }

    @Test
    void preferLocalPicksTheCloserNode() {
        PlacementEngine marketplace = new PlacementEngine(new MarketplaceScoringPolicy());
        NodeSnapshot nodeF = NODE_A.toBuilder().id(5).name("NodeF").region(null).location(44.5, 0.0).build();
        NodeSnapshot nodeE = NODE_A.toBuilder().id(6).name("NodeE").region(null).location(40.04, 0.0).build();
        ResourceRequest request = ResourceRequest.builder()
                .requiredVramGb(24.0)
                .location(40.0, 0.0)
                .preferLocal(true)
                .build();

        Decision decision = marketplace.evaluate("r4", request, DirectorySnapshot.of(NOW, List.of(nodeF, nodeE)), NOW);

        assertEquals("NodeE", decision.chosenNodeName());
        assertEquals("marketplace", decision.policy());
        assertEquals("proximity", DecisionAssembler.dominant(decision.subScores()).get(0).name());
    }

    @Test
    void inactiveNodeIsNeverChosen() {
        NodeSnapshot inactive = NODE_B.toBuilder().region("us-east-1").active(false).build();
        ResourceRequest request = ResourceRequest.builder().requiredVramGb(24.0).build();

        Decision decision = engine.evaluate("r5", request, DirectorySnapshot.of(NOW, List.of(inactive, NODE_A)), NOW);
        assertEquals("NodeA", decision.chosenNodeName());

        Decision none = engine.evaluate("r6", request, DirectorySnapshot.of(NOW, List.of(inactive)), NOW);
        assertFalse(none.hasChosenNode());
        assertEquals("No eligible node: no node is active (1 of 1 nodes rejected by the active criterion).",
                none.justification());
    }

    @Test
    void undersizedActiveNodesAreBlamedEvenWhenInactiveNodesOutnumberThem() {
        List<NodeSnapshot> nodes = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            nodes.add(NODE_B.toBuilder().id(10 + i).name("idle-" + i).active(false).build());
        }
        nodes.add(NODE_A.toBuilder().id(21).name("small-1").vramFreeGb(8).build());
        nodes.add(NODE_A.toBuilder().id(22).name("small-2").vramFreeGb(8).build());
        ResourceRequest request = ResourceRequest.builder().requiredVramGb(24.0).build();

        Decision decision = engine.evaluate("r9", request, DirectorySnapshot.of(NOW, nodes), NOW);

        assertFalse(decision.hasChosenNode());
        assertEquals("No eligible node: no active node has >= 24.0 GB VRAM free "
                + "(2 of 2 active nodes rejected by the vram criterion).", decision.justification());
        assertFalse(decision.justification().contains("no node is active"), decision.justification());
    }

    @Test
    void invalidRequestNeverReachesScoring() {
        AtomicInteger calls = new AtomicInteger();
        ScoringPolicy counting = new ScoringPolicy() {
            @Override
            public String name() {
                return "counting";
            }

            @Override
            public List<ScoredCandidate> score(ResourceRequest request, List<NodeSnapshot> eligible) {
                calls.incrementAndGet();
                return new HeadroomScoringPolicy().score(request, eligible);
            }
        };
        PlacementEngine countingEngine = new PlacementEngine(counting);
        DirectorySnapshot snapshot = DirectorySnapshot.of(NOW, List.of(NODE_A));

        assertThrows(InvalidRequestException.class, () -> countingEngine.evaluate("x",
                ResourceRequest.builder().requiredVramGb(-1.0).build(), snapshot, NOW));
        assertThrows(InvalidRequestException.class, () -> countingEngine.evaluate("x",
                ResourceRequest.builder().build(), snapshot, NOW));
        assertEquals(0, calls.get());

        countingEngine.evaluate("y", ResourceRequest.builder().requiredVramGb(8.0).build(), snapshot, NOW);
        assertEquals(1, calls.get());
    }

    @Test
    void emptyDirectoryIsNotAnError() {
        Decision decision = engine.evaluate("r7", ResourceRequest.builder().requiredVramGb(8.0).build(),
                DirectorySnapshot.of(NOW, List.of()), NOW);

        assertFalse(decision.hasChosenNode());
        assertEquals("No eligible node: the node directory is empty.", decision.justification());
    }

    @Test
    void evaluationDoesNotChangeTheSnapshot() {
        List<NodeSnapshot> nodes = List.of(NODE_A, NODE_B);
        DirectorySnapshot snapshot = DirectorySnapshot.of(NOW, nodes);

        engine.evaluate("r8", ResourceRequest.builder().requiredVramGb(24.0).build(), snapshot, NOW);

        assertEquals(56.0, snapshot.nodes().get(0).vramFreeGb());
        assertEquals(80.0, snapshot.nodes().get(1).vramFreeGb());
    }

    @Test
    void concurrentEvaluationsAgree() throws Exception {
        List<NodeSnapshot> nodes = new ArrayList<>();
        for (int i = 1; i <= 40; i++) {
            nodes.add(NodeSnapshot.builder()
                    .id(i).name("node-" + i)
                    .category(i % 3 == 0 ? NodeCategory.MIST_NODE : NodeCategory.DATACENTER)
                    .location(40.0 + i * 0.1, -74.0)
                    .vramTotalGb(80).vramFreeGb(16 + (i * 7) % 64)
                    .bandwidthGbps(100 + (i * 13) % 900).latencyMs(1 + i % 5)
                    .pricePerHour(1 + (i % 4) * 0.5).reliability(90 + i % 10)
                    .build());
        }
        DirectorySnapshot snapshot = DirectorySnapshot.of(NOW, nodes);
        ResourceRequest request = ResourceRequest.builder()
                .requiredVramGb(24.0)
                .location(40.0, -74.0)
                .build();
        PlacementEngine marketplace = new PlacementEngine(new MarketplaceScoringPolicy());
        Decision expected = marketplace.evaluate("same", request, snapshot, NOW);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Decision>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> marketplace.evaluate("same", request, snapshot, NOW));
            }
            for (Future<Decision> f : pool.invokeAll(tasks)) {
                assertEquals(expected, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
