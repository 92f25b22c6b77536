package marouter.placement.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeSnapshotTest {

    @Test
    void builderDefaults() {
        NodeSnapshot node = NodeSnapshot.builder().id(1).name("gpu-1").build();

        assertEquals(NodeCategory.DATACENTER, node.category());
        assertEquals(99.0, node.reliability());
        assertTrue(node.active());
        assertFalse(node.hasLocation());
    }

    @Test
    void toBuilderCopiesAllFields() {
        NodeSnapshot node = NodeSnapshot.builder()
                .id(7).name("mist").category(NodeCategory.MIST_NODE)
                .region("eu-west-1").location(52.37, 4.9)
                .vramTotalGb(24).vramFreeGb(20).ramTotalGb(64).ramFreeGb(32)
                .bandwidthGbps(1008).latencyMs(12).pricePerHour(0.6).reliability(90)
                .active(false)
                .build();

        NodeSnapshot copy = node.toBuilder().vramFreeGb(4).build();

        assertEquals(node, copy);
        assertEquals("eu-west-1", copy.region());
        assertEquals(new GeoPoint(52.37, 4.9), copy.location());
        assertEquals(4.0, copy.vramFreeGb());
        assertFalse(copy.active());
        assertTrue(copy.category().isVolunteer());
    }

    @Test
    void categoryParsesWireAndEnumNames() {
        assertEquals(NodeCategory.EDGE_CLUSTER, NodeCategory.fromString("edge_cluster"));
        assertEquals(NodeCategory.MIST_NODE, NodeCategory.fromString("MIST_NODE"));
        assertThrows(IllegalArgumentException.class, () -> NodeCategory.fromString("satellite"));
    }

    @Test
    void distanceBetweenCities() {
        GeoPoint newYork = new GeoPoint(40.7128, -74.0060);
        GeoPoint london = new GeoPoint(51.5074, -0.1278);

        assertEquals(5570.0, newYork.distanceKm(london), 10.0);
        assertEquals(0.0, newYork.distanceKm(newYork), 1e-9);
    }

    @Test
    void coordinateRanges() {
        assertTrue(new GeoPoint(-90, 180).isValid());
        assertFalse(new GeoPoint(90.5, 0).isValid());
        assertFalse(new GeoPoint(0, Double.NaN).isValid());
    }
}
