package marouter.placement.store;

import marouter.placement.engine.SnapshotUnavailableException;
import marouter.placement.model.DirectorySnapshot;
import marouter.placement.model.GeoPoint;
import marouter.placement.model.NodeCategory;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.repository.NodeDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of NodeDirectory over the {@code nodes} table.
 */
public class JdbcNodeDirectory implements NodeDirectory {

    private static final Logger log = LoggerFactory.getLogger(JdbcNodeDirectory.class);

    private final Database db;
    private final Clock clock;

    public JdbcNodeDirectory(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcNodeDirectory(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public DirectorySnapshot snapshot() {
        String sql = "SELECT * FROM nodes ORDER BY id";

        Instant takenAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<NodeSnapshot> nodes = new ArrayList<>();
            while (rs.next()) {
                nodes.add(mapRow(rs));
            }
            log.debug("Read snapshot of {} nodes", nodes.size());
            return DirectorySnapshot.of(takenAt, nodes);
        } catch (SQLException e) {
            throw new SnapshotUnavailableException("Failed to read node directory: " + e.getMessage(), e);
        }
    }

    /**
     * Insert or replace a node. Used by the seed loader; the engine never
     * writes nodes.
     */
    public void save(NodeSnapshot node) {
        String sql = """
                    MERGE INTO nodes (id, name, category, region, latitude, longitude,
                                      vram_total_gb, vram_free_gb, ram_total_gb, ram_free_gb,
                                      bandwidth_gbps, latency_ms, price_per_hour, reliability,
                                      is_active, last_telemetry_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, node.id());
            ps.setString(2, node.name());
            ps.setString(3, node.category().name());
            ps.setString(4, node.region());
            if (node.hasLocation()) {
                ps.setDouble(5, node.location().latitude());
                ps.setDouble(6, node.location().longitude());
            } else {
                ps.setNull(5, Types.DOUBLE);
                ps.setNull(6, Types.DOUBLE);
            }
            ps.setDouble(7, node.vramTotalGb());
            ps.setDouble(8, node.vramFreeGb());
            ps.setDouble(9, node.ramTotalGb());
            ps.setDouble(10, node.ramFreeGb());
            ps.setDouble(11, node.bandwidthGbps());
            ps.setDouble(12, node.latencyMs());
            ps.setDouble(13, node.pricePerHour());
            ps.setDouble(14, node.reliability());
            ps.setBoolean(15, node.active());
            JdbcSupport.setTimestamp(ps, 16, node.lastTelemetryAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save node: " + node.id(), e);
        }
    }

    /**
     * Get total count of nodes, active or not.
     */
    public int count() {
        String sql = "SELECT COUNT(*) FROM nodes";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            if (rs.next()) {
                return rs.getInt(1);
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count nodes", e);
        }
    }

    private NodeSnapshot mapRow(ResultSet rs) throws SQLException {
        double lat = rs.getDouble("latitude");
        boolean noLat = rs.wasNull();
        double lon = rs.getDouble("longitude");
        boolean noLon = rs.wasNull();

        return NodeSnapshot.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .category(NodeCategory.fromString(rs.getString("category")))
                .region(rs.getString("region"))
                .location(noLat || noLon ? null : new GeoPoint(lat, lon))
                .vramTotalGb(rs.getDouble("vram_total_gb"))
                .vramFreeGb(rs.getDouble("vram_free_gb"))
                .ramTotalGb(rs.getDouble("ram_total_gb"))
                .ramFreeGb(rs.getDouble("ram_free_gb"))
                .bandwidthGbps(rs.getDouble("bandwidth_gbps"))
                .latencyMs(rs.getDouble("latency_ms"))
                .pricePerHour(rs.getDouble("price_per_hour"))
                .reliability(rs.getDouble("reliability"))
                .active(rs.getBoolean("is_active"))
                .lastTelemetryAt(JdbcSupport.toInstant(rs.getTimestamp("last_telemetry_at")))
                .build();
    }
}
