package marouter.placement.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import marouter.placement.model.Decision;
import marouter.placement.model.ResourceRequest;
import marouter.placement.model.SubScore;
import marouter.placement.repository.DecisionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of DecisionStore.
 * Requests and decisions are written together in one transaction.
 */
public class JdbcDecisionStore implements DecisionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDecisionStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SubScore>> SUB_SCORES = new TypeReference<>() {
    };

    private final Database db;

    public JdbcDecisionStore(Database db) {
        this.db = db;
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public void record(String requestId, ResourceRequest request, Decision decision) {
        String requestSql = """
                    INSERT INTO placement_requests (id, requester_id, model_name, required_vram_gb, required_ram_gb,
                                                    preferred_region, latitude, longitude, max_distance_km,
                                                    max_price_per_hour, min_reliability, priority, prefer_local,
                                                    created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String decisionSql = """
                    INSERT INTO placement_decisions (request_id, chosen_node_id, chosen_node_name, policy,
                                                     fit_score, raw_score, sub_scores, headroom_gb,
                                                     justification, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement(requestSql)) {
                    ps.setString(1, requestId);
                    ps.setString(2, request.requesterId());
                    ps.setString(3, request.modelName());
                    ps.setDouble(4, request.vramGb());
                    JdbcSupport.setDouble(ps, 5, request.requiredRamGb());
                    ps.setString(6, request.preferredRegion());
                    JdbcSupport.setDouble(ps, 7, request.hasLocation() ? request.location().latitude() : null);
                    JdbcSupport.setDouble(ps, 8, request.hasLocation() ? request.location().longitude() : null);
                    JdbcSupport.setDouble(ps, 9, request.maxDistanceKm());
                    JdbcSupport.setDouble(ps, 10, request.maxPricePerHour());
                    JdbcSupport.setDouble(ps, 11, request.minReliability());
                    ps.setString(12, request.priority().name());
                    ps.setBoolean(13, request.preferLocal());
                    JdbcSupport.setTimestamp(ps, 14, decision.createdAt());
                    ps.executeUpdate();
                }

                try (PreparedStatement ps = conn.prepareStatement(decisionSql)) {
                    ps.setString(1, requestId);
                    JdbcSupport.setLong(ps, 2, decision.chosenNodeId());
                    ps.setString(3, decision.chosenNodeName());
                    ps.setString(4, decision.policy());
                    ps.setDouble(5, decision.fitScore());
                    ps.setDouble(6, decision.rawScore());
                    ps.setString(7, MAPPER.writeValueAsString(decision.subScores()));
                    JdbcSupport.setDouble(ps, 8, decision.headroomGb());
                    ps.setString(9, decision.justification());
                    JdbcSupport.setTimestamp(ps, 10, decision.createdAt());
                    ps.executeUpdate();
                }

                conn.commit();
                log.debug("Recorded decision for request {}", requestId);
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed to record decision for request: " + requestId, e);
        }
    }

    @Override
    public Optional<Decision> findByRequestId(String requestId) {
        String sql = "SELECT * FROM placement_decisions WHERE request_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find decision: " + requestId, e);
        }
    }

    @Override
    public List<Decision> findRecent(int limit) {
        String sql = "SELECT * FROM placement_decisions ORDER BY created_at DESC, request_id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                List<Decision> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list recent decisions", e);
        }
    }

    @Override
    public int count() {
        String sql = "SELECT COUNT(*) FROM placement_decisions";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            if (rs.next()) {
                return rs.getInt(1);
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count decisions", e);
        }
    }

    private Decision mapRow(ResultSet rs) throws SQLException {
        long nodeId = rs.getLong("chosen_node_id");
        Long chosenNodeId = rs.wasNull() ? null : nodeId;

        List<SubScore> subScores;
        try {
            subScores = MAPPER.readValue(rs.getString("sub_scores"), SUB_SCORES);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt sub_scores for request " + rs.getString("request_id"), e);
        }

        return Decision.builder()
                .requestId(rs.getString("request_id"))
                .chosenNodeId(chosenNodeId)
                .chosenNodeName(rs.getString("chosen_node_name"))
                .policy(rs.getString("policy"))
                .fitScore(rs.getDouble("fit_score"))
                .rawScore(rs.getDouble("raw_score"))
                .subScores(subScores)
                .headroomGb(JdbcSupport.getDouble(rs, "headroom_gb"))
                .justification(rs.getString("justification"))
                .createdAt(JdbcSupport.toInstant(rs.getTimestamp("created_at")))
                .build();
    }
}
