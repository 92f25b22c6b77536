package marouter.placement.store;

import marouter.placement.model.ModelProfile;
import marouter.placement.repository.ModelProfileRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ModelProfileRepository.
 */
public class JdbcModelProfileRepository implements ModelProfileRepository {

    private final Database db;

    public JdbcModelProfileRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(ModelProfile profile) {
        String sql = "MERGE INTO model_profiles (name, suggested_min_vram_gb, category) KEY (name) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, profile.name());
            ps.setDouble(2, profile.suggestedMinVramGb());
            ps.setString(3, profile.category().name());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save model profile: " + profile.name(), e);
        }
    }

    @Override
    public Optional<ModelProfile> findByName(String name) {
        String sql = "SELECT * FROM model_profiles WHERE name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find model profile: " + name, e);
        }
    }

    @Override
    public List<ModelProfile> findAll() {
        String sql = "SELECT * FROM model_profiles ORDER BY name";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<ModelProfile> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list model profiles", e);
        }
    }

    private ModelProfile mapRow(ResultSet rs) throws SQLException {
        return new ModelProfile(
                rs.getString("name"),
                rs.getDouble("suggested_min_vram_gb"),
                ModelProfile.Category.valueOf(rs.getString("category")));
    }
}
