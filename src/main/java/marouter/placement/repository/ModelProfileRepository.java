package marouter.placement.repository;

import marouter.placement.model.ModelProfile;

import java.util.List;
import java.util.Optional;

/**
 * Catalog of model profiles used to infer VRAM requirements.
 */
public interface ModelProfileRepository {

    /**
     * Insert or replace a profile by name.
     */
    void save(ModelProfile profile);

    Optional<ModelProfile> findByName(String name);

    List<ModelProfile> findAll();
}
