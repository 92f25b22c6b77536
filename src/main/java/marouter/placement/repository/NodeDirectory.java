package marouter.placement.repository;

import marouter.placement.engine.SnapshotUnavailableException;
import marouter.placement.model.DirectorySnapshot;

/**
 * Read-only source of candidate nodes. The engine reads one snapshot per
 * evaluation and never writes back.
 */
@FunctionalInterface
public interface NodeDirectory {

    /**
     * Take a snapshot of all known nodes, active or not.
     *
     * @return the nodes together with the instant they were read
     * @throws SnapshotUnavailableException if the directory cannot be read
     */
    DirectorySnapshot snapshot();
}
