package marouter.placement.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of the node directory taken at one instant.
 */
public record DirectorySnapshot(Instant takenAt, List<NodeSnapshot> nodes) {

    public DirectorySnapshot {
        if (takenAt == null) {
            throw new IllegalArgumentException("takenAt is required");
        }
        nodes = List.copyOf(nodes);
    }

    public static DirectorySnapshot of(Instant takenAt, List<NodeSnapshot> nodes) {
        return new DirectorySnapshot(takenAt, nodes);
    }
}
