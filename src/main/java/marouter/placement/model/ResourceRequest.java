package marouter.placement.model;

import java.util.Objects;

/**
 * Immutable placement request. Optional values are null when not given.
 * Validation happens in the engine, not here, so that a malformed request can
 * still be built and rejected with a proper error.
 */
public final class ResourceRequest {
    private final String requesterId;
    private final String modelName;
    private final Double requiredVramGb;
    private final Double requiredRamGb;
    private final String preferredRegion;
    private final GeoPoint location;
    private final Double maxDistanceKm;
    private final Double maxPricePerHour;
    private final Double minReliability;
    private final Priority priority;
    private final boolean preferLocal;

    private ResourceRequest(Builder builder) {
        this.requesterId = builder.requesterId;
        this.modelName = builder.modelName;
        this.requiredVramGb = builder.requiredVramGb;
        this.requiredRamGb = builder.requiredRamGb;
        this.preferredRegion = builder.preferredRegion;
        this.location = builder.location;
        this.maxDistanceKm = builder.maxDistanceKm;
        this.maxPricePerHour = builder.maxPricePerHour;
        this.minReliability = builder.minReliability;
        this.priority = builder.priority != null ? builder.priority : Priority.NORMAL;
        this.preferLocal = builder.preferLocal;
    }

    // Getters
    public String requesterId() {
        return requesterId;
    }

    public String modelName() {
        return modelName;
    }

    public Double requiredVramGb() {
        return requiredVramGb;
    }

    public Double requiredRamGb() {
        return requiredRamGb;
    }

    public String preferredRegion() {
        return preferredRegion;
    }

    public GeoPoint location() {
        return location;
    }

    public Double maxDistanceKm() {
        return maxDistanceKm;
    }

    public Double maxPricePerHour() {
        return maxPricePerHour;
    }

    public Double minReliability() {
        return minReliability;
    }

    public Priority priority() {
        return priority;
    }

    public boolean preferLocal() {
        return preferLocal;
    }

    public boolean hasRegion() {
        return preferredRegion != null && !preferredRegion.isBlank();
    }

    public boolean hasLocation() {
        return location != null;
    }

    /** Primary amount as a plain double, 0 when absent */
    public double vramGb() {
        return requiredVramGb != null ? requiredVramGb : 0.0;
    }

    /** Secondary amount as a plain double, 0 when absent */
    public double ramGb() {
        return requiredRamGb != null ? requiredRamGb : 0.0;
    }

    /** Create a builder from this request */
    public Builder toBuilder() {
        return new Builder()
                .requesterId(requesterId)
                .modelName(modelName)
                .requiredVramGb(requiredVramGb)
                .requiredRamGb(requiredRamGb)
                .preferredRegion(preferredRegion)
                .location(location)
                .maxDistanceKm(maxDistanceKm)
                .maxPricePerHour(maxPricePerHour)
                .minReliability(minReliability)
                .priority(priority)
                .preferLocal(preferLocal);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requesterId;
        private String modelName;
        private Double requiredVramGb;
        private Double requiredRamGb;
        private String preferredRegion;
        private GeoPoint location;
        private Double maxDistanceKm;
        private Double maxPricePerHour;
        private Double minReliability;
        private Priority priority = Priority.NORMAL;
        private boolean preferLocal;

        public Builder requesterId(String requesterId) {
            this.requesterId = requesterId;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder requiredVramGb(Double requiredVramGb) {
            this.requiredVramGb = requiredVramGb;
            return this;
        }

        public Builder requiredRamGb(Double requiredRamGb) {
            this.requiredRamGb = requiredRamGb;
            return this;
        }

        public Builder preferredRegion(String preferredRegion) {
            this.preferredRegion = preferredRegion;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder location(double latitude, double longitude) {
            this.location = new GeoPoint(latitude, longitude);
            return this;
        }

        public Builder maxDistanceKm(Double maxDistanceKm) {
            this.maxDistanceKm = maxDistanceKm;
            return this;
        }

        public Builder maxPricePerHour(Double maxPricePerHour) {
            this.maxPricePerHour = maxPricePerHour;
            return this;
        }

        public Builder minReliability(Double minReliability) {
            this.minReliability = minReliability;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder preferLocal(boolean preferLocal) {
            this.preferLocal = preferLocal;
            return this;
        }

        public ResourceRequest build() {
            return new ResourceRequest(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResourceRequest that))
            return false;
        return preferLocal == that.preferLocal
                && Objects.equals(requesterId, that.requesterId)
                && Objects.equals(modelName, that.modelName)
                && Objects.equals(requiredVramGb, that.requiredVramGb)
                && Objects.equals(requiredRamGb, that.requiredRamGb)
                && Objects.equals(preferredRegion, that.preferredRegion)
                && Objects.equals(location, that.location)
                && Objects.equals(maxDistanceKm, that.maxDistanceKm)
                && Objects.equals(maxPricePerHour, that.maxPricePerHour)
                && Objects.equals(minReliability, that.minReliability)
                && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requesterId, modelName, requiredVramGb, requiredRamGb, preferredRegion, location,
                maxDistanceKm, maxPricePerHour, minReliability, priority, preferLocal);
    }

    @Override
    public String toString() {
        return "ResourceRequest{vram=" + requiredVramGb + ", ram=" + requiredRamGb
                + ", region=" + preferredRegion + ", priority=" + priority.wireName() + "}";
    }
}
