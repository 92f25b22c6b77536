package marouter.placement.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one resource node as reported by the node directory.
 * Primary resource is VRAM, secondary resource is RAM, both in GB.
 */
public final class NodeSnapshot {
    private final long id;
    private final String name;
    private final NodeCategory category;
    private final GeoPoint location;
    private final String region;
    private final double vramTotalGb;
    private final double vramFreeGb;
    private final double ramTotalGb;
    private final double ramFreeGb;
    private final double bandwidthGbps;
    private final double latencyMs;
    private final double pricePerHour;
    private final double reliability;
    private final boolean active;
    private final Instant lastTelemetryAt;

    private NodeSnapshot(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.category = Objects.requireNonNull(builder.category, "category is required");
        this.location = builder.location;
        this.region = builder.region;
        this.vramTotalGb = builder.vramTotalGb;
        this.vramFreeGb = builder.vramFreeGb;
        this.ramTotalGb = builder.ramTotalGb;
        this.ramFreeGb = builder.ramFreeGb;
        this.bandwidthGbps = builder.bandwidthGbps;
        this.latencyMs = builder.latencyMs;
        this.pricePerHour = builder.pricePerHour;
        this.reliability = builder.reliability;
        this.active = builder.active;
        this.lastTelemetryAt = builder.lastTelemetryAt;
    }

    // Getters
    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public NodeCategory category() {
        return category;
    }

    /** Location, or null when the node has not reported one */
    public GeoPoint location() {
        return location;
    }

    public String region() {
        return region;
    }

    public double vramTotalGb() {
        return vramTotalGb;
    }

    public double vramFreeGb() {
        return vramFreeGb;
    }

    public double ramTotalGb() {
        return ramTotalGb;
    }

    public double ramFreeGb() {
        return ramFreeGb;
    }

    public double bandwidthGbps() {
        return bandwidthGbps;
    }

    public double latencyMs() {
        return latencyMs;
    }

    public double pricePerHour() {
        return pricePerHour;
    }

    /** Uptime/reliability score, 0-100 */
    public double reliability() {
        return reliability;
    }

    public boolean active() {
        return active;
    }

    public Instant lastTelemetryAt() {
        return lastTelemetryAt;
    }

    public boolean hasLocation() {
        return location != null;
    }

    /** Create a builder from this node (for tests and telemetry updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .category(category)
                .location(location)
                .region(region)
                .vramTotalGb(vramTotalGb)
                .vramFreeGb(vramFreeGb)
                .ramTotalGb(ramTotalGb)
                .ramFreeGb(ramFreeGb)
                .bandwidthGbps(bandwidthGbps)
                .latencyMs(latencyMs)
                .pricePerHour(pricePerHour)
                .reliability(reliability)
                .active(active)
                .lastTelemetryAt(lastTelemetryAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private String name;
        private NodeCategory category = NodeCategory.DATACENTER;
        private GeoPoint location;
        private String region;
        private double vramTotalGb;
        private double vramFreeGb;
        private double ramTotalGb;
        private double ramFreeGb;
        private double bandwidthGbps;
        private double latencyMs;
        private double pricePerHour;
        private double reliability = 99.0;
        private boolean active = true;
        private Instant lastTelemetryAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(NodeCategory category) {
            this.category = category;
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

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder vramTotalGb(double vramTotalGb) {
            this.vramTotalGb = vramTotalGb;
            return this;
        }

        public Builder vramFreeGb(double vramFreeGb) {
            this.vramFreeGb = vramFreeGb;
            return this;
        }

        public Builder ramTotalGb(double ramTotalGb) {
            this.ramTotalGb = ramTotalGb;
            return this;
        }

        public Builder ramFreeGb(double ramFreeGb) {
            this.ramFreeGb = ramFreeGb;
            return this;
        }

        public Builder bandwidthGbps(double bandwidthGbps) {
            this.bandwidthGbps = bandwidthGbps;
            return this;
        }

        public Builder latencyMs(double latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder pricePerHour(double pricePerHour) {
            this.pricePerHour = pricePerHour;
            return this;
        }

        public Builder reliability(double reliability) {
            this.reliability = reliability;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder lastTelemetryAt(Instant lastTelemetryAt) {
            this.lastTelemetryAt = lastTelemetryAt;
            return this;
        }

        public NodeSnapshot build() {
            return new NodeSnapshot(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeSnapshot node))
            return false;
        return id == node.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "NodeSnapshot{id=" + id + ", name='" + name + "', region=" + region
                + ", vramFree=" + vramFreeGb + ", active=" + active + "}";
    }
}
