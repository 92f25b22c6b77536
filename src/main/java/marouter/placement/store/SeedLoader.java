package marouter.placement.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import marouter.placement.model.ModelProfile;
import marouter.placement.model.NodeCategory;
import marouter.placement.model.NodeSnapshot;
import marouter.placement.repository.ModelProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Loads nodes and model profiles from a JSON file into the database.
 *
 * <pre>
 * {
 *   "nodes": [ { "id": 1, "name": "gpu-a", "category": "datacenter", ... } ],
 *   "modelProfiles": [ { "name": "llama-70b", "suggestedMinVramGb": 40, "category": "llm" } ]
 * }
 * </pre>
 *
 * A path starting with {@code classpath:} is read from the classpath.
 */
public class SeedLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper mapper;
    private final JdbcNodeDirectory nodeDirectory;
    private final ModelProfileRepository modelProfiles;

    public SeedLoader(ObjectMapper mapper, JdbcNodeDirectory nodeDirectory, ModelProfileRepository modelProfiles) {
        this.mapper = mapper;
        this.nodeDirectory = nodeDirectory;
        this.modelProfiles = modelProfiles;
    }

    /**
     * @return number of nodes loaded
     */
    public int load(String location) throws IOException {
        SeedFile seed;
        try (InputStream in = open(location)) {
            seed = mapper.readValue(in, SeedFile.class);
        }

        int nodes = 0;
        if (seed.nodes() != null) {
            for (NodeSeed node : seed.nodes()) {
                nodeDirectory.save(node.toSnapshot());
                nodes++;
            }
        }
        int profiles = 0;
        if (seed.modelProfiles() != null) {
            for (ProfileSeed profile : seed.modelProfiles()) {
                modelProfiles.save(profile.toProfile());
                profiles++;
            }
        }

        log.info("Seeded {} nodes and {} model profiles from {}", nodes, profiles, location);
        return nodes;
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream in = SeedLoader.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Seed resource not found: " + resource);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedFile(
            @JsonProperty("nodes") List<NodeSeed> nodes,
            @JsonProperty("modelProfiles") List<ProfileSeed> modelProfiles) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NodeSeed(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("category") String category,
            @JsonProperty("region") String region,
            @JsonProperty("latitude") Double latitude,
            @JsonProperty("longitude") Double longitude,
            @JsonProperty("vramTotalGb") double vramTotalGb,
            @JsonProperty("vramFreeGb") double vramFreeGb,
            @JsonProperty("ramTotalGb") double ramTotalGb,
            @JsonProperty("ramFreeGb") double ramFreeGb,
            @JsonProperty("bandwidthGbps") double bandwidthGbps,
            @JsonProperty("latencyMs") double latencyMs,
            @JsonProperty("pricePerHour") double pricePerHour,
            @JsonProperty("reliability") Double reliability,
            @JsonProperty("active") Boolean active,
            @JsonProperty("lastTelemetryAt") Instant lastTelemetryAt) {

        NodeSnapshot toSnapshot() {
            NodeSnapshot.Builder builder = NodeSnapshot.builder()
                    .id(id)
                    .name(name)
                    .category(category != null ? NodeCategory.fromString(category) : NodeCategory.DATACENTER)
                    .region(region)
                    .vramTotalGb(vramTotalGb)
                    .vramFreeGb(vramFreeGb)
                    .ramTotalGb(ramTotalGb)
                    .ramFreeGb(ramFreeGb)
                    .bandwidthGbps(bandwidthGbps)
                    .latencyMs(latencyMs)
                    .pricePerHour(pricePerHour)
                    .active(active == null || active)
                    .lastTelemetryAt(lastTelemetryAt);
            if (latitude != null && longitude != null) {
                builder.location(latitude, longitude);
            }
            if (reliability != null) {
                builder.reliability(reliability);
            }
            return builder.build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProfileSeed(
            @JsonProperty("name") String name,
            @JsonProperty("suggestedMinVramGb") double suggestedMinVramGb,
            @JsonProperty("category") String category) {

        ModelProfile toProfile() {
            ModelProfile.Category c = category != null
                    ? ModelProfile.Category.valueOf(category.toUpperCase(Locale.ROOT))
                    : ModelProfile.Category.OTHER;
            return new ModelProfile(name, suggestedMinVramGb, c);
        }
    }
}
