package marouter.placement.config;

import marouter.placement.engine.HeadroomWeights;
import marouter.placement.engine.MarketplaceWeights;

/**
 * Configuration holder for the placement service.
 * All settings have sensible defaults.
 */
public final class PlacementConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/marouter;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Public quote API key (optional). If set, callers must send X-API-Key.
    private String apiKey = null;

    // Scoring
    private String scoringPolicy = "headroom";
    private HeadroomWeights headroomWeights = HeadroomWeights.defaults();
    private MarketplaceWeights marketplaceWeights = MarketplaceWeights.defaults();

    // Optional JSON file with nodes to load into the directory at startup
    private String seedNodesPath = null;

    private PlacementConfig() {
    }

    public static PlacementConfig defaults() {
        return new PlacementConfig();
    }

    public static PlacementConfig fromEnv() {
        PlacementConfig config = new PlacementConfig();

        // Override from environment variables
        String dbUrl = System.getenv("MAR_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("MAR_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String apiKey = System.getenv("MAR_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String policy = System.getenv("MAR_SCORING_POLICY");
        if (policy != null && !policy.isBlank()) {
            config.scoringPolicy = policy.trim();
        }

        String seed = System.getenv("MAR_SEED_NODES");
        if (seed != null && !seed.isBlank()) {
            config.seedNodesPath = seed;
        }

        HeadroomWeights w = config.headroomWeights;
        config.headroomWeights = new HeadroomWeights(
                envDouble("MAR_W_HEADROOM", w.headroom()),
                envDouble("MAR_W_BANDWIDTH", w.bandwidth()),
                envDouble("MAR_W_LATENCY", w.latency()));

        return config;
    }

    private static double envDouble(String name, double fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Double.parseDouble(value.trim());
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String scoringPolicy() {
        return scoringPolicy;
    }

    public HeadroomWeights headroomWeights() {
        return headroomWeights;
    }

    public MarketplaceWeights marketplaceWeights() {
        return marketplaceWeights;
    }

    public String seedNodesPath() {
        return seedNodesPath;
    }

    // Fluent setters for testing/customization
    public PlacementConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public PlacementConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public PlacementConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public PlacementConfig withScoringPolicy(String policy) {
        this.scoringPolicy = policy;
        return this;
    }

    public PlacementConfig withHeadroomWeights(HeadroomWeights weights) {
        this.headroomWeights = weights;
        return this;
    }

    public PlacementConfig withMarketplaceWeights(MarketplaceWeights weights) {
        this.marketplaceWeights = weights;
        return this;
    }

    public PlacementConfig withSeedNodesPath(String path) {
        this.seedNodesPath = path;
        return this;
    }

    @Override
    public String toString() {
        return "PlacementConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", scoringPolicy=" + scoringPolicy +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
