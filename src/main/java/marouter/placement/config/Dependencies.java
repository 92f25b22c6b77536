package marouter.placement.config;

import marouter.placement.api.v1.HealthController;
import marouter.placement.api.v1.PlacementController;
import marouter.placement.api.v1.QuoteController;
import marouter.placement.engine.PlacementEngine;
import marouter.placement.engine.ScoringPolicies;
import marouter.placement.engine.ScoringPolicy;
import marouter.placement.repository.DecisionStore;
import marouter.placement.repository.ModelProfileRepository;
import marouter.placement.server.RouterHandler;
import marouter.placement.service.PlacementService;
import marouter.placement.service.QuoteService;
import marouter.placement.store.Database;
import marouter.placement.store.JdbcDecisionStore;
import marouter.placement.store.JdbcModelProfileRepository;
import marouter.placement.store.JdbcNodeDirectory;
import marouter.placement.store.SeedLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(PlacementConfig.fromEnv());
 * Decision d = deps.quoteService().quote(request);
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final PlacementConfig config;
    private final Database database;
    private final JdbcNodeDirectory nodeDirectory;
    private final DecisionStore decisionStore;
    private final ModelProfileRepository modelProfileRepository;
    private final PlacementEngine engine;
    private final PlacementService placementService;
    private final QuoteService quoteService;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(PlacementConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Fail on a bad policy name before opening the pool
        ScoringPolicy policy = ScoringPolicies.create(
                config.scoringPolicy(), config.headroomWeights(), config.marketplaceWeights());

        // Infrastructure
        this.database = new Database(config);

        // Collaborators
        this.nodeDirectory = new JdbcNodeDirectory(database);
        this.decisionStore = new JdbcDecisionStore(database);
        this.modelProfileRepository = new JdbcModelProfileRepository(database);

        // Engine
        this.engine = new PlacementEngine(policy);

        // Services
        this.placementService = new PlacementService(nodeDirectory, decisionStore, modelProfileRepository, engine);
        this.quoteService = new QuoteService(nodeDirectory, engine);

        log.info("Dependencies initialized with {} scoring policy", policy.name());
    }

    public static Dependencies create(PlacementConfig config) {
        return new Dependencies(config);
    }

    public static Dependencies create() {
        return create(PlacementConfig.fromEnv());
    }

    // Getters
    public PlacementConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JdbcNodeDirectory nodeDirectory() {
        return nodeDirectory;
    }

    public DecisionStore decisionStore() {
        return decisionStore;
    }

    public ModelProfileRepository modelProfileRepository() {
        return modelProfileRepository;
    }

    public PlacementEngine engine() {
        return engine;
    }

    public PlacementService placementService() {
        return placementService;
    }

    public QuoteService quoteService() {
        return quoteService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, nodeDirectory, decisionStore,
                            engine.policy().name()))
                    .registerController(new PlacementController(placementService))
                    .registerController(new QuoteController(quoteService));
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    /**
     * Load the seed file named in the config, if any.
     */
    public void seedIfConfigured() {
        String path = config.seedNodesPath();
        if (path == null || path.isBlank()) {
            return;
        }
        try {
            new SeedLoader(RouterHandler.mapper(), nodeDirectory, modelProfileRepository).load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load seed file " + path, e);
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
