package marouter;

import marouter.placement.config.PlacementConfig;
import marouter.placement.server.PlacementNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point. Starts the placement server with environment
 * configuration and runs until the JVM is asked to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        PlacementConfig config = PlacementConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting placement server on port {}...", port);
        if (!PlacementNettyServer.start(port, config)) {
            log.error("Placement server did not start");
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping server...");
            PlacementNettyServer.stop();
            shutdown.countDown();
        }, "marouter-shutdown"));

        shutdown.await();
    }
}
