package gpuhub;

import gpuhub.coordinator.config.CoordinatorConfig;
import gpuhub.coordinator.config.Dependencies;
import gpuhub.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Starts the HTTP server, then the background scheduler. On JVM shutdown the
 * server stops accepting requests and running jobs are drained before the
 * database closes.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorNettyServer server = new CoordinatorNettyServer(deps.routerHandler());

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (IllegalStateException e) {
            log.error("Failed to start coordinator", e);
            deps.close();
            System.exit(1);
            return;
        }
        deps.startScheduler();
        log.info("Coordinator started on port {}", server.port());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down coordinator...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "gpuhub-shutdown"));

        stopped.await();
    }
}
