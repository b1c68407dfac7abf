package agora.market;

import agora.market.config.Dependencies;
import agora.market.config.MarketConfig;
import agora.market.server.MarketNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Coordinator entry point.
 *
 * Wires the services, starts the HTTP server and the background scheduler,
 * and shuts both down on JVM exit.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        MarketConfig config = MarketConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        MarketNettyServer server = new MarketNettyServer(deps.routerHandler());

        log.info("Starting marketplace coordinator on port {}...", config.serverPort());
        if (!server.start(config.serverHost(), config.serverPort())) {
            log.error("Server did not start, exiting");
            deps.close();
            System.exit(1);
        }
        deps.startScheduler();

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            deps.close();
            shutdown.countDown();
        }, "agora-shutdown"));

        shutdown.await();
    }
}
