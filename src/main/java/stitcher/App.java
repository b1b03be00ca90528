package stitcher;

import stitcher.taskcenter.config.AppConfig;
import stitcher.taskcenter.config.Dependencies;
import stitcher.taskcenter.scheduler.AbandonedTaskReconciler;
import stitcher.taskcenter.server.TaskCenterHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Task center entry point.
 *
 * Loads config (first argument overrides the ini path), reconciles tasks left
 * over by a previous run, then serves the HTTP control surface until shutdown.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        Path ini = Path.of(args.length > 0 ? args[0] : AppConfig.DEFAULT_INI);
        AppConfig config = AppConfig.load(ini, System.getenv());

        Dependencies deps = Dependencies.create(config);
        TaskCenterHttpServer server = new TaskCenterHttpServer(config.serverHost(), config.serverPort(),
                deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.close();
            deps.close();
            stopped.countDown();
        }, "taskcenter-shutdown"));

        try {
            AbandonedTaskReconciler.Report report = deps.start();
            log.info("Startup reconciliation: {}", report);
            server.start();
        } catch (Exception e) {
            log.error("Failed to start task center", e);
            server.close();
            deps.close();
            System.exit(1);
        }

        log.info("Task center {} ready on http://{}:{}", AppConfig.VERSION, config.serverHost(), server.port());
        stopped.await();
    }
}
