package io.groupstream;

import io.groupstream.config.impl.ApplicationInfo;
import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.config.type.ConfigLoader;
import io.groupstream.config.type.ServiceRole;
import io.groupstream.deploy.DeploymentPlatforms;
import io.groupstream.deploy.type.DeploymentPlatform;
import io.groupstream.dispatcher.DispatcherServer;
import io.groupstream.grouping.GroupingResolver;
import io.groupstream.grouping.GroupingStrategies;
import io.groupstream.grouping.type.GroupingStrategy;
import io.groupstream.log.impl.KafkaLogConsumerFactory;
import io.groupstream.metadata.KsqlClient;
import io.groupstream.registry.GroupHealthMonitor;
import io.groupstream.registry.GroupRegistry;
import io.groupstream.routing.RouterServer;
import io.groupstream.routing.RoutingController;
import io.groupstream.state.impl.KsqlStateQuery;
import io.groupstream.transport.client.HttpEndpointProbe;
import io.groupstream.transport.client.HttpJsonClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point. Runs as the router or as a single-group dispatcher depending on
 * {@code role}.
 * <pre>
 *   java -jar groupstream.jar [config.yaml] [teardown]
 * </pre>
 * Without a file, configuration comes from the environment only.
 */
@Slf4j
public class Application {
    private static final Duration KSQL_TIMEOUT = Duration.ofSeconds(10);

    public static void main(final String[] args) throws Exception {
        final ServiceConfig cfg = args.length > 0 && !args[0].equals("teardown")
                ? ConfigLoader.load(args[0])
                : ConfigLoader.fromEnvironment();
        final boolean teardown = args.length > 0 && args[args.length - 1].equals("teardown");
        final ApplicationInfo info = ApplicationInfo.fromEnvironment(System.getenv());

        log.info("Starting groupstream {} as {}", info.version(), cfg.getRole());
        if (cfg.getRole() == ServiceRole.DISPATCHER) {
            runDispatcher(cfg, info);
        } else {
            runRouter(cfg, info, teardown);
        }
    }

    private static void runDispatcher(final ServiceConfig cfg, final ApplicationInfo info) throws InterruptedException {
        final DispatcherServer server = new DispatcherServer(cfg, new KafkaLogConsumerFactory(cfg.getKafkaBroker()), info);
        final CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down dispatcher for group [{}]...", cfg.getGroupLabel());
                server.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            } finally {
                stopped.countDown();
            }
        }));

        server.start();
        stopped.await();
    }

    private static void runRouter(final ServiceConfig cfg,
                                  final ApplicationInfo info,
                                  final boolean teardown) throws InterruptedException {
        final HttpJsonClient http = new HttpJsonClient();
        final KsqlClient ksql = new KsqlClient(http, cfg.getKsqldbUrl(), KSQL_TIMEOUT);
        final GroupingStrategy strategy = GroupingStrategies.create(cfg, ksql);
        final DeploymentPlatform platform = DeploymentPlatforms.create(cfg);
        final GroupRegistry registry = new GroupRegistry(cfg.provisionTimeout().plus(cfg.probeTimeout()));
        final RoutingController controller = new RoutingController(
                new GroupingResolver(strategy, cfg.groupCacheTtl()), registry, strategy, platform,
                HttpEndpointProbe.readiness(http, cfg.probeTimeout()), cfg);

        if (teardown) {
            controller.teardown();
            controller.close();
            http.close();
            return;
        }

        final String issue = strategy.readinessIssue();
        if (issue != null) {
            log.warn("Grouping strategy '{}' not ready at startup: {}", cfg.getGroupingStrategy(), issue);
        }

        controller.initialize();
        final GroupHealthMonitor monitor = new GroupHealthMonitor(registry,
                HttpEndpointProbe.liveness(http, cfg.probeTimeout()), cfg.healthCheckInterval());
        monitor.start();

        final RouterServer server = new RouterServer(cfg, controller,
                new KsqlStateQuery(ksql, cfg.getKsqldbAssetsTable()), info);
        final CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down router...");
                server.close();
                monitor.close();
                controller.close();
                http.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            } finally {
                stopped.countDown();
            }
        }));

        server.start();
        log.info("Router started on port {} ({} mode)", server.port(), cfg.getRoutingMode());
        stopped.await();
    }
}
