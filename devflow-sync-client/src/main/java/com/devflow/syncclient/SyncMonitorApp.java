package com.devflow.syncclient;

import com.devflow.syncclient.connection.Subscription;
import com.devflow.syncclient.event.SyncEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

/**
 * Command-line monitor: connects to a sync server, subscribes to the given
 * topics and logs every event until interrupted.
 *
 * Usage: {@code SyncMonitorApp [--config file.yaml] topic[:key=value,...]...}
 *
 * Without {@code --config} the settings come from {@code devflow.sync.*}
 * system properties or {@code DEVFLOW_SYNC_*} environment variables.
 */
public class SyncMonitorApp {
    private static final Logger LOG = LoggerFactory.getLogger(SyncMonitorApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        MonitorArgs parsed;
        try {
            parsed = MonitorArgs.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: SyncMonitorApp [--config file.yaml] topic[:key=value,...]...");
            System.exit(2);
            return;
        }

        try {
            SyncClientConfig config = parsed.configFile() != null
                ? SyncClientConfig.fromYaml(parsed.configFile())
                : SyncClientConfig.load();
            LOG.info("Starting sync monitor with {}", config);

            SyncSession session = SyncSession.create(config);
            logAllEvents(session);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down sync monitor...");
                session.close();
                shutdownLatch.countDown();
            }));

            session.connect().join();
            for (Subscription subscription : parsed.subscriptions()) {
                session.connection().subscribe(subscription).whenComplete((v, error) -> {
                    if (error != null) {
                        LOG.error("Subscription to {} failed: {}", subscription.topic(), error.getMessage());
                    } else {
                        LOG.info("Subscribed to {} {}", subscription.topic(), subscription.filters());
                    }
                });
            }

            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.error("Sync monitor failed", e);
            System.exit(1);
        }
    }

    private static void logAllEvents(SyncSession session) {
        Consumer<SyncEvent> logger = event -> LOG.info("EVENT {} | {}", event.name(), event);
        for (Class<?> type : SyncEvent.class.getPermittedSubclasses()) {
            session.events().on(type.asSubclass(SyncEvent.class), logger);
        }
    }

    /**
     * Parsed command line.
     *
     * @param configFile YAML configuration, or null to use properties and environment
     */
    record MonitorArgs(Path configFile, List<Subscription> subscriptions) {

        static MonitorArgs parse(String[] args) {
            Path configFile = null;
            List<Subscription> subscriptions = new ArrayList<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--config".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file");
                    }
                    configFile = Path.of(args[++i]);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else {
                    subscriptions.add(parseSubscription(arg));
                }
            }
            return new MonitorArgs(configFile, List.copyOf(subscriptions));
        }

        // tasks:teamId=t1,status=open
        static Subscription parseSubscription(String arg) {
            int colon = arg.indexOf(':');
            String topic = colon < 0 ? arg : arg.substring(0, colon);
            if (topic.isBlank()) {
                throw new IllegalArgumentException("Missing topic in: " + arg);
            }
            Map<String, Object> filters = new LinkedHashMap<>();
            if (colon >= 0 && colon < arg.length() - 1) {
                for (String pair : arg.substring(colon + 1).split(",")) {
                    int eq = pair.indexOf('=');
                    if (eq <= 0) {
                        throw new IllegalArgumentException("Filter must be key=value: " + pair);
                    }
                    filters.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
                }
            }
            return Subscription.of(topic, filters);
        }
    }
}
