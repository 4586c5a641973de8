package org.treqs.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treqs.api.impl.SocketHttpServer;
import org.treqs.api.impl.handlers.HandlerFactory;
import org.treqs.api.impl.handlers.PiResultCache;
import org.treqs.api.interfaces.IHttpServer;
import org.treqs.config.TreqsConfig;
import org.treqs.domain.RequestClassifier;
import org.treqs.domain.TraceCoordinator;
import org.treqs.domain.TracingMiddleware;
import org.treqs.infrastructure.impl.InMemorySessionStore;
import org.treqs.infrastructure.impl.JfrTraceCapture;
import org.treqs.infrastructure.impl.SecureRandomSessionIds;
import org.treqs.infrastructure.util.ConfigLoader;

import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sample application behind the tracing middleware, plus a periodic cache compaction that
 * runs through {@link TraceCoordinator#exclude(Runnable)} so it never shows up in a trace.
 * <p>
 * Usage: {@code java org.treqs.app.TreqsServer [config.json]}
 */
public final class TreqsServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TreqsServer.class);

    private final TreqsConfig config;
    private final PiResultCache cache;
    private final TraceCoordinator coordinator;
    private final IHttpServer server;
    private final ScheduledExecutorService compactor;

    public TreqsServer(TreqsConfig config) {
        this(config, new PiResultCache(config.cacheLimit()));
    }

    TreqsServer(TreqsConfig config, PiResultCache cache) {
        this.config = config.validate();
        this.cache = cache;
        this.coordinator = new TraceCoordinator(
                new HandlerFactory(cache).asHandler(),
                new JfrTraceCapture(config.captureSettings()),
                new SecureRandomSessionIds(),
                new InMemorySessionStore());
        this.server = new SocketHttpServer(
                new TracingMiddleware(new RequestClassifier(config.key()), coordinator));
        this.compactor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "treqs-compactor");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() throws Exception {
        server.start(config.port());
        long every = config.compactIntervalSeconds();
        compactor.scheduleAtFixedRate(this::compactCache, every, every, TimeUnit.SECONDS);
    }

    /** Never throws: an exception escaping a scheduled run would cancel every later run. */
    void compactCache() {
        try {
            coordinator.exclude(() -> {
                int removed = cache.compact();
                if (removed > 0) {
                    LOG.info("Compacted pi cache, dropped {} entries", removed);
                }
            });
        } catch (RuntimeException e) {
            LOG.warn("Pi cache compaction failed, retrying next interval", e);
        }
    }

    public int port() {
        return server.port();
    }

    public TraceCoordinator coordinator() {
        return coordinator;
    }

    @Override
    public void close() throws Exception {
        compactor.shutdownNow();
        server.close();
    }

    public static void main(String[] args) throws Exception {
        String path = args.length > 0 ? args[0] : System.getProperty("treqs.config", "treqs.json");
        TreqsConfig config = ConfigLoader.applyOverrides(
                ConfigLoader.loadOrDefault(Paths.get(path)), System.getProperties());

        TreqsServer app = new TreqsServer(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                app.close();
            } catch (Exception e) {
                LOG.warn("Shutdown failed: {}", e.getMessage());
            } finally {
                stopped.countDown();
            }
        }, "treqs-shutdown"));

        app.start();
        LOG.info("treqs ready on port {} (capture settings '{}')", app.port(), config.captureSettings());
        stopped.await();
    }
}
