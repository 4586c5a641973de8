package org.treqs.domain;

import org.junit.jupiter.api.Test;
import org.treqs.api.impl.HttpResponseImpl;
import org.treqs.api.impl.MinimalHttpRequest;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.infrastructure.impl.InMemorySessionStore;
import org.treqs.infrastructure.impl.SecureRandomSessionIds;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TraceCoordinatorTest {

    private final FakeTraceCapture capture = new FakeTraceCapture();
    private final AtomicInteger downstreamCalls = new AtomicInteger();

    private final IHttpHandler hello = (req, res) -> {
        downstreamCalls.incrementAndGet();
        res.status(200, "OK");
        res.body("hello");
    };

    private TraceCoordinator coordinator(IHttpHandler downstream) {
        return new TraceCoordinator(downstream, capture, new SecureRandomSessionIds(), new InMemorySessionStore());
    }

    private static MinimalHttpRequest get(String path) {
        return MinimalHttpRequest.of("GET", path);
    }

    @Test
    void passThroughForwardsToDownstream() throws Exception {
        TraceCoordinator c = coordinator(hello);
        HttpResponseImpl res = new HttpResponseImpl();
        c.passThrough(get("/"), res);

        assertEquals(200, res.status());
        assertEquals("hello", new String(res.body(), StandardCharsets.UTF_8));
        assertEquals(0, capture.starts.get());
        assertEquals(0, c.sessionCount());
    }

    @Test
    void traceStoresCaptureAndReturnsId() throws Exception {
        TraceCoordinator c = coordinator(hello);
        HttpResponseImpl res = new HttpResponseImpl();
        c.trace(get("/"), res);

        String id = res.header(TreqsHeaders.ID);
        assertNotNull(id);
        assertTrue(id.matches("[0-9a-f]{64}"), id);
        assertEquals("hello", new String(res.body(), StandardCharsets.UTF_8));
        assertEquals(0, capture.active.get(), "capture must be stopped");
        assertEquals(1, c.sessionCount());

        HttpResponseImpl read = new HttpResponseImpl();
        c.read(id, read);
        assertEquals(200, read.status());
        assertEquals("application/octet-stream", read.header("Content-Type"));
        assertEquals("capture-1", new String(read.body(), StandardCharsets.UTF_8));
    }

    @Test
    void readUnknownOrEmptyIdIsNotFound() {
        TraceCoordinator c = coordinator(hello);
        for (String id : new String[]{"bogus", "", null}) {
            HttpResponseImpl res = new HttpResponseImpl();
            c.read(id, res);
            assertEquals(404, res.status());
        }
    }

    @Test
    void resetDropsEverySession() throws Exception {
        TraceCoordinator c = coordinator(hello);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            HttpResponseImpl res = new HttpResponseImpl();
            c.trace(get("/"), res);
            ids.add(res.header(TreqsHeaders.ID));
        }
        assertEquals(3, c.sessionCount());

        HttpResponseImpl reset = new HttpResponseImpl();
        c.reset(reset);
        assertEquals(200, reset.status());
        assertEquals(0, c.sessionCount());

        for (String id : ids) {
            HttpResponseImpl res = new HttpResponseImpl();
            c.read(id, res);
            assertEquals(404, res.status());
        }
    }

    @Test
    void captureStartFailureAnswers500WithoutCallingDownstream() throws Exception {
        capture.failWith = "tracing is already enabled";
        TraceCoordinator c = coordinator(hello);
        HttpResponseImpl res = new HttpResponseImpl();
        c.trace(get("/"), res);

        assertEquals(500, res.status());
        assertEquals("text/plain; charset=utf-8", res.header("Content-Type"));
        assertEquals("Could not enable tracing: tracing is already enabled\n",
                new String(res.body(), StandardCharsets.UTF_8));
        assertNull(res.header(TreqsHeaders.ID));
        assertEquals(0, downstreamCalls.get());
        assertEquals(0, c.sessionCount());
    }

    @Test
    void idSourceFailureAbortsBeforeCapture() {
        TraceCoordinator c = new TraceCoordinator(hello, capture,
                () -> { throw new SessionIdException("entropy exhausted", null); },
                new InMemorySessionStore());

        assertThrows(SessionIdException.class, () -> c.trace(get("/"), new HttpResponseImpl()));
        assertEquals(0, capture.starts.get());
        assertEquals(0, downstreamCalls.get());
        assertEquals(0, c.sessionCount());
        assertFalse(c.isExclusiveHeld());
    }

    @Test
    void downstreamFailureStopsCaptureAndStoresNothing() throws Exception {
        TraceCoordinator c = coordinator((req, res) -> { throw new IllegalStateException("boom"); });
        HttpResponseImpl res = new HttpResponseImpl();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> c.trace(get("/"), res));
        assertEquals("boom", e.getMessage());
        assertEquals(0, capture.active.get());
        assertEquals(0, c.sessionCount());
        assertNull(res.header(TreqsHeaders.ID));
        assertFalse(c.isExclusiveHeld());
    }

    @Test
    void passThroughWaitsForTraceInProgress() throws Exception {
        CountDownLatch traceEntered = new CountDownLatch(1);
        CountDownLatch releaseTrace = new CountDownLatch(1);
        TraceCoordinator c = coordinator((req, res) -> {
            if (req.path().equals("/slow")) {
                traceEntered.countDown();
                assertTrue(releaseTrace.await(5, TimeUnit.SECONDS));
            }
            res.body(req.path());
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> trace = pool.submit(() -> { c.trace(get("/slow"), new HttpResponseImpl()); return null; });
            assertTrue(traceEntered.await(5, TimeUnit.SECONDS));

            CompletableFuture<Void> pass = CompletableFuture.runAsync(() -> {
                try {
                    c.passThrough(get("/fast"), new HttpResponseImpl());
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }, pool);

            Thread.sleep(200);
            assertFalse(pass.isDone(), "pass-through ran during a trace");

            releaseTrace.countDown();
            trace.get(5, TimeUnit.SECONDS);
            pass.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentPassThroughsDoNotBlockEachOther() throws Exception {
        // both requests must be inside the handler at the same time to pass the barrier
        CyclicBarrier together = new CyclicBarrier(2);
        TraceCoordinator c = coordinator((req, res) -> {
            together.await(5, TimeUnit.SECONDS);
            res.body("slow");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> a = pool.submit(() -> { c.passThrough(get("/a"), new HttpResponseImpl()); return null; });
            Future<?> b = pool.submit(() -> { c.passThrough(get("/b"), new HttpResponseImpl()); return null; });
            a.get(10, TimeUnit.SECONDS);
            b.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void readsRunAlongsidePassThrough() throws Exception {
        CountDownLatch inHandler = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TraceCoordinator c = coordinator((req, res) -> {
            inHandler.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
        });

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> pass = pool.submit(() -> { c.passThrough(get("/"), new HttpResponseImpl()); return null; });
            assertTrue(inHandler.await(5, TimeUnit.SECONDS));

            HttpResponseImpl res = new HttpResponseImpl();
            c.read("missing", res);
            assertEquals(404, res.status());

            release.countDown();
            pass.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void tracesAndResetsNeverOverlap() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        TraceCoordinator c = coordinator((req, res) -> {
            int now = inside.incrementAndGet();
            maxInside.accumulateAndGet(now, Math::max);
            Thread.sleep(5);
            inside.decrementAndGet();
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> all = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                final int n = i;
                all.add(pool.submit(() -> {
                    if (n % 5 == 0) {
                        c.reset(new HttpResponseImpl());
                    } else if (n % 2 == 0) {
                        c.trace(get("/t"), new HttpResponseImpl());
                    } else {
                        c.passThrough(get("/p"), new HttpResponseImpl());
                    }
                    return null;
                }));
            }
            for (Future<?> f : all) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, capture.maxActive.get(), "two captures were active at once");
        assertEquals(0, capture.active.get());
    }

    @Test
    void excludedWorkPausesDuringTrace() throws Exception {
        CountDownLatch traceEntered = new CountDownLatch(1);
        CountDownLatch releaseTrace = new CountDownLatch(1);
        TraceCoordinator c = coordinator((req, res) -> {
            traceEntered.countDown();
            assertTrue(releaseTrace.await(5, TimeUnit.SECONDS));
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> trace = pool.submit(() -> { c.trace(get("/"), new HttpResponseImpl()); return null; });
            assertTrue(traceEntered.await(5, TimeUnit.SECONDS));

            AtomicInteger ran = new AtomicInteger();
            Future<?> background = pool.submit(() -> c.exclude(() -> { ran.incrementAndGet(); }));

            Thread.sleep(200);
            assertEquals(0, ran.get(), "background work ran inside a capture");

            releaseTrace.countDown();
            trace.get(5, TimeUnit.SECONDS);
            background.get(5, TimeUnit.SECONDS);
            assertEquals(1, ran.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void excludeCallReturnsValueUnderSharedLock() throws Exception {
        TraceCoordinator c = coordinator(hello);
        assertEquals(Integer.valueOf(42), c.excludeCall(() -> {
            assertFalse(c.isExclusiveHeld());
            return 42;
        }));
    }
}
