package org.treqs.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.api.interfaces.http.HttpResponse;
import org.treqs.domain.interfaces.ISessionIdSource;
import org.treqs.domain.interfaces.ISessionStore;
import org.treqs.domain.interfaces.ITraceCapture;
import org.treqs.domain.interfaces.ITraceCapture.CaptureHandle;
import org.treqs.domain.model.TraceSession;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs the four tracing actions under one readers-writer lock.
 * <p>
 * <b>Lock tiers</b>
 * <ul>
 *   <li>Shared: pass-through, read, and {@link #exclude} work. These never block each other.</li>
 *   <li>Exclusive: trace and reset. While one runs nothing else in the tier above runs, so a
 *       capture only ever records the single traced request.</li>
 * </ul>
 * Waits are unbounded. The session store is mutated only under the exclusive lock.
 */
public final class TraceCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(TraceCoordinator.class);

    // fair: waiters are served in arrival order, a queued trace is not starved by readers
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock(true);
    private final Lock shared = rw.readLock();
    private final Lock exclusive = rw.writeLock();

    private final IHttpHandler downstream;
    private final ITraceCapture capture;
    private final ISessionIdSource ids;
    private final ISessionStore sessions;

    public TraceCoordinator(IHttpHandler downstream, ITraceCapture capture,
                            ISessionIdSource ids, ISessionStore sessions) {
        this.downstream = downstream;
        this.capture = capture;
        this.ids = ids;
        this.sessions = sessions;
    }

    /** Forwards the request to the downstream handler under the shared lock. */
    public void passThrough(HttpRequest req, HttpResponse res) throws Exception {
        shared.lock();
        try {
            downstream.handle(req, res);
        } finally {
            shared.unlock();
        }
    }

    /**
     * Captures the downstream handling of this request and stores it as a new session.
     * <p>
     * On success the response carries the new id in {@link TreqsHeaders#ID}. If capture
     * cannot start the response is a plain-text 500 and downstream is not called. If
     * downstream throws, capture is stopped, nothing is stored and the exception propagates.
     *
     * @throws SessionIdException if no secure id could be generated; nothing is started
     */
    public void trace(HttpRequest req, HttpResponse res) throws Exception {
        exclusive.lock();
        try {
            String id = ids.next();
            ByteArrayOutputStream buf = new ByteArrayOutputStream();

            CaptureHandle handle;
            try {
                handle = capture.start(buf);
            } catch (CaptureException e) {
                LOG.warn("Could not enable tracing for {} {}: {}", req.method(), req.path(), e.getMessage());
                res.status(500, "Internal Server Error");
                res.header("Content-Type", "text/plain; charset=utf-8");
                res.body("Could not enable tracing: " + e.getMessage() + "\n");
                return;
            }

            boolean handled = false;
            try {
                downstream.handle(req, res);
                handled = true;
            } finally {
                if (!handled) {
                    stopAfterFailure(handle);
                }
            }
            handle.stop();

            TraceSession session = new TraceSession(id, buf.toByteArray(), Instant.now());
            sessions.put(session);
            res.header(TreqsHeaders.ID, id);
            LOG.info("Stored trace {} ({} bytes) for {} {}", id, session.size(), req.method(), req.path());
        } finally {
            exclusive.unlock();
        }
    }

    /** Serves a stored capture, or 404 when the id is unknown or empty. */
    public void read(String id, HttpResponse res) {
        shared.lock();
        try {
            Optional<TraceSession> session = (id == null || id.isEmpty()) ? Optional.empty() : sessions.get(id);
            if (session.isEmpty()) {
                res.status(404, "Not Found");
                res.header("Content-Type", "text/plain; charset=utf-8");
                res.body("404 page not found\n");
                return;
            }
            LOG.debug("Serving trace {} captured at {}", id, session.get().createdAt());
            res.status(200, "OK");
            res.header("Content-Type", "application/octet-stream");
            res.body(session.get().data());
        } finally {
            shared.unlock();
        }
    }

    /** Drops every stored session. */
    public void reset(HttpResponse res) {
        exclusive.lock();
        try {
            int dropped = sessions.size();
            sessions.clear();
            LOG.info("Reset discarded {} trace session(s)", dropped);
            res.status(200, "OK");
        } finally {
            exclusive.unlock();
        }
    }

    /**
     * Runs work that lives outside request handling (timers, sweepers) under the shared lock,
     * so it never lands inside a capture and pauses while a trace or reset runs.
     */
    public void exclude(Runnable work) {
        shared.lock();
        try {
            work.run();
        } finally {
            shared.unlock();
        }
    }

    /** Same as {@link #exclude(Runnable)} for work that returns a value. */
    public <T> T excludeCall(Callable<T> work) throws Exception {
        shared.lock();
        try {
            return work.call();
        } finally {
            shared.unlock();
        }
    }

    public int sessionCount() {
        shared.lock();
        try {
            return sessions.size();
        } finally {
            shared.unlock();
        }
    }

    boolean isExclusiveHeld() {
        return rw.isWriteLocked();
    }

    private static void stopAfterFailure(CaptureHandle handle) {
        try {
            handle.stop();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Stopping capture after a failed request also failed", e);
        }
    }
}
