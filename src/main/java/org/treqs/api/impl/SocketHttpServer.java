package org.treqs.api.impl;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.IHttpServer;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Blocking HTTP/1.1 server: one thread per connection, one request per connection.
 * <p>
 * Every request is handed to a single {@link IHttpHandler}; the response is buffered and
 * written once the handler returns. Handler failures become a 500 with a JSON error body,
 * bodies over {@link HttpRequestReader#MAX_BODY_BYTES} a 413.
 */
public final class SocketHttpServer implements IHttpServer {
    private static final Logger LOG = LoggerFactory.getLogger(SocketHttpServer.class);
    private static final Gson GSON = new Gson();

    private final IHttpHandler handler;
    private final AtomicLong connectionSeq = new AtomicLong();
    private volatile ServerSocket serverSocket;
    private volatile boolean closed;

    public SocketHttpServer(IHttpHandler handler) {
        this.handler = handler;
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("server already started on port " + serverSocket.getLocalPort());
        }
        serverSocket = new ServerSocket(port);
        Thread acceptor = new Thread(this::acceptLoop, "treqs-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        LOG.info("Listening on port {}", serverSocket.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (!closed) {
            try {
                Socket s = ss.accept();
                Thread t = new Thread(() -> handle(s), "treqs-conn-" + connectionSeq.incrementAndGet());
                t.setDaemon(true);
                t.start();
            } catch (IOException e) {
                if (closed) break;
                LOG.warn("Accept failed: {}", e.getMessage());
            }
        }
    }

    /** Processes a single connection end-to-end (read, dispatch, respond). */
    private void handle(Socket s) {
        try (s; InputStream rawIn = s.getInputStream();
             BufferedInputStream in = new BufferedInputStream(rawIn);
             OutputStream out = s.getOutputStream()) {

            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in, out);
            } catch (RequestTooLargeException e) {
                LOG.warn("Rejected request with a {} byte body", e.declared());
                HttpResponseImpl tooLarge = new HttpResponseImpl();
                tooLarge.status(413, "Payload Too Large");
                tooLarge.header("Content-Type", "text/plain; charset=utf-8");
                tooLarge.body(e.getMessage());
                HttpResponseWriter.write(out, tooLarge);
                return;
            }
            HttpResponseImpl res = new HttpResponseImpl();
            if (req == null) {
                res.status(400, "Bad Request");
                res.header("Content-Type", "text/plain; charset=utf-8");
                res.body("empty request line");
                HttpResponseWriter.write(out, res);
                return;
            }

            try {
                handler.handle(req, res);
            } catch (Exception e) {
                LOG.error("Handler failed for {} {}", req.method(), req.path(), e);
                res = errorResponse(e);
            }
            HttpResponseWriter.write(out, res);

        } catch (SocketException se) {
            // client went away mid-response
            LOG.debug("Socket closed by peer: {}", se.getMessage());
        } catch (IOException e) {
            LOG.warn("Connection error: {}", e.getMessage());
        }
    }

    private static HttpResponseImpl errorResponse(Exception e) {
        HttpResponseImpl res = new HttpResponseImpl();
        JsonObject body = new JsonObject();
        body.addProperty("error", String.valueOf(e.getMessage()));
        res.status(500, "Internal Server Error");
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body(GSON.toJson(body));
        return res;
    }

    @Override
    public void close() throws IOException {
        closed = true;
        ServerSocket ss = serverSocket;
        if (ss != null) {
            ss.close();
            LOG.info("Stopped listening on port {}", ss.getLocalPort());
        }
    }
}
