package org.treqs.api.interfaces;

/*
AutoCloseable so tests and main can stop the listener with try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    /** Binds and starts accepting. Port 0 picks a free port, see {@link #port()}. */
    void start(int port) throws Exception;

    /** Bound port, or -1 before {@link #start}. */
    int port();

    @Override void close() throws Exception;
}
