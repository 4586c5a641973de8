package org.treqs.domain.interfaces;

import org.treqs.domain.CaptureException;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Process-wide execution recorder. At most one capture may be active at any instant.
 */
public interface ITraceCapture {

    /**
     * Starts recording. Recorded bytes are written to {@code sink} no later than
     * {@link CaptureHandle#stop()} returns.
     *
     * @throws CaptureException if recording cannot be enabled, including when another
     *         capture is already active
     */
    CaptureHandle start(OutputStream sink) throws CaptureException;

    interface CaptureHandle {
        /** Stops recording and flushes everything captured into the sink. */
        void stop() throws IOException;
    }
}
