package org.treqs.infrastructure.impl;

import jdk.jfr.Configuration;
import jdk.jfr.FlightRecorder;
import jdk.jfr.Recording;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treqs.domain.CaptureException;
import org.treqs.domain.interfaces.ITraceCapture;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ITraceCapture} on top of Java Flight Recorder.
 * <p>
 * Each capture is a fresh {@link Recording} using one of the JDK's named settings
 * ({@code default} or {@code profile}). On stop the recording is dumped to a temporary
 * file, copied into the sink and released. Only one capture may be active in the process;
 * a second {@link #start} fails until the first is stopped.
 */
public final class JfrTraceCapture implements ITraceCapture {
    private static final Logger LOG = LoggerFactory.getLogger(JfrTraceCapture.class);

    private static final AtomicBoolean ACTIVE = new AtomicBoolean();
    private static final AtomicInteger RECORDING_SEQUENCE_NUMBER = new AtomicInteger();

    private final String settings;

    public JfrTraceCapture() {
        this("default");
    }

    /** @param settings name of a JFR configuration shipped with the JDK */
    public JfrTraceCapture(String settings) {
        this.settings = settings;
    }

    @Override
    public CaptureHandle start(OutputStream sink) throws CaptureException {
        if (!FlightRecorder.isAvailable()) {
            throw new CaptureException("flight recorder is not available in this JVM");
        }
        if (!ACTIVE.compareAndSet(false, true)) {
            throw new CaptureException("tracing is already enabled");
        }

        Recording recording = null;
        try {
            recording = new Recording(Configuration.getConfiguration(settings));
            recording.setName("treqs-" + RECORDING_SEQUENCE_NUMBER.incrementAndGet());
            recording.start();
        } catch (IOException | ParseException | RuntimeException e) {
            if (recording != null) {
                recording.close();
            }
            ACTIVE.set(false);
            throw new CaptureException("failed to start recording with settings '" + settings + "': "
                    + e.getMessage(), e);
        }
        LOG.debug("Started recording {}", recording.getName());
        return new JfrHandle(recording, sink);
    }

    private static final class JfrHandle implements CaptureHandle {
        private final Recording recording;
        private final OutputStream sink;
        private boolean stopped;

        JfrHandle(Recording recording, OutputStream sink) {
            this.recording = recording;
            this.sink = sink;
        }

        @Override
        public synchronized void stop() throws IOException {
            if (stopped) {
                return;
            }
            stopped = true;
            try {
                recording.stop();
                Path tmp = Files.createTempFile("treqs-recording-", ".jfr");
                try {
                    recording.dump(tmp);
                    Files.copy(tmp, sink);
                    sink.flush();
                } finally {
                    Files.deleteIfExists(tmp);
                }
                LOG.debug("Stopped recording {}", recording.getName());
            } finally {
                recording.close();
                ACTIVE.set(false);
            }
        }
    }
}
