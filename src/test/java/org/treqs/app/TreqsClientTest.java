package org.treqs.app;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.treqs.config.TreqsConfig;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.treqs.NetTestUtils.waitForPortOpen;

class TreqsClientTest {

    private static TreqsServer server;
    private static String url;

    @BeforeAll
    static void startServer() throws Exception {
        server = new TreqsServer(new TreqsConfig().withKey("treqs").withPort(0));
        server.start();
        waitForPortOpen("localhost", server.port(), 5000);
        url = "http://localhost:" + server.port() + "/pi?rounds=5000";
    }

    @AfterAll
    static void stopServer() throws Exception {
        if (server != null) server.close();
    }

    @Test
    void writesCaptureToStdout() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int status = TreqsClient.run(new String[]{"--url=" + url}, out, new PrintStream(err, true));

        assertEquals(0, status, err.toString(StandardCharsets.UTF_8));
        byte[] data = out.toByteArray();
        assertTrue(data.length > 4);
        assertEquals('F', data[0]);
        assertEquals('L', data[1]);
        assertEquals('R', data[2]);
    }

    @Test
    void wrongKeyFailsWithMissingIdMessage() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        int status = TreqsClient.run(new String[]{"--url=" + url, "--key=nope", "--method=GET"},
                new ByteArrayOutputStream(), new PrintStream(err, true));

        assertEquals(1, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("X-Treqs-Id header missing"));
    }

    @Test
    void missingOrUnknownArgumentsPrintUsage() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        assertEquals(1, TreqsClient.run(new String[0], new ByteArrayOutputStream(), new PrintStream(err, true)));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("missing --url"));

        assertEquals(1, TreqsClient.run(new String[]{"-x"}, new ByteArrayOutputStream(),
                new PrintStream(new ByteArrayOutputStream(), true)));
    }
}
