package org.treqs.app;

import org.treqs.client.RawResponse;
import org.treqs.client.TraceClient;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;

/**
 * Traces one request against a running server and writes the capture to stdout.
 * <p>
 * Example: {@code java org.treqs.app.TreqsClient --url=http://localhost:8080/pi --key=treqs > pi.jfr}
 */
public final class TreqsClient {

    private TreqsClient() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** @return process exit status */
    static int run(String[] args, OutputStream out, PrintStream err) {
        String url = null, key = "treqs", method = "GET";
        for (String a : args) {
            if (a.startsWith("--url=")) url = a.substring("--url=".length());
            else if (a.startsWith("--key=")) key = a.substring("--key=".length());
            else if (a.startsWith("--method=")) method = a.substring("--method=".length());
            else {
                err.println("unknown argument: " + a);
                usage(err);
                return 1;
            }
        }
        if (url == null || url.isEmpty()) {
            err.println("missing --url argument");
            usage(err);
            return 1;
        }

        try {
            TraceClient client = new TraceClient(url, key);
            String id = client.traceId(method);
            RawResponse res = client.read(method, id);
            if (res.status() != 200) {
                err.println("read failed: " + res.status() + " " + res.reason());
                return 1;
            }
            out.write(res.body());
            out.flush();
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    private static void usage(PrintStream err) {
        err.println("Usage: TreqsClient --url=<http://host:port/path> [--key=<key>] [--method=<GET>]");
    }
}
