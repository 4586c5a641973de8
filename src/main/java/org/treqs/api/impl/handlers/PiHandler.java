package org.treqs.api.impl.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.treqs.api.interfaces.IHttpHandler;
import org.treqs.api.interfaces.http.HttpRequest;
import org.treqs.api.interfaces.http.HttpResponse;

import java.util.Locale;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * GET /pi?rounds=N. Nilakantha series summed on the common fork-join pool, which gives a
 * traced request some real concurrency to record.
 */
public class PiHandler implements IHttpHandler {
    static final int DEFAULT_ROUNDS = 50_000;
    static final int MAX_ROUNDS = 10_000_000;
    private static final Gson gson = new GsonBuilder().serializeNulls().create();

    private final PiResultCache cache;

    public PiHandler(PiResultCache cache) { this.cache = cache; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        int rounds = DEFAULT_ROUNDS;
        String raw = req.query("rounds");
        if (raw != null && !raw.isBlank()) {
            try {
                rounds = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                rounds = -1;
            }
            if (rounds < 1 || rounds > MAX_ROUNDS) {
                JsonObject err = new JsonObject();
                err.addProperty("error", "rounds must be between 1 and " + MAX_ROUNDS);
                res.status(400, "Bad Request");
                res.header("Content-Type", "application/json; charset=utf-8");
                res.body(gson.toJson(err));
                return;
            }
        }

        Optional<Double> hit = cache.get(rounds);
        double pi;
        if (hit.isPresent()) {
            pi = hit.get();
        } else {
            pi = approximate(rounds);
            cache.put(rounds, pi);
        }

        JsonObject out = new JsonObject();
        out.addProperty("rounds", rounds);
        out.addProperty("pi", String.format(Locale.ROOT, "%.10f", pi));
        out.addProperty("cached", hit.isPresent());
        res.status(200, "OK");
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body(gson.toJson(out));
    }

    static double approximate(int rounds) {
        return 3.0 + IntStream.rangeClosed(1, rounds)
                .parallel()
                .mapToDouble(k -> {
                    double sign = (k % 2 == 0) ? 1.0 : -1.0;
                    double kk = k;
                    return (-4.0 * sign) / (2 * kk * (2 * kk + 1) * (2 * kk + 2));
                })
                .sum();
    }
}
