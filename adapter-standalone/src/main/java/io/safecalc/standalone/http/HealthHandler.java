package io.safecalc.standalone.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;

/**
 * Liveness probe. Answers {@code 200 {"status":"UP"}} whenever the server is
 * accepting requests; it does not touch the engine.
 */
public final class HealthHandler implements Handler {

    private static final String UP = "{\"status\":\"UP\"}";

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.contentType("application/json");
        ctx.result(UP);
    }
}
