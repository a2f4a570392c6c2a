package io.safecalc.standalone.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import io.safecalc.core.engine.CalculatorEngine;
import io.safecalc.core.error.CalcException;
import io.safecalc.standalone.adapter.StandaloneAdapter;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Handles {@code GET} and {@code POST} on the evaluate route.
 *
 * <ol>
 * <li>Echo or generate {@code X-Request-ID} and put it in the MDC</li>
 * <li>Reject bodies over the size limit with 413</li>
 * <li>Read the expression (400 if the request is malformed)</li>
 * <li>Evaluate; 200 with the result, or a problem body mapped from the
 * rejection</li>
 * </ol>
 *
 * <p>
 * Thread-safe: all per-request state is local to {@link #handle(Context)}.
 */
public final class EvaluateHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluateHandler.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_REQUEST_ID = "requestId";

    private final CalculatorEngine engine;
    private final StandaloneAdapter adapter;
    private final int maxBodyBytes;

    /**
     * @param engine       shared engine
     * @param adapter      request reading and response building
     * @param maxBodyBytes largest accepted request body
     */
    public EvaluateHandler(CalculatorEngine engine, StandaloneAdapter adapter, int maxBodyBytes) {
        this.engine = engine;
        this.adapter = adapter;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(Context ctx) {
        String requestId = ctx.header(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        ctx.header(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            process(ctx);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private void process(Context ctx) {
        if (ctx.method() == HandlerType.POST && exceedsBodyLimit(ctx)) {
            writeProblem(ctx, ProblemDetail.bodyTooLarge("Request body exceeds " + maxBodyBytes + " bytes", ctx.path()));
            return;
        }

        String expression;
        try {
            expression = adapter.readExpression(ctx);
        } catch (IllegalArgumentException e) {
            LOG.debug("evaluate.bad_request detail={}", e.getMessage());
            writeProblem(ctx, ProblemDetail.badRequest(e.getMessage(), ctx.path()));
            return;
        }

        try {
            double value = engine.evaluate(adapter.toEngineInput(expression));
            ctx.status(200);
            ctx.contentType("application/json");
            ctx.result(adapter.successBody(expression, value).toString());
        } catch (CalcException e) {
            LOG.debug("evaluate.rejected type={} phase={} detail={}", e.type(), e.phase(), e.detail());
            writeProblem(ctx, ProblemDetail.fromCalcException(e, ctx.path()));
        }
    }

    private boolean exceedsBodyLimit(Context ctx) {
        long contentLength = ctx.contentLength();
        if (contentLength > maxBodyBytes) {
            LOG.warn("Request body too large: {} bytes (limit {})", contentLength, maxBodyBytes);
            return true;
        }
        // chunked requests carry no Content-Length
        int actual = ctx.bodyAsBytes().length;
        if (actual > maxBodyBytes) {
            LOG.warn("Request body too large: {} bytes (limit {})", actual, maxBodyBytes);
            return true;
        }
        return false;
    }

    static void writeProblem(Context ctx, ObjectNode problem) {
        ctx.status(problem.get("status").asInt());
        ctx.contentType(ProblemDetail.CONTENT_TYPE);
        ctx.result(problem.toString());
    }
}
