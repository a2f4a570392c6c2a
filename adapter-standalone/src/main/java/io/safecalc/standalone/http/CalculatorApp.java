package io.safecalc.standalone.http;

import io.javalin.Javalin;
import io.javalin.http.HttpResponseException;
import io.safecalc.core.engine.CalculatorEngine;
import io.safecalc.standalone.adapter.ResultFormatter;
import io.safecalc.standalone.adapter.StandaloneAdapter;
import io.safecalc.standalone.config.ConfigLoader;
import io.safecalc.standalone.config.ServiceConfig;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the calculator service.
 *
 * <p>
 * Startup:
 * <ol>
 * <li>Load configuration from YAML + environment</li>
 * <li>Configure Logback</li>
 * <li>Build the engine with the configured limits</li>
 * <li>Register routes and start Javalin</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.safecalc.standalone.StandaloneMain} so tests can
 * start and stop the service without going through {@code main()}.
 */
public final class CalculatorApp {

    private static final Logger LOG = LoggerFactory.getLogger(CalculatorApp.class);

    private final Javalin app;
    private final CalculatorEngine engine;
    private final ServiceConfig config;

    private CalculatorApp(Javalin app, CalculatorEngine engine, ServiceConfig config) {
        this.app = app;
        this.engine = engine;
        this.config = config;
    }

    /**
     * Runs the startup sequence against the process environment.
     *
     * @param args command-line arguments, e.g. {@code --config safecalc.yaml}
     * @return the running service
     */
    public static CalculatorApp start(String[] args) {
        return start(args, System::getenv);
    }

    /**
     * Runs the startup sequence with the given environment lookup.
     *
     * @param args      command-line arguments
     * @param envLookup environment lookup used for configuration overrides
     * @return the running service
     * @throws io.safecalc.standalone.config.ConfigLoadException if configuration
     *                                                           is invalid
     */
    public static CalculatorApp start(String[] args, Function<String, String> envLookup) {
        long startTime = System.nanoTime();

        ServiceConfig config = ConfigLoader.load(args, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        CalculatorEngine engine = new CalculatorEngine(config.enginePolicy());
        CalculatorApp started = start(config, engine);

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "safecalc started: port={}, evaluatePath={}, health={}, caretAsPower={}, maxPowBase={}, "
                        + "maxPowExponent={}, maxDepth={}, maxInputLength={}, startupMs={}",
                started.port(),
                config.evaluatePath(),
                config.healthEnabled() ? config.healthPath() : "disabled",
                config.caretAsPower(),
                config.maxPowBase(),
                config.maxPowExponent(),
                config.maxDepth(),
                config.maxInputLength(),
                elapsedMs);
        return started;
    }

    /**
     * Starts Javalin for an already-built configuration and engine. Does not
     * touch logging setup.
     */
    public static CalculatorApp start(ServiceConfig config, CalculatorEngine engine) {
        StandaloneAdapter adapter =
                new StandaloneAdapter(
                        config.caretAsPower(), config.maxInputLength(), new ResultFormatter(config.displayPrecision()));
        EvaluateHandler evaluateHandler = new EvaluateHandler(engine, adapter, config.maxBodyBytes());

        Javalin app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.maxRequestSize = config.maxBodyBytes();
        });

        if (config.healthEnabled()) {
            app.get(config.healthPath(), new HealthHandler());
        }
        app.get(config.evaluatePath(), evaluateHandler);
        app.post(config.evaluatePath(), evaluateHandler);

        app.exception(HttpResponseException.class, (e, ctx) -> {
            int status = e.getStatus();
            if (status == 404) {
                EvaluateHandler.writeProblem(
                        ctx, ProblemDetail.notFound("No route for " + ctx.method() + " " + ctx.path(), ctx.path()));
            } else if (status == 413) {
                EvaluateHandler.writeProblem(ctx, ProblemDetail.bodyTooLarge(e.getMessage(), ctx.path()));
            } else {
                EvaluateHandler.writeProblem(ctx, ProblemDetail.httpError(status, e.getMessage(), ctx.path()));
            }
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOG.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            EvaluateHandler.writeProblem(ctx, ProblemDetail.internalError("Internal server error", ctx.path()));
        });

        app.start(config.host(), config.port());
        return new CalculatorApp(app, engine, config);
    }

    /** Port the server is listening on. */
    public int port() {
        return app.port();
    }

    public Javalin javalin() {
        return app;
    }

    public CalculatorEngine engine() {
        return engine;
    }

    public ServiceConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("safecalc stopped");
    }
}
