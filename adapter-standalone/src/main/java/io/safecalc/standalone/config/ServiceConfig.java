package io.safecalc.standalone.config;

import io.safecalc.core.engine.EvalPolicy;

/**
 * Settings for the standalone calculator service.
 *
 * <p>
 * Every field has a default; use {@link #builder()} to construct instances.
 *
 * @param host             bind address for the HTTP server
 * @param port             listen port, {@code 0} for an ephemeral port
 * @param maxBodyBytes     largest accepted request body
 * @param evaluatePath     route of the evaluate endpoint (GET and POST)
 * @param healthEnabled    whether the liveness endpoint is registered
 * @param healthPath       route of the liveness endpoint
 * @param loggingFormat    {@code json} or {@code text}
 * @param loggingLevel     root log level
 * @param caretAsPower     rewrite {@code ^} to {@code **} before evaluation
 * @param displayPrecision decimal places in the {@code display} field
 * @param maxPowBase       largest {@code abs(base)} for {@code **}
 * @param maxPowExponent   largest {@code abs(exponent)} for {@code **}
 * @param maxDepth         nesting depth limit
 * @param maxInputLength   expression length limit in code points
 */
public record ServiceConfig(
        String host,
        int port,
        int maxBodyBytes,
        String evaluatePath,
        boolean healthEnabled,
        String healthPath,
        String loggingFormat,
        String loggingLevel,
        boolean caretAsPower,
        int displayPrecision,
        double maxPowBase,
        double maxPowExponent,
        int maxDepth,
        int maxInputLength) {

    /** Creates a new builder holding the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** The evaluation limits as the engine expects them. */
    public EvalPolicy evalPolicy() {
        return new EvalPolicy(maxPowBase, maxPowExponent, maxDepth, maxInputLength);
    }

    /**
     * Policy for the engine behind the HTTP layer. With {@code caretAsPower}
     * every {@code ^} grows to {@code **} before the engine sees it, so the
     * engine's input limit is doubled and {@link #maxInputLength()} is enforced
     * on the untranslated text by the adapter instead.
     */
    public EvalPolicy enginePolicy() {
        if (!caretAsPower) {
            return evalPolicy();
        }
        int widened = (int) Math.min(2L * maxInputLength, Integer.MAX_VALUE);
        return new EvalPolicy(maxPowBase, maxPowExponent, maxDepth, widened);
    }

    /** Builder for {@link ServiceConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private int maxBodyBytes = 16_384;
        private String evaluatePath = "/evaluate";
        private boolean healthEnabled = true;
        private String healthPath = "/health";
        private String loggingFormat = "json";
        private String loggingLevel = "INFO";
        private boolean caretAsPower = false;
        private int displayPrecision = 10;
        private double maxPowBase = EvalPolicy.DEFAULT_MAX_POW_BASE;
        private double maxPowExponent = EvalPolicy.DEFAULT_MAX_POW_EXPONENT;
        private int maxDepth = EvalPolicy.DEFAULT_MAX_DEPTH;
        private int maxInputLength = EvalPolicy.DEFAULT_MAX_INPUT_LENGTH;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder evaluatePath(String evaluatePath) {
            this.evaluatePath = evaluatePath;
            return this;
        }

        public Builder healthEnabled(boolean healthEnabled) {
            this.healthEnabled = healthEnabled;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder caretAsPower(boolean caretAsPower) {
            this.caretAsPower = caretAsPower;
            return this;
        }

        public Builder displayPrecision(int displayPrecision) {
            this.displayPrecision = displayPrecision;
            return this;
        }

        public Builder maxPowBase(double maxPowBase) {
            this.maxPowBase = maxPowBase;
            return this;
        }

        public Builder maxPowExponent(double maxPowExponent) {
            this.maxPowExponent = maxPowExponent;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
            return this;
        }

        /**
         * Builds the {@link ServiceConfig}.
         *
         * @throws IllegalArgumentException if a value is out of range
         */
        public ServiceConfig build() {
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("server.port must be between 0 and 65535, got: " + port);
            }
            if (maxBodyBytes <= 0) {
                throw new IllegalArgumentException("server.max-body-bytes must be positive, got: " + maxBodyBytes);
            }
            requirePath("endpoints.evaluate-path", evaluatePath);
            requirePath("health.path", healthPath);
            if (healthEnabled && healthPath.equals(evaluatePath)) {
                throw new IllegalArgumentException("health.path and endpoints.evaluate-path must differ: " + healthPath);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new IllegalArgumentException("logging.format must be 'json' or 'text', got: " + loggingFormat);
            }
            if (displayPrecision < 0) {
                throw new IllegalArgumentException(
                        "display.precision must not be negative, got: " + displayPrecision);
            }
            ServiceConfig config = new ServiceConfig(
                    host,
                    port,
                    maxBodyBytes,
                    evaluatePath,
                    healthEnabled,
                    healthPath,
                    loggingFormat,
                    loggingLevel,
                    caretAsPower,
                    displayPrecision,
                    maxPowBase,
                    maxPowExponent,
                    maxDepth,
                    maxInputLength);
            config.evalPolicy(); // rejects out-of-range limits
            return config;
        }

        private static void requirePath(String key, String path) {
            if (path == null || !path.startsWith("/")) {
                throw new IllegalArgumentException(key + " must start with '/', got: " + path);
            }
        }
    }
}
