package io.safecalc.standalone;

import io.safecalc.standalone.http.CalculatorApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone calculator service.
 *
 * <p>
 * Delegates to {@link CalculatorApp#start(String[])}. On failure, logs the
 * error and exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --config safecalc.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CalculatorApp app = CalculatorApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "safecalc-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
