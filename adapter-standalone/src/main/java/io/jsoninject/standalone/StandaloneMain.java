package io.jsoninject.standalone;

import io.jsoninject.standalone.server.InjectorApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone page server. Delegates to {@link InjectorApp#start(String[])};
 * any startup failure is logged and the process exits with status 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g. {@code --config path/to/json-inject.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            InjectorApp app = InjectorApp.start(args);
            Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "json-inject-shutdown"));
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
